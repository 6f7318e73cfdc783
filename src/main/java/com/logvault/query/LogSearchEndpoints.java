package com.logvault.query;

import com.logvault.domain.LogQuery;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds Log Search request URIs from the configured regional base URL template.
 */
public class LogSearchEndpoints {

    private final String baseUrlTemplate;

    public LogSearchEndpoints(String baseUrlTemplate) {
        this.baseUrlTemplate = baseUrlTemplate;
    }

    /**
     * {@code GET {base}/query/logs/{logKey}?from=&to=&per_page=[&query=]}, times in epoch millis.
     */
    public URI submitUri(LogQuery query, int perPage) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("region", query.getRegion().getCode());
        variables.put("logKey", query.getLogKey());

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrlTemplate)
            .path("/query/logs/{logKey}")
            .queryParam("from", query.getFrom().toEpochMilli())
            .queryParam("to", query.getTo().toEpochMilli())
            .queryParam("per_page", perPage);
        if (query.hasFilter()) {
            builder.queryParam("query", "{query}");
            variables.put("query", query.getFilter());
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }

    public String describeBase(LogQuery query) {
        return UriComponentsBuilder.fromUriString(baseUrlTemplate)
            .buildAndExpand(Map.of("region", query.getRegion().getCode()))
            .toUriString();
    }
}
