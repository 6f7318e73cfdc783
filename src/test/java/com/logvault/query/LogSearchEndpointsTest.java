package com.logvault.query;

import com.logvault.domain.LogQuery;
import com.logvault.domain.Region;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LogSearchEndpoints")
class LogSearchEndpointsTest {

    private final LogSearchEndpoints endpoints =
        new LogSearchEndpoints("https://{region}.rest.logs.insight.rapid7.com");

    private static final Instant FROM = Instant.ofEpochMilli(1_700_000_000_000L);
    private static final Instant TO = Instant.ofEpochMilli(1_700_000_600_000L);

    @Test
    void regionSelectsHost() {
        URI uri = endpoints.submitUri(new LogQuery(Region.US, "abc-123", FROM, TO), 100);

        assertThat(uri.getHost()).isEqualTo("us.rest.logs.insight.rapid7.com");
        assertThat(uri.getPath()).isEqualTo("/query/logs/abc-123");
        assertThat(uri.getQuery()).isEqualTo("from=1700000000000&to=1700000600000&per_page=100");
    }

    @Test
    void filterIsEncoded() {
        URI uri = endpoints.submitUri(new LogQuery(Region.EU, "abc", FROM, TO, "where(status=500 & a=b)"), 50);

        assertThat(uri.getRawQuery()).contains("query=where%28status%3D500%20%26%20a%3Db%29");
        assertThat(uri.getQuery()).contains("query=where(status=500 & a=b)");
    }

    @Test
    void describesRegionalBase() {
        assertThat(endpoints.describeBase(new LogQuery(Region.AU, "abc", FROM, TO)))
            .isEqualTo("https://au.rest.logs.insight.rapid7.com");
    }
}
