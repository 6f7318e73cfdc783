package com.logvault.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Wiring for the Log Search HTTP client and its metrics.
 */
@Configuration
@EnableConfigurationProperties(IngestionProperties.class)
public class LogSearchClientConfig {
    private static final Logger logger = LoggerFactory.getLogger(LogSearchClientConfig.class);

    /**
     * WebClient used by the Log Search transport, with connect / response timeouts
     * and a body buffer large enough for a full result page.
     */
    @Bean
    public WebClient logSearchWebClient(WebClient.Builder builder, IngestionProperties properties) {
        IngestionProperties.Api api = properties.getApi();
        logger.info("Configuring Log Search client: {}", api);
        if (api.getApiKey() == null || api.getApiKey().isBlank()) {
            logger.warn("logvault.api.api-key is empty; Log Search will answer 401");
        }

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) api.getConnectTimeout().toMillis())
            .responseTimeout(api.getReadTimeout());

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(api.getMaxResponseBytes()))
            .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
