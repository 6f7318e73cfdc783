package com.logvault.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IngestionMetrics")
class IngestionMetricsTest {

    private SimpleMeterRegistry registry;
    private IngestionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new IngestionMetrics(registry);
    }

    @Test
    void registersMetersUnderLogvaultPrefix() {
        assertThat(registry.find("logvault.query.submitted").counter()).isNotNull();
        assertThat(registry.find("logvault.sink.records.written").counter()).isNotNull();
        assertThat(registry.find("logvault.run.latency").timer()).isNotNull();
        assertThat(registry.find("logvault.query.page.size").summary()).isNotNull();
    }

    @Test
    void pageFetchFeedsCounterAndSizeDistribution() {
        metrics.recordPageFetched(3);
        metrics.recordPageFetched(5);

        assertThat(metrics.getPagesFetched().count()).isEqualTo(2.0);
        assertThat(metrics.getPageSize().totalAmount()).isEqualTo(8.0);
        assertThat(metrics.getPageSize().max()).isEqualTo(5.0);
    }

    @Test
    void runOutcomesAreCountedSeparately() {
        metrics.recordRunCompleted(42, Duration.ofSeconds(2));
        metrics.recordRunFailed(Duration.ofSeconds(1));
        metrics.recordRunCancelled(Duration.ofSeconds(1));

        assertThat(metrics.getRunsCompleted().count()).isEqualTo(1.0);
        assertThat(metrics.getRunsFailed().count()).isEqualTo(1.0);
        assertThat(metrics.getRunsCancelled().count()).isEqualTo(1.0);
        assertThat(metrics.getRecordsWritten().count()).isEqualTo(42.0);
        assertThat(metrics.getRunLatency().count()).isEqualTo(3);
        assertThat(metrics.getRunLatency().totalTime(TimeUnit.SECONDS)).isEqualTo(4.0);
    }

    @Test
    void rateLimitWaitIsRecordedInSeconds() {
        metrics.recordRateLimited(2.5);

        assertThat(metrics.getRateLimited().count()).isEqualTo(1.0);
        assertThat(metrics.getRateLimitWait().totalAmount()).isEqualTo(2.5);
    }
}
