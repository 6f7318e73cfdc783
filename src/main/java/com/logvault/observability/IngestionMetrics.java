package com.logvault.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for ingestion runs.
 * Tracks submissions, polling, pagination, throttling, retries and run outcomes.
 */
@Component
public class IngestionMetrics {

    private final Counter queriesSubmitted;
    private final Counter pollAttempts;
    private final Counter pagesFetched;
    private final Counter recordsWritten;
    private final Counter rateLimited;
    private final Counter transientRetries;
    private final Counter runsCompleted;
    private final Counter runsFailed;
    private final Counter runsCancelled;
    private final Timer runLatency;
    private final DistributionSummary pageSize;
    private final DistributionSummary rateLimitWait;

    public IngestionMetrics(MeterRegistry meterRegistry) {
        queriesSubmitted = Counter.builder("logvault.query.submitted")
            .description("Total number of Log Search queries submitted")
            .register(meterRegistry);

        pollAttempts = Counter.builder("logvault.query.poll.attempts")
            .description("Total number of poll requests for in-progress queries")
            .register(meterRegistry);

        pagesFetched = Counter.builder("logvault.query.pages.fetched")
            .description("Total number of result pages handed to the sink")
            .register(meterRegistry);

        recordsWritten = Counter.builder("logvault.sink.records.written")
            .description("Total number of records flushed to Parquet files")
            .register(meterRegistry);

        rateLimited = Counter.builder("logvault.query.rate.limited")
            .description("Total number of throttled (HTTP 429) responses")
            .register(meterRegistry);

        transientRetries = Counter.builder("logvault.query.transient.retries")
            .description("Total number of retries after 5xx or I/O failures")
            .register(meterRegistry);

        runsCompleted = Counter.builder("logvault.run.completed")
            .description("Total number of ingestion runs that completed")
            .register(meterRegistry);

        runsFailed = Counter.builder("logvault.run.failed")
            .description("Total number of ingestion runs that failed")
            .register(meterRegistry);

        runsCancelled = Counter.builder("logvault.run.cancelled")
            .description("Total number of ingestion runs that were cancelled")
            .register(meterRegistry);

        runLatency = Timer.builder("logvault.run.latency")
            .description("Wall-clock duration of ingestion runs")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        pageSize = DistributionSummary.builder("logvault.query.page.size")
            .description("Distribution of records per result page")
            .baseUnit("records")
            .register(meterRegistry);

        rateLimitWait = DistributionSummary.builder("logvault.query.rate.limit.wait")
            .description("Distribution of waits imposed by throttled responses")
            .baseUnit("seconds")
            .register(meterRegistry);
    }

    public void recordQuerySubmitted() {
        queriesSubmitted.increment();
    }

    public void recordPollAttempt() {
        pollAttempts.increment();
    }

    public void recordPageFetched(int records) {
        pagesFetched.increment();
        pageSize.record(records);
    }

    public void recordRateLimited(double waitSeconds) {
        rateLimited.increment();
        rateLimitWait.record(waitSeconds);
    }

    public void recordTransientRetry() {
        transientRetries.increment();
    }

    public void recordRunCompleted(long records, Duration elapsed) {
        runsCompleted.increment();
        recordsWritten.increment(records);
        runLatency.record(elapsed);
    }

    public void recordRunFailed(Duration elapsed) {
        runsFailed.increment();
        runLatency.record(elapsed);
    }

    public void recordRunCancelled(Duration elapsed) {
        runsCancelled.increment();
        runLatency.record(elapsed);
    }

    // Getters for testing

    public Counter getQueriesSubmitted() {
        return queriesSubmitted;
    }

    public Counter getPollAttempts() {
        return pollAttempts;
    }

    public Counter getPagesFetched() {
        return pagesFetched;
    }

    public Counter getRecordsWritten() {
        return recordsWritten;
    }

    public Counter getRateLimited() {
        return rateLimited;
    }

    public Counter getTransientRetries() {
        return transientRetries;
    }

    public Counter getRunsCompleted() {
        return runsCompleted;
    }

    public Counter getRunsFailed() {
        return runsFailed;
    }

    public Counter getRunsCancelled() {
        return runsCancelled;
    }

    public Timer getRunLatency() {
        return runLatency;
    }

    public DistributionSummary getPageSize() {
        return pageSize;
    }

    public DistributionSummary getRateLimitWait() {
        return rateLimitWait;
    }
}
