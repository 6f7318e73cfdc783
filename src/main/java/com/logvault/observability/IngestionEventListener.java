package com.logvault.observability;

import com.logvault.domain.LogQuery;
import com.logvault.domain.RunSummary;
import com.logvault.query.ratelimit.RateLimitSignal;

import java.time.Duration;

/**
 * Observability hooks raised by the query engine and the pipeline.
 * Events carry only non-secret fields; the API key is never passed here.
 */
public interface IngestionEventListener {

    IngestionEventListener NOOP = new IngestionEventListener() {
    };

    default void onSubmit(LogQuery query) {
    }

    /**
     * @param attempt 1-based poll attempt for the query
     * @param delay   backoff slept before this attempt
     * @param elapsed time since the query was submitted
     */
    default void onPollAttempt(LogQuery query, int attempt, Duration delay, Duration elapsed) {
    }

    default void onPageFetched(LogQuery query, int pageIndex, int recordCount, Duration elapsed) {
    }

    /**
     * @param throttledResponses throttled answers for the current request so far
     */
    default void onRateLimited(LogQuery query, RateLimitSignal signal, int throttledResponses) {
    }

    default void onTransientRetry(LogQuery query, int attempt, Duration wait, Throwable cause) {
    }

    default void onRunComplete(LogQuery query, RunSummary summary) {
    }

    default void onRunFailed(LogQuery query, Throwable error, Duration elapsed) {
    }
}
