package com.logvault.query.ratelimit;

import com.logvault.domain.IngestionException;

/**
 * Throttling outlasted the configured budget: a single wait above the cap,
 * too many throttled answers for one request, or no client-side permit.
 * Fatal for the run.
 */
public class RateLimitExhaustedException extends IngestionException {

    private final int throttledResponses;

    public RateLimitExhaustedException(String message, String logKey, int throttledResponses) {
        super(message, logKey);
        this.throttledResponses = throttledResponses;
    }

    public int getThrottledResponses() {
        return throttledResponses;
    }
}
