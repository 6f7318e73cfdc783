package com.logvault.query;

import com.logvault.domain.IngestionException;

import java.time.Duration;

/**
 * Polling exceeded {@code logvault.polling.max-elapsed} or {@code logvault.polling.max-attempts}.
 */
public class QueryTimeoutException extends IngestionException {

    private final Duration elapsed;
    private final int pollAttempts;

    public QueryTimeoutException(String logKey, Duration elapsed, int pollAttempts) {
        super("Query still in progress after " + elapsed.toMillis() + "ms and " + pollAttempts
            + " poll attempts; raise logvault.polling.max-elapsed or narrow the time range", logKey);
        this.elapsed = elapsed;
        this.pollAttempts = pollAttempts;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public int getPollAttempts() {
        return pollAttempts;
    }
}
