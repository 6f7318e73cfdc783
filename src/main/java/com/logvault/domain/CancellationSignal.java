package com.logvault.domain;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a single run.
 * The run checks it between poll attempts and between page fetches.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile String reason;

    public void cancel(String reason) {
        this.reason = reason;
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * @param checkpoint where the run currently is, e.g. "poll" or "page fetch"
     * @throws IngestionCancelledException if {@link #cancel(String)} was called
     */
    public void throwIfCancelled(String checkpoint) {
        if (cancelled.get()) {
            throw new IngestionCancelledException(checkpoint, reason);
        }
    }
}
