package com.logvault.query.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * How long to wait after a throttled response, and which header said so.
 */
public final class RateLimitSignal {

    public enum Source {
        RETRY_AFTER("retry-after"),
        RATELIMIT_RESET("ratelimit-reset"),
        DEFAULT("default");

        private final String label;

        Source(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Duration wait;
    private final Source source;

    public RateLimitSignal(Duration wait, Source source) {
        Objects.requireNonNull(wait, "wait must not be null");
        if (wait.isNegative()) {
            throw new IllegalArgumentException("wait must not be negative: " + wait);
        }
        this.wait = wait;
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    public Duration getWait() {
        return wait;
    }

    public double getWaitSeconds() {
        return wait.toMillis() / 1000.0;
    }

    public Source getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RateLimitSignal)) return false;
        RateLimitSignal that = (RateLimitSignal) o;
        return wait.equals(that.wait) && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(wait, source);
    }

    @Override
    public String toString() {
        return "RateLimitSignal{waitSeconds=" + getWaitSeconds() + ", source=" + source.getLabel() + "}";
    }
}
