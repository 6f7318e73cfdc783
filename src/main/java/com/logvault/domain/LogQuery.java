package com.logvault.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A time-ranged Log Search request against a single log.
 * The range is half-open: events at {@code from} are included, events at {@code to} are not.
 * Immutable once built.
 */
public final class LogQuery {

    private final Region region;
    private final String logKey;
    private final Instant from;
    private final Instant to;
    private final String filter;

    public LogQuery(Region region, String logKey, Instant from, Instant to) {
        this(region, logKey, from, to, null);
    }

    public LogQuery(Region region, String logKey, Instant from, Instant to, String filter) {
        this.region = Objects.requireNonNull(region, "region must not be null");
        this.logKey = Objects.requireNonNull(logKey, "logKey must not be null");
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.to = Objects.requireNonNull(to, "to must not be null");
        if (logKey.isBlank()) {
            throw new IllegalArgumentException("logKey must not be blank");
        }
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("Query range is empty: from " + from + " is not before to " + to);
        }
        this.filter = filter == null || filter.isBlank() ? null : filter;
    }

    public Region getRegion() {
        return region;
    }

    public String getLogKey() {
        return logKey;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    /**
     * @return the free-text / LEQL filter, or null when the whole range is requested
     */
    public String getFilter() {
        return filter;
    }

    public boolean hasFilter() {
        return filter != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogQuery)) return false;
        LogQuery that = (LogQuery) o;
        return region == that.region
            && logKey.equals(that.logKey)
            && from.equals(that.from)
            && to.equals(that.to)
            && Objects.equals(filter, that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, logKey, from, to, filter);
    }

    @Override
    public String toString() {
        return "LogQuery{region=" + region.getCode()
            + ", logKey=" + logKey
            + ", from=" + from
            + ", to=" + to
            + (filter != null ? ", filter=" + filter : "")
            + "}";
    }
}
