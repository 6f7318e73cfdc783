package com.logvault.query;

import java.time.Duration;

/**
 * Doubling poll delay with a ceiling. One instance per query; it is never reset,
 * so polls of a page that comes back in progress continue from the query's current delay.
 */
class PollBackoff {

    private final Duration max;
    private Duration next;

    PollBackoff(Duration initial, Duration max) {
        this.next = initial;
        this.max = max;
    }

    Duration nextDelay() {
        Duration current = next;
        Duration doubled = next.multipliedBy(2);
        next = doubled.compareTo(max) > 0 ? max : doubled;
        return current;
    }

    Duration peek() {
        return next;
    }
}
