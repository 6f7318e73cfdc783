package com.logvault.query;

import java.time.Duration;

/**
 * The engine's only blocking point: poll backoff and rate-limit waits go through here.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
