package com.logvault.query.ratelimit;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Client-side pacing of outbound Log Search requests, so a run stays under the
 * account's per-minute budget before the server has to throttle it.
 */
public class RequestPacer {
    private static final Logger logger = LoggerFactory.getLogger(RequestPacer.class);

    private final RateLimiter rateLimiter;

    /**
     * @param requestsPerMinute permits per minute; 0 disables pacing
     */
    public RequestPacer(int requestsPerMinute) {
        if (requestsPerMinute <= 0) {
            this.rateLimiter = null;
            logger.info("Request pacing disabled");
            return;
        }
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitForPeriod(requestsPerMinute)
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .timeoutDuration(Duration.ofMinutes(1))
            .build();
        this.rateLimiter = RateLimiter.of("log-search", config);
        logger.info("Request pacing enabled: {} requests per minute", requestsPerMinute);
    }

    public boolean isEnabled() {
        return rateLimiter != null;
    }

    /**
     * Blocks until a permit is available.
     *
     * @throws RateLimitExhaustedException if no permit frees up within a minute
     */
    public void acquire() {
        if (rateLimiter == null) {
            return;
        }
        if (!rateLimiter.acquirePermission()) {
            throw new RateLimitExhaustedException(
                "No request permit within " + rateLimiter.getRateLimiterConfig().getTimeoutDuration().toSeconds()
                    + "s; lower concurrency or raise logvault.api.requests-per-minute", null, 0);
        }
    }

    int availablePermissions() {
        return rateLimiter == null ? Integer.MAX_VALUE : rateLimiter.getMetrics().getAvailablePermissions();
    }
}
