package com.logvault.query.ratelimit;

import com.logvault.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Turns a throttled (HTTP 429) response into a wait duration and enforces the throttling budget.
 *
 * {@code Retry-After} (integer seconds) wins. Otherwise {@code X-RateLimit-Reset} is used:
 * values of at least 10^9 are epoch seconds and converted to a delta from now, smaller values
 * are already seconds-until-reset. Negative results clamp to zero. With neither header the
 * configured default wait applies.
 */
public class RateLimitPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitPolicy.class);

    public static final int TOO_MANY_REQUESTS = 429;
    public static final String RETRY_AFTER = "Retry-After";
    public static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";

    private static final long EPOCH_SECONDS_THRESHOLD = 1_000_000_000L;

    private final IngestionProperties.RateLimit settings;
    private final Clock clock;

    public RateLimitPolicy(IngestionProperties.RateLimit settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public boolean isThrottled(int statusCode) {
        return statusCode == TOO_MANY_REQUESTS;
    }

    /**
     * @throws IllegalArgumentException if the status is not a throttling status
     */
    public RateLimitSignal evaluate(int statusCode, HttpHeaders headers) {
        if (!isThrottled(statusCode)) {
            throw new IllegalArgumentException("HTTP " + statusCode + " is not a throttling response");
        }

        Long retryAfter = parseLong(headers.getFirst(RETRY_AFTER));
        if (retryAfter != null) {
            return new RateLimitSignal(Duration.ofSeconds(Math.max(0, retryAfter)), RateLimitSignal.Source.RETRY_AFTER);
        }

        Long reset = parseLong(headers.getFirst(RATE_LIMIT_RESET));
        if (reset != null) {
            long seconds;
            if (reset >= EPOCH_SECONDS_THRESHOLD) {
                seconds = Duration.between(clock.instant(), Instant.ofEpochSecond(reset)).toSeconds();
            } else {
                seconds = reset;
            }
            return new RateLimitSignal(Duration.ofSeconds(Math.max(0, seconds)), RateLimitSignal.Source.RATELIMIT_RESET);
        }

        logger.debug("Throttled response without {} or {} header, using default wait {}",
            RETRY_AFTER, RATE_LIMIT_RESET, settings.getDefaultWait());
        return new RateLimitSignal(settings.getDefaultWait(), RateLimitSignal.Source.DEFAULT);
    }

    /**
     * @param throttledResponses throttled answers received so far for the current request, including this one
     * @throws RateLimitExhaustedException if the wait exceeds the cap or the retry budget is spent
     */
    public void enforceCaps(RateLimitSignal signal, int throttledResponses, String logKey) {
        if (throttledResponses > settings.getMaxRetries()) {
            throw new RateLimitExhaustedException(
                "Still throttled after " + settings.getMaxRetries() + " retries of the same request",
                logKey, throttledResponses);
        }
        if (signal.getWait().compareTo(settings.getMaxWait()) > 0) {
            throw new RateLimitExhaustedException(
                "Log Search asked to wait " + signal.getWaitSeconds() + "s (" + signal.getSource().getLabel()
                    + "), above logvault.rate-limit.max-wait of " + settings.getMaxWait().toSeconds() + "s",
                logKey, throttledResponses);
        }
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric rate limit header value '{}'", value);
            return null;
        }
    }
}
