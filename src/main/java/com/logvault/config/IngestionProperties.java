package com.logvault.config;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalised settings for an ingestion run, bound from {@code logvault.*}.
 * The pipeline receives an instance explicitly rather than reading global state,
 * so tests can run against a mocked API with their own thresholds.
 */
@ConfigurationProperties(prefix = "logvault")
public class IngestionProperties {

    private Api api = new Api();
    private Polling polling = new Polling();
    private RateLimit rateLimit = new RateLimit();
    private Retry retry = new Retry();
    private Pagination pagination = new Pagination();
    private Sink sink = new Sink();
    private Run run = new Run();

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Polling getPolling() {
        return polling;
    }

    public void setPolling(Polling polling) {
        this.polling = polling;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Sink getSink() {
        return sink;
    }

    public void setSink(Sink sink) {
        this.sink = sink;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    /**
     * Reject settings that would make a run hang or misbehave.
     *
     * @throws IllegalArgumentException naming the offending property
     */
    public void validate() {
        require(api.perPage >= 1 && api.perPage <= 10_000, "logvault.api.per-page must be between 1 and 10000");
        require(api.requestsPerMinute >= 0, "logvault.api.requests-per-minute must not be negative");
        require(api.maxResponseBytes >= 1024, "logvault.api.max-response-bytes must be at least 1024");
        require(isPositive(polling.initialDelay), "logvault.polling.initial-delay must be positive");
        require(isPositive(polling.maxDelay) && polling.maxDelay.compareTo(polling.initialDelay) >= 0,
            "logvault.polling.max-delay must be positive and not below initial-delay");
        require(isPositive(polling.maxElapsed), "logvault.polling.max-elapsed must be positive");
        require(polling.maxAttempts >= 0, "logvault.polling.max-attempts must not be negative");
        require(isPositive(rateLimit.maxWait), "logvault.rate-limit.max-wait must be positive");
        require(rateLimit.maxRetries >= 0, "logvault.rate-limit.max-retries must not be negative");
        require(rateLimit.defaultWait != null && !rateLimit.defaultWait.isNegative(),
            "logvault.rate-limit.default-wait must not be negative");
        require(retry.maxAttempts >= 1, "logvault.retry.max-attempts must be at least 1");
        require(isPositive(retry.initialBackoff), "logvault.retry.initial-backoff must be positive");
        require(retry.multiplier >= 1.0, "logvault.retry.multiplier must be at least 1.0");
        require(pagination.maxPages >= 1, "logvault.pagination.max-pages must be at least 1");
        require(sink.flushRows >= 1, "logvault.sink.flush-rows must be at least 1");
        require(sink.flushBytes >= 1, "logvault.sink.flush-bytes must be at least 1");
        require(sink.compression != null, "logvault.sink.compression must be set");
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public static class Api {
        private String baseUrlTemplate = "https://{region}.rest.logs.insight.rapid7.com";
        private String apiKey = "";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int perPage = 500;
        private int requestsPerMinute = 60;
        private int maxResponseBytes = 32 * 1024 * 1024;

        public String getBaseUrlTemplate() {
            return baseUrlTemplate;
        }

        public void setBaseUrlTemplate(String baseUrlTemplate) {
            this.baseUrlTemplate = baseUrlTemplate;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public int getPerPage() {
            return perPage;
        }

        public void setPerPage(int perPage) {
            this.perPage = perPage;
        }

        public int getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }

        public int getMaxResponseBytes() {
            return maxResponseBytes;
        }

        public void setMaxResponseBytes(int maxResponseBytes) {
            this.maxResponseBytes = maxResponseBytes;
        }

        @Override
        public String toString() {
            // apiKey deliberately left out
            return "Api{baseUrlTemplate=" + baseUrlTemplate
                + ", connectTimeout=" + connectTimeout
                + ", readTimeout=" + readTimeout
                + ", perPage=" + perPage
                + ", requestsPerMinute=" + requestsPerMinute
                + ", maxResponseBytes=" + maxResponseBytes + "}";
        }
    }

    public static class Polling {
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(6);
        private Duration maxElapsed = Duration.ofMinutes(10);
        /** 0 means unbounded; the elapsed guard still applies */
        private int maxAttempts = 0;

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getMaxElapsed() {
            return maxElapsed;
        }

        public void setMaxElapsed(Duration maxElapsed) {
            this.maxElapsed = maxElapsed;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class RateLimit {
        private Duration maxWait = Duration.ofSeconds(60);
        private int maxRetries = 10;
        private Duration defaultWait = Duration.ofSeconds(1);

        public Duration getMaxWait() {
            return maxWait;
        }

        public void setMaxWait(Duration maxWait) {
            this.maxWait = maxWait;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getDefaultWait() {
            return defaultWait;
        }

        public void setDefaultWait(Duration defaultWait) {
            this.defaultWait = defaultWait;
        }
    }

    public static class Retry {
        private int maxAttempts = 4;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }

    public static class Pagination {
        private int maxPages = 10_000;

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }
    }

    public static class Sink {
        private int flushRows = 50_000;
        private long flushBytes = 64L * 1024 * 1024;
        private CompressionCodecName compression = CompressionCodecName.SNAPPY;
        private boolean dedupeEvents = true;

        public int getFlushRows() {
            return flushRows;
        }

        public void setFlushRows(int flushRows) {
            this.flushRows = flushRows;
        }

        public long getFlushBytes() {
            return flushBytes;
        }

        public void setFlushBytes(long flushBytes) {
            this.flushBytes = flushBytes;
        }

        public CompressionCodecName getCompression() {
            return compression;
        }

        public void setCompression(CompressionCodecName compression) {
            this.compression = compression;
        }

        public boolean isDedupeEvents() {
            return dedupeEvents;
        }

        public void setDedupeEvents(boolean dedupeEvents) {
            this.dedupeEvents = dedupeEvents;
        }
    }

    /**
     * One-shot run executed at startup when {@code enabled} is true.
     */
    public static class Run {
        private boolean enabled = false;
        private String region = "eu";
        private String logKey;
        private String from;
        private String to;
        private String query;
        private String destination = "data/logs";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getLogKey() {
            return logKey;
        }

        public void setLogKey(String logKey) {
            this.logKey = logKey;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getTo() {
            return to;
        }

        public void setTo(String to) {
            this.to = to;
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public String getDestination() {
            return destination;
        }

        public void setDestination(String destination) {
            this.destination = destination;
        }
    }
}
