package com.logvault.domain;

/**
 * Base class for every failure raised while ingesting a Log Search query.
 * Carries the log key of the run, when known, so callers can attribute the failure.
 */
public class IngestionException extends RuntimeException {

    private final String logKey;

    public IngestionException(String message) {
        super(message);
        this.logKey = null;
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
        this.logKey = null;
    }

    public IngestionException(String message, String logKey) {
        super(message);
        this.logKey = logKey;
    }

    public IngestionException(String message, String logKey, Throwable cause) {
        super(message, cause);
        this.logKey = logKey;
    }

    public String getLogKey() {
        return logKey;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (logKey != null) {
            sb.append(" [Log: ").append(logKey).append("]");
        }
        return sb.toString();
    }
}
