package com.logvault.query;

import com.logvault.domain.IngestionException;

/**
 * The Log Search API answered with an HTTP status the engine cannot recover from.
 */
public class LogSearchApiException extends IngestionException {

    private final int statusCode;

    public LogSearchApiException(int statusCode, String message, String logKey) {
        super(message, logKey);
        this.statusCode = statusCode;
    }

    public LogSearchApiException(int statusCode, String message, String logKey, Throwable cause) {
        super(message, logKey, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status, or 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
