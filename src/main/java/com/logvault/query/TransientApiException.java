package com.logvault.query;

/**
 * A 5xx answer or an I/O failure. Retried locally with exponential backoff,
 * fatal once the retry budget is spent.
 */
public class TransientApiException extends LogSearchApiException {

    public TransientApiException(int statusCode, String message, String logKey) {
        super(statusCode, message, logKey);
    }

    public TransientApiException(String message, String logKey, Throwable cause) {
        super(0, message, logKey, cause);
    }
}
