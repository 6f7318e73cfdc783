package com.logvault.query;

/**
 * HTTP 401/403 from Log Search. Never retried.
 */
public class LogSearchAuthException extends LogSearchApiException {

    public LogSearchAuthException(int statusCode, String logKey) {
        super(statusCode,
            "Log Search rejected the API key (HTTP " + statusCode + "); check logvault.api.api-key "
                + "and that the key has read access to the log",
            logKey);
    }
}
