package com.logvault.query;

import com.logvault.domain.IngestionException;

/**
 * The API broke the polling / pagination contract after submission:
 * malformed bodies, Next links without href, repeating Next links, runaway pagination.
 */
public class ProtocolException extends IngestionException {

    public ProtocolException(String message, String logKey) {
        super(message, logKey);
    }

    public ProtocolException(String message, String logKey, Throwable cause) {
        super(message, logKey, cause);
    }
}
