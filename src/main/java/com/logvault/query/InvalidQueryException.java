package com.logvault.query;

import com.logvault.domain.IngestionException;

/**
 * The submit request was refused, or its answer was neither a result payload nor an in-progress link.
 */
public class InvalidQueryException extends IngestionException {

    public InvalidQueryException(String message, String logKey) {
        super(message, logKey);
    }

    public InvalidQueryException(String message, String logKey, Throwable cause) {
        super(message, logKey, cause);
    }
}
