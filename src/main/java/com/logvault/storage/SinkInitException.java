package com.logvault.storage;

import com.logvault.domain.IngestionException;

/**
 * The destination directory could not be prepared. Raised before any fetch begins.
 */
public class SinkInitException extends IngestionException {

    public SinkInitException(String message) {
        super(message);
    }

    public SinkInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
