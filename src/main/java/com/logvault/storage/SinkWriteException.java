package com.logvault.storage;

import com.logvault.domain.IngestionException;

/**
 * Writing a batch to storage failed. The records of that batch were not persisted.
 */
public class SinkWriteException extends IngestionException {

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
