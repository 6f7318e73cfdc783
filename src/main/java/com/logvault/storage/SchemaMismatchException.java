package com.logvault.storage;

import com.logvault.domain.IngestionException;

/**
 * A record does not fit the schema established by the first records of the run.
 */
public class SchemaMismatchException extends IngestionException {

    private final String field;

    public SchemaMismatchException(String message, String field) {
        super(message);
        this.field = field;
    }

    /**
     * @return the offending field name as it appeared in the event, or null when not field specific
     */
    public String getField() {
        return field;
    }
}
