package com.logvault.storage;

import java.nio.file.Path;

/**
 * Durable columnar storage for the records of one ingestion run.
 */
public interface ColumnarSink {

    /**
     * Prepare the destination directory and return a handle that accepts records.
     * Creates the directory if absent.
     *
     * @throws SinkInitException if the directory cannot be created or is not writable
     */
    SinkHandle open(Path destination);
}
