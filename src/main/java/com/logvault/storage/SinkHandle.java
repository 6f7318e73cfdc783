package com.logvault.storage;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.List;

/**
 * An open sink. Records are buffered and flushed to immutable files once a row or byte
 * threshold is crossed; {@link #close()} flushes whatever is still buffered.
 * Owned by a single run; not thread-safe.
 */
public interface SinkHandle extends AutoCloseable {

    /**
     * Buffer the records in order. The call is validated as a whole: if any record does not
     * fit the run's schema nothing from this call is buffered.
     *
     * @throws SchemaMismatchException if a record diverges from the established schema
     * @throws SinkWriteException      if a threshold flush fails
     */
    void append(List<? extends JsonNode> records);

    /**
     * Flush the remaining records and release the handle. Calling it again is a no-op.
     *
     * @throws SinkWriteException if the final flush fails
     */
    @Override
    void close();

    long getRecordsAccepted();

    long getRecordsFlushed();

    /**
     * @return files written so far, in the order they were flushed
     */
    List<Path> getOutputFiles();

    Path getDestination();
}
