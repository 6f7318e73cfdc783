package com.logvault.storage.parquet;

import org.apache.avro.generic.GenericRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records buffered for the next output file, with a running size estimate.
 */
final class OutputBatch {

    private final List<GenericRecord> records = new ArrayList<>();
    private long estimatedBytes;

    void add(GenericRecord record, long sizeEstimate) {
        records.add(record);
        estimatedBytes += sizeEstimate;
    }

    boolean reached(int flushRows, long flushBytes) {
        return records.size() >= flushRows || estimatedBytes >= flushBytes;
    }

    boolean isEmpty() {
        return records.isEmpty();
    }

    int size() {
        return records.size();
    }

    long getEstimatedBytes() {
        return estimatedBytes;
    }

    List<GenericRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    void clear() {
        records.clear();
        estimatedBytes = 0;
    }
}
