package com.logvault.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Outcome of one successful ingestion run.
 */
public final class RunSummary {

    private final int pagesFetched;
    private final long recordsWritten;
    private final List<Path> outputFiles;
    private final long rawEventsSeen;
    private final long duplicatesDropped;
    private final Long observedMinTimestamp;
    private final Long observedMaxTimestamp;
    private final Duration elapsed;

    public RunSummary(int pagesFetched,
                      long recordsWritten,
                      List<Path> outputFiles,
                      long rawEventsSeen,
                      long duplicatesDropped,
                      Long observedMinTimestamp,
                      Long observedMaxTimestamp,
                      Duration elapsed) {
        this.pagesFetched = pagesFetched;
        this.recordsWritten = recordsWritten;
        this.outputFiles = List.copyOf(outputFiles);
        this.rawEventsSeen = rawEventsSeen;
        this.duplicatesDropped = duplicatesDropped;
        this.observedMinTimestamp = observedMinTimestamp;
        this.observedMaxTimestamp = observedMaxTimestamp;
        this.elapsed = elapsed;
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    public long getRecordsWritten() {
        return recordsWritten;
    }

    public List<Path> getOutputFiles() {
        return outputFiles;
    }

    public long getRawEventsSeen() {
        return rawEventsSeen;
    }

    public long getDuplicatesDropped() {
        return duplicatesDropped;
    }

    /**
     * @return smallest {@code timestamp} (epoch millis) seen in the run, or null if no event carried one
     */
    public Long getObservedMinTimestamp() {
        return observedMinTimestamp;
    }

    public Long getObservedMaxTimestamp() {
        return observedMaxTimestamp;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return String.format("RunSummary{pages=%d, records=%d, files=%d, raw=%d, duplicates=%d, elapsed=%dms}",
            pagesFetched, recordsWritten, outputFiles.size(), rawEventsSeen, duplicatesDropped,
            elapsed != null ? elapsed.toMillis() : 0);
    }
}
