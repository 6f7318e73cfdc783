package com.logvault.storage.parquet;

import java.nio.file.Path;
import java.util.List;

/**
 * What a destination directory holds after one or more runs.
 */
public final class ParquetDatasetSummary {

    private final List<Path> files;
    private final long rowCount;
    private final List<String> columns;
    private final Long minTimestamp;
    private final Long maxTimestamp;

    public ParquetDatasetSummary(List<Path> files, long rowCount, List<String> columns,
                                 Long minTimestamp, Long maxTimestamp) {
        this.files = List.copyOf(files);
        this.rowCount = rowCount;
        this.columns = List.copyOf(columns);
        this.minTimestamp = minTimestamp;
        this.maxTimestamp = maxTimestamp;
    }

    public List<Path> getFiles() {
        return files;
    }

    public long getRowCount() {
        return rowCount;
    }

    /**
     * @return column names as they appeared in the events, in schema order of the first file
     */
    public List<String> getColumns() {
        return columns;
    }

    public Long getMinTimestamp() {
        return minTimestamp;
    }

    public Long getMaxTimestamp() {
        return maxTimestamp;
    }

    @Override
    public String toString() {
        return "ParquetDatasetSummary{files=" + files.size() + ", rows=" + rowCount + ", columns=" + columns
            + ", minTimestamp=" + minTimestamp + ", maxTimestamp=" + maxTimestamp + "}";
    }
}
