package com.logvault.storage.parquet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logvault.config.IngestionProperties;
import com.logvault.storage.SinkHandle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ParquetDatasetSummarizer")
class ParquetDatasetSummarizerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ParquetDatasetSummarizer summarizer = new ParquetDatasetSummarizer();

    @Test
    void summarizesRowsColumnsAndTimestampRange() throws Exception {
        IngestionProperties.Sink settings = new IngestionProperties.Sink();
        settings.setFlushRows(2);
        SinkHandle handle = new ParquetColumnarSink(settings).open(tempDir);
        handle.append(List.<JsonNode>of(
            mapper.readTree("{\"timestamp\":300,\"log-id\":\"a\"}"),
            mapper.readTree("{\"timestamp\":100,\"log-id\":\"b\"}"),
            mapper.readTree("{\"timestamp\":200,\"log-id\":\"c\"}")));
        handle.close();

        ParquetDatasetSummary summary = summarizer.summarize(tempDir);

        assertThat(summary.getFiles()).hasSize(2);
        assertThat(summary.getRowCount()).isEqualTo(3);
        assertThat(summary.getColumns()).containsExactly("timestamp", "log-id");
        assertThat(summary.getMinTimestamp()).isEqualTo(100L);
        assertThat(summary.getMaxTimestamp()).isEqualTo(300L);
    }

    @Test
    void missingDirectoryIsEmpty() {
        ParquetDatasetSummary summary = summarizer.summarize(tempDir.resolve("nothing-here"));

        assertThat(summary.getRowCount()).isZero();
        assertThat(summary.getFiles()).isEmpty();
        assertThat(summary.getMinTimestamp()).isNull();
    }
}
