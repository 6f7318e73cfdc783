package com.logvault.ingestion;

import com.logvault.config.IngestionProperties;
import com.logvault.domain.LogQuery;
import com.logvault.domain.Region;
import com.logvault.domain.RunSummary;
import com.logvault.storage.parquet.ParquetDatasetSummarizer;
import com.logvault.storage.parquet.ParquetDatasetSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("IngestionRunner")
class IngestionRunnerTest {

    private static IngestionProperties.Run run(String from, String to) {
        IngestionProperties.Run run = new IngestionProperties.Run();
        run.setRegion("US");
        run.setLogKey(" key-1 ");
        run.setFrom(from);
        run.setTo(to);
        run.setQuery("where(level=ERROR)");
        return run;
    }

    @Test
    void buildsQueryFromSettings() {
        LogQuery query = IngestionRunner.toQuery(run("2026-01-01T00:00:00Z", "2026-01-01T02:00:00+01:00"));

        assertThat(query.getRegion()).isEqualTo(Region.US);
        assertThat(query.getLogKey()).isEqualTo("key-1");
        assertThat(query.getFrom()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        assertThat(query.getTo()).isEqualTo(Instant.parse("2026-01-01T01:00:00Z"));
        assertThat(query.getFilter()).isEqualTo("where(level=ERROR)");
    }

    @Test
    void rejectsTimestampWithoutOffset() {
        assertThatThrownBy(() -> IngestionRunner.toQuery(run("2026-01-01T00:00:00", "2026-01-01T01:00:00Z")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("logvault.run.from");
    }

    @Test
    void requiresLogKey() {
        IngestionProperties.Run settings = run("2026-01-01T00:00:00Z", "2026-01-01T01:00:00Z");
        settings.setLogKey(null);

        assertThatThrownBy(() -> IngestionRunner.toQuery(settings))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("log-key");
    }

    @Test
    void runsPipelineAndSummarizesDestination() throws Exception {
        IngestionProperties properties = new IngestionProperties();
        properties.setRun(run("2026-01-01T00:00:00Z", "2026-01-01T01:00:00Z"));
        properties.getRun().setDestination("target/runner-out");
        IngestionPipeline pipeline = mock(IngestionPipeline.class);
        ParquetDatasetSummarizer summarizer = mock(ParquetDatasetSummarizer.class);
        when(pipeline.run(any(LogQuery.class), any(Path.class)))
            .thenReturn(new RunSummary(1, 2, List.of(), 2, 0, null, null, Duration.ZERO));
        when(summarizer.summarize(any())).thenReturn(new ParquetDatasetSummary(List.of(), 2, List.of("message"), null, null));

        new IngestionRunner(pipeline, summarizer, properties).run(new DefaultApplicationArguments());

        ArgumentCaptor<LogQuery> query = ArgumentCaptor.forClass(LogQuery.class);
        verify(pipeline).run(query.capture(), eq(Paths.get("target/runner-out")));
        assertThat(query.getValue().getLogKey()).isEqualTo("key-1");
        verify(summarizer).summarize(Paths.get("target/runner-out"));
    }
}
