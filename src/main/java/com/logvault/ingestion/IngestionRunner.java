package com.logvault.ingestion;

import com.logvault.config.IngestionProperties;
import com.logvault.domain.LogQuery;
import com.logvault.domain.Region;
import com.logvault.domain.RunSummary;
import com.logvault.storage.parquet.ParquetDatasetSummarizer;
import com.logvault.storage.parquet.ParquetDatasetSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Runs a single ingestion from {@code logvault.run.*} at startup.
 */
@Component
@ConditionalOnProperty(prefix = "logvault.run", name = "enabled", havingValue = "true")
public class IngestionRunner implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(IngestionRunner.class);

    private final IngestionPipeline pipeline;
    private final ParquetDatasetSummarizer summarizer;
    private final IngestionProperties properties;

    public IngestionRunner(IngestionPipeline pipeline, ParquetDatasetSummarizer summarizer,
                           IngestionProperties properties) {
        this.pipeline = pipeline;
        this.summarizer = summarizer;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        IngestionProperties.Run run = properties.getRun();
        LogQuery query = toQuery(run);
        Path destination = Paths.get(run.getDestination());

        RunSummary summary = pipeline.run(query, destination);
        ParquetDatasetSummary dataset = summarizer.summarize(destination);
        logger.info("Ingestion finished: {}; destination now holds {} rows in {} files, timestamp range {}..{}",
            summary, dataset.getRowCount(), dataset.getFiles().size(),
            dataset.getMinTimestamp(), dataset.getMaxTimestamp());
    }

    static LogQuery toQuery(IngestionProperties.Run run) {
        if (run.getLogKey() == null || run.getLogKey().isBlank()) {
            throw new IllegalArgumentException("logvault.run.log-key must be set when logvault.run.enabled is true");
        }
        return new LogQuery(Region.fromCode(run.getRegion()), run.getLogKey().trim(),
            parseInstant("logvault.run.from", run.getFrom()), parseInstant("logvault.run.to", run.getTo()),
            run.getQuery());
    }

    static Instant parseInstant(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must be set to an ISO-8601 timestamp with offset");
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(property + " is not an ISO-8601 timestamp with offset: " + value, e);
        }
    }
}
