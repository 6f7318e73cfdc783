package com.logvault.storage.parquet;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.springframework.stereotype.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the part files of a destination directory back and reports row count,
 * columns and the {@code timestamp} range.
 */
@Component
public class ParquetDatasetSummarizer {
    private static final Logger logger = LoggerFactory.getLogger(ParquetDatasetSummarizer.class);

    static final String TIMESTAMP_FIELD = "timestamp";

    public ParquetDatasetSummary summarize(Path directory) {
        List<Path> files = listPartFiles(directory);
        Configuration conf = HadoopConfigurations.localFileSystem();

        long rows = 0;
        List<String> columns = new ArrayList<>();
        Long min = null;
        Long max = null;

        for (Path file : files) {
            try (ParquetReader<GenericRecord> reader = AvroParquetReader
                    .<GenericRecord>builder(HadoopInputFile.fromPath(new org.apache.hadoop.fs.Path(file.toUri()), conf))
                    .withDataModel(GenericData.get())
                    .withConf(conf)
                    .build()) {
                GenericRecord record;
                String timestampColumn = null;
                while ((record = reader.read()) != null) {
                    if (rows == 0 && columns.isEmpty()) {
                        columns.addAll(sourceNames(record.getSchema()));
                    }
                    if (timestampColumn == null) {
                        timestampColumn = avroNameOf(record.getSchema(), TIMESTAMP_FIELD);
                    }
                    rows++;
                    Object value = timestampColumn != null ? record.get(timestampColumn) : null;
                    if (value instanceof Number) {
                        long ts = ((Number) value).longValue();
                        min = min == null ? ts : Math.min(min, ts);
                        max = max == null ? ts : Math.max(max, ts);
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read Parquet file " + file, e);
            }
        }

        ParquetDatasetSummary summary = new ParquetDatasetSummary(files, rows, columns, min, max);
        logger.debug("Summarized {}: {}", directory, summary);
        return summary;
    }

    private static List<Path> listPartFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                .filter(p -> ParquetColumnarSink.PART_FILE.matcher(p.getFileName().toString()).matches())
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
    }

    private static List<String> sourceNames(Schema schema) {
        List<String> names = new ArrayList<>();
        for (Schema.Field field : schema.getFields()) {
            String source = field.getProp(RecordSchema.SOURCE_NAME_PROP);
            names.add(source != null ? source : field.name());
        }
        return names;
    }

    private static String avroNameOf(Schema schema, String sourceName) {
        for (Schema.Field field : schema.getFields()) {
            String source = field.getProp(RecordSchema.SOURCE_NAME_PROP);
            if (sourceName.equals(source != null ? source : field.name())) {
                return field.name();
            }
        }
        return null;
    }
}
