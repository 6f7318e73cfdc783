package com.logvault.storage.parquet;

import com.fasterxml.jackson.databind.JsonNode;
import com.logvault.config.IngestionProperties;
import com.logvault.storage.SinkHandle;
import com.logvault.storage.SinkWriteException;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Open Parquet sink of one run.
 *
 * Each flush writes a hidden {@code .part-NNNNN.parquet.inprogress} file and moves it to
 * {@code part-NNNNN.parquet} once the footer is written, so a visible part file is always complete.
 */
public class ParquetSinkHandle implements SinkHandle {
    private static final Logger logger = LoggerFactory.getLogger(ParquetSinkHandle.class);

    private static final int PAGE_SIZE = 1024 * 1024; // 1MB
    private static final int ROW_GROUP_SIZE = 128 * 1024 * 1024; // 128MB

    private final Path destination;
    private final IngestionProperties.Sink settings;
    private final Configuration hadoopConf;
    private final OutputBatch batch = new OutputBatch();
    private final List<Path> outputFiles = new ArrayList<>();

    private RecordSchema schema;
    private int nextPart;
    private long recordsAccepted;
    private long recordsFlushed;
    private boolean closed;

    ParquetSinkHandle(Path destination, IngestionProperties.Sink settings, Configuration hadoopConf, int firstPart) {
        this.destination = destination;
        this.settings = settings;
        this.hadoopConf = hadoopConf;
        this.nextPart = firstPart;
    }

    @Override
    public void append(List<? extends JsonNode> records) {
        if (closed) {
            throw new IllegalStateException("Sink at " + destination + " is closed");
        }
        if (records.isEmpty()) {
            return;
        }
        if (schema == null) {
            schema = RecordSchema.infer(records);
            logger.info("Inferred schema for {}: {}", destination, schema);
        }
        for (int i = 0; i < records.size(); i++) {
            schema.validate(records.get(i), i);
        }

        for (JsonNode record : records) {
            batch.add(schema.toRecord(record), record.toString().getBytes(StandardCharsets.UTF_8).length);
            recordsAccepted++;
            if (batch.reached(settings.getFlushRows(), settings.getFlushBytes())) {
                flush();
            }
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        flush();
        logger.info("Closed Parquet sink at {}: {} records in {} files", destination, recordsFlushed, outputFiles.size());
    }

    private void flush() {
        if (batch.isEmpty()) {
            return;
        }
        String fileName = String.format("part-%05d.parquet", nextPart);
        Path target = destination.resolve(fileName);
        Path inProgress = destination.resolve("." + fileName + ".inprogress");

        try {
            writeFile(inProgress, batch.getRecords());
            Files.move(inProgress, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            discard(inProgress, e);
            throw new SinkWriteException("Failed to write " + batch.size() + " records to " + target, e);
        }

        logger.debug("Flushed {} records (~{} bytes) to {}", batch.size(), batch.getEstimatedBytes(), target);
        outputFiles.add(target);
        recordsFlushed += batch.size();
        nextPart++;
        batch.clear();
    }

    private void writeFile(Path path, List<GenericRecord> records) throws IOException {
        HadoopOutputFile outputFile = HadoopOutputFile.fromPath(
            new org.apache.hadoop.fs.Path(path.toUri()), hadoopConf);
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                .<GenericRecord>builder(outputFile)
                .withSchema(schema.getAvroSchema())
                .withConf(hadoopConf)
                .withCompressionCodec(settings.getCompression())
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .withPageSize(PAGE_SIZE)
                .withRowGroupSize(ROW_GROUP_SIZE)
                .build()) {
            for (GenericRecord record : records) {
                writer.write(record);
            }
        }
    }

    private static void discard(Path inProgress, Exception cause) {
        try {
            Files.deleteIfExists(inProgress);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    RecordSchema getSchema() {
        return schema;
    }

    @Override
    public long getRecordsAccepted() {
        return recordsAccepted;
    }

    @Override
    public long getRecordsFlushed() {
        return recordsFlushed;
    }

    @Override
    public List<Path> getOutputFiles() {
        return Collections.unmodifiableList(outputFiles);
    }

    @Override
    public Path getDestination() {
        return destination;
    }
}
