package com.logvault.storage.parquet;

import com.logvault.config.IngestionProperties;
import com.logvault.storage.ColumnarSink;
import com.logvault.storage.SinkHandle;
import com.logvault.storage.SinkInitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Writes ingested events as Parquet files, one file per flushed batch.
 */
public class ParquetColumnarSink implements ColumnarSink {
    private static final Logger logger = LoggerFactory.getLogger(ParquetColumnarSink.class);

    static final Pattern PART_FILE = Pattern.compile("part-(\\d{5,})\\.parquet");

    private final IngestionProperties.Sink settings;

    public ParquetColumnarSink(IngestionProperties.Sink settings) {
        this.settings = settings;
    }

    @Override
    public SinkHandle open(Path destination) {
        Path directory = destination.toAbsolutePath().normalize();
        try {
            Files.createDirectories(directory);
        } catch (FileAlreadyExistsException e) {
            throw new SinkInitException("Destination " + directory
                + " exists but is not a directory; choose another output path", e);
        } catch (IOException e) {
            throw new SinkInitException("Cannot create destination directory " + directory + " (" + e
                + "); check that the parent exists and is writable", e);
        }
        if (!Files.isDirectory(directory)) {
            throw new SinkInitException("Destination " + directory + " is not a directory; choose another output path");
        }
        if (!Files.isWritable(directory)) {
            throw new SinkInitException("Destination directory " + directory
                + " is not writable; fix its permissions or choose another output path");
        }

        int firstPart = nextFreePart(directory);
        logger.info("Opened Parquet sink at {} (compression={}, flushRows={}, flushBytes={}, firstPart={})",
            directory, settings.getCompression(), settings.getFlushRows(), settings.getFlushBytes(), firstPart);
        return new ParquetSinkHandle(directory, settings, HadoopConfigurations.localFileSystem(), firstPart);
    }

    /**
     * Continue numbering after part files already present so earlier runs are never overwritten.
     */
    private static int nextFreePart(Path directory) {
        int next = 0;
        try (Stream<Path> entries = Files.list(directory)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                Matcher matcher = PART_FILE.matcher(entry.getFileName().toString());
                if (matcher.matches()) {
                    next = Math.max(next, partNumber(entry, matcher.group(1)) + 1);
                }
            }
        } catch (IOException e) {
            throw new SinkInitException("Cannot list destination directory " + directory + " (" + e + ")", e);
        }
        return next;
    }

    private static int partNumber(Path entry, String digits) {
        try {
            int part = Integer.parseInt(digits);
            if (part == Integer.MAX_VALUE) {
                throw new NumberFormatException(digits);
            }
            return part;
        } catch (NumberFormatException e) {
            throw new SinkInitException("Part file " + entry + " is numbered beyond " + (Integer.MAX_VALUE - 1)
                + "; move it out of the destination or choose another output path", e);
        }
    }
}
