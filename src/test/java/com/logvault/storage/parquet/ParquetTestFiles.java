package com.logvault.storage.parquet;

import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads Parquet files back for assertions.
 */
final class ParquetTestFiles {

    private ParquetTestFiles() {
    }

    static List<GenericRecord> read(Path file) throws IOException {
        Configuration conf = HadoopConfigurations.localFileSystem();
        List<GenericRecord> records = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader
                .<GenericRecord>builder(HadoopInputFile.fromPath(new org.apache.hadoop.fs.Path(file.toUri()), conf))
                .withDataModel(GenericData.get())
                .withConf(conf)
                .build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                records.add(record);
            }
        }
        return records;
    }

    static List<GenericRecord> readAll(List<Path> files) throws IOException {
        List<GenericRecord> records = new ArrayList<>();
        for (Path file : files) {
            records.addAll(read(file));
        }
        return records;
    }
}
