package com.logvault.storage.parquet;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.RawLocalFileSystem;

/**
 * Hadoop settings for reading and writing Parquet on the local disk.
 */
final class HadoopConfigurations {

    private HadoopConfigurations() {
    }

    /**
     * A configuration whose {@code file://} scheme maps to the raw local filesystem,
     * so no {@code .crc} side files are written next to the output.
     */
    static Configuration localFileSystem() {
        Configuration conf = new Configuration();
        conf.set("fs.file.impl", RawLocalFileSystem.class.getName());
        conf.setBoolean("fs.file.impl.disable.cache", true);
        return conf;
    }
}
