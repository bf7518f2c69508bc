package com.archlint.cli;

import com.archlint.core.config.ScanOptions;
import picocli.CommandLine.Option;

/**
 * Options shared by commands that read many source files.
 */
public class ScanSettings {

    @Option(names = "--max-file-size", paramLabel = "BYTES",
        description = "Skip files larger than this (default: ${DEFAULT-VALUE})")
    long maxFileSize = ScanOptions.DEFAULT_MAX_FILE_SIZE;

    @Option(names = {"-t", "--threads"},
        description = "Worker threads (default: number of processors)")
    Integer threads;

    ScanOptions toScanOptions() {
        ScanOptions options = ScanOptions.defaults().withMaxFileSizeBytes(maxFileSize);
        return threads != null ? options.withParallelism(threads) : options;
    }
}
