package com.archlint.core.config;

import java.nio.file.Path;
import java.util.Set;

/**
 * Tuning options for scans and source discovery.
 *
 * @param maxFileSizeBytes files larger than this are skipped
 * @param parallelism number of worker threads
 * @param ignoredDirectories directory names pruned during source discovery
 * @param cacheDirectory directory for the parsed-invariants cache, or null to disable it
 */
public record ScanOptions(
    long maxFileSizeBytes,
    int parallelism,
    Set<String> ignoredDirectories,
    Path cacheDirectory
) {
    public static final long DEFAULT_MAX_FILE_SIZE = 512_000L;

    public static final Set<String> DEFAULT_IGNORED_DIRECTORIES = Set.of(
        "node_modules", "dist", ".next", ".git", "coverage", "__pycache__",
        ".venv", "vendor", "target", "build", ".archlint"
    );

    public ScanOptions {
        if (maxFileSizeBytes <= 0) {
            throw new IllegalArgumentException("maxFileSizeBytes must be positive: " + maxFileSizeBytes);
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        ignoredDirectories = ignoredDirectories != null ? Set.copyOf(ignoredDirectories) : DEFAULT_IGNORED_DIRECTORIES;
    }

    /**
     * Creates options with the default size cap, one worker per available processor and
     * no invariants cache.
     *
     * @return default options
     */
    public static ScanOptions defaults() {
        return new ScanOptions(
            DEFAULT_MAX_FILE_SIZE,
            Runtime.getRuntime().availableProcessors(),
            DEFAULT_IGNORED_DIRECTORIES,
            null
        );
    }

    public ScanOptions withMaxFileSizeBytes(long maxFileSizeBytes) {
        return new ScanOptions(maxFileSizeBytes, parallelism, ignoredDirectories, cacheDirectory);
    }

    public ScanOptions withParallelism(int parallelism) {
        return new ScanOptions(maxFileSizeBytes, parallelism, ignoredDirectories, cacheDirectory);
    }

    public ScanOptions withCacheDirectory(Path cacheDirectory) {
        return new ScanOptions(maxFileSizeBytes, parallelism, ignoredDirectories, cacheDirectory);
    }
}
