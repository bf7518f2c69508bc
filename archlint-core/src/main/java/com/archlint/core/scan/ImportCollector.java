package com.archlint.core.scan;

import com.archlint.core.config.ScanOptions;
import com.archlint.core.model.ImportEntry;
import com.archlint.core.rules.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Extracts the imports of many files in parallel, producing input for the module graph.
 *
 * <p>Missing files are left out. Files above the size limit are kept with an empty import
 * list so that they still count as module members.
 */
public class ImportCollector {

    private final Logger log;
    private final ScanOptions options;
    private final FileTaskExecutor executor;

    public ImportCollector() {
        this(ScanOptions.defaults());
    }

    public ImportCollector(ScanOptions options) {
        this(options, LoggerFactory.getLogger(ImportCollector.class));
    }

    public ImportCollector(ScanOptions options, Logger log) {
        this.options = options;
        this.log = log;
        this.executor = new FileTaskExecutor(options.parallelism(), log);
    }

    /**
     * Collects the imports of each file.
     *
     * @param projectRoot project root directory
     * @param files project-relative paths
     * @return one entry per existing file, in input order
     * @throws InterruptedException if interrupted while waiting for workers
     */
    public List<ImportEntry> collect(Path projectRoot, List<String> files) throws InterruptedException {
        List<ImportEntry> entries = executor.run(files, file -> entryFor(projectRoot, file), null);
        return entries.stream().filter(Objects::nonNull).toList();
    }

    private ImportEntry entryFor(Path projectRoot, String relativePath) {
        SourceFile file = SourceFile.of(projectRoot, relativePath);
        if (!file.exists()) {
            return null;
        }
        try {
            if (Files.size(file.path()) > options.maxFileSizeBytes()) {
                log.debug("Not extracting imports of oversized file {}", relativePath);
                return new ImportEntry(relativePath, List.of());
            }
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", relativePath, e.getMessage());
            return new ImportEntry(relativePath, List.of());
        }
        return new ImportEntry(relativePath, file.imports());
    }
}
