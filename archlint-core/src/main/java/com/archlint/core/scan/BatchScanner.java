package com.archlint.core.scan;

import com.archlint.core.config.InvariantConfigException;
import com.archlint.core.config.InvariantLoader;
import com.archlint.core.config.ScanOptions;
import com.archlint.core.extractor.SourceLanguage;
import com.archlint.core.model.Invariant;
import com.archlint.core.model.ScanReport;
import com.archlint.core.model.Violation;
import com.archlint.core.rules.RuleEngine;
import com.archlint.core.rules.ScopeMatcher;
import com.archlint.core.rules.SourceFile;
import com.archlint.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks many files against a set of invariants.
 *
 * <p>Files are evaluated in parallel on a worker pool sized by {@link ScanOptions#parallelism()}
 * and merged in input order, so a report never depends on scheduling. Files that no longer
 * exist are skipped silently and files larger than {@link ScanOptions#maxFileSizeBytes()} are
 * skipped with a debug message. A missing or unreadable invariants file yields a failed
 * {@link ScanReport} rather than an exception.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BatchScanner scanner = new BatchScanner();
 * ScanReport report = scanner.scanProject(projectRoot, "", projectRoot.resolve(".archlint/invariants.yml"));
 * report.violations().forEach(v -> System.out.println(v.file() + ": " + v.message()));
 * }</pre>
 */
public class BatchScanner {

    private final Logger log;
    private final ScanOptions options;
    private final InvariantLoader invariantLoader;
    private final RuleEngine ruleEngine;
    private final FileTaskExecutor executor;

    public BatchScanner() {
        this(ScanOptions.defaults());
    }

    public BatchScanner(ScanOptions options) {
        this(options, LoggerFactory.getLogger(BatchScanner.class));
    }

    /**
     * Creates a scanner reporting progress and skipped rules to the given logger.
     *
     * @param options scan options
     * @param log logger passed to every component of the scan
     */
    public BatchScanner(ScanOptions options, Logger log) {
        this.options = options;
        this.log = log;
        this.invariantLoader = new InvariantLoader(options.cacheDirectory());
        this.ruleEngine = new RuleEngine(log);
        this.executor = new FileTaskExecutor(options.parallelism(), log);
    }

    /**
     * Scans every source file of a project, or of one of its sub-directories.
     *
     * @param projectRoot project root directory
     * @param scope sub-directory relative to the root, or empty for the whole project
     * @param invariantsFile invariants YAML file
     * @return scan report, failed if the invariants cannot be loaded
     */
    public ScanReport scanProject(Path projectRoot, String scope, Path invariantsFile) {
        String normalizedScope = normalizeScope(scope);
        List<Invariant> invariants;
        try {
            invariants = invariantLoader.load(invariantsFile);
        } catch (InvariantConfigException e) {
            log.error("Cannot load invariants: {}", e.getMessage());
            return ScanReport.failed(normalizedScope, e.getMessage());
        }

        List<String> files;
        try {
            files = discoverFiles(projectRoot, normalizedScope);
        } catch (IOException e) {
            log.error("Cannot list source files under {}: {}", projectRoot, e.getMessage());
            return ScanReport.failed(normalizedScope, "Cannot list source files: " + e.getMessage());
        }
        log.info("Scanning {} files against {} invariants", files.size(), invariants.size());
        return scan(projectRoot, files, invariants, normalizedScope);
    }

    /**
     * Scans an explicit list of files, such as the files changed since the last commit.
     *
     * @param projectRoot project root directory
     * @param files project-relative paths; deleted files are skipped
     * @param invariantsFile invariants YAML file
     * @return scan report, failed if the invariants cannot be loaded
     */
    public ScanReport scanFiles(Path projectRoot, List<String> files, Path invariantsFile) {
        List<Invariant> invariants;
        try {
            invariants = invariantLoader.load(invariantsFile);
        } catch (InvariantConfigException e) {
            log.error("Cannot load invariants: {}", e.getMessage());
            return ScanReport.failed("", e.getMessage());
        }
        return scan(projectRoot, files, invariants, "");
    }

    /**
     * Scans files against already loaded invariants.
     *
     * @param projectRoot project root directory
     * @param files project-relative paths
     * @param invariants invariants to apply
     * @param scope scope label recorded in the report
     * @return scan report with violations in file order, then invariant order
     */
    public ScanReport scan(Path projectRoot, List<String> files, List<Invariant> invariants, String scope) {
        List<List<Violation>> perFile;
        try {
            perFile = executor.run(files, file -> checkFile(projectRoot, file, invariants), List.of());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ScanReport.failed(scope, "Scan interrupted");
        }

        List<Violation> violations = new ArrayList<>();
        perFile.forEach(violations::addAll);
        log.debug("Scan finished: {} files, {} violations", files.size(), violations.size());
        return ScanReport.of(scope, files.size(), violations);
    }

    /**
     * Lists the source files of a project scope.
     *
     * @param projectRoot project root directory
     * @param scope sub-directory relative to the root, or empty
     * @return sorted project-relative paths
     * @throws IOException if the directory walk fails
     */
    public List<String> discoverFiles(Path projectRoot, String scope) throws IOException {
        String normalizedScope = normalizeScope(scope);
        Path base = normalizedScope.isEmpty() ? projectRoot : projectRoot.resolve(normalizedScope);
        List<String> found = FileUtils.findSourceFiles(base, options.ignoredDirectories(), SourceLanguage::isSupported);
        if (normalizedScope.isEmpty()) {
            return found;
        }
        return found.stream().map(file -> normalizedScope + "/" + file).toList();
    }

    private List<Violation> checkFile(Path projectRoot, String relativePath, List<Invariant> invariants) {
        SourceFile file = SourceFile.of(projectRoot, relativePath);
        if (!file.exists()) {
            return List.of();
        }
        if (invariants.stream().noneMatch(invariant -> ScopeMatcher.fileInScope(relativePath, invariant))) {
            return List.of();
        }
        if (isTooLarge(file)) {
            return List.of();
        }
        return ruleEngine.evaluate(file, invariants);
    }

    private boolean isTooLarge(SourceFile file) {
        try {
            long size = Files.size(file.path());
            if (size > options.maxFileSizeBytes()) {
                log.debug("Skipping {} ({} bytes exceeds limit of {})", file, size, options.maxFileSizeBytes());
                return true;
            }
            return false;
        } catch (IOException e) {
            log.debug("Skipping {}: {}", file, e.getMessage());
            return true;
        }
    }

    private static String normalizeScope(String scope) {
        if (scope == null) {
            return "";
        }
        String normalized = scope.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.equals(".") ? "" : normalized;
    }
}
