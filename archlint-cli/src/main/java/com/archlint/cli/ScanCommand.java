package com.archlint.cli;

import com.archlint.core.config.InvariantLoader;
import com.archlint.core.model.ScanReport;
import com.archlint.core.scan.BatchScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check a project against its invariants.
 *
 * <p>Without {@code --files} every source file under the project (or under {@code --scope})
 * is checked. With {@code --files} only the listed files are checked; listed files that no
 * longer exist are skipped, so the output of {@code git diff --name-only} can be passed as is.
 *
 * <p>The report is printed even when the invariants cannot be loaded; it then carries an
 * {@code error} field and the command still exits with 0.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * archlint scan
 * archlint scan /path/to/project --scope src/api
 * archlint scan --files src/a.ts,src/b.ts --fail-on-error
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Check project files against the architectural invariants",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    static final int EXIT_VIOLATIONS = 2;

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Invariants file, relative to the project (default: " + InvariantLoader.DEFAULT_CONFIG_PATH + ")"
    )
    private Path configPath = Paths.get(InvariantLoader.DEFAULT_CONFIG_PATH);

    @Option(names = {"-s", "--scope"}, description = "Only scan this sub-directory")
    private String scope = "";

    @Option(names = {"-f", "--files"}, split = ",", paramLabel = "FILE",
        description = "Only scan these project-relative files")
    private List<String> files;

    @Option(names = "--fail-on-error",
        description = "Exit with " + EXIT_VIOLATIONS + " if any error-severity violation is found")
    private boolean failOnError;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format = OutputFormat.JSON;

    @Mixin
    private ScanSettings settings;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            Path invariantsFile = configPath.isAbsolute() ? configPath : root.resolve(configPath);
            log.info("Scanning project: {}", root);

            BatchScanner scanner = new BatchScanner(settings.toScanOptions());
            ScanReport report = files != null
                ? scanner.scanFiles(root, files, invariantsFile)
                : scanner.scanProject(root, scope, invariantsFile);

            Output.write(spec.commandLine().getOut(), report, format);

            if (report.isFailed()) {
                log.warn("Scan did not run: {}", report.error());
                return 0;
            }
            log.info("{} violations ({} errors, {} warnings) in {} files",
                report.stats().total(), report.stats().errors(), report.stats().warnings(), report.filesChecked());
            return failOnError && report.hasErrors() ? EXIT_VIOLATIONS : 0;

        } catch (Exception e) {
            log.error("Scan failed", e);
            spec.commandLine().getErr().println("✗ Scan failed: " + e.getMessage());
            return 1;
        }
    }
}
