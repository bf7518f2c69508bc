package com.archlint.cli;

import com.archlint.core.config.ScanOptions;
import com.archlint.core.model.StructureReport;
import com.archlint.core.structure.StructureAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to summarize a project's layout: directories, layers, naming patterns, test gaps
 * and per-directory file counts.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * archlint structure
 * archlint structure path/to/project --format yaml
 * }</pre>
 */
@Command(
    name = "structure",
    description = "Summarize directories, layers, naming patterns and test gaps",
    mixinStandardHelpOptions = true
)
public class StructureCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StructureCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectPath;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format = OutputFormat.JSON;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                spec.commandLine().getErr().println("✗ Not a directory: " + root);
                return 1;
            }

            StructureReport report = new StructureAnalyzer().analyze(root, ScanOptions.defaults());
            log.info("Structure: {} directories, {} test gaps", report.rawStructure().size(), report.testGaps().size());

            Output.write(spec.commandLine().getOut(), report, format);
            return 0;

        } catch (Exception e) {
            log.error("Structure analysis failed", e);
            spec.commandLine().getErr().println("✗ Structure analysis failed: " + e.getMessage());
            return 1;
        }
    }
}
