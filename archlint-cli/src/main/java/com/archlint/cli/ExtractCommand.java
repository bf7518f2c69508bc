package com.archlint.cli;

import com.archlint.core.model.ImportEntry;
import com.archlint.core.scan.ImportCollector;
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
 * Command to print the import specifiers of files.
 *
 * <p>Output is a JSON array of {@code {"file", "imports"}} entries, the input format of
 * {@code graph --imports}.
 */
@Command(
    name = "extract",
    description = "Print the imports of source files",
    mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files, relative to the project or absolute")
    private List<Path> files;

    @Option(names = {"-p", "--project"}, description = "Project directory (default: current directory)")
    private Path projectPath = Paths.get(".");

    @Mixin
    private ScanSettings settings;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            List<String> relativePaths = files.stream()
                .map(file -> CheckCommand.relativize(root, file))
                .toList();

            List<ImportEntry> entries = new ImportCollector(settings.toScanOptions()).collect(root, relativePaths);
            log.debug("Extracted imports of {} files", entries.size());

            Output.json(spec.commandLine().getOut(), entries);
            return 0;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            spec.commandLine().getErr().println("✗ Extraction interrupted");
            return 1;
        } catch (Exception e) {
            log.error("Extraction failed", e);
            spec.commandLine().getErr().println("✗ Extraction failed: " + e.getMessage());
            return 1;
        }
    }
}
