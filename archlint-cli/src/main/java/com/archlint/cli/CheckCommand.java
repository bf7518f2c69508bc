package com.archlint.cli;

import com.archlint.core.config.InvariantLoader;
import com.archlint.core.model.Invariant;
import com.archlint.core.model.Violation;
import com.archlint.core.rules.RuleEngine;
import com.archlint.core.rules.SourceFile;
import com.archlint.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check a single file, printing its violations as a JSON array.
 *
 * <p>Suited to editor integrations and hooks that react to one edited file.
 */
@Command(
    name = "check",
    description = "Check one file against the architectural invariants",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "File to check, relative to the project or absolute")
    private Path file;

    @Option(names = {"-p", "--project"}, description = "Project directory (default: current directory)")
    private Path projectPath = Paths.get(".");

    @Option(names = {"-c", "--config"},
        description = "Invariants file, relative to the project (default: " + InvariantLoader.DEFAULT_CONFIG_PATH + ")")
    private Path configPath = Paths.get(InvariantLoader.DEFAULT_CONFIG_PATH);

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            Path invariantsFile = configPath.isAbsolute() ? configPath : root.resolve(configPath);
            String relativePath = relativize(root, file);

            List<Invariant> invariants = new InvariantLoader().load(invariantsFile);
            List<Violation> violations = new RuleEngine().evaluate(SourceFile.of(root, relativePath), invariants);
            log.debug("{}: {} violations", relativePath, violations.size());

            Output.json(spec.commandLine().getOut(), violations);
            return 0;

        } catch (Exception e) {
            log.error("Check failed", e);
            spec.commandLine().getErr().println("✗ Check failed: " + e.getMessage());
            return 1;
        }
    }

    static String relativize(Path root, Path file) {
        Path absolute = file.isAbsolute() ? file.normalize() : root.resolve(file).normalize();
        return FileUtils.toUnixPath(root.relativize(absolute));
    }
}
