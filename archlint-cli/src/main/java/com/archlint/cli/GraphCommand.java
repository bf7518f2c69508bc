package com.archlint.cli;

import com.archlint.core.model.AdjacencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to build the module adjacency graph of a project.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * archlint graph > graph.json
 * archlint scan > scan.json && archlint graph --violations scan.json
 * }</pre>
 */
@Command(
    name = "graph",
    description = "Build the module-level import graph",
    mixinStandardHelpOptions = true
)
public class GraphCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GraphCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectPath;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format = OutputFormat.JSON;

    @Mixin
    private GraphInput input;

    @Mixin
    private ScanSettings settings;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            AdjacencyGraph graph = input.build(root, settings.toScanOptions());
            log.info("Graph: {} modules, {} edges", graph.modules().size(), graph.edges().size());

            Output.write(spec.commandLine().getOut(), graph, format);
            return 0;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            spec.commandLine().getErr().println("✗ Graph build interrupted");
            return 1;
        } catch (Exception e) {
            log.error("Graph build failed", e);
            spec.commandLine().getErr().println("✗ Graph build failed: " + e.getMessage());
            return 1;
        }
    }
}
