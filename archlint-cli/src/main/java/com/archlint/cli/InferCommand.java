package com.archlint.cli;

import com.archlint.core.config.InvariantLoader;
import com.archlint.core.inference.InferredRuleWriter;
import com.archlint.core.inference.RuleInferenceEngine;
import com.archlint.core.model.AdjacencyGraph;
import com.archlint.core.model.InferredRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to propose boundary rules from the module graph.
 *
 * <p>YAML output can be reviewed and appended to the invariants file; JSON output lists the
 * same rules as objects. With {@code --apply} the proposed rules are also appended to the
 * invariants file, skipping ids it already declares.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * archlint infer
 * archlint infer --graph graph.json --min-confidence 95
 * archlint infer --apply
 * }</pre>
 */
@Command(
    name = "infer",
    description = "Propose boundary rules from the module graph",
    mixinStandardHelpOptions = true
)
public class InferCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InferCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectPath;

    @Option(names = "--graph", paramLabel = "FILE", description = "Read the module graph from this JSON file")
    private Path graphFile;

    @Option(names = "--min-confidence", paramLabel = "PERCENT",
        description = "Minimum confidence of proposed rules (default: ${DEFAULT-VALUE})")
    private double minConfidence = RuleInferenceEngine.DEFAULT_MIN_CONFIDENCE;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format = OutputFormat.YAML;

    @Option(names = "--apply", description = "Append the proposed rules to the invariants file")
    private boolean apply;

    @Option(names = {"-c", "--config"},
        description = "Invariants file for --apply, relative to the project (default: " + InvariantLoader.DEFAULT_CONFIG_PATH + ")")
    private Path configPath = Paths.get(InvariantLoader.DEFAULT_CONFIG_PATH);

    @Mixin
    private GraphInput input;

    @Mixin
    private ScanSettings settings;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            Path invariantsFile = configPath.isAbsolute() ? configPath : root.resolve(configPath);
            if (apply && !Files.isRegularFile(invariantsFile)) {
                spec.commandLine().getErr().println("✗ --apply requires an existing invariants file: " + invariantsFile);
                return 1;
            }

            AdjacencyGraph graph = loadGraph(root);
            List<InferredRule> rules = new RuleInferenceEngine().infer(graph, minConfidence);

            InferredRuleWriter writer = new InferredRuleWriter();
            PrintWriter out = spec.commandLine().getOut();
            if (format == OutputFormat.YAML) {
                writer.write(rules, minConfidence, out);
            } else {
                Output.json(out, rules.stream().map(InferredRule::toConfigMap).toList());
            }

            if (apply) {
                List<InferredRule> appended = writer.append(invariantsFile, rules);
                spec.commandLine().getErr().println(appended.isEmpty()
                    ? "No new rules to apply"
                    : "✓ Appended " + appended.size() + " rules to " + invariantsFile);
            }
            return 0;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            spec.commandLine().getErr().println("✗ Inference interrupted");
            return 1;
        } catch (Exception e) {
            log.error("Inference failed", e);
            spec.commandLine().getErr().println("✗ Inference failed: " + e.getMessage());
            return 1;
        }
    }

    private AdjacencyGraph loadGraph(Path root) throws IOException, InterruptedException {
        if (graphFile != null) {
            log.debug("Reading graph from {}", graphFile);
            return Output.JSON_MAPPER.readValue(graphFile.toFile(), AdjacencyGraph.class);
        }
        return input.build(root, settings.toScanOptions());
    }
}
