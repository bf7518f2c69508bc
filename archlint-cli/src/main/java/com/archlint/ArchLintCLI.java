package com.archlint;

import ch.qos.logback.classic.Level;
import com.archlint.cli.CheckCommand;
import com.archlint.cli.ExtractCommand;
import com.archlint.cli.GraphCommand;
import com.archlint.cli.InferCommand;
import com.archlint.cli.ScanCommand;
import com.archlint.cli.StructureCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.ScopeType;

/**
 * Main CLI entry point for ArchLint.
 *
 * <p>ArchLint checks source trees against architectural invariants: import boundaries,
 * forbidden code patterns, test conventions and dependency restrictions. It can also derive
 * a module graph from the imports of a project and propose rules from that graph.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Check a project (or a set of files) against the invariants</li>
 *   <li>{@code check} - Check a single file</li>
 *   <li>{@code extract} - Print the imports of files</li>
 *   <li>{@code graph} - Build the module adjacency graph</li>
 *   <li>{@code infer} - Propose boundary rules from the module graph</li>
 *   <li>{@code structure} - Summarize the project layout and its test gaps</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p>Results are written to stdout as JSON or YAML; log output goes to stderr.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Scan the current project
 * archlint scan
 *
 * # Scan only the files changed in the working tree
 * archlint scan --files "$(git diff --name-only | paste -sd, -)"
 *
 * # Propose rules
 * archlint infer --min-confidence 95
 * }</pre>
 */
@Command(
    name = "archlint",
    mixinStandardHelpOptions = true,
    version = "ArchLint 1.0.0-SNAPSHOT",
    description = "Architectural invariant checker for polyglot source trees",
    subcommands = {
        ScanCommand.class,
        CheckCommand.class,
        ExtractCommand.class,
        GraphCommand.class,
        InferCommand.class,
        StructureCommand.class
    }
)
public class ArchLintCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, scope = ScopeType.INHERIT,
        description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, scope = ScopeType.INHERIT,
        description = "Suppress all output except errors")
    private boolean quiet;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Creates the command line with ArchLint's parsing and execution settings.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new ArchLintCLI());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(ArchLintCLI::executeWithLogging);
        return commandLine;
    }

    private static int executeWithLogging(ParseResult parseResult) {
        configureLogging(parseResult);
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Sets the root log level from the global flags, wherever in the command chain they appear.
     */
    static void configureLogging(ParseResult parseResult) {
        boolean quiet = false;
        boolean verbose = false;
        for (ParseResult current = parseResult; current != null;
             current = current.hasSubcommand() ? current.subcommand() : null) {
            quiet |= current.hasMatchedOption("--quiet");
            verbose |= current.hasMatchedOption("--verbose");
        }

        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
