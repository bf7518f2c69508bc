package com.archlint.cli;

import com.archlint.core.config.ScanOptions;
import com.archlint.core.graph.AdjacencyGraphBuilder;
import com.archlint.core.graph.ViolationIndex;
import com.archlint.core.model.AdjacencyGraph;
import com.archlint.core.model.ImportEntry;
import com.archlint.core.model.ScanReport;
import com.archlint.core.scan.BatchScanner;
import com.archlint.core.scan.ImportCollector;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Options selecting where a module graph's imports come from, shared by {@code graph} and
 * {@code infer}.
 *
 * <p>Imports are extracted from the project's source files unless {@code --imports} names a
 * file produced by {@code extract}.
 */
public class GraphInput {

    private static final Logger log = LoggerFactory.getLogger(GraphInput.class);

    @Option(names = {"-s", "--scope"}, description = "Only include this sub-directory")
    String scope = "";

    @Option(names = "--imports", paramLabel = "FILE",
        description = "Read file imports from this JSON file instead of the project sources")
    Path importsFile;

    @Option(names = "--violations", paramLabel = "FILE",
        description = "Scan report JSON used to flag violating edges")
    Path violationsFile;

    AdjacencyGraph build(Path root, ScanOptions options) throws IOException, InterruptedException {
        List<ImportEntry> entries = importsFile != null ? readImports(importsFile) : collectImports(root, options);
        return new AdjacencyGraphBuilder().build(entries, readViolations());
    }

    private List<ImportEntry> collectImports(Path root, ScanOptions options) throws IOException, InterruptedException {
        List<String> files = new BatchScanner(options).discoverFiles(root, scope);
        log.info("Extracting imports of {} files", files.size());
        return new ImportCollector(options).collect(root, files);
    }

    private static List<ImportEntry> readImports(Path file) throws IOException {
        return Output.JSON_MAPPER.readValue(file.toFile(), new TypeReference<List<ImportEntry>>() {});
    }

    private ViolationIndex readViolations() {
        if (violationsFile == null) {
            return ViolationIndex.empty();
        }
        try {
            ScanReport report = Output.JSON_MAPPER.readValue(violationsFile.toFile(), ScanReport.class);
            return ViolationIndex.of(report.violations());
        } catch (IOException e) {
            log.warn("Could not load violations file {}: {}", violationsFile, e.getMessage());
            return ViolationIndex.empty();
        }
    }
}
