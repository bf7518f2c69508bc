package com.archlint.core.graph;

import com.archlint.core.model.AdjacencyGraph;
import com.archlint.core.model.ImportDetail;
import com.archlint.core.model.ImportEntry;
import com.archlint.core.model.ModuleEdge;
import com.archlint.core.model.ModuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Aggregates file-level imports into a module-level adjacency graph.
 *
 * <p>Every importing file is registered in its module. Each import is resolved against its
 * file's directory and mapped to a target module; imports staying inside the source module
 * are dropped. Target modules with no files of their own still appear as nodes, with a file
 * count of zero. When a {@link ViolationIndex} is supplied, edges carrying a violating import
 * are flagged with the violated rule ids.
 *
 * <p>The result is deterministic: modules are sorted by id, member files by path, edges by
 * source then target module, and rule ids alphabetically. Import details keep input order.
 */
public class AdjacencyGraphBuilder {

    private final Logger log;

    public AdjacencyGraphBuilder() {
        this(LoggerFactory.getLogger(AdjacencyGraphBuilder.class));
    }

    public AdjacencyGraphBuilder(Logger log) {
        this.log = log;
    }

    public AdjacencyGraph build(List<ImportEntry> entries) {
        return build(entries, ViolationIndex.empty());
    }

    /**
     * Builds the module graph.
     *
     * @param entries per-file imports
     * @param violations boundary violations to annotate edges with
     * @return module graph
     */
    public AdjacencyGraph build(List<ImportEntry> entries, ViolationIndex violations) {
        Map<String, Set<String>> moduleFiles = new TreeMap<>();
        Map<EdgeKey, List<ImportDetail>> edgeImports = new TreeMap<>();
        Map<EdgeKey, Set<String>> edgeRules = new TreeMap<>();

        for (ImportEntry entry : entries) {
            String sourceFile = entry.file();
            if (sourceFile == null || sourceFile.isEmpty()) {
                continue;
            }
            String sourceModule = ModuleIds.moduleOf(sourceFile);
            moduleFiles.computeIfAbsent(sourceModule, m -> new TreeSet<>()).add(sourceFile);

            for (String specifier : entry.imports()) {
                if (specifier == null || specifier.isEmpty()) {
                    continue;
                }
                String resolved = ModuleIds.resolve(sourceFile, specifier);
                String targetModule = ModuleIds.moduleOf(resolved);
                if (targetModule.equals(sourceModule)) {
                    continue;
                }
                moduleFiles.computeIfAbsent(targetModule, m -> new TreeSet<>());

                EdgeKey key = new EdgeKey(sourceModule, targetModule);
                edgeImports.computeIfAbsent(key, k -> new ArrayList<>()).add(new ImportDetail(sourceFile, specifier));

                List<String> ruleIds = violations.ruleIds(sourceFile, resolved);
                if (!ruleIds.isEmpty()) {
                    edgeRules.computeIfAbsent(key, k -> new TreeSet<>()).addAll(ruleIds);
                }
            }
        }

        Map<String, Integer> violationCounts = violations.countsByModule();
        List<ModuleNode> modules = new ArrayList<>(moduleFiles.size());
        moduleFiles.forEach((id, files) -> modules.add(
            new ModuleNode(id, List.copyOf(files), files.size(), violationCounts.getOrDefault(id, 0))));

        List<ModuleEdge> edges = new ArrayList<>(edgeImports.size());
        edgeImports.forEach((key, imports) -> {
            List<String> ruleIds = List.copyOf(edgeRules.getOrDefault(key, Set.of()));
            edges.add(new ModuleEdge(key.from(), key.to(), imports, !ruleIds.isEmpty(), ruleIds));
        });

        log.debug("Built graph with {} modules and {} edges", modules.size(), edges.size());
        return new AdjacencyGraph(modules, edges);
    }

    private record EdgeKey(String from, String to) implements Comparable<EdgeKey> {
        @Override
        public int compareTo(EdgeKey other) {
            int byFrom = from.compareTo(other.from);
            return byFrom != 0 ? byFrom : to.compareTo(other.to);
        }
    }
}
