package com.archlint.core.inference;

import com.archlint.core.model.AdjacencyGraph;
import com.archlint.core.model.ImportDetail;
import com.archlint.core.model.ModuleEdge;
import com.archlint.core.model.ModuleNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup indexes over an {@link AdjacencyGraph}, built once per inference run.
 *
 * <p>All collections preserve the graph's own order: modules by id, edges by source then
 * target.
 */
public final class GraphView {

    private final AdjacencyGraph graph;
    private final Map<String, ModuleNode> modulesById = new LinkedHashMap<>();
    private final Map<String, Map<String, ModuleEdge>> edgesByFrom = new LinkedHashMap<>();
    private final Map<String, Set<String>> outgoingTargets = new LinkedHashMap<>();
    private final Map<String, List<ImportDetail>> incomingImports = new LinkedHashMap<>();

    public GraphView(AdjacencyGraph graph) {
        this.graph = graph;
        for (ModuleNode module : graph.modules()) {
            modulesById.put(module.id(), module);
        }
        for (ModuleEdge edge : graph.edges()) {
            edgesByFrom.computeIfAbsent(edge.from(), k -> new LinkedHashMap<>()).put(edge.to(), edge);
            outgoingTargets.computeIfAbsent(edge.from(), k -> new LinkedHashSet<>()).add(edge.to());
            incomingImports.computeIfAbsent(edge.to(), k -> new ArrayList<>()).addAll(edge.imports());
        }
    }

    public List<ModuleNode> modules() {
        return graph.modules();
    }

    public List<ModuleEdge> edges() {
        return graph.edges();
    }

    public int moduleCount() {
        return graph.modules().size();
    }

    public Optional<ModuleNode> module(String id) {
        return Optional.ofNullable(modulesById.get(id));
    }

    /**
     * Gets the number of member files of a module, zero for unknown modules.
     */
    public int fileCount(String moduleId) {
        ModuleNode module = modulesById.get(moduleId);
        return module != null ? module.fileCount() : 0;
    }

    public boolean hasEdge(String from, String to) {
        return edgesByFrom.getOrDefault(from, Map.of()).containsKey(to);
    }

    /**
     * Gets the distinct modules a module imports from, in edge order.
     */
    public Set<String> outgoingTargets(String moduleId) {
        return Collections.unmodifiableSet(outgoingTargets.getOrDefault(moduleId, Set.of()));
    }

    /**
     * Gets every import into a module from other modules, grouped by target module in order
     * of first appearance.
     */
    public Map<String, List<ImportDetail>> incomingImports() {
        return Collections.unmodifiableMap(incomingImports);
    }
}
