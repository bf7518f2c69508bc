package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Module-level import graph.
 *
 * @param modules modules sorted by id
 * @param edges edges sorted by source then target
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdjacencyGraph(
    @JsonProperty("modules") List<ModuleNode> modules,
    @JsonProperty("edges") List<ModuleEdge> edges
) {
    public AdjacencyGraph {
        modules = modules != null ? List.copyOf(modules) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public static AdjacencyGraph empty() {
        return new AdjacencyGraph(List.of(), List.of());
    }
}
