package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A directed edge between two modules.
 *
 * @param from importing module
 * @param to imported module
 * @param imports individual imports supporting the edge
 * @param violation whether any supporting import violated a rule
 * @param ruleIds ids of the violated rules, sorted
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModuleEdge(
    @JsonProperty("from") String from,
    @JsonProperty("to") String to,
    @JsonProperty("imports") List<ImportDetail> imports,
    @JsonProperty("violation") boolean violation,
    @JsonProperty("rule_ids") List<String> ruleIds
) {
    public ModuleEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        imports = imports != null ? List.copyOf(imports) : List.of();
        ruleIds = ruleIds != null ? List.copyOf(ruleIds) : List.of();
    }

    @JsonIgnore
    public int importCount() {
        return imports.size();
    }
}
