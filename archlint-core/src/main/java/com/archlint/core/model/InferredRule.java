package com.archlint.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A boundary rule proposed by structural analysis of the module graph.
 *
 * @param rule proposed invariant, always of type boundary
 * @param confidence confidence in percent, between 0 and 100
 */
public record InferredRule(Invariant rule, double confidence) {

    public InferredRule {
        Objects.requireNonNull(rule, "rule must not be null");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100: " + confidence);
        }
    }

    public String id() {
        return rule.id();
    }

    /**
     * Renders the rule in the invariant configuration shape, flagged as inferred.
     *
     * <p>Whole confidence values are rendered as integers.
     *
     * @return ordered map suitable for YAML or JSON serialization
     */
    public Map<String, Object> toConfigMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", rule.id());
        map.put("type", rule.type().value());
        map.put("severity", rule.severity().value());
        map.put("description", rule.description());
        map.put("source_glob", rule.sourceGlob());
        map.put("forbidden_imports", rule.forbiddenImports());
        if (!rule.allowedImports().isEmpty()) {
            map.put("allowed_imports", rule.allowedImports());
        }
        map.put("inferred", true);
        map.put("confidence", confidence == Math.rint(confidence) ? (Object) (long) confidence : confidence);
        return map;
    }
}
