package com.archlint.core.inference.impl;

import com.archlint.core.inference.GraphView;
import com.archlint.core.model.InferredRule;
import com.archlint.core.model.ModuleEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * Proposes keeping one-way dependencies one-way.
 *
 * <p>For an edge {@code A -> B} backed by at least two imports, where both modules own files
 * and {@code B} never imports from {@code A}, proposes forbidding {@code B} to import {@code A}.
 */
public class DirectionalityDetector extends AbstractRuleDetector {

    static final int MIN_IMPORTS = 2;

    @Override
    public String getId() {
        return "directionality";
    }

    @Override
    public List<InferredRule> detect(GraphView graph) {
        List<InferredRule> rules = new ArrayList<>();
        for (ModuleEdge edge : graph.edges()) {
            String from = edge.from();
            String to = edge.to();
            if (edge.importCount() < MIN_IMPORTS) {
                continue;
            }
            if (graph.fileCount(from) == 0 || graph.fileCount(to) == 0) {
                continue;
            }
            if (graph.hasEdge(to, from)) {
                continue;
            }
            rules.add(propose(
                "inferred-" + slug(to) + "-no-import-" + slug(from),
                from + " imports from " + to + " but " + to + " never imports from " + from,
                allModuleFiles(to),
                List.of(allModuleFiles(from)),
                List.of(),
                FULL_CONFIDENCE));
        }
        return rules;
    }
}
