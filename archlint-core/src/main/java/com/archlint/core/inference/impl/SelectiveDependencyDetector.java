package com.archlint.core.inference.impl;

import com.archlint.core.inference.GraphView;
import com.archlint.core.model.InferredRule;
import com.archlint.core.model.ModuleNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Proposes pinning the dependencies of a module that imports from exactly two other modules.
 */
public class SelectiveDependencyDetector extends AbstractRuleDetector {

    static final int MIN_MODULES = 3;
    static final int TARGET_COUNT = 2;

    @Override
    public String getId() {
        return "selective-dependencies";
    }

    @Override
    public List<InferredRule> detect(GraphView graph) {
        if (graph.moduleCount() < MIN_MODULES) {
            return List.of();
        }
        List<InferredRule> rules = new ArrayList<>();
        for (ModuleNode module : graph.modules()) {
            String id = module.id();
            if (module.fileCount() <= 1 || graph.outgoingTargets(id).size() != TARGET_COUNT) {
                continue;
            }
            List<String> targets = graph.outgoingTargets(id).stream().sorted().toList();
            List<String> allowed = new ArrayList<>();
            allowed.add(allModuleFiles(id));
            targets.forEach(target -> allowed.add(allModuleFiles(target)));

            rules.add(propose(
                ruleId(id, "selective-deps"),
                id + " only imports from " + targets.get(0) + " and " + targets.get(1) + "; enforce selective dependencies",
                allModuleFiles(id),
                List.of("**"),
                allowed,
                FULL_CONFIDENCE));
        }
        return rules;
    }
}
