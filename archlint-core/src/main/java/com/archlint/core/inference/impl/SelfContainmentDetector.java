package com.archlint.core.inference.impl;

import com.archlint.core.inference.GraphView;
import com.archlint.core.model.InferredRule;
import com.archlint.core.model.ModuleNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Proposes keeping a module that depends on at most one other module that way.
 *
 * <p>Only applies to graphs of three or more modules, and only to modules with two or more
 * files.
 */
public class SelfContainmentDetector extends AbstractRuleDetector {

    static final int MIN_MODULES = 3;

    @Override
    public String getId() {
        return "self-containment";
    }

    @Override
    public List<InferredRule> detect(GraphView graph) {
        if (graph.moduleCount() < MIN_MODULES) {
            return List.of();
        }
        List<InferredRule> rules = new ArrayList<>();
        for (ModuleNode module : graph.modules()) {
            if (module.fileCount() <= 1) {
                continue;
            }
            String id = module.id();
            Set<String> targets = graph.outgoingTargets(id);
            if (targets.size() > 1) {
                continue;
            }
            if (targets.isEmpty()) {
                rules.add(propose(
                    ruleId(id, "self-contained"),
                    id + " has no external imports; enforce self-containment",
                    allModuleFiles(id),
                    List.of("**"),
                    List.of(allModuleFiles(id)),
                    FULL_CONFIDENCE));
            } else {
                String target = targets.iterator().next();
                rules.add(propose(
                    ruleId(id, "self-contained"),
                    id + " only imports from " + target + "; enforce self-containment",
                    allModuleFiles(id),
                    List.of("**"),
                    List.of(allModuleFiles(id), allModuleFiles(target)),
                    FULL_CONFIDENCE));
            }
        }
        return rules;
    }
}
