package com.archlint.core.inference.impl;

import com.archlint.core.inference.GraphView;
import com.archlint.core.model.ImportDetail;
import com.archlint.core.model.InferredRule;
import com.archlint.core.util.FileUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Proposes enforcing an entry-point file that already receives almost all imports into a
 * module.
 *
 * <p>The imported file is approximated by the last segment of each import specifier. When the
 * most imported segment takes at least {@value #MIN_SHARE}% of the imports into a module with
 * two or more files, and its stem is a conventional entry-point name such as {@code index} or
 * {@code __init__}, every other file of the module is proposed as forbidden from outside.
 */
public class GatewayDetector extends AbstractRuleDetector {

    static final double MIN_SHARE = 90.0;

    static final Set<String> GATEWAY_NAMES = Set.of("index", "__init__", "mod", "lib", "main", "exports", "public");

    @Override
    public String getId() {
        return "gateway";
    }

    @Override
    public List<InferredRule> detect(GraphView graph) {
        List<InferredRule> rules = new ArrayList<>();
        graph.incomingImports().forEach((moduleId, imports) -> {
            if (graph.module(moduleId).isEmpty() || graph.fileCount(moduleId) <= 1 || imports.size() < 2) {
                return;
            }

            Map<String, Integer> leafCounts = new LinkedHashMap<>();
            for (ImportDetail detail : imports) {
                leafCounts.merge(leaf(detail.target()), 1, Integer::sum);
            }
            String topLeaf = null;
            int topCount = 0;
            for (Map.Entry<String, Integer> entry : leafCounts.entrySet()) {
                if (entry.getValue() > topCount) {
                    topLeaf = entry.getKey();
                    topCount = entry.getValue();
                }
            }

            double share = topCount * 100.0 / imports.size();
            if (!GATEWAY_NAMES.contains(FileUtils.stripExtension(topLeaf)) || share < MIN_SHARE) {
                return;
            }
            rules.add(propose(
                ruleId(moduleId, "gateway"),
                String.format(Locale.ROOT, "%.0f%% of imports into %s go through %s; enforce gateway pattern", share, moduleId, topLeaf),
                "**",
                List.of(allModuleFiles(moduleId)),
                List.of(moduleId + "/" + topLeaf),
                Math.round(share * 10) / 10.0));
        });
        return rules;
    }

    private static String leaf(String target) {
        String normalized = target.replace('\\', '/');
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }
}
