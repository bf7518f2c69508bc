package com.archlint.core.inference;

import com.archlint.core.inference.impl.DirectionalityDetector;
import com.archlint.core.inference.impl.GatewayDetector;
import com.archlint.core.inference.impl.SelectiveDependencyDetector;
import com.archlint.core.inference.impl.SelfContainmentDetector;
import com.archlint.core.model.AdjacencyGraph;
import com.archlint.core.model.InferredRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Proposes boundary rules from the structure of a module graph.
 *
 * <p>Detectors run in a fixed order: directionality, gateway, self-containment, then selective
 * dependencies. Proposals below the confidence threshold are dropped, then proposals sharing
 * a source glob and forbidden import set with an earlier one are discarded.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<InferredRule> rules = new RuleInferenceEngine().infer(graph, RuleInferenceEngine.DEFAULT_MIN_CONFIDENCE);
 * }</pre>
 */
public class RuleInferenceEngine {

    public static final double DEFAULT_MIN_CONFIDENCE = 90.0;

    private static final int MIN_FILES_PER_MODULE = 2;

    private final Logger log;
    private final List<RuleDetector> detectors;

    public RuleInferenceEngine() {
        this(LoggerFactory.getLogger(RuleInferenceEngine.class));
    }

    public RuleInferenceEngine(Logger log) {
        this(log, List.of(
            new DirectionalityDetector(),
            new GatewayDetector(),
            new SelfContainmentDetector(),
            new SelectiveDependencyDetector()));
    }

    RuleInferenceEngine(Logger log, List<RuleDetector> detectors) {
        this.log = log;
        this.detectors = List.copyOf(detectors);
    }

    /**
     * Infers rules from a graph.
     *
     * @param graph module graph
     * @param minConfidence minimum confidence in percent
     * @return deduplicated proposals in detector order; empty if no module has two or more files
     */
    public List<InferredRule> infer(AdjacencyGraph graph, double minConfidence) {
        boolean hasMultiFileModule = graph.modules().stream()
            .anyMatch(module -> module.fileCount() >= MIN_FILES_PER_MODULE);
        if (!hasMultiFileModule) {
            log.debug("No module with {} or more files, nothing to infer", MIN_FILES_PER_MODULE);
            return List.of();
        }

        GraphView view = new GraphView(graph);
        List<InferredRule> proposals = new ArrayList<>();
        for (RuleDetector detector : detectors) {
            List<InferredRule> detected = detector.detect(view).stream()
                .filter(rule -> rule.confidence() >= minConfidence)
                .toList();
            log.debug("{}: {} rules", detector.getId(), detected.size());
            proposals.addAll(detected);
        }

        List<InferredRule> unique = deduplicate(proposals);
        log.info("Inferred {} rules at minimum confidence {}", unique.size(), minConfidence);
        return unique;
    }

    private static List<InferredRule> deduplicate(List<InferredRule> rules) {
        Set<DedupKey> seen = new HashSet<>();
        List<InferredRule> unique = new ArrayList<>();
        for (InferredRule rule : rules) {
            DedupKey key = new DedupKey(rule.rule().sourceGlob(),
                rule.rule().forbiddenImports().stream().sorted().toList());
            if (seen.add(key)) {
                unique.add(rule);
            }
        }
        return unique;
    }

    private record DedupKey(String sourceGlob, List<String> forbiddenImports) {}
}
