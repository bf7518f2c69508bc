package com.archlint.core.inference;

import com.archlint.core.model.InferredRule;

import java.util.List;

/**
 * Detects one structural regularity in a module graph and proposes boundary rules that
 * would keep it in place.
 *
 * <p>Detectors are stateless; the same graph always yields the same proposals in the same
 * order.
 *
 * @see RuleInferenceEngine
 */
public interface RuleDetector {

    /**
     * Short identifier used in log output, e.g. {@code "gateway"}.
     *
     * @return detector id
     */
    String getId();

    /**
     * Proposes rules for the graph. Confidence filtering is left to the caller.
     *
     * @param graph graph with lookup indexes
     * @return proposals, possibly empty
     */
    List<InferredRule> detect(GraphView graph);
}
