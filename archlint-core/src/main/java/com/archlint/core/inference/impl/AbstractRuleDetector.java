package com.archlint.core.inference.impl;

import com.archlint.core.inference.RuleDetector;
import com.archlint.core.model.InferredRule;
import com.archlint.core.model.Invariant;
import com.archlint.core.model.InvariantType;
import com.archlint.core.model.Severity;

import java.util.List;

/**
 * Base class for detectors proposing boundary rules.
 *
 * <p>Every proposal is a boundary rule at warning severity with an id of the form
 * {@code inferred-<module-slug>-<suffix>}.
 */
public abstract class AbstractRuleDetector implements RuleDetector {

    /** Confidence of proposals describing what the graph currently shows without exception. */
    protected static final double FULL_CONFIDENCE = 100.0;

    /**
     * Converts a module id to a form usable inside rule ids: {@code src/routes} becomes
     * {@code src-routes}.
     *
     * @param moduleId module id
     * @return slug
     */
    protected static String slug(String moduleId) {
        return moduleId.replace('/', '-').replace('\\', '-');
    }

    protected static String ruleId(String moduleId, String suffix) {
        return "inferred-" + slug(moduleId) + "-" + suffix;
    }

    protected static String allModuleFiles(String moduleId) {
        return moduleId + "/**";
    }

    /**
     * Creates a boundary proposal.
     *
     * @param id rule id
     * @param description human-readable rationale
     * @param sourceGlob files the rule applies to
     * @param forbiddenImports forbidden import globs
     * @param allowedImports overriding allowed import globs, possibly empty
     * @param confidence confidence in percent
     * @return proposal
     */
    protected static InferredRule propose(String id, String description, String sourceGlob,
                                          List<String> forbiddenImports, List<String> allowedImports,
                                          double confidence) {
        Invariant rule = Invariant.builder(id, InvariantType.BOUNDARY)
            .severity(Severity.WARNING)
            .description(description)
            .sourceGlob(sourceGlob)
            .forbiddenImports(forbiddenImports.toArray(String[]::new))
            .allowedImports(allowedImports.toArray(String[]::new))
            .build();
        return new InferredRule(rule, confidence);
    }
}
