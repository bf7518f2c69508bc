package com.archlint.core.rules;

import com.archlint.core.model.Invariant;
import com.archlint.core.model.InvariantType;
import com.archlint.core.model.Violation;
import com.archlint.core.rules.impl.BoundaryRuleEvaluator;
import com.archlint.core.rules.impl.ConventionRuleEvaluator;
import com.archlint.core.rules.impl.DependencyRuleEvaluator;
import com.archlint.core.rules.impl.PatternRuleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates invariants against single files.
 *
 * <p>Scope is checked before any file access. Invariants without an id or with an unknown
 * type are skipped and reported once through the logger. Dispatch to the type-specific
 * {@link RuleEvaluator} is table driven.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RuleEngine engine = new RuleEngine();
 * SourceFile file = SourceFile.of(projectRoot, "src/routes/users.ts");
 * List<Violation> violations = engine.evaluate(file, invariants);
 * }</pre>
 */
public class RuleEngine {

    private final Logger log;
    private final Map<InvariantType, RuleEvaluator> evaluators = new EnumMap<>(InvariantType.class);
    private final Set<String> reportedInvalid = ConcurrentHashMap.newKeySet();

    public RuleEngine() {
        this(LoggerFactory.getLogger(RuleEngine.class));
    }

    /**
     * Creates an engine reporting skipped rules to the given logger.
     *
     * @param log logger shared with the evaluators
     */
    public RuleEngine(Logger log) {
        this.log = log;
        register(new BoundaryRuleEvaluator());
        register(new PatternRuleEvaluator(log));
        register(new ConventionRuleEvaluator());
        register(new DependencyRuleEvaluator());
    }

    private void register(RuleEvaluator evaluator) {
        evaluators.put(evaluator.getType(), evaluator);
    }

    /**
     * Evaluates one invariant against one file.
     *
     * @param file file under evaluation
     * @param invariant invariant to apply
     * @return violations, empty if the file is out of scope, missing or compliant
     */
    public List<Violation> evaluate(SourceFile file, Invariant invariant) {
        if (!isValid(invariant)) {
            return List.of();
        }
        if (!ScopeMatcher.fileInScope(file.relativePath(), invariant)) {
            return List.of();
        }
        if (!file.exists()) {
            return List.of();
        }
        return evaluators.get(invariant.type()).evaluate(file, invariant);
    }

    /**
     * Evaluates several invariants against one file.
     *
     * @param file file under evaluation
     * @param invariants invariants to apply
     * @return violations in invariant order
     */
    public List<Violation> evaluate(SourceFile file, List<Invariant> invariants) {
        List<Violation> violations = new ArrayList<>();
        for (Invariant invariant : invariants) {
            violations.addAll(evaluate(file, invariant));
        }
        return violations;
    }

    private boolean isValid(Invariant invariant) {
        if (invariant.id() == null || invariant.id().isBlank()) {
            warnOnce("<no id>:" + invariant.description(), "Skipping invariant without id: {}", invariant.description());
            return false;
        }
        if (invariant.type() == null) {
            warnOnce(invariant.id(), "Skipping invariant {} with missing or unknown type", invariant.id());
            return false;
        }
        return true;
    }

    private void warnOnce(String key, String message, String argument) {
        if (reportedInvalid.add(key)) {
            log.warn(message, argument);
        }
    }
}
