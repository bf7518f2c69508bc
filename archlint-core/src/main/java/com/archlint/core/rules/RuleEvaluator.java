package com.archlint.core.rules;

import com.archlint.core.model.Invariant;
import com.archlint.core.model.InvariantType;
import com.archlint.core.model.Violation;

import java.util.List;

/**
 * Evaluates invariants of one {@link InvariantType} against a file.
 *
 * <p>Callers have already checked that the file exists and is in the invariant's scope.
 * Implementations must be safe to call from several threads.
 */
public interface RuleEvaluator {

    /**
     * Returns the invariant type this evaluator handles.
     */
    InvariantType getType();

    /**
     * Evaluates one invariant against one file.
     *
     * @param file file under evaluation
     * @param invariant invariant of {@link #getType()}
     * @return violations in discovery order, never null
     */
    List<Violation> evaluate(SourceFile file, Invariant invariant);
}
