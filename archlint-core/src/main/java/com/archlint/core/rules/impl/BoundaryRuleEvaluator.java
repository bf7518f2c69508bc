package com.archlint.core.rules.impl;

import com.archlint.core.model.Invariant;
import com.archlint.core.model.InvariantType;
import com.archlint.core.model.Violation;
import com.archlint.core.rules.ImportMatcher;
import com.archlint.core.rules.RuleEvaluator;
import com.archlint.core.rules.SourceFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports one violation per forbidden import of a file.
 */
public class BoundaryRuleEvaluator implements RuleEvaluator {

    @Override
    public InvariantType getType() {
        return InvariantType.BOUNDARY;
    }

    @Override
    public List<Violation> evaluate(SourceFile file, Invariant invariant) {
        if (invariant.forbiddenImports().isEmpty()) {
            return List.of();
        }
        List<Violation> violations = new ArrayList<>();
        for (String specifier : file.imports()) {
            if (ImportMatcher.isForbidden(specifier, file.relativePath(), invariant)) {
                violations.add(Violation.forImport(invariant, file.relativePath(), specifier));
            }
        }
        return violations;
    }
}
