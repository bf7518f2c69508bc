package com.archlint.core.rules.impl;

import com.archlint.core.model.Invariant;
import com.archlint.core.model.InvariantType;
import com.archlint.core.model.Violation;
import com.archlint.core.rules.RuleEvaluator;
import com.archlint.core.rules.ScopeMatcher;
import com.archlint.core.rules.SourceFile;

import java.util.List;

/**
 * Restricts usage of a package to files matching {@code allowed_in}.
 *
 * <p>An import uses the package when the package name occurs anywhere in the specifier. At most
 * one violation is reported per file.
 */
public class DependencyRuleEvaluator implements RuleEvaluator {

    @Override
    public InvariantType getType() {
        return InvariantType.DEPENDENCY;
    }

    @Override
    public List<Violation> evaluate(SourceFile file, Invariant invariant) {
        String packageName = invariant.packageName();
        if (packageName == null || packageName.isEmpty()) {
            return List.of();
        }
        for (String glob : invariant.allowedIn()) {
            if (ScopeMatcher.matches(file.relativePath(), glob)) {
                return List.of();
            }
        }
        for (String specifier : file.imports()) {
            if (specifier.contains(packageName)) {
                return List.of(Violation.forPackage(invariant, file.relativePath(), packageName));
            }
        }
        return List.of();
    }
}
