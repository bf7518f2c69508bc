package com.archlint.core.rules.impl;

import com.archlint.core.model.Invariant;
import com.archlint.core.model.InvariantType;
import com.archlint.core.model.Violation;
import com.archlint.core.rules.RuleEvaluator;
import com.archlint.core.rules.SourceFile;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks file-organization conventions.
 *
 * <p>The only convention with an automated check is test colocation, selected when the
 * invariant's rule text mentions "test". Other conventions produce no violations.
 */
public class ConventionRuleEvaluator implements RuleEvaluator {

    static final String MISSING_TEST_MESSAGE = "missing colocated test file";

    private static final Pattern TEST_RULE = Pattern.compile("test", Pattern.CASE_INSENSITIVE);

    private final TestColocationChecker colocationChecker = new TestColocationChecker();

    @Override
    public InvariantType getType() {
        return InvariantType.CONVENTION;
    }

    @Override
    public List<Violation> evaluate(SourceFile file, Invariant invariant) {
        if (invariant.rule() == null || !TEST_RULE.matcher(invariant.rule()).find()) {
            return List.of();
        }
        if (colocationChecker.hasTest(file)) {
            return List.of();
        }
        return List.of(Violation.of(invariant, file.relativePath(), MISSING_TEST_MESSAGE));
    }
}
