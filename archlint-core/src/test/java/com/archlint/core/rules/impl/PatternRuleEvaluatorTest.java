package com.archlint.core.rules.impl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for POSIX class translation in {@link PatternRuleEvaluator}.
 */
class PatternRuleEvaluatorTest {

    @Test
    void translatePosixClasses_replacesEveryClass() {
        assertThat(PatternRuleEvaluator.translatePosixClasses("[[:space:]][[:digit:]]+"))
            .isEqualTo("\\s\\d+");
        assertThat(PatternRuleEvaluator.translatePosixClasses("[[:alpha:]][[:alnum:]]*"))
            .isEqualTo("[a-zA-Z][a-zA-Z0-9]*");
        assertThat(PatternRuleEvaluator.translatePosixClasses("[[:upper:]][[:lower:]]"))
            .isEqualTo("[A-Z][a-z]");
        assertThat(PatternRuleEvaluator.translatePosixClasses("[[:punct:]][[:blank:]]"))
            .isEqualTo("[^\\w\\s][ \\t]");
    }

    @Test
    void translatePosixClasses_leavesOtherSyntaxUntouched() {
        assertThat(PatternRuleEvaluator.translatePosixClasses("eval\\(.*\\)")).isEqualTo("eval\\(.*\\)");
    }
}
