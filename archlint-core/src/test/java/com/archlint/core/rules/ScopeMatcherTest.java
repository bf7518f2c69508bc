package com.archlint.core.rules;

import com.archlint.core.model.Invariant;
import com.archlint.core.model.InvariantType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScopeMatcher}.
 */
class ScopeMatcherTest {

    @Test
    void globToRegex_translatesWildcards() {
        assertThat(ScopeMatcher.globToRegex("src/**/*.ts")).isEqualTo("^src/.*/[^/]*\\.ts$");
        assertThat(ScopeMatcher.globToRegex("lib/*")).isEqualTo("^lib/[^/]*$");
    }

    @Test
    void matches_withDoubleStar_crossesDirectories() {
        assertThat(ScopeMatcher.matches("src/db/client.ts", "src/**")).isTrue();
        assertThat(ScopeMatcher.matches("src/db/pool/index.ts", "src/db/**")).isTrue();
        assertThat(ScopeMatcher.matches("lib/db/client.ts", "src/**")).isFalse();
    }

    @Test
    void matches_withSingleStar_staysInOneSegment() {
        assertThat(ScopeMatcher.matches("src/app.ts", "src/*.ts")).isTrue();
        assertThat(ScopeMatcher.matches("src/routes/app.ts", "src/*.ts")).isFalse();
    }

    @Test
    void matches_treatsDotLiterally() {
        assertThat(ScopeMatcher.matches("src/appxts", "src/app.ts")).isFalse();
        assertThat(ScopeMatcher.matches("src/app.ts", "src/app.ts")).isTrue();
    }

    @Test
    void matches_withInvalidRegexGlob_fallsBackToLiteralMatch() {
        assertThat(ScopeMatcher.matches("src/(*", "src/(*")).isTrue();
        assertThat(ScopeMatcher.matches("src/(a", "src/(*")).isFalse();
    }

    @Test
    void matches_withEmptyGlob_returnsFalse() {
        assertThat(ScopeMatcher.matches("src/a.ts", "")).isFalse();
        assertThat(ScopeMatcher.matches("src/a.ts", null)).isFalse();
    }

    @Test
    void fileInScope_withoutGlob_includesEveryFile() {
        Invariant invariant = Invariant.builder("r", InvariantType.PATTERN).forbiddenPattern("x").build();

        assertThat(ScopeMatcher.fileInScope("anything/at/all.py", invariant)).isTrue();
    }

    @Test
    void fileInScope_withExclude_removesMatchingFiles() {
        // Given: A scope over src with test files excluded
        Invariant invariant = Invariant.builder("r", InvariantType.CONVENTION)
            .scopeGlob("src/**")
            .scopeGlobExclude("src/**/*.test.ts")
            .rule("every file needs a test")
            .build();

        // Then: Excluded and out-of-scope files are not in scope
        assertThat(ScopeMatcher.fileInScope("src/lib/util.ts", invariant)).isTrue();
        assertThat(ScopeMatcher.fileInScope("src/lib/util.test.ts", invariant)).isFalse();
        assertThat(ScopeMatcher.fileInScope("scripts/build.ts", invariant)).isFalse();
    }

    @Test
    void fileInScope_prefersSourceGlobOverScopeGlob() {
        Invariant invariant = Invariant.builder("r", InvariantType.BOUNDARY)
            .sourceGlob("src/routes/**")
            .scopeGlob("src/**")
            .forbiddenImports("src/db/**")
            .build();

        assertThat(ScopeMatcher.fileInScope("src/routes/users.ts", invariant)).isTrue();
        assertThat(ScopeMatcher.fileInScope("src/services/users.ts", invariant)).isFalse();
    }
}
