package com.archlint.core.graph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ModuleIds}.
 */
class ModuleIdsTest {

    @ParameterizedTest
    @CsvSource({
        "src/routes/users.ts, src/routes",
        "src/routes/admin/users.ts, src/routes",
        "src/utils.ts, src",
        "utils.ts, utils",
        "express, express",
        "src\\db\\client.ts, src/db"
    })
    void moduleOf_usesFirstTwoComponents(String path, String expected) {
        assertThat(ModuleIds.moduleOf(path)).isEqualTo(expected);
    }

    @Test
    void resolve_withRelativeSpecifier_normalizesAgainstFileDirectory() {
        assertThat(ModuleIds.resolve("src/routes/users.ts", "../db/client")).isEqualTo("src/db/client");
        assertThat(ModuleIds.resolve("src/routes/users.ts", "./helpers")).isEqualTo("src/routes/helpers");
        assertThat(ModuleIds.resolve("index.ts", "./lib")).isEqualTo("lib");
    }

    @Test
    void resolve_withBareSpecifier_returnsItUnchanged() {
        assertThat(ModuleIds.resolve("src/routes/users.ts", "express")).isEqualTo("express");
        assertThat(ModuleIds.resolve("src/app.py", "os.path")).isEqualTo("os.path");
    }
}
