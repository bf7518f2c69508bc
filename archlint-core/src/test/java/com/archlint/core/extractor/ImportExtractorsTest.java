package com.archlint.core.extractor;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ImportExtractors} and {@link SourceLanguage} dispatch.
 */
class ImportExtractorsTest extends ExtractorTestBase {

    @Test
    void fromPath_withKnownExtensions_selectsLanguage() {
        assertThat(SourceLanguage.fromPath("src/app.tsx")).contains(SourceLanguage.JAVASCRIPT);
        assertThat(SourceLanguage.fromPath("lib/main.mjs")).contains(SourceLanguage.JAVASCRIPT);
        assertThat(SourceLanguage.fromPath("pkg/mod.py")).contains(SourceLanguage.PYTHON);
        assertThat(SourceLanguage.fromPath("build.gradle.kts")).contains(SourceLanguage.KOTLIN);
        assertThat(SourceLanguage.fromPath("App.CS")).contains(SourceLanguage.CSHARP);
    }

    @Test
    void fromPath_withUnknownExtension_returnsEmpty() {
        assertThat(SourceLanguage.fromPath("README.md")).isEmpty();
        assertThat(SourceLanguage.fromPath("Makefile")).isEmpty();
    }

    @Test
    void extract_withUnsupportedFile_returnsEmptyList() {
        assertThat(extract("notes.txt", "import os")).isEmpty();
    }

    @Test
    void extract_fromFileOnDisk_readsContent() throws IOException {
        // Given: A TypeScript file on disk
        Path file = createFile("src/routes/users.ts", """
            import { db } from '../db/client';
            import express from 'express';
            """);

        // When: Imports are extracted from the path
        List<String> imports = ImportExtractors.extract(file);

        // Then: Both specifiers are found in order
        assertThat(imports).containsExactly("../db/client", "express");
    }

    @Test
    void extract_withMissingFile_returnsEmptyList() {
        assertThat(ImportExtractors.extract(tempDir.resolve("missing.ts"))).isEmpty();
    }

    @Test
    void extract_withEmptyContent_returnsEmptyList() {
        assertThat(extract("a.ts", "")).isEmpty();
        assertThat(extract("a.py", "")).isEmpty();
        assertThat(extract("A.java", "")).isEmpty();
    }

    @Test
    void allExtensions_coversEveryLanguage() {
        assertThat(SourceLanguage.allExtensions())
            .contains("ts", "tsx", "js", "py", "go", "rs", "java", "dart", "kt", "kts", "swift", "cs", "php", "rb");
    }
}
