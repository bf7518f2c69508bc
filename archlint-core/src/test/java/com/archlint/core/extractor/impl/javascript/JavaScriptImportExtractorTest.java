package com.archlint.core.extractor.impl.javascript;

import com.archlint.core.extractor.ExtractorTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link JavaScriptImportExtractor}.
 */
class JavaScriptImportExtractorTest extends ExtractorTestBase {

    @Test
    void extract_withAllImportForms_returnsSpecifiersInOrder() {
        // Given: Static, side-effect, re-export, require and dynamic imports
        String source = """
            import React from 'react';
            import { a, b } from "./utils";
            import './styles.css';
            export * from '../shared/types';
            const fs = require('fs');
            const lazy = import('./lazy');
            """;

        // When: Imports are extracted
        List<String> imports = extract("src/app.ts", source);

        // Then: Every form is recognized in source order
        assertThat(imports).containsExactly("react", "./utils", "./styles.css", "../shared/types", "fs", "./lazy");
    }

    @Test
    void extract_withTypeImportsAndNamedReExports_returnsSpecifiers() {
        String source = """
            import type { User } from './types';
            export { helper } from "./helpers";
            """;

        assertThat(extract("index.ts", source)).containsExactly("./types", "./helpers");
    }

    @Test
    void extract_withCommentedImports_ignoresThem() {
        // Given: Imports inside line and block comments
        String source = """
            // import fake from 'commented';
            /* import other from 'block';
               require('inside-block') */
            import real from 'real';
            """;

        // Then: Only the live import is returned
        assertThat(extract("a.js", source)).containsExactly("real");
    }

    @Test
    void extract_withImportTextInsideString_ignoresIt() {
        String source = """
            const msg = "import x from 'not-an-import'";
            const url = "http://example.com"; import a from 'a';
            """;

        assertThat(extract("a.js", source)).containsExactly("a");
    }

    @Test
    void extract_withImportTextInsideTemplateLiteral_ignoresIt() {
        String source = """
            const t = `
            import hidden from 'hidden';
            `;
            import visible from 'visible';
            """;

        assertThat(extract("a.ts", source)).containsExactly("visible");
    }

    @Test
    void extract_withMultiLineBracedImport_joinsStatement() {
        // Given: A named import list spread over several lines
        String source = """
            import {
              alpha,
              beta,
            } from './letters';
            """;

        assertThat(extract("a.ts", source)).containsExactly("./letters");
    }

    @Test
    void extract_withRegexContainingCommentOpener_keepsFollowingImports() {
        // Given: A regex literal that would otherwise open a block comment
        String source = """
            const re = /\\/\\*/;
            import after from 'after';
            """;

        assertThat(extract("a.js", source)).containsExactly("after");
    }

    @Test
    void extract_withDivisionOperator_doesNotTreatItAsRegex() {
        String source = """
            const half = total / 2; const third = total / 3;
            import math from 'math';
            """;

        assertThat(extract("a.js", source)).containsExactly("math");
    }

    @Test
    void extract_withDuplicateImports_returnsEachOnce() {
        String source = """
            import a from 'lodash';
            const b = require('lodash');
            """;

        assertThat(extract("a.js", source)).containsExactly("lodash");
    }

    @Test
    void hasKeywordOutsideStrings_distinguishesQuotedKeywords() {
        assertThat(JavaScriptImportExtractor.hasKeywordOutsideStrings("import x from 'y'")).isTrue();
        assertThat(JavaScriptImportExtractor.hasKeywordOutsideStrings("log('import x')")).isFalse();
        assertThat(JavaScriptImportExtractor.hasKeywordOutsideStrings("const important = 1")).isFalse();
    }
}
