package com.archlint.core.extractor.impl.kotlin;

import com.archlint.core.extractor.base.AbstractLexicalImportExtractor;
import com.archlint.core.extractor.impl.kotlin.util.KotlinCommentStripper;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts qualified names from Kotlin {@code import} directives.
 *
 * <p>{@code import kotlinx.coroutines.*} yields {@code kotlinx.coroutines.*};
 * {@code import a.b.C as D} yields {@code a.b.C}.
 */
public class KotlinImportExtractor extends AbstractLexicalImportExtractor {

    private static final Pattern IMPORT = Pattern.compile("^import\\s+(\\w+(?:\\.\\w+)*(?:\\.\\*)?)");

    @Override
    protected String strip(String content) {
        return new KotlinCommentStripper(content).strip();
    }

    @Override
    protected void collectImports(String stripped, Set<String> imports) {
        for (String line : lines(stripped)) {
            String name = firstMatch(IMPORT, line.trim());
            if (name != null) {
                imports.add(name);
            }
        }
    }
}
