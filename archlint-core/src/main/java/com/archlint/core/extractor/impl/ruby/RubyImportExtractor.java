package com.archlint.core.extractor.impl.ruby;

import com.archlint.core.extractor.base.AbstractLexicalImportExtractor;
import com.archlint.core.extractor.impl.ruby.util.RubyCommentStripper;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts required paths from Ruby sources.
 *
 * <p>Recognizes {@code require}, {@code require_relative}, {@code require_dependency},
 * {@code load} and {@code autoload :Name, "path"} with a literal path, with or without
 * parentheses.
 */
public class RubyImportExtractor extends AbstractLexicalImportExtractor {

    private static final Pattern REQUIRE = Pattern.compile(
        "^(?:require_relative|require_dependency|require|load)\\s*\\(?\\s*['\"](.+?)['\"]");
    private static final Pattern AUTOLOAD = Pattern.compile(
        "^autoload\\s*\\(?\\s*:\\w+\\s*,\\s*['\"](.+?)['\"]");

    @Override
    protected String strip(String content) {
        return new RubyCommentStripper(content).strip();
    }

    @Override
    protected void collectImports(String stripped, Set<String> imports) {
        for (String line : lines(stripped)) {
            String trimmed = line.trim();
            String path = firstMatch(REQUIRE, trimmed);
            if (path == null) {
                path = firstMatch(AUTOLOAD, trimmed);
            }
            if (path != null) {
                imports.add(path);
            }
        }
    }
}
