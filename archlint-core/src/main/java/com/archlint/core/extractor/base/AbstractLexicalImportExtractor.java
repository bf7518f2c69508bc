package com.archlint.core.extractor.base;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for extractors that work on comment-stripped source text.
 *
 * <p>Extraction runs in two phases:
 * <ol>
 *   <li>{@link #strip(String)} blanks comments (and, for some languages, string contents) with
 *       a language-specific {@link AbstractCommentStripper}</li>
 *   <li>{@link #collectImports(String, Set)} recognizes import statements in the stripped text,
 *       usually line by line with precompiled patterns</li>
 * </ol>
 * Collected specifiers keep their first-appearance order and duplicates are dropped.
 *
 * <p>Used for every supported language except Java, which is parsed structurally.
 */
public abstract class AbstractLexicalImportExtractor extends AbstractImportExtractor {

    @Override
    public final List<String> extract(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        Set<String> imports = new LinkedHashSet<>();
        collectImports(strip(content), imports);
        return List.copyOf(imports);
    }

    /**
     * Removes comments from the source while keeping its line structure.
     *
     * @param content raw source text
     * @return stripped text
     */
    protected abstract String strip(String content);

    /**
     * Adds every import specifier found in the stripped text.
     *
     * @param stripped output of {@link #strip(String)}
     * @param imports ordered set receiving specifiers
     */
    protected abstract void collectImports(String stripped, Set<String> imports);

    // ==================== Matching Utilities ====================

    /**
     * Splits text into lines, accepting both LF and CRLF line endings.
     *
     * @param text text to split
     * @return lines without terminators
     */
    protected static List<String> lines(String text) {
        List<String> result = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            result.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return result;
    }

    /**
     * Adds group {@code group} of every match of {@code pattern} in {@code text}.
     */
    protected static void addAllMatches(Pattern pattern, String text, int group, Set<String> imports) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(group);
            if (value != null && !value.isEmpty()) {
                imports.add(value);
            }
        }
    }

    /**
     * Returns group 1 of the first match of {@code pattern} in {@code text}.
     *
     * @return captured text, or null if the pattern does not match
     */
    protected static String firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Splits a comma-separated list at top level, ignoring commas inside braces.
     *
     * @param list list body without its enclosing braces
     * @return trimmed, non-empty items
     */
    protected static List<String> splitTopLevel(String list) {
        List<String> items = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < list.length(); i++) {
            char c = list.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addTrimmed(items, list.substring(start, i));
                start = i + 1;
            }
        }
        addTrimmed(items, list.substring(start));
        return items;
    }

    private static void addTrimmed(List<String> items, String item) {
        String trimmed = item.trim();
        if (!trimmed.isEmpty()) {
            items.add(trimmed);
        }
    }
}
