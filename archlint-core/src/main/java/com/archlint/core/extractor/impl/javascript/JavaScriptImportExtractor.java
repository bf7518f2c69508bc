package com.archlint.core.extractor.impl.javascript;

import com.archlint.core.extractor.base.AbstractLexicalImportExtractor;
import com.archlint.core.extractor.impl.javascript.util.JavaScriptCommentStripper;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts module specifiers from JavaScript and TypeScript sources.
 *
 * <p>Recognized forms:
 * <ul>
 *   <li>{@code import x from "mod"}, {@code import {a, b} from "mod"}, {@code import type ...}</li>
 *   <li>{@code import "mod"} (side-effect import)</li>
 *   <li>{@code export * from "mod"}, {@code export {a} from "mod"}</li>
 *   <li>{@code require("mod")}</li>
 *   <li>{@code import("mod")} (dynamic import with a literal argument)</li>
 * </ul>
 * Only lines where {@code import}, {@code export} or {@code require} appears outside a string
 * literal are examined. A braced import or export list spanning several lines is joined into
 * one statement first.
 */
public class JavaScriptImportExtractor extends AbstractLexicalImportExtractor {

    private static final Pattern KEYWORD = Pattern.compile("\\b(?:import|require|export)\\b");

    private static final List<Pattern> IMPORT_PATTERNS = List.of(
        Pattern.compile("(?:import|export)\\s+.*?\\s+from\\s+['\"]([^'\"]+)['\"]"),
        Pattern.compile("import\\s+['\"]([^'\"]+)['\"]"),
        Pattern.compile("export\\s+\\*\\s+from\\s+['\"]([^'\"]+)['\"]"),
        Pattern.compile("require\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)"),
        Pattern.compile("import\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)")
    );

    /** An import or export whose braced list is not closed on the same line. */
    private static final Pattern OPEN_BRACE_LIST =
        Pattern.compile("^\\s*(?:import|export)\\b[^'\"`;]*\\{[^}]*$");

    @Override
    protected String strip(String content) {
        return new JavaScriptCommentStripper(content).strip();
    }

    @Override
    protected void collectImports(String stripped, Set<String> imports) {
        List<String> lines = lines(stripped);
        for (int i = 0; i < lines.size(); i++) {
            String statement = lines.get(i);
            if (OPEN_BRACE_LIST.matcher(statement).find()) {
                StringBuilder joined = new StringBuilder(statement);
                while (i + 1 < lines.size() && joined.indexOf("}") < 0) {
                    joined.append(' ').append(lines.get(++i));
                }
                statement = joined.toString();
            }
            if (!hasKeywordOutsideStrings(statement)) {
                continue;
            }
            for (Pattern pattern : IMPORT_PATTERNS) {
                addAllMatches(pattern, statement, 1, imports);
            }
        }
    }

    /**
     * Checks whether an import keyword occurs in the line outside any string literal.
     */
    static boolean hasKeywordOutsideStrings(String line) {
        boolean[] quoted = new boolean[line.length()];
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                quoted[i] = true;
                if (c == '\\') {
                    if (i + 1 < line.length()) {
                        quoted[++i] = true;
                    }
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
                quoted[i] = true;
            }
        }
        Matcher matcher = KEYWORD.matcher(line);
        while (matcher.find()) {
            if (!quoted[matcher.start()]) {
                return true;
            }
        }
        return false;
    }
}
