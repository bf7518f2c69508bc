package com.archlint.core.extractor.impl.go;

import com.archlint.core.extractor.base.AbstractLexicalImportExtractor;
import com.archlint.core.extractor.impl.go.util.GoCommentStripper;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts import paths from Go sources.
 *
 * <p>Handles single imports ({@code import "fmt"}, {@code import f "fmt"}) and grouped imports:
 * <pre>{@code
 * import (
 *     "fmt"
 *     log "github.com/sirupsen/logrus"
 *     _ "github.com/lib/pq"
 * )
 * }</pre>
 * Aliases, blank ({@code _}) and dot imports are reduced to the quoted path.
 */
public class GoImportExtractor extends AbstractLexicalImportExtractor {

    private static final Pattern GROUP_START = Pattern.compile("^import\\s*\\(");
    private static final Pattern GROUP_SPEC = Pattern.compile("^\\s*(?:[\\w.]+\\s+)?\"([^\"]+)\"");
    private static final Pattern SINGLE_IMPORT = Pattern.compile("^import\\s+(?:[\\w.]+\\s+)?\"([^\"]+)\"");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    @Override
    protected String strip(String content) {
        return new GoCommentStripper(content).strip();
    }

    @Override
    protected void collectImports(String stripped, Set<String> imports) {
        boolean inGroup = false;
        for (String line : lines(stripped)) {
            String trimmed = line.trim();
            if (inGroup) {
                if (trimmed.startsWith(")")) {
                    inGroup = false;
                    continue;
                }
                String path = firstMatch(GROUP_SPEC, line);
                if (path != null) {
                    imports.add(path);
                }
                continue;
            }

            Matcher groupStart = GROUP_START.matcher(trimmed);
            if (groupStart.find()) {
                String rest = trimmed.substring(groupStart.end());
                int close = rest.indexOf(')');
                if (close >= 0) {
                    addAllMatches(QUOTED, rest.substring(0, close), 1, imports);
                } else {
                    inGroup = true;
                    String path = firstMatch(GROUP_SPEC, rest);
                    if (path != null) {
                        imports.add(path);
                    }
                }
                continue;
            }

            String path = firstMatch(SINGLE_IMPORT, trimmed);
            if (path != null) {
                imports.add(path);
            }
        }
    }
}
