package com.archlint.core.extractor.impl.dotnet;

import com.archlint.core.extractor.base.AbstractLexicalImportExtractor;
import com.archlint.core.extractor.impl.dotnet.util.CSharpCommentStripper;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts namespaces from C# {@code using} directives.
 *
 * <p>Handles {@code global using}, {@code using static} and alias directives; generic
 * arguments are dropped, so {@code using Map = System.Collections.Generic.Dictionary<string, int>;}
 * yields {@code System.Collections.Generic.Dictionary}. Extraction stops at the first namespace
 * or type declaration.
 */
public class CSharpImportExtractor extends AbstractLexicalImportExtractor {

    private static final Pattern DECLARATION = Pattern.compile(
        "^(?:(?:public|internal|private|protected|static|sealed|abstract|partial|file|readonly)\\s+)*"
            + "(?:namespace|class|struct|interface|enum|record)\\s");

    private static final Pattern USING = Pattern.compile(
        "^(?:global\\s+)?using\\s+(?:static\\s+)?(?:\\w+\\s*=\\s*)?(?:global::)?([\\w.]+(?:<.*)?)");

    @Override
    protected String strip(String content) {
        return new CSharpCommentStripper(content).strip();
    }

    @Override
    protected void collectImports(String stripped, Set<String> imports) {
        for (String line : lines(stripped)) {
            String trimmed = line.trim();
            if (DECLARATION.matcher(trimmed).find()) {
                return;
            }
            String target = firstMatch(USING, trimmed);
            if (target == null) {
                continue;
            }
            int generic = target.indexOf('<');
            if (generic >= 0) {
                target = target.substring(0, generic);
            }
            if (!target.isEmpty() && !"var".equals(target)) {
                imports.add(target);
            }
        }
    }
}
