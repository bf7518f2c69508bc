package com.archlint.core.extractor.impl.php;

import com.archlint.core.extractor.base.AbstractLexicalImportExtractor;
import com.archlint.core.extractor.impl.php.util.PhpCommentStripper;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts namespaces and included files from PHP sources.
 *
 * <p>Recognized forms:
 * <ul>
 *   <li>{@code use App\Models\User;}, {@code use function App\helper;}, {@code use App\X as Y;}</li>
 *   <li>{@code use A\B, C\D;} (one name per clause)</li>
 *   <li>{@code use App\Models\{User, Role};} (expanded to {@code App\Models\User}, ...)</li>
 *   <li>{@code require}, {@code require_once}, {@code include}, {@code include_once} with a
 *       literal path, when the statement starts the line</li>
 * </ul>
 */
public class PhpImportExtractor extends AbstractLexicalImportExtractor {

    private static final Pattern USE = Pattern.compile("^use\\s+(?:function\\s+|const\\s+)?([^;]+);");
    private static final Pattern GROUP = Pattern.compile("^([\\w\\\\]+?)\\\\?\\{([^}]+)\\}$");
    private static final Pattern NAME = Pattern.compile("^(?:function\\s+|const\\s+)?\\\\?([\\w\\\\]+)(?:\\s+as\\s+\\w+)?$");
    private static final Pattern INCLUDE = Pattern.compile(
        "^(?:<\\?php\\s+)?(?:require_once|require|include_once|include)\\b\\s*\\(?\\s*['\"](.+?)['\"]");

    @Override
    protected String strip(String content) {
        return new PhpCommentStripper(content).strip();
    }

    @Override
    protected void collectImports(String stripped, Set<String> imports) {
        for (String line : lines(stripped)) {
            String trimmed = line.trim();
            Matcher use = USE.matcher(trimmed);
            if (use.find()) {
                collectUse(use.group(1).trim(), imports);
                continue;
            }
            Matcher include = INCLUDE.matcher(trimmed);
            if (include.find()) {
                imports.add(include.group(1));
            }
        }
    }

    private void collectUse(String clause, Set<String> imports) {
        Matcher group = GROUP.matcher(clause);
        if (group.matches()) {
            String prefix = group.group(1);
            for (String item : group.group(2).split(",")) {
                String name = name(item);
                if (name != null) {
                    imports.add(prefix + "\\" + name);
                }
            }
            return;
        }
        for (String item : clause.split(",")) {
            String name = name(item);
            if (name != null) {
                imports.add(name);
            }
        }
    }

    private static String name(String item) {
        Matcher matcher = NAME.matcher(item.trim());
        return matcher.matches() ? matcher.group(1) : null;
    }
}
