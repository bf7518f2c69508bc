package com.archlint.core.rules;

import com.archlint.core.model.Invariant;
import com.archlint.core.util.FileUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether an import specifier is forbidden by a boundary invariant.
 *
 * <p>A specifier is compared against each pattern in several forms:
 * <ul>
 *   <li>as written, both as a glob match and as an exact literal</li>
 *   <li>for dotted module names without {@code /} ({@code app.db.models}), with dots turned
 *       into slashes ({@code app/db/models})</li>
 *   <li>for relative specifiers, when the importing file is known, resolved against the
 *       file's directory ({@code ../db/client} from {@code src/routes/users.ts} is
 *       {@code src/db/client})</li>
 * </ul>
 * A match against {@code allowed_imports} overrides a match against {@code forbidden_imports}.
 */
public final class ImportMatcher {

    private ImportMatcher() {
        // Utility class
    }

    /**
     * Checks a specifier without a known importing file.
     */
    public static boolean isForbidden(String specifier, Invariant invariant) {
        return isForbidden(specifier, null, invariant);
    }

    /**
     * Checks a specifier imported by the given file.
     *
     * @param specifier import specifier as written
     * @param sourceFile project-relative importing file, or null
     * @param invariant boundary invariant
     * @return true if the specifier matches a forbidden pattern and no allowed pattern
     */
    public static boolean isForbidden(String specifier, String sourceFile, Invariant invariant) {
        if (specifier == null || specifier.isEmpty() || invariant.forbiddenImports().isEmpty()) {
            return false;
        }
        List<String> forms = candidateForms(specifier, sourceFile);
        if (!matchesAny(specifier, forms, invariant.forbiddenImports())) {
            return false;
        }
        return !matchesAny(specifier, forms, invariant.allowedImports());
    }

    private static List<String> candidateForms(String specifier, String sourceFile) {
        List<String> forms = new ArrayList<>(3);
        forms.add(specifier);
        if (specifier.contains(".") && !specifier.contains("/")) {
            forms.add(specifier.replace('.', '/'));
        }
        if (sourceFile != null && (specifier.startsWith("./") || specifier.startsWith("../"))) {
            forms.add(FileUtils.resolveImport(sourceFile, specifier));
        }
        return forms;
    }

    private static boolean matchesAny(String specifier, List<String> forms, List<String> patterns) {
        for (String pattern : patterns) {
            if (specifier.equals(pattern)) {
                return true;
            }
            for (String form : forms) {
                if (ScopeMatcher.matches(form, pattern)) {
                    return true;
                }
            }
        }
        return false;
    }
}
