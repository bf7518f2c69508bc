package com.archlint.core.graph;

import com.archlint.core.util.FileUtils;

/**
 * Maps file paths to module identifiers.
 *
 * <p>A module is identified by the first two path components: {@code src/routes/users.ts}
 * belongs to {@code src/routes}, {@code src/utils.ts} to {@code src}, and a top-level file
 * such as {@code utils.ts} forms its own module {@code utils}.
 */
public final class ModuleIds {

    private ModuleIds() {
        // Utility class
    }

    /**
     * Gets the module of a file or resolved import path.
     *
     * @param path {@code /} or {@code \} separated path
     * @return module identifier
     */
    public static String moduleOf(String path) {
        String[] parts = path.replace('\\', '/').split("/", -1);
        if (parts.length >= 3) {
            return parts[0] + "/" + parts[1];
        }
        if (parts.length == 2) {
            return parts[0];
        }
        return FileUtils.stripExtension(parts[0]);
    }

    /**
     * Resolves an import specifier against the directory of the importing file.
     *
     * @param sourceFile importing file
     * @param specifier import specifier as written
     * @return normalized path for relative specifiers, the specifier otherwise
     */
    public static String resolve(String sourceFile, String specifier) {
        return FileUtils.resolveImport(sourceFile.replace('\\', '/'), specifier);
    }
}
