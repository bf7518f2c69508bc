package com.archlint.core.extractor;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for extracting imports from a file of any supported language.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<String> imports = ImportExtractors.extract(Path.of("src/routes/users.ts"));
 * }</pre>
 */
public final class ImportExtractors {

    private ImportExtractors() {
        // Utility class
    }

    /**
     * Extracts imports from a file, choosing the extractor by extension.
     *
     * @param file source file
     * @return specifiers in order of first appearance; empty for unsupported or unreadable files
     */
    public static List<String> extract(Path file) {
        return SourceLanguage.fromPath(file)
            .map(language -> language.getExtractor().extract(file))
            .orElse(List.of());
    }

    /**
     * Extracts imports from source text attributed to the given file name.
     *
     * @param fileName name used to select the language
     * @param content source text
     * @return specifiers in order of first appearance; empty for unsupported languages
     */
    public static List<String> extract(String fileName, String content) {
        return SourceLanguage.fromPath(fileName)
            .map(language -> language.getExtractor().extract(content))
            .orElse(List.of());
    }
}
