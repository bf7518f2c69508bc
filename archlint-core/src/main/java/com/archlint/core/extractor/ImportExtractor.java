package com.archlint.core.extractor;

import java.nio.file.Path;
import java.util.List;

/**
 * Extracts raw import specifiers from the source of one language.
 *
 * <p>Implementations must be stateless and safe to call from several threads. Specifiers are
 * returned exactly as written, in order of first appearance, without duplicates. Imports that
 * only appear inside comments or string literals are never returned.
 *
 * @see SourceLanguage
 */
public interface ImportExtractor {

    /**
     * Extracts import specifiers from source text.
     *
     * @param content source text
     * @return specifiers in order of first appearance, never null
     */
    List<String> extract(String content);

    /**
     * Extracts import specifiers from a file.
     *
     * <p>Unreadable files yield an empty list rather than an exception.
     *
     * @param file source file
     * @return specifiers in order of first appearance, never null
     */
    List<String> extract(Path file);
}
