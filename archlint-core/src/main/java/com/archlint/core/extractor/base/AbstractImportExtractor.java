package com.archlint.core.extractor.base;

import com.archlint.core.extractor.ImportExtractor;
import com.archlint.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstract base class for import extractors.
 *
 * <p>Provides one logger per extractor class and lenient file reading: a file that cannot be
 * read produces an empty import list and a debug message.
 *
 * @see ImportExtractor
 */
public abstract class AbstractImportExtractor implements ImportExtractor {

    /**
     * Logger instance for this extractor.
     * Automatically initialized with the concrete extractor class name.
     */
    protected final Logger log;

    protected AbstractImportExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public List<String> extract(Path file) {
        String content;
        try {
            content = FileUtils.readLenient(file);
        } catch (IOException | UncheckedIOException e) {
            log.debug("Cannot read {}: {}", file, e.getMessage());
            return List.of();
        }
        return extract(content);
    }
}
