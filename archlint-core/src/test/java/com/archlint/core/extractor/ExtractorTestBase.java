package com.archlint.core.extractor;

import com.archlint.core.ProjectTestBase;

import java.util.List;

/**
 * Base class for import extractor tests.
 */
public abstract class ExtractorTestBase extends ProjectTestBase {

    /**
     * Extracts imports from source text, choosing the language by file name.
     */
    protected List<String> extract(String fileName, String content) {
        return ImportExtractors.extract(fileName, content);
    }
}
