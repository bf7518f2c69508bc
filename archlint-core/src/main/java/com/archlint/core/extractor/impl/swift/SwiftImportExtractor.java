package com.archlint.core.extractor.impl.swift;

import com.archlint.core.extractor.base.AbstractLexicalImportExtractor;
import com.archlint.core.extractor.impl.swift.util.SwiftCommentStripper;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts module names from Swift {@code import} declarations.
 *
 * <p>{@code @testable import App}, {@code import struct Foundation.Date} and
 * {@code import UIKit} yield {@code App}, {@code Foundation} and {@code UIKit}.
 */
public class SwiftImportExtractor extends AbstractLexicalImportExtractor {

    private static final Pattern IMPORT = Pattern.compile(
        "^(?:@testable\\s+)?import\\s+(?:(?:struct|class|enum|protocol|typealias|func|var|let)\\s+)?(\\w+)");

    @Override
    protected String strip(String content) {
        return new SwiftCommentStripper(content).strip();
    }

    @Override
    protected void collectImports(String stripped, Set<String> imports) {
        for (String line : lines(stripped)) {
            String module = firstMatch(IMPORT, line.trim());
            if (module != null) {
                imports.add(module);
            }
        }
    }
}
