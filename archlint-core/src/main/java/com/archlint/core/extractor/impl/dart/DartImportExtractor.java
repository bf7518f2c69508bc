package com.archlint.core.extractor.impl.dart;

import com.archlint.core.extractor.base.AbstractLexicalImportExtractor;
import com.archlint.core.extractor.impl.dart.util.DartCommentStripper;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts URIs from Dart {@code import}, {@code export} and {@code part} directives.
 *
 * <p>{@code import 'package:flutter/material.dart' as m;} yields
 * {@code package:flutter/material.dart}.
 */
public class DartImportExtractor extends AbstractLexicalImportExtractor {

    private static final Pattern DIRECTIVE = Pattern.compile("^(?:import|export|part)\\s+['\"](.+?)['\"]");

    @Override
    protected String strip(String content) {
        return new DartCommentStripper(content).strip();
    }

    @Override
    protected void collectImports(String stripped, Set<String> imports) {
        for (String line : lines(stripped)) {
            String uri = firstMatch(DIRECTIVE, line.trim());
            if (uri != null) {
                imports.add(uri);
            }
        }
    }
}
