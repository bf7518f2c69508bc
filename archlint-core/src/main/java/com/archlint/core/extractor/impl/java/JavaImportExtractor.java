package com.archlint.core.extractor.impl.java;

import com.archlint.core.extractor.base.AbstractImportExtractor;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts imports from Java sources using JavaParser.
 *
 * <p>Returns the qualified name of every import declaration: {@code import java.util.List;}
 * yields {@code java.util.List}, {@code import java.util.*;} yields {@code java.util.*} and
 * {@code import static org.junit.Assert.assertTrue;} yields {@code org.junit.Assert.assertTrue}.
 *
 * <p>Files that fail to parse produce an empty list.
 */
public class JavaImportExtractor extends AbstractImportExtractor {

    private static final ParserConfiguration CONFIGURATION = new ParserConfiguration()
        .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_21)
        .setAttributeComments(false);

    @Override
    public List<String> extract(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }

        ParseResult<CompilationUnit> result = new JavaParser(CONFIGURATION).parse(content);
        Optional<CompilationUnit> unit = result.getResult();
        if (!result.isSuccessful() || unit.isEmpty()) {
            log.debug("Skipping Java source with {} parse problems", result.getProblems().size());
            return List.of();
        }

        Set<String> imports = new LinkedHashSet<>();
        for (ImportDeclaration declaration : unit.get().getImports()) {
            String name = declaration.getNameAsString();
            imports.add(declaration.isAsterisk() ? name + ".*" : name);
        }
        return List.copyOf(imports);
    }
}
