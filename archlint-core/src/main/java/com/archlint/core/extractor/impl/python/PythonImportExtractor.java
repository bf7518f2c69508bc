package com.archlint.core.extractor.impl.python;

import com.archlint.core.extractor.base.AbstractImportExtractor;
import com.archlint.core.extractor.impl.python.util.PythonAstParser;
import com.archlint.core.extractor.impl.python.util.PythonSyntaxException;
import com.archlint.parser.Python3Parser;
import com.archlint.parser.Python3ParserBaseListener;
import org.antlr.v4.runtime.tree.ParseTreeWalker;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts module names from Python sources using the ANTLR Python 3 grammar.
 *
 * <p>{@code import a.b, c as d} yields {@code a.b} and {@code c}; {@code from a.b import x}
 * yields {@code a.b}. For relative imports the leading dots are dropped, so
 * {@code from .models import User} yields {@code models} and {@code from . import x} yields
 * nothing. Imports anywhere in the module are included: inside functions, classes and
 * conditional blocks, and after a compound-statement header on the same line
 * ({@code def f(): import x}).
 *
 * <p>Source that does not parse produces an empty list.
 */
public class PythonImportExtractor extends AbstractImportExtractor {

    @Override
    public List<String> extract(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }

        Python3Parser.File_inputContext tree;
        try {
            tree = PythonAstParser.parse(content);
        } catch (PythonSyntaxException e) {
            log.debug("Skipping Python source with syntax error: {}", e.getMessage());
            return List.of();
        }

        ImportListener listener = new ImportListener();
        ParseTreeWalker.DEFAULT.walk(listener, tree);
        return List.copyOf(listener.imports);
    }

    /**
     * Collects module names in source order.
     */
    private static final class ImportListener extends Python3ParserBaseListener {

        private final Set<String> imports = new LinkedHashSet<>();

        @Override
        public void enterImport_name(Python3Parser.Import_nameContext ctx) {
            for (Python3Parser.Dotted_as_nameContext name : ctx.dotted_as_names().dotted_as_name()) {
                imports.add(name.dotted_name().getText());
            }
        }

        @Override
        public void enterImport_from(Python3Parser.Import_fromContext ctx) {
            if (ctx.dotted_name() != null) {
                imports.add(ctx.dotted_name().getText());
            }
        }
    }
}
