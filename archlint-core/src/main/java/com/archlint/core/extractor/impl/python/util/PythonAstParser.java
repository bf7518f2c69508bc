package com.archlint.core.extractor.impl.python.util;

import com.archlint.parser.Python3Lexer;
import com.archlint.parser.Python3Parser;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Parses Python 3 source into an ANTLR parse tree.
 *
 * <p>Parsing runs in SLL mode first and falls back to full LL prediction only when SLL
 * rejects the input, so a file is reported as malformed only when the full grammar rejects
 * it. Lexer and parser errors both surface as {@link PythonSyntaxException}; no partial tree
 * is ever returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Python3Parser.File_inputContext tree = PythonAstParser.parse(source);
 * ParseTreeWalker.DEFAULT.walk(listener, tree);
 * }</pre>
 */
public final class PythonAstParser {

    private static final BaseErrorListener FAIL_FAST = new BaseErrorListener() {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new PythonSyntaxException(msg, line, e);
        }
    };

    private PythonAstParser() {
    }

    /**
     * Parses a whole module.
     *
     * @param source Python source text
     * @return the {@code file_input} parse tree
     * @throws PythonSyntaxException if the source is not valid Python 3
     */
    public static Python3Parser.File_inputContext parse(String source) {
        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FAIL_FAST);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        Python3Parser parser = new Python3Parser(tokens);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

        try {
            return parser.file_input();
        } catch (ParseCancellationException e) {
            parser.reset();
            parser.addErrorListener(FAIL_FAST);
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            return parser.file_input();
        }
    }
}
