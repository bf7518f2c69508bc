package com.archlint.core.extractor.impl.dart.util;

import com.archlint.core.extractor.base.AbstractCommentStripper;

/**
 * Comment stripper for Dart.
 *
 * <p>Blanks line and block comments (including {@code ///} doc comments). Recognizes raw
 * strings ({@code r'...'}, {@code r"""..."""}), triple-quoted strings and single-line strings;
 * expressions inside {@code ${...}} are scanned as code.
 */
public class DartCommentStripper extends AbstractCommentStripper {

    public DartCommentStripper(String source) {
        super(source);
    }

    @Override
    protected boolean consumeToken(char c) {
        switch (c) {
            case '/':
                if (peek(1) == '/') {
                    skipLineComment();
                    return true;
                }
                if (peek(1) == '*') {
                    skipBlockComment("/*", "*/", false);
                    return true;
                }
                return false;
            case 'r':
                if (isIdentifierChar(peek(-1)) || (peek(1) != '\'' && peek(1) != '"')) {
                    return false;
                }
                pos++;
                skipString(delimiterAt(), false);
                return true;
            case '\'':
            case '"':
                String delimiter = delimiterAt();
                skipInterpolatedString(delimiter, true, delimiter.length() == 3, "${", '}', false);
                return true;
            default:
                return false;
        }
    }

    private String delimiterAt() {
        char quote = source.charAt(pos);
        String triple = String.valueOf(quote).repeat(3);
        return startsWith(triple) ? triple : String.valueOf(quote);
    }

    private static boolean isIdentifierChar(char c) {
        return c != NONE && (Character.isLetterOrDigit(c) || c == '_' || c == '$');
    }
}
