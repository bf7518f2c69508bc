package com.archlint.core.extractor.impl.go.util;

import com.archlint.core.extractor.base.AbstractCommentStripper;

/**
 * Comment stripper for Go.
 *
 * <p>Blanks {@code //} and non-nesting {@code /* *}{@code /} comments. Interpreted strings,
 * raw back-quoted strings and rune literals are preserved.
 */
public class GoCommentStripper extends AbstractCommentStripper {

    public GoCommentStripper(String source) {
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
            case '"':
            case '\'':
                skipLineString(c);
                return true;
            case '`':
                skipString("`", false);
                return true;
            default:
                return false;
        }
    }
}
