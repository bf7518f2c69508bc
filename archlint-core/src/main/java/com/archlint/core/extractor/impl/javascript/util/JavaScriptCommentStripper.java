package com.archlint.core.extractor.impl.javascript.util;

import com.archlint.core.extractor.base.AbstractCommentStripper;

/**
 * Comment stripper for JavaScript and TypeScript.
 *
 * <p>Handles line and block comments, single- and double-quoted strings, template literals and
 * regular-expression literals. Template text is blanked while the expressions inside
 * {@code ${...}} are scanned as code. A {@code /} starts a regular expression unless the
 * preceding non-blank character is alphanumeric or one of {@code ) ] } . _ $}, in which case
 * it is a division operator.
 */
public class JavaScriptCommentStripper extends AbstractCommentStripper {

    private static final String DIVISION_PRECEDERS = ")]}._$";

    public JavaScriptCommentStripper(String source) {
        super(source);
    }

    @Override
    protected boolean consumeToken(char c) {
        switch (c) {
            case '/':
                if (peek(1) == '/') {
                    skipLineComment();
                } else if (peek(1) == '*') {
                    skipBlockComment("/*", "*/", false);
                } else if (startsRegex()) {
                    skipRegex();
                } else {
                    return false;
                }
                return true;
            case '\'':
            case '"':
                skipLineString(c);
                return true;
            case '`':
                skipInterpolatedString("`", true, true, "${", '}', true);
                return true;
            default:
                return false;
        }
    }

    private boolean startsRegex() {
        char previous = previousNonBlank();
        if (previous == NONE) {
            return true;
        }
        return !Character.isLetterOrDigit(previous) && DIVISION_PRECEDERS.indexOf(previous) < 0;
    }

    private void skipRegex() {
        pos++;
        boolean inClass = false;
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '\n') {
                return;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                pos++;
                while (pos < length && Character.isLetter(source.charAt(pos))) {
                    pos++;
                }
                return;
            }
            pos++;
        }
        pos = Math.min(pos, length);
    }
}
