package com.archlint.core.extractor.impl.kotlin.util;

import com.archlint.core.extractor.base.AbstractCommentStripper;

/**
 * Comment stripper for Kotlin.
 *
 * <p>Block comments nest. Raw {@code """} strings have no escapes; both raw and regular strings
 * scan {@code ${...}} templates as code. Character literals are single-line.
 */
public class KotlinCommentStripper extends AbstractCommentStripper {

    public KotlinCommentStripper(String source) {
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
                    skipBlockComment("/*", "*/", true);
                    return true;
                }
                return false;
            case '"':
                if (startsWith("\"\"\"")) {
                    skipInterpolatedString("\"\"\"", false, true, "${", '}', false);
                } else {
                    skipInterpolatedString("\"", true, false, "${", '}', false);
                }
                return true;
            case '\'':
                skipLineString('\'');
                return true;
            default:
                return false;
        }
    }
}
