package com.archlint.core.extractor.impl.swift.util;

import com.archlint.core.extractor.base.AbstractCommentStripper;

/**
 * Comment stripper for Swift.
 *
 * <p>Block comments nest. Multi-line {@code """} and single-line strings scan {@code \(...)}
 * interpolations as code. Extended-delimiter raw strings ({@code #"..."#}) close only on a
 * quote followed by the same number of hashes.
 */
public class SwiftCommentStripper extends AbstractCommentStripper {

    public SwiftCommentStripper(String source) {
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
                    skipInterpolatedString("\"\"\"", true, true, "\\(", ')', false);
                } else {
                    skipInterpolatedString("\"", true, false, "\\(", ')', false);
                }
                return true;
            case '#':
                return skipExtendedDelimiterString();
            default:
                return false;
        }
    }

    private boolean skipExtendedDelimiterString() {
        int hashes = 0;
        while (peek(hashes) == '#') {
            hashes++;
        }
        if (peek(hashes) != '"') {
            return false;
        }
        int start = pos;
        String closing = "\"" + "#".repeat(hashes);
        pos += hashes + (source.startsWith("\"\"\"", pos + hashes) ? 3 : 1);
        skipPast(closing);
        blankIfMultiline(start, pos);
        return true;
    }
}
