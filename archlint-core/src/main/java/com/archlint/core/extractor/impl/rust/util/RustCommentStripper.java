package com.archlint.core.extractor.impl.rust.util;

import com.archlint.core.extractor.base.AbstractCommentStripper;

/**
 * Comment stripper for Rust.
 *
 * <p>Block comments nest. Raw strings ({@code r"..."}, {@code r#"..."#}, {@code br#"..."#})
 * close only on a quote followed by the same number of hashes as the opener. A single quote
 * starts a character literal when it is followed by an escape or closed two characters later;
 * otherwise it is a lifetime or label and is copied through.
 */
public class RustCommentStripper extends AbstractCommentStripper {

    public RustCommentStripper(String source) {
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
                skipString("\"", true);
                return true;
            case '\'':
                skipCharOrLifetime();
                return true;
            case 'b':
                if (identifierBefore()) {
                    return false;
                }
                if (peek(1) == 'r' && isRawStringStart(2)) {
                    pos++;
                    skipRawString();
                    return true;
                }
                if (peek(1) == '"') {
                    pos++;
                    skipString("\"", true);
                    return true;
                }
                if (peek(1) == '\'') {
                    pos++;
                    skipCharOrLifetime();
                    return true;
                }
                return false;
            case 'r':
                if (!identifierBefore() && isRawStringStart(1)) {
                    skipRawString();
                    return true;
                }
                return false;
            default:
                return false;
        }
    }

    private boolean identifierBefore() {
        char previous = peek(-1);
        return previous != NONE && (Character.isLetterOrDigit(previous) || previous == '_');
    }

    /**
     * Checks for {@code #*"} starting {@code offset} characters ahead.
     */
    private boolean isRawStringStart(int offset) {
        int i = offset;
        while (peek(i) == '#') {
            i++;
        }
        return peek(i) == '"';
    }

    /**
     * Skips a raw string with {@link #pos} on its {@code r}.
     */
    private void skipRawString() {
        pos++;
        int hashes = 0;
        while (pos < length && source.charAt(pos) == '#') {
            hashes++;
            pos++;
        }
        int start = pos;
        pos++;
        skipPast("\"" + "#".repeat(hashes));
        blankIfMultiline(start, pos);
    }

    private void skipCharOrLifetime() {
        if (peek(1) == '\\') {
            pos += 3;
            while (pos < length && source.charAt(pos) != '\'' && source.charAt(pos) != '\n') {
                pos++;
            }
            if (pos < length && source.charAt(pos) == '\'') {
                pos++;
            }
        } else if (peek(2) == '\'') {
            pos += 3;
        } else {
            pos++;
        }
    }
}
