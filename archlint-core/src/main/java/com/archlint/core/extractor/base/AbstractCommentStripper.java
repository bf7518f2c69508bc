package com.archlint.core.extractor.base;

/**
 * Single-pass lexer that blanks comments out of source text.
 *
 * <p>Subclasses recognize the comment and literal forms of one language in
 * {@link #consumeToken(char)}; everything else is copied through unchanged. Comment characters
 * are replaced by spaces while line breaks are kept, so the stripped text has the same length
 * and line structure as the input. String literals are preserved unless a subclass explicitly
 * blanks them.
 *
 * <p>Interpolated strings re-enter code scanning for their embedded expressions through
 * {@link #scanCode(char)}, which tracks bracket depth until the matching closer.
 *
 * <p>Instances are single-use and not thread-safe.
 */
public abstract class AbstractCommentStripper {

    /** Marker for "no closing character": scan until end of input. */
    protected static final char NONE = '\0';

    protected final String source;
    protected final int length;
    protected int pos;

    private final char[] out;

    protected AbstractCommentStripper(String source) {
        this.source = source;
        this.length = source.length();
        this.out = source.toCharArray();
    }

    /**
     * Strips the source.
     *
     * @return source text with comments blanked
     */
    public final String strip() {
        pos = 0;
        scanCode(NONE);
        return new String(out);
    }

    /**
     * Consumes one comment or literal starting at {@link #pos}, if any.
     *
     * @param c character at {@link #pos}
     * @return true if a token was consumed and {@link #pos} advanced past it
     */
    protected abstract boolean consumeToken(char c);

    /**
     * Scans code until {@code closer} is found at bracket depth zero, leaving {@link #pos} on it.
     *
     * @param closer {@code '}'}, {@code ')'} or {@link #NONE}
     */
    protected final void scanCode(char closer) {
        char opener = closer == '}' ? '{' : closer == ')' ? '(' : NONE;
        int depth = 0;
        while (pos < length) {
            char c = source.charAt(pos);
            if (closer != NONE) {
                if (c == closer) {
                    if (depth == 0) {
                        return;
                    }
                    depth--;
                } else if (c == opener) {
                    depth++;
                }
            }
            if (!consumeToken(c)) {
                pos++;
            }
        }
    }

    // ==================== Lookahead ====================

    protected final char peek(int offset) {
        int index = pos + offset;
        return index >= 0 && index < length ? source.charAt(index) : NONE;
    }

    protected final boolean startsWith(String token) {
        return source.startsWith(token, pos);
    }

    protected final boolean atLineStart() {
        return pos == 0 || source.charAt(pos - 1) == '\n';
    }

    // ==================== Consumers ====================

    /**
     * Replaces characters in {@code [from, to)} with spaces, keeping line breaks.
     */
    protected final void blank(int from, int to) {
        int end = Math.min(to, length);
        for (int i = from; i < end; i++) {
            if (out[i] != '\n' && out[i] != '\r') {
                out[i] = ' ';
            }
        }
    }

    /**
     * Blanks literal text in {@code [from, to)} if it spans several lines.
     */
    protected final void blankIfMultiline(int from, int to) {
        int end = Math.min(to, length);
        int newline = source.indexOf('\n', from);
        if (newline >= 0 && newline < end) {
            blank(from, end);
        }
    }

    /**
     * Returns the nearest character before {@link #pos} in the stripped output that is not a
     * space or tab.
     *
     * @return preceding character, or {@link #NONE} at the start of input
     */
    protected final char previousNonBlank() {
        for (int i = pos - 1; i >= 0; i--) {
            char c = out[i];
            if (c != ' ' && c != '\t') {
                return c;
            }
        }
        return NONE;
    }

    /**
     * Blanks a comment running to the end of the current line. The line break is kept.
     */
    protected final void skipLineComment() {
        int end = source.indexOf('\n', pos);
        if (end < 0) {
            end = length;
        }
        blank(pos, end);
        pos = end;
    }

    /**
     * Blanks a block comment starting at {@link #pos}.
     *
     * @param open opening delimiter
     * @param close closing delimiter
     * @param nested whether inner opening delimiters increase the nesting depth
     */
    protected final void skipBlockComment(String open, String close, boolean nested) {
        int start = pos;
        pos += open.length();
        int depth = 1;
        while (pos < length) {
            if (nested && startsWith(open)) {
                depth++;
                pos += open.length();
            } else if (startsWith(close)) {
                pos += close.length();
                if (--depth == 0) {
                    break;
                }
            } else {
                pos++;
            }
        }
        pos = Math.min(pos, length);
        blank(start, pos);
    }

    /**
     * Skips a string literal starting with {@code delimiter} at {@link #pos}, preserving it.
     *
     * @param delimiter opening and closing delimiter
     * @param escapes whether a backslash consumes the following character
     */
    protected final void skipString(String delimiter, boolean escapes) {
        int start = pos;
        pos += delimiter.length();
        while (pos < length) {
            if (escapes && source.charAt(pos) == '\\') {
                pos += 2;
            } else if (startsWith(delimiter)) {
                pos += delimiter.length();
                break;
            } else {
                pos++;
            }
        }
        pos = Math.min(pos, length);
        blankIfMultiline(start, pos);
    }

    /**
     * Skips a single-line string literal with backslash escapes, preserving it. An unterminated
     * literal ends at the line break.
     *
     * @param quote opening and closing quote
     */
    protected final void skipLineString(char quote) {
        pos++;
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == quote) {
                pos++;
                break;
            } else if (c == '\n') {
                break;
            } else {
                pos++;
            }
        }
        pos = Math.min(pos, length);
    }

    /**
     * Skips a string literal whose embedded expressions are scanned as code.
     *
     * @param delimiter opening and closing delimiter
     * @param escapes whether a backslash consumes the following character
     * @param multiline whether the literal may span lines; otherwise it ends at a line break
     * @param interpolationStart token opening an embedded expression, e.g. {@code "${"}
     * @param closer character closing an embedded expression
     * @param blankText whether the literal text itself is blanked
     */
    protected final void skipInterpolatedString(String delimiter, boolean escapes, boolean multiline,
                                                String interpolationStart, char closer,
                                                boolean blankText) {
        int textStart = pos;
        pos += delimiter.length();
        while (pos < length) {
            if (startsWith(interpolationStart)) {
                pos += interpolationStart.length();
                if (blankText) {
                    blank(textStart, pos);
                } else {
                    blankIfMultiline(textStart, pos);
                }
                scanCode(closer);
                textStart = pos;
                pos++;
            } else if (escapes && source.charAt(pos) == '\\') {
                pos += 2;
            } else if (startsWith(delimiter)) {
                pos += delimiter.length();
                break;
            } else if (!multiline && source.charAt(pos) == '\n') {
                break;
            } else {
                pos++;
            }
        }
        pos = Math.min(pos, length);
        if (blankText) {
            blank(textStart, pos);
        } else {
            blankIfMultiline(textStart, pos);
        }
    }

    /**
     * Skips forward until just past {@code terminator}, or to the end of input.
     */
    protected final void skipPast(String terminator) {
        int end = source.indexOf(terminator, pos);
        pos = end < 0 ? length : end + terminator.length();
    }
}
