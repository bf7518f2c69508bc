package com.archlint.core.extractor.impl.dotnet.util;

import com.archlint.core.extractor.base.AbstractCommentStripper;

/**
 * Comment stripper for C#.
 *
 * <p>Recognizes verbatim strings ({@code @"..."}, {@code $@"..."}, {@code @$"..."}) where a
 * doubled quote is an escaped quote, raw string literals opened by three or more quotes (closed
 * by at least as many), interpolated {@code $"..."} strings, regular strings and character
 * literals.
 */
public class CSharpCommentStripper extends AbstractCommentStripper {

    public CSharpCommentStripper(String source) {
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
            case '@':
                if (peek(1) == '"') {
                    pos++;
                    skipVerbatimString();
                    return true;
                }
                if (peek(1) == '$' && peek(2) == '"') {
                    pos += 2;
                    skipVerbatimString();
                    return true;
                }
                return false;
            case '$':
                return skipInterpolatedPrefix();
            case '"':
                skipQuotedOrRaw();
                return true;
            case '\'':
                skipLineString('\'');
                return true;
            default:
                return false;
        }
    }

    private boolean skipInterpolatedPrefix() {
        int dollars = 0;
        while (peek(dollars) == '$') {
            dollars++;
        }
        if (peek(dollars) == '@' && peek(dollars + 1) == '"') {
            pos += dollars + 1;
            skipVerbatimString();
            return true;
        }
        if (peek(dollars) == '"') {
            pos += dollars;
            skipQuotedOrRaw();
            return true;
        }
        return false;
    }

    private void skipQuotedOrRaw() {
        int quotes = countQuotes(pos);
        if (quotes >= 3) {
            skipRawString(quotes);
        } else {
            skipLineString('"');
        }
    }

    private void skipVerbatimString() {
        int start = pos;
        pos++;
        while (pos < length) {
            if (source.charAt(pos) == '"') {
                if (peek(1) == '"') {
                    pos += 2;
                    continue;
                }
                pos++;
                break;
            }
            pos++;
        }
        pos = Math.min(pos, length);
        blankIfMultiline(start, pos);
    }

    private void skipRawString(int openingQuotes) {
        int start = pos;
        pos += openingQuotes;
        while (pos < length) {
            if (source.charAt(pos) == '"') {
                int run = countQuotes(pos);
                pos += run;
                if (run >= openingQuotes) {
                    break;
                }
            } else {
                pos++;
            }
        }
        pos = Math.min(pos, length);
        blankIfMultiline(start, pos);
    }

    private int countQuotes(int from) {
        int i = from;
        while (i < length && source.charAt(i) == '"') {
            i++;
        }
        return i - from;
    }
}
