package com.archlint.core.extractor.impl.ruby.util;

import com.archlint.core.extractor.base.AbstractCommentStripper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comment stripper for Ruby.
 *
 * <p>Blanks {@code #} comments and {@code =begin}/{@code =end} blocks. Heredocs
 * ({@code <<~ID}, {@code <<-ID}, {@code <<ID}, optionally quoted) are recognized when the
 * opener is followed by the end of the line or by {@code , . )}; their bodies are blanked up
 * to the line whose trimmed content starts with the identifier. Double-quoted strings scan
 * {@code #{...}} interpolations as code.
 */
public class RubyCommentStripper extends AbstractCommentStripper {

    private static final Pattern HEREDOC_START = Pattern.compile("<<([~-]?)(['\"`]?)([A-Za-z_]\\w*)\\2");

    private int heredocBodyStart = -1;
    private int heredocBodyEnd;
    private int heredocResume;

    public RubyCommentStripper(String source) {
        super(source);
    }

    @Override
    protected boolean consumeToken(char c) {
        if (heredocBodyStart >= 0 && pos >= heredocBodyStart) {
            blank(heredocBodyStart, heredocBodyEnd);
            pos = Math.max(pos, heredocResume);
            heredocBodyStart = -1;
            return true;
        }
        switch (c) {
            case '#':
                skipLineComment();
                return true;
            case '=':
                if (atLineStart() && startsWith("=begin")) {
                    skipEmbeddedDocument();
                    return true;
                }
                return false;
            case '"':
                skipInterpolatedString("\"", true, true, "#{", '}', false);
                return true;
            case '\'':
            case '`':
                skipString(String.valueOf(c), true);
                return true;
            case '<':
                return heredocBodyStart < 0 && startsWith("<<") && registerHeredoc();
            default:
                return false;
        }
    }

    private void skipEmbeddedDocument() {
        int start = pos;
        int end = source.indexOf("\n=end", pos);
        if (end < 0) {
            pos = length;
        } else {
            int lineEnd = source.indexOf('\n', end + 1);
            pos = lineEnd < 0 ? length : lineEnd;
        }
        blank(start, pos);
    }

    private boolean registerHeredoc() {
        Matcher matcher = HEREDOC_START.matcher(source).region(pos, length);
        if (!matcher.lookingAt() || !heredocOpenerEndsStatement(matcher.end())) {
            return false;
        }
        String identifier = matcher.group(3);
        int newline = source.indexOf('\n', matcher.end());
        if (newline < 0) {
            return false;
        }

        int bodyStart = newline + 1;
        int lineStart = bodyStart;
        int bodyEnd = length;
        int resume = length;
        while (lineStart < length) {
            int lineEnd = source.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = length;
            }
            String trimmed = source.substring(lineStart, lineEnd).trim();
            if (trimmed.startsWith(identifier)
                    && (trimmed.length() == identifier.length()
                        || Character.isWhitespace(trimmed.charAt(identifier.length())))) {
                bodyEnd = lineStart;
                resume = lineEnd;
                break;
            }
            lineStart = lineEnd + 1;
        }

        heredocBodyStart = bodyStart;
        heredocBodyEnd = bodyEnd;
        heredocResume = resume;
        pos = matcher.end();
        return true;
    }

    private boolean heredocOpenerEndsStatement(int from) {
        int i = from;
        while (i < length && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
            i++;
        }
        if (i >= length) {
            return true;
        }
        char next = source.charAt(i);
        return next == '\n' || next == '\r' || next == ',' || next == '.' || next == ')';
    }
}
