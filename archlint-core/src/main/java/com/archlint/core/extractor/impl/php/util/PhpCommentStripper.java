package com.archlint.core.extractor.impl.php.util;

import com.archlint.core.extractor.base.AbstractCommentStripper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comment stripper for PHP.
 *
 * <p>Blanks {@code //}, {@code #} (but not {@code #[} attributes) and block comments. Heredoc
 * and nowdoc bodies are blanked up to the closing identifier, which may be indented.
 */
public class PhpCommentStripper extends AbstractCommentStripper {

    private static final Pattern HEREDOC_START = Pattern.compile("<<<[ \\t]*([\"']?)([A-Za-z_]\\w*)\\1[ \\t]*\\r?\\n");

    public PhpCommentStripper(String source) {
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
            case '#':
                if (peek(1) == '[') {
                    return false;
                }
                skipLineComment();
                return true;
            case '\'':
            case '"':
                skipString(String.valueOf(c), true);
                return true;
            case '<':
                return startsWith("<<<") && skipHeredoc();
            default:
                return false;
        }
    }

    private boolean skipHeredoc() {
        Matcher matcher = HEREDOC_START.matcher(source).region(pos, length);
        if (!matcher.lookingAt()) {
            return false;
        }
        String identifier = matcher.group(2);
        Pattern closing = Pattern.compile("(?m)^[ \\t]*" + Pattern.quote(identifier) + "(?![A-Za-z0-9_])");
        Matcher end = closing.matcher(source).region(matcher.end(), length);
        int bodyStart = matcher.end();
        if (end.find()) {
            blank(bodyStart, end.start());
            pos = end.end();
        } else {
            blank(bodyStart, length);
            pos = length;
        }
        return true;
    }
}
