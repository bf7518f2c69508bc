package com.archlint.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Base class for the Python 3 lexer.
 *
 * <p>Tracks the indentation stack and emits {@code INDENT} and {@code DEDENT} tokens around
 * logical lines. Line breaks inside brackets and on blank or comment-only lines produce no
 * token. At end of input a final {@code NEWLINE} closes the last statement and all open
 * blocks are dedented.
 */
public abstract class Python3LexerBase extends Lexer {

    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int opened;
    private Token lastToken;
    private boolean endOfInputHandled;

    protected Python3LexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        super.setToken(token);
        pending.offer(token);
    }

    @Override
    public Token nextToken() {
        if (pending.isEmpty()) {
            super.nextToken();
        }
        Token next = pending.poll();

        if (next.getType() == Token.EOF && !endOfInputHandled) {
            endOfInputHandled = true;
            if (lastToken != null && lastToken.getType() != Python3Lexer.NEWLINE) {
                pending.offer(syntheticToken(Python3Lexer.NEWLINE, "\n"));
            }
            while (!indents.isEmpty()) {
                indents.pop();
                pending.offer(syntheticToken(Python3Lexer.DEDENT, ""));
            }
            pending.offer(next);
            next = pending.poll();
        }

        if (next.getChannel() == Token.DEFAULT_CHANNEL) {
            lastToken = next;
        }
        return next;
    }

    @Override
    public void reset() {
        super.reset();
        pending.clear();
        indents.clear();
        opened = 0;
        lastToken = null;
        endOfInputHandled = false;
    }

    protected boolean atStartOfInput() {
        return getCharPositionInLine() == 0 && getLine() == 1;
    }

    protected void onOpenBracket() {
        opened++;
    }

    protected void onCloseBracket() {
        if (opened > 0) {
            opened--;
        }
    }

    protected void onNewLine() {
        String text = getText();
        String lineBreak = text.replaceAll("[^\r\n\f]+", "");
        String spaces = text.replaceAll("[\r\n\f]+", "");
        int next = _input.LA(1);

        if (opened > 0 || next == '\r' || next == '\n' || next == '\f' || next == '#' || next == EOF) {
            skip();
            return;
        }

        emit(syntheticToken(Python3Lexer.NEWLINE, lineBreak));
        int indent = indentationWidth(spaces);
        int previous = indents.isEmpty() ? 0 : indents.peek();
        if (indent > previous) {
            indents.push(indent);
            emit(syntheticToken(Python3Lexer.INDENT, spaces));
        } else {
            while (!indents.isEmpty() && indents.peek() > indent) {
                indents.pop();
                emit(syntheticToken(Python3Lexer.DEDENT, ""));
            }
        }
    }

    static int indentationWidth(String spaces) {
        int width = 0;
        for (char c : spaces.toCharArray()) {
            width = c == '\t' ? width + 8 - (width % 8) : width + 1;
        }
        return width;
    }

    private Token syntheticToken(int type, String text) {
        int stop = getCharIndex() - 1;
        int start = text.isEmpty() ? stop : stop - text.length() + 1;
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
        token.setText(text);
        token.setLine(getLine());
        return token;
    }
}
