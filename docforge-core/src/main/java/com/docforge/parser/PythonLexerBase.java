package com.docforge.parser;

import org.antlr.v4.runtime.*;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Base class for the Python lexer.
 *
 * <p>Turns the raw token stream into the layout the parser expects: an INDENT or DEDENT before
 * the first token of a logical line whose indentation changed, a NEWLINE only at the end of a
 * logical line, and blank or bracketed line breaks moved to the hidden channel. It also tracks
 * which brace opened an f-string replacement field so the matching '}' or a top-level ':'
 * returns to the enclosing string mode.
 */
public abstract class PythonLexerBase extends Lexer {

    private static final int TAB_SIZE = 8;

    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Integer> fieldDepths = new ArrayDeque<>();

    private int opened;
    private int lineIndent;
    private boolean lineHasCode;
    private int lastType = Token.INVALID_TYPE;

    protected PythonLexerBase(CharStream input) {
        super(input);
        indents.push(0);
    }

    @Override
    public Token nextToken() {
        while (pending.isEmpty()) {
            fill(super.nextToken());
        }
        return pending.poll();
    }

    @Override
    public void reset() {
        pending.clear();
        indents.clear();
        indents.push(0);
        fieldDepths.clear();
        opened = 0;
        lineIndent = 0;
        lineHasCode = false;
        lastType = Token.INVALID_TYPE;
        super.reset();
    }

    /** Action for a '{' that opens an f-string replacement field. */
    protected void enterReplacementField() {
        setType(Python3Lexer.OPEN_BRACE);
        fieldDepths.push(opened + 1);
        pushMode(DEFAULT_MODE);
    }

    /** Action for '}' in the default mode; closes the innermost replacement field when it owns the brace. */
    protected void onCloseBrace() {
        if (atFieldTopLevel()) {
            fieldDepths.pop();
            popMode();
        }
    }

    /** Action for ':'; at the top level of a replacement field it starts the format spec. */
    protected void onColon() {
        if (atFieldTopLevel()) {
            pushMode(Python3Lexer.FORMAT_SPEC_MODE);
        }
    }

    /** Action for the '}' that ends a format spec, and with it the replacement field. */
    protected void exitFormatSpec() {
        setType(Python3Lexer.CLOSE_BRACE);
        fieldDepths.pop();
        popMode();
        popMode();
    }

    private boolean atFieldTopLevel() {
        return !fieldDepths.isEmpty() && fieldDepths.peek() == opened;
    }

    private void fill(Token t) {
        int type = t.getType();

        if (type == Token.EOF) {
            if (lastType != Python3Lexer.NEWLINE && lastType != Token.INVALID_TYPE && lastType != Token.EOF) {
                pending.add(synthetic(Python3Lexer.NEWLINE, t));
            }
            while (indents.peek() > 0) {
                indents.pop();
                pending.add(synthetic(Python3Lexer.DEDENT, t));
            }
            pending.add(t);
            lastType = Token.EOF;
            return;
        }

        if (type == Python3Lexer.WS && !lineHasCode && opened == 0) {
            lineIndent = indentWidth(t.getText());
            pending.add(t);
            return;
        }

        if (t.getChannel() != Token.DEFAULT_CHANNEL) {
            pending.add(t);
            return;
        }

        if (type == Python3Lexer.NEWLINE) {
            if (opened > 0 || !lineHasCode) {
                ((WritableToken) t).setChannel(Token.HIDDEN_CHANNEL);
                if (opened == 0) {
                    lineIndent = 0;
                }
            } else {
                lineHasCode = false;
                lineIndent = 0;
                lastType = type;
            }
            pending.add(t);
            return;
        }

        if (!lineHasCode) {
            lineHasCode = true;
            layout(t);
        }

        switch (type) {
            case Python3Lexer.OPEN_PAREN, Python3Lexer.OPEN_BRACK, Python3Lexer.OPEN_BRACE -> opened++;
            case Python3Lexer.CLOSE_PAREN, Python3Lexer.CLOSE_BRACK, Python3Lexer.CLOSE_BRACE ->
                    opened = Math.max(0, opened - 1);
            default -> {
            }
        }
        pending.add(t);
        lastType = type;
    }

    private void layout(Token first) {
        int current = indents.peek();
        if (lineIndent > current) {
            indents.push(lineIndent);
            pending.add(synthetic(Python3Lexer.INDENT, first));
            return;
        }
        while (lineIndent < indents.peek()) {
            indents.pop();
            pending.add(synthetic(Python3Lexer.DEDENT, first));
        }
        if (lineIndent != indents.peek()) {
            getErrorListenerDispatch().syntaxError(this, first, first.getLine(), first.getCharPositionInLine(),
                    "unindent does not match any outer indentation level", null);
        }
    }

    private Token synthetic(int type, Token anchor) {
        int start = anchor.getStartIndex();
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, start - 1);
        token.setText(type == Python3Lexer.NEWLINE ? "\n" : "");
        token.setLine(anchor.getLine());
        token.setCharPositionInLine(anchor.getCharPositionInLine());
        return token;
    }

    private static int indentWidth(String whitespace) {
        int width = 0;
        for (int i = 0; i < whitespace.length(); i++) {
            char c = whitespace.charAt(i);
            if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                width++;
            }
        }
        return width;
    }
}
