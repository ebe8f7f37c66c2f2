package com.docforge.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.docforge.parser.Python3Lexer.ADD;
import static com.docforge.parser.Python3Lexer.CLOSE_BRACE;
import static com.docforge.parser.Python3Lexer.CLOSE_PAREN;
import static com.docforge.parser.Python3Lexer.COLON;
import static com.docforge.parser.Python3Lexer.COMMA;
import static com.docforge.parser.Python3Lexer.DEDENT;
import static com.docforge.parser.Python3Lexer.DEF;
import static com.docforge.parser.Python3Lexer.FSTRING_END;
import static com.docforge.parser.Python3Lexer.FSTRING_MIDDLE;
import static com.docforge.parser.Python3Lexer.FSTRING_START;
import static com.docforge.parser.Python3Lexer.INDENT;
import static com.docforge.parser.Python3Lexer.NAME;
import static com.docforge.parser.Python3Lexer.NEWLINE;
import static com.docforge.parser.Python3Lexer.NUMBER;
import static com.docforge.parser.Python3Lexer.OPEN_BRACE;
import static com.docforge.parser.Python3Lexer.OPEN_PAREN;
import static com.docforge.parser.Python3Lexer.RETURN;
import static com.docforge.parser.Python3Lexer.STRING;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the layout and f-string handling in {@link PythonLexerBase}.
 */
class PythonLexerBaseTest {

    @Test
    void nextToken_functionWithBody_emitsIndentAndDedent() {
        assertThat(types("""
            def add(a, b):
                return a + b
            """)).containsExactly(
            DEF, NAME, OPEN_PAREN, NAME, COMMA, NAME, CLOSE_PAREN, COLON, NEWLINE,
            INDENT, RETURN, NAME, ADD, NAME, NEWLINE,
            DEDENT, Token.EOF);
    }

    @Test
    void nextToken_emptySource_returnsOnlyEof() {
        assertThat(types("")).containsExactly(Token.EOF);
    }

    @Test
    void nextToken_insideBrackets_hidesNewline() {
        assertThat(types("x = (1,\n     2)\n")).containsExactly(
            NAME, Python3Lexer.ASSIGN, OPEN_PAREN, NUMBER, COMMA, NUMBER, CLOSE_PAREN, NEWLINE, Token.EOF);
    }

    @Test
    void nextToken_blankAndCommentLines_produceNoLayoutTokens() {
        assertThat(types("""
            a = 1

            # note
                # indented comment
            b = 2
            """)).containsExactly(
            NAME, Python3Lexer.ASSIGN, NUMBER, NEWLINE,
            NAME, Python3Lexer.ASSIGN, NUMBER, NEWLINE, Token.EOF);
    }

    @Test
    void nextToken_missingFinalNewline_isSupplied() {
        assertThat(types("x = 1")).containsExactly(NAME, Python3Lexer.ASSIGN, NUMBER, NEWLINE, Token.EOF);
    }

    @Test
    void nextToken_fieldWithSameQuoteString_returnsToStringMode() {
        assertThat(types("f\"{\"nested\"} tail\"\n")).containsExactly(
            FSTRING_START, OPEN_BRACE, STRING, CLOSE_BRACE, FSTRING_MIDDLE, FSTRING_END, NEWLINE, Token.EOF);
    }

    @Test
    void nextToken_formatSpecWithNestedField_closesBothLevels() {
        assertThat(types("f'{x:{w}}'\n")).containsExactly(
            FSTRING_START, OPEN_BRACE, NAME, COLON, OPEN_BRACE, NAME, CLOSE_BRACE, CLOSE_BRACE, FSTRING_END,
            NEWLINE, Token.EOF);
    }

    @Test
    void nextToken_dictInsideField_keepsColonInExpression() {
        assertThat(types("f'{ {1: 2}[1] }'\n")).contains(COLON).endsWith(CLOSE_BRACE, FSTRING_END, NEWLINE, Token.EOF);
    }

    private static List<Integer> types(String source) {
        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(source));
        List<Integer> types = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            if (token.getChannel() == Token.DEFAULT_CHANNEL) {
                types.add(token.getType());
            }
        } while (token.getType() != Token.EOF);
        return types;
    }
}
