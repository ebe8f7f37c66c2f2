package com.docforge.core.parser;

import com.docforge.core.parser.PythonAst.Module;
import com.docforge.parser.Python3Lexer;
import com.docforge.parser.Python3Parser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Parses Python 3 source into a {@link PythonAst.Module} using the ANTLR Python grammar.
 *
 * <p>Covers the language up to Python 3.12, including decorators, {@code async} forms,
 * positional-only and keyword-only parameters, walrus, {@code match} (patterns kept as text),
 * {@code type} aliases and PEP 701 f-strings.
 *
 * <p>Any lexical or syntax error aborts the whole parse with a {@link SourceParseException};
 * no partial tree is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PythonAst.Module module = PythonAstParser.parse(source);
 * }</pre>
 */
public final class PythonAstParser {

    private PythonAstParser() {
        // Utility class - no instantiation
    }

    /**
     * Parses a complete source file.
     *
     * @param source Python source text
     * @return module tree
     * @throws SourceParseException on the first lexical or syntax error
     */
    public static Module parse(String source) {
        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        Python3Parser parser = new Python3Parser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        Python3Parser.File_inputContext tree = parser.file_input();
        return new PythonAstBuilder(new SourceText(source), tokens).module(tree);
    }

    /**
     * Turns the first error ANTLR reports into a {@link SourceParseException}.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new SourceParseException(diagnostic(recognizer, offendingSymbol, msg), line, charPositionInLine + 1);
        }

        private static String diagnostic(Recognizer<?, ?> recognizer, Object offendingSymbol, String msg) {
            if (!(offendingSymbol instanceof Token token) || !(recognizer instanceof Parser parser)) {
                return msg;
            }
            if (token.getType() == Python3Lexer.INDENT) {
                return "unexpected indent";
            }
            if (token.getType() == Token.EOF
                || (token.getType() == Python3Lexer.NEWLINE && token.getStartIndex() > token.getStopIndex())) {
                return "unexpected EOF while parsing";
            }
            if (parser.getExpectedTokens().contains(Python3Lexer.INDENT)) {
                return "expected an indented block";
            }
            return msg;
        }
    }
}
