package com.pipesql.parser;

import com.pipesql.exception.PipelineParseException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Turns the first lexer or parser error into a {@link PipelineParseException}.
 *
 * <p>ANTLR's default listener prints to stderr and lets the parser recover;
 * the compiler instead stops at the first error and reports its position.
 * Line and column are translated by the origin of the text being parsed, so
 * errors inside interpolated strings point into the enclosing source.
 */
class PipelineErrorListener extends BaseErrorListener {

    private final int lineOffset;
    private final int columnOffset;

    PipelineErrorListener() {
        this(0, 0);
    }

    PipelineErrorListener(int lineOffset, int columnOffset) {
        this.lineOffset = lineOffset;
        this.columnOffset = columnOffset;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg,
                            RecognitionException e) {
        String text = "";
        String message = msg;
        if (offendingSymbol instanceof Token token) {
            if (token.getType() == Token.EOF) {
                message = "unexpected end of input";
            } else {
                text = token.getText();
                message = "unexpected `%s`".formatted(printable(text));
            }
        }
        int column = line == 1 ? charPositionInLine + columnOffset : charPositionInLine;
        throw new PipelineParseException(line + lineOffset, column, text, message);
    }

    private static String printable(String text) {
        return text.replace("\n", "\\n").replace("\r", "\\r");
    }
}
