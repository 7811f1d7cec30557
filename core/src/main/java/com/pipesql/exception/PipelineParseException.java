package com.pipesql.exception;

import com.pipesql.pl.SourceSpan;

/**
 * Raised when the source text is not a well-formed program.
 */
public class PipelineParseException extends PipeSqlException {

    private final int line;
    private final int column;
    private final String offendingText;

    /**
     * Creates a parse exception.
     *
     * @param line one-based line of the error
     * @param column zero-based column of the error
     * @param offendingText the token text at the error, or empty
     * @param message description of the problem
     */
    public PipelineParseException(int line, int column, String offendingText, String message) {
        super(message, new SourceSpan(0, 0, line, column));
        this.line = line;
        this.column = column;
        this.offendingText = offendingText == null ? "" : offendingText;
    }

    @Override
    public CompileStage stage() {
        return CompileStage.PARSE;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getOffendingText() {
        return offendingText;
    }
}
