package com.pipesql.exception;

import com.pipesql.pl.SourceSpan;

/**
 * Base class of every error the compiler reports.
 *
 * <p>Each subclass belongs to exactly one {@link CompileStage}, so callers of
 * {@code compile} can tell which stage failed without inspecting messages.
 * Errors are unchecked: the compiler fails fast on the first problem and the
 * exception carries everything needed to report it.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       String sql = PipeSql.compile(source, options);
 *   } catch (PipeSqlException e) {
 *       System.err.println(e.stage() + " error: " + e.getUserMessage());
 *   }
 * </pre>
 */
public abstract class PipeSqlException extends RuntimeException {

    private final SourceSpan span;

    protected PipeSqlException(String message, SourceSpan span) {
        super(message);
        this.span = span;
    }

    protected PipeSqlException(String message, SourceSpan span, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    /**
     * Returns the stage that raised this error.
     */
    public abstract CompileStage stage();

    /**
     * Returns the source location of the offending construct, or null when
     * the error has no source position (e.g. generation from a hand-built
     * RQ).
     */
    public SourceSpan span() {
        return span;
    }

    /**
     * Returns a message suitable for end users, prefixed with the location
     * when one is known.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        if (span == null || span.equals(SourceSpan.SYNTHETIC)) {
            return getMessage();
        }
        return "line %d, column %d: %s".formatted(span.line(), span.column(), getMessage());
    }
}
