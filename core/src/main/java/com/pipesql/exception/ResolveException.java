package com.pipesql.exception;

import com.pipesql.pl.SourceSpan;

/**
 * Raised when a parsed program cannot be bound to relations and columns.
 *
 * <p>The {@link Reason} classifies the failure; {@link #getName()} holds the
 * offending identifier where there is one.
 */
public class ResolveException extends PipeSqlException {

    /**
     * Classification of resolution failures.
     */
    public enum Reason {
        /** A name matches nothing in scope. */
        UNKNOWN_NAME,
        /** A bare name matches columns of more than one relation. */
        AMBIGUOUS_NAME,
        /** An argument or operand has the wrong kind, type or count. */
        TYPE_MISMATCH,
        /** Function inlining exceeded the configured depth. */
        RECURSION_LIMIT_EXCEEDED,
        /** A relation definition depends on itself. */
        CYCLIC_RELATION_REFERENCE
    }

    private final Reason reason;
    private final String name;

    public ResolveException(Reason reason, String name, String message, SourceSpan span) {
        super(message, span);
        this.reason = reason;
        this.name = name;
    }

    public static ResolveException unknownName(String name, SourceSpan span) {
        return new ResolveException(Reason.UNKNOWN_NAME, name, "Unknown name `" + name + "`", span);
    }

    public static ResolveException ambiguousName(String name, String candidates, SourceSpan span) {
        return new ResolveException(Reason.AMBIGUOUS_NAME, name,
            "Ambiguous name `%s`, could be any of: %s".formatted(name, candidates), span);
    }

    public static ResolveException typeMismatch(String message, SourceSpan span) {
        return new ResolveException(Reason.TYPE_MISMATCH, null, message, span);
    }

    @Override
    public CompileStage stage() {
        return CompileStage.RESOLVE;
    }

    public Reason getReason() {
        return reason;
    }

    public String getName() {
        return name;
    }
}
