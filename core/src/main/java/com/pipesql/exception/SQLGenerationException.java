package com.pipesql.exception;

import com.pipesql.rq.Relation;

/**
 * Exception thrown when SQL generation fails.
 *
 * <p>Common causes:
 * <ul>
 *   <li>The target dialect cannot express a construct (for instance OFFSET
 *       on a LIMIT-only dialect)</li>
 *   <li>The RQ handed to the generator violates its structural invariants</li>
 * </ul>
 *
 * @see com.pipesql.generator.SQLGenerator
 */
public class SQLGenerationException extends PipeSqlException {

    /**
     * Classification of generation failures.
     */
    public enum Reason {
        UNSUPPORTED_CONSTRUCT,
        INVALID_INPUT
    }

    private final Reason reason;
    private final String dialect;
    private final String construct;
    private final Relation failedRelation;

    private SQLGenerationException(Reason reason, String dialect, String construct,
                                   String message, Relation relation, Throwable cause) {
        super(message, null, cause);
        this.reason = reason;
        this.dialect = dialect;
        this.construct = construct;
        this.failedRelation = relation;
    }

    /**
     * Creates the error raised when a dialect lacks a capability.
     *
     * @param dialect name of the target dialect
     * @param construct the construct that cannot be expressed
     */
    public static SQLGenerationException unsupported(String dialect, String construct) {
        return new SQLGenerationException(Reason.UNSUPPORTED_CONSTRUCT, dialect, construct,
            "%s is not supported by dialect %s".formatted(construct, dialect), null, null);
    }

    /**
     * Creates the error raised for RQ that the generator cannot lower.
     *
     * @param message the error message
     * @param relation the relation being generated, may be null
     * @param cause the underlying cause, may be null
     */
    public static SQLGenerationException invalidInput(String message, Relation relation, Throwable cause) {
        String planType = relation != null ? relation.getClass().getSimpleName() : "null";
        return new SQLGenerationException(Reason.INVALID_INPUT, null, null,
            message + " (relation type: " + planType + ")", relation, cause);
    }

    @Override
    public CompileStage stage() {
        return CompileStage.GENERATE;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the dialect name for unsupported constructs, otherwise null.
     */
    public String getDialect() {
        return dialect;
    }

    public String getConstruct() {
        return construct;
    }

    /**
     * Returns the relation that failed to generate, or null if not available.
     */
    public Relation getFailedRelation() {
        return failedRelation;
    }
}
