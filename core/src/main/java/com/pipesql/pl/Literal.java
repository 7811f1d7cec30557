package com.pipesql.pl;

import java.util.Objects;

/**
 * A literal constant.
 *
 * <p>The value is a {@code Long}, {@code Double}, {@code Boolean} or
 * {@code String} depending on the kind. Dates, times and timestamps keep
 * their source text (without the leading {@code @}). Null literals carry a
 * null value.
 */
public record Literal(Object value, LiteralKind kind, SourceSpan span) implements Expr {

    public Literal {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(span, "span must not be null");
        if (value == null && kind != LiteralKind.NULL) {
            throw new IllegalArgumentException("only NULL literals may have a null value");
        }
    }

    public static Literal of(long value) {
        return new Literal(value, LiteralKind.INTEGER, SourceSpan.SYNTHETIC);
    }

    public static Literal ofString(String value) {
        return new Literal(value, LiteralKind.STRING, SourceSpan.SYNTHETIC);
    }

    @Override
    public String toString() {
        if (kind == LiteralKind.STRING) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }
}
