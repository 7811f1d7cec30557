package com.pipesql.pl;

import java.util.Objects;

/**
 * A range {@code start..end}; either bound may be absent.
 */
public record Range(Expr start, Expr end, SourceSpan span) implements Expr {

    public Range {
        Objects.requireNonNull(span, "span must not be null");
    }

    @Override
    public String toString() {
        return (start == null ? "" : start.toString()) + ".." + (end == null ? "" : end.toString());
    }
}
