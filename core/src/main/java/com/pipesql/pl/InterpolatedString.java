package com.pipesql.pl;

import java.util.List;
import java.util.Objects;

/**
 * An s-string ({@code s"..."}, raw SQL) or f-string ({@code f"..."}, text
 * concatenation) with {@code {expr}} holes.
 */
public record InterpolatedString(Flavor flavor, List<Part> parts, SourceSpan span) implements Expr {

    public InterpolatedString {
        Objects.requireNonNull(flavor, "flavor must not be null");
        Objects.requireNonNull(parts, "parts must not be null");
        Objects.requireNonNull(span, "span must not be null");
        parts = List.copyOf(parts);
    }

    public enum Flavor {
        /** Raw SQL with interpolated expressions. */
        SQL,
        /** String formatting, lowered to concatenation. */
        FORMAT
    }

    public sealed interface Part permits Text, Hole {
    }

    public record Text(String text) implements Part {
    }

    public record Hole(Expr expr) implements Part {
    }
}
