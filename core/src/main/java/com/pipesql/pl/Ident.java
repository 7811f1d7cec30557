package com.pipesql.pl;

import java.util.List;
import java.util.Objects;

/**
 * A possibly qualified name such as {@code salary} or {@code e.salary}.
 */
public record Ident(List<String> parts, SourceSpan span) implements Expr {

    public Ident {
        Objects.requireNonNull(parts, "parts must not be null");
        Objects.requireNonNull(span, "span must not be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("identifier must have at least one part");
        }
        parts = List.copyOf(parts);
    }

    public static Ident of(String... parts) {
        return new Ident(List.of(parts), SourceSpan.SYNTHETIC);
    }

    /**
     * Returns the last part, the name proper.
     */
    public String name() {
        return parts.get(parts.size() - 1);
    }

    /**
     * Returns everything before the last part joined with dots, or null for
     * a bare name.
     */
    public String qualifier() {
        if (parts.size() == 1) {
            return null;
        }
        return String.join(".", parts.subList(0, parts.size() - 1));
    }

    public boolean isQualified() {
        return parts.size() > 1;
    }

    public String fullName() {
        return String.join(".", parts);
    }

    @Override
    public String toString() {
        return fullName();
    }
}
