package com.pipesql.rq;

import java.util.List;
import java.util.Objects;

/**
 * Declaration of a column in the RQ arena.
 *
 * <p>{@code wildcard} links a column to the wildcard it was inferred from
 * ({@link ColumnKind#TABLE} columns) or, for a {@link ColumnKind#WILDCARD}
 * that excludes shadowed names, to the original wildcard. {@code excluded}
 * lists the names a wildcard no longer covers.
 *
 * @param id the column id
 * @param name display name, null for unnamed computed columns and wildcards
 * @param kind where the column comes from
 * @param type inferred type
 * @param wildcard related wildcard column, or null
 * @param excluded names excluded from a wildcard, empty otherwise
 */
public record ColumnDecl(ColumnId id, String name, ColumnKind kind, Ty type,
                         ColumnId wildcard, List<String> excluded) {

    public ColumnDecl {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(type, "type must not be null");
        excluded = excluded == null ? List.of() : List.copyOf(excluded);
    }

    public boolean isWildcard() {
        return kind == ColumnKind.WILDCARD;
    }

    /**
     * Returns the wildcard this column hangs under, following exclusion
     * chains to the original table wildcard; the column itself when it is an
     * original wildcard; null for ordinary columns.
     */
    public ColumnId rootWildcard() {
        if (kind == ColumnKind.WILDCARD) {
            return wildcard != null ? wildcard : id;
        }
        return wildcard;
    }
}
