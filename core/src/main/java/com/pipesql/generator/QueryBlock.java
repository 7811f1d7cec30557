package com.pipesql.generator;

import com.pipesql.rq.ColumnId;
import com.pipesql.rq.SortKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One SELECT statement under construction.
 *
 * <p>Relations are folded into the block while SQL clause order allows it;
 * when it does not, the generator finalizes the block as a CTE and starts a
 * new one reading from it.
 */
final class QueryBlock {

    /** How a column id is expressed inside this block. */
    sealed interface Entry permits Source, Computed {
    }

    /** A column read from a FROM or JOIN source. */
    record Source(String qualifier, String name) implements Entry {
    }

    /** A column computed by an expression that is inlined where it is used. */
    record Computed(ExpressionRenderer.Rendered rendered) implements Entry {
    }

    String from;
    /** The FROM source without its alias. */
    String fromSource;
    final List<String> joins = new ArrayList<>();
    final List<String> where = new ArrayList<>();
    final List<String> groupBy = new ArrayList<>();
    final List<String> having = new ArrayList<>();
    List<String> orderBy = new ArrayList<>();
    List<SortKey> orderKeys = List.of();
    Long limit;
    long offset;
    boolean aggregated;
    boolean joined;
    List<ColumnId> outputs = List.of();

    final Map<ColumnId, Entry> scope = new HashMap<>();
    /** Root wildcard id to the qualifier of the source it expands. */
    final Map<ColumnId, String> wildcardQualifiers = new HashMap<>();
    final Set<String> qualifiers = new HashSet<>();
    /**
     * Columns a source's {@code *} already yields, mapped to that wildcard's
     * root. Listing them next to the star would duplicate them.
     */
    final Map<ColumnId, ColumnId> starCovered = new HashMap<>();

    void setFrom(String source, String alias) {
        this.fromSource = source;
        this.from = alias == null ? source : source + " AS " + alias;
    }

    boolean isLimited() {
        return limit != null || offset > 0;
    }

    boolean hasWindow() {
        return scope.values().stream()
            .anyMatch(e -> e instanceof Computed computed && computed.rendered().window());
    }

    boolean hasComputed() {
        return scope.values().stream().anyMatch(e -> e instanceof Computed);
    }

    /**
     * Returns whether another source can be joined to this block without
     * changing the meaning of clauses already in it.
     */
    boolean acceptsJoin() {
        return where.isEmpty() && !aggregated && groupBy.isEmpty() && orderBy.isEmpty()
            && !isLimited() && !hasComputed();
    }

    /** A single source with nothing applied to it. */
    boolean isPlainSource() {
        return joins.isEmpty() && acceptsJoin();
    }

    boolean hasOrder() {
        return !orderBy.isEmpty();
    }

    void setOrder(List<String> sql, List<SortKey> keys) {
        this.orderBy = new ArrayList<>(sql);
        this.orderKeys = List.copyOf(keys);
    }

    void clearOrder() {
        this.orderBy = new ArrayList<>();
        this.orderKeys = List.of();
    }
}
