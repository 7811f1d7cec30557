package com.pipesql.rq;

import java.util.List;
import java.util.Objects;

/**
 * Relational node of the RQ arena.
 *
 * <p>Relations refer to their inputs by {@link RelId}. Each variant either
 * stores its output columns or, for row-preserving operators
 * ({@link Filter}, {@link Sort}, {@link Take}), passes its source's columns
 * through unchanged; see {@link RqQuery#outputColumns(RelId)}.
 */
public sealed interface Relation {

    /**
     * Returns the ids of the relations this one reads from, left to right.
     */
    List<RelId> sources();

    <R> R accept(RelationVisitor<R> visitor);

    /**
     * Reads a table.
     *
     * @param name table name, or the name of a {@link DeclaredRelation}
     * @param declared whether {@code name} refers to a declared relation
     * @param alias alias given in the query, or null
     * @param columns columns read; a declared relation's columns align by
     *                position with its output columns
     */
    record TableRef(String name, boolean declared, String alias, List<ColumnId> columns) implements Relation {
        public TableRef {
            Objects.requireNonNull(name, "name must not be null");
            columns = List.copyOf(columns);
        }

        @Override
        public List<RelId> sources() {
            return List.of();
        }

        @Override
        public <R> R accept(RelationVisitor<R> visitor) {
            return visitor.visitTableRef(this);
        }
    }

    /**
     * Inline rows of constants.
     */
    record LiteralTable(List<List<RqExpr>> rows, List<ColumnId> columns) implements Relation {
        public LiteralTable {
            rows = rows.stream().map(List::copyOf).toList();
            columns = List.copyOf(columns);
        }

        @Override
        public List<RelId> sources() {
            return List.of();
        }

        @Override
        public <R> R accept(RelationVisitor<R> visitor) {
            return visitor.visitLiteralTable(this);
        }
    }

    /**
     * Projection: introduces {@code computes} and outputs exactly
     * {@code columns} in order.
     */
    record Select(RelId source, List<Compute> computes, List<ColumnId> columns) implements Relation {
        public Select {
            Objects.requireNonNull(source, "source must not be null");
            computes = List.copyOf(computes);
            columns = List.copyOf(columns);
        }

        @Override
        public List<RelId> sources() {
            return List.of(source);
        }

        @Override
        public <R> R accept(RelationVisitor<R> visitor) {
            return visitor.visitSelect(this);
        }
    }

    record Filter(RelId source, RqExpr predicate) implements Relation {
        public Filter {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(predicate, "predicate must not be null");
        }

        @Override
        public List<RelId> sources() {
            return List.of(source);
        }

        @Override
        public <R> R accept(RelationVisitor<R> visitor) {
            return visitor.visitFilter(this);
        }
    }

    /**
     * Grouping. Outputs the group-by columns followed by the aggregations.
     */
    record Aggregate(RelId source, List<ColumnId> groupBy, List<Compute> aggregations) implements Relation {
        public Aggregate {
            Objects.requireNonNull(source, "source must not be null");
            groupBy = List.copyOf(groupBy);
            aggregations = List.copyOf(aggregations);
        }

        @Override
        public List<RelId> sources() {
            return List.of(source);
        }

        @Override
        public <R> R accept(RelationVisitor<R> visitor) {
            return visitor.visitAggregate(this);
        }
    }

    /**
     * Join of two relations. {@code computes} holds columns merged from both
     * sides (equal-name full joins).
     */
    record Join(JoinSide side, RelId left, RelId right, RqExpr condition,
                List<Compute> computes, List<ColumnId> columns) implements Relation {
        public Join {
            Objects.requireNonNull(side, "side must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
            Objects.requireNonNull(condition, "condition must not be null");
            computes = List.copyOf(computes);
            columns = List.copyOf(columns);
        }

        @Override
        public List<RelId> sources() {
            return List.of(left, right);
        }

        @Override
        public <R> R accept(RelationVisitor<R> visitor) {
            return visitor.visitJoin(this);
        }
    }

    record Sort(RelId source, List<SortKey> keys) implements Relation {
        public Sort {
            Objects.requireNonNull(source, "source must not be null");
            keys = List.copyOf(keys);
        }

        @Override
        public List<RelId> sources() {
            return List.of(source);
        }

        @Override
        public <R> R accept(RelationVisitor<R> visitor) {
            return visitor.visitSort(this);
        }
    }

    /**
     * Row limit. {@code offset} rows are skipped, then at most {@code limit}
     * (null for no limit) are kept, in the order given by {@code sort}.
     */
    record Take(RelId source, long offset, Long limit, List<SortKey> sort) implements Relation {
        public Take {
            Objects.requireNonNull(source, "source must not be null");
            if (offset < 0) {
                throw new IllegalArgumentException("offset must not be negative");
            }
            sort = List.copyOf(sort);
        }

        @Override
        public List<RelId> sources() {
            return List.of(source);
        }

        @Override
        public <R> R accept(RelationVisitor<R> visitor) {
            return visitor.visitTake(this);
        }
    }

    /**
     * Introduces windowed computes over the given partition, order and frame.
     */
    record Window(RelId source, List<RqExpr> partitionBy, List<SortKey> orderBy, WindowFrame frame,
                  List<Compute> computes, List<ColumnId> columns) implements Relation {
        public Window {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(frame, "frame must not be null");
            partitionBy = List.copyOf(partitionBy);
            orderBy = List.copyOf(orderBy);
            computes = List.copyOf(computes);
            columns = List.copyOf(columns);
        }

        @Override
        public List<RelId> sources() {
            return List.of(source);
        }

        @Override
        public <R> R accept(RelationVisitor<R> visitor) {
            return visitor.visitWindow(this);
        }
    }

    /**
     * Concatenation ({@code UNION ALL}). Columns align by position.
     */
    record Append(RelId top, RelId bottom, List<ColumnId> columns) implements Relation {
        public Append {
            Objects.requireNonNull(top, "top must not be null");
            Objects.requireNonNull(bottom, "bottom must not be null");
            columns = List.copyOf(columns);
        }

        @Override
        public List<RelId> sources() {
            return List.of(top, bottom);
        }

        @Override
        public <R> R accept(RelationVisitor<R> visitor) {
            return visitor.visitAppend(this);
        }
    }
}
