package com.pipesql.rq;

/**
 * Typed traversal over {@link Relation} variants.
 *
 * @param <R> result type
 */
public interface RelationVisitor<R> {

    R visitTableRef(Relation.TableRef table);

    R visitLiteralTable(Relation.LiteralTable table);

    R visitSelect(Relation.Select select);

    R visitFilter(Relation.Filter filter);

    R visitAggregate(Relation.Aggregate aggregate);

    R visitJoin(Relation.Join join);

    R visitSort(Relation.Sort sort);

    R visitTake(Relation.Take take);

    R visitWindow(Relation.Window window);

    R visitAppend(Relation.Append append);
}
