package com.pipesql.rq;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable arena used by the resolver to assemble an {@link RqQuery}.
 *
 * <p>Relations must be added after their sources, so a source id is always
 * smaller than the id of the relation reading it; this keeps every tree
 * acyclic by construction. {@link #build(RelId)} verifies the structural
 * invariants before handing out the immutable query.
 */
public final class RqBuilder {

    private final List<Relation> relations = new ArrayList<>();
    private final List<ColumnDecl> columns = new ArrayList<>();
    private final List<DeclaredRelation> declared = new ArrayList<>();

    public RelId add(Relation relation) {
        relations.add(relation);
        return new RelId(relations.size() - 1);
    }

    public Relation relation(RelId id) {
        return relations.get(id.index());
    }

    /**
     * Replaces a table reference, used when a column is inferred through a
     * wildcard after the reference was created.
     */
    public void replaceTable(RelId id, Relation.TableRef table) {
        if (!(relations.get(id.index()) instanceof Relation.TableRef)) {
            throw new IllegalArgumentException(id + " is not a table reference");
        }
        relations.set(id.index(), table);
    }

    public ColumnId newColumn(String name, ColumnKind kind, Ty type, ColumnId wildcard, List<String> excluded) {
        ColumnId id = new ColumnId(columns.size());
        columns.add(new ColumnDecl(id, name, kind, type, wildcard, excluded));
        return id;
    }

    public ColumnId tableColumn(String name, Ty type) {
        return newColumn(name, ColumnKind.TABLE, type, null, List.of());
    }

    public ColumnId wildcard() {
        return newColumn(null, ColumnKind.WILDCARD, Ty.UNKNOWN, null, List.of());
    }

    public ColumnId computed(String name, Ty type) {
        return newColumn(name, ColumnKind.COMPUTED, type, null, List.of());
    }

    public ColumnDecl column(ColumnId id) {
        return columns.get(id.index());
    }

    public void declare(String name, RelId root) {
        declared.add(new DeclaredRelation(name, root));
    }

    public boolean isDeclared(String name) {
        return declared.stream().anyMatch(d -> d.name().equals(name));
    }

    /**
     * Returns the relation produced so far for the given declared name.
     */
    public RelId declaredRoot(String name) {
        return declared.stream()
            .filter(d -> d.name().equals(name))
            .map(DeclaredRelation::root)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Undeclared relation: " + name));
    }

    /**
     * Validates the arena and freezes it.
     *
     * @param main the relation producing the query result
     * @return the immutable query
     * @throws IllegalStateException if an invariant is violated
     */
    public RqQuery build(RelId main) {
        Set<RelId> consumed = new HashSet<>();
        for (int i = 0; i < relations.size(); i++) {
            Relation relation = relations.get(i);
            for (RelId source : relation.sources()) {
                if (source.index() >= i) {
                    throw new IllegalStateException("Relation r%d reads later relation %s".formatted(i, source));
                }
                if (!consumed.add(source)) {
                    throw new IllegalStateException("Relation %s is read more than once".formatted(source));
                }
            }
            for (ColumnId column : referencedColumns(relation)) {
                if (column.index() >= columns.size()) {
                    throw new IllegalStateException("Relation r%d references undeclared column %s".formatted(i, column));
                }
            }
            if (relation instanceof Relation.TableRef table && table.declared()) {
                checkDeclaredOrder(new RelId(i), table.name());
            }
        }
        if (main.index() >= relations.size()) {
            throw new IllegalStateException("Main relation %s does not exist".formatted(main));
        }
        return new RqQuery(relations, columns, declared, main);
    }

    private void checkDeclaredOrder(RelId reference, String name) {
        RelId root = declared.stream()
            .filter(d -> d.name().equals(name))
            .map(DeclaredRelation::root)
            .reduce((first, second) -> second)
            .orElseThrow(() -> new IllegalStateException(
                "Reference to undeclared relation `%s`".formatted(name)));
        // roots are added before anything that reads them, so a cycle would need a forward reference
        if (root.index() >= reference.index()) {
            throw new IllegalStateException("Declared relations form a cycle through `%s`".formatted(name));
        }
    }

    private static List<ColumnId> referencedColumns(Relation relation) {
        List<ColumnId> result = new ArrayList<>();
        if (relation instanceof Relation.TableRef table) {
            result.addAll(table.columns());
        } else if (relation instanceof Relation.LiteralTable table) {
            result.addAll(table.columns());
        } else if (relation instanceof Relation.Select select) {
            select.computes().forEach(c -> collect(c, result));
            result.addAll(select.columns());
        } else if (relation instanceof Relation.Filter filter) {
            collect(filter.predicate(), result);
        } else if (relation instanceof Relation.Aggregate aggregate) {
            result.addAll(aggregate.groupBy());
            aggregate.aggregations().forEach(c -> collect(c, result));
        } else if (relation instanceof Relation.Join join) {
            collect(join.condition(), result);
            join.computes().forEach(c -> collect(c, result));
            result.addAll(join.columns());
        } else if (relation instanceof Relation.Sort sort) {
            sort.keys().forEach(k -> collect(k.expr(), result));
        } else if (relation instanceof Relation.Take take) {
            take.sort().forEach(k -> collect(k.expr(), result));
        } else if (relation instanceof Relation.Window window) {
            window.partitionBy().forEach(e -> collect(e, result));
            window.orderBy().forEach(k -> collect(k.expr(), result));
            window.computes().forEach(c -> collect(c, result));
            result.addAll(window.columns());
        } else if (relation instanceof Relation.Append append) {
            result.addAll(append.columns());
        }
        return result;
    }

    private static void collect(Compute compute, List<ColumnId> into) {
        into.add(compute.id());
        collect(compute.expr(), into);
    }

    /**
     * Adds every column referenced by the expression to {@code into}.
     */
    public static void collect(RqExpr expr, List<ColumnId> into) {
        if (expr instanceof RqExpr.ColumnRef ref) {
            into.add(ref.column());
        } else if (expr instanceof RqExpr.Unary unary) {
            collect(unary.operand(), into);
        } else if (expr instanceof RqExpr.Binary binary) {
            collect(binary.left(), into);
            collect(binary.right(), into);
        } else if (expr instanceof RqExpr.FunctionCall call) {
            call.args().forEach(a -> collect(a, into));
        } else if (expr instanceof RqExpr.Case caseExpr) {
            for (RqExpr.Branch branch : caseExpr.branches()) {
                collect(branch.condition(), into);
                collect(branch.value(), into);
            }
            if (caseExpr.otherwise() != null) {
                collect(caseExpr.otherwise(), into);
            }
        } else if (expr instanceof RqExpr.Between between) {
            collect(between.operand(), into);
            collect(between.low(), into);
            collect(between.high(), into);
        } else if (expr instanceof RqExpr.RawSql raw) {
            raw.parts().stream()
                .filter(RqExpr.class::isInstance)
                .forEach(p -> collect((RqExpr) p, into));
        }
    }
}
