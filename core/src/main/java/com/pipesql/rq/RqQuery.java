package com.pipesql.rq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Relational query: the fully resolved, dialect-neutral representation handed
 * to the SQL generator.
 *
 * <p>Relations and columns live in arenas indexed by {@link RelId} and
 * {@link ColumnId}. The main relation and each {@link DeclaredRelation} root
 * form trees; declared relations are shared by name through
 * {@link Relation.TableRef}, which makes the whole query a DAG.
 *
 * <p>Instances are immutable and only created by {@link RqBuilder#build}.
 */
public final class RqQuery {

    private final List<Relation> relations;
    private final List<ColumnDecl> columns;
    private final List<DeclaredRelation> declared;
    private final RelId main;

    RqQuery(List<Relation> relations, List<ColumnDecl> columns,
            List<DeclaredRelation> declared, RelId main) {
        this.relations = List.copyOf(relations);
        this.columns = List.copyOf(columns);
        this.declared = List.copyOf(declared);
        this.main = Objects.requireNonNull(main, "main must not be null");
    }

    public RelId main() {
        return main;
    }

    public Relation relation(RelId id) {
        return relations.get(id.index());
    }

    public ColumnDecl column(ColumnId id) {
        return columns.get(id.index());
    }

    public List<Relation> relations() {
        return Collections.unmodifiableList(relations);
    }

    public List<ColumnDecl> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Returns declared relations in dependency order: a relation only refers
     * to relations listed before it.
     */
    public List<DeclaredRelation> declaredRelations() {
        return Collections.unmodifiableList(declared);
    }

    public Optional<DeclaredRelation> declared(String name) {
        return declared.stream().filter(d -> d.name().equals(name)).findFirst();
    }

    /**
     * Returns the columns a relation produces, in order.
     */
    public List<ColumnId> outputColumns(RelId id) {
        Relation relation = relation(id);
        if (relation instanceof Relation.TableRef table) {
            return table.columns();
        } else if (relation instanceof Relation.LiteralTable table) {
            return table.columns();
        } else if (relation instanceof Relation.Select select) {
            return select.columns();
        } else if (relation instanceof Relation.Aggregate aggregate) {
            List<ColumnId> result = new ArrayList<>(aggregate.groupBy());
            aggregate.aggregations().forEach(c -> result.add(c.id()));
            return result;
        } else if (relation instanceof Relation.Join join) {
            return join.columns();
        } else if (relation instanceof Relation.Window window) {
            return window.columns();
        } else if (relation instanceof Relation.Append append) {
            return append.columns();
        }
        // Filter, Sort and Take keep their input's columns
        return outputColumns(relation.sources().get(0));
    }

    /**
     * Returns the table columns inferred through the given wildcard (or
     * through the wildcard it excludes names from).
     */
    public List<ColumnDecl> inferredColumns(ColumnId wildcard) {
        ColumnId root = column(wildcard).rootWildcard();
        return columns.stream()
            .filter(c -> c.kind() == ColumnKind.TABLE && root.equals(c.wildcard()))
            .toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RqQuery(main=").append(main).append(")\n");
        for (DeclaredRelation decl : declared) {
            sb.append("  let ").append(decl.name()).append(" = ").append(decl.root()).append('\n');
        }
        for (int i = 0; i < relations.size(); i++) {
            sb.append("  r").append(i).append(": ").append(relations.get(i)).append('\n');
        }
        return sb.toString();
    }
}
