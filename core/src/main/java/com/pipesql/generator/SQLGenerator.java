package com.pipesql.generator;

import com.pipesql.dialect.DialectDescriptor;
import com.pipesql.dialect.LimitStyle;
import com.pipesql.exception.PipeSqlException;
import com.pipesql.exception.SQLGenerationException;
import com.pipesql.rq.ColumnDecl;
import com.pipesql.rq.ColumnId;
import com.pipesql.rq.ColumnKind;
import com.pipesql.rq.Compute;
import com.pipesql.rq.DeclaredRelation;
import com.pipesql.rq.RelId;
import com.pipesql.rq.Relation;
import com.pipesql.rq.RelationVisitor;
import com.pipesql.rq.RqBuilder;
import com.pipesql.rq.RqExpr;
import com.pipesql.rq.RqOperator;
import com.pipesql.rq.RqQuery;
import com.pipesql.rq.SortKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SQL generator that lowers a resolved relational query (RQ) to a single SQL
 * statement for one dialect.
 *
 * <p>Relations are folded bottom-up into {@link QueryBlock}s. A relation is
 * added to the current block while the clause order of a SELECT statement
 * preserves pipeline semantics; otherwise the block is finalized as a common
 * table expression named {@code table_N} and a new block reads from it.
 * Declared relations become CTEs under their own names.
 *
 * <p>Output is a single line; {@link SqlFormatter} lays it out for reading.
 *
 * <p>This class is not thread-safe. Use one instance per thread or per
 * query.
 *
 * @see ExpressionRenderer
 * @see SQLQuoting
 */
public class SQLGenerator implements RelationVisitor<QueryBlock> {

    private static final Logger logger = LoggerFactory.getLogger(SQLGenerator.class);

    private record Cte(String name, String sql) {
    }

    private final DialectDescriptor dialect;

    private final List<Cte> ctes = new ArrayList<>();
    private final Map<String, List<String>> declaredOutputs = new HashMap<>();
    private final Map<String, String> declaredSql = new HashMap<>();
    private RqQuery query;
    private ExpressionRenderer renderer;
    private Relation current;
    private int tableCounter;
    private int exprCounter;

    public SQLGenerator(DialectDescriptor dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    /**
     * Generates SQL for a resolved query.
     *
     * @param query the relational query
     * @return SQL text without a trailing newline
     * @throws SQLGenerationException if the dialect cannot express the query
     *         or the query is malformed
     * @throws IllegalArgumentException if the query is null
     */
    public String generate(RqQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }

        // Reset state for each generation
        this.query = query;
        this.renderer = new ExpressionRenderer(dialect, query);
        this.ctes.clear();
        this.declaredOutputs.clear();
        this.declaredSql.clear();
        this.current = null;
        this.tableCounter = 0;
        this.exprCounter = 0;

        logger.debug("Generating {} SQL for {} relations", dialect.name(), query.relations().size());
        try {
            for (DeclaredRelation declared : query.declaredRelations()) {
                QueryBlock block = build(declared.root());
                List<String> names = uniqueNames(block);
                String sql = selectSql(block, names);
                declaredOutputs.put(declared.name(), names);
                declaredSql.put(declared.name(), sql);
                if (dialect.supportsCte()) {
                    ctes.add(new Cte(declared.name(), sql));
                }
            }

            QueryBlock main = build(query.main());
            String body = selectSql(main, displayNames(main));
            String sql = ctes.isEmpty() ? body : withClause() + " " + body;
            logger.debug("Generated SQL: {}", sql);
            return sql;

        } catch (PipeSqlException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw SQLGenerationException.invalidInput(
                "Unexpected error during SQL generation: " + e.getMessage(), current, e);
        }
    }

    private String withClause() {
        return "WITH " + ctes.stream()
            .map(cte -> quote(cte.name()) + " AS (" + cte.sql() + ")")
            .collect(Collectors.joining(", "));
    }

    private QueryBlock build(RelId id) {
        Relation relation = query.relation(id);
        return relation.accept(this);
    }

    // ==================== Sources ====================

    @Override
    public QueryBlock visitTableRef(Relation.TableRef table) {
        current = table;
        QueryBlock block = new QueryBlock();
        String qualifier;
        List<String> names = null;
        if (table.declared()) {
            names = declaredOutputs.get(table.name());
            if (names == null) {
                throw new IllegalStateException("Relation `" + table.name() + "` used before its declaration");
            }
            qualifier = quote(table.alias() != null ? table.alias() : table.name());
            if (dialect.supportsCte()) {
                block.setFrom(quote(table.name()), table.alias() != null ? qualifier : null);
            } else {
                block.setFrom("(" + declaredSql.get(table.name()) + ")", qualifier);
            }
        } else {
            String tableName = SQLQuoting.quoteTableName(table.name(), dialect);
            qualifier = table.alias() != null ? quote(table.alias()) : tableName;
            block.setFrom(tableName, table.alias() != null ? qualifier : null);
        }
        block.qualifiers.add(qualifier);

        if (names != null) {
            bindOutputs(block, table.columns(), names, qualifier);
            return block;
        }
        for (ColumnId id : table.columns()) {
            ColumnDecl decl = query.column(id);
            if (decl.kind() == ColumnKind.WILDCARD) {
                block.wildcardQualifiers.put(decl.rootWildcard(), qualifier);
            } else {
                block.scope.put(id, new QueryBlock.Source(qualifier, decl.name()));
            }
        }
        block.outputs = table.columns();
        return block;
    }

    @Override
    public QueryBlock visitLiteralTable(Relation.LiteralTable table) {
        current = table;
        QueryBlock empty = new QueryBlock();
        List<String> names = table.columns().stream()
            .map(id -> query.column(id).name())
            .toList();
        List<String> rows = new ArrayList<>();
        for (List<RqExpr> row : table.rows()) {
            List<String> items = new ArrayList<>();
            for (int i = 0; i < row.size(); i++) {
                items.add(renderer.render(row.get(i), empty).sql() + " AS " + quote(names.get(i)));
            }
            rows.add("SELECT " + String.join(", ", items));
        }
        String name = nextTableName();
        QueryBlock block = new QueryBlock();
        registerSubquery(block, name, String.join(" UNION ALL ", rows));
        String qualifier = quote(name);
        block.qualifiers.add(qualifier);
        for (int i = 0; i < names.size(); i++) {
            block.scope.put(table.columns().get(i), new QueryBlock.Source(qualifier, names.get(i)));
        }
        block.outputs = table.columns();
        return block;
    }

    // ==================== Transforms ====================

    @Override
    public QueryBlock visitSelect(Relation.Select select) {
        Relation.Take bound = rowBound(select);
        if (bound != null) {
            QueryBlock block = visitTake(bound);
            current = select;
            block.outputs = select.columns();
            return block;
        }
        QueryBlock block = build(select.source());
        current = select;
        for (Compute compute : select.computes()) {
            block.scope.put(compute.id(), new QueryBlock.Computed(renderer.render(compute.expr(), block)));
        }
        block.outputs = select.columns();
        return block;
    }

    @Override
    public QueryBlock visitFilter(Relation.Filter filter) {
        QueryBlock block = build(filter.source());
        current = filter;
        // WHERE runs before LIMIT and window functions, so those force a new block
        if (block.isLimited() || block.hasWindow()) {
            block = split(block);
        }
        ExpressionRenderer.Rendered predicate = renderer.render(filter.predicate(), block);
        if (predicate.window()) {
            block = split(block);
            predicate = renderer.render(filter.predicate(), block);
        }
        String sql = ExpressionRenderer.wrap(predicate, ExpressionRenderer.AND);
        if (block.aggregated) {
            block.having.add(sql);
        } else {
            block.where.add(sql);
        }
        return block;
    }

    @Override
    public QueryBlock visitAggregate(Relation.Aggregate aggregate) {
        QueryBlock block = build(aggregate.source());
        current = aggregate;
        if (block.aggregated || block.isLimited() || block.hasWindow()) {
            block = split(block);
        }
        for (ColumnId key : aggregate.groupBy()) {
            block.groupBy.add(renderer.column(block, key).sql());
        }
        for (Compute compute : aggregate.aggregations()) {
            ExpressionRenderer.Rendered rendered = renderer.render(compute.expr(), block);
            block.scope.put(compute.id(), new QueryBlock.Computed(rendered));
        }
        block.aggregated = true;
        block.clearOrder();
        List<ColumnId> outputs = new ArrayList<>(aggregate.groupBy());
        aggregate.aggregations().forEach(c -> outputs.add(c.id()));
        block.outputs = outputs;
        return block;
    }

    @Override
    public QueryBlock visitSort(Relation.Sort sort) {
        QueryBlock block = build(sort.source());
        current = sort;
        if (block.isLimited()) {
            block = split(block);
        }
        block.setOrder(renderer.orderBy(sort.keys(), block), sort.keys());
        return block;
    }

    @Override
    public QueryBlock visitTake(Relation.Take take) {
        QueryBlock block = build(take.source());
        current = take;
        if (take.offset() > 0 && !dialect.supportsOffset()) {
            throw SQLGenerationException.unsupported(dialect.name(), "OFFSET");
        }
        if (block.isLimited()) {
            block = split(block);
        }
        if (!block.hasOrder() && !take.sort().isEmpty()) {
            block.setOrder(renderer.orderBy(take.sort(), block), take.sort());
        }
        block.limit = take.limit();
        block.offset = take.offset();
        return block;
    }

    @Override
    public QueryBlock visitWindow(Relation.Window window) {
        QueryBlock source = build(window.source());
        current = window;
        boolean windowed = window.computes().stream().anyMatch(Compute::windowed);
        if (windowed && !dialect.supportsWindowFunctions()) {
            throw SQLGenerationException.unsupported(dialect.name(), "window functions");
        }
        QueryBlock block = source.isLimited() || referencesWindow(source, window) ? split(source) : source;

        List<String> spec = new ArrayList<>();
        if (!window.partitionBy().isEmpty()) {
            spec.add("PARTITION BY " + window.partitionBy().stream()
                .map(e -> renderer.render(e, block).sql())
                .collect(Collectors.joining(", ")));
        }
        if (!window.orderBy().isEmpty()) {
            spec.add("ORDER BY " + String.join(", ", renderer.orderBy(window.orderBy(), block)));
        }
        ExpressionRenderer.Over over = new ExpressionRenderer.Over(
            String.join(" ", spec), renderer.frame(window.frame(), !window.orderBy().isEmpty()));

        for (Compute compute : window.computes()) {
            ExpressionRenderer.Rendered rendered = compute.windowed()
                ? renderer.render(compute.expr(), block, over)
                : renderer.render(compute.expr(), block);
            block.scope.put(compute.id(), new QueryBlock.Computed(rendered));
        }
        block.outputs = window.columns();
        return block;
    }

    /**
     * Matches a row range bounded by an unpartitioned, unordered
     * {@code row_number}, with the row number dropped afterwards. Such a
     * bound means the same as a plain limit and is returned as one; other
     * selects return null.
     */
    private Relation.Take rowBound(Relation.Select select) {
        if (!select.computes().isEmpty()
                || !(query.relation(select.source()) instanceof Relation.Filter filter)
                || !(query.relation(filter.source()) instanceof Relation.Window window)
                || !window.partitionBy().isEmpty() || !window.orderBy().isEmpty()
                || window.computes().size() != 1) {
            return null;
        }
        Compute compute = window.computes().get(0);
        if (!(compute.expr() instanceof RqExpr.FunctionCall call) || !"row_number".equals(call.name())
                || !call.args().isEmpty() || select.columns().contains(compute.id())) {
            return null;
        }
        RqExpr rowNumber = new RqExpr.ColumnRef(compute.id());
        if (filter.predicate() instanceof RqExpr.Between between && rowNumber.equals(between.operand())
                && between.low() instanceof RqExpr.Constant low && low.value() instanceof Long first
                && between.high() instanceof RqExpr.Constant high && high.value() instanceof Long last
                && first >= 1) {
            return new Relation.Take(window.source(), first - 1, Math.max(0, last - first + 1), List.of());
        }
        if (filter.predicate() instanceof RqExpr.Binary binary && binary.operator() == RqOperator.GT
                && rowNumber.equals(binary.left())
                && binary.right() instanceof RqExpr.Constant skip && skip.value() instanceof Long offset
                && offset >= 0) {
            return new Relation.Take(window.source(), offset, null, List.of());
        }
        return null;
    }

    /**
     * Returns whether the window reads a column that is itself a window
     * result in this block; window calls cannot nest in one SELECT.
     */
    private boolean referencesWindow(QueryBlock block, Relation.Window window) {
        List<ColumnId> used = new ArrayList<>();
        window.partitionBy().forEach(e -> RqBuilder.collect(e, used));
        window.orderBy().forEach(k -> RqBuilder.collect(k.expr(), used));
        window.computes().forEach(c -> RqBuilder.collect(c.expr(), used));
        return used.stream().anyMatch(id -> block.scope.get(id) instanceof QueryBlock.Computed computed
            && computed.rendered().window());
    }

    @Override
    public QueryBlock visitJoin(Relation.Join join) {
        current = join;
        if (!dialect.supportsJoin(join.side())) {
            throw SQLGenerationException.unsupported(dialect.name(), join.side().sqlKeyword());
        }
        QueryBlock block = build(join.left());
        if (!block.acceptsJoin()) {
            block = split(block);
        }
        QueryBlock right = build(join.right());
        current = join;
        if (!right.isPlainSource()) {
            right = split(right);
        }

        String rightFrom = right.from;
        String rightQualifier = right.qualifiers.iterator().next();
        if (block.qualifiers.contains(rightQualifier)) {
            String renamed = uniqueQualifier(block, rightQualifier);
            rightFrom = right.fromSource + " AS " + renamed;
            requalify(right, rightQualifier, renamed);
            rightQualifier = renamed;
        }

        block.qualifiers.add(rightQualifier);
        block.scope.putAll(right.scope);
        block.wildcardQualifiers.putAll(right.wildcardQualifiers);
        block.starCovered.putAll(right.starCovered);
        block.joined = true;

        String condition = renderer.render(join.condition(), block).sql();
        block.joins.add(join.side().sqlKeyword() + " " + rightFrom + " ON " + condition);

        for (Compute compute : join.computes()) {
            block.scope.put(compute.id(), new QueryBlock.Computed(renderer.render(compute.expr(), block)));
        }
        block.outputs = join.columns();
        return block;
    }

    private String uniqueQualifier(QueryBlock block, String qualifier) {
        String base = unquote(qualifier);
        int suffix = 1;
        String candidate = quote(base + "_" + suffix);
        while (block.qualifiers.contains(candidate)) {
            suffix++;
            candidate = quote(base + "_" + suffix);
        }
        return candidate;
    }

    private static void requalify(QueryBlock block, String from, String to) {
        block.scope.replaceAll((id, entry) -> entry instanceof QueryBlock.Source source && source.qualifier().equals(from)
            ? new QueryBlock.Source(to, source.name())
            : entry);
        block.wildcardQualifiers.replaceAll((id, qualifier) -> qualifier.equals(from) ? to : qualifier);
        block.qualifiers.remove(from);
        block.qualifiers.add(to);
    }

    @Override
    public QueryBlock visitAppend(Relation.Append append) {
        QueryBlock top = build(append.top());
        QueryBlock bottom = build(append.bottom());
        current = append;
        List<String> names = uniqueNames(top);
        String topSql = unionBranch(top, names);
        String bottomSql = unionBranch(bottom, uniqueNames(bottom));

        String name = nextTableName();
        QueryBlock block = new QueryBlock();
        registerSubquery(block, name, topSql + " UNION ALL " + bottomSql);
        String qualifier = quote(name);
        block.qualifiers.add(qualifier);
        bindOutputs(block, append.columns(), names, qualifier);
        return block;
    }

    private String unionBranch(QueryBlock block, List<String> names) {
        String sql = selectSql(block, names);
        if (block.hasOrder() || block.isLimited()) {
            return "SELECT * FROM (" + sql + ") AS " + quote(nextTableName());
        }
        return sql;
    }

    // ==================== Splitting ====================

    /**
     * Finalizes a block as a named subquery and returns a fresh block reading
     * from it. An ordering without a limit moves to the outer block when its
     * keys are still visible there.
     */
    private QueryBlock split(QueryBlock inner) {
        List<SortKey> ordering = inner.orderKeys;
        if (!inner.isLimited()) {
            inner.clearOrder();
        }
        List<String> names = uniqueNames(inner);
        String name = nextTableName();
        logger.debug("Splitting query block into {}", name);

        QueryBlock outer = new QueryBlock();
        registerSubquery(outer, name, selectSql(inner, names));
        String qualifier = quote(name);
        outer.qualifiers.add(qualifier);
        bindOutputs(outer, inner.outputs, names, qualifier);

        if (!ordering.isEmpty() && isVisible(outer, ordering)) {
            outer.setOrder(renderer.orderBy(ordering, outer), ordering);
        }
        return outer;
    }

    /**
     * Binds the columns of a finalized subquery, read by position. When the
     * subquery selected a {@code *}, its other columns are reachable through
     * the star as well.
     */
    private void bindOutputs(QueryBlock block, List<ColumnId> columns, List<String> names, String qualifier) {
        ColumnId star = null;
        for (int i = 0; i < columns.size(); i++) {
            ColumnDecl decl = query.column(columns.get(i));
            if (decl.kind() == ColumnKind.WILDCARD) {
                block.wildcardQualifiers.put(decl.rootWildcard(), qualifier);
                star = star == null ? decl.rootWildcard() : star;
            } else {
                String name = names.get(i) != null ? names.get(i) : decl.name();
                block.scope.put(decl.id(), new QueryBlock.Source(qualifier, name));
            }
        }
        if (star != null) {
            for (ColumnId id : columns) {
                if (query.column(id).kind() != ColumnKind.WILDCARD) {
                    block.starCovered.put(id, star);
                }
            }
        }
        block.outputs = columns;
    }

    private boolean isVisible(QueryBlock block, List<SortKey> keys) {
        List<ColumnId> used = new ArrayList<>();
        keys.forEach(k -> RqBuilder.collect(k.expr(), used));
        for (ColumnId id : used) {
            ColumnDecl decl = query.column(id);
            boolean inferred = decl.kind() == ColumnKind.TABLE && decl.wildcard() != null
                && block.wildcardQualifiers.containsKey(decl.wildcard());
            if (!block.scope.containsKey(id) && !inferred) {
                return false;
            }
        }
        return true;
    }

    private void registerSubquery(QueryBlock block, String name, String sql) {
        if (dialect.supportsCte()) {
            ctes.add(new Cte(name, sql));
            block.setFrom(quote(name), null);
        } else {
            block.setFrom("(" + sql + ")", quote(name));
        }
    }

    private String nextTableName() {
        return "table_" + tableCounter++;
    }

    // ==================== SELECT Rendering ====================

    /**
     * Output names for a block that other SQL reads by name: unnamed
     * expressions get {@code _expr_N}, duplicates a numeric suffix.
     * Wildcard positions hold null.
     */
    private List<String> uniqueNames(QueryBlock block) {
        Set<String> used = new HashSet<>();
        List<String> names = new ArrayList<>();
        for (ColumnId id : block.outputs) {
            ColumnDecl decl = query.column(id);
            if (decl.kind() == ColumnKind.WILDCARD) {
                names.add(null);
                continue;
            }
            String base = decl.name() != null ? decl.name() : "_expr_" + exprCounter++;
            String name = base;
            int suffix = 1;
            while (!used.add(name.toLowerCase(Locale.ROOT))) {
                name = base + "_" + suffix++;
            }
            names.add(name);
        }
        return names;
    }

    private List<String> displayNames(QueryBlock block) {
        return block.outputs.stream()
            .map(id -> query.column(id).kind() == ColumnKind.WILDCARD ? null : query.column(id).name())
            .collect(Collectors.toList());
    }

    private String selectSql(QueryBlock block, List<String> names) {
        StringBuilder sql = new StringBuilder("SELECT ");
        LimitStyle style = dialect.limitStyle();
        if (style == LimitStyle.TOP && block.limit != null && block.offset == 0) {
            sql.append("TOP (").append(block.limit).append(") ");
        }
        sql.append(String.join(", ", selectList(block, names)));
        sql.append(" FROM ").append(block.from);
        for (String join : block.joins) {
            sql.append(' ').append(join);
        }
        if (!block.where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", block.where));
        }
        if (!block.groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", block.groupBy));
        }
        if (!block.having.isEmpty()) {
            sql.append(" HAVING ").append(String.join(" AND ", block.having));
        }
        if (!block.orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", block.orderBy));
        }
        appendLimit(sql, block);
        return sql.toString();
    }

    private List<String> selectList(QueryBlock block, List<String> names) {
        Map<ColumnId, ColumnDecl> stars = new HashMap<>();
        for (ColumnId id : block.outputs) {
            ColumnDecl decl = query.column(id);
            if (decl.kind() == ColumnKind.WILDCARD) {
                stars.putIfAbsent(decl.rootWildcard(), decl);
            }
        }

        List<String> items = new ArrayList<>();
        for (int i = 0; i < block.outputs.size(); i++) {
            ColumnDecl decl = query.column(block.outputs.get(i));
            if (decl.kind() == ColumnKind.WILDCARD) {
                items.add(star(block, decl));
                continue;
            }
            String name = names.get(i);
            if (isCoveredByStar(block, decl, name, stars)) {
                continue;
            }
            String expr = renderer.column(block, decl.id()).sql();
            if (name == null) {
                items.add(expr);
                continue;
            }
            String quoted = quote(name);
            if (expr.equals(quoted) || expr.endsWith("." + quoted)) {
                items.add(expr);
            } else {
                items.add(expr + " AS " + quoted);
            }
        }
        if (items.isEmpty()) {
            items.add("NULL");
        }
        return items;
    }

    private static boolean isCoveredByStar(QueryBlock block, ColumnDecl decl, String name,
                                           Map<ColumnId, ColumnDecl> stars) {
        ColumnId root = block.starCovered.get(decl.id());
        if (root == null || !stars.containsKey(root)) {
            return false;
        }
        QueryBlock.Entry entry = block.scope.get(decl.id());
        if (!(entry instanceof QueryBlock.Source source)) {
            return false;
        }
        return (name == null || name.equals(source.name()))
            && !stars.get(root).excluded().contains(source.name());
    }

    private String star(QueryBlock block, ColumnDecl wildcard) {
        ColumnId root = wildcard.rootWildcard();
        String qualifier = block.wildcardQualifiers.get(root);
        String star = block.joined && qualifier != null ? qualifier + ".*" : "*";
        String keyword = dialect.starExcludeKeyword();

        Set<String> excluded = new LinkedHashSet<>(wildcard.excluded());
        if (keyword != null) {
            // helper columns of the subquery that the pipeline has since dropped
            Set<ColumnId> outputs = new HashSet<>(block.outputs);
            block.starCovered.forEach((id, coveredRoot) -> {
                if (coveredRoot.equals(root) && !outputs.contains(id)
                        && block.scope.get(id) instanceof QueryBlock.Source source) {
                    excluded.add(source.name());
                }
            });
        }
        if (excluded.isEmpty()) {
            return star;
        }
        if (keyword == null) {
            throw SQLGenerationException.unsupported(dialect.name(), "excluding columns from a wildcard");
        }
        return star + " " + keyword + " (" + excluded.stream()
            .map(this::quote)
            .collect(Collectors.joining(", ")) + ")";
    }

    private void appendLimit(StringBuilder sql, QueryBlock block) {
        Long limit = block.limit;
        long offset = block.offset;
        if (limit == null && offset == 0) {
            return;
        }
        switch (dialect.limitStyle()) {
            case LIMIT_OFFSET:
                if (limit != null) {
                    sql.append(" LIMIT ").append(limit);
                } else if (dialect.limitForOffsetOnly() != null) {
                    sql.append(" LIMIT ").append(dialect.limitForOffsetOnly());
                }
                if (offset > 0) {
                    sql.append(" OFFSET ").append(offset);
                }
                break;
            case FETCH_FIRST:
                if (offset > 0) {
                    sql.append(" OFFSET ").append(offset).append(" ROWS");
                }
                if (limit != null) {
                    sql.append(" FETCH FIRST ").append(limit).append(" ROWS ONLY");
                }
                break;
            case TOP:
                if (offset > 0) {
                    if (block.orderBy.isEmpty()) {
                        sql.append(" ORDER BY (SELECT NULL)");
                    }
                    sql.append(" OFFSET ").append(offset).append(" ROWS");
                    if (limit != null) {
                        sql.append(" FETCH NEXT ").append(limit).append(" ROWS ONLY");
                    }
                }
                break;
            case LIMIT_ONLY:
                if (offset > 0) {
                    throw SQLGenerationException.unsupported(dialect.name(), "OFFSET");
                }
                sql.append(" LIMIT ").append(limit);
                break;
            default:
                throw new IllegalStateException("Unknown limit style: " + dialect.limitStyle());
        }
    }

    // ==================== Helpers ====================

    private String quote(String identifier) {
        return SQLQuoting.quoteIdentifierIfNeeded(identifier, dialect);
    }

    private String unquote(String qualifier) {
        String start = dialect.identifierQuoteStart();
        String end = dialect.identifierQuoteEnd();
        if (qualifier.startsWith(start) && qualifier.endsWith(end) && qualifier.length() >= 2) {
            return qualifier.substring(start.length(), qualifier.length() - end.length()).replace(end + end, end);
        }
        return qualifier;
    }
}
