package com.pipesql.semantic;

import com.pipesql.exception.ResolveException;
import com.pipesql.pl.ArrayExpr;
import com.pipesql.pl.Assign;
import com.pipesql.pl.BinaryExpr;
import com.pipesql.pl.BinaryOperator;
import com.pipesql.pl.Expr;
import com.pipesql.pl.Ident;
import com.pipesql.pl.Literal;
import com.pipesql.pl.LiteralKind;
import com.pipesql.pl.Param;
import com.pipesql.pl.ParamKind;
import com.pipesql.pl.SourceSpan;
import com.pipesql.pl.TransformKind;
import com.pipesql.pl.TupleExpr;
import com.pipesql.pl.UnaryExpr;
import com.pipesql.pl.UnaryOperator;
import com.pipesql.rq.ColumnId;
import com.pipesql.rq.ColumnKind;
import com.pipesql.rq.Compute;
import com.pipesql.rq.JoinSide;
import com.pipesql.rq.RelId;
import com.pipesql.rq.Relation;
import com.pipesql.rq.RqBuilder;
import com.pipesql.rq.RqExpr;
import com.pipesql.rq.RqOperator;
import com.pipesql.rq.SortDirection;
import com.pipesql.rq.SortKey;
import com.pipesql.rq.Ty;
import com.pipesql.rq.WindowFrame;
import com.pipesql.semantic.Value.Arg;
import com.pipesql.semantic.Value.FunctionValue;
import com.pipesql.semantic.Value.RangeValue;
import com.pipesql.semantic.Value.RelationValue;
import com.pipesql.semantic.Value.Scalar;
import com.pipesql.semantic.Value.TupleValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the standard transforms, turning each step into RQ relations and
 * computing the frame that follows it.
 */
final class TransformResolver {

    private static final Logger logger = LoggerFactory.getLogger(TransformResolver.class);

    private static final Map<TransformKind, List<Param>> SIGNATURES = new EnumMap<>(TransformKind.class);

    static {
        Param relation = Param.of("relation", ParamKind.RELATION);
        Param columns = Param.of("columns");
        Literal none = new Literal(null, LiteralKind.NULL, SourceSpan.SYNTHETIC);

        SIGNATURES.put(TransformKind.FROM, List.of(relation));
        SIGNATURES.put(TransformKind.SELECT, List.of(columns, relation));
        SIGNATURES.put(TransformKind.DERIVE, List.of(columns, relation));
        SIGNATURES.put(TransformKind.FILTER, List.of(Param.of("condition"), relation));
        SIGNATURES.put(TransformKind.AGGREGATE, List.of(columns, relation, new Param("by", null, none)));
        SIGNATURES.put(TransformKind.SORT, List.of(Param.of("by"), relation));
        SIGNATURES.put(TransformKind.TAKE, List.of(Param.of("n"), relation));
        SIGNATURES.put(TransformKind.JOIN, List.of(Param.of("with", ParamKind.RELATION), Param.of("condition"),
            relation, new Param("side", null, Literal.ofString("inner"))));
        SIGNATURES.put(TransformKind.GROUP, List.of(Param.of("by"), Param.of("pipeline", ParamKind.FUNCTION),
            relation));
        SIGNATURES.put(TransformKind.WINDOW, List.of(Param.of("pipeline", ParamKind.FUNCTION), relation,
            new Param("rows", null, none), new Param("range", null, none),
            new Param("expanding", null, none), new Param("rolling", null, none)));
        SIGNATURES.put(TransformKind.APPEND, List.of(Param.of("bottom", ParamKind.RELATION), relation));
    }

    private final Resolver resolver;

    TransformResolver(Resolver resolver) {
        this.resolver = resolver;
    }

    static List<Param> signature(TransformKind kind) {
        return SIGNATURES.get(kind);
    }

    /**
     * A field of a tuple argument, resolved lazily so that later fields see
     * the columns introduced by earlier ones.
     */
    private record FieldSpec(String alias, Expr expr, Environment env, Value value, SourceSpan span) {
    }

    Value apply(TransformKind kind, List<Arg> args, Map<String, Arg> named, Frame callerFrame, SourceSpan span) {
        List<Param> params = SIGNATURES.get(kind);
        int relationIndex = kind == TransformKind.FROM ? 0 : params.indexOf(params.stream()
            .filter(p -> "relation".equals(p.name())).findFirst().orElseThrow());
        RelationValue input = (RelationValue) resolver.resolveArg(args.get(relationIndex),
            params.get(relationIndex), Frame.EMPTY);

        logger.debug("Applying {} to {}", kind.keyword(), input.frame());
        return switch (kind) {
            case FROM -> input;
            case SELECT -> project(false, args.get(0), input, span);
            case DERIVE -> project(true, args.get(0), input, span);
            case FILTER -> filter(args.get(0), input, span);
            case AGGREGATE -> aggregate(args.get(0), named.get("by"), input, span);
            case SORT -> sort(args.get(0), input);
            case TAKE -> take(args.get(0), input, span);
            case JOIN -> join(args.get(0), args.get(1), named.get("side"), input, span);
            case GROUP -> group(args.get(0), args.get(1), input, span);
            case WINDOW -> window(args.get(0), named, input, span);
            case APPEND -> append(args.get(0), input, span);
        };
    }

    // ==================== Fields ====================

    private static List<FieldSpec> fieldSpecs(Arg arg) {
        if (arg.isReady()) {
            return valueSpecs(arg.value(), arg.span());
        }
        return exprSpecs(arg.expr(), arg.env());
    }

    private static List<FieldSpec> exprSpecs(Expr expr, Environment env) {
        List<Expr> items;
        if (expr instanceof TupleExpr tuple) {
            items = tuple.fields();
        } else if (expr instanceof ArrayExpr array) {
            items = array.items();
        } else {
            items = List.of(expr);
        }
        List<FieldSpec> specs = new ArrayList<>();
        for (Expr item : items) {
            if (item instanceof Assign assign) {
                specs.add(new FieldSpec(assign.alias(), assign.value(), env, null, item.span()));
            } else {
                specs.add(new FieldSpec(null, item, env, null, item.span()));
            }
        }
        return specs;
    }

    private static List<FieldSpec> valueSpecs(Value value, SourceSpan span) {
        if (value instanceof TupleValue tuple) {
            return tuple.fields().stream()
                .map(f -> new FieldSpec(f.alias(), null, null, f.value(), f.span()))
                .toList();
        }
        return List.of(new FieldSpec(null, null, null, value, span));
    }

    /**
     * Resolves the fields of a tuple argument one by one. A field that turns
     * out to be a tuple itself is flattened in place.
     */
    private void forEachField(List<FieldSpec> specs, java.util.function.Supplier<Frame> frame,
                              FieldConsumer consumer) {
        Deque<FieldSpec> queue = new ArrayDeque<>(specs);
        while (!queue.isEmpty()) {
            FieldSpec spec = queue.removeFirst();
            Value value = spec.value() != null ? spec.value() : resolver.eval(spec.expr(), frame.get(), spec.env());
            if (value instanceof TupleValue tuple) {
                List<FieldSpec> nested = valueSpecs(tuple, spec.span());
                for (int i = nested.size() - 1; i >= 0; i--) {
                    queue.addFirst(nested.get(i));
                }
                continue;
            }
            Scalar scalar = resolver.expectScalar(value, spec.span());
            consumer.accept(spec.alias() != null ? spec.alias() : scalar.name(), scalar, spec.span());
        }
    }

    @FunctionalInterface
    private interface FieldConsumer {
        void accept(String name, Scalar value, SourceSpan span);
    }

    private static List<ColumnId> ids(List<FrameColumn> columns) {
        return columns.stream().map(FrameColumn::id).toList();
    }

    // ==================== select / derive ====================

    private RelationValue project(boolean derive, Arg columnsArg, RelationValue input, SourceSpan span) {
        Frame frame = input.frame();
        RqBuilder rq = resolver.rq();
        List<FrameColumn> output = derive ? new ArrayList<>(frame.columns()) : new ArrayList<>();
        List<FrameColumn> visible = new ArrayList<>(frame.columns());
        List<Compute> pending = new ArrayList<>();
        Set<ColumnId> pendingWindowed = new HashSet<>();
        RelId[] source = {input.rel()};

        forEachField(fieldSpecs(columnsArg), () -> frame.withColumns(derive ? output : visible),
            (name, value, fieldSpan) -> {
                boolean windowed = value.aggregate() || value.window();
                if (!windowed && value.column() != null && (name == null || name.equals(value.column().name()))) {
                    if (!derive) {
                        // same-named columns of different relations stay side by side
                        ColumnId selected = value.column().id();
                        output.removeIf(c -> c.id().equals(selected));
                        output.add(value.column());
                    }
                    return;
                }
                if (windowed && references(value.expr(), pendingWindowed)) {
                    // nested window calls need the inner one computed first
                    List<FrameColumn> current = derive ? output : visible;
                    source[0] = emit(source[0], pending, ids(current), frame);
                    pending.clear();
                    pendingWindowed.clear();
                }
                ColumnId id = rq.computed(name, value.type());
                pending.add(new Compute(id, value.expr(), windowed));
                if (windowed) {
                    pendingWindowed.add(id);
                }
                FrameColumn column = FrameColumn.named(id, name, null);
                if (derive) {
                    shadow(output, name);
                } else {
                    if (name != null) {
                        output.removeIf(c -> !c.wildcard() && name.equals(c.name()));
                    }
                    output.add(column);
                    shadow(visible, name);
                    visible.add(column);
                    return;
                }
                output.add(column);
            });

        RelId rel = emit(source[0], pending, ids(output), frame);
        return input.withRel(rel, frame.withColumns(output));
    }

    /**
     * Removes columns a new column of the given name hides. Names inferred
     * through a wildcard are excluded from it instead.
     */
    private void shadow(List<FrameColumn> columns, String name) {
        if (name == null) {
            return;
        }
        columns.removeIf(c -> !c.wildcard() && name.equals(c.name()));
        for (int i = 0; i < columns.size(); i++) {
            FrameColumn column = columns.get(i);
            if (column.wildcard() && resolver.isInferred(column.id(), name)) {
                var decl = resolver.rq().column(column.id());
                List<String> excluded = new ArrayList<>(decl.excluded());
                excluded.add(name);
                ColumnId replacement = resolver.rq().newColumn(null, ColumnKind.WILDCARD, Ty.UNKNOWN,
                    decl.rootWildcard(), excluded);
                columns.set(i, column.withId(replacement));
            }
        }
    }

    private static boolean references(RqExpr expr, Set<ColumnId> columns) {
        if (columns.isEmpty()) {
            return false;
        }
        List<ColumnId> referenced = new ArrayList<>();
        RqBuilder.collect(expr, referenced);
        return referenced.stream().anyMatch(columns::contains);
    }

    /**
     * Emits a projection node. Windowed computes go to a window node over the
     * frame's partition, order and bounds.
     */
    private RelId emit(RelId source, List<Compute> computes, List<ColumnId> columns, Frame frame) {
        boolean windowed = computes.stream().anyMatch(Compute::windowed);
        if (windowed) {
            WindowFrame bounds = frame.window() != null ? frame.window() : WindowFrame.UNBOUNDED;
            List<RqExpr> partition = frame.group() != null ? frame.group().partition() : List.of();
            return resolver.rq().add(new Relation.Window(source, partition, frame.sort(), bounds,
                computes, columns));
        }
        return resolver.rq().add(new Relation.Select(source, computes, columns));
    }

    // ==================== filter ====================

    private RelationValue filter(Arg conditionArg, RelationValue input, SourceSpan span) {
        Frame frame = input.frame();
        Scalar predicate = resolver.expectScalar(resolve(conditionArg, frame), conditionArg.span());
        if (!predicate.type().canBeBoolean()) {
            throw ResolveException.typeMismatch("Filter condition must be a boolean, found "
                + predicate.type().displayName(), conditionArg.span());
        }
        RqBuilder rq = resolver.rq();
        if (predicate.aggregate() || predicate.window()) {
            ColumnId id = rq.computed(null, Ty.BOOL);
            List<ColumnId> withPredicate = new ArrayList<>(frame.columnIds());
            withPredicate.add(id);
            RelId computed = emit(input.rel(), List.of(new Compute(id, predicate.expr(), true)), withPredicate, frame);
            RelId filtered = rq.add(new Relation.Filter(computed, new RqExpr.ColumnRef(id)));
            RelId rel = rq.add(new Relation.Select(filtered, List.of(), frame.columnIds()));
            return input.withRel(rel, frame);
        }
        RelId rel = rq.add(new Relation.Filter(input.rel(), predicate.expr()));
        return input.withRel(rel, frame);
    }

    private Value resolve(Arg arg, Frame frame) {
        return arg.isReady() ? arg.value() : resolver.eval(arg.expr(), frame, arg.env());
    }

    // ==================== aggregate / group ====================

    /**
     * Group keys resolved against a relation; non-column keys are computed by
     * a projection first.
     */
    private record Keys(RelId source, Frame frame, List<FrameColumn> keys) {
    }

    private Keys keys(List<FieldSpec> specs, RelId source, Frame frame) {
        List<FrameColumn> keys = new ArrayList<>();
        List<Compute> computes = new ArrayList<>();
        List<FrameColumn> columns = new ArrayList<>(frame.columns());
        forEachField(specs, () -> frame, (name, value, span) -> {
            if (value.aggregate() || value.window()) {
                throw ResolveException.typeMismatch("Group keys cannot contain aggregate or window functions", span);
            }
            if (value.column() != null && (name == null || name.equals(value.column().name()))) {
                keys.add(value.column().asKey());
                return;
            }
            ColumnId id = resolver.rq().computed(name, value.type());
            computes.add(Compute.of(id, value.expr()));
            FrameColumn column = new FrameColumn(id, name, null, true, false);
            keys.add(column);
            columns.add(column);
        });
        RelId rel = source;
        if (!computes.isEmpty()) {
            rel = resolver.rq().add(new Relation.Select(source, computes, ids(columns)));
        }
        List<ColumnId> keyIds = ids(keys);
        List<FrameColumn> marked = columns.stream()
            .map(c -> keyIds.contains(c.id()) ? c.asKey() : c)
            .toList();
        return new Keys(rel, frame.withColumns(marked), keys);
    }

    private RelationValue aggregate(Arg columnsArg, Arg byArg, RelationValue input, SourceSpan span) {
        Frame frame = input.frame();
        List<FieldSpec> byFields = new ArrayList<>();
        List<FieldSpec> aggregations = new ArrayList<>();
        if (byArg != null) {
            byFields.addAll(fieldSpecs(byArg));
        }
        for (FieldSpec spec : fieldSpecs(columnsArg)) {
            if ("by".equals(spec.alias()) && spec.expr() != null
                    && (spec.expr() instanceof ArrayExpr || spec.expr() instanceof TupleExpr)) {
                byFields.addAll(exprSpecs(spec.expr(), spec.env()));
            } else {
                aggregations.add(spec);
            }
        }

        List<FrameColumn> keyColumns = new ArrayList<>();
        if (frame.group() != null) {
            keyColumns.addAll(frame.group().keys());
        }
        RelId source = input.rel();
        Frame working = frame;
        if (!byFields.isEmpty()) {
            Keys keys = keys(byFields, source, frame);
            source = keys.source();
            working = keys.frame();
            for (FrameColumn key : keys.keys()) {
                if (keyColumns.stream().noneMatch(k -> k.id().equals(key.id()))) {
                    keyColumns.add(key);
                }
            }
        }

        List<Compute> computes = new ArrayList<>();
        List<FrameColumn> output = new ArrayList<>(keyColumns);
        Frame aggregateFrame = working;
        forEachField(aggregations, () -> aggregateFrame, (name, value, fieldSpan) -> {
            if (value.window()) {
                throw ResolveException.typeMismatch("Window functions cannot be used in aggregate", fieldSpan);
            }
            ColumnId id = resolver.rq().computed(name, value.type());
            computes.add(Compute.of(id, value.expr()));
            output.add(FrameColumn.named(id, name, null));
        });

        RelId rel = resolver.rq().add(new Relation.Aggregate(source, ids(keyColumns), computes));
        logger.debug("Aggregate {} by {} -> {}", computes.size(), keyColumns, rel);
        return new RelationValue(rel, Frame.of(output), input.name());
    }

    private RelationValue group(Arg byArg, Arg pipelineArg, RelationValue input, SourceSpan span) {
        Frame frame = input.frame();
        if (frame.inGroup()) {
            throw ResolveException.typeMismatch("group cannot be nested inside group", span);
        }
        Keys keys = keys(fieldSpecs(byArg), input.rel(), frame);
        Frame grouped = keys.frame().withGroup(new Frame.GroupContext(keys.keys()));

        FunctionValue pipeline = (FunctionValue) resolver.resolveArg(pipelineArg,
            Param.of("pipeline", ParamKind.FUNCTION), grouped);
        RelationValue partitioned = new RelationValue(keys.source(), grouped, input.name());
        Value result = resolver.apply(pipeline, List.of(Arg.ready(partitioned, span)), Map.of(), grouped, span);
        RelationValue output = resolver.expectRelation(result, pipelineArg.span());
        return output.withFrame(output.frame().withoutContext());
    }

    // ==================== sort / take ====================

    private RelationValue sort(Arg byArg, RelationValue input) {
        Frame frame = input.frame();
        List<SortKey> keys = new ArrayList<>();
        for (FieldSpec spec : fieldSpecs(byArg)) {
            SortDirection direction = SortDirection.ASC;
            FieldSpec target = spec;
            if (spec.expr() instanceof UnaryExpr unary
                    && (unary.operator() == UnaryOperator.NEG || unary.operator() == UnaryOperator.POS)) {
                direction = unary.operator() == UnaryOperator.NEG ? SortDirection.DESC : SortDirection.ASC;
                target = new FieldSpec(spec.alias(), unary.operand(), spec.env(), null, spec.span());
            }
            SortDirection keyDirection = direction;
            forEachField(List.of(target), () -> frame,
                (name, value, span) -> keys.add(new SortKey(value.expr(), keyDirection)));
        }
        Frame sorted = frame.withSort(keys);
        if (frame.inGroup()) {
            // inside group a sort only orders the partition
            return input.withFrame(sorted);
        }
        RelId rel = resolver.rq().add(new Relation.Sort(input.rel(), keys));
        return input.withRel(rel, sorted);
    }

    private RelationValue take(Arg nArg, RelationValue input, SourceSpan span) {
        Frame frame = input.frame();
        Value value = resolve(nArg, frame);
        long offset = 0;
        Long limit;
        if (value instanceof Scalar scalar) {
            long n = constant(scalar, nArg.span());
            if (n < 0) {
                throw ResolveException.typeMismatch("take expects a non-negative number, found " + n, nArg.span());
            }
            limit = n;
        } else if (value instanceof RangeValue range) {
            long start = range.start() == null ? 1 : constant(range.start(), nArg.span());
            if (start < 1) {
                throw ResolveException.typeMismatch("take range must start at 1 or later, found " + start,
                    nArg.span());
            }
            offset = start - 1;
            limit = range.end() == null ? null : Math.max(0, constant(range.end(), nArg.span()) - start + 1);
        } else {
            throw ResolveException.typeMismatch("take expects a number or a range", nArg.span());
        }

        RqBuilder rq = resolver.rq();
        if (!frame.inGroup() && !frame.sort().isEmpty()) {
            RelId rel = rq.add(new Relation.Take(input.rel(), offset, limit, frame.sort()));
            return input.withRel(rel, frame);
        }

        // per-group take, or no ordering to bound by: number the rows (within
        // each partition) and keep the requested range
        List<RqExpr> partition = frame.inGroup() ? frame.group().partition() : List.of();
        ColumnId rowNumber = rq.computed(null, Ty.INT);
        List<ColumnId> withRowNumber = new ArrayList<>(frame.columnIds());
        withRowNumber.add(rowNumber);
        RelId numbered = rq.add(new Relation.Window(input.rel(), partition, frame.sort(),
            WindowFrame.UNBOUNDED,
            List.of(new Compute(rowNumber, new RqExpr.FunctionCall("row_number", List.of()), true)),
            withRowNumber));
        RqExpr ref = new RqExpr.ColumnRef(rowNumber);
        RqExpr predicate = limit == null
            ? new RqExpr.Binary(ref, RqOperator.GT, RqExpr.Constant.of(offset))
            : new RqExpr.Between(ref, RqExpr.Constant.of(offset + 1), RqExpr.Constant.of(offset + limit));
        RelId filtered = rq.add(new Relation.Filter(numbered, predicate));
        RelId rel = rq.add(new Relation.Select(filtered, List.of(), frame.columnIds()));
        return input.withRel(rel, frame);
    }

    private static long constant(Scalar scalar, SourceSpan span) {
        if (scalar.expr() instanceof RqExpr.Constant constant && constant.value() instanceof Long value) {
            return value;
        }
        throw ResolveException.typeMismatch("Expected an integer constant", span);
    }

    // ==================== join ====================

    private RelationValue join(Arg withArg, Arg conditionArg, Arg sideArg, RelationValue left, SourceSpan span) {
        if (left.frame().inGroup()) {
            throw ResolveException.typeMismatch("join is not allowed inside group", span);
        }
        RelationValue right = (RelationValue) resolver.resolveArg(withArg,
            Param.of("with", ParamKind.RELATION), Frame.EMPTY);
        Set<ColumnId> leftIds = new HashSet<>(left.frame().columnIds());
        if (left.rel().equals(right.rel()) || right.frame().columnIds().stream().anyMatch(leftIds::contains)) {
            throw ResolveException.typeMismatch("The same relation cannot be used on both sides of a join",
                withArg.span());
        }
        JoinSide side = side(sideArg);
        Frame joinFrame = Frame.forJoin(left.frame(), right.frame());

        List<RqExpr> conjuncts = new ArrayList<>();
        List<FrameColumn[]> using = new ArrayList<>();
        if (conditionArg.isReady()) {
            conjuncts.add(booleanCondition(resolver.expectScalar(conditionArg.value(), conditionArg.span()),
                conditionArg.span()));
        } else {
            for (Expr part : splitConjunction(conditionArg.expr())) {
                if (part instanceof UnaryExpr unary && unary.operator() == UnaryOperator.SELF_EQ
                        && unary.operand() instanceof Ident ident) {
                    Scalar leftColumn = resolver.column(ident, left.frame());
                    Scalar rightColumn = resolver.column(ident, right.frame());
                    conjuncts.add(new RqExpr.Binary(leftColumn.expr(), RqOperator.EQ, rightColumn.expr()));
                    using.add(new FrameColumn[] {leftColumn.column(), rightColumn.column()});
                } else {
                    Scalar condition = resolver.scalar(part, joinFrame, conditionArg.env());
                    conjuncts.add(booleanCondition(condition, part.span()));
                }
            }
        }
        RqExpr condition = conjuncts.get(0);
        for (int i = 1; i < conjuncts.size(); i++) {
            condition = new RqExpr.Binary(condition, RqOperator.AND, conjuncts.get(i));
        }

        List<FrameColumn> output = new ArrayList<>(left.frame().columns());
        List<FrameColumn> rightColumns = new ArrayList<>(right.frame().columns());
        List<Compute> computes = new ArrayList<>();
        for (FrameColumn[] pair : using) {
            FrameColumn leftColumn = pair[0];
            FrameColumn rightColumn = pair[1];
            int position = indexOf(output, leftColumn.id());
            rightColumns.removeIf(c -> c.id().equals(rightColumn.id()));
            FrameColumn merged;
            if (side == JoinSide.FULL) {
                ColumnId id = resolver.rq().computed(leftColumn.name(), resolver.columnType(leftColumn.id()));
                computes.add(Compute.of(id, new RqExpr.FunctionCall("coalesce",
                    List.of(new RqExpr.ColumnRef(rightColumn.id()), new RqExpr.ColumnRef(leftColumn.id())))));
                merged = new FrameColumn(id, leftColumn.name(), null, true, false);
            } else if (side == JoinSide.RIGHT) {
                merged = rightColumn.asKey();
            } else {
                merged = leftColumn.asKey();
            }
            if (position >= 0) {
                output.set(position, merged);
            } else {
                // the left column was inferred through a wildcard; listing the key
                // explicitly makes its bare name win over both wildcards
                output.add(merged);
            }
        }
        output.addAll(rightColumns);

        RelId rel = resolver.rq().add(new Relation.Join(side, left.rel(), right.rel(), condition,
            computes, ids(output)));
        logger.debug("Join {} {} with {} -> {}", side, left.rel(), right.rel(), rel);
        return left.withRel(rel, left.frame().withColumns(output));
    }

    private JoinSide side(Arg sideArg) {
        if (sideArg == null) {
            return JoinSide.INNER;
        }
        String name;
        if (!sideArg.isReady() && sideArg.expr() instanceof Ident ident && !ident.isQualified()) {
            name = ident.name();
        } else if (!sideArg.isReady() && sideArg.expr() instanceof Literal literal
                && literal.kind() == LiteralKind.STRING) {
            name = (String) literal.value();
        } else {
            throw ResolveException.typeMismatch("Join side must be one of inner, left, right, full",
                sideArg.span());
        }
        JoinSide side = JoinSide.fromName(name);
        if (side == null) {
            throw ResolveException.typeMismatch(
                "Unknown join side `%s`, expected one of inner, left, right, full".formatted(name), sideArg.span());
        }
        return side;
    }

    private static List<Expr> splitConjunction(Expr expr) {
        if (expr instanceof BinaryExpr binary && binary.operator() == BinaryOperator.AND) {
            List<Expr> parts = new ArrayList<>(splitConjunction(binary.left()));
            parts.addAll(splitConjunction(binary.right()));
            return parts;
        }
        return List.of(expr);
    }

    private static RqExpr booleanCondition(Scalar condition, SourceSpan span) {
        if (!condition.type().canBeBoolean()) {
            throw ResolveException.typeMismatch("Join condition must be a boolean, found "
                + condition.type().displayName(), span);
        }
        return condition.expr();
    }

    private static int indexOf(List<FrameColumn> columns, ColumnId id) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    // ==================== window ====================

    private RelationValue window(Arg pipelineArg, Map<String, Arg> named, RelationValue input, SourceSpan span) {
        Frame frame = input.frame();
        WindowFrame bounds = bounds(named, frame);
        Frame windowed = frame.withWindow(bounds);
        FunctionValue pipeline = (FunctionValue) resolver.resolveArg(pipelineArg,
            Param.of("pipeline", ParamKind.FUNCTION), windowed);
        Value result = resolver.apply(pipeline, List.of(Arg.ready(input.withFrame(windowed), span)),
            Map.of(), windowed, span);
        RelationValue output = resolver.expectRelation(result, pipelineArg.span());
        return output.withFrame(output.frame().withWindow(null).withGroup(frame.group()));
    }

    private WindowFrame bounds(Map<String, Arg> named, Frame frame) {
        Arg rows = named.get("rows");
        Arg range = named.get("range");
        Arg expanding = named.get("expanding");
        Arg rolling = named.get("rolling");
        if (rows != null) {
            return rangeBounds(WindowFrame.Unit.ROWS, rows, frame);
        }
        if (range != null) {
            return rangeBounds(WindowFrame.Unit.RANGE, range, frame);
        }
        if (expanding != null) {
            Scalar flag = resolver.expectScalar(resolve(expanding, frame), expanding.span());
            if (flag.expr() instanceof RqExpr.Constant constant && Boolean.TRUE.equals(constant.value())) {
                return new WindowFrame(WindowFrame.Unit.ROWS, null, 0L);
            }
            return WindowFrame.UNBOUNDED;
        }
        if (rolling != null) {
            long n = constant(resolver.expectScalar(resolve(rolling, frame), rolling.span()), rolling.span());
            if (n < 1) {
                throw ResolveException.typeMismatch("rolling expects a positive number of rows", rolling.span());
            }
            return new WindowFrame(WindowFrame.Unit.ROWS, -(n - 1), 0L);
        }
        return frame.window() != null ? frame.window() : WindowFrame.UNBOUNDED;
    }

    private WindowFrame rangeBounds(WindowFrame.Unit unit, Arg arg, Frame frame) {
        Value value = resolve(arg, frame);
        if (!(value instanceof RangeValue range)) {
            throw ResolveException.typeMismatch("Window bounds must be a range such as -2..0", arg.span());
        }
        Long start = range.start() == null ? null : constant(range.start(), arg.span());
        Long end = range.end() == null ? null : constant(range.end(), arg.span());
        return new WindowFrame(unit, start, end);
    }

    // ==================== append ====================

    private RelationValue append(Arg bottomArg, RelationValue top, SourceSpan span) {
        Frame frame = top.frame();
        if (frame.inGroup()) {
            throw ResolveException.typeMismatch("append is not allowed inside group", span);
        }
        RelationValue bottom = (RelationValue) resolver.resolveArg(bottomArg,
            Param.of("bottom", ParamKind.RELATION), Frame.EMPTY);
        if (bottom.rel().equals(top.rel())) {
            throw ResolveException.typeMismatch("A relation cannot be appended to itself", bottomArg.span());
        }
        Frame bottomFrame = bottom.frame();
        if (!frame.hasWildcard() && !bottomFrame.hasWildcard()
                && frame.columns().size() != bottomFrame.columns().size()) {
            throw ResolveException.typeMismatch("append requires the same number of columns, found %d and %d"
                .formatted(frame.columns().size(), bottomFrame.columns().size()), bottomArg.span());
        }

        RqBuilder rq = resolver.rq();
        List<FrameColumn> output = new ArrayList<>();
        for (FrameColumn column : frame.columns()) {
            if (column.wildcard()) {
                output.add(FrameColumn.wildcard(rq.wildcard(), null));
            } else {
                ColumnId id = rq.computed(column.name(), resolver.columnType(column.id()));
                output.add(FrameColumn.named(id, column.name(), null));
            }
        }
        RelId rel = rq.add(new Relation.Append(top.rel(), bottom.rel(), ids(output)));
        return new RelationValue(rel, Frame.of(output), top.name());
    }
}
