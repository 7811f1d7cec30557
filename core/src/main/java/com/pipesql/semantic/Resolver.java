package com.pipesql.semantic;

import com.pipesql.exception.ResolveException;
import com.pipesql.functions.BuiltinFunction;
import com.pipesql.functions.FunctionCategory;
import com.pipesql.functions.FunctionRegistry;
import com.pipesql.pl.ArrayExpr;
import com.pipesql.pl.Assign;
import com.pipesql.pl.BinaryExpr;
import com.pipesql.pl.BinaryOperator;
import com.pipesql.pl.CaseExpr;
import com.pipesql.pl.Declaration;
import com.pipesql.pl.Expr;
import com.pipesql.pl.FuncCall;
import com.pipesql.pl.FuncDef;
import com.pipesql.pl.Ident;
import com.pipesql.pl.InterpolatedString;
import com.pipesql.pl.Literal;
import com.pipesql.pl.Param;
import com.pipesql.pl.ParamKind;
import com.pipesql.pl.Pipeline;
import com.pipesql.pl.Query;
import com.pipesql.pl.Range;
import com.pipesql.pl.SourceSpan;
import com.pipesql.pl.TransformKind;
import com.pipesql.pl.TupleExpr;
import com.pipesql.pl.UnaryExpr;
import com.pipesql.pl.VarDef;
import com.pipesql.rq.ColumnDecl;
import com.pipesql.rq.ColumnId;
import com.pipesql.rq.ColumnKind;
import com.pipesql.rq.RelId;
import com.pipesql.rq.Relation;
import com.pipesql.rq.RqBuilder;
import com.pipesql.rq.RqExpr;
import com.pipesql.rq.RqOperator;
import com.pipesql.rq.RqQuery;
import com.pipesql.rq.Ty;
import com.pipesql.semantic.Value.Arg;
import com.pipesql.semantic.Value.Callable;
import com.pipesql.semantic.Value.FunctionValue;
import com.pipesql.semantic.Value.RangeValue;
import com.pipesql.semantic.Value.RelationStar;
import com.pipesql.semantic.Value.RelationValue;
import com.pipesql.semantic.Value.Scalar;
import com.pipesql.semantic.Value.TupleValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Binds a parsed program to relations and columns, producing an
 * {@link RqQuery}.
 *
 * <p>Resolution walks the main pipeline, keeping a {@link Frame} of visible
 * columns. Names are looked up in this order:
 * <ol>
 *   <li>explicit columns of the current frame</li>
 *   <li>parameters of the user function being inlined</li>
 *   <li>top-level declarations, then transforms and standard functions</li>
 *   <li>columns inferred through a wildcard of a table with unknown columns</li>
 * </ol>
 *
 * <p>User functions are inlined at each call site. Relation variables become
 * declared relations, read through a fresh {@link Relation.TableRef} at each
 * use. Resolution is fail-fast: the first error aborts with a
 * {@link ResolveException}.
 *
 * <p>A resolver holds per-program state and must not be reused.
 */
public final class Resolver {

    private static final Logger logger = LoggerFactory.getLogger(Resolver.class);

    public static final int DEFAULT_RECURSION_LIMIT = 64;

    private final TableCatalog catalog;
    private final int recursionLimit;
    private final RqBuilder rq = new RqBuilder();
    private final SymbolTable symbols = new SymbolTable();
    private final Map<ColumnId, Map<String, ColumnId>> inferred = new HashMap<>();
    private final TransformResolver transforms = new TransformResolver(this);
    private int depth;
    private boolean used;

    public Resolver() {
        this(TableCatalog.empty(), DEFAULT_RECURSION_LIMIT);
    }

    public Resolver(TableCatalog catalog, int recursionLimit) {
        if (recursionLimit < 1) {
            throw new IllegalArgumentException("recursionLimit must be positive, got " + recursionLimit);
        }
        this.catalog = catalog == null ? TableCatalog.empty() : catalog;
        this.recursionLimit = recursionLimit;
    }

    /**
     * Resolves a program.
     *
     * @param query the parsed program
     * @return the relational query of its main pipeline
     * @throws ResolveException if a name cannot be bound or a value has the
     *         wrong kind or type
     */
    public RqQuery resolve(Query query) {
        if (used) {
            throw new IllegalStateException("Resolver instances resolve a single program");
        }
        used = true;

        for (Declaration declaration : query.declarations()) {
            symbols.declare(declaration);
        }
        Expr main = query.mainPipeline().orElseThrow(() -> ResolveException.typeMismatch(
            "Program has no main pipeline", SourceSpan.SYNTHETIC));

        logger.debug("Resolving main pipeline: {}", main);
        RelationValue result = expectRelation(eval(main, Frame.EMPTY, Environment.root()), main.span());
        RqQuery rqQuery = rq.build(result.rel());
        logger.debug("Resolved query: {}", rqQuery);
        return rqQuery;
    }

    // ==================== Shared State ====================

    RqBuilder rq() {
        return rq;
    }

    Ty columnType(ColumnId id) {
        return rq.column(id).type();
    }

    /**
     * Returns whether a name has already been inferred through the wildcard.
     */
    boolean isInferred(ColumnId wildcard, String name) {
        ColumnId root = rq.column(wildcard).rootWildcard();
        Map<String, ColumnId> names = inferred.get(root);
        return names != null && names.containsKey(name);
    }

    // ==================== Expressions ====================

    Value eval(Expr expr, Frame frame, Environment env) {
        if (expr instanceof Literal literal) {
            return literal(literal);
        } else if (expr instanceof Ident ident) {
            return ident(ident, frame, env);
        } else if (expr instanceof UnaryExpr unary) {
            return unary(unary, frame, env);
        } else if (expr instanceof BinaryExpr binary) {
            return binary(binary, frame, env);
        } else if (expr instanceof FuncCall call) {
            return call(call, frame, env, null);
        } else if (expr instanceof Assign assign) {
            Value value = eval(assign.value(), frame, env);
            return value instanceof Scalar scalar ? scalar.withName(assign.alias()) : value;
        } else if (expr instanceof Range range) {
            Scalar start = range.start() == null ? null : scalar(range.start(), frame, env);
            Scalar end = range.end() == null ? null : scalar(range.end(), frame, env);
            return new RangeValue(start, end);
        } else if (expr instanceof TupleExpr tuple) {
            return tuple(tuple.fields(), false, frame, env);
        } else if (expr instanceof ArrayExpr array) {
            return tuple(array.items(), true, frame, env);
        } else if (expr instanceof Pipeline pipeline) {
            return pipeline(pipeline, frame, env);
        } else if (expr instanceof CaseExpr caseExpr) {
            return caseExpr(caseExpr, frame, env);
        } else if (expr instanceof InterpolatedString interpolated) {
            return interpolation(interpolated, frame, env);
        }
        throw new IllegalStateException("Unhandled expression: " + expr.getClass().getSimpleName());
    }

    Scalar scalar(Expr expr, Frame frame, Environment env) {
        return expectScalar(eval(expr, frame, env), expr.span());
    }

    Scalar expectScalar(Value value, SourceSpan span) {
        if (value instanceof Scalar scalar) {
            return scalar;
        }
        throw ResolveException.typeMismatch("Expected a scalar value, found " + describe(value), span);
    }

    RelationValue expectRelation(Value value, SourceSpan span) {
        if (value instanceof RelationValue relation) {
            return relation;
        }
        throw ResolveException.typeMismatch("Expected a relation, found " + describe(value), span);
    }

    private static String describe(Value value) {
        if (value instanceof Scalar) {
            return "a scalar";
        } else if (value instanceof RelationValue) {
            return "a relation";
        } else if (value instanceof RelationStar) {
            return "`this`";
        } else if (value instanceof RangeValue) {
            return "a range";
        } else if (value instanceof TupleValue tuple) {
            return tuple.array() ? "an array" : "a tuple";
        } else if (value instanceof FunctionValue function) {
            int missing = function.callable().positionalParams().size() - function.args().size();
            return "function `%s` missing %d argument%s".formatted(
                function.callable().name(), missing, missing == 1 ? "" : "s");
        }
        return value.toString();
    }

    private Scalar literal(Literal literal) {
        Ty type = switch (literal.kind()) {
            case NULL -> Ty.NULL;
            case INTEGER -> Ty.INT;
            case FLOAT -> Ty.FLOAT;
            case BOOLEAN -> Ty.BOOL;
            case STRING -> Ty.TEXT;
            case DATE -> Ty.DATE;
            case TIME -> Ty.TIME;
            case TIMESTAMP -> Ty.TIMESTAMP;
        };
        return Scalar.of(new RqExpr.Constant(literal.value(), type), type);
    }

    private Value tuple(List<Expr> items, boolean array, Frame frame, Environment env) {
        List<Value.Field> fields = new ArrayList<>();
        for (Expr item : items) {
            String alias = item instanceof Assign assign ? assign.alias() : null;
            fields.add(new Value.Field(alias, eval(item, frame, env), item.span()));
        }
        return new TupleValue(fields, array);
    }

    private Scalar unary(UnaryExpr unary, Frame frame, Environment env) {
        switch (unary.operator()) {
            case SELF_EQ:
                throw ResolveException.typeMismatch(
                    "`==" + unary.operand() + "` is only allowed in join conditions", unary.span());
            case NOT: {
                Scalar operand = scalar(unary.operand(), frame, env);
                requireBoolean(operand, "!", unary.span());
                return new Scalar(new RqExpr.Unary(RqOperator.NOT, operand.expr()), Ty.BOOL, null, null,
                    operand.aggregate(), operand.window());
            }
            case POS: {
                Scalar operand = scalar(unary.operand(), frame, env);
                requireNumeric(operand, "+", unary.span());
                return operand;
            }
            case NEG:
            default: {
                Scalar operand = scalar(unary.operand(), frame, env);
                requireNumeric(operand, "-", unary.span());
                if (operand.expr() instanceof RqExpr.Constant constant) {
                    if (constant.value() instanceof Long value) {
                        return Scalar.of(new RqExpr.Constant(-value, Ty.INT), Ty.INT);
                    }
                    if (constant.value() instanceof Double value) {
                        return Scalar.of(new RqExpr.Constant(-value, Ty.FLOAT), Ty.FLOAT);
                    }
                }
                return new Scalar(new RqExpr.Unary(RqOperator.NEG, operand.expr()), operand.type(), null, null,
                    operand.aggregate(), operand.window());
            }
        }
    }

    private Scalar binary(BinaryExpr binary, Frame frame, Environment env) {
        Scalar left = scalar(binary.left(), frame, env);
        Scalar right = scalar(binary.right(), frame, env);
        BinaryOperator op = binary.operator();
        boolean aggregate = left.aggregate() || right.aggregate();
        boolean window = left.window() || right.window();

        if (op == BinaryOperator.COALESCE) {
            Ty type = left.type() != Ty.NULL && left.type() != Ty.UNKNOWN ? left.type() : right.type();
            RqExpr call = new RqExpr.FunctionCall("coalesce", List.of(right.expr(), left.expr()));
            return new Scalar(call, type, null, null, aggregate, window);
        }
        if (op == BinaryOperator.EQ || op == BinaryOperator.NE) {
            RqOperator nullCheck = op == BinaryOperator.EQ ? RqOperator.IS_NULL : RqOperator.IS_NOT_NULL;
            if (isNullConstant(right)) {
                return new Scalar(new RqExpr.Unary(nullCheck, left.expr()), Ty.BOOL, null, null, aggregate, window);
            }
            if (isNullConstant(left)) {
                return new Scalar(new RqExpr.Unary(nullCheck, right.expr()), Ty.BOOL, null, null, aggregate, window);
            }
        }

        Ty type;
        if (op.isArithmetic()) {
            requireNumeric(left, op.symbol(), binary.span());
            requireNumeric(right, op.symbol(), binary.span());
            type = arithmeticType(op, left.type(), right.type());
        } else if (op.isLogical()) {
            requireBoolean(left, op.symbol(), binary.span());
            requireBoolean(right, op.symbol(), binary.span());
            type = Ty.BOOL;
        } else {
            type = Ty.BOOL;
        }
        RqExpr expr = new RqExpr.Binary(left.expr(), RqOperator.valueOf(op.name()), right.expr());
        return new Scalar(expr, type, null, null, aggregate, window);
    }

    private static boolean isNullConstant(Scalar scalar) {
        return scalar.expr() instanceof RqExpr.Constant constant && constant.type() == Ty.NULL;
    }

    private static Ty arithmeticType(BinaryOperator op, Ty left, Ty right) {
        if (op == BinaryOperator.INT_DIV) {
            return Ty.INT;
        }
        if (op == BinaryOperator.DIV) {
            return left.isNumeric() && right.isNumeric() ? Ty.FLOAT : Ty.NUMBER;
        }
        if (left == Ty.INT && right == Ty.INT) {
            return Ty.INT;
        }
        if ((left == Ty.FLOAT && right.isNumeric()) || (right == Ty.FLOAT && left.isNumeric())) {
            return Ty.FLOAT;
        }
        for (Ty temporal : List.of(Ty.TIMESTAMP, Ty.DATE, Ty.TIME)) {
            if (left == temporal || right == temporal) {
                return temporal;
            }
        }
        return Ty.NUMBER;
    }

    private static void requireNumeric(Scalar operand, String operator, SourceSpan span) {
        if (!operand.type().canBeNumeric()) {
            throw ResolveException.typeMismatch("Operator `%s` cannot be applied to a value of type %s"
                .formatted(operator, operand.type().displayName()), span);
        }
    }

    private static void requireBoolean(Scalar operand, String operator, SourceSpan span) {
        if (!operand.type().canBeBoolean()) {
            throw ResolveException.typeMismatch("Operator `%s` expects a boolean, found %s"
                .formatted(operator, operand.type().displayName()), span);
        }
    }

    private Scalar caseExpr(CaseExpr caseExpr, Frame frame, Environment env) {
        List<RqExpr.Branch> branches = new ArrayList<>();
        RqExpr otherwise = null;
        Ty type = Ty.NULL;
        boolean aggregate = false;
        boolean window = false;
        for (CaseExpr.Arm arm : caseExpr.arms()) {
            Scalar condition = scalar(arm.condition(), frame, env);
            if (!condition.type().canBeBoolean()) {
                throw ResolveException.typeMismatch("Case condition must be a boolean, found "
                    + condition.type().displayName(), arm.condition().span());
            }
            Scalar value = scalar(arm.value(), frame, env);
            if (type == Ty.NULL) {
                type = value.type();
            }
            aggregate |= condition.aggregate() || value.aggregate();
            window |= condition.window() || value.window();
            if (condition.expr() instanceof RqExpr.Constant constant && Boolean.TRUE.equals(constant.value())) {
                otherwise = value.expr();
                break;
            }
            branches.add(new RqExpr.Branch(condition.expr(), value.expr()));
        }
        if (branches.isEmpty()) {
            return new Scalar(otherwise, type, null, null, aggregate, window);
        }
        return new Scalar(new RqExpr.Case(branches, otherwise), type, null, null, aggregate, window);
    }

    private Scalar interpolation(InterpolatedString interpolated, Frame frame, Environment env) {
        boolean aggregate = false;
        boolean window = false;
        if (interpolated.flavor() == InterpolatedString.Flavor.SQL) {
            List<Object> parts = new ArrayList<>();
            for (InterpolatedString.Part part : interpolated.parts()) {
                if (part instanceof InterpolatedString.Text text) {
                    parts.add(text.text());
                } else {
                    Scalar hole = scalar(((InterpolatedString.Hole) part).expr(), frame, env);
                    aggregate |= hole.aggregate();
                    window |= hole.window();
                    parts.add(hole.expr());
                }
            }
            return new Scalar(new RqExpr.RawSql(parts), Ty.UNKNOWN, null, null, aggregate, window);
        }

        List<RqExpr> args = new ArrayList<>();
        for (InterpolatedString.Part part : interpolated.parts()) {
            if (part instanceof InterpolatedString.Text text) {
                if (!text.text().isEmpty()) {
                    args.add(new RqExpr.Constant(text.text(), Ty.TEXT));
                }
            } else {
                Scalar hole = scalar(((InterpolatedString.Hole) part).expr(), frame, env);
                aggregate |= hole.aggregate();
                window |= hole.window();
                args.add(hole.expr());
            }
        }
        if (args.isEmpty()) {
            return Scalar.of(new RqExpr.Constant("", Ty.TEXT), Ty.TEXT);
        }
        if (args.size() == 1 && args.get(0) instanceof RqExpr.Constant) {
            return Scalar.of(args.get(0), Ty.TEXT);
        }
        return new Scalar(new RqExpr.FunctionCall(FunctionRegistry.CONCAT, args), Ty.TEXT, null, null,
            aggregate, window);
    }

    // ==================== Names ====================

    private Value ident(Ident ident, Frame frame, Environment env) {
        String name = ident.name();
        String qualifier = ident.qualifier();
        if (qualifier == null && "this".equals(name)) {
            return new RelationStar(ident.span());
        }

        boolean inFrame = qualifier == null || frame.hasRelation(qualifier);
        if (inFrame) {
            List<FrameColumn> found = frame.find(qualifier, name);
            if (!found.isEmpty()) {
                return columnValue(pick(found, ident));
            }
        }
        if (qualifier == null) {
            Optional<Value> bound = env.lookup(name);
            if (bound.isPresent()) {
                return bound.get();
            }
        }
        Optional<Value> global = global(ident);
        if (global.isPresent()) {
            Value value = global.get();
            if (value instanceof FunctionValue function
                    && function.callable() instanceof Value.UserFunction
                    && function.callable().positionalParams().isEmpty()) {
                return apply(function, List.of(), Map.of(), frame, ident.span());
            }
            return value;
        }
        if (inFrame) {
            Optional<Scalar> viaWildcard = inferThroughWildcard(ident, frame);
            if (viaWildcard.isPresent()) {
                return viaWildcard.get();
            }
        }
        throw ResolveException.unknownName(ident.fullName(), ident.span());
    }

    /**
     * Resolves a name against frame columns only, inferring through
     * wildcards when needed. Used for the sides of {@code ==col} join
     * conditions.
     */
    Scalar column(Ident ident, Frame frame) {
        List<FrameColumn> found = frame.find(ident.qualifier(), ident.name());
        if (!found.isEmpty()) {
            return columnValue(pick(found, ident));
        }
        return inferThroughWildcard(ident, frame)
            .orElseThrow(() -> ResolveException.unknownName(ident.fullName(), ident.span()));
    }

    private FrameColumn pick(List<FrameColumn> found, Ident ident) {
        List<ColumnId> distinct = found.stream().map(FrameColumn::id).distinct().toList();
        if (distinct.size() > 1 && ident.qualifier() == null) {
            String candidates = found.stream().map(FrameColumn::toString).collect(Collectors.joining(", "));
            throw ResolveException.ambiguousName(ident.fullName(), candidates, ident.span());
        }
        // qualified duplicates resolve to the leftmost column
        return found.get(0);
    }

    private Scalar columnValue(FrameColumn column) {
        return Scalar.ofColumn(column, columnType(column.id()));
    }

    private Optional<Scalar> inferThroughWildcard(Ident ident, Frame frame) {
        List<FrameColumn> wildcards = frame.wildcards(ident.qualifier());
        if (wildcards.isEmpty()) {
            return Optional.empty();
        }
        if (wildcards.size() > 1 && ident.qualifier() == null) {
            String candidates = wildcards.stream()
                .map(w -> (w.relation() == null ? "" : w.relation() + ".") + ident.name())
                .collect(Collectors.joining(", "));
            throw ResolveException.ambiguousName(ident.fullName(), candidates, ident.span());
        }
        FrameColumn wildcard = wildcards.get(0);
        ColumnDecl decl = rq.column(wildcard.id());
        if (decl.excluded().contains(ident.name())) {
            return Optional.empty();
        }
        ColumnId root = decl.rootWildcard();
        ColumnId id = inferred.computeIfAbsent(root, k -> new HashMap<>())
            .computeIfAbsent(ident.name(), n -> rq.newColumn(n, ColumnKind.TABLE, Ty.UNKNOWN, root, List.of()));
        logger.debug("Inferred column `{}` through wildcard {} as {}", ident.fullName(), root, id);
        return Optional.of(Scalar.ofColumn(FrameColumn.named(id, ident.name(), wildcard.relation()), Ty.UNKNOWN));
    }

    private Optional<Value> global(Ident ident) {
        if (!ident.isQualified()) {
            String name = ident.name();
            Optional<Declaration> declaration = symbols.lookup(name);
            if (declaration.isPresent()) {
                if (declaration.get() instanceof FuncDef def) {
                    return Optional.of(FunctionValue.of(new Value.UserFunction(def)));
                }
                return Optional.of(variable((VarDef) declaration.get()));
            }
            Optional<TransformKind> transform = TransformKind.lookup(name);
            if (transform.isPresent()) {
                return Optional.of(FunctionValue.of(new Value.Transform(transform.get())));
            }
        }
        return FunctionRegistry.lookup(ident.fullName())
            .map(fn -> FunctionValue.of(new Value.Builtin(fn)));
    }

    private Value variable(VarDef variable) {
        Value value = symbols.resolveVariable(variable, def -> {
            Value resolved = eval(def.value(), Frame.EMPTY, Environment.root());
            if (resolved instanceof RelationValue relation) {
                rq.declare(def.name(), relation.rel());
                logger.debug("Declared relation `{}` rooted at {}", def.name(), relation.rel());
                return new RelationValue(relation.rel(), Frame.of(relation.frame().columns()), def.name());
            }
            return resolved;
        });
        if (value instanceof RelationValue root) {
            return referenceDeclared(variable.name(), root);
        }
        return value;
    }

    /**
     * Creates a fresh reference to a declared relation. Its columns align by
     * position with the declared relation's output.
     */
    private RelationValue referenceDeclared(String name, RelationValue root) {
        List<ColumnId> ids = new ArrayList<>();
        List<FrameColumn> columns = new ArrayList<>();
        for (FrameColumn column : root.frame().columns()) {
            if (column.wildcard()) {
                ColumnId id = rq.wildcard();
                ids.add(id);
                columns.add(FrameColumn.wildcard(id, name));
            } else {
                ColumnId id = rq.tableColumn(column.name(), columnType(column.id()));
                ids.add(id);
                columns.add(FrameColumn.named(id, column.name(), name));
            }
        }
        RelId rel = rq.add(new Relation.TableRef(name, true, null, ids));
        return new RelationValue(rel, Frame.of(columns), name);
    }

    // ==================== Relations ====================

    /**
     * Resolves an expression in relation position, where a bare name refers
     * to a relation parameter, a declared relation or an external table.
     */
    RelationValue relation(Expr expr, Environment env) {
        if (expr instanceof Assign assign) {
            return alias(relation(assign.value(), env), assign.alias());
        }
        if (expr instanceof Ident ident) {
            if (!ident.isQualified()) {
                Optional<Value> bound = env.lookup(ident.name());
                if (bound.isPresent()) {
                    return expectRelation(bound.get(), ident.span());
                }
                Optional<VarDef> variable = symbols.variable(ident.name());
                if (variable.isPresent()) {
                    return expectRelation(variable(variable.get()), ident.span());
                }
            }
            return table(ident);
        }
        if (expr instanceof ArrayExpr array) {
            return literalTable(array, env);
        }
        return expectRelation(eval(expr, Frame.EMPTY, env), expr.span());
    }

    private RelationValue table(Ident ident) {
        String name = ident.fullName();
        String namespace = ident.name();
        List<ColumnId> ids = new ArrayList<>();
        List<FrameColumn> columns = new ArrayList<>();
        Optional<List<String>> known = catalog.columns(name);
        if (known.isPresent()) {
            for (String column : known.get()) {
                ColumnId id = rq.tableColumn(column, Ty.UNKNOWN);
                ids.add(id);
                columns.add(FrameColumn.named(id, column, namespace));
            }
        } else {
            ColumnId id = rq.wildcard();
            ids.add(id);
            columns.add(FrameColumn.wildcard(id, namespace));
        }
        RelId rel = rq.add(new Relation.TableRef(name, false, null, ids));
        logger.debug("Table `{}` read as {} with columns {}", name, rel, columns);
        return new RelationValue(rel, Frame.of(columns), namespace);
    }

    private RelationValue alias(RelationValue relation, String alias) {
        if (rq.relation(relation.rel()) instanceof Relation.TableRef table && table.alias() == null) {
            rq.replaceTable(relation.rel(),
                new Relation.TableRef(table.name(), table.declared(), alias, table.columns()));
        }
        List<FrameColumn> renamed = relation.frame().columns().stream()
            .map(c -> c.withRelation(alias))
            .toList();
        return new RelationValue(relation.rel(), relation.frame().withColumns(renamed), alias);
    }

    private RelationValue literalTable(ArrayExpr array, Environment env) {
        List<String> names = null;
        List<Ty> types = new ArrayList<>();
        List<List<RqExpr>> rows = new ArrayList<>();
        for (Expr item : array.items()) {
            if (!(item instanceof TupleExpr row)) {
                throw ResolveException.typeMismatch("Literal table rows must be tuples", item.span());
            }
            List<String> rowNames = new ArrayList<>();
            List<RqExpr> values = new ArrayList<>();
            for (Expr field : row.fields()) {
                if (!(field instanceof Assign assign)) {
                    throw ResolveException.typeMismatch("Literal table fields must be named", field.span());
                }
                Scalar value = scalar(assign.value(), Frame.EMPTY, env);
                if (!value.isConstant()) {
                    throw ResolveException.typeMismatch(
                        "Literal table values must be constants", assign.value().span());
                }
                rowNames.add(assign.alias());
                values.add(value.expr());
                if (names == null) {
                    types.add(value.type());
                }
            }
            if (names == null) {
                names = rowNames;
            } else if (!names.equals(rowNames)) {
                throw ResolveException.typeMismatch(
                    "Literal table rows must have the same fields, expected " + names, row.span());
            }
            rows.add(values);
        }
        if (names == null) {
            throw ResolveException.typeMismatch("Literal table must have at least one row", array.span());
        }
        List<ColumnId> ids = new ArrayList<>();
        List<FrameColumn> columns = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            ColumnId id = rq.computed(names.get(i), types.get(i));
            ids.add(id);
            columns.add(FrameColumn.named(id, names.get(i), null));
        }
        RelId rel = rq.add(new Relation.LiteralTable(rows, ids));
        return new RelationValue(rel, Frame.of(columns), null);
    }

    // ==================== Calls ====================

    private Value pipeline(Pipeline pipeline, Frame frame, Environment env) {
        List<Expr> steps = pipeline.steps();
        Value value = eval(steps.get(0), frame, env);
        if (value instanceof FunctionValue head && steps.size() > 1
                && head.callable().positionalParams().size() - head.args().size() == 1) {
            return FunctionValue.of(new Value.PipelineClosure(head, steps.subList(1, steps.size()), env));
        }
        return applySteps(value, steps.subList(1, steps.size()), frame, env);
    }

    private Value applySteps(Value input, List<Expr> steps, Frame frame, Environment env) {
        Value value = input;
        for (Expr step : steps) {
            Arg piped = Arg.ready(value, step.span());
            if (step instanceof FuncCall call) {
                value = call(call, frame, env, piped);
            } else if (step instanceof Ident ident) {
                value = apply(callee(ident, env), List.of(piped), Map.of(), frame, step.span());
            } else {
                throw ResolveException.typeMismatch(
                    "Pipeline step `%s` is not a function call".formatted(step), step.span());
            }
        }
        return value;
    }

    private Value call(FuncCall call, Frame frame, Environment env, Arg piped) {
        FunctionValue function = callee(call.callee(), env);
        List<Arg> args = new ArrayList<>();
        for (Expr arg : call.args()) {
            args.add(Arg.pending(arg, env));
        }
        if (piped != null) {
            args.add(piped);
        }
        Map<String, Arg> named = new LinkedHashMap<>();
        call.namedArgs().forEach((name, arg) -> named.put(name, Arg.pending(arg, env)));
        return apply(function, args, named, frame, call.span());
    }

    private FunctionValue callee(Expr callee, Environment env) {
        if (!(callee instanceof Ident ident)) {
            throw ResolveException.typeMismatch("Expected a function name, found `%s`".formatted(callee),
                callee.span());
        }
        if (!ident.isQualified()) {
            Optional<Value> bound = env.lookup(ident.name());
            if (bound.isPresent()) {
                return expectFunction(bound.get(), ident);
            }
        }
        Optional<Value> global = global(ident);
        if (global.isPresent()) {
            return expectFunction(global.get(), ident);
        }
        throw ResolveException.unknownName(ident.fullName(), ident.span());
    }

    private static FunctionValue expectFunction(Value value, Ident ident) {
        if (value instanceof FunctionValue function) {
            return function;
        }
        throw ResolveException.typeMismatch("`%s` is not a function".formatted(ident.fullName()), ident.span());
    }

    /**
     * Applies a function to further arguments. Returns a partially applied
     * function while positional arguments are missing.
     */
    Value apply(FunctionValue function, List<Arg> newArgs, Map<String, Arg> newNamed,
                Frame frame, SourceSpan span) {
        Callable callable = function.callable();
        List<Arg> args = new ArrayList<>(function.args());
        args.addAll(newArgs);
        Map<String, Arg> named = new LinkedHashMap<>(function.named());
        for (Map.Entry<String, Arg> entry : newNamed.entrySet()) {
            boolean known = callable.params().stream()
                .anyMatch(p -> p.hasDefault() && p.name().equals(entry.getKey()));
            if (!known) {
                throw new ResolveException(ResolveException.Reason.UNKNOWN_NAME, entry.getKey(),
                    "Unknown argument `%s` for `%s`".formatted(entry.getKey(), callable.name()),
                    entry.getValue().span());
            }
            named.put(entry.getKey(), entry.getValue());
        }

        int expected = callable.positionalParams().size();
        if (args.size() > expected) {
            throw ResolveException.typeMismatch("Function `%s` takes %d argument%s, but %d were given"
                .formatted(callable.name(), expected, expected == 1 ? "" : "s", args.size()), span);
        }
        if (args.size() < expected) {
            return new FunctionValue(callable, args, named);
        }

        if (callable instanceof Value.Transform transform) {
            return transforms.apply(transform.kind(), args, named, frame, span);
        } else if (callable instanceof Value.Builtin builtin) {
            return builtin(builtin.function(), args, frame, span);
        } else if (callable instanceof Value.PipelineClosure closure) {
            Value head = apply(closure.head(), args, Map.of(), frame, span);
            return applySteps(head, closure.rest(), frame, closure.env());
        }
        return inline(((Value.UserFunction) callable).definition(), args, named, frame, span);
    }

    /**
     * Resolves one argument against its parameter, checking the declared
     * kind.
     */
    Value resolveArg(Arg arg, Param param, Frame frame) {
        Value value;
        if (arg.isReady()) {
            value = arg.value();
        } else if (param.kind() == ParamKind.RELATION) {
            value = relation(arg.expr(), arg.env());
        } else {
            value = eval(arg.expr(), frame, arg.env());
        }
        return checkKind(value, param, arg.span());
    }

    private static Value checkKind(Value value, Param param, SourceSpan span) {
        if (param.kind() == null) {
            return value;
        }
        boolean ok = switch (param.kind()) {
            case RELATION -> value instanceof RelationValue;
            case COLUMN -> value instanceof Scalar scalar && scalar.column() != null;
            case SCALAR -> value instanceof Scalar;
            case FUNCTION -> value instanceof FunctionValue;
        };
        if (!ok) {
            throw ResolveException.typeMismatch("Argument `%s` expects a %s, found %s".formatted(
                param.name(), param.kind().name().toLowerCase(java.util.Locale.ROOT), describe(value)), span);
        }
        return value;
    }

    private Scalar builtin(BuiltinFunction function, List<Arg> args, Frame frame, SourceSpan span) {
        List<Param> params = function.params();
        List<RqExpr> exprs = new ArrayList<>();
        List<Ty> types = new ArrayList<>();
        boolean aggregate = function.category() == FunctionCategory.AGGREGATE;
        boolean window = function.category() == FunctionCategory.WINDOW;

        for (int i = 0; i < params.size(); i++) {
            Param param = params.get(i);
            Value value = resolveArg(args.get(i), param, frame);
            if ("count".equals(function.name()) && value instanceof RelationStar) {
                return new Scalar(new RqExpr.FunctionCall(FunctionRegistry.COUNT_ALL, List.of()), Ty.INT,
                    null, null, true, false);
            }
            if (window && "relation".equals(param.name())) {
                // ranking functions only read the partition
                continue;
            }
            Scalar scalar = expectScalar(value, args.get(i).span());
            checkArgumentType(function, scalar, args.get(i).span());
            exprs.add(scalar.expr());
            types.add(scalar.type());
            aggregate |= scalar.aggregate();
            window |= scalar.window();
        }
        RqExpr call = new RqExpr.FunctionCall(function.name(), exprs);
        return new Scalar(call, function.returnType(types), null, null, aggregate, window);
    }

    private static void checkArgumentType(BuiltinFunction function, Scalar arg, SourceSpan span) {
        Ty type = arg.type();
        boolean ok = switch (function.argumentType()) {
            case ANY -> true;
            case NUMERIC -> type.canBeNumeric();
            case TEXT -> type == Ty.TEXT || type == Ty.UNKNOWN || type == Ty.NULL;
        };
        if (!ok) {
            throw ResolveException.typeMismatch("Function `%s` expects %s arguments, found %s".formatted(
                function.name(), function.argumentType().name().toLowerCase(java.util.Locale.ROOT),
                type.displayName()), span);
        }
    }

    private Value inline(FuncDef def, List<Arg> args, Map<String, Arg> named, Frame frame, SourceSpan span) {
        if (depth >= recursionLimit) {
            throw new ResolveException(ResolveException.Reason.RECURSION_LIMIT_EXCEEDED, def.name(),
                "Function `%s` exceeded the recursion limit of %d".formatted(def.name(), recursionLimit), span);
        }
        depth++;
        try {
            List<Param> positional = def.positionalParams();
            Map<String, Value> bindings = new HashMap<>();
            Frame callFrame = frame;

            // relations first: the other arguments resolve against their frame
            for (int i = 0; i < positional.size(); i++) {
                Param param = positional.get(i);
                Arg arg = args.get(i);
                if (param.kind() == ParamKind.RELATION || arg.isReady()) {
                    Value value = resolveArg(arg, param, callFrame);
                    bindings.put(param.name(), value);
                    if (value instanceof RelationValue relation && callFrame == frame) {
                        callFrame = relation.frame();
                    }
                }
            }
            for (int i = 0; i < positional.size(); i++) {
                Param param = positional.get(i);
                if (!bindings.containsKey(param.name())) {
                    bindings.put(param.name(), resolveArg(args.get(i), param, callFrame));
                }
            }
            for (Param param : def.params()) {
                if (!param.hasDefault()) {
                    continue;
                }
                Arg arg = named.get(param.name());
                Value value = arg != null
                    ? resolveArg(arg, param, callFrame)
                    : checkKind(eval(param.defaultValue(), callFrame, Environment.root()), param, span);
                bindings.put(param.name(), value);
            }

            logger.debug("Inlining `{}` at depth {}", def.name(), depth);
            return eval(def.body(), callFrame, Environment.of(bindings));
        } finally {
            depth--;
        }
    }
}
