package com.pipesql.semantic;

import com.pipesql.functions.BuiltinFunction;
import com.pipesql.pl.Expr;
import com.pipesql.pl.FuncDef;
import com.pipesql.pl.Param;
import com.pipesql.pl.SourceSpan;
import com.pipesql.pl.TransformKind;
import com.pipesql.rq.RelId;
import com.pipesql.rq.RqExpr;
import com.pipesql.rq.Ty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of resolving a PL expression.
 */
sealed interface Value {

    /**
     * A scalar expression.
     *
     * @param expr the resolved expression
     * @param type its inferred type
     * @param name name the value gets when it becomes a column, or null
     * @param column the frame column, when the value is a plain column reference
     * @param aggregate whether it contains an aggregate call
     * @param window whether it contains a window-only call
     */
    record Scalar(RqExpr expr, Ty type, String name, FrameColumn column,
                  boolean aggregate, boolean window) implements Value {

        public Scalar {
            Objects.requireNonNull(expr, "expr must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }

        static Scalar of(RqExpr expr, Ty type) {
            return new Scalar(expr, type, null, null, false, false);
        }

        static Scalar ofColumn(FrameColumn column, Ty type) {
            return new Scalar(new RqExpr.ColumnRef(column.id()), type, column.name(), column, false, false);
        }

        Scalar withName(String newName) {
            return new Scalar(expr, type, newName, column, aggregate, window);
        }

        boolean isConstant() {
            return expr instanceof RqExpr.Constant;
        }
    }

    /**
     * A tuple {@code {..}} or array {@code [..]} of values.
     */
    record TupleValue(List<Field> fields, boolean array) implements Value {
        public TupleValue {
            fields = List.copyOf(fields);
        }
    }

    record Field(String alias, Value value, SourceSpan span) {
    }

    /**
     * A relation together with the frame describing its columns.
     *
     * @param rel the RQ relation
     * @param frame its columns and context
     * @param name namespace used when the relation is joined, or null
     */
    record RelationValue(RelId rel, Frame frame, String name) implements Value {
        public RelationValue {
            Objects.requireNonNull(rel, "rel must not be null");
            Objects.requireNonNull(frame, "frame must not be null");
        }

        RelationValue withFrame(Frame newFrame) {
            return new RelationValue(rel, newFrame, name);
        }

        RelationValue withRel(RelId newRel, Frame newFrame) {
            return new RelationValue(newRel, newFrame, name);
        }
    }

    /**
     * {@code this} used as a value, e.g. in {@code count this}.
     */
    record RelationStar(SourceSpan span) implements Value {
    }

    /**
     * A range {@code a..b}; either end may be null.
     */
    record RangeValue(Scalar start, Scalar end) implements Value {
    }

    /**
     * A callable, possibly with some arguments already bound. Arguments are
     * kept unresolved until the call is complete, because what they resolve
     * to depends on the relation the call is finally applied to.
     */
    record FunctionValue(Callable callable, List<Arg> args, Map<String, Arg> named) implements Value {
        public FunctionValue {
            args = List.copyOf(args);
            named = Map.copyOf(named);
        }

        static FunctionValue of(Callable callable) {
            return new FunctionValue(callable, List.of(), Map.of());
        }
    }

    /**
     * A call argument: either an expression still to be resolved in the
     * environment it was written in, or an already resolved value (the input
     * of a pipeline step).
     */
    record Arg(Expr expr, Environment env, Value value, SourceSpan span) {

        static Arg pending(Expr expr, Environment env) {
            return new Arg(expr, env, null, expr.span());
        }

        static Arg ready(Value value, SourceSpan span) {
            return new Arg(null, null, value, span);
        }

        boolean isReady() {
            return value != null;
        }
    }

    /**
     * Something that can be called.
     */
    sealed interface Callable {
        String name();

        List<Param> params();

        default List<Param> positionalParams() {
            return params().stream().filter(p -> !p.hasDefault()).toList();
        }
    }

    record Builtin(BuiltinFunction function) implements Callable {
        @Override
        public String name() {
            return function.name();
        }

        @Override
        public List<Param> params() {
            return function.params();
        }
    }

    record Transform(TransformKind kind) implements Callable {
        @Override
        public String name() {
            return kind.keyword();
        }

        @Override
        public List<Param> params() {
            return TransformResolver.signature(kind);
        }
    }

    /**
     * A nested pipeline whose first step still lacks its input, such as
     * {@code (sort x | take 1)}. Applying it pipes the input through the
     * steps.
     */
    record PipelineClosure(FunctionValue head, List<Expr> rest, Environment env) implements Callable {
        private static final List<Param> PARAMS = List.of(Param.of("relation"));

        public PipelineClosure {
            rest = List.copyOf(rest);
        }

        @Override
        public String name() {
            return head.callable().name();
        }

        @Override
        public List<Param> params() {
            return PARAMS;
        }
    }

    record UserFunction(FuncDef definition) implements Callable {
        @Override
        public String name() {
            return definition.name();
        }

        @Override
        public List<Param> params() {
            return definition.params();
        }
    }
}
