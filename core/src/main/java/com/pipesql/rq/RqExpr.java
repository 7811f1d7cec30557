package com.pipesql.rq;

import java.util.List;
import java.util.Objects;

/**
 * Fully resolved scalar expression. Every column reference is a
 * {@link ColumnId}; no names are left to bind.
 */
public sealed interface RqExpr {

    record ColumnRef(ColumnId column) implements RqExpr {
        public ColumnRef {
            Objects.requireNonNull(column, "column must not be null");
        }
    }

    /**
     * A constant. Values are {@code Long}, {@code Double}, {@code Boolean},
     * {@code String} (text, dates and times) or null.
     */
    record Constant(Object value, Ty type) implements RqExpr {
        public Constant {
            Objects.requireNonNull(type, "type must not be null");
        }

        public static Constant of(long value) {
            return new Constant(value, Ty.INT);
        }

        public static Constant ofBoolean(boolean value) {
            return new Constant(value, Ty.BOOL);
        }
    }

    record Unary(RqOperator operator, RqExpr operand) implements RqExpr {
        public Unary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    record Binary(RqExpr left, RqOperator operator, RqExpr right) implements RqExpr {
        public Binary {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /**
     * Call of a standard-library function, named by its canonical registry
     * name (see {@code FunctionRegistry}).
     */
    record FunctionCall(String name, List<RqExpr> args) implements RqExpr {
        public FunctionCall {
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }
    }

    record Case(List<Branch> branches, RqExpr otherwise) implements RqExpr {
        public Case {
            branches = List.copyOf(branches);
        }
    }

    record Branch(RqExpr condition, RqExpr value) {
    }

    record Between(RqExpr operand, RqExpr low, RqExpr high) implements RqExpr {
    }

    /**
     * Raw SQL text with interpolated expressions, from an s-string. Parts are
     * {@code String} text or {@link RqExpr}.
     */
    record RawSql(List<Object> parts) implements RqExpr {
        public RawSql {
            parts = List.copyOf(parts);
        }
    }
}
