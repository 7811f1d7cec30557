package com.pipesql.pl;

/**
 * Base type of every PL expression node.
 *
 * <p>PL is the tree produced by the parser. It mirrors the surface syntax:
 * transforms are ordinary {@link FuncCall}s naming a standard transform or a
 * user function, and pipelines keep their steps unresolved. The tree is
 * immutable once built.
 */
public sealed interface Expr
    permits Literal, Ident, UnaryExpr, BinaryExpr, FuncCall, Assign, Range,
            TupleExpr, ArrayExpr, Pipeline, CaseExpr, InterpolatedString {

    /**
     * Returns the location of this node in the source text.
     *
     * @return the span, never null
     */
    SourceSpan span();
}
