package com.pipesql.pl;

/**
 * A top-level {@code let} statement.
 */
public sealed interface Declaration permits FuncDef, VarDef {

    String name();

    SourceSpan span();
}
