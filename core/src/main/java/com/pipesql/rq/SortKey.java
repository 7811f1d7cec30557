package com.pipesql.rq;

import java.util.Objects;

public record SortKey(RqExpr expr, SortDirection direction) {

    public SortKey {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }

    public static SortKey asc(ColumnId column) {
        return new SortKey(new RqExpr.ColumnRef(column), SortDirection.ASC);
    }

    public static SortKey desc(ColumnId column) {
        return new SortKey(new RqExpr.ColumnRef(column), SortDirection.DESC);
    }
}
