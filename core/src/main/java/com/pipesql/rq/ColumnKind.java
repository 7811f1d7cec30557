package com.pipesql.rq;

public enum ColumnKind {
    /** A named column of a table or declared relation. */
    TABLE,
    /** All columns of a relation whose column list is not known. */
    WILDCARD,
    /** A column computed by a {@link Compute}. */
    COMPUTED
}
