package com.pipesql.rq;

/**
 * Index of a column declaration in the {@link RqQuery} arena. Column ids are
 * unique across the whole query, so two relations never share an id unless
 * one passes the other's column through.
 */
public record ColumnId(int index) {

    @Override
    public String toString() {
        return "c" + index;
    }
}
