package com.pipesql.dialect;

/**
 * How a dialect spells row limits.
 */
public enum LimitStyle {
    /** {@code LIMIT n OFFSET m} */
    LIMIT_OFFSET,
    /** {@code OFFSET m ROWS FETCH FIRST n ROWS ONLY} */
    FETCH_FIRST,
    /** {@code SELECT TOP (n)}, with {@code OFFSET .. FETCH NEXT} when skipping rows */
    TOP,
    /** {@code LIMIT n} only; skipping rows is not expressible */
    LIMIT_ONLY
}
