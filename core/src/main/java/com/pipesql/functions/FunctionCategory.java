package com.pipesql.functions;

/**
 * How a standard-library function behaves with respect to rows.
 */
public enum FunctionCategory {
    /** Row-wise function. */
    SCALAR,
    /** Collapses a group to one value; windowed when used outside {@code aggregate}. */
    AGGREGATE,
    /** Only meaningful over a window (ranking and offset functions). */
    WINDOW
}
