package com.pipesql.rq;

import java.util.Objects;

/**
 * Bounds of a window frame in rows or range units. A null bound is
 * unbounded; 0 is the current row; negative offsets precede it.
 */
public record WindowFrame(Unit unit, Long start, Long end) {

    public enum Unit {
        ROWS,
        RANGE
    }

    /** Whole partition, the default for aggregations. */
    public static final WindowFrame UNBOUNDED = new WindowFrame(Unit.ROWS, null, null);

    public WindowFrame {
        Objects.requireNonNull(unit, "unit must not be null");
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }
}
