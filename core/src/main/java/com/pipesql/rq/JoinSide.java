package com.pipesql.rq;

import java.util.Locale;

public enum JoinSide {
    INNER,
    LEFT,
    RIGHT,
    FULL;

    /**
     * Parses the value of a {@code side:} argument.
     *
     * @return the side, or null for an unknown name
     */
    public static JoinSide fromName(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "inner" -> INNER;
            case "left" -> LEFT;
            case "right" -> RIGHT;
            case "full" -> FULL;
            default -> null;
        };
    }

    public String sqlKeyword() {
        return switch (this) {
            case INNER -> "JOIN";
            case LEFT -> "LEFT JOIN";
            case RIGHT -> "RIGHT JOIN";
            case FULL -> "FULL JOIN";
        };
    }
}
