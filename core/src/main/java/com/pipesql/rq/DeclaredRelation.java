package com.pipesql.rq;

import java.util.Objects;

/**
 * A relation bound to a name by {@code let}, lowered to a CTE when the
 * dialect allows.
 */
public record DeclaredRelation(String name, RelId root) {

    public DeclaredRelation {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(root, "root must not be null");
    }
}
