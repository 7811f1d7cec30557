package com.pipesql.semantic;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parameter bindings of the user function being inlined.
 *
 * <p>Scoping is lexical: a function body sees its own parameters only, never
 * those of its caller, so each call starts from {@link #root()}.
 */
final class Environment {

    private static final Environment ROOT = new Environment(Map.of());

    private final Map<String, Value> bindings;

    private Environment(Map<String, Value> bindings) {
        this.bindings = bindings;
    }

    static Environment root() {
        return ROOT;
    }

    static Environment of(Map<String, Value> bindings) {
        return new Environment(new HashMap<>(bindings));
    }

    Optional<Value> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }
}
