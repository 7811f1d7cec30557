package com.pipesql.semantic;

import com.pipesql.exception.ResolveException;
import com.pipesql.pl.Declaration;
import com.pipesql.pl.FuncDef;
import com.pipesql.pl.VarDef;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Top-level declarations of a program.
 *
 * <p>A later declaration of a name replaces an earlier one. Variables are
 * resolved lazily on first use and memoized; a variable reached again while
 * it is being resolved is a cyclic reference.
 */
final class SymbolTable {

    private final Map<String, Declaration> declarations = new HashMap<>();
    private final Map<String, Value> resolved = new HashMap<>();
    private final Set<String> inProgress = new LinkedHashSet<>();

    void declare(Declaration declaration) {
        declarations.put(declaration.name(), declaration);
        resolved.remove(declaration.name());
    }

    Optional<Declaration> lookup(String name) {
        return Optional.ofNullable(declarations.get(name));
    }

    Optional<FuncDef> function(String name) {
        Declaration declaration = declarations.get(name);
        return declaration instanceof FuncDef def ? Optional.of(def) : Optional.empty();
    }

    Optional<VarDef> variable(String name) {
        Declaration declaration = declarations.get(name);
        return declaration instanceof VarDef def ? Optional.of(def) : Optional.empty();
    }

    /**
     * Returns the value of a variable, resolving it on first use.
     *
     * @throws ResolveException if the variable depends on itself
     */
    Value resolveVariable(VarDef variable, Function<VarDef, Value> resolver) {
        Value cached = resolved.get(variable.name());
        if (cached != null) {
            return cached;
        }
        if (!inProgress.add(variable.name())) {
            throw new ResolveException(ResolveException.Reason.CYCLIC_RELATION_REFERENCE, variable.name(),
                "Relation `%s` refers to itself through %s".formatted(
                    variable.name(), String.join(" -> ", inProgress)),
                variable.span());
        }
        try {
            Value value = resolver.apply(variable);
            resolved.put(variable.name(), value);
            return value;
        } finally {
            inProgress.remove(variable.name());
        }
    }
}
