package com.pipesql.pl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A call by juxtaposition: {@code name arg1 arg2 named:value}.
 *
 * <p>Positional arguments keep their order; {@link Assign} arguments
 * ({@code alias = expr}) count as positional arguments with an alias.
 * Named arguments bind parameters that declare a default.
 */
public record FuncCall(Expr callee, List<Expr> args, Map<String, Expr> namedArgs, SourceSpan span)
        implements Expr {

    public FuncCall {
        Objects.requireNonNull(callee, "callee must not be null");
        Objects.requireNonNull(args, "args must not be null");
        Objects.requireNonNull(namedArgs, "namedArgs must not be null");
        Objects.requireNonNull(span, "span must not be null");
        args = List.copyOf(args);
        namedArgs = Collections.unmodifiableMap(new LinkedHashMap<>(namedArgs));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(callee.toString());
        namedArgs.forEach((name, value) -> sb.append(' ').append(name).append(':').append(value));
        args.forEach(arg -> sb.append(' ').append(arg));
        return sb.toString();
    }
}
