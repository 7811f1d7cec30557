package com.pipesql.functions;

import com.pipesql.dialect.DialectDescriptor;
import com.pipesql.pl.Param;
import com.pipesql.pl.ParamKind;
import com.pipesql.rq.Ty;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of standard-library functions and their SQL translations.
 *
 * <p>Function categories:
 * <ul>
 *   <li>Aggregate functions: sum, average, min, max, stddev, count, count_distinct</li>
 *   <li>Window functions: row_number, rank, rank_dense, lag, lead, first, last</li>
 *   <li>String functions: lower, upper, length, trim (also under {@code text.})</li>
 *   <li>Math functions: abs, floor, ceil, round (also under {@code math.})</li>
 *   <li>Conditional functions: coalesce</li>
 *   <li>Internal: concat, used for f-strings</li>
 * </ul>
 *
 * <p>Parameters follow pipeline conventions: the argument usually supplied
 * through a pipe comes last, so {@code x | round 2} is {@code round 2 x}.
 *
 * @see BuiltinFunction
 */
public final class FunctionRegistry {

    /** Internal name of {@code count this}. */
    public static final String COUNT_ALL = "count_all";

    /** Internal name of f-string concatenation. */
    public static final String CONCAT = "concat";

    private static final Map<String, BuiltinFunction> FUNCTIONS = new HashMap<>();
    private static final Map<String, String> ALIASES = new HashMap<>();

    static {
        initializeAggregateFunctions();
        initializeWindowFunctions();
        initializeStringFunctions();
        initializeMathFunctions();
        initializeConditionalFunctions();
    }

    private FunctionRegistry() {
        // Utility class - prevent instantiation
    }

    /**
     * Looks up a function by name or alias.
     *
     * @param functionName the name as written, e.g. {@code sum} or {@code text.lower}
     * @return the function, or empty if not a standard-library function
     */
    public static Optional<BuiltinFunction> lookup(String functionName) {
        if (functionName == null || functionName.isEmpty()) {
            return Optional.empty();
        }
        String normalized = functionName.toLowerCase(Locale.ROOT);
        String canonical = ALIASES.getOrDefault(normalized, normalized);
        return Optional.ofNullable(FUNCTIONS.get(canonical));
    }

    /**
     * Checks if a function is supported.
     *
     * @param functionName the function name
     * @return true if supported, false otherwise
     */
    public static boolean isSupported(String functionName) {
        return lookup(functionName).isPresent();
    }

    /**
     * Translates a call to SQL for the given dialect.
     *
     * @param functionName canonical function name
     * @param dialect the target dialect
     * @param args rendered SQL arguments
     * @return the SQL call
     * @throws UnsupportedOperationException if the function is unknown or the
     *         dialect cannot express it
     */
    public static String translate(String functionName, DialectDescriptor dialect, List<String> args) {
        BuiltinFunction function = lookup(functionName)
            .orElseThrow(() -> new UnsupportedOperationException("Unsupported function: " + functionName));
        String template = function.template(dialect.name());
        if (template == null) {
            throw new UnsupportedOperationException(
                "Function " + functionName + " is not available in dialect " + dialect.name());
        }
        if (function.isVariadic()) {
            return template.formatted(String.join(function.separator(dialect.name()), args));
        }
        return template.formatted(args.toArray());
    }

    private static void register(BuiltinFunction function, String... aliases) {
        FUNCTIONS.put(function.name(), function);
        for (String alias : aliases) {
            ALIASES.put(alias, function.name());
        }
    }

    private static Ty firstArgType(List<Ty> args) {
        return args.isEmpty() ? Ty.UNKNOWN : args.get(0);
    }

    private static Ty lastArgType(List<Ty> args) {
        return args.isEmpty() ? Ty.UNKNOWN : args.get(args.size() - 1);
    }

    private static Ty numericType(List<Ty> args) {
        Ty type = lastArgType(args);
        return type.isNumeric() ? type : Ty.NUMBER;
    }

    // ==================== Aggregate Functions ====================

    private static void initializeAggregateFunctions() {
        Param column = Param.of("column", ParamKind.SCALAR);

        register(BuiltinFunction.builder("sum", FunctionCategory.AGGREGATE)
            .params(column).argumentType(BuiltinFunction.ArgumentType.NUMERIC)
            .returns(FunctionRegistry::numericType).sql("SUM(%s)").build(), "std.sum");
        register(BuiltinFunction.builder("average", FunctionCategory.AGGREGATE)
            .params(column).argumentType(BuiltinFunction.ArgumentType.NUMERIC)
            .returns(Ty.FLOAT).sql("AVG(%s)").build(), "avg", "std.average");
        register(BuiltinFunction.builder("min", FunctionCategory.AGGREGATE)
            .params(column).returns(FunctionRegistry::firstArgType).sql("MIN(%s)").build(), "std.min");
        register(BuiltinFunction.builder("max", FunctionCategory.AGGREGATE)
            .params(column).returns(FunctionRegistry::firstArgType).sql("MAX(%s)").build(), "std.max");
        register(BuiltinFunction.builder("stddev", FunctionCategory.AGGREGATE)
            .params(column).argumentType(BuiltinFunction.ArgumentType.NUMERIC)
            .returns(Ty.FLOAT).sql("STDDEV(%s)")
            .sql("mssql", "STDEV(%s)")
            .sql("sqlite", null)
            .build(), "std.stddev");
        register(BuiltinFunction.builder("count", FunctionCategory.AGGREGATE)
            .params(Param.of("column")).returns(Ty.INT).sql("COUNT(%s)").build(), "std.count");
        register(BuiltinFunction.builder(COUNT_ALL, FunctionCategory.AGGREGATE)
            .returns(Ty.INT).sql("COUNT(*)").build());
        register(BuiltinFunction.builder("count_distinct", FunctionCategory.AGGREGATE)
            .params(column).returns(Ty.INT).sql("COUNT(DISTINCT %s)").build(), "std.count_distinct");
    }

    // ==================== Window Functions ====================

    private static void initializeWindowFunctions() {
        // ranking functions take the relation (`this`) only to read naturally in pipelines
        Param relation = Param.of("relation");
        Param offset = Param.of("offset", ParamKind.SCALAR);
        Param column = Param.of("column", ParamKind.SCALAR);

        register(BuiltinFunction.builder("row_number", FunctionCategory.WINDOW)
            .params(relation).returns(Ty.INT).sql("ROW_NUMBER()").build(), "std.row_number");
        register(BuiltinFunction.builder("rank", FunctionCategory.WINDOW)
            .params(relation).returns(Ty.INT).sql("RANK()").build(), "std.rank");
        register(BuiltinFunction.builder("rank_dense", FunctionCategory.WINDOW)
            .params(relation).returns(Ty.INT).sql("DENSE_RANK()").build(), "dense_rank", "std.rank_dense");
        register(BuiltinFunction.builder("lag", FunctionCategory.WINDOW)
            .params(offset, column).returns(FunctionRegistry::lastArgType).sql("LAG(%2$s, %1$s)").build(), "std.lag");
        register(BuiltinFunction.builder("lead", FunctionCategory.WINDOW)
            .params(offset, column).returns(FunctionRegistry::lastArgType).sql("LEAD(%2$s, %1$s)").build(), "std.lead");
        register(BuiltinFunction.builder("first", FunctionCategory.WINDOW)
            .params(column).returns(FunctionRegistry::firstArgType).sql("FIRST_VALUE(%s)").build(), "std.first");
        register(BuiltinFunction.builder("last", FunctionCategory.WINDOW)
            .params(column).returns(FunctionRegistry::firstArgType).sql("LAST_VALUE(%s)").build(), "std.last");
    }

    // ==================== String Functions ====================

    private static void initializeStringFunctions() {
        Param column = Param.of("column", ParamKind.SCALAR);

        register(BuiltinFunction.builder("lower", FunctionCategory.SCALAR)
            .params(column).argumentType(BuiltinFunction.ArgumentType.TEXT)
            .returns(Ty.TEXT).sql("LOWER(%s)").build(), "text.lower");
        register(BuiltinFunction.builder("upper", FunctionCategory.SCALAR)
            .params(column).argumentType(BuiltinFunction.ArgumentType.TEXT)
            .returns(Ty.TEXT).sql("UPPER(%s)").build(), "text.upper");
        register(BuiltinFunction.builder("length", FunctionCategory.SCALAR)
            .params(column).argumentType(BuiltinFunction.ArgumentType.TEXT)
            .returns(Ty.INT).sql("LENGTH(%s)")
            .sql("mssql", "LEN(%s)")
            .build(), "text.length");
        register(BuiltinFunction.builder("trim", FunctionCategory.SCALAR)
            .params(column).argumentType(BuiltinFunction.ArgumentType.TEXT)
            .returns(Ty.TEXT).sql("TRIM(%s)").build(), "text.trim");
    }

    // ==================== Math Functions ====================

    private static void initializeMathFunctions() {
        Param column = Param.of("column", ParamKind.SCALAR);

        register(BuiltinFunction.builder("abs", FunctionCategory.SCALAR)
            .params(column).argumentType(BuiltinFunction.ArgumentType.NUMERIC)
            .returns(FunctionRegistry::numericType).sql("ABS(%s)").build(), "math.abs");
        register(BuiltinFunction.builder("floor", FunctionCategory.SCALAR)
            .params(column).argumentType(BuiltinFunction.ArgumentType.NUMERIC)
            .returns(FunctionRegistry::numericType).sql("FLOOR(%s)").build(), "math.floor");
        register(BuiltinFunction.builder("ceil", FunctionCategory.SCALAR)
            .params(column).argumentType(BuiltinFunction.ArgumentType.NUMERIC)
            .returns(FunctionRegistry::numericType).sql("CEIL(%s)")
            .sql("mssql", "CEILING(%s)")
            .build(), "math.ceil");
        register(BuiltinFunction.builder("round", FunctionCategory.SCALAR)
            .params(Param.of("digits", ParamKind.SCALAR), column)
            .argumentType(BuiltinFunction.ArgumentType.NUMERIC)
            .returns(FunctionRegistry::numericType).sql("ROUND(%2$s, %1$s)").build(), "math.round");
    }

    // ==================== Conditional Functions ====================

    private static void initializeConditionalFunctions() {
        register(BuiltinFunction.builder("coalesce", FunctionCategory.SCALAR)
            .params(Param.of("fallback", ParamKind.SCALAR), Param.of("column", ParamKind.SCALAR))
            .returns(FunctionRegistry::lastArgType).sql("COALESCE(%2$s, %1$s)").build());
        register(BuiltinFunction.builder(CONCAT, FunctionCategory.SCALAR)
            .variadic().returns(Ty.TEXT).sql("CONCAT(%s)")
            .sql("sqlite", "(%s)").separator("sqlite", " || ")
            .build());
    }
}
