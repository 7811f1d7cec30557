package com.pipesql.functions;

import com.pipesql.pl.Param;
import com.pipesql.rq.Ty;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Metadata and SQL translation of one standard-library function.
 *
 * <p>SQL templates are {@link String#format} patterns over the rendered RQ
 * arguments, so {@code "ROUND(%2$s, %1$s)"} swaps the two arguments. Dialect
 * overrides are keyed by {@code DialectDescriptor.name()}.
 */
public final class BuiltinFunction {

    private final String name;
    private final FunctionCategory category;
    private final List<Param> params;
    private final Function<List<Ty>, Ty> returnType;
    private final ArgumentType argumentType;
    private final String sqlTemplate;
    private final Map<String, String> dialectTemplates;
    private final boolean variadic;
    private final String separator;
    private final Map<String, String> dialectSeparators;

    /**
     * Required type of every value argument.
     */
    private static final Pattern CALL_FORM = Pattern.compile("[A-Za-z_]+\\((?:%[0-9$]*s(?:, )?)*\\)");
    private static final Pattern PLACEHOLDER = Pattern.compile("%[0-9$]*s");

    public enum ArgumentType {
        ANY,
        NUMERIC,
        TEXT
    }

    private BuiltinFunction(Builder builder) {
        this.name = builder.name;
        this.category = builder.category;
        this.params = List.copyOf(builder.params);
        this.returnType = builder.returnType;
        this.argumentType = builder.argumentType;
        this.sqlTemplate = builder.sqlTemplate;
        this.dialectTemplates = Collections.unmodifiableMap(new HashMap<>(builder.dialectTemplates));
        this.variadic = builder.variadic;
        this.separator = builder.separator;
        this.dialectSeparators = Collections.unmodifiableMap(new HashMap<>(builder.dialectSeparators));
    }

    public static Builder builder(String name, FunctionCategory category) {
        return new Builder(name, category);
    }

    public String name() {
        return name;
    }

    public FunctionCategory category() {
        return category;
    }

    public List<Param> params() {
        return params;
    }

    public ArgumentType argumentType() {
        return argumentType;
    }

    /**
     * Infers the result type from the argument types.
     */
    public Ty returnType(List<Ty> argTypes) {
        return returnType.apply(argTypes);
    }

    /**
     * Returns the SQL template for the dialect, or null when the dialect
     * cannot express the function.
     */
    public String template(String dialect) {
        if (dialectTemplates.containsKey(dialect)) {
            return dialectTemplates.get(dialect);
        }
        return sqlTemplate;
    }

    /**
     * Returns whether the function takes any number of arguments, joined into
     * the single {@code %s} slot of its template.
     */
    public boolean isVariadic() {
        return variadic;
    }

    public String separator(String dialect) {
        return dialectSeparators.getOrDefault(dialect, separator);
    }

    /**
     * Returns whether the dialect template is an operator expression rather
     * than a call, so compound arguments need parentheses. Templates without
     * argument placeholders, such as {@code COUNT(*)}, are complete
     * expressions.
     */
    public boolean needsParenthesizedArguments(String dialect) {
        String template = template(dialect);
        return template != null && PLACEHOLDER.matcher(template).find()
            && !CALL_FORM.matcher(template).matches();
    }

    @Override
    public String toString() {
        return "BuiltinFunction(" + name + ", " + category + ")";
    }

    public static final class Builder {
        private final String name;
        private final FunctionCategory category;
        private List<Param> params = List.of();
        private Function<List<Ty>, Ty> returnType = args -> Ty.UNKNOWN;
        private ArgumentType argumentType = ArgumentType.ANY;
        private String sqlTemplate;
        private final Map<String, String> dialectTemplates = new HashMap<>();
        private boolean variadic;
        private String separator = ", ";
        private final Map<String, String> dialectSeparators = new HashMap<>();

        private Builder(String name, FunctionCategory category) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.category = Objects.requireNonNull(category, "category must not be null");
        }

        public Builder params(Param... params) {
            this.params = List.of(params);
            return this;
        }

        public Builder returns(Ty type) {
            this.returnType = args -> type;
            return this;
        }

        public Builder returns(Function<List<Ty>, Ty> rule) {
            this.returnType = rule;
            return this;
        }

        public Builder argumentType(ArgumentType type) {
            this.argumentType = type;
            return this;
        }

        public Builder sql(String template) {
            this.sqlTemplate = template;
            return this;
        }

        /**
         * Overrides the template for one dialect; a null template marks the
         * function as unsupported there.
         */
        public Builder sql(String dialect, String template) {
            this.dialectTemplates.put(dialect, template);
            return this;
        }

        public Builder variadic() {
            this.variadic = true;
            return this;
        }

        public Builder separator(String dialect, String separator) {
            this.dialectSeparators.put(dialect, separator);
            return this;
        }

        public BuiltinFunction build() {
            Objects.requireNonNull(sqlTemplate, "sql template must be set for " + name);
            return new BuiltinFunction(this);
        }
    }
}
