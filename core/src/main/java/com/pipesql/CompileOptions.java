package com.pipesql;

import com.pipesql.dialect.Dialect;
import com.pipesql.semantic.Resolver;
import com.pipesql.semantic.TableCatalog;

import java.util.Objects;
import java.util.Properties;

/**
 * Options for {@link PipeSql#compile(String, CompileOptions)}.
 *
 * <p>Instances are immutable. Use {@link #builder()} or
 * {@link #fromProperties(Properties)}:
 * <pre>
 *   CompileOptions options = CompileOptions.builder()
 *       .target(Dialect.POSTGRES)
 *       .format(false)
 *       .build();
 * </pre>
 */
public final class CompileOptions {

    public static final String TARGET_PROPERTY = "pipesql.target";
    public static final String FORMAT_PROPERTY = "pipesql.format";
    public static final String SIGNATURE_COMMENT_PROPERTY = "pipesql.signature-comment";
    public static final String RECURSION_LIMIT_PROPERTY = "pipesql.recursion-limit";

    private static final CompileOptions DEFAULTS = builder().build();

    private final Dialect target;
    private final boolean format;
    private final boolean signatureComment;
    private final int recursionLimit;
    private final TableCatalog catalog;

    private CompileOptions(Builder builder) {
        this.target = builder.target;
        this.format = builder.format;
        this.signatureComment = builder.signatureComment;
        this.recursionLimit = builder.recursionLimit;
        this.catalog = builder.catalog;
    }

    public static CompileOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from properties. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static CompileOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        Builder builder = builder();
        String target = properties.getProperty(TARGET_PROPERTY);
        if (target != null) {
            builder.target(target);
        }
        String format = properties.getProperty(FORMAT_PROPERTY);
        if (format != null) {
            builder.format(parseBoolean(FORMAT_PROPERTY, format));
        }
        String signature = properties.getProperty(SIGNATURE_COMMENT_PROPERTY);
        if (signature != null) {
            builder.signatureComment(parseBoolean(SIGNATURE_COMMENT_PROPERTY, signature));
        }
        String limit = properties.getProperty(RECURSION_LIMIT_PROPERTY);
        if (limit != null) {
            try {
                builder.recursionLimit(Integer.parseInt(limit.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid value for " + RECURSION_LIMIT_PROPERTY + ": " + limit, e);
            }
        }
        return builder.build();
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.trim();
        if (normalized.equalsIgnoreCase("true")) {
            return true;
        }
        if (normalized.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }

    public Dialect target() {
        return target;
    }

    public boolean format() {
        return format;
    }

    public boolean signatureComment() {
        return signatureComment;
    }

    public int recursionLimit() {
        return recursionLimit;
    }

    public TableCatalog catalog() {
        return catalog;
    }

    public Builder toBuilder() {
        return builder()
            .target(target)
            .format(format)
            .signatureComment(signatureComment)
            .recursionLimit(recursionLimit)
            .catalog(catalog);
    }

    @Override
    public String toString() {
        return "CompileOptions(target=" + target.target() + ", format=" + format
            + ", signatureComment=" + signatureComment + ", recursionLimit=" + recursionLimit + ")";
    }

    public static final class Builder {
        private Dialect target = Dialect.GENERIC;
        private boolean format = true;
        private boolean signatureComment = true;
        private int recursionLimit = Resolver.DEFAULT_RECURSION_LIMIT;
        private TableCatalog catalog = TableCatalog.empty();

        private Builder() {
        }

        public Builder target(Dialect target) {
            this.target = Objects.requireNonNull(target, "target must not be null");
            return this;
        }

        /**
         * Sets the target from its name, with or without the {@code sql.}
         * prefix.
         */
        public Builder target(String target) {
            this.target = Dialect.fromTarget(target);
            return this;
        }

        public Builder format(boolean format) {
            this.format = format;
            return this;
        }

        public Builder signatureComment(boolean signatureComment) {
            this.signatureComment = signatureComment;
            return this;
        }

        public Builder recursionLimit(int recursionLimit) {
            if (recursionLimit < 1) {
                throw new IllegalArgumentException("recursionLimit must be positive: " + recursionLimit);
            }
            this.recursionLimit = recursionLimit;
            return this;
        }

        public Builder catalog(TableCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(this);
        }
    }
}
