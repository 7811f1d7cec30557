package com.pipesql.dialect;

import com.pipesql.rq.JoinSide;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Built-in target dialects.
 *
 * <p>Targets are named {@code sql.<dialect>} in configuration, e.g.
 * {@code sql.postgres}; {@link #fromTarget(String)} accepts either form.
 */
public enum Dialect {
    GENERIC(DialectDescriptor.builder("generic").build()),

    ANSI(DialectDescriptor.builder("ansi")
        .limitStyle(LimitStyle.FETCH_FIRST)
        .build()),

    BIGQUERY(DialectDescriptor.builder("bigquery")
        .identifierQuotes("`", "`")
        .starExcludeKeyword("EXCEPT")
        .regexMatchTemplate("REGEXP_CONTAINS(%s, %s)")
        .intDivTemplate("DIV(%s, %s)")
        .build()),

    CLICKHOUSE(DialectDescriptor.builder("clickhouse")
        .identifierQuotes("`", "`")
        .starExcludeKeyword("EXCEPT")
        .regexMatchTemplate("match(%s, %s)")
        .intDivTemplate("intDiv(%s, %s)")
        .build()),

    DUCKDB(DialectDescriptor.builder("duckdb")
        .starExcludeKeyword("EXCLUDE")
        .regexMatchTemplate("REGEXP_MATCHES(%s, %s)")
        .intDivTemplate("(%s // %s)")
        .build()),

    HIVE(DialectDescriptor.builder("hive")
        .identifierQuotes("`", "`")
        .limitStyle(LimitStyle.LIMIT_ONLY)
        .regexMatchTemplate("%s RLIKE %s")
        .intDivTemplate("(%s DIV %s)")
        .build()),

    MSSQL(DialectDescriptor.builder("mssql")
        .identifierQuotes("[", "]")
        .limitStyle(LimitStyle.TOP)
        .build()),

    MYSQL(DialectDescriptor.builder("mysql")
        .identifierQuotes("`", "`")
        .limitForOffsetOnly("18446744073709551615")
        .joinSides(JoinSide.INNER, JoinSide.LEFT, JoinSide.RIGHT)
        .regexMatchTemplate("%s REGEXP %s")
        .intDivTemplate("(%s DIV %s)")
        .build()),

    POSTGRES(DialectDescriptor.builder("postgres")
        .regexMatchTemplate("%s ~ %s")
        .build()),

    SNOWFLAKE(DialectDescriptor.builder("snowflake")
        .starExcludeKeyword("EXCLUDE")
        .regexMatchTemplate("REGEXP_LIKE(%s, %s)")
        .build()),

    SQLITE(DialectDescriptor.builder("sqlite")
        .limitForOffsetOnly("-1")
        .intDivTemplate("CAST(%s / %s AS INTEGER)")
        .build());

    private final DialectDescriptor descriptor;

    Dialect(DialectDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    public DialectDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Returns the configuration name, e.g. {@code sql.duckdb}.
     */
    public String target() {
        return "sql." + descriptor.name();
    }

    /**
     * Parses a target name such as {@code sql.postgres} or {@code postgres}.
     *
     * @param target the target name, case-insensitive
     * @return the dialect
     * @throws IllegalArgumentException if the name is not a known dialect
     */
    public static Dialect fromTarget(String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Target must not be empty");
        }
        String normalized = target.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("sql.")) {
            normalized = normalized.substring(4);
        }
        for (Dialect dialect : values()) {
            if (dialect.descriptor.name().equals(normalized)) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unknown target: " + target + ". Valid values: "
            + Arrays.stream(values()).map(Dialect::target).collect(Collectors.joining(", ")));
    }
}
