package com.pipesql.generator;

import com.pipesql.dialect.DialectDescriptor;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Utilities for quoting SQL identifiers and literals.
 *
 * <p>Identifier quotes come from the dialect ({@code "name"}, {@code `name`}
 * or {@code [name]}); a closing quote inside a name is escaped by doubling
 * it. String literals always use single quotes with doubled embedded quotes.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifierIfNeeded("user id", Dialect.MYSQL.descriptor());
 *   // Result: `user id`
 *
 *   SQLQuoting.quoteLiteral("O'Reilly");
 *   // Result: 'O''Reilly'
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private static final Set<String> RESERVED_WORDS = Set.of(
        "ALL", "AND", "AS", "ASC", "BETWEEN", "BY", "CASE", "CROSS", "DEFAULT", "DESC", "DISTINCT",
        "ELSE", "END", "EXCEPT", "EXISTS", "FALSE", "FETCH", "FIRST", "FOR", "FROM", "FULL", "GROUP",
        "HAVING", "ILIKE", "IN", "INNER", "INTERSECT", "INTERVAL", "IS", "JOIN", "LAST", "LEFT",
        "LIKE", "LIMIT", "NATURAL", "NOT", "NULL", "NULLS", "OFFSET", "ON", "OR", "ORDER", "OUTER",
        "OVER", "PARTITION", "RANGE", "RIGHT", "ROWS", "SELECT", "TABLE", "THEN", "TO", "TOP", "TRUE",
        "UNION", "USING", "WHEN", "WHERE", "WINDOW", "WITH");

    private SQLQuoting() {
        // Utility class - prevent instantiation
    }

    /**
     * Quotes an identifier with the dialect's quote characters.
     *
     * @param identifier the identifier to quote
     * @param dialect the target dialect
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier, DialectDescriptor dialect) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        String end = dialect.identifierQuoteEnd();
        String escaped = identifier.replace(end, end + end);
        return dialect.identifierQuoteStart() + escaped + end;
    }

    /**
     * Quotes an identifier only if needed, keeping generated SQL readable.
     *
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier, DialectDescriptor dialect) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return needsQuoting(identifier) ? quoteIdentifier(identifier, dialect) : identifier;
    }

    /**
     * Quotes a possibly schema-qualified table name part by part.
     *
     * @throws IllegalArgumentException if the name is null or contains
     *         statement separators or comment markers
     */
    public static String quoteTableName(String tableName, DialectDescriptor dialect) {
        if (tableName == null) {
            throw new IllegalArgumentException("Table name cannot be null");
        }
        if (!isSafe(tableName)) {
            throw new IllegalArgumentException("Table name contains invalid characters: " + tableName);
        }
        return Arrays.stream(tableName.split("\\."))
            .map(part -> quoteIdentifierIfNeeded(part, dialect))
            .collect(Collectors.joining("."));
    }

    /**
     * Quotes a string literal value. Returns NULL (without quotes) if the
     * value is null.
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Checks a name for statement separators and comment markers.
     */
    public static boolean isSafe(String input) {
        if (input == null) {
            return true;
        }
        return !input.contains(";") && !input.contains("--")
            && !input.contains("/*") && !input.contains("*/");
    }

    /**
     * Returns whether an identifier must be quoted: anything but lower-case
     * letters, digits and underscores, or a reserved word.
     */
    public static boolean needsQuoting(String identifier) {
        if (!PLAIN_IDENTIFIER.matcher(identifier).matches()) {
            return true;
        }
        return RESERVED_WORDS.contains(identifier.toUpperCase(Locale.ROOT));
    }
}
