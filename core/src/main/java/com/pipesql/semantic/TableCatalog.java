package com.pipesql.semantic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Known column lists of external tables.
 *
 * <p>Tables listed here get explicit frames, so their columns can be checked
 * and counted. Tables not listed are read through a wildcard and their
 * columns are inferred from use.
 *
 * <pre>
 *   TableCatalog catalog = TableCatalog.builder()
 *       .table("employees", "id", "name", "salary", "dept_id")
 *       .build();
 * </pre>
 */
public final class TableCatalog {

    private static final TableCatalog EMPTY = new TableCatalog(Map.of());

    private final Map<String, List<String>> tables;

    private TableCatalog(Map<String, List<String>> tables) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static TableCatalog empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the columns of a table, if the table is known.
     */
    public Optional<List<String>> columns(String table) {
        return Optional.ofNullable(tables.get(table));
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    public static final class Builder {
        private final Map<String, List<String>> tables = new LinkedHashMap<>();

        public Builder table(String name, String... columns) {
            return table(name, List.of(columns));
        }

        public Builder table(String name, List<String> columns) {
            Objects.requireNonNull(name, "name must not be null");
            tables.put(name, List.copyOf(columns));
            return this;
        }

        public TableCatalog build() {
            return new TableCatalog(tables);
        }
    }
}
