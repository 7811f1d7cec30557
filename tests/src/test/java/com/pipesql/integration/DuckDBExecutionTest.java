package com.pipesql.integration;

import com.pipesql.CompileOptions;
import com.pipesql.PipeSql;
import com.pipesql.dialect.Dialect;
import com.pipesql.rq.RqQuery;
import com.pipesql.semantic.TableCatalog;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs compiled DuckDB SQL against an in-memory database and checks the
 * rows it returns.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("DuckDB Execution Tests")
public class DuckDBExecutionTest extends TestBase {

    private Connection connection;

    @Override
    protected void doSetUp() {
        try {
            connection = DriverManager.getConnection("jdbc:duckdb:");
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("CREATE TABLE employees (" +
                    "id INTEGER NOT NULL, " +
                    "name VARCHAR, " +
                    "dept VARCHAR, " +
                    "salary INTEGER)");
                stmt.execute("INSERT INTO employees VALUES " +
                    "(1, 'Ann', 'eng', 120), " +
                    "(2, 'Bob', 'eng', 100), " +
                    "(3, 'Cid', 'ops', 90), " +
                    "(4, 'Dee', 'ops', 95), " +
                    "(5, 'Eve', 'hr', 70)");

                stmt.execute("CREATE TABLE departments (dept VARCHAR, title VARCHAR)");
                stmt.execute("INSERT INTO departments VALUES " +
                    "('eng', 'Engineering'), ('ops', 'Operations'), ('hr', 'People')");
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to set up test database", e);
        }
    }

    @Override
    protected void doTearDown() {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                logger.warn("Failed to close DuckDB connection", e);
            }
        }
    }

    private List<List<String>> run(String source) {
        return execute(sql(source, Dialect.DUCKDB));
    }

    private List<List<String>> execute(String sql) {
        List<List<String>> rows = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            int columns = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                List<String> row = new ArrayList<>();
                for (int i = 1; i <= columns; i++) {
                    row.add(rs.getString(i));
                }
                rows.add(row);
            }
        } catch (SQLException e) {
            throw new AssertionError("DuckDB rejected generated SQL: " + sql, e);
        }
        logData("Rows", rows);
        return rows;
    }

    private List<String> columnNames(String sql) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            List<String> names = new ArrayList<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                names.add(meta.getColumnName(i));
            }
            return names;
        }
    }

    @Nested
    @DisplayName("Row Transforms")
    class RowTransformTests {

        @Test
        @DisplayName("filter, sort and select")
        void testFilterSortSelect() {
            assertThat(run("from employees | filter salary > 95 | sort name | select {name}"))
                .containsExactly(List.of("Ann"), List.of("Bob"));
        }

        @Test
        @DisplayName("take with a range skips rows")
        void testTakeRange() {
            assertThat(run("from employees | sort id | take 2..3 | select {id}"))
                .containsExactly(List.of("2"), List.of("3"));
        }

        @Test
        @DisplayName("Literal tables compile to runnable SQL")
        void testLiteralTable() {
            assertThat(run("from [{a = 1, b = \"x\"}, {a = 2, b = \"y\"}] | filter a > 1"))
                .containsExactly(List.of("2", "y"));
        }

        @Test
        @DisplayName("f-strings concatenate text")
        void testFormatString() {
            assertThat(run("from employees | filter id == 1 | derive {label = f\"{name} ({dept})\"} | select {label}"))
                .containsExactly(List.of("Ann (eng)"));
        }
    }

    @Nested
    @DisplayName("Grouping and Windows")
    class GroupingTests {

        @Test
        @DisplayName("group and aggregate")
        void testAggregate() {
            assertThat(run("from employees | group {dept} (aggregate {total = sum salary}) | sort dept"))
                .containsExactly(List.of("eng", "220"), List.of("hr", "70"), List.of("ops", "185"));
        }

        @Test
        @DisplayName("Take inside group keeps the top row of each group")
        void testGroupedTake() throws SQLException {
            String sql = sql("from employees | group {dept} (sort {-salary} | take 1) | sort dept", Dialect.DUCKDB);

            assertThat(sql).contains("EXCLUDE (_expr_0)");
            assertThat(columnNames(sql)).containsExactly("id", "name", "dept", "salary");
            assertThat(execute(sql)).extracting(row -> row.get(1)).containsExactly("Ann", "Eve", "Dee");
        }

        @Test
        @DisplayName("Filtering on a row number")
        void testRowNumberFilter() {
            assertThat(run("from employees | sort salary | derive {r = row_number this} | filter r <= 2 | select {name}"))
                .containsExactly(List.of("Eve"), List.of("Cid"));
        }

        @Test
        @DisplayName("Rolling sums over the current and previous row")
        void testRollingWindow() {
            assertThat(run("from employees | sort id | window rolling:2 (derive {s = sum salary}) | select {id, s}"))
                .extracting(row -> row.get(1))
                .containsExactly("120", "220", "190", "185", "165");
        }
    }

    @Nested
    @DisplayName("Combining Relations")
    class CombiningTests {

        @Test
        @DisplayName("join on a shared column")
        void testJoin() {
            CompileOptions options = options(Dialect.DUCKDB).toBuilder()
                .catalog(TableCatalog.builder()
                    .table("employees", "id", "name", "dept", "salary")
                    .table("departments", "dept", "title")
                    .build())
                .build();

            assertThat(execute(sql("from employees | join departments (==dept) | sort id | select {name, title}",
                options)))
                .containsExactly(
                    List.of("Ann", "Engineering"),
                    List.of("Bob", "Engineering"),
                    List.of("Cid", "Operations"),
                    List.of("Dee", "Operations"),
                    List.of("Eve", "People"));
        }

        @Test
        @DisplayName("join on a shared column of tables without a catalog")
        void testJoinWithoutCatalog() {
            assertThat(run("from employees | join departments (==dept) "
                + "| select {employees.name, dept, departments.title}"))
                .containsExactlyInAnyOrder(
                    List.of("Ann", "eng", "Engineering"),
                    List.of("Bob", "eng", "Engineering"),
                    List.of("Cid", "ops", "Operations"),
                    List.of("Dee", "ops", "Operations"),
                    List.of("Eve", "hr", "People"));
        }

        @Test
        @DisplayName("Same-named columns of both join sides come back side by side")
        void testSelectBothSides() throws SQLException {
            String sql = sql("from employees | join departments (employees.dept == departments.dept) "
                + "| filter employees.name == \"Eve\" | select {employees.dept, departments.dept}", Dialect.DUCKDB);

            assertThat(columnNames(sql)).containsExactly("dept", "dept");
            assertThat(execute(sql)).containsExactly(List.of("hr", "hr"));
        }

        @Test
        @DisplayName("append stacks rows")
        void testAppend() {
            assertThat(run("from employees | filter dept == \"hr\" | select {name} "
                + "| append (from departments | filter dept == \"hr\" | select {title})"))
                .containsExactlyInAnyOrder(List.of("Eve"), List.of("People"));
        }

        @Test
        @DisplayName("Declared relations are read by name")
        void testDeclaredRelation() {
            assertThat(run("let engineers = (from employees | filter dept == \"eng\")\n"
                + "from engineers | sort id | select {name}"))
                .containsExactly(List.of("Ann"), List.of("Bob"));
        }
    }

    @Test
    @DisplayName("Result columns match the final frame")
    void testFrameMatchesResultColumns() throws SQLException {
        CompileOptions options = options(Dialect.DUCKDB).toBuilder()
            .catalog(TableCatalog.builder().table("employees", "id", "name", "dept", "salary").build())
            .build();
        String source = "from employees | derive {salary = salary * 2, bonus = 10} | select {name, bonus, salary}";

        RqQuery rq = PipeSql.resolve(PipeSql.parse(source), options);
        List<String> frame = rq.outputColumns(rq.main()).stream()
            .map(id -> rq.column(id).name())
            .toList();

        assertThat(columnNames(sql(source, options))).containsExactlyElementsOf(frame);
    }

    @Test
    @DisplayName("Formatted output with the signature comment runs unchanged")
    void testFormattedOutput() {
        String sql = PipeSql.compile("from employees | filter salary < 80 | select {name}",
            CompileOptions.builder().target(Dialect.DUCKDB).build());

        assertThat(sql).contains("-- Generated by pipesql compiler");
        assertThat(execute(sql)).containsExactly(List.of("Eve"));
    }
}
