package com.pipesql.generator;

import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SqlFormatter}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Generator
@DisplayName("SQL Formatter Tests")
public class SqlFormatterTest extends TestBase {

    @Test
    @DisplayName("Clause bodies are indented below their keyword")
    void testClauseLayout() {
        String formatted = SqlFormatter.format("SELECT a, b FROM t WHERE x > 1 ORDER BY a LIMIT 5");

        assertThat(formatted).isEqualTo("""
            SELECT
              a,
              b
            FROM
              t
            WHERE
              x > 1
            ORDER BY
              a
            LIMIT 5
            """);
    }

    @Test
    @DisplayName("CTE bodies are indented inside their parentheses")
    void testCommonTableExpressions() {
        String formatted = SqlFormatter.format(
            "WITH table_0 AS (SELECT a FROM t), table_1 AS (SELECT a FROM table_0) SELECT a FROM table_1");

        assertThat(formatted).isEqualTo("""
            WITH table_0 AS (
              SELECT
                a
              FROM
                t
            ),
            table_1 AS (
              SELECT
                a
              FROM
                table_0
            )
            SELECT
              a
            FROM
              table_1
            """);
    }

    @Test
    @DisplayName("Function arguments stay on one line")
    void testFunctionCalls() {
        String formatted = SqlFormatter.format(
            "SELECT dept, COUNT(*) AS n, ROUND(AVG(salary), 2) AS avg FROM e GROUP BY dept");

        assertThat(formatted).isEqualTo("""
            SELECT
              dept,
              COUNT(*) AS n,
              ROUND(AVG(salary), 2) AS avg
            FROM
              e
            GROUP BY
              dept
            """);
    }

    @Test
    @DisplayName("Join keywords stay together")
    void testJoins() {
        String formatted = SqlFormatter.format("SELECT e.*, d.* FROM e LEFT JOIN d ON e.id = d.id");

        assertThat(formatted).isEqualTo("""
            SELECT
              e.*,
              d.*
            FROM
              e
            LEFT JOIN d ON e.id = d.id
            """);
    }

    @Test
    @DisplayName("Quoted text is copied verbatim")
    void testQuotedText() {
        String formatted = SqlFormatter.format("SELECT 'a, (b) FROM c' AS \"x, y\" FROM t");

        assertThat(formatted).contains("'a, (b) FROM c' AS \"x, y\"");
        assertThat(formatted.lines()).hasSize(4);
    }

    @Test
    @DisplayName("FETCH FIRST follows OFFSET on the same line")
    void testFetchFirst() {
        String formatted = SqlFormatter.format("SELECT * FROM e OFFSET 10 ROWS FETCH FIRST 10 ROWS ONLY");

        assertThat(formatted).endsWith("OFFSET 10 ROWS FETCH FIRST 10 ROWS ONLY\n");
    }
}
