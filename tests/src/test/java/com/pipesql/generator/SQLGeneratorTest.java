package com.pipesql.generator;

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

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SQLGenerator} with the generic dialect: clause folding,
 * block splitting and expression rendering.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Generator
@DisplayName("SQL Generator Tests")
public class SQLGeneratorTest extends TestBase {

    @Nested
    @DisplayName("Basic Transforms")
    class BasicTransformTests {

        @Test
        @DisplayName("from reads the whole table")
        void testFrom() {
            assertThat(sql("from employees")).isEqualTo("SELECT * FROM employees");
        }

        @Test
        @DisplayName("select lists columns")
        void testSelect() {
            assertThat(sql("from employees | select {id, name}"))
                .isEqualTo("SELECT id, name FROM employees");
        }

        @Test
        @DisplayName("filter becomes WHERE")
        void testFilter() {
            assertThat(sql("from e | filter salary > 1000 | select {name}"))
                .isEqualTo("SELECT name FROM e WHERE salary > 1000");
        }

        @Test
        @DisplayName("derive appends computed columns after the wildcard")
        void testDerive() {
            assertThat(sql("from e | derive {gross = salary + bonus}"))
                .isEqualTo("SELECT *, salary + bonus AS gross FROM e");
        }

        @Test
        @DisplayName("group with aggregate becomes GROUP BY")
        void testGroupAggregate() {
            assertThat(sql("from e | group {dept} (aggregate {total = sum salary})"))
                .isEqualTo("SELECT dept, SUM(salary) AS total FROM e GROUP BY dept");
        }

        @Test
        @DisplayName("sort and take become ORDER BY and LIMIT")
        void testSortTake() {
            assertThat(sql("from e | sort {-salary} | take 10"))
                .isEqualTo("SELECT * FROM e ORDER BY salary DESC LIMIT 10");
        }

        @Test
        @DisplayName("filter after aggregate becomes HAVING")
        void testHaving() {
            assertThat(sql("from e | group {d} (aggregate {n = count this}) | filter n > 5"))
                .isEqualTo("SELECT d, COUNT(*) AS n FROM e GROUP BY d HAVING COUNT(*) > 5");
        }

        @Test
        @DisplayName("Literal tables become a UNION ALL of constant rows")
        void testLiteralTable() {
            assertThat(sql("from [{a = 1, b = \"x\"}, {a = 2, b = \"y\"}]"))
                .isEqualTo("WITH table_0 AS (SELECT 1 AS a, 'x' AS b UNION ALL SELECT 2 AS a, 'y' AS b) "
                    + "SELECT a, b FROM table_0");
        }
    }

    @Nested
    @DisplayName("Block Splitting")
    class BlockSplittingTests {

        @Test
        @DisplayName("Filtering on a window result needs a CTE")
        void testFilterOnWindow() {
            assertThat(sql("from e | derive {r = row_number this} | filter r <= 3"))
                .isEqualTo("WITH table_0 AS (SELECT *, ROW_NUMBER() OVER () AS r FROM e) "
                    + "SELECT * FROM table_0 WHERE r <= 3");
        }

        @Test
        @DisplayName("Sorting after a limit sorts the limited rows")
        void testSortAfterTake() {
            assertThat(sql("from e | take 10 | sort name"))
                .isEqualTo("WITH table_0 AS (SELECT * FROM e LIMIT 10) SELECT * FROM table_0 ORDER BY name");
        }

        @Test
        @DisplayName("An ordering is carried to the outer query")
        void testOrderInheritance() {
            assertThat(sql("from e | sort name | derive {r = row_number this} | filter r > 1"))
                .isEqualTo("WITH table_0 AS (SELECT *, ROW_NUMBER() OVER (ORDER BY name) AS r FROM e) "
                    + "SELECT * FROM table_0 WHERE r > 1 ORDER BY name");
        }

        @Test
        @DisplayName("Take inside group filters on a row number")
        void testGroupedTake() {
            CompileOptions options = options(Dialect.GENERIC).toBuilder()
                .catalog(TableCatalog.builder().table("e", "name", "dept", "salary").build())
                .build();

            assertThat(sql("from e | group {dept} (sort salary | take 1)", options))
                .isEqualTo("WITH table_0 AS (SELECT name, dept, salary, "
                    + "ROW_NUMBER() OVER (PARTITION BY dept ORDER BY salary) AS _expr_0 FROM e) "
                    + "SELECT name, dept, salary FROM table_0 WHERE _expr_0 BETWEEN 1 AND 1");
        }

        @Test
        @DisplayName("Declared relations become named CTEs")
        void testDeclaredRelation() {
            assertThat(sql("let high = (from e | filter salary > 100)\nfrom high | select {name}"))
                .isEqualTo("WITH high AS (SELECT * FROM e WHERE salary > 100) SELECT name FROM high");
        }

        @Test
        @DisplayName("append becomes UNION ALL")
        void testAppend() {
            assertThat(sql("from a | append b"))
                .isEqualTo("WITH table_0 AS (SELECT * FROM a UNION ALL SELECT * FROM b) SELECT * FROM table_0");
        }
    }

    @Nested
    @DisplayName("Joins")
    class JoinTests {

        @Test
        @DisplayName("Using-join compares the key on both sides and lists the kept key")
        void testUsingJoin() {
            assertThat(sql("from e | join d (==dept_id)"))
                .isEqualTo("SELECT e.*, e.dept_id, d.* FROM e JOIN d ON e.dept_id = d.dept_id");
        }

        @Test
        @DisplayName("side:left becomes LEFT JOIN")
        void testLeftJoin() {
            assertThat(sql("from e | join side:left d (==dept_id)"))
                .isEqualTo("SELECT e.*, e.dept_id, d.* FROM e LEFT JOIN d ON e.dept_id = d.dept_id");
        }

        @Test
        @DisplayName("The key of a using-join on unknown tables can be selected by its bare name")
        void testUsingJoinBareKey() {
            assertThat(sql("from orders | join customers (==id) | select {id, customers.name}"))
                .isEqualTo("SELECT orders.id, customers.name FROM orders "
                    + "JOIN customers ON orders.id = customers.id");
        }

        @Test
        @DisplayName("Same-named columns of both sides can be selected together")
        void testSelectBothSides() {
            assertThat(sql("from orders | join customers (orders.id == customers.id) "
                    + "| select {orders.id, customers.id}"))
                .isEqualTo("SELECT orders.id, customers.id FROM orders "
                    + "JOIN customers ON orders.id = customers.id");
        }

        @Test
        @DisplayName("Without CTEs a relation joined to itself is aliased once per side")
        void testSelfJoinWithoutCte() {
            String generated = PipeSql.generate(
                PipeSql.resolve(PipeSql.parse("let x = (from t | filter a > 1)\nfrom x | join x (==a)")),
                Dialect.GENERIC.descriptor().toBuilder().supportsCte(false).build());

            assertThat(generated)
                .startsWith("SELECT ")
                .doesNotContain("WITH")
                .contains(" FROM (SELECT * FROM t WHERE a > 1) AS x ")
                .contains(" JOIN (SELECT * FROM t WHERE a > 1) AS x_1 ON x.a = x_1.a")
                .doesNotContain("AS x AS");
        }
    }

    @Nested
    @DisplayName("Unordered Takes")
    class UnorderedTakeTests {

        @Test
        @DisplayName("A take on unordered rows renders as a plain limit")
        void testUnorderedTake() {
            assertThat(sql("from e | take 5")).isEqualTo("SELECT * FROM e LIMIT 5");
        }

        @Test
        @DisplayName("A range on unordered rows renders as LIMIT and OFFSET")
        void testUnorderedRange() {
            assertThat(sql("from e | take 3..4 | select {name}"))
                .isEqualTo("SELECT name FROM e LIMIT 2 OFFSET 2");
        }

        @Test
        @DisplayName("A filter after an unordered take reads the limited rows")
        void testFilterAfterUnorderedTake() {
            assertThat(sql("from e | take 10 | filter salary > 100"))
                .isEqualTo("WITH table_0 AS (SELECT * FROM e LIMIT 10) SELECT * FROM table_0 WHERE salary > 100");
        }

        @Test
        @DisplayName("Dialects without window functions still bound unordered rows")
        void testUnorderedTakeWithoutWindows() {
            String generated = PipeSql.generate(PipeSql.resolve(PipeSql.parse("from e | take 5")),
                Dialect.GENERIC.descriptor().toBuilder().supportsWindowFunctions(false).build());

            assertThat(generated).isEqualTo("SELECT * FROM e LIMIT 5");
        }
    }

    @Nested
    @DisplayName("Expressions")
    class ExpressionTests {

        @Test
        @DisplayName("Equality with null becomes IS NULL")
        void testNullComparison() {
            assertThat(sql("from e | filter x == null"))
                .isEqualTo("SELECT * FROM e WHERE x IS NULL");
        }

        @Test
        @DisplayName("?? becomes COALESCE")
        void testCoalesce() {
            assertThat(sql("from e | derive {y = x ?? 0}"))
                .isEqualTo("SELECT *, COALESCE(x, 0) AS y FROM e");
        }

        @Test
        @DisplayName("case becomes CASE WHEN with a trailing ELSE")
        void testCase() {
            assertThat(sql("from e | derive {size = case [a > 10 => \"big\", true => \"small\"]}"))
                .isEqualTo("SELECT *, CASE WHEN a > 10 THEN 'big' ELSE 'small' END AS size FROM e");
        }

        @Test
        @DisplayName("f-strings concatenate their parts")
        void testFormatString() {
            assertThat(sql("from e | derive {label = f\"{given} {family}\"}"))
                .isEqualTo("SELECT *, CONCAT(given, ' ', family) AS label FROM e");
        }

        @Test
        @DisplayName("s-strings splice raw SQL")
        void testSqlString() {
            assertThat(sql("from e | derive {u = s\"UPPER({name})\"}"))
                .isEqualTo("SELECT *, UPPER(name) AS u FROM e");
        }

        @Test
        @DisplayName("Rolling windows frame the preceding rows")
        void testRollingWindow() {
            assertThat(sql("from e | sort day | window rolling:3 (derive {avg3 = average value})"))
                .isEqualTo("SELECT *, AVG(value) OVER (ORDER BY day ROWS BETWEEN 2 PRECEDING AND CURRENT ROW) "
                    + "AS avg3 FROM e ORDER BY day");
        }
    }

    @Nested
    @DisplayName("Generator API")
    class GeneratorApiTests {

        @Test
        @DisplayName("A generator instance can be reused")
        void testReuse() {
            SQLGenerator generator = new SQLGenerator(Dialect.GENERIC.descriptor());
            RqQuery first = PipeSql.resolve(PipeSql.parse("from e | take 10 | sort name"));
            RqQuery second = PipeSql.resolve(PipeSql.parse("from e | take 10 | sort name"));

            assertThat(generator.generate(first)).isEqualTo(generator.generate(second));
            assertThat(generator.generate(first)).contains("table_0").doesNotContain("table_1");
        }

        @Test
        @DisplayName("A null query is rejected")
        void testNullQuery() {
            SQLGenerator generator = new SQLGenerator(Dialect.GENERIC.descriptor());

            assertThatThrownBy(() -> generator.generate(null))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
