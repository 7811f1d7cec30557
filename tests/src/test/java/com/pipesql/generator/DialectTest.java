package com.pipesql.generator;

import com.pipesql.dialect.Dialect;
import com.pipesql.exception.CompileStage;
import com.pipesql.exception.SQLGenerationException;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for dialect-specific SQL: row limits, identifier quoting, operators
 * and unsupported constructs.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Dialect
@DisplayName("Dialect Tests")
public class DialectTest extends TestBase {

    private static SQLGenerationException unsupported(Throwable error) {
        assertThat(error).isInstanceOf(SQLGenerationException.class);
        SQLGenerationException exception = (SQLGenerationException) error;
        assertThat(exception.getReason()).isEqualTo(SQLGenerationException.Reason.UNSUPPORTED_CONSTRUCT);
        assertThat(exception.stage()).isEqualTo(CompileStage.GENERATE);
        return exception;
    }

    @Nested
    @DisplayName("Row Limits")
    class RowLimitTests {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
            "GENERIC  | SELECT * FROM e LIMIT 10 OFFSET 10",
            "POSTGRES | SELECT * FROM e LIMIT 10 OFFSET 10",
            "ANSI     | SELECT * FROM e OFFSET 10 ROWS FETCH FIRST 10 ROWS ONLY",
            "MSSQL    | SELECT * FROM e ORDER BY (SELECT NULL) OFFSET 10 ROWS FETCH NEXT 10 ROWS ONLY"
        })
        @DisplayName("Ranges become an offset and a limit")
        void testRange(Dialect dialect, String expected) {
            assertThat(sql("from e | take 11..20", dialect)).isEqualTo(expected);
        }

        @Test
        @DisplayName("MSSQL limits without offset use TOP")
        void testTop() {
            assertThat(sql("from e | take 5", Dialect.MSSQL)).isEqualTo("SELECT TOP (5) * FROM e");
        }

        @Test
        @DisplayName("MSSQL keeps the query ordering before OFFSET")
        void testTopWithOrder() {
            assertThat(sql("from e | sort id | take 3..4", Dialect.MSSQL))
                .isEqualTo("SELECT * FROM e ORDER BY id OFFSET 2 ROWS FETCH NEXT 2 ROWS ONLY");
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
            "GENERIC | SELECT * FROM e OFFSET 2",
            "SQLITE  | SELECT * FROM e LIMIT -1 OFFSET 2",
            "MYSQL   | SELECT * FROM e LIMIT 18446744073709551615 OFFSET 2"
        })
        @DisplayName("Open ranges write the dialect's offset-only form")
        void testOpenRange(Dialect dialect, String expected) {
            assertThat(sql("from e | take 3..", dialect)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Hive has no OFFSET")
        void testHiveOffset() {
            assertThatThrownBy(() -> sql("from e | take 11..20", Dialect.HIVE))
                .satisfies(e -> assertThat(unsupported(e).getConstruct()).isEqualTo("OFFSET"));
        }

        @Test
        @DisplayName("Hive writes plain LIMIT")
        void testHiveLimit() {
            assertThat(sql("from e | take 5", Dialect.HIVE)).isEqualTo("SELECT * FROM e LIMIT 5");
        }
    }

    @Nested
    @DisplayName("Identifier Quoting")
    class QuotingTests {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
            "GENERIC | SELECT \"first name\" FROM e",
            "MYSQL   | SELECT `first name` FROM e",
            "MSSQL   | SELECT [first name] FROM e"
        })
        @DisplayName("Names that are not plain identifiers are quoted")
        void testQuotedColumn(Dialect dialect, String expected) {
            assertThat(sql("from e | select {`first name`}", dialect)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Reserved words are quoted")
        void testReservedWord() {
            assertThat(sql("from e | select {`order`}")).isEqualTo("SELECT \"order\" FROM e");
        }
    }

    @Nested
    @DisplayName("Operators")
    class OperatorTests {

        @Test
        @DisplayName("Postgres matches regular expressions with ~")
        void testPostgresRegex() {
            assertThat(sql("from e | filter name ~= \"A.*\"", Dialect.POSTGRES))
                .isEqualTo("SELECT * FROM e WHERE name ~ 'A.*'");
        }

        @Test
        @DisplayName("The generic dialect has no regex operator")
        void testGenericRegex() {
            assertThatThrownBy(() -> sql("from e | filter name ~= \"A.*\""))
                .satisfies(e -> assertThat(unsupported(e).getDialect()).isEqualTo("generic"));
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
            "GENERIC | SELECT *, FLOOR(a / 2) AS h FROM e",
            "DUCKDB  | SELECT *, (a // 2) AS h FROM e",
            "SQLITE  | SELECT *, CAST(a / 2 AS INTEGER) AS h FROM e"
        })
        @DisplayName("Integer division follows the dialect")
        void testIntegerDivision(Dialect dialect, String expected) {
            assertThat(sql("from e | derive {h = a // 2}", dialect)).isEqualTo(expected);
        }

        @Test
        @DisplayName("SQLite concatenates f-strings with ||")
        void testSqliteConcat() {
            assertThat(sql("from e | derive {label = f\"{given} {family}\"}", Dialect.SQLITE))
                .isEqualTo("SELECT *, (given || ' ' || family) AS label FROM e");
        }
    }

    @Nested
    @DisplayName("Joins")
    class JoinTests {

        @Test
        @DisplayName("MySQL has no FULL JOIN")
        void testMysqlFullJoin() {
            assertThatThrownBy(() -> sql("from e | join side:full d (==dept_id)", Dialect.MYSQL))
                .satisfies(e -> assertThat(unsupported(e).getConstruct()).isEqualTo("FULL JOIN"));
        }
    }

    @Nested
    @DisplayName("Targets")
    class TargetTests {

        @ParameterizedTest
        @EnumSource(Dialect.class)
        @DisplayName("Every dialect round-trips through its target name")
        void testTargetNames(Dialect dialect) {
            assertThat(dialect.target()).startsWith("sql.");
            assertThat(Dialect.fromTarget(dialect.target())).isEqualTo(dialect);
        }

        @Test
        @DisplayName("Unknown targets are rejected")
        void testUnknownTarget() {
            assertThatThrownBy(() -> Dialect.fromTarget("sql.cobol"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
