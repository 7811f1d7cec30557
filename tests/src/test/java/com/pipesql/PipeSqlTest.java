package com.pipesql;

import com.pipesql.dialect.Dialect;
import com.pipesql.exception.CompileStage;
import com.pipesql.exception.PipeSqlException;
import com.pipesql.pl.Query;
import com.pipesql.rq.RqQuery;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the {@link PipeSql} entry points and {@link CompileOptions}.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("PipeSql Compile Tests")
public class PipeSqlTest extends TestBase {

    private static final String SOURCE = "from employees | filter salary > 1000 | select {id, name}";

    @Nested
    @DisplayName("Compile Output")
    class CompileOutputTests {

        @Test
        @DisplayName("Defaults format the SQL and append the signature")
        void testDefaults() {
            String sql = PipeSql.compile(SOURCE);

            assertThat(sql).isEqualTo("""
                SELECT
                  id,
                  name
                FROM
                  employees
                WHERE
                  salary > 1000

                -- Generated by pipesql compiler version:%s target:sql.generic
                """.formatted(PipeSql.version()));
        }

        @Test
        @DisplayName("Unformatted output keeps the signature on the same line")
        void testUnformattedSignature() {
            CompileOptions options = CompileOptions.builder().format(false).target(Dialect.POSTGRES).build();

            String sql = PipeSql.compile(SOURCE, options);

            assertThat(sql).isEqualTo("SELECT id, name FROM employees WHERE salary > 1000 "
                + "-- Generated by pipesql compiler version:" + PipeSql.version() + " target:sql.postgres\n");
        }

        @Test
        @DisplayName("The signature can be turned off")
        void testNoSignature() {
            CompileOptions options = CompileOptions.builder().format(false).signatureComment(false).build();

            assertThat(PipeSql.compile(SOURCE, options))
                .isEqualTo("SELECT id, name FROM employees WHERE salary > 1000\n");
        }

        @Test
        @DisplayName("Stages compose to the same SQL as compile")
        void testStages() {
            Query pl = PipeSql.parse(SOURCE);
            RqQuery rq = PipeSql.resolve(pl);
            String sql = PipeSql.generate(rq, Dialect.GENERIC.descriptor());

            assertThat(sql).isEqualTo(sql(SOURCE));
        }

        @Test
        @DisplayName("Compiling twice gives identical SQL")
        void testDeterminism() {
            String source = "from e | sort name | derive {r = row_number this} | filter r > 1 | take 5";

            for (Dialect dialect : Dialect.values()) {
                CompileOptions options = CompileOptions.builder().target(dialect).build();
                assertThat(PipeSql.compile(source, options)).isEqualTo(PipeSql.compile(source, options));
            }
        }

        @Test
        @DisplayName("The version is filled in at build time")
        void testVersion() {
            assertThat(PipeSql.version()).isNotBlank().doesNotContain("${");
        }
    }

    @Nested
    @DisplayName("Error Stages")
    class ErrorStageTests {

        @ParameterizedTest(name = "{1}: {0}")
        @CsvSource(delimiter = ';', value = {
            "from employees | select {id,     ; PARSE",
            "from t | select {a} | select {b} ; RESOLVE",
            "from t | filter name ~= \"x\"      ; GENERATE"
        })
        @DisplayName("Errors report the stage that raised them")
        void testErrorStage(String source, CompileStage stage) {
            assertThatThrownBy(() -> PipeSql.compile(source))
                .isInstanceOf(PipeSqlException.class)
                .satisfies(e -> assertThat(((PipeSqlException) e).stage()).isEqualTo(stage));
        }

        @Test
        @DisplayName("Programs with only declarations have nothing to compile")
        void testNoMainPipeline() {
            assertThatThrownBy(() -> PipeSql.compile("let x = (from t)"))
                .isInstanceOf(PipeSqlException.class)
                .satisfies(e -> assertThat(((PipeSqlException) e).stage()).isEqualTo(CompileStage.RESOLVE));
        }
    }

    @Nested
    @DisplayName("Compile Options")
    class CompileOptionsTests {

        @Test
        @DisplayName("Properties override the defaults")
        void testFromProperties() {
            Properties properties = new Properties();
            properties.setProperty(CompileOptions.TARGET_PROPERTY, "sql.duckdb");
            properties.setProperty(CompileOptions.FORMAT_PROPERTY, "false");
            properties.setProperty(CompileOptions.RECURSION_LIMIT_PROPERTY, " 12 ");

            CompileOptions options = CompileOptions.fromProperties(properties);

            assertThat(options.target()).isEqualTo(Dialect.DUCKDB);
            assertThat(options.format()).isFalse();
            assertThat(options.signatureComment()).isTrue();
            assertThat(options.recursionLimit()).isEqualTo(12);
        }

        @Test
        @DisplayName("Malformed property values are rejected")
        void testInvalidProperties() {
            Properties properties = new Properties();
            properties.setProperty(CompileOptions.FORMAT_PROPERTY, "yes");

            assertThatThrownBy(() -> CompileOptions.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(CompileOptions.FORMAT_PROPERTY);
        }

        @Test
        @DisplayName("The recursion limit must be positive")
        void testRecursionLimit() {
            assertThatThrownBy(() -> CompileOptions.builder().recursionLimit(0))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Targets may omit the sql. prefix")
        void testTargetWithoutPrefix() {
            assertThat(CompileOptions.builder().target("mssql").build().target()).isEqualTo(Dialect.MSSQL);
        }
    }
}
