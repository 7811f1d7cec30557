package com.pipesql.test;

import com.pipesql.CompileOptions;
import com.pipesql.PipeSql;
import com.pipesql.dialect.Dialect;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for compiler tests.
 *
 * <p>Logs test boundaries and Given/When/Then steps, and offers shortcuts
 * that compile a pipeline to single-line SQL without the signature comment.
 * Subclasses hook into the lifecycle through {@link #doSetUp()} and
 * {@link #doTearDown()}.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected String testName;

    @BeforeEach
    final void setUp(TestInfo testInfo) {
        testName = testInfo.getDisplayName();
        logger.debug("=== Starting test: {} ===", testName);
        doSetUp();
    }

    @AfterEach
    final void tearDown() {
        doTearDown();
        logger.debug("=== Finished test: {} ===", testName);
    }

    protected void doSetUp() {
    }

    protected void doTearDown() {
    }

    protected void logStep(String step) {
        logger.debug("  {}", step);
    }

    protected void logData(String label, Object value) {
        logger.debug("  {}: {}", label, value);
    }

    /**
     * Compiles a pipeline for the generic dialect to single-line SQL.
     */
    protected String sql(String source) {
        return sql(source, Dialect.GENERIC);
    }

    protected String sql(String source, Dialect dialect) {
        return sql(source, options(dialect));
    }

    protected String sql(String source, CompileOptions options) {
        String sql = PipeSql.compile(source, options).strip();
        logData("SQL", sql);
        return sql;
    }

    /**
     * Returns options for single-line SQL without the signature comment.
     */
    protected CompileOptions options(Dialect dialect) {
        return CompileOptions.builder()
            .target(dialect)
            .format(false)
            .signatureComment(false)
            .build();
    }
}
