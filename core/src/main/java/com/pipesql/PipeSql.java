package com.pipesql;

import com.pipesql.dialect.DialectDescriptor;
import com.pipesql.generator.SQLGenerator;
import com.pipesql.generator.SqlFormatter;
import com.pipesql.parser.PipelineParser;
import com.pipesql.pl.Query;
import com.pipesql.rq.RqQuery;
import com.pipesql.semantic.Resolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Entry points of the pipeline compiler.
 *
 * <p>The stages can run separately or together:
 * <pre>
 *   Query pl = PipeSql.parse("from employees | filter salary > 1000");
 *   RqQuery rq = PipeSql.resolve(pl);
 *   String sql = PipeSql.generate(rq, Dialect.DUCKDB.descriptor());
 *
 *   String same = PipeSql.compile(source, CompileOptions.builder().target("sql.duckdb").build());
 * </pre>
 *
 * <p>Each call builds its own state, so all methods are thread-safe. Every
 * failure is a {@link com.pipesql.exception.PipeSqlException} tagged with the
 * stage that raised it.
 */
public final class PipeSql {

    private static final Logger logger = LoggerFactory.getLogger(PipeSql.class);

    private static final String VERSION_RESOURCE = "version.properties";
    private static final String VERSION = loadVersion();

    private PipeSql() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the compiler version embedded in signature comments.
     */
    public static String version() {
        return VERSION;
    }

    /**
     * Parses program text into a PL tree.
     *
     * @throws com.pipesql.exception.PipelineParseException on syntax errors
     */
    public static Query parse(String source) {
        return PipelineParser.getInstance().parse(source);
    }

    public static RqQuery resolve(Query pl) {
        return resolve(pl, CompileOptions.defaults());
    }

    /**
     * Resolves a PL tree into relational query form.
     *
     * @throws com.pipesql.exception.ResolveException on name, type or
     *         recursion errors
     */
    public static RqQuery resolve(Query pl, CompileOptions options) {
        Objects.requireNonNull(pl, "pl must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return new Resolver(options.catalog(), options.recursionLimit()).resolve(pl);
    }

    /**
     * Generates single-line SQL for a dialect.
     *
     * @throws com.pipesql.exception.SQLGenerationException if the dialect
     *         cannot express the query
     */
    public static String generate(RqQuery rq, DialectDescriptor dialect) {
        return new SQLGenerator(dialect).generate(rq);
    }

    /**
     * Compiles program text to SQL, applying formatting and the signature
     * comment as configured.
     */
    public static String compile(String source, CompileOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        logger.debug("Compiling with {}", options);

        Query pl = parse(source);
        RqQuery rq = resolve(pl, options);
        String sql = generate(rq, options.target().descriptor());

        StringBuilder result = new StringBuilder();
        if (options.format()) {
            result.append(SqlFormatter.format(sql));
            if (options.signatureComment()) {
                result.append('\n').append(signature(options)).append('\n');
            }
        } else {
            result.append(sql);
            if (options.signatureComment()) {
                result.append(' ').append(signature(options));
            }
            result.append('\n');
        }
        return result.toString();
    }

    public static String compile(String source) {
        return compile(source, CompileOptions.defaults());
    }

    static String signature(CompileOptions options) {
        return "-- Generated by pipesql compiler version:" + VERSION + " target:" + options.target().target();
    }

    private static String loadVersion() {
        Properties properties = new Properties();
        try (InputStream in = PipeSql.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + VERSION_RESOURCE);
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + VERSION_RESOURCE, e);
        }
        return properties.getProperty("version", "unknown");
    }
}
