package com.pipesql.parser;

import com.pipesql.exception.PipelineParseException;
import com.pipesql.pl.Expr;
import com.pipesql.pl.Query;
import com.pipesql.pl.SourceSpan;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Entry point for parsing pipeline source text into a PL {@link Query}.
 *
 * <p>Wraps the ANTLR4-generated parser with:
 * <ul>
 *   <li>SLL-first, LL-fallback two-phase parsing</li>
 *   <li>Fail-fast, positioned errors via {@link PipelineErrorListener}</li>
 *   <li>Thread safety via a ThreadLocal parser pool</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 *   Query query = PipelineParser.getInstance().parse("from employees | select {id, name}");
 * </pre>
 */
public class PipelineParser {

    private static final Logger logger = LoggerFactory.getLogger(PipelineParser.class);

    private static final ThreadLocal<PipelineParser> PARSER_POOL =
        ThreadLocal.withInitial(PipelineParser::new);

    private final PipeSqlLexer lexer;
    private final CommonTokenStream tokens;
    private final PipeSqlParser parser;

    /**
     * Creates a new parser instance. Typically accessed via {@link #getInstance()}.
     */
    public PipelineParser() {
        this.lexer = new PipeSqlLexer(CharStreams.fromString(""));
        this.tokens = new CommonTokenStream(lexer);
        this.parser = new PipeSqlParser(tokens);
    }

    /**
     * Returns the thread-local parser instance.
     *
     * @return parser for the current thread
     */
    public static PipelineParser getInstance() {
        return PARSER_POOL.get();
    }

    /**
     * Parses a complete program.
     *
     * <p>Empty or comment-only input is a valid program with no declarations
     * and no main pipeline.
     *
     * @param source the program text
     * @return the PL tree
     * @throws PipelineParseException if the text is not a well-formed program
     */
    public Query parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        logger.debug("Parsing pipeline source ({} chars)", source.length());

        PipeSqlParser.ProgramContext tree = run(source, new PipelineErrorListener(), PipeSqlParser::program);
        Query query = (Query) new PlAstBuilder(SourceSpan.SYNTHETIC).visit(tree);

        logger.debug("Parsed {} declaration(s), main pipeline present: {}",
            query.declarations().size(), query.main() != null);
        return query;
    }

    /**
     * Parses a single expression embedded in a larger source, such as the
     * hole of an interpolated string. Spans are reported relative to
     * {@code origin}.
     */
    Expr parseFragment(String text, SourceSpan origin) {
        PipelineErrorListener listener = new PipelineErrorListener(
            Math.max(origin.line() - 1, 0), origin.column());
        PipeSqlParser.StandaloneExpressionContext tree =
            run(text, listener, PipeSqlParser::standaloneExpression);
        return (Expr) new PlAstBuilder(origin).visit(tree.exprCall());
    }

    private <T extends ParserRuleContext> T run(String text, PipelineErrorListener listener,
                                                Function<PipeSqlParser, T> entry) {
        lexer.setInputStream(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        tokens.setTokenSource(lexer);
        parser.setTokenStream(tokens);

        // Phase 1: SLL prediction, bail out on the first conflict
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        try {
            return entry.apply(parser);
        } catch (ParseCancellationException e) {
            // Phase 2: full LL prediction with positioned error reporting
            logger.debug("SLL parse failed, falling back to LL mode");
            tokens.seek(0);
            parser.reset();
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.addErrorListener(listener);
            parser.setErrorHandler(new DefaultErrorStrategy());
            return entry.apply(parser);
        }
    }

    /**
     * Tests whether the given source parses without errors.
     *
     * @param source the text to test
     * @return true if the text parses successfully
     */
    public boolean canParse(String source) {
        try {
            parse(source);
            return true;
        } catch (PipelineParseException e) {
            return false;
        }
    }
}
