package com.pipesql.parser;

import com.pipesql.exception.CompileStage;
import com.pipesql.exception.PipelineParseException;
import com.pipesql.pl.Assign;
import com.pipesql.pl.BinaryExpr;
import com.pipesql.pl.BinaryOperator;
import com.pipesql.pl.FuncCall;
import com.pipesql.pl.FuncDef;
import com.pipesql.pl.Ident;
import com.pipesql.pl.InterpolatedString;
import com.pipesql.pl.Literal;
import com.pipesql.pl.LiteralKind;
import com.pipesql.pl.Pipeline;
import com.pipesql.pl.Query;
import com.pipesql.pl.Range;
import com.pipesql.pl.TupleExpr;
import com.pipesql.pl.UnaryExpr;
import com.pipesql.pl.UnaryOperator;
import com.pipesql.pl.VarDef;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PipelineParser}: program structure, expressions and
 * positioned syntax errors.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Parser
@DisplayName("Pipeline Parser Tests")
public class PipelineParserTest extends TestBase {

    private PipelineParser parser;

    @Override
    protected void doSetUp() {
        parser = PipelineParser.getInstance();
    }

    private Pipeline mainPipeline(String source) {
        Query query = parser.parse(source);
        assertThat(query.mainPipeline()).isPresent();
        assertThat(query.mainPipeline().get()).isInstanceOf(Pipeline.class);
        return (Pipeline) query.mainPipeline().get();
    }

    @Nested
    @DisplayName("Program Structure")
    class ProgramStructureTests {

        @Test
        @DisplayName("Pipe-separated steps form one pipeline")
        void testPipeSeparatedSteps() {
            Pipeline pipeline = mainPipeline("from employees | select {id, name}");

            assertThat(pipeline.steps()).hasSize(2);
            FuncCall from = (FuncCall) pipeline.steps().get(0);
            assertThat(((Ident) from.callee()).name()).isEqualTo("from");
            assertThat(from.args()).hasSize(1);
            assertThat(((Ident) from.args().get(0)).name()).isEqualTo("employees");
        }

        @Test
        @DisplayName("Newlines separate steps like pipes")
        void testNewlineSeparatedSteps() {
            Pipeline pipeline = mainPipeline("from employees\nfilter salary > 10\ntake 5\n");

            assertThat(pipeline.steps()).hasSize(3);
            assertThat(pipeline.steps()).allMatch(step -> step instanceof FuncCall);
        }

        @Test
        @DisplayName("Declarations precede the main pipeline")
        void testDeclarations() {
            Query query = parser.parse("""
                let add_one = x -> x + 1
                let rich = (from employees | filter salary > 1000)

                from rich
                """);

            assertThat(query.declarations()).hasSize(2);
            assertThat(query.declarations().get(0)).isInstanceOf(FuncDef.class);
            FuncDef function = (FuncDef) query.declarations().get(0);
            assertThat(function.name()).isEqualTo("add_one");
            assertThat(function.params()).hasSize(1);
            assertThat(function.body()).isInstanceOf(BinaryExpr.class);

            assertThat(query.declarations().get(1)).isInstanceOf(VarDef.class);
            assertThat(((VarDef) query.declarations().get(1)).value()).isInstanceOf(Pipeline.class);
            assertThat(query.mainPipeline()).isPresent();
        }

        @Test
        @DisplayName("Function parameters may carry defaults")
        void testParameterDefault() {
            Query query = parser.parse("let scale = x factor:10 -> x * factor");

            FuncDef function = (FuncDef) query.declarations().get(0);
            assertThat(function.params()).hasSize(2);
            assertThat(function.params().get(1).hasDefault()).isTrue();
            assertThat(function.positionalParams()).hasSize(1);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "\n\n", "# only a comment\n"})
        @DisplayName("Empty programs have no main pipeline")
        void testEmptyProgram(String source) {
            Query query = parser.parse(source);

            assertThat(query.declarations()).isEmpty();
            assertThat(query.mainPipeline()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Expressions")
    class ExpressionTests {

        private FuncCall singleCall(String source) {
            Query query = parser.parse(source);
            return (FuncCall) query.mainPipeline().orElseThrow();
        }

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void testPrecedence() {
            FuncCall call = singleCall("derive {y = a + b * c}");

            TupleExpr tuple = (TupleExpr) call.args().get(0);
            Assign assign = (Assign) tuple.fields().get(0);
            BinaryExpr sum = (BinaryExpr) assign.value();
            assertThat(sum.operator()).isEqualTo(BinaryOperator.ADD);
            assertThat(sum.right()).isInstanceOf(BinaryExpr.class);
            assertThat(((BinaryExpr) sum.right()).operator()).isEqualTo(BinaryOperator.MUL);
        }

        @Test
        @DisplayName("Named arguments are kept apart from positional ones")
        void testNamedArguments() {
            FuncCall call = singleCall("join side:left departments (==dept_id)");

            assertThat(call.namedArgs()).containsOnlyKeys("side");
            assertThat(call.args()).hasSize(2);
            UnaryExpr condition = (UnaryExpr) call.args().get(1);
            assertThat(condition.operator()).isEqualTo(UnaryOperator.SELF_EQ);
        }

        @Test
        @DisplayName("Ranges parse with open ends")
        void testRanges() {
            Range closed = (Range) singleCall("take 11..20").args().get(0);
            Range open = (Range) singleCall("take 3..").args().get(0);

            assertThat(((Literal) closed.start()).value()).isEqualTo(11L);
            assertThat(((Literal) closed.end()).value()).isEqualTo(20L);
            assertThat(open.end()).isNull();
        }

        @Test
        @DisplayName("Literals carry their kind")
        void testLiteralKinds() {
            TupleExpr tuple = (TupleExpr) singleCall(
                "select {1, 2.5, 'text', true, null, @2024-01-31}").args().get(0);

            assertThat(tuple.fields())
                .extracting(field -> ((Literal) field).kind())
                .containsExactly(LiteralKind.INTEGER, LiteralKind.FLOAT, LiteralKind.STRING,
                    LiteralKind.BOOLEAN, LiteralKind.NULL, LiteralKind.DATE);
        }

        @Test
        @DisplayName("Interpolated strings split into text and holes")
        void testInterpolation() {
            TupleExpr tuple = (TupleExpr) singleCall("derive {full = f\"{first} {last}\"}").args().get(0);
            InterpolatedString string = (InterpolatedString) ((Assign) tuple.fields().get(0)).value();

            assertThat(string.flavor()).isEqualTo(InterpolatedString.Flavor.FORMAT);
            assertThat(string.parts()).hasSize(3);
            assertThat(string.parts().get(0)).isInstanceOf(InterpolatedString.Hole.class);
            assertThat(string.parts().get(1)).isEqualTo(new InterpolatedString.Text(" "));
        }

        @Test
        @DisplayName("Backquoted identifiers may contain spaces")
        void testQuotedIdentifier() {
            TupleExpr tuple = (TupleExpr) singleCall("select {`first name`}").args().get(0);

            assertThat(((Ident) tuple.fields().get(0)).name()).isEqualTo("first name");
        }
    }

    @Nested
    @DisplayName("Syntax Errors")
    class SyntaxErrorTests {

        @Test
        @DisplayName("Errors report the line of the offending token")
        void testErrorLine() {
            logStep("Given: a program with a dangling operator on line 2");
            String source = "from employees\nfilter salary >\n";

            logStep("Then: parsing fails at line 2");
            assertThatThrownBy(() -> parser.parse(source))
                .isInstanceOf(PipelineParseException.class)
                .satisfies(e -> {
                    PipelineParseException error = (PipelineParseException) e;
                    assertThat(error.getLine()).isEqualTo(2);
                    assertThat(error.stage()).isEqualTo(CompileStage.PARSE);
                    assertThat(error.getUserMessage()).startsWith("line 2");
                });
        }

        @Test
        @DisplayName("Unbalanced braces are rejected")
        void testUnbalancedBraces() {
            assertThat(parser.canParse("from employees | select {id, name")).isFalse();
            assertThat(parser.canParse("from employees | select {id, name}")).isTrue();
        }
    }
}
