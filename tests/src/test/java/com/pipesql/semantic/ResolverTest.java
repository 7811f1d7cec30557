package com.pipesql.semantic;

import com.pipesql.dialect.Dialect;
import com.pipesql.exception.CompileStage;
import com.pipesql.exception.ResolveException;
import com.pipesql.generator.SQLGenerator;
import com.pipesql.parser.PipelineParser;
import com.pipesql.rq.ColumnDecl;
import com.pipesql.rq.ColumnKind;
import com.pipesql.rq.Relation;
import com.pipesql.rq.RqExpr;
import com.pipesql.rq.RqQuery;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Resolver}: name binding, frames, declarations and
 * function inlining.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Resolver
@DisplayName("Resolver Tests")
public class ResolverTest extends TestBase {

    private static final TableCatalog CATALOG = TableCatalog.builder()
        .table("t", "a", "b")
        .table("a", "id", "x")
        .table("b", "id", "y")
        .table("c", "id", "z")
        .table("e", "name", "dept", "salary")
        .build();

    private RqQuery resolve(String source) {
        return resolve(source, Resolver.DEFAULT_RECURSION_LIMIT);
    }

    private RqQuery resolve(String source, int recursionLimit) {
        return new Resolver(CATALOG, recursionLimit).resolve(PipelineParser.getInstance().parse(source));
    }

    private static List<String> outputNames(RqQuery rq) {
        return rq.outputColumns(rq.main()).stream()
            .map(id -> rq.column(id).name())
            .toList();
    }

    private static ResolveException.Reason reasonOf(Throwable error) {
        return ((ResolveException) error).getReason();
    }

    @Nested
    @DisplayName("Frames")
    class FrameTests {

        @Test
        @DisplayName("Catalog tables expose their declared columns")
        void testCatalogColumns() {
            RqQuery rq = resolve("from e");

            assertThat(outputNames(rq)).containsExactly("name", "dept", "salary");
            assertThat(rq.relation(rq.main())).isInstanceOf(Relation.TableRef.class);
        }

        @Test
        @DisplayName("Unknown tables are read through a wildcard")
        void testWildcardInference() {
            RqQuery rq = resolve("from employees | select {id, name}");

            assertThat(outputNames(rq)).containsExactly("id", "name");
            List<ColumnDecl> table = rq.columns().stream()
                .filter(c -> c.kind() == ColumnKind.TABLE)
                .toList();
            assertThat(table).extracting(ColumnDecl::name).containsExactly("id", "name");
            assertThat(table).allMatch(c -> c.wildcard() != null);
        }

        @Test
        @DisplayName("Select narrows the frame")
        void testSelectNarrowsFrame() {
            assertThatThrownBy(() -> resolve("from t | select {a} | select {b}"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> {
                    assertThat(reasonOf(e)).isEqualTo(ResolveException.Reason.UNKNOWN_NAME);
                    assertThat(((ResolveException) e).getName()).isEqualTo("b");
                    assertThat(((ResolveException) e).stage()).isEqualTo(CompileStage.RESOLVE);
                });
        }

        @Test
        @DisplayName("Derive replaces a column of the same name and moves it last")
        void testDeriveShadowing() {
            RqQuery rq = resolve("from t | derive {a = a + 1}");

            assertThat(outputNames(rq)).containsExactly("b", "a");
        }

        @Test
        @DisplayName("Aggregate outputs group keys then aggregations")
        void testAggregateFrame() {
            RqQuery rq = resolve("from e | group {dept} (aggregate {total = sum salary, n = count this})");

            assertThat(outputNames(rq)).containsExactly("dept", "total", "n");
            assertThat(rq.relation(rq.main())).isInstanceOf(Relation.Aggregate.class);
        }

        @Test
        @DisplayName("Aggregate with a by field collapses rows to the keys and aggregations")
        void testAggregateByField() {
            RqQuery rq = resolve("from e | aggregate {by = [dept], total = sum salary}");

            assertThat(outputNames(rq)).containsExactly("dept", "total");
            Relation.Aggregate aggregate = (Relation.Aggregate) rq.relation(rq.main());
            assertThat(aggregate.groupBy()).hasSize(1);
            assertThat(aggregate.aggregations()).hasSize(1);
        }

        @Test
        @DisplayName("The final frame matches the generated select list")
        void testFrameMatchesSelectList() {
            RqQuery rq = resolve("from e | derive {bonus = salary / 10} | select {name, bonus, dept}");

            assertThat(outputNames(rq)).containsExactly("name", "bonus", "dept");
            assertThat(new SQLGenerator(Dialect.GENERIC.descriptor()).generate(rq))
                .isEqualTo("SELECT name, salary / 10 AS bonus, dept FROM e");
        }

        @Test
        @DisplayName("Only the first error is reported")
        void testFailFast() {
            assertThatThrownBy(() -> resolve("from t | select {nope} | filter 1"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(ResolveException.Reason.UNKNOWN_NAME));
        }

        @Test
        @DisplayName("Filter conditions must be boolean")
        void testFilterTypeMismatch() {
            assertThatThrownBy(() -> resolve("from t | filter 1"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(ResolveException.Reason.TYPE_MISMATCH));
        }
    }

    @Nested
    @DisplayName("Joins")
    class JoinTests {

        @Test
        @DisplayName("Bare names present on both sides are ambiguous")
        void testAmbiguousName() {
            assertThatThrownBy(() -> resolve("from a | join b (a.id == b.id) | select {id}"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(ResolveException.Reason.AMBIGUOUS_NAME));
        }

        @Test
        @DisplayName("Qualified names pick one side")
        void testQualifiedName() {
            RqQuery rq = resolve("from a | join b (a.id == b.id) | select {b.id, x, y}");

            assertThat(outputNames(rq)).containsExactly("id", "x", "y");
        }

        @Test
        @DisplayName("Three-way joins keep every qualified column reachable")
        void testThreeWayJoin() {
            String joined = "from a | join b (a.id == b.id) | join c (b.id == c.id)";

            assertThat(outputNames(resolve(joined + " | select {c.id, a.id, z}")))
                .containsExactly("id", "id", "z");
            assertThatThrownBy(() -> resolve(joined + " | select {id}"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(ResolveException.Reason.AMBIGUOUS_NAME));
        }

        @Test
        @DisplayName("Both sides of a join can be selected under the same name")
        void testSelectBothSides() {
            RqQuery rq = resolve("from a | join b (a.id == b.id) | select {a.id, b.id}");

            assertThat(outputNames(rq)).containsExactly("id", "id");
            List<?> ids = rq.outputColumns(rq.main());
            assertThat(ids).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("Selecting the same column twice keeps it once")
        void testSelectSameColumnTwice() {
            RqQuery rq = resolve("from a | select {x, a.x}");

            assertThat(outputNames(rq)).containsExactly("x");
        }

        @Test
        @DisplayName("Using-joins on unknown tables make the key reachable by its bare name")
        void testUsingJoinThroughWildcards() {
            RqQuery rq = resolve("from orders | join customers (==id) | select {id}");

            assertThat(outputNames(rq)).containsExactly("id");
            ColumnDecl key = rq.column(rq.outputColumns(rq.main()).get(0));
            assertThat(key.kind()).isEqualTo(ColumnKind.TABLE);
            assertThat(key.wildcard()).isNotNull();
        }

        @Test
        @DisplayName("Using-joins keep a single key column")
        void testUsingJoin() {
            RqQuery rq = resolve("from a | join b (==id)");

            assertThat(outputNames(rq)).containsOnlyOnce("id");
            assertThat(outputNames(rq)).contains("x", "y");
            Relation.Join join = (Relation.Join) rq.relation(rq.main());
            assertThat(join.condition()).isInstanceOf(RqExpr.Binary.class);
        }
    }

    @Nested
    @DisplayName("Declarations")
    class DeclarationTests {

        @Test
        @DisplayName("Relation variables become declared relations")
        void testDeclaredRelation() {
            RqQuery rq = resolve("let high = (from e | filter salary > 100)\nfrom high | select {name}");

            assertThat(rq.declaredRelations()).hasSize(1);
            assertThat(rq.declared("high")).isPresent();
            assertThat(outputNames(rq)).containsExactly("name");
        }

        @Test
        @DisplayName("Relations that refer to each other are rejected")
        void testCycle() {
            assertThatThrownBy(() -> resolve("let x = (from y)\nlet y = (from x)\nfrom x"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(reasonOf(e))
                    .isEqualTo(ResolveException.Reason.CYCLIC_RELATION_REFERENCE));
        }

        @Test
        @DisplayName("Functions are inlined at the call site")
        void testFunctionInlining() {
            RqQuery rq = resolve("let add_one = x -> x + 1\nfrom t | select {c = add_one a}");

            assertThat(outputNames(rq)).containsExactly("c");
            Relation.Select select = (Relation.Select) rq.relation(rq.main());
            assertThat(select.computes()).hasSize(1);
            assertThat(select.computes().get(0).expr()).isInstanceOf(RqExpr.Binary.class);
        }

        @Test
        @DisplayName("Self-recursive functions hit the recursion limit")
        void testRecursionLimit() {
            assertThatThrownBy(() -> resolve("let f = x -> f x\nfrom t | derive {c = f a}", 8))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(reasonOf(e))
                    .isEqualTo(ResolveException.Reason.RECURSION_LIMIT_EXCEEDED));
        }

        @Test
        @DisplayName("Transforms can be partially applied")
        void testPartialApplication() {
            RqQuery rq = resolve("let take_two = take 2\nfrom t | sort a | take_two");

            Relation.Take take = (Relation.Take) rq.relation(rq.main());
            assertThat(take.limit()).isEqualTo(2L);
            assertThat(take.offset()).isZero();
        }

        @Test
        @DisplayName("Unknown named arguments are rejected")
        void testUnknownNamedArgument() {
            assertThatThrownBy(() -> resolve("from t | take 2 foo:1"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> {
                    assertThat(reasonOf(e)).isEqualTo(ResolveException.Reason.UNKNOWN_NAME);
                    assertThat(((ResolveException) e).getName()).isEqualTo("foo");
                });
        }
    }

    @Nested
    @DisplayName("Grouped Transforms")
    class GroupedTransformTests {

        @Test
        @DisplayName("Take on unordered rows numbers them without a partition")
        void testUnorderedTake() {
            RqQuery rq = resolve("from t | take 2..3");

            Relation.Select select = (Relation.Select) rq.relation(rq.main());
            Relation.Filter filter = (Relation.Filter) rq.relation(select.source());
            Relation.Window window = (Relation.Window) rq.relation(filter.source());

            assertThat(window.partitionBy()).isEmpty();
            assertThat(window.orderBy()).isEmpty();
            assertThat(window.computes()).singleElement()
                .satisfies(c -> assertThat(c.expr()).isEqualTo(new RqExpr.FunctionCall("row_number", List.of())));
            RqExpr.Between range = (RqExpr.Between) filter.predicate();
            assertThat(range.low()).isEqualTo(RqExpr.Constant.of(2));
            assertThat(range.high()).isEqualTo(RqExpr.Constant.of(3));
            assertThat(outputNames(rq)).containsExactly("a", "b");
        }

        @Test
        @DisplayName("Take on sorted rows stays a take carrying the sort")
        void testSortedTake() {
            RqQuery rq = resolve("from t | sort b | take 2");

            Relation.Take take = (Relation.Take) rq.relation(rq.main());
            assertThat(take.limit()).isEqualTo(2L);
            assertThat(take.sort()).hasSize(1);
        }

        @Test
        @DisplayName("Take inside group numbers rows per partition")
        void testGroupedTake() {
            RqQuery rq = resolve("from e | group {dept} (sort salary | take 1)");

            logData("RQ", rq);
            Relation.Select select = (Relation.Select) rq.relation(rq.main());
            Relation.Filter filter = (Relation.Filter) rq.relation(select.source());
            Relation.Window window = (Relation.Window) rq.relation(filter.source());

            assertThat(filter.predicate()).isInstanceOf(RqExpr.Between.class);
            assertThat(window.partitionBy()).hasSize(1);
            assertThat(window.orderBy()).hasSize(1);
            assertThat(outputNames(rq)).containsExactly("name", "dept", "salary");
        }
    }
}
