package com.funnelduck.funnel;

import static com.funnelduck.generator.Functions.col;
import static org.assertj.core.api.Assertions.*;

import com.funnelduck.exception.BadRequestException;
import com.funnelduck.expression.Expression;
import com.funnelduck.generator.CompiledQuery;
import com.funnelduck.generator.SQLCompiler;
import com.funnelduck.helpers.FilterOperator;
import com.funnelduck.helpers.PropertyFilter;
import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FunnelExclusions Tests")
public class FunnelExclusionsTest extends TestBase {

    private static final List<FunnelStep> STEPS =
        List.of(FunnelStep.of("view"), FunnelStep.of("cart"), FunnelStep.of("purchase"));

    private SQLCompiler compiler;

    @Override
    protected void doSetUp() {
        compiler = new SQLCompiler();
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Step ranges must be increasing and inside the funnel")
        void testRanges() {
            assertThatCode(() -> FunnelExclusions.validate(List.of(new FunnelExclusion("logout", 0, 2)), STEPS))
                .doesNotThrowAnyException();
            assertThatThrownBy(() -> FunnelExclusions.validate(List.of(new FunnelExclusion("logout", 1, 1)), STEPS))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("got 1 -> 1");
            assertThatThrownBy(() -> FunnelExclusions.validate(List.of(new FunnelExclusion("logout", 0, 3)), STEPS))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("[0, 2]");
            assertThatThrownBy(() -> FunnelExclusions.validate(List.of(new FunnelExclusion("logout", -1, 1)), STEPS))
                .isInstanceOf(BadRequestException.class);
        }

        @Test
        @DisplayName("Excluding a step event needs filters")
        void testStepEventNeedsFilters() {
            assertThatThrownBy(() -> FunnelExclusions.validate(List.of(new FunnelExclusion("cart", 0, 2)), STEPS))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("must have filters");

            FunnelExclusion filtered = new FunnelExclusion("cart", 0, 2,
                List.of(PropertyFilter.of("properties.source", FilterOperator.EQ, "email")));
            assertThatCode(() -> FunnelExclusions.validate(List.of(filtered), STEPS)).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Columns")
    class ColumnTests {

        @Test
        @DisplayName("Each exclusion contributes three timestamp arrays")
        void testColumns() {
            List<Expression> columns = FunnelExclusions.buildExclusionColumns(
                List.of(new FunnelExclusion("logout", 0, 2)), STEPS);

            assertThat(columns).hasSize(3);
            CompiledQuery from = compiler.compileExpression(columns.get(0));
            CompiledQuery to = compiler.compileExpression(columns.get(1));
            CompiledQuery excl = compiler.compileExpression(columns.get(2));
            assertThat(from.sql()).isEqualTo("groupArrayIf(toUnixTimestamp64Milli(timestamp), "
                + "event_name = {excl_0_from_step_name:String}) AS excl_0_from_arr");
            assertThat(to.params()).containsEntry("excl_0_to_step_name", "purchase");
            assertThat(excl.sql()).endsWith("event_name = {excl_0_name:String}) AS excl_0_arr");
            assertThat(FunnelExclusions.columnNames(1))
                .containsExactly("excl_0_from_arr", "excl_0_to_arr", "excl_0_arr");
        }
    }

    @Nested
    @DisplayName("Excluded Users")
    class ExcludedUsersTests {

        @Test
        @DisplayName("A user is excluded when tainted and no pair is clean")
        void testWhereExpr() {
            Expression where = FunnelExclusions.buildExcludedUsersWhereExpr(
                List.of(new FunnelExclusion("logout", 0, 1)), 60, Optional.empty()).orElseThrow();

            String sql = compiler.compileExpression(where).sql();

            assertThat(sql).isEqualTo(
                "arrayExists(f -> arrayExists(t -> t > f AND t <= f + toInt64({window:UInt64}) * 1000"
                    + " AND arrayExists(e -> e > f AND e < t, excl_0_arr), excl_0_to_arr) = 1, excl_0_from_arr) = 1"
                    + " AND arrayExists(f -> arrayExists(t -> t > f AND t <= f + toInt64({window:UInt64}) * 1000"
                    + " AND NOT arrayExists(e -> e > f AND e < t, excl_0_arr), excl_0_to_arr) = 1, excl_0_from_arr) = 0");
        }

        @Test
        @DisplayName("An anchor restricts from-step occurrences to its window")
        void testAnchorGuard() {
            Expression where = FunnelExclusions.buildExcludedUsersWhereExpr(
                List.of(new FunnelExclusion("logout", 0, 1)), 60, Optional.of(col("step_0_ms"))).orElseThrow();

            assertThat(compiler.compileExpression(where).sql())
                .contains("arrayExists(f -> f >= step_0_ms AND f <= step_0_ms + toInt64({window:UInt64}) * 1000 AND ");
        }

        @Test
        @DisplayName("Several exclusions are ORed")
        void testSeveral() {
            Expression where = FunnelExclusions.buildExcludedUsersWhereExpr(List.of(
                new FunnelExclusion("logout", 0, 1), new FunnelExclusion("refund", 1, 2)), 60, Optional.empty())
                .orElseThrow();

            String sql = compiler.compileExpression(where).sql();

            assertThat(sql).contains("excl_0_from_arr) = 0 OR arrayExists(").contains("excl_1_arr");
        }

        @Test
        @DisplayName("No exclusions means no filter")
        void testNone() {
            assertThat(FunnelExclusions.buildExcludedUsersWhereExpr(List.of(), 60, Optional.empty())).isEmpty();
            assertThat(FunnelExclusions.notExcluded(List.of())).isEmpty();
        }

        @Test
        @DisplayName("The final filter reads the excluded_users CTE")
        void testNotExcluded() {
            Expression e = FunnelExclusions.notExcluded(List.of(new FunnelExclusion("logout", 0, 1))).orElseThrow();

            assertThat(compiler.compileExpression(e).sql())
                .isEqualTo("person_id NOT IN (SELECT\n  person_id\nFROM excluded_users)");
        }
    }
}
