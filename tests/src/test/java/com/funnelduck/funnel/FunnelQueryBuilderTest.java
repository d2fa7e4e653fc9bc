package com.funnelduck.funnel;

import static org.assertj.core.api.Assertions.*;

import com.funnelduck.cohort.CohortFilterInput;
import com.funnelduck.exception.BadRequestException;
import com.funnelduck.generator.CompiledQuery;
import com.funnelduck.generator.SQLCompiler;
import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import java.util.LinkedHashSet;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Shape of the compiled funnel statements for each order type and option.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FunnelQueryBuilder Tests")
public class FunnelQueryBuilderTest extends TestBase {

    private static final String PROJECT = "11111111-1111-1111-1111-111111111111";
    private static final long DAY = 86_400;

    private SQLCompiler compiler;

    @Override
    protected void doSetUp() {
        compiler = new SQLCompiler();
    }

    private static FunnelRequest.Builder request() {
        return FunnelRequest.builder(PROJECT, "2025-01-01", "2025-01-31").steps("signup", "purchase");
    }

    private CompiledQuery compile(FunnelRequest request) {
        FunnelScope scope = FunnelScope.of(request, 14 * DAY, null);
        return compiler.compile(FunnelQueryBuilder.buildFunnelQuery(scope));
    }

    private static void assertParamsMatchPlaceholders(CompiledQuery q) {
        assertThat(q.params().keySet()).containsExactlyInAnyOrderElementsOf(new LinkedHashSet<>(q.placeholderNames()));
    }

    @Nested
    @DisplayName("Ordered Funnels")
    class OrderedTests {

        @Test
        @DisplayName("Ordered funnels use windowFunnel without flags")
        void testOrderedShape() {
            CompiledQuery q = compile(request().build());

            assertThat(q.sql())
                .startsWith("WITH\n  funnel_raw AS (\nSELECT\n  coalesce(dictGetOrNull(")
                .contains("windowFunnel({window:UInt64} * 1000)(")
                .contains("funnel_per_user AS (")
                .contains("arrayMin(arrayFilter(a -> arrayExists(l -> a <= l AND l <= a + toInt64({window:UInt64}) * 1000, "
                    + "arrayElement([t0_arr, t1_arr], max_step)), t0_arr))")
                .contains("[step_0_ms, step_1_ms] AS step_ms_arr")
                .contains("FROM funnel_per_user\nCROSS JOIN (SELECT\n  number + 1 AS step_num\n"
                    + "FROM numbers({num_steps:UInt64})) AS steps")
                .endsWith("GROUP BY step_num\nORDER BY step_num ASC")
                .doesNotContain("strict_order")
                .doesNotContain("excluded_users");
            assertThat(q.params())
                .containsEntry("project_id", PROJECT)
                .containsEntry("from", "2025-01-01 00:00:00")
                .containsEntry("to", "2025-01-31 23:59:59")
                .containsEntry("step_0_name", "signup")
                .containsEntry("step_1_name", "purchase")
                .containsEntry("window", 14 * DAY)
                .containsEntry("num_steps", 2L);
            assertParamsMatchPlaceholders(q);
        }

        @Test
        @DisplayName("Later steps take the earliest timestamp after the previous step within the window")
        void testStepTimestamps() {
            CompiledQuery q = compile(request().build());

            assertThat(q.sql()).contains("if(max_step > 1, arrayMin(arrayFilter(t -> step_0_ms > 0 AND t >= step_0_ms AND "
                + "t <= step_0_ms + toInt64({window:UInt64}) * 1000, t1_arr)), toInt64(0)) AS step_1_ms");
        }

        @Test
        @DisplayName("A missing step breaks the chain instead of matching events before the anchor")
        void testChainStopsAtMissingStep() {
            CompiledQuery q = compile(FunnelRequest.builder(PROJECT, "2025-01-01", "2025-01-31").steps("a", "b", "c").build());

            assertThat(q.sql()).contains("if(max_step > 2, arrayMin(arrayFilter(t -> step_1_ms > 0 AND t >= step_1_ms AND "
                + "t >= step_0_ms AND t <= step_0_ms + toInt64({window:UInt64}) * 1000, t2_arr)), toInt64(0)) AS step_2_ms");
        }

        @Test
        @DisplayName("The outer query counts entries, conversions and average times per step")
        void testAggregates() {
            CompiledQuery q = compile(request().build());

            assertThat(q.sql())
                .contains("countIf(max_step >= step_num) AS entered")
                .contains("countIf(max_step >= step_num + 1) AS next_step")
                .contains("avgIf((arrayElement(step_ms_arr, step_num) - arrayElement(step_ms_arr, step_num - 1)) / 1000, "
                    + "step_num > 1 AND max_step >= step_num AND arrayElement(step_ms_arr, step_num - 1) > 0 AND "
                    + "arrayElement(step_ms_arr, step_num) > arrayElement(step_ms_arr, step_num - 1)) AS avg_time_seconds");
        }

        @Test
        @DisplayName("Compilation is deterministic")
        void testDeterministic() {
            FunnelRequest r = request().exclusion(new FunnelExclusion("logout", 0, 1)).build();

            assertThat(compile(r)).isEqualTo(compile(r));
        }
    }

    @Nested
    @DisplayName("Strict Funnels")
    class StrictTests {

        @Test
        @DisplayName("Strict funnels flag windowFunnel and drop people with outside events")
        void testStrictShape() {
            CompiledQuery q = compile(request().orderType(FunnelOrderType.STRICT)
                .exclusion(new FunnelExclusion("logout", 0, 1)).build());

            assertThat(q.sql())
                .contains("windowFunnel({window:UInt64} * 1000, 'strict_order')(")
                .contains("NOT IN (SELECT DISTINCT")
                .contains("event_name NOT IN {all_event_names:Array(String)}")
                .contains("arrayMax(arrayFilter(a -> ");
            assertThat(q.params().get("all_event_names")).isEqualTo(List.of("signup", "purchase", "logout"));
            assertParamsMatchPlaceholders(q);
        }
    }

    @Nested
    @DisplayName("Unordered Funnels")
    class UnorderedTests {

        @Test
        @DisplayName("Unordered funnels anchor on any step")
        void testUnorderedShape() {
            CompiledQuery q = compile(request().orderType(FunnelOrderType.UNORDERED).build());

            assertThat(q.sql())
                .contains("step_times AS (")
                .contains("anchor_per_user AS (")
                .contains("funnel_per_user AS (")
                .contains("event_name IN {all_event_names:Array(String)}")
                .contains("toInt64(greatest(arrayMax(a0 -> toInt64(")
                .contains("anchor_ms AS step_0_ms")
                .contains("if(length(t0_arr) > 0, arrayMin(t0_arr), toInt64(0))")
                .doesNotContain("windowFunnel");
            assertParamsMatchPlaceholders(q);
        }

        @Test
        @DisplayName("Only people with a step-0 event enter the funnel")
        void testRequiresFirstStep() {
            String sql = compile(request().orderType(FunnelOrderType.UNORDERED).build()).sql();

            String anchorCte = sql.substring(sql.indexOf("anchor_per_user AS ("), sql.indexOf("funnel_per_user AS ("));
            assertThat(anchorCte).contains("FROM step_times\nWHERE length(t0_arr) > 0");
        }

        @Test
        @DisplayName("The last step's array is searched first for a full anchor")
        void testAnchorPrecedence() {
            String sql = compile(request().orderType(FunnelOrderType.UNORDERED).build()).sql();

            int anchorStart = sql.indexOf("AS max_step");
            String anchor = sql.substring(anchorStart);
            assertThat(anchor.indexOf(", t1_arr)))")).isLessThan(anchor.indexOf(", t0_arr)))"));
        }

        @Test
        @DisplayName("Unordered exclusions only consider from-steps inside the anchor window")
        void testUnorderedExclusions() {
            CompiledQuery q = compile(request().orderType(FunnelOrderType.UNORDERED)
                .exclusion(new FunnelExclusion("logout", 0, 1)).build());

            assertThat(q.sql())
                .contains("excluded_users AS (")
                .contains("arrayExists(f -> f >= step_0_ms AND ");
        }
    }

    @Nested
    @DisplayName("Breakdowns")
    class BreakdownTests {

        @Test
        @DisplayName("Property breakdowns keep the top values plus the empty one")
        void testPropertyBreakdown() {
            FunnelScope scope = FunnelScope.of(request().build(), 14 * DAY, null);

            CompiledQuery q = compiler.compile(FunnelQueryBuilder.buildPropertyBreakdownQuery(scope, "browser", 5));

            assertThat(q.sql())
                .contains("argMinIf(browser, timestamp, event_name = {step_0_name:String}) AS breakdown_value")
                .contains("top_breakdown_values AS (")
                .contains("ORDER BY bd_count DESC\nLIMIT 5")
                .contains("breakdown_total AS (\nSELECT\n  count() AS total\nFROM (SELECT")
                .contains("(SELECT\n  total\nFROM breakdown_total) AS total_bd_count")
                .contains("WHERE breakdown_value IN (SELECT\n  breakdown_value\nFROM top_breakdown_values) OR breakdown_value = ''")
                .endsWith("GROUP BY breakdown_value, step_num\nORDER BY step_num ASC");
        }

        @Test
        @DisplayName("Strict breakdowns take the value of the latest first-step event")
        void testStrictBreakdownValue() {
            FunnelScope scope = FunnelScope.of(request().orderType(FunnelOrderType.STRICT).build(), 14 * DAY, null);

            assertThat(compiler.compile(FunnelQueryBuilder.buildPropertyBreakdownQuery(scope, "browser", 5)).sql())
                .contains("argMaxIf(browser, timestamp, event_name = {step_0_name:String}) AS breakdown_value");
        }

        @Test
        @DisplayName("Unordered breakdowns take the value at the anchor")
        void testUnorderedBreakdownValue() {
            FunnelScope scope = FunnelScope.of(request().orderType(FunnelOrderType.UNORDERED).build(), 14 * DAY, null);

            assertThat(compiler.compile(FunnelQueryBuilder.buildPropertyBreakdownQuery(scope, "properties.plan", 5)).sql())
                .contains("groupArrayIf(JSONExtractString(properties, 'plan'), event_name = {step_0_name:String}) AS t0_bv_arr")
                .contains("arrayElement(t0_bv_arr, indexOf(t0_arr, anchor_ms)) AS breakdown_value");
        }

        @Test
        @DisplayName("Unsafe breakdown properties are rejected")
        void testUnsafeBreakdownProperty() {
            FunnelScope scope = FunnelScope.of(request().build(), 14 * DAY, null);

            assertThatThrownBy(() -> FunnelQueryBuilder.buildPropertyBreakdownQuery(scope, "properties.x'y", 5))
                .isInstanceOf(BadRequestException.class);
        }

        @Test
        @DisplayName("Cohort breakdown queries restrict the population to the cohort")
        void testCohortBreakdown() {
            FunnelScope scope = FunnelScope.of(request().build(), 14 * DAY, null);
            CohortFilterInput cohort = CohortFilterInput.materialized("aaaa-bbbb", "Buyers");

            CompiledQuery q = compiler.compile(FunnelQueryBuilder.buildCohortBreakdownQuery(scope, cohort, 0));

            assertThat(q.sql()).contains("{cohort_bd_aaaabbbb:UUID}").doesNotContain("breakdown_value");
            assertThat(q.params()).containsEntry("cohort_bd_aaaabbbb", "aaaa-bbbb");
        }
    }

    @Nested
    @DisplayName("Event Filters")
    class EventFilterTests {

        @Test
        @DisplayName("Cohort filters, sampling and timezone reach the events scan")
        void testEventConditions() {
            CompiledQuery q = compile(request()
                .timezone("Europe/Berlin")
                .samplingFactor(0.1)
                .cohortFilters(List.of(CohortFilterInput.materialized("c1", "Buyers")))
                .build());

            assertThat(q.sql())
                .contains("timestamp >= toDateTime64({from:String}, 3, {tz:String})")
                .contains("FROM cohort_members FINAL\nWHERE cohort_id = {coh_mid_0:UUID}")
                .contains("% 100 < {sample_pct:UInt8}");
            assertThat(q.params())
                .containsEntry("tz", "Europe/Berlin")
                .containsEntry("sample_pct", 10L);
            assertParamsMatchPlaceholders(q);
        }

        @Test
        @DisplayName("Exclusions add the excluded_users CTE and the final filter")
        void testExclusions() {
            CompiledQuery q = compile(request().steps("confirm").exclusion(new FunnelExclusion("logout", 0, 2)).build());

            assertThat(q.sql())
                .contains("excl_0_from_arr")
                .contains("excluded_users AS (\nSELECT\n  person_id\nFROM funnel_per_user\nWHERE ")
                .contains("WHERE person_id NOT IN (SELECT\n  person_id\nFROM excluded_users)");
            assertThat(q.params()).containsEntry("excl_0_name", "logout")
                .containsEntry("excl_0_to_step_name", "confirm");
        }
    }
}
