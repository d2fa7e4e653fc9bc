package com.funnelduck.funnel;

import static org.assertj.core.api.Assertions.*;

import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FunnelResults Tests")
public class FunnelResultsTest extends TestBase {

    private static final List<FunnelStep> STEPS = List.of(
        FunnelStep.of("view", "Viewed"), FunnelStep.of("cart", "Carted"), FunnelStep.of("purchase", "Bought"));

    private static Map<String, Object> row(Object stepNum, Object entered, Object avg) {
        Map<String, Object> row = new HashMap<>();
        row.put("step_num", stepNum);
        row.put("entered", entered);
        row.put("next_step", 0L);
        row.put("avg_time_seconds", avg);
        return row;
    }

    private static Map<String, Object> bdRow(String value, int stepNum, long entered, long total) {
        Map<String, Object> row = row((long) stepNum, entered, null);
        row.put("breakdown_value", value);
        row.put("total_bd_count", total);
        return row;
    }

    @Nested
    @DisplayName("Step Arithmetic")
    class ArithmeticTests {

        @Test
        @DisplayName("Rates are relative to the first step in total mode")
        void testTotalMode() {
            List<FunnelStepResult> steps = FunnelResults.computeStepResults(List.of(
                row(1L, 200L, Double.NaN), row(2L, 100L, 30.4), row(3L, 30L, 120.6)), STEPS, StepDisplayMode.TOTAL);

            assertThat(steps).extracting(FunnelStepResult::count).containsExactly(200L, 100L, 30L);
            assertThat(steps).extracting(FunnelStepResult::conversionRate).containsExactly(1.0, 0.5, 0.15);
            assertThat(steps).extracting(FunnelStepResult::dropOff).containsExactly(0L, 100L, 70L);
            assertThat(steps).extracting(FunnelStepResult::dropOffRate).containsExactly(0.0, 0.5, 0.7);
            assertThat(steps).extracting(FunnelStepResult::avgTimeToConvertSeconds).containsExactly(null, 30L, 121L);
            assertThat(steps.get(2).label()).isEqualTo("Bought");
            assertThat(steps.get(2).eventName()).isEqualTo("purchase");
        }

        @Test
        @DisplayName("Rates are relative to the previous step in relative mode")
        void testRelativeMode() {
            List<FunnelStepResult> steps = FunnelResults.computeStepResults(List.of(
                row(1L, 200L, null), row(2L, 100L, null), row(3L, 30L, null)), STEPS, StepDisplayMode.RELATIVE);

            assertThat(steps).extracting(FunnelStepResult::conversionRate).containsExactly(1.0, 0.5, 0.3);
        }

        @Test
        @DisplayName("Rates are rounded to four decimals")
        void testRounding() {
            List<FunnelStepResult> steps = FunnelResults.computeStepResults(List.of(
                row(1L, 3L, null), row(2L, 1L, null), row(3L, 1L, null)), STEPS, StepDisplayMode.TOTAL);

            assertThat(steps.get(1).conversionRate()).isEqualTo(0.3333);
            assertThat(steps.get(1).dropOffRate()).isEqualTo(0.6667);
        }

        @Test
        @DisplayName("No rows yields zero steps")
        void testEmpty() {
            List<FunnelStepResult> steps = FunnelResults.computeStepResults(List.of(), STEPS, StepDisplayMode.TOTAL);

            assertThat(steps).hasSize(3);
            assertThat(steps).allSatisfy(s -> {
                assertThat(s.count()).isZero();
                assertThat(s.conversionRate()).isZero();
            });
        }

        @Test
        @DisplayName("Numbers returned as strings are accepted")
        void testStringNumbers() {
            List<FunnelStepResult> steps = FunnelResults.computeStepResults(List.of(
                row("1", "10", "nan"), row("2", "5", "42.0")), STEPS, StepDisplayMode.TOTAL);

            assertThat(steps.get(1).count()).isEqualTo(5L);
            assertThat(steps.get(1).avgTimeToConvertSeconds()).isEqualTo(42L);
        }

        @Test
        @DisplayName("Negative average times are dropped")
        void testNegativeAverage() {
            List<FunnelStepResult> steps = FunnelResults.computeStepResults(List.of(
                row(1L, 10L, null), row(2L, 5L, -3.0)), STEPS, StepDisplayMode.TOTAL);

            assertThat(steps.get(1).avgTimeToConvertSeconds()).isNull();
        }
    }

    @Nested
    @DisplayName("Breakdowns")
    class BreakdownTests {

        @Test
        @DisplayName("Groups sort by first-step count with (none) last")
        void testPropertyGroups() {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (int s = 1; s <= 3; s++) {
                rows.add(bdRow("", s, 500, 2));
                rows.add(bdRow("Firefox", s, 10, 2));
                rows.add(bdRow("Chrome", s, 50, 2));
            }

            List<FunnelStepResult> steps = FunnelResults.computePropertyBreakdownResults(rows, STEPS, StepDisplayMode.TOTAL);

            assertThat(steps).hasSize(9);
            assertThat(steps).extracting(FunnelStepResult::breakdownValue).containsExactly(
                "Chrome", "Chrome", "Chrome", "Firefox", "Firefox", "Firefox", "(none)", "(none)", "(none)");
            assertThat(FunnelResults.totalBreakdownCount(rows)).isEqualTo(2L);
        }

        @Test
        @DisplayName("Cohort groups carry the cohort name")
        void testCohortGroup() {
            List<FunnelStepResult> steps = FunnelResults.computeCohortBreakdownResults(
                List.of(row(1L, 4L, null), row(2L, 2L, 60.0)), STEPS, StepDisplayMode.TOTAL, "Buyers");

            assertThat(steps).extracting(FunnelStepResult::breakdownValue).containsOnly("Buyers");
        }

        @Test
        @DisplayName("Aggregates sum counts and carry no times")
        void testAggregate() {
            List<FunnelStepResult> a = FunnelResults.computeCohortBreakdownResults(
                List.of(row(1L, 4L, null), row(2L, 2L, 60.0), row(3L, 1L, 10.0)), STEPS, StepDisplayMode.TOTAL, "A");
            List<FunnelStepResult> b = FunnelResults.computeCohortBreakdownResults(
                List.of(row(1L, 6L, null), row(2L, 3L, 60.0), row(3L, 0L, null)), STEPS, StepDisplayMode.TOTAL, "B");
            List<FunnelStepResult> all = new ArrayList<>(a);
            all.addAll(b);

            List<FunnelStepResult> agg = FunnelResults.computeAggregateSteps(all, STEPS, StepDisplayMode.TOTAL);

            assertThat(agg).extracting(FunnelStepResult::count).containsExactly(10L, 5L, 1L);
            assertThat(agg).extracting(FunnelStepResult::conversionRate).containsExactly(1.0, 0.5, 0.1);
            assertThat(agg).extracting(FunnelStepResult::avgTimeToConvertSeconds).containsOnlyNulls();
            assertThat(agg).extracting(FunnelStepResult::breakdownValue).containsOnlyNulls();
        }

        @Test
        @DisplayName("No rows means no breakdown values")
        void testNoRows() {
            assertThat(FunnelResults.totalBreakdownCount(List.of())).isZero();
        }
    }
}
