package com.funnelduck.funnel;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.cohort.CohortFilterInput;
import com.funnelduck.expression.Expression;
import com.funnelduck.helpers.CohortFilters;
import com.funnelduck.helpers.PropertyFilters;
import com.funnelduck.query.OrderItem;
import com.funnelduck.query.SelectBuilder;
import com.funnelduck.query.SelectNode;
import com.funnelduck.runtime.EngineConfig;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles complete funnel statements from the per-user CTE chain.
 *
 * <p>The outer query cross joins {@value FunnelCtes#PER_USER} with the step
 * numbers {@code 1..N} and counts, per step, the people who entered it and the
 * people who went on to the next one. Rows come back as
 * {@code [breakdown_value,] step_num, entered, next_step, avg_time_seconds
 * [, total_bd_count]}, ordered by {@code step_num}.
 */
public final class FunnelQueryBuilder {

    public static final String TOP_BREAKDOWN_CTE = "top_breakdown_values";
    public static final String BREAKDOWN_TOTAL_CTE = "breakdown_total";

    private FunnelQueryBuilder() {
    }

    /**
     * The funnel query for a scope without breakdown, or with the configured
     * default breakdown limit.
     */
    public static SelectNode buildFunnelQuery(FunnelScope scope) {
        return buildFunnelQuery(scope, EngineConfig.DEFAULT_BREAKDOWN_LIMIT);
    }

    /**
     * The funnel query for a scope. With a breakdown, only the top
     * {@code breakdownLimit} non-empty values (by people reaching step 1) and
     * the empty value are kept, and each row carries the number of distinct
     * non-empty values in {@code total_bd_count}.
     */
    public static SelectNode buildFunnelQuery(FunnelScope scope, int breakdownLimit) {
        FunnelCtes chain = FunnelCtes.build(scope);
        List<FunnelExclusion> exclusions = scope.exclusions();
        int numSteps = scope.steps().size();

        List<Expression> columns = new ArrayList<>();
        if (scope.hasBreakdown()) {
            columns.add(col("breakdown_value"));
        }
        columns.addAll(stepAggregates());
        if (scope.hasBreakdown()) {
            columns.add(subquery(SelectBuilder.select(col("total")).from(BREAKDOWN_TOTAL_CTE).build())
                .as("total_bd_count"));
        }

        SelectBuilder builder = SelectBuilder.select(columns)
            .withAll(chain.ctes())
            .from(FunnelCtes.PER_USER)
            .crossJoin(stepNumbers(numSteps), "steps")
            .where(FunnelExclusions.notExcluded(exclusions));

        if (scope.hasBreakdown()) {
            builder.with(TOP_BREAKDOWN_CTE, topBreakdownValues(exclusions, breakdownLimit))
                .with(BREAKDOWN_TOTAL_CTE, breakdownTotal(exclusions))
                .where(or(
                    inSubquery(col("breakdown_value"),
                        SelectBuilder.select(col("breakdown_value")).from(TOP_BREAKDOWN_CTE).build()),
                    eq(col("breakdown_value"), literal(""))))
                .groupBy(col("breakdown_value"), col("step_num"));
        } else {
            builder.groupBy(col("step_num"));
        }
        return builder.orderBy(col("step_num")).build();
    }

    /**
     * Funnel query for a property breakdown; the property is resolved with
     * {@link PropertyFilters#resolvePropertyExpr}.
     */
    public static SelectNode buildPropertyBreakdownQuery(FunnelScope scope, String property, int breakdownLimit) {
        return buildFunnelQuery(scope.withBreakdown(PropertyFilters.resolvePropertyExpr(property)), breakdownLimit);
    }

    /**
     * Funnel query restricted to the members of one breakdown cohort.
     */
    public static SelectNode buildCohortBreakdownQuery(FunnelScope scope, CohortFilterInput cohort, int groupIndex) {
        FunnelRequest request = scope.request();
        Expression members = CohortFilters.breakdownFilter(cohort, groupIndex, request.projectId(),
            scope.lookup(), request.dateTo(), request.dateFrom());
        return buildFunnelQuery(scope.withPopulationFilter(members));
    }

    // ==================== Pieces ====================

    /**
     * <pre>
     * step_num,
     * countIf(max_step >= step_num) AS entered,
     * countIf(max_step >= step_num + 1) AS next_step,
     * avgIf((step_ms_arr[step_num] - step_ms_arr[step_num - 1]) / 1000,
     *       step_num > 1 AND max_step >= step_num AND prev > 0 AND cur > prev) AS avg_time_seconds
     * </pre>
     *
     * <p>A step timestamp of 0 means the step has no event in the person's
     * window; such pairs are left out of the average.
     */
    static List<Expression> stepAggregates() {
        Expression stepNum = col("step_num");
        Expression maxStep = col("max_step");
        Expression cur = arrayElement(col("step_ms_arr"), stepNum);
        Expression prev = arrayElement(col("step_ms_arr"), sub(stepNum, literal(1)));

        List<Expression> columns = new ArrayList<>();
        columns.add(stepNum);
        columns.add(countIf(gte(maxStep, stepNum)).as("entered"));
        columns.add(countIf(gte(maxStep, add(stepNum, literal(1)))).as("next_step"));
        columns.add(avgIf(div(sub(cur, prev), literal(1000.0)),
            and(gt(stepNum, literal(1)), gte(maxStep, stepNum), gt(prev, literal(0)), gt(cur, prev)))
            .as("avg_time_seconds"));
        return columns;
    }

    /**
     * {@code SELECT number + 1 AS step_num FROM numbers({num_steps:UInt64})}
     */
    static SelectNode stepNumbers(int numSteps) {
        return SelectBuilder.select(add(col("number"), literal(1)).as("step_num"))
            .from(func("numbers", named("num_steps", "UInt64", (long) numSteps)))
            .build();
    }

    private static SelectNode topBreakdownValues(List<FunnelExclusion> exclusions, int limit) {
        return SelectBuilder.select(col("breakdown_value"), count().as("bd_count"))
            .from(FunnelCtes.PER_USER)
            .where(gte(col("max_step"), literal(1)), neq(col("breakdown_value"), literal("")))
            .where(FunnelExclusions.notExcluded(exclusions))
            .groupBy(col("breakdown_value"))
            .orderBy(col("bd_count"), OrderItem.Direction.DESC)
            .limit(limit)
            .build();
    }

    private static SelectNode breakdownTotal(List<FunnelExclusion> exclusions) {
        SelectNode distinctValues = SelectBuilder.select(col("breakdown_value"))
            .from(FunnelCtes.PER_USER)
            .where(gte(col("max_step"), literal(1)), neq(col("breakdown_value"), literal("")))
            .where(FunnelExclusions.notExcluded(exclusions))
            .groupBy(col("breakdown_value"))
            .build();
        return SelectBuilder.select(count().as("total"))
            .from(distinctValues, null)
            .build();
    }
}
