package com.funnelduck.funnel;

import static com.funnelduck.funnel.FunnelCtes.stepArr;
import static com.funnelduck.funnel.FunnelCtes.stepMs;
import static com.funnelduck.generator.Functions.*;

import com.funnelduck.expression.Expression;
import com.funnelduck.helpers.ResolvedPerson;
import com.funnelduck.query.CommonTableExpression;
import com.funnelduck.query.SelectBuilder;
import com.funnelduck.query.SelectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * CTEs for ordered and strict funnels.
 *
 * <pre>
 * funnel_raw:      one row per person over the whole event stream in range;
 *                  max_step from windowFunnel plus per-step timestamp arrays
 * funnel_per_user: the anchor (step_0_ms) and the earliest timestamp of each
 *                  later step that follows the previous one within the window;
 *                  0 from the first step without such an event onwards
 * </pre>
 *
 * <p>Ordered mode anchors on the earliest step-0 event that still has an
 * occurrence of the last reached step within one window; strict mode on the
 * latest. Strict mode also drops every person with an event outside the
 * funnel's event universe in range.
 */
final class OrderedFunnelCtes {

    private OrderedFunnelCtes() {
    }

    static List<CommonTableExpression> build(FunnelScope scope, boolean strict) {
        List<CommonTableExpression> ctes = new ArrayList<>();
        ctes.add(new CommonTableExpression(FunnelCtes.RAW, raw(scope, strict)));
        ctes.add(new CommonTableExpression(FunnelCtes.PER_USER, perUser(scope, strict)));
        return ctes;
    }

    private static SelectNode raw(FunnelScope scope, boolean strict) {
        List<FunnelStep> steps = scope.steps();
        List<Expression> columns = new ArrayList<>();
        columns.add(ResolvedPerson.expr().as("person_id"));
        columns.add(FunnelSteps.windowFunnel(steps, scope.windowSeconds(), strict).as("max_step"));
        if (scope.hasBreakdown()) {
            Expression firstStep = FunnelSteps.buildStepCondition(steps.get(0), 0);
            Expression value = strict
                ? argMaxIf(scope.breakdownExpr(), col("timestamp"), firstStep)
                : argMinIf(scope.breakdownExpr(), col("timestamp"), firstStep);
            columns.add(value.as("breakdown_value"));
        }
        for (int i = 0; i < steps.size(); i++) {
            columns.add(FunnelSteps.timestampsWhere(FunnelSteps.buildStepCondition(steps.get(i), i)).as(stepArr(i)));
        }
        columns.addAll(FunnelExclusions.buildExclusionColumns(scope.exclusions(), steps));

        List<Expression> where = scope.eventConditions();
        if (strict) {
            where.add(strictPopulation(scope));
        }
        return SelectBuilder.select(columns)
            .from("events")
            .where(where.toArray(new Expression[0]))
            .groupBy(col("person_id"))
            .build();
    }

    /**
     * {@code <resolved person> NOT IN (SELECT DISTINCT <resolved person> FROM events
     * WHERE <range> AND event_name NOT IN {all_event_names:Array(String)})}
     */
    static Expression strictPopulation(FunnelScope scope) {
        List<Expression> where = scope.rangeConditions();
        where.add(notIn(col("event_name"), FunnelSteps.allEventNamesParam(scope.steps(), scope.exclusions())));
        SelectNode outsiders = SelectBuilder.select(ResolvedPerson.expr())
            .distinct()
            .from("events")
            .where(where.toArray(new Expression[0]))
            .build();
        return notInSubquery(ResolvedPerson.expr(), outsiders);
    }

    private static SelectNode perUser(FunnelScope scope, boolean strict) {
        int n = scope.steps().size();
        Expression win = FunnelSteps.windowMs(scope.windowSeconds());
        Expression maxStep = col("max_step");

        List<Expression> columns = new ArrayList<>();
        columns.add(col("person_id"));
        columns.add(maxStep);
        if (scope.hasBreakdown()) {
            columns.add(col("breakdown_value"));
        }
        columns.add(ifFn(gt(maxStep, literal(0)), anchor(n, win, strict), toInt64(literal(0))).as(stepMs(0)));
        for (int i = 1; i < n; i++) {
            columns.add(ifFn(gt(maxStep, literal(i)), nextStepTimestamp(i, win), toInt64(literal(0))).as(stepMs(i)));
        }
        columns.add(FunnelCtes.stepMsArray(n));
        columns.addAll(FunnelCtes.columns(FunnelExclusions.columnNames(scope.exclusions().size())));

        return SelectBuilder.select(columns)
            .from(FunnelCtes.RAW)
            .build();
    }

    /**
     * Earliest step-{@code i} event between the previous step and the end of
     * the anchor's window. A missing previous step (0) breaks the chain, so
     * every later step stays 0 instead of matching events before the anchor:
     * <pre>
     * arrayMin(arrayFilter(t -> step_&lt;i-1&gt;_ms > 0 AND t >= step_&lt;i-1&gt;_ms
     *     [AND t >= step_0_ms] AND t &lt;= step_0_ms + win, t&lt;i&gt;_arr))
     * </pre>
     */
    private static Expression nextStepTimestamp(int i, Expression win) {
        Expression t = col("t");
        Expression prev = col(stepMs(i - 1));
        Expression anchor = col(stepMs(0));
        Expression afterAnchor = i > 1 ? gte(t, anchor) : null;
        return arrayMin(arrayFilter(
            lambda("t", and(gt(prev, literal(0)), gte(t, prev), afterAnchor, lte(t, add(anchor, win)))),
            col(stepArr(i))));
    }

    /**
     * Step-0 occurrences with an occurrence of the last reached step within
     * one window after them; the earliest of those, or the latest in strict mode.
     * <pre>
     * arrayMin(arrayFilter(a -> arrayExists(l -> a &lt;= l AND l &lt;= a + win,
     *     arrayElement([t0_arr, t1_arr, ...], max_step)), t0_arr))
     * </pre>
     */
    private static Expression anchor(int numSteps, Expression win, boolean strict) {
        List<Expression> arrays = new ArrayList<>();
        for (int i = 0; i < numSteps; i++) {
            arrays.add(col(stepArr(i)));
        }
        Expression a = col("a");
        Expression l = col("l");
        Expression lastReached = arrayElement(array(arrays), col("max_step"));
        Expression candidates = arrayFilter(
            lambda("a", arrayExists(lambda("l", and(lte(a, l), lte(l, add(a, win)))), lastReached)),
            col(stepArr(0)));
        return strict ? arrayMax(candidates) : arrayMin(candidates);
    }
}
