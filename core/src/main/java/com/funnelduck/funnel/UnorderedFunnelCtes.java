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
 * CTEs for unordered funnels.
 *
 * <p>Any occurrence of any step can be the anchor. The coverage of an anchor
 * {@code a} is the number of steps with an occurrence in {@code [a, a + window]};
 * {@code max_step} is the best coverage over all anchors. The chosen anchor is
 * the latest one with full coverage, searching the step arrays from the last
 * step down to step 0; without full coverage it is the earliest step-0 event.
 * People without a step-0 event in range are not part of the funnel.
 *
 * <pre>
 * step_times:      per-step timestamp arrays over the funnel's events
 * anchor_per_user: max_step and anchor_ms, for people with a step-0 event
 * funnel_per_user: step_i_ms = earliest step-i event in [anchor, anchor + window]
 * </pre>
 */
final class UnorderedFunnelCtes {

    private UnorderedFunnelCtes() {
    }

    static List<CommonTableExpression> build(FunnelScope scope) {
        List<CommonTableExpression> ctes = new ArrayList<>();
        ctes.add(new CommonTableExpression(FunnelCtes.STEP_TIMES, stepTimes(scope)));
        ctes.add(new CommonTableExpression(FunnelCtes.ANCHOR, anchorPerUser(scope)));
        ctes.add(new CommonTableExpression(FunnelCtes.PER_USER, perUser(scope)));
        return ctes;
    }

    private static SelectNode stepTimes(FunnelScope scope) {
        List<FunnelStep> steps = scope.steps();
        List<Expression> columns = new ArrayList<>();
        columns.add(ResolvedPerson.expr().as("person_id"));
        for (int i = 0; i < steps.size(); i++) {
            columns.add(FunnelSteps.timestampsWhere(FunnelSteps.buildStepCondition(steps.get(i), i)).as(stepArr(i)));
        }
        if (scope.hasBreakdown()) {
            columns.add(groupArrayIf(scope.breakdownExpr(), FunnelSteps.buildStepCondition(steps.get(0), 0))
                .as("t0_bv_arr"));
        }
        columns.addAll(FunnelExclusions.buildExclusionColumns(scope.exclusions(), steps));

        List<Expression> where = scope.eventConditions();
        where.add(in(col("event_name"), FunnelSteps.allEventNamesParam(steps, scope.exclusions())));
        return SelectBuilder.select(columns)
            .from("events")
            .where(where.toArray(new Expression[0]))
            .groupBy(col("person_id"))
            .build();
    }

    private static SelectNode anchorPerUser(FunnelScope scope) {
        int n = scope.steps().size();
        Expression win = FunnelSteps.windowMs(scope.windowSeconds());

        List<Expression> columns = new ArrayList<>();
        columns.add(col("person_id"));
        columns.add(toInt64(maxCoverage(n, win)).as("max_step"));
        columns.add(toInt64(anchor(n, win)).as("anchor_ms"));
        for (int i = 0; i < n; i++) {
            columns.add(col(stepArr(i)));
        }
        if (scope.hasBreakdown()) {
            columns.add(col("t0_bv_arr"));
        }
        columns.addAll(FunnelCtes.columns(FunnelExclusions.columnNames(scope.exclusions().size())));
        return SelectBuilder.select(columns)
            .from(FunnelCtes.STEP_TIMES)
            .where(gt(length(col(stepArr(0))), literal(0)))
            .build();
    }

    private static SelectNode perUser(FunnelScope scope) {
        int n = scope.steps().size();
        Expression win = FunnelSteps.windowMs(scope.windowSeconds());
        Expression anchor = col("anchor_ms");

        List<Expression> columns = new ArrayList<>();
        columns.add(col("person_id"));
        columns.add(col("max_step"));
        if (scope.hasBreakdown()) {
            columns.add(arrayElement(col("t0_bv_arr"), indexOf(col(stepArr(0)), anchor)).as("breakdown_value"));
        }
        columns.add(anchor.as(stepMs(0)));
        for (int i = 1; i < n; i++) {
            Expression t = col("t");
            Expression inWindow = arrayFilter(lambda("t", and(gte(t, anchor), lte(t, add(anchor, win)))),
                col(stepArr(i)));
            columns.add(ifFn(gt(length(inWindow), literal(0)), arrayMin(inWindow), toInt64(literal(0)))
                .as(stepMs(i)));
        }
        columns.add(FunnelCtes.stepMsArray(n));
        columns.addAll(FunnelCtes.columns(FunnelExclusions.columnNames(scope.exclusions().size())));
        return SelectBuilder.select(columns)
            .from(FunnelCtes.ANCHOR)
            .build();
    }

    // ==================== Coverage ====================

    /**
     * Number of steps with an occurrence in {@code [a, a + win]}:
     * {@code if(arrayExists(t_j -> t_j >= a AND t_j <= a + win, t<j>_arr), 1, 0) + ...}
     */
    static Expression coverage(String anchorVar, int numSteps, Expression win) {
        Expression a = col(anchorVar);
        Expression total = null;
        for (int j = 0; j < numSteps; j++) {
            String v = "t" + j;
            Expression tj = col(v);
            Expression hit = ifFn(
                arrayExists(lambda(v, and(gte(tj, a), lte(tj, add(a, win)))), col(stepArr(j))),
                literal(1), literal(0));
            total = total == null ? hit : add(total, hit);
        }
        return total;
    }

    /**
     * {@code greatest(arrayMax(a0 -> toInt64(coverage(a0)), t0_arr), ...)}
     */
    private static Expression maxCoverage(int numSteps, Expression win) {
        List<Expression> perStep = new ArrayList<>();
        for (int i = 0; i < numSteps; i++) {
            String a = "a" + i;
            perStep.add(arrayMax(lambda(a, toInt64(coverage(a, numSteps, win))), col(stepArr(i))));
        }
        return greatest(perStep);
    }

    /**
     * Latest fully covering anchor, checking the last step's array first:
     * <pre>
     * if(toInt64(arrayMax(arrayFilter(a -> coverage(a) = N, t&lt;N-1&gt;_arr))) != 0, that,
     *   if(... t&lt;N-2&gt;_arr ...,
     *     ... if(length(t0_arr) > 0, arrayMin(t0_arr), toInt64(0))))
     * </pre>
     */
    private static Expression anchor(int numSteps, Expression win) {
        Expression result = ifFn(gt(length(col(stepArr(0))), literal(0)),
            arrayMin(col(stepArr(0))), toInt64(literal(0)));
        for (int i = 0; i < numSteps; i++) {
            String a = "a" + i;
            Expression full = toInt64(arrayMax(arrayFilter(
                lambda(a, eq(coverage(a, numSteps, win), literal(numSteps))), col(stepArr(i)))));
            result = ifFn(neq(full, literal(0)), full, result);
        }
        return result;
    }
}
