package com.funnelduck.funnel;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.exception.BadRequestException;
import com.funnelduck.expression.Expression;
import com.funnelduck.helpers.PropertyFilters;
import com.funnelduck.query.SelectBuilder;
import com.funnelduck.query.SelectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Exclusion steps: users who performed an excluded event between two funnel
 * steps are removed from every step count.
 *
 * <p>Per exclusion {@code i} the per-user CTE collects three millisecond
 * arrays: {@code excl_<i>_from_arr} and {@code excl_<i>_to_arr} (occurrences of
 * the bounding steps) and {@code excl_<i>_arr} (occurrences of the excluded
 * event). A user is excluded when some from/to pair within the window has an
 * excluded event strictly between them and no such pair is clean.
 */
public final class FunnelExclusions {

    public static final String EXCLUDED_USERS_CTE = "excluded_users";

    private FunnelExclusions() {
    }

    /**
     * @throws BadRequestException if a step range is not {@code 0 <= from < to < numSteps},
     *         or the excluded event is also a step event and has no filters
     */
    public static void validate(List<FunnelExclusion> exclusions, List<FunnelStep> steps) {
        List<String> stepEvents = FunnelSteps.allEventNames(steps);
        for (int i = 0; i < exclusions.size(); i++) {
            FunnelExclusion excl = exclusions.get(i);
            if (excl.fromStep() < 0 || excl.fromStep() >= excl.toStep() || excl.toStep() >= steps.size()) {
                throw new BadRequestException("Exclusion " + i + " (" + excl.eventName()
                    + "): funnel_from_step must be less than funnel_to_step and both must lie in [0, "
                    + (steps.size() - 1) + "], got " + excl.fromStep() + " -> " + excl.toStep());
            }
            if (stepEvents.contains(excl.eventName()) && excl.filters().isEmpty()) {
                throw new BadRequestException("Exclusion " + i + " uses the step event '" + excl.eventName()
                    + "' and must have filters to tell the two apart");
            }
        }
    }

    /**
     * The three array columns per exclusion, aliased.
     */
    public static List<Expression> buildExclusionColumns(List<FunnelExclusion> exclusions, List<FunnelStep> steps) {
        List<Expression> columns = new ArrayList<>();
        for (int i = 0; i < exclusions.size(); i++) {
            FunnelExclusion excl = exclusions.get(i);
            String base = "excl_" + i;
            Expression fromCond = FunnelSteps.stepCondition(steps.get(excl.fromStep()), base + "_from_step");
            Expression toCond = FunnelSteps.stepCondition(steps.get(excl.toStep()), base + "_to_step");
            Expression exclCond = and(eq(col("event_name"), named(base + "_name", "String", excl.eventName())),
                PropertyFilters.propertyFilters(excl.filters()).orElse(null));
            columns.add(FunnelSteps.timestampsWhere(fromCond).as(base + "_from_arr"));
            columns.add(FunnelSteps.timestampsWhere(toCond).as(base + "_to_arr"));
            columns.add(FunnelSteps.timestampsWhere(exclCond).as(base + "_arr"));
        }
        return columns;
    }

    /**
     * Column names produced by {@link #buildExclusionColumns}, for CTEs that
     * pass the arrays through.
     */
    public static List<String> columnNames(int exclusionCount) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < exclusionCount; i++) {
            names.add("excl_" + i + "_from_arr");
            names.add("excl_" + i + "_to_arr");
            names.add("excl_" + i + "_arr");
        }
        return names;
    }

    /**
     * ORs {@code tainted(i) AND NOT clean(i)} over all exclusions.
     *
     * @param anchorMs when present, from-step occurrences must lie in
     *        {@code [anchor, anchor + window]}
     * @return the condition, or empty without exclusions
     */
    public static Optional<Expression> buildExcludedUsersWhereExpr(List<FunnelExclusion> exclusions,
                                                                   long windowSeconds,
                                                                   Optional<Expression> anchorMs) {
        Expression win = FunnelSteps.windowMs(windowSeconds);
        List<Expression> perExclusion = new ArrayList<>();
        for (int i = 0; i < exclusions.size(); i++) {
            String base = "excl_" + i;
            Expression tainted = eq(pairExists(base, win, anchorMs, true), literal(1));
            Expression clean = eq(pairExists(base, win, anchorMs, false), literal(0));
            perExclusion.add(and(tainted, clean));
        }
        return anyOf(perExclusion);
    }

    /**
     * <pre>
     * arrayExists(f -> [guard AND] arrayExists(t -> t > f AND t &lt;= f + win
     *     AND [NOT] arrayExists(e -> e > f AND e &lt; t, excl_i_arr), excl_i_to_arr) = 1, excl_i_from_arr)
     * </pre>
     */
    private static Expression pairExists(String base, Expression win, Optional<Expression> anchorMs,
                                         boolean withExcludedEvent) {
        Expression f = col("f");
        Expression t = col("t");
        Expression e = col("e");
        Expression between = arrayExists(lambda("e", and(gt(e, f), lt(e, t))), col(base + "_arr"));
        Expression pair = arrayExists(
            lambda("t", and(gt(t, f), lte(t, add(f, win)), withExcludedEvent ? between : not(between))),
            col(base + "_to_arr"));
        Expression body = eq(pair, literal(1));
        if (anchorMs.isPresent()) {
            Expression a = anchorMs.get();
            body = and(gte(f, a), lte(f, add(a, win)), body);
        }
        return arrayExists(lambda("f", body), col(base + "_from_arr"));
    }

    /**
     * {@code SELECT person_id FROM funnel_per_user WHERE <excluded>}
     */
    public static SelectNode excludedUsersCte(List<FunnelExclusion> exclusions, long windowSeconds,
                                              Optional<Expression> anchorMs) {
        return SelectBuilder.select(col("person_id"))
            .from(FunnelCtes.PER_USER)
            .where(buildExcludedUsersWhereExpr(exclusions, windowSeconds, anchorMs))
            .build();
    }

    /**
     * {@code person_id NOT IN (SELECT person_id FROM excluded_users)}, or empty
     * without exclusions.
     */
    public static Optional<Expression> notExcluded(List<FunnelExclusion> exclusions) {
        if (exclusions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(notInSubquery(col("person_id"),
            SelectBuilder.select(col("person_id")).from(EXCLUDED_USERS_CTE).build()));
    }
}
