package com.funnelduck.funnel;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.exception.BadRequestException;
import com.funnelduck.expression.Expression;
import com.funnelduck.helpers.PropertyFilters;
import com.funnelduck.helpers.ResolvedPerson;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Step conditions and the expressions shared by every funnel query shape.
 */
public final class FunnelSteps {

    public static final String WINDOW_PARAM = "window";
    public static final String ALL_EVENT_NAMES_PARAM = "all_event_names";

    private FunnelSteps() {
    }

    /**
     * Condition matching the events of step {@code idx}:
     * <pre>
     *   event_name = {step_0_name:String}
     *   event_name IN {step_0_names:Array(String)} AND &lt;filters&gt;
     * </pre>
     */
    public static Expression buildStepCondition(FunnelStep step, int idx) {
        return stepCondition(step, "step_" + idx);
    }

    /**
     * Same as {@link #buildStepCondition} with a caller-chosen parameter base,
     * so the event names are bound as {@code <base>_name} or {@code <base>_names}.
     */
    static Expression stepCondition(FunnelStep step, String paramBase) {
        Expression eventMatch = step.eventNames().size() == 1
            ? eq(col("event_name"), named(paramBase + "_name", "String", step.eventNames().get(0)))
            : in(col("event_name"), named(paramBase + "_names", "Array(String)", step.eventNames()));
        return and(eventMatch, PropertyFilters.propertyFilters(step.filters()).orElse(null));
    }

    /**
     * Distinct event names over all steps, in step order.
     */
    public static List<String> allEventNames(List<FunnelStep> steps) {
        return allEventNames(steps, List.of());
    }

    /**
     * Distinct event names over all steps followed by the excluded events:
     * the event universe of the funnel.
     */
    public static List<String> allEventNames(List<FunnelStep> steps, List<FunnelExclusion> exclusions) {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        for (FunnelStep step : steps) {
            names.addAll(step.eventNames());
        }
        for (FunnelExclusion excl : exclusions) {
            names.add(excl.eventName());
        }
        return new ArrayList<>(names);
    }

    /**
     * {@code {all_event_names:Array(String)}}
     */
    public static Expression allEventNamesParam(List<FunnelStep> steps, List<FunnelExclusion> exclusions) {
        return named(ALL_EVENT_NAMES_PARAM, "Array(String)", allEventNames(steps, exclusions));
    }

    /**
     * Unordered funnels match each event to at most one step, so no event name
     * may appear in two steps.
     *
     * @throws BadRequestException naming the first shared event and both steps
     */
    public static void validateUnorderedSteps(List<FunnelStep> steps) {
        Map<String, Integer> owner = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            for (String name : new LinkedHashSet<>(steps.get(i).eventNames())) {
                Integer previous = owner.putIfAbsent(name, i);
                if (previous != null) {
                    throw new BadRequestException("Unordered funnel steps " + previous + " and " + i
                        + " share the event '" + name + "'; each event may belong to one step only");
                }
            }
        }
    }

    // ==================== Window ====================

    /**
     * {@code {window:UInt64}}
     */
    public static Expression windowParam(long windowSeconds) {
        return named(WINDOW_PARAM, "UInt64", windowSeconds);
    }

    /**
     * The window in milliseconds as a signed value, for arithmetic against
     * millisecond timestamps: {@code toInt64({window:UInt64}) * 1000}.
     */
    public static Expression windowMs(long windowSeconds) {
        return mul(toInt64(windowParam(windowSeconds)), literal(1000));
    }

    /**
     * <pre>
     * windowFunnel({window:UInt64} * 1000[, 'strict_order'])(
     *     toUInt64(toUnixTimestamp64Milli(timestamp)), cond_0, cond_1, ...)
     * </pre>
     */
    public static Expression windowFunnel(List<FunnelStep> steps, long windowSeconds, boolean strict) {
        List<Expression> parameters = new ArrayList<>();
        parameters.add(mul(windowParam(windowSeconds), literal(1000)));
        if (strict) {
            parameters.add(literal("strict_order"));
        }
        List<Expression> args = new ArrayList<>();
        args.add(toUInt64(toUnixTimestamp64Milli(col("timestamp"))));
        for (int i = 0; i < steps.size(); i++) {
            args.add(buildStepCondition(steps.get(i), i));
        }
        return parametric("windowFunnel", parameters, args);
    }

    /**
     * {@code groupArrayIf(toUnixTimestamp64Milli(timestamp), cond)}
     */
    static Expression timestampsWhere(Expression condition) {
        return groupArrayIf(toUnixTimestamp64Milli(col("timestamp")), condition);
    }

    // ==================== Sampling ====================

    /**
     * {@code sipHash64(toString(<resolved person>)) % 100 < {sample_pct:UInt8}}
     * for factors strictly between 0 and 1; empty otherwise. The percentage is
     * at least 1 so a tiny factor still samples someone.
     */
    public static Optional<Expression> samplingFilter(Double factor) {
        if (factor == null || factor.isNaN() || factor <= 0.0 || factor >= 1.0) {
            return Optional.empty();
        }
        long pct = Math.max(1L, Math.round(factor * 100));
        return Optional.of(lt(mod(sipHash64(toStringFn(ResolvedPerson.expr())), literal(100)),
            named("sample_pct", "UInt8", pct)));
    }
}
