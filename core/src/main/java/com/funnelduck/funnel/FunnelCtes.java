package com.funnelduck.funnel;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.expression.Expression;
import com.funnelduck.query.CommonTableExpression;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The per-user CTE chain of one funnel query.
 *
 * <p>Whatever the order type, the chain ends in {@value #PER_USER} with one
 * row per person and these columns:
 * <ul>
 *   <li>{@code person_id}, {@code max_step} (number of steps reached)</li>
 *   <li>{@code step_<i>_ms} and {@code step_ms_arr}: millisecond timestamp of
 *       each reached step, 0 when not reached</li>
 *   <li>{@code breakdown_value} when broken down by property</li>
 *   <li>the exclusion arrays, followed by an {@value FunnelExclusions#EXCLUDED_USERS_CTE}
 *       CTE when there are exclusions</li>
 * </ul>
 */
public final class FunnelCtes {

    public static final String RAW = "funnel_raw";
    public static final String STEP_TIMES = "step_times";
    public static final String ANCHOR = "anchor_per_user";
    public static final String PER_USER = "funnel_per_user";

    private final List<CommonTableExpression> ctes;

    FunnelCtes(List<CommonTableExpression> ctes) {
        this.ctes = List.copyOf(ctes);
    }

    /**
     * Builds the chain for the scope's order type.
     */
    public static FunnelCtes build(FunnelScope scope) {
        Objects.requireNonNull(scope, "scope must not be null");
        List<CommonTableExpression> ctes = new ArrayList<>();
        Optional<Expression> exclusionAnchor;
        switch (scope.request().orderType()) {
            case UNORDERED -> {
                ctes.addAll(UnorderedFunnelCtes.build(scope));
                exclusionAnchor = Optional.of(col("step_0_ms"));
            }
            case STRICT -> {
                ctes.addAll(OrderedFunnelCtes.build(scope, true));
                exclusionAnchor = Optional.empty();
            }
            default -> {
                ctes.addAll(OrderedFunnelCtes.build(scope, false));
                exclusionAnchor = Optional.empty();
            }
        }
        if (!scope.exclusions().isEmpty()) {
            ctes.add(new CommonTableExpression(FunnelExclusions.EXCLUDED_USERS_CTE,
                FunnelExclusions.excludedUsersCte(scope.exclusions(), scope.windowSeconds(), exclusionAnchor)));
        }
        return new FunnelCtes(ctes);
    }

    public List<CommonTableExpression> ctes() {
        return ctes;
    }

    // ==================== Column helpers ====================

    static String stepMs(int i) {
        return "step_" + i + "_ms";
    }

    static String stepArr(int i) {
        return "t" + i + "_arr";
    }

    /**
     * {@code [step_0_ms, step_1_ms, ...] AS step_ms_arr}
     */
    static Expression stepMsArray(int numSteps) {
        List<Expression> items = new ArrayList<>();
        for (int i = 0; i < numSteps; i++) {
            items.add(col(stepMs(i)));
        }
        return array(items).as("step_ms_arr");
    }

    static List<Expression> columns(List<String> names) {
        List<Expression> cols = new ArrayList<>();
        for (String name : names) {
            cols.add(col(name));
        }
        return cols;
    }
}
