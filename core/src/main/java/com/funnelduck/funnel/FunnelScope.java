package com.funnelduck.funnel;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.cohort.CohortLookup;
import com.funnelduck.expression.Expression;
import com.funnelduck.helpers.CohortFilters;
import com.funnelduck.helpers.TimeHelpers;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One funnel query to build: the request, its resolved window, and the
 * optional breakdown expression or extra population filter that vary between
 * the queries of a single request.
 */
public final class FunnelScope {

    private final FunnelRequest request;
    private final long windowSeconds;
    private final CohortLookup lookup;
    private final Expression breakdownExpr;
    private final Expression populationFilter;

    public FunnelScope(FunnelRequest request, long windowSeconds, CohortLookup lookup,
                       Expression breakdownExpr, Expression populationFilter) {
        this.request = Objects.requireNonNull(request, "request must not be null");
        this.windowSeconds = windowSeconds;
        this.lookup = lookup != null ? lookup : CohortLookup.materializedOnly();
        this.breakdownExpr = breakdownExpr;
        this.populationFilter = populationFilter;
    }

    public static FunnelScope of(FunnelRequest request, long windowSeconds, CohortLookup lookup) {
        return new FunnelScope(request, windowSeconds, lookup, null, null);
    }

    public FunnelScope withBreakdown(Expression expr) {
        return new FunnelScope(request, windowSeconds, lookup, expr, populationFilter);
    }

    public FunnelScope withPopulationFilter(Expression filter) {
        return new FunnelScope(request, windowSeconds, lookup, breakdownExpr, filter);
    }

    public FunnelRequest request() {
        return request;
    }

    public List<FunnelStep> steps() {
        return request.steps();
    }

    public List<FunnelExclusion> exclusions() {
        return request.exclusions();
    }

    public long windowSeconds() {
        return windowSeconds;
    }

    public CohortLookup lookup() {
        return lookup;
    }

    public boolean hasBreakdown() {
        return breakdownExpr != null;
    }

    /**
     * @return the per-event breakdown expression, or null
     */
    public Expression breakdownExpr() {
        return breakdownExpr;
    }

    // ==================== Shared conditions ====================

    public Expression projectCondition() {
        return eq(col("project_id"), named("project_id", "UUID", request.projectId()));
    }

    public Expression fromBound() {
        return TimeHelpers.tsNamedParam("from", TimeHelpers.toChTs(request.dateFrom()), request.timezone());
    }

    public Expression toBound() {
        return TimeHelpers.tsNamedParam("to", TimeHelpers.toChTs(request.dateTo(), true), request.timezone());
    }

    /**
     * Project and date range only.
     */
    public List<Expression> rangeConditions() {
        List<Expression> conditions = new ArrayList<>();
        conditions.add(projectCondition());
        conditions.add(gte(col("timestamp"), fromBound()));
        conditions.add(lte(col("timestamp"), toBound()));
        return conditions;
    }

    /**
     * Range conditions plus cohort filters, sampling and the population
     * filter; the WHERE of every per-user events scan.
     */
    public List<Expression> eventConditions() {
        List<Expression> conditions = rangeConditions();
        CohortFilters.cohortFilter(request.cohortFilters(), request.projectId(), lookup,
            request.dateTo(), request.dateFrom()).ifPresent(conditions::add);
        FunnelSteps.samplingFilter(request.samplingFactor()).ifPresent(conditions::add);
        if (populationFilter != null) {
            conditions.add(populationFilter);
        }
        return conditions;
    }
}
