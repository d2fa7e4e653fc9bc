package com.funnelduck.funnel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.funnelduck.generator.CompiledQuery;
import java.util.List;
import java.util.Objects;

/**
 * Result of a funnel request.
 *
 * <p>Without a breakdown {@link #steps()} holds one entry per step and
 * {@link #aggregateSteps()} is null. With a breakdown it holds the steps of
 * every group in display order, and {@link #aggregateSteps()} the totals.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FunnelResult {

    private final boolean breakdown;
    private final String breakdownProperty;
    private final List<FunnelStepResult> steps;
    private final List<FunnelStepResult> aggregateSteps;
    private final boolean breakdownTruncated;
    private final Double samplingFactor;
    private final List<CompiledQuery> compiledQueries;

    public FunnelResult(boolean breakdown, String breakdownProperty, List<FunnelStepResult> steps,
                        List<FunnelStepResult> aggregateSteps, boolean breakdownTruncated,
                        Double samplingFactor, List<CompiledQuery> compiledQueries) {
        this.breakdown = breakdown;
        this.breakdownProperty = breakdownProperty;
        this.steps = List.copyOf(Objects.requireNonNull(steps, "steps must not be null"));
        this.aggregateSteps = aggregateSteps == null ? null : List.copyOf(aggregateSteps);
        this.breakdownTruncated = breakdownTruncated;
        this.samplingFactor = samplingFactor;
        this.compiledQueries = compiledQueries == null ? List.of() : List.copyOf(compiledQueries);
    }

    @JsonProperty("breakdown")
    public boolean breakdown() {
        return breakdown;
    }

    @JsonProperty("breakdown_property")
    public String breakdownProperty() {
        return breakdownProperty;
    }

    @JsonProperty("steps")
    public List<FunnelStepResult> steps() {
        return steps;
    }

    @JsonProperty("aggregate_steps")
    public List<FunnelStepResult> aggregateSteps() {
        return aggregateSteps;
    }

    @JsonProperty("breakdown_truncated")
    public boolean breakdownTruncated() {
        return breakdownTruncated;
    }

    @JsonProperty("sampling_factor")
    public Double samplingFactor() {
        return samplingFactor;
    }

    /**
     * Every statement sent to the store for this result, in execution order.
     */
    @JsonIgnore
    public List<CompiledQuery> compiledQueries() {
        return compiledQueries;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunnelResult)) return false;
        FunnelResult that = (FunnelResult) obj;
        return breakdown == that.breakdown && breakdownTruncated == that.breakdownTruncated
            && Objects.equals(breakdownProperty, that.breakdownProperty)
            && steps.equals(that.steps) && Objects.equals(aggregateSteps, that.aggregateSteps)
            && Objects.equals(samplingFactor, that.samplingFactor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(breakdown, breakdownProperty, steps, aggregateSteps, breakdownTruncated, samplingFactor);
    }

    @Override
    public String toString() {
        return "FunnelResult(breakdown=" + breakdown + ", steps=" + steps.size()
            + (breakdownTruncated ? ", truncated" : "") + ")";
    }
}
