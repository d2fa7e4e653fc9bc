package com.funnelduck.funnel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Counts and rates for one funnel step, optionally within a breakdown group.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FunnelStepResult {

    private final int step;
    private final String label;
    private final String eventName;
    private final long count;
    private final double conversionRate;
    private final long dropOff;
    private final double dropOffRate;
    private final Long avgTimeToConvertSeconds;
    private final String breakdownValue;

    public FunnelStepResult(int step, String label, String eventName, long count, double conversionRate,
                            long dropOff, double dropOffRate, Long avgTimeToConvertSeconds,
                            String breakdownValue) {
        this.step = step;
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.eventName = Objects.requireNonNull(eventName, "eventName must not be null");
        this.count = count;
        this.conversionRate = conversionRate;
        this.dropOff = dropOff;
        this.dropOffRate = dropOffRate;
        this.avgTimeToConvertSeconds = avgTimeToConvertSeconds;
        this.breakdownValue = breakdownValue;
    }

    public FunnelStepResult withBreakdownValue(String value) {
        return new FunnelStepResult(step, label, eventName, count, conversionRate, dropOff, dropOffRate,
            avgTimeToConvertSeconds, value);
    }

    /**
     * 1-based step number.
     */
    @JsonProperty("step")
    public int step() {
        return step;
    }

    @JsonProperty("label")
    public String label() {
        return label;
    }

    @JsonProperty("event_name")
    public String eventName() {
        return eventName;
    }

    @JsonProperty("count")
    public long count() {
        return count;
    }

    /**
     * Ratio in [0, 1], rounded to 4 decimals.
     */
    @JsonProperty("conversion_rate")
    public double conversionRate() {
        return conversionRate;
    }

    @JsonProperty("drop_off")
    public long dropOff() {
        return dropOff;
    }

    @JsonProperty("drop_off_rate")
    public double dropOffRate() {
        return dropOffRate;
    }

    /**
     * Mean seconds from the previous step, or null for the first step and
     * when nobody converted.
     */
    @JsonProperty("avg_time_to_convert_seconds")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Long avgTimeToConvertSeconds() {
        return avgTimeToConvertSeconds;
    }

    @JsonProperty("breakdown_value")
    public String breakdownValue() {
        return breakdownValue;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunnelStepResult)) return false;
        FunnelStepResult that = (FunnelStepResult) obj;
        return step == that.step && count == that.count
            && Double.compare(conversionRate, that.conversionRate) == 0
            && dropOff == that.dropOff && Double.compare(dropOffRate, that.dropOffRate) == 0
            && label.equals(that.label) && eventName.equals(that.eventName)
            && Objects.equals(avgTimeToConvertSeconds, that.avgTimeToConvertSeconds)
            && Objects.equals(breakdownValue, that.breakdownValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, label, eventName, count, conversionRate, dropOff, dropOffRate,
            avgTimeToConvertSeconds, breakdownValue);
    }

    @Override
    public String toString() {
        return String.format("FunnelStepResult(step=%d, %s, count=%d, rate=%.4f%s)",
            step, eventName, count, conversionRate, breakdownValue == null ? "" : ", " + breakdownValue);
    }
}
