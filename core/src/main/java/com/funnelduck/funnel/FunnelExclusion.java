package com.funnelduck.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.funnelduck.helpers.PropertyFilter;
import java.util.List;
import java.util.Objects;

/**
 * Drops users who performed {@code eventName} between two funnel steps.
 */
public final class FunnelExclusion {

    private final String eventName;
    private final int fromStep;
    private final int toStep;
    private final List<PropertyFilter> filters;

    @JsonCreator
    public FunnelExclusion(@JsonProperty("event_name") String eventName,
                           @JsonProperty("funnel_from_step") int fromStep,
                           @JsonProperty("funnel_to_step") int toStep,
                           @JsonProperty("filters") List<PropertyFilter> filters) {
        this.eventName = Objects.requireNonNull(eventName, "eventName must not be null");
        this.fromStep = fromStep;
        this.toStep = toStep;
        this.filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public FunnelExclusion(String eventName, int fromStep, int toStep) {
        this(eventName, fromStep, toStep, null);
    }

    public String eventName() {
        return eventName;
    }

    public int fromStep() {
        return fromStep;
    }

    public int toStep() {
        return toStep;
    }

    public List<PropertyFilter> filters() {
        return filters;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunnelExclusion)) return false;
        FunnelExclusion that = (FunnelExclusion) obj;
        return fromStep == that.fromStep && toStep == that.toStep
            && eventName.equals(that.eventName) && filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventName, fromStep, toStep, filters);
    }

    @Override
    public String toString() {
        return "FunnelExclusion(" + eventName + ", " + fromStep + " -> " + toStep + ")";
    }
}
