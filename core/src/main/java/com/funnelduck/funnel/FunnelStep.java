package com.funnelduck.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.funnelduck.exception.BadRequestException;
import com.funnelduck.helpers.PropertyFilter;
import java.util.List;
import java.util.Objects;

/**
 * One funnel step: one or more event names (OR) plus property filters (AND).
 */
public final class FunnelStep {

    private final String eventName;
    private final List<String> eventNames;
    private final String label;
    private final List<PropertyFilter> filters;

    @JsonCreator
    public FunnelStep(@JsonProperty("event_name") String eventName,
                      @JsonProperty("event_names") List<String> eventNames,
                      @JsonProperty("label") String label,
                      @JsonProperty("filters") List<PropertyFilter> filters) {
        this.eventNames = eventNames == null || eventNames.isEmpty()
            ? (eventName == null ? List.of() : List.of(eventName))
            : List.copyOf(eventNames);
        if (this.eventNames.isEmpty()) {
            throw new BadRequestException("Funnel step needs event_name or event_names");
        }
        this.eventName = eventName != null ? eventName : this.eventNames.get(0);
        this.label = label == null ? "" : label;
        this.filters = filters == null ? List.of() : List.copyOf(filters);
    }

    // ==================== Factory Methods ====================

    public static FunnelStep of(String eventName) {
        return new FunnelStep(eventName, null, null, null);
    }

    public static FunnelStep of(String eventName, String label) {
        return new FunnelStep(eventName, null, label, null);
    }

    public static FunnelStep anyOf(List<String> eventNames, String label) {
        return new FunnelStep(null, eventNames, label, null);
    }

    public FunnelStep withFilters(List<PropertyFilter> newFilters) {
        return new FunnelStep(eventName, eventNames, label, newFilters);
    }

    /**
     * Display event name: the single name, or the first of several.
     */
    public String eventName() {
        return eventName;
    }

    /**
     * All event names matching this step (at least one).
     */
    public List<String> eventNames() {
        return eventNames;
    }

    public String label() {
        return label;
    }

    public List<PropertyFilter> filters() {
        return filters;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunnelStep)) return false;
        FunnelStep that = (FunnelStep) obj;
        return eventName.equals(that.eventName) && eventNames.equals(that.eventNames)
            && label.equals(that.label) && filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventName, eventNames, label, filters);
    }

    @Override
    public String toString() {
        return "FunnelStep(" + eventNames + (filters.isEmpty() ? "" : ", " + filters) + ")";
    }
}
