package com.funnelduck.cohort;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.funnelduck.exception.BadRequestException;
import com.funnelduck.helpers.PropertyFilter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Matches persons who performed an event a number of times within the last
 * {@code timeWindowDays} days before the upper bound of the query.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EventCondition implements CohortCondition {

    /**
     * Comparison applied to the event count.
     */
    public enum CountOperator {
        GTE(">="),
        LTE("<="),
        EQ("=");

        private final String symbol;

        CountOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static CountOperator fromWire(String value) {
            for (CountOperator op : values()) {
                if (op.wireName().equals(value)) {
                    return op;
                }
            }
            throw new BadRequestException("Unknown count operator: " + value);
        }
    }

    private final String eventName;
    private final CountOperator countOperator;
    private final long count;
    private final int timeWindowDays;
    private final List<PropertyFilter> eventFilters;

    @JsonCreator
    public EventCondition(@JsonProperty("event_name") String eventName,
                          @JsonProperty("count_operator") CountOperator countOperator,
                          @JsonProperty("count") long count,
                          @JsonProperty("time_window_days") int timeWindowDays,
                          @JsonProperty("event_filters") List<PropertyFilter> eventFilters) {
        this.eventName = Objects.requireNonNull(eventName, "eventName must not be null");
        this.countOperator = Objects.requireNonNull(countOperator, "countOperator must not be null");
        if (count < 0) {
            throw new BadRequestException("Event count must not be negative: " + count);
        }
        if (timeWindowDays <= 0) {
            throw new BadRequestException("time_window_days must be positive: " + timeWindowDays);
        }
        this.count = count;
        this.timeWindowDays = timeWindowDays;
        this.eventFilters = eventFilters == null ? List.of() : List.copyOf(eventFilters);
    }

    public EventCondition(String eventName, CountOperator countOperator, long count, int timeWindowDays) {
        this(eventName, countOperator, count, timeWindowDays, null);
    }

    public String eventName() {
        return eventName;
    }

    public CountOperator countOperator() {
        return countOperator;
    }

    public long count() {
        return count;
    }

    public int timeWindowDays() {
        return timeWindowDays;
    }

    public List<PropertyFilter> eventFilters() {
        return eventFilters;
    }

    /**
     * True for "performed exactly zero times", which needs a different query shape.
     */
    public boolean isZeroCount() {
        return countOperator == CountOperator.EQ && count == 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EventCondition)) return false;
        EventCondition that = (EventCondition) obj;
        return count == that.count && timeWindowDays == that.timeWindowDays
            && eventName.equals(that.eventName) && countOperator == that.countOperator
            && eventFilters.equals(that.eventFilters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventName, countOperator, count, timeWindowDays, eventFilters);
    }

    @Override
    public String toString() {
        return "event(" + eventName + " " + countOperator.symbol() + " " + count
            + " in " + timeWindowDays + "d)";
    }
}
