package com.funnelduck.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.funnelduck.cohort.CohortFilterInput;
import com.funnelduck.exception.BadRequestException;
import com.funnelduck.helpers.TimeHelpers;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A funnel query: steps, exclusions, window, ordering, breakdown and filters
 * over one project and date range.
 *
 * <p>The constructor checks the request shape (step count, breakdown kind,
 * sampling factor, timezone). Exclusion and unordered-step rules are checked
 * when the query is built; see {@link FunnelExclusions#validate} and
 * {@link FunnelSteps#validateUnorderedSteps}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FunnelRequest {

    public static final int MIN_STEPS = 2;
    public static final int MAX_STEPS = 10;

    private final String projectId;
    private final String dateFrom;
    private final String dateTo;
    private final String timezone;
    private final List<FunnelStep> steps;
    private final List<FunnelExclusion> exclusions;
    private final FunnelOrderType orderType;
    private final Integer conversionWindowDays;
    private final Integer conversionWindowValue;
    private final String conversionWindowUnit;
    private final String breakdownProperty;
    private final List<CohortFilterInput> breakdownCohorts;
    private final Integer breakdownLimit;
    private final Double samplingFactor;
    private final List<CohortFilterInput> cohortFilters;
    private final StepDisplayMode displayMode;

    @JsonCreator
    public FunnelRequest(@JsonProperty("project_id") String projectId,
                         @JsonProperty("date_from") String dateFrom,
                         @JsonProperty("date_to") String dateTo,
                         @JsonProperty("timezone") String timezone,
                         @JsonProperty("steps") List<FunnelStep> steps,
                         @JsonProperty("exclusions") List<FunnelExclusion> exclusions,
                         @JsonProperty("funnel_order_type") FunnelOrderType orderType,
                         @JsonProperty("conversion_window_days") Integer conversionWindowDays,
                         @JsonProperty("conversion_window_value") Integer conversionWindowValue,
                         @JsonProperty("conversion_window_unit") String conversionWindowUnit,
                         @JsonProperty("breakdown_property") String breakdownProperty,
                         @JsonProperty("breakdown_cohort_ids") List<CohortFilterInput> breakdownCohorts,
                         @JsonProperty("breakdown_limit") Integer breakdownLimit,
                         @JsonProperty("sampling_factor") Double samplingFactor,
                         @JsonProperty("cohort_filters") List<CohortFilterInput> cohortFilters,
                         @JsonProperty("conversion_rate_display") StepDisplayMode displayMode) {
        this.projectId = requireField(projectId, "project_id");
        this.dateFrom = requireField(dateFrom, "date_from");
        this.dateTo = requireField(dateTo, "date_to");
        this.timezone = timezone == null || timezone.isEmpty() ? "UTC" : TimeHelpers.validateTimezone(timezone);
        this.steps = steps == null ? List.of() : List.copyOf(steps);
        this.exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
        this.orderType = orderType == null ? FunnelOrderType.ORDERED : orderType;
        this.conversionWindowDays = conversionWindowDays;
        this.conversionWindowValue = conversionWindowValue;
        this.conversionWindowUnit = conversionWindowUnit;
        this.breakdownProperty = breakdownProperty == null || breakdownProperty.isEmpty() ? null : breakdownProperty;
        this.breakdownCohorts = breakdownCohorts == null ? List.of() : List.copyOf(breakdownCohorts);
        this.breakdownLimit = breakdownLimit;
        this.samplingFactor = samplingFactor;
        this.cohortFilters = cohortFilters == null ? List.of() : List.copyOf(cohortFilters);
        this.displayMode = displayMode == null ? StepDisplayMode.TOTAL : displayMode;

        if (this.steps.size() < MIN_STEPS || this.steps.size() > MAX_STEPS) {
            throw new BadRequestException("A funnel needs between " + MIN_STEPS + " and " + MAX_STEPS
                + " steps, got " + this.steps.size());
        }
        if (this.breakdownProperty != null && !this.breakdownCohorts.isEmpty()) {
            throw new BadRequestException("breakdown_property and breakdown_cohort_ids cannot be combined");
        }
        if (breakdownLimit != null && breakdownLimit <= 0) {
            throw new BadRequestException("breakdown_limit must be positive, got " + breakdownLimit);
        }
        if (samplingFactor != null && (samplingFactor.isNaN() || samplingFactor <= 0.0 || samplingFactor > 1.0)) {
            throw new BadRequestException("sampling_factor must be in (0, 1], got " + samplingFactor);
        }
    }

    private static String requireField(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new BadRequestException(name + " is required");
        }
        return value;
    }

    public static Builder builder(String projectId, String dateFrom, String dateTo) {
        return new Builder(projectId, dateFrom, dateTo);
    }

    // ==================== Accessors ====================

    public String projectId() {
        return projectId;
    }

    public String dateFrom() {
        return dateFrom;
    }

    public String dateTo() {
        return dateTo;
    }

    public String timezone() {
        return timezone;
    }

    public List<FunnelStep> steps() {
        return steps;
    }

    public int numSteps() {
        return steps.size();
    }

    public List<FunnelExclusion> exclusions() {
        return exclusions;
    }

    public FunnelOrderType orderType() {
        return orderType;
    }

    public Integer conversionWindowDays() {
        return conversionWindowDays;
    }

    public Integer conversionWindowValue() {
        return conversionWindowValue;
    }

    public String conversionWindowUnit() {
        return conversionWindowUnit;
    }

    /**
     * @return the breakdown property, or null when not broken down by property
     */
    public String breakdownProperty() {
        return breakdownProperty;
    }

    public List<CohortFilterInput> breakdownCohorts() {
        return breakdownCohorts;
    }

    public boolean hasPropertyBreakdown() {
        return breakdownProperty != null;
    }

    public boolean hasCohortBreakdown() {
        return !breakdownCohorts.isEmpty();
    }

    /**
     * @return the requested limit, or null to use the configured default
     */
    public Integer breakdownLimit() {
        return breakdownLimit;
    }

    /**
     * @return the sampling factor, or null when not sampled
     */
    public Double samplingFactor() {
        return samplingFactor;
    }

    public List<CohortFilterInput> cohortFilters() {
        return cohortFilters;
    }

    public StepDisplayMode displayMode() {
        return displayMode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunnelRequest)) return false;
        FunnelRequest that = (FunnelRequest) obj;
        return projectId.equals(that.projectId) && dateFrom.equals(that.dateFrom)
            && dateTo.equals(that.dateTo) && timezone.equals(that.timezone)
            && steps.equals(that.steps) && exclusions.equals(that.exclusions)
            && orderType == that.orderType
            && Objects.equals(conversionWindowDays, that.conversionWindowDays)
            && Objects.equals(conversionWindowValue, that.conversionWindowValue)
            && Objects.equals(conversionWindowUnit, that.conversionWindowUnit)
            && Objects.equals(breakdownProperty, that.breakdownProperty)
            && breakdownCohorts.equals(that.breakdownCohorts)
            && Objects.equals(breakdownLimit, that.breakdownLimit)
            && Objects.equals(samplingFactor, that.samplingFactor)
            && cohortFilters.equals(that.cohortFilters)
            && displayMode == that.displayMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, dateFrom, dateTo, timezone, steps, exclusions, orderType,
            conversionWindowDays, conversionWindowValue, conversionWindowUnit, breakdownProperty,
            breakdownCohorts, breakdownLimit, samplingFactor, cohortFilters, displayMode);
    }

    @Override
    public String toString() {
        return String.format("FunnelRequest(project=%s, %s..%s, %d steps, %s)",
            projectId, dateFrom, dateTo, steps.size(), orderType.wireName());
    }

    // ==================== Builder ====================

    /**
     * Fluent builder for requests created in code.
     */
    public static final class Builder {
        private final String projectId;
        private final String dateFrom;
        private final String dateTo;
        private String timezone;
        private final List<FunnelStep> steps = new ArrayList<>();
        private final List<FunnelExclusion> exclusions = new ArrayList<>();
        private FunnelOrderType orderType;
        private Integer windowDays;
        private Integer windowValue;
        private String windowUnit;
        private String breakdownProperty;
        private List<CohortFilterInput> breakdownCohorts;
        private Integer breakdownLimit;
        private Double samplingFactor;
        private List<CohortFilterInput> cohortFilters;
        private StepDisplayMode displayMode;

        private Builder(String projectId, String dateFrom, String dateTo) {
            this.projectId = projectId;
            this.dateFrom = dateFrom;
            this.dateTo = dateTo;
        }

        public Builder timezone(String tz) {
            this.timezone = tz;
            return this;
        }

        public Builder step(FunnelStep step) {
            steps.add(Objects.requireNonNull(step, "step must not be null"));
            return this;
        }

        public Builder steps(String... eventNames) {
            for (String name : eventNames) {
                steps.add(FunnelStep.of(name));
            }
            return this;
        }

        public Builder exclusion(FunnelExclusion exclusion) {
            exclusions.add(Objects.requireNonNull(exclusion, "exclusion must not be null"));
            return this;
        }

        public Builder orderType(FunnelOrderType type) {
            this.orderType = type;
            return this;
        }

        public Builder windowDays(int days) {
            this.windowDays = days;
            return this;
        }

        public Builder window(int value, String unit) {
            this.windowValue = value;
            this.windowUnit = unit;
            return this;
        }

        public Builder breakdownProperty(String property) {
            this.breakdownProperty = property;
            return this;
        }

        public Builder breakdownCohorts(List<CohortFilterInput> cohorts) {
            this.breakdownCohorts = cohorts;
            return this;
        }

        public Builder breakdownLimit(int limit) {
            this.breakdownLimit = limit;
            return this;
        }

        public Builder samplingFactor(double factor) {
            this.samplingFactor = factor;
            return this;
        }

        public Builder cohortFilters(List<CohortFilterInput> cohorts) {
            this.cohortFilters = cohorts;
            return this;
        }

        public Builder displayMode(StepDisplayMode mode) {
            this.displayMode = mode;
            return this;
        }

        public FunnelRequest build() {
            return new FunnelRequest(projectId, dateFrom, dateTo, timezone, steps, exclusions, orderType,
                windowDays, windowValue, windowUnit, breakdownProperty, breakdownCohorts, breakdownLimit,
                samplingFactor, cohortFilters, displayMode);
        }
    }
}
