package com.funnelduck.cohort;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Membership (or, when negated, non-membership) in another cohort.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CohortRefCondition implements CohortCondition {

    private final String cohortId;
    private final boolean negated;

    @JsonCreator
    public CohortRefCondition(@JsonProperty("cohort_id") String cohortId,
                              @JsonProperty("negated") boolean negated) {
        this.cohortId = Objects.requireNonNull(cohortId, "cohortId must not be null");
        this.negated = negated;
    }

    public String cohortId() {
        return cohortId;
    }

    public boolean negated() {
        return negated;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CohortRefCondition)) return false;
        CohortRefCondition that = (CohortRefCondition) obj;
        return negated == that.negated && cohortId.equals(that.cohortId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cohortId, negated);
    }

    @Override
    public String toString() {
        return (negated ? "not in cohort " : "in cohort ") + cohortId;
    }
}
