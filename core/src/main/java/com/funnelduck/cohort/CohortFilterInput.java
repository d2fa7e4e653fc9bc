package com.funnelduck.cohort;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A cohort used as a query filter or as a breakdown group.
 *
 * <p>Materialized and static cohorts are read from their member tables; for
 * any other cohort the {@link #definition()} is compiled inline.
 */
public final class CohortFilterInput {

    private final String cohortId;
    private final String name;
    private final ConditionGroup definition;
    private final boolean materialized;
    private final boolean isStatic;

    @JsonCreator
    public CohortFilterInput(@JsonProperty("cohort_id") String cohortId,
                             @JsonProperty("name") String name,
                             @JsonProperty("definition") ConditionGroup definition,
                             @JsonProperty("materialized") boolean materialized,
                             @JsonProperty("is_static") boolean isStatic) {
        this.cohortId = Objects.requireNonNull(cohortId, "cohortId must not be null");
        this.name = name == null ? cohortId : name;
        this.definition = definition == null ? new ConditionGroup(ConditionGroup.Type.AND, null) : definition;
        this.materialized = materialized;
        this.isStatic = isStatic;
    }

    // ==================== Factory Methods ====================

    public static CohortFilterInput inline(String cohortId, String name, ConditionGroup definition) {
        return new CohortFilterInput(cohortId, name, definition, false, false);
    }

    public static CohortFilterInput materialized(String cohortId, String name) {
        return new CohortFilterInput(cohortId, name, null, true, false);
    }

    public static CohortFilterInput staticCohort(String cohortId, String name) {
        return new CohortFilterInput(cohortId, name, null, false, true);
    }

    public String cohortId() {
        return cohortId;
    }

    public String name() {
        return name;
    }

    public ConditionGroup definition() {
        return definition;
    }

    public boolean materialized() {
        return materialized;
    }

    public boolean isStatic() {
        return isStatic;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CohortFilterInput)) return false;
        CohortFilterInput that = (CohortFilterInput) obj;
        return materialized == that.materialized && isStatic == that.isStatic
            && cohortId.equals(that.cohortId) && name.equals(that.name)
            && definition.equals(that.definition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cohortId, name, definition, materialized, isStatic);
    }

    @Override
    public String toString() {
        return "CohortFilterInput(" + cohortId + ", " + name + ")";
    }
}
