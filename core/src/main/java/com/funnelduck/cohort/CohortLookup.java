package com.funnelduck.cohort;

/**
 * Resolves how a referenced cohort is stored.
 *
 * <p>Static cohorts are uploaded lists kept in {@code person_static_cohort};
 * every other cohort is read from the materialized {@code cohort_members}
 * table.
 */
@FunctionalInterface
public interface CohortLookup {

    /**
     * @param cohortId id of the referenced cohort
     * @return true if the cohort is static
     */
    boolean isStatic(String cohortId);

    /**
     * Lookup that treats every cohort as materialized.
     */
    static CohortLookup materializedOnly() {
        return cohortId -> false;
    }
}
