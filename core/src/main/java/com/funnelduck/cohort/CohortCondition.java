package com.funnelduck.cohort;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Node of a cohort definition: either a nested AND/OR group or a leaf condition.
 *
 * <p>The JSON form carries the kind in {@code type}: {@code "AND"} or
 * {@code "OR"} for groups, {@code "person_property"}, {@code "event"} or
 * {@code "cohort"} for leaves.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type", visible = true)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ConditionGroup.class, names = {"AND", "OR"}),
    @JsonSubTypes.Type(value = PersonPropertyCondition.class, name = "person_property"),
    @JsonSubTypes.Type(value = EventCondition.class, name = "event"),
    @JsonSubTypes.Type(value = CohortRefCondition.class, name = "cohort")
})
public sealed interface CohortCondition
        permits ConditionGroup, PersonPropertyCondition, EventCondition, CohortRefCondition {
}
