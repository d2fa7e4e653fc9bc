package com.funnelduck.helpers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.funnelduck.exception.BadRequestException;

/**
 * Operators accepted in property filters.
 */
public enum FilterOperator {
    EQ("eq"),
    NEQ("neq"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    IS_SET("is_set"),
    IS_NOT_SET("is_not_set"),
    GT("gt"),
    LT("lt"),
    GTE("gte"),
    LTE("lte"),
    REGEX("regex"),
    NOT_REGEX("not_regex"),
    IN("in"),
    NOT_IN("not_in"),
    BETWEEN("between"),
    NOT_BETWEEN("not_between"),
    IS_DATE_BEFORE("is_date_before"),
    IS_DATE_AFTER("is_date_after"),
    IS_DATE_EXACT("is_date_exact"),
    CONTAINS_MULTI("contains_multi"),
    NOT_CONTAINS_MULTI("not_contains_multi");

    private final String wireName;

    FilterOperator(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static FilterOperator fromWire(String value) {
        for (FilterOperator op : values()) {
            if (op.wireName.equals(value)) {
                return op;
            }
        }
        throw new BadRequestException("Unknown filter operator: " + value);
    }
}
