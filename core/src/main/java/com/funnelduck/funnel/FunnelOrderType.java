package com.funnelduck.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.funnelduck.exception.BadRequestException;
import java.util.Locale;

/**
 * How step order is enforced.
 *
 * <ul>
 *   <li>{@link #ORDERED}: steps in order within the window, other events may interleave</li>
 *   <li>{@link #STRICT}: steps in order, users with any event outside the funnel are dropped</li>
 *   <li>{@link #UNORDERED}: every step within one window of an anchor, in any order</li>
 * </ul>
 */
public enum FunnelOrderType {
    ORDERED,
    STRICT,
    UNORDERED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FunnelOrderType fromWire(String value) {
        if (value == null) {
            return ORDERED;
        }
        for (FunnelOrderType type : values()) {
            if (type.wireName().equals(value)) {
                return type;
            }
        }
        throw new BadRequestException("Unknown funnel order type: " + value);
    }
}
