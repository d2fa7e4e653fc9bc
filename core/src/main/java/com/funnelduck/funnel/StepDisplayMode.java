package com.funnelduck.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.funnelduck.exception.BadRequestException;
import java.util.Locale;

/**
 * Base of the per-step conversion rate: the first step ({@link #TOTAL}) or
 * the previous step ({@link #RELATIVE}).
 */
public enum StepDisplayMode {
    TOTAL,
    RELATIVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StepDisplayMode fromWire(String value) {
        if (value == null) {
            return TOTAL;
        }
        for (StepDisplayMode mode : values()) {
            if (mode.wireName().equals(value)) {
                return mode;
            }
        }
        throw new BadRequestException("Unknown conversion rate display: " + value);
    }
}
