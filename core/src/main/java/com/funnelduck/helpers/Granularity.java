package com.funnelduck.helpers;

import com.funnelduck.exception.BadRequestException;
import java.util.Locale;

/**
 * Time bucket sizes for trend-style queries.
 */
public enum Granularity {
    HOUR,
    DAY,
    WEEK,
    MONTH;

    /**
     * Parses a granularity from its lower-case wire name.
     *
     * @param value e.g. {@code "day"}
     * @return the granularity
     * @throws BadRequestException if the value is unknown
     */
    public static Granularity parse(String value) {
        if (value == null) {
            throw new BadRequestException("granularity is required");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "hour" -> HOUR;
            case "day" -> DAY;
            case "week" -> WEEK;
            case "month" -> MONTH;
            default -> throw new BadRequestException("Unknown granularity: " + value);
        };
    }
}
