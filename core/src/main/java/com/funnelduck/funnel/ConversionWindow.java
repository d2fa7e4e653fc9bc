package com.funnelduck.funnel;

import com.funnelduck.exception.BadRequestException;
import java.util.Locale;

/**
 * Resolves the conversion window of a funnel to seconds.
 *
 * <p>Requests give either the legacy day count or a {@code (value, unit)}
 * pair; a month counts as 30 days.
 */
public final class ConversionWindow {

    /** Default window when nothing is given. */
    public static final int DEFAULT_DAYS = 14;

    /** 90 days. */
    public static final long MAX_WINDOW_SECONDS = 90L * 86_400;

    public enum Unit {
        SECOND(1),
        MINUTE(60),
        HOUR(3_600),
        DAY(86_400),
        WEEK(604_800),
        MONTH(2_592_000);

        private final long seconds;

        Unit(long seconds) {
            this.seconds = seconds;
        }

        public long seconds() {
            return seconds;
        }

        public static Unit fromWire(String value) {
            for (Unit unit : values()) {
                if (unit.name().toLowerCase(Locale.ROOT).equals(value)) {
                    return unit;
                }
            }
            throw new BadRequestException("Unknown conversion window unit: " + value);
        }
    }

    private ConversionWindow() {
    }

    /**
     * Resolves against the default ceiling of {@value #MAX_WINDOW_SECONDS} seconds.
     *
     * @see #resolveWindowSeconds(Integer, Integer, String, long)
     */
    public static long resolveWindowSeconds(Integer days, Integer value, String unit) {
        return resolveWindowSeconds(days, value, unit, MAX_WINDOW_SECONDS);
    }

    /**
     * Resolves the window.
     *
     * @param days legacy day count, may be null (defaults to {@value #DEFAULT_DAYS})
     * @param value window value, must come with {@code unit}
     * @param unit one of second, minute, hour, day, week, month
     * @param maxSeconds ceiling, itself capped at {@value #MAX_WINDOW_SECONDS}
     * @return the window in seconds
     * @throws BadRequestException if only one of value/unit is given, a value is
     *         not positive, the unit is unknown or the window exceeds the ceiling
     */
    public static long resolveWindowSeconds(Integer days, Integer value, String unit, long maxSeconds) {
        if ((value == null) != (unit == null)) {
            throw new BadRequestException(
                "conversion_window_value and conversion_window_unit must be given together");
        }
        long seconds;
        if (value != null) {
            if (value <= 0) {
                throw new BadRequestException("conversion_window_value must be positive, got " + value);
            }
            seconds = value * Unit.fromWire(unit).seconds();
        } else {
            int d = days != null ? days : DEFAULT_DAYS;
            if (d <= 0) {
                throw new BadRequestException("conversion_window_days must be positive, got " + d);
            }
            seconds = d * Unit.DAY.seconds();
        }
        long ceiling = Math.min(maxSeconds, MAX_WINDOW_SECONDS);
        if (seconds > ceiling) {
            throw new BadRequestException("Conversion window of " + seconds
                + " seconds exceeds the maximum of " + ceiling + " seconds ("
                + (ceiling / Unit.DAY.seconds()) + " days)");
        }
        return seconds;
    }
}
