package com.funnelduck.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine settings read from system properties, with defaults.
 *
 * <pre>
 *   funnelduck.breakdown.limit        top breakdown values reported (25)
 *   funnelduck.breakdown.parallelism  concurrent cohort breakdown queries (4)
 *   funnelduck.window.maxDays         longest conversion window (90)
 * </pre>
 *
 * <p>The window setting can only lower the ceiling: values above
 * {@value #MAX_WINDOW_DAYS} days are clamped to it.
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String PROP_BREAKDOWN_LIMIT = "funnelduck.breakdown.limit";
    public static final String PROP_BREAKDOWN_PARALLELISM = "funnelduck.breakdown.parallelism";
    public static final String PROP_WINDOW_MAX_DAYS = "funnelduck.window.maxDays";

    public static final int DEFAULT_BREAKDOWN_LIMIT = 25;
    public static final int DEFAULT_BREAKDOWN_PARALLELISM = 4;
    public static final int MAX_WINDOW_DAYS = 90;
    public static final int DEFAULT_WINDOW_MAX_DAYS = MAX_WINDOW_DAYS;

    private static final EngineConfig DEFAULTS = new EngineConfig(
        DEFAULT_BREAKDOWN_LIMIT, DEFAULT_BREAKDOWN_PARALLELISM, DEFAULT_WINDOW_MAX_DAYS);

    private final int breakdownLimit;
    private final int breakdownParallelism;
    private final int windowMaxDays;

    public EngineConfig(int breakdownLimit, int breakdownParallelism, int windowMaxDays) {
        if (breakdownLimit <= 0 || breakdownParallelism <= 0 || windowMaxDays <= 0) {
            throw new IllegalArgumentException("Engine settings must be positive");
        }
        this.breakdownLimit = breakdownLimit;
        this.breakdownParallelism = breakdownParallelism;
        if (windowMaxDays > MAX_WINDOW_DAYS) {
            logger.warn("Window ceiling of {} days exceeds the maximum, using {}", windowMaxDays, MAX_WINDOW_DAYS);
        }
        this.windowMaxDays = Math.min(windowMaxDays, MAX_WINDOW_DAYS);
    }

    public static EngineConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the current system properties. Missing, malformed or non-positive
     * values fall back to the defaults.
     */
    public static EngineConfig fromSystemProperties() {
        return new EngineConfig(
            positiveInt(PROP_BREAKDOWN_LIMIT, DEFAULT_BREAKDOWN_LIMIT),
            positiveInt(PROP_BREAKDOWN_PARALLELISM, DEFAULT_BREAKDOWN_PARALLELISM),
            positiveInt(PROP_WINDOW_MAX_DAYS, DEFAULT_WINDOW_MAX_DAYS));
    }

    public int breakdownLimit() {
        return breakdownLimit;
    }

    public int breakdownParallelism() {
        return breakdownParallelism;
    }

    public int windowMaxDays() {
        return windowMaxDays;
    }

    public long windowMaxSeconds() {
        return windowMaxDays * 86_400L;
    }

    // ========== Configuration Helpers ==========

    private static int positiveInt(String property, int defaultValue) {
        String value = System.getProperty(property);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                logger.warn("Ignoring non-positive {}={}, using {}", property, value, defaultValue);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed {}={}, using {}", property, value, defaultValue);
            }
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "EngineConfig(breakdownLimit=" + breakdownLimit + ", breakdownParallelism="
            + breakdownParallelism + ", windowMaxDays=" + windowMaxDays + ")";
    }
}
