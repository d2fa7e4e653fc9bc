package com.funnelduck.helpers;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.exception.BadRequestException;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.IntervalExpression;
import com.funnelduck.expression.Literal;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.regex.Pattern;

/**
 * Timezone-aware time helpers: range filters, bucketing and date arithmetic.
 *
 * <p>A timezone of {@code null} or {@code "UTC"} short-circuits the
 * timezone-aware SQL forms. Any other zone must be a valid IANA id; it is
 * checked with {@link ZoneId#of(String)} before it reaches the SQL text.
 */
public final class TimeHelpers {

    private static final DateTimeFormatter CH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Pattern OFFSET_SUFFIX = Pattern.compile(".*[+-]\\d{2}:\\d{2}$");

    private TimeHelpers() {
    }

    /**
     * Converts an ISO date or datetime into ClickHouse's {@code YYYY-MM-DD HH:MM:SS}.
     *
     * <ul>
     *   <li>{@code 2025-01-31} becomes {@code 2025-01-31 00:00:00}, or {@code 23:59:59} with endOfDay</li>
     *   <li>values ending in {@code Z} or an offset are converted to UTC</li>
     *   <li>anything else keeps its first 19 characters with {@code T} replaced by a space</li>
     * </ul>
     */
    public static String toChTs(String iso, boolean endOfDay) {
        if (iso == null || iso.length() < 10) {
            throw new BadRequestException("Invalid date: " + iso);
        }
        if (iso.length() == 10) {
            parseDate(iso);
            return iso + (endOfDay ? " 23:59:59" : " 00:00:00");
        }
        if (iso.endsWith("Z") || OFFSET_SUFFIX.matcher(iso).matches()) {
            try {
                return OffsetDateTime.parse(iso).withOffsetSameInstant(ZoneOffset.UTC).format(CH_FORMAT);
            } catch (DateTimeParseException e) {
                throw new BadRequestException("Invalid datetime: " + iso, e);
            }
        }
        return iso.substring(0, Math.min(19, iso.length())).replace('T', ' ');
    }

    public static String toChTs(String iso) {
        return toChTs(iso, false);
    }

    /**
     * Returns true when the zone requires timezone-aware SQL.
     */
    public static boolean hasTimezone(String tz) {
        return tz != null && !tz.isEmpty() && !"UTC".equals(tz);
    }

    /**
     * Validates an IANA timezone id.
     *
     * @throws BadRequestException if the id is unknown
     */
    public static String validateTimezone(String tz) {
        if (!hasTimezone(tz)) {
            return "UTC";
        }
        try {
            ZoneId.of(tz);
            return tz;
        } catch (DateTimeException e) {
            throw new BadRequestException("Unknown timezone: " + tz, e);
        }
    }

    /**
     * Datetime parameter with timezone handling.
     *
     * <pre>
     *   UTC: {p_N:DateTime64(3)}
     *   tz:  toDateTime64({p_N:String}, 3, {p_M:String})
     * </pre>
     */
    public static Expression tsParam(String value, String tz) {
        String chTs = toChTs(value);
        if (!hasTimezone(tz)) {
            return param("DateTime64(3)", chTs);
        }
        return toDateTime64(param("String", chTs), literal(3), param("String", validateTimezone(tz)));
    }

    /**
     * Named variant of {@link #tsParam(String, String)}. The timezone is bound as
     * the named parameter {@code tz} so that several timestamps share it.
     *
     * @param name parameter name for the timestamp, e.g. {@code from}
     * @param chTs value already converted with {@link #toChTs(String, boolean)}
     */
    public static Expression tsNamedParam(String name, String chTs, String tz) {
        if (!hasTimezone(tz)) {
            return named(name, "DateTime64(3)", chTs);
        }
        return toDateTime64(named(name, "String", chTs), literal(3), named("tz", "String", validateTimezone(tz)));
    }

    /**
     * {@code timestamp >= from AND timestamp <= to}. A date-only upper bound is
     * extended to the end of that day.
     */
    public static Expression timeRange(String from, String to, String tz) {
        Expression fromExpr = tsParam(from, tz);
        Expression toExpr = tsParam(to.length() == 10 ? toChTs(to, true) : to, tz);
        return and(gte(col("timestamp"), fromExpr), lte(col("timestamp"), toExpr));
    }

    /**
     * Truncates a column to the start of its bucket.
     *
     * <pre>
     *   hour:  toStartOfHour(col [, tz])
     *   day:   toStartOfDay(col [, tz])
     *   week:  toDateTime(toStartOfWeek(col, 1 [, tz]) [, tz])
     *   month: toDateTime(toStartOfMonth(col [, tz]) [, tz])
     * </pre>
     */
    public static Expression bucket(Granularity granularity, String column, String tz) {
        Expression c = col(column);
        if (!hasTimezone(tz)) {
            return switch (granularity) {
                case HOUR -> toStartOfHour(c);
                case DAY -> toStartOfDay(c);
                case WEEK -> toDateTime(toStartOfWeek(c, literal(1)));
                case MONTH -> toDateTime(toStartOfMonth(c));
            };
        }
        Literal zone = literal(validateTimezone(tz));
        return switch (granularity) {
            case HOUR -> toStartOfHour(c, zone);
            case DAY -> toStartOfDay(c, zone);
            case WEEK -> toDateTime(toStartOfWeek(c, literal(1), zone), zone);
            case MONTH -> toDateTime(toStartOfMonth(c, zone), zone);
        };
    }

    /**
     * The bucket before or after {@code bucketExpr}. Week and month buckets in a
     * non-UTC zone are re-snapped to the local boundary after shifting, which
     * keeps them aligned across DST changes.
     *
     * @param direction +1 for the next bucket, -1 for the previous one
     */
    public static Expression neighborBucket(Granularity granularity, Expression bucketExpr, int direction, String tz) {
        if (direction != 1 && direction != -1) {
            throw new IllegalArgumentException("direction must be 1 or -1: " + direction);
        }
        Expression step = switch (granularity) {
            case HOUR -> interval(literal(1), IntervalExpression.Unit.HOUR);
            case DAY -> interval(literal(1), IntervalExpression.Unit.DAY);
            case WEEK -> interval(literal(7), IntervalExpression.Unit.DAY);
            case MONTH -> interval(literal(1), IntervalExpression.Unit.MONTH);
        };
        Expression shifted = direction == 1 ? add(bucketExpr, step) : sub(bucketExpr, step);
        if (!hasTimezone(tz)) {
            return shifted;
        }
        Literal zone = literal(validateTimezone(tz));
        return switch (granularity) {
            case HOUR, DAY -> shifted;
            case WEEK -> toDateTime(toStartOfWeek(shifted, literal(1), zone), zone);
            case MONTH -> toDateTime(toStartOfMonth(shifted, zone), zone);
        };
    }

    // ==================== Date arithmetic ====================

    /**
     * Shifts a {@code YYYY-MM-DD} date by whole periods (negative moves back).
     */
    public static String shiftDate(String date, int periods, Granularity granularity) {
        LocalDate d = parseDate(date);
        LocalDate shifted = switch (granularity) {
            case DAY -> d.plusDays(periods);
            case WEEK -> d.plusWeeks(periods);
            case MONTH -> d.plusMonths(periods);
            case HOUR -> throw new IllegalArgumentException("Cannot shift a date by hours");
        };
        return shifted.toString();
    }

    /**
     * Truncates a {@code YYYY-MM-DD} date to the start of its bucket. Weeks start on Monday.
     */
    public static String truncateDate(String date, Granularity granularity) {
        LocalDate d = parseDate(date);
        LocalDate truncated = switch (granularity) {
            case DAY -> d;
            case WEEK -> d.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> d.withDayOfMonth(1);
            case HOUR -> throw new IllegalArgumentException("Cannot truncate a date to hours");
        };
        return truncated.toString();
    }

    /**
     * Returns the period of equal length immediately before {@code [from, to]} (inclusive days).
     *
     * @return a two-element array {@code {previousFrom, previousTo}}
     */
    public static String[] shiftPeriod(String from, String to) {
        LocalDate f = parseDate(from);
        LocalDate t = parseDate(to);
        long days = ChronoUnit.DAYS.between(f, t) + 1;
        return new String[] {f.minusDays(days).toString(), f.minusDays(1).toString()};
    }

    private static LocalDate parseDate(String date) {
        try {
            return LocalDate.parse(date.length() > 10 ? date.substring(0, 10) : date);
        } catch (DateTimeParseException e) {
            throw new BadRequestException("Invalid date: " + date, e);
        }
    }
}
