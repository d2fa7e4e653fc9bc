package com.funnelduck.helpers;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.exception.BadRequestException;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.generator.SQLQuoting;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles property filters into expressions over the {@code events} table.
 *
 * <p>A property key is either a direct column from {@link #DIRECT_COLUMNS} or
 * a dotted JSON path in one of two namespaces:
 * <ul>
 *   <li>{@code properties.a.b}: event properties, column {@code properties}</li>
 *   <li>{@code user_properties.a}: identity properties, column {@code user_properties}</li>
 * </ul>
 *
 * <p>JSON path segments end up in the SQL text as string literals, so the key
 * is checked against {@code [A-Za-z0-9_.-]+} first. A key that fails the check
 * is rejected with {@link BadRequestException}; it is never cleaned up.
 */
public final class PropertyFilters {

    /** Columns of the events table that may be filtered on directly. */
    public static final Set<String> DIRECT_COLUMNS = Set.of(
        "event_name", "distinct_id", "session_id",
        "url", "referrer", "page_title", "page_path",
        "device_type", "browser", "browser_version",
        "os", "os_version",
        "country", "region", "city",
        "language", "timezone",
        "sdk_name", "sdk_version");

    private static final String EVENT_PREFIX = "properties.";
    private static final String PERSON_PREFIX = "user_properties.";

    private PropertyFilters() {
    }

    /**
     * JSON column plus validated path segments.
     */
    static final class JsonPath {
        final ColumnReference column;
        final List<String> segments;

        JsonPath(String column, List<String> segments) {
            this.column = col(column);
            this.segments = segments;
        }
    }

    /**
     * Parses a namespaced key into its JSON path.
     *
     * @return the path, or empty for keys without a JSON namespace
     * @throws BadRequestException if the key contains characters outside the allow-list
     */
    static Optional<JsonPath> parsePath(String property) {
        String column;
        String key;
        if (property.startsWith(EVENT_PREFIX)) {
            column = "properties";
            key = property.substring(EVENT_PREFIX.length());
        } else if (property.startsWith(PERSON_PREFIX)) {
            column = "user_properties";
            key = property.substring(PERSON_PREFIX.length());
        } else {
            return Optional.empty();
        }
        if (!SQLQuoting.isSafePropertyKey(key)) {
            throw new BadRequestException("Invalid property key '" + property
                + "': only letters, digits, '_', '-' and '.' are allowed");
        }
        List<String> segments = Arrays.asList(key.split("\\.", -1));
        if (segments.stream().anyMatch(String::isEmpty)) {
            throw new BadRequestException("Invalid property key '" + property + "': empty path segment");
        }
        return Optional.of(new JsonPath(column, List.copyOf(segments)));
    }

    /**
     * Resolves a property key to the expression extracting its string value.
     *
     * @throws BadRequestException for unknown or invalid keys
     */
    public static Expression resolvePropertyExpr(String property) {
        Optional<JsonPath> path = parsePath(property);
        if (path.isPresent()) {
            return jsonExtractString(path.get().column, path.get().segments);
        }
        if (DIRECT_COLUMNS.contains(property)) {
            return col(property);
        }
        throw new BadRequestException("Unknown filter property: " + property);
    }

    /**
     * Resolves a JSON property to {@code toFloat64OrZero(JSONExtractRaw(...))}.
     * Direct columns are rejected: numeric aggregation is only defined over
     * JSON properties.
     *
     * @throws BadRequestException for direct columns, unknown or invalid keys
     */
    public static Expression resolveNumericPropertyExpr(String property) {
        return parsePath(property)
            .map(p -> (Expression) toFloat64OrZero(jsonExtractRaw(p.column, p.segments)))
            .orElseThrow(() -> new BadRequestException("Unknown metric property: " + property));
    }

    /**
     * Compiles a single filter.
     *
     * <p>JSON properties get null-aware forms: {@code eq} also matches the raw
     * JSON text (so {@code true} and {@code 42} compare as strings), and the
     * negative operators require the key to be present.
     */
    public static Expression propertyFilter(PropertyFilter filter) {
        Optional<JsonPath> path = parsePath(filter.property());
        if (path.isEmpty()) {
            return operatorClause(resolvePropertyExpr(filter.property()),
                filter.operator(), filter.value(), filter.values());
        }
        JsonPath p = path.get();
        Expression value = jsonExtractString(p.column, p.segments);
        Expression rawValue = toStringFn(jsonExtractRaw(p.column, p.segments));
        Expression has = jsonHas(p.column, p.segments);
        FilterOperator op = filter.operator();

        return switch (op) {
            case EQ -> or(eq(value, param("String", filter.value())),
                          eq(rawValue, param("String", filter.value())));
            case NEQ -> and(has,
                            neq(value, param("String", filter.value())),
                            neq(rawValue, param("String", filter.value())));
            case NOT_CONTAINS -> and(has, operatorClause(value, op, filter.value(), filter.values()));
            case IS_SET -> has;
            case IS_NOT_SET -> not(has);
            case GT, LT, GTE, LTE, BETWEEN, NOT_BETWEEN ->
                numericClause(toFloat64OrZero(jsonExtractRaw(p.column, p.segments)), op, filter.value(), filter.values());
            default -> operatorClause(value, op, filter.value(), filter.values());
        };
    }

    /**
     * Applies an operator to an already resolved string expression. Used for
     * direct columns and for aggregated person properties in cohort conditions.
     */
    public static Expression operatorClause(Expression expr, FilterOperator op, String value, List<String> values) {
        return switch (op) {
            case EQ -> eq(expr, param("String", value));
            case NEQ -> neq(expr, param("String", value));
            case CONTAINS -> like(expr, param("String", "%" + SQLQuoting.escapeLikePattern(value) + "%"));
            case NOT_CONTAINS -> notLike(expr, param("String", "%" + SQLQuoting.escapeLikePattern(value) + "%"));
            case IS_SET -> neq(expr, literal(""));
            case IS_NOT_SET -> eq(expr, literal(""));
            case GT, LT, GTE, LTE, BETWEEN, NOT_BETWEEN -> numericClause(toFloat64OrZero(expr), op, value, values);
            case REGEX -> match(expr, param("String", value));
            case NOT_REGEX -> not(match(expr, param("String", value)));
            case IN -> in(expr, param("Array(String)", values));
            case NOT_IN -> notIn(expr, param("Array(String)", values));
            case IS_DATE_BEFORE, IS_DATE_AFTER, IS_DATE_EXACT -> dateClause(expr, op, value);
            case CONTAINS_MULTI -> multiSearchAny(expr, param("Array(String)", values));
            case NOT_CONTAINS_MULTI -> not(multiSearchAny(expr, param("Array(String)", values)));
        };
    }

    /**
     * ANDs a list of filters; empty for an empty list.
     */
    public static Optional<Expression> propertyFilters(List<PropertyFilter> filters) {
        if (filters == null || filters.isEmpty()) {
            return Optional.empty();
        }
        List<Expression> exprs = new ArrayList<>(filters.size());
        for (PropertyFilter f : filters) {
            exprs.add(propertyFilter(f));
        }
        return allOf(exprs);
    }

    private static Expression numericClause(Expression number, FilterOperator op, String value, List<String> values) {
        return switch (op) {
            case GT -> gt(number, param("Float64", parseNumber(value)));
            case LT -> lt(number, param("Float64", parseNumber(value)));
            case GTE -> gte(number, param("Float64", parseNumber(value)));
            case LTE -> lte(number, param("Float64", parseNumber(value)));
            case BETWEEN -> and(gte(number, param("Float64", rangeBound(values, 0))),
                                lte(number, param("Float64", rangeBound(values, 1))));
            case NOT_BETWEEN -> or(lt(number, param("Float64", rangeBound(values, 0))),
                                   gt(number, param("Float64", rangeBound(values, 1))));
            default -> throw new IllegalArgumentException("Not a numeric operator: " + op);
        };
    }

    private static Expression dateClause(Expression expr, FilterOperator op, String value) {
        if (value.isEmpty()) {
            return raw("1 = 0");
        }
        Expression parsed = parseDateTimeBestEffortOrZero(expr);
        Expression target = parseDateTimeBestEffort(param("String", value));
        Expression nonZero = neq(parsed, toDateTime(literal(0)));
        return switch (op) {
            case IS_DATE_BEFORE -> and(nonZero, lt(parsed, target));
            case IS_DATE_AFTER -> and(nonZero, gt(parsed, target));
            default -> and(nonZero, eq(toDate(parsed), toDate(target)));
        };
    }

    private static double rangeBound(List<String> values, int index) {
        return index < values.size() ? parseNumber(values.get(index)) : 0.0;
    }

    private static double parseNumber(String value) {
        if (value == null || value.isEmpty()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new BadRequestException("Expected a number but got '" + value + "'", e);
        }
    }
}
