package com.funnelduck.cohort;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.exception.BadRequestException;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.IntervalExpression;
import com.funnelduck.generator.SQLQuoting;
import com.funnelduck.helpers.PropertyFilters;
import com.funnelduck.helpers.ResolvedPerson;
import com.funnelduck.helpers.TimeHelpers;
import com.funnelduck.query.QueryNode;
import com.funnelduck.query.SelectBuilder;
import com.funnelduck.query.SelectNode;
import com.funnelduck.query.SetOperationNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a cohort definition into a query returning matching {@code person_id}s.
 *
 * <p>AND groups become {@code INTERSECT}, OR groups {@code UNION DISTINCT}.
 * Each leaf condition is a {@code SELECT ... AS person_id} over {@code events}
 * or over a member table.
 *
 * <p>Named parameters of a leaf are {@code coh_<n>_*}, where {@code n} starts at
 * {@code cohortIndex * 100} and increases by one per leaf, so several cohorts
 * compiled into one query never share a name.
 *
 * <p>Behavioral conditions are evaluated relative to an upper bound: the end of
 * the analyzed date range when one is given, {@code now64(3)} otherwise.
 */
public final class CohortQueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CohortQueryBuilder.class);

    public static final int MAX_TOTAL_CONDITIONS = 20;
    public static final int MAX_NESTING_DEPTH = 5;

    public static final String STATIC_MEMBERS_TABLE = "person_static_cohort FINAL";
    public static final String MATERIALIZED_MEMBERS_TABLE = "cohort_members FINAL";

    /** Columns stored on each event row; their latest value is read with {@code argMax}. */
    static final Set<String> TOP_LEVEL_COLUMNS = Set.of(
        "country", "region", "city", "device_type", "browser",
        "browser_version", "os", "os_version", "language");

    private final String projectId;
    private final CohortLookup lookup;
    private final String dateTo;
    private final String dateFrom;

    private int counter;

    /**
     * @param projectId project the cohort belongs to
     * @param lookup resolves referenced cohorts
     * @param dateTo optional upper bound for behavioral conditions (ISO date or datetime)
     * @param dateFrom optional lower bound for zero-count event conditions
     */
    public CohortQueryBuilder(String projectId, CohortLookup lookup, String dateTo, String dateFrom) {
        this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
        this.lookup = lookup != null ? lookup : CohortLookup.materializedOnly();
        this.dateTo = dateTo;
        this.dateFrom = dateFrom;
    }

    /**
     * Builds the member query of a cohort definition.
     *
     * @param definition the definition
     * @param cohortIndex index of the cohort in the enclosing query, used to namespace parameters
     * @return a select or set-operation node with a single {@code person_id} column
     * @throws BadRequestException if the definition is too large, too deep or invalid
     */
    public QueryNode build(ConditionGroup definition, int cohortIndex) {
        Objects.requireNonNull(definition, "definition must not be null");
        validateComplexity(definition);
        counter = cohortIndex * 100;
        QueryNode node = group(definition);
        logger.debug("Built cohort query for index {} ({} conditions)", cohortIndex, counter - cohortIndex * 100);
        return node;
    }

    // ==================== Validation ====================

    /**
     * Rejects definitions with more than {@value #MAX_TOTAL_CONDITIONS} leaf
     * conditions or nested deeper than {@value #MAX_NESTING_DEPTH} groups.
     */
    public static void validateComplexity(ConditionGroup definition) {
        int leaves = countLeafConditions(definition);
        if (leaves > MAX_TOTAL_CONDITIONS) {
            throw new BadRequestException("Cohort definition has " + leaves
                + " conditions; at most " + MAX_TOTAL_CONDITIONS + " are allowed");
        }
        int depth = nestingDepth(definition);
        if (depth > MAX_NESTING_DEPTH) {
            throw new BadRequestException("Cohort definition is nested " + depth
                + " levels deep; at most " + MAX_NESTING_DEPTH + " are allowed");
        }
    }

    static int countLeafConditions(CohortCondition condition) {
        if (condition instanceof ConditionGroup) {
            int total = 0;
            for (CohortCondition c : ((ConditionGroup) condition).values()) {
                total += countLeafConditions(c);
            }
            return total;
        }
        return 1;
    }

    static int nestingDepth(CohortCondition condition) {
        if (!(condition instanceof ConditionGroup)) {
            return 0;
        }
        int deepest = 0;
        for (CohortCondition c : ((ConditionGroup) condition).values()) {
            deepest = Math.max(deepest, nestingDepth(c));
        }
        return deepest + 1;
    }

    // ==================== Groups ====================

    private QueryNode group(ConditionGroup group) {
        if (group.values().isEmpty()) {
            return SelectBuilder.select(toUUID(literal("00000000-0000-0000-0000-000000000000")).as("person_id"))
                .where(raw("0"))
                .build();
        }
        List<QueryNode> parts = new ArrayList<>();
        for (CohortCondition c : group.values()) {
            parts.add(condition(c));
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return group.type() == ConditionGroup.Type.AND
            ? SetOperationNode.intersect(parts)
            : SetOperationNode.unionDistinct(parts);
    }

    private QueryNode condition(CohortCondition c) {
        if (c instanceof ConditionGroup) {
            return group((ConditionGroup) c);
        } else if (c instanceof PersonPropertyCondition) {
            return personProperty((PersonPropertyCondition) c);
        } else if (c instanceof EventCondition) {
            return event((EventCondition) c);
        } else if (c instanceof CohortRefCondition) {
            return cohortRef((CohortRefCondition) c);
        }
        throw new IllegalStateException("Unknown cohort condition: " + c);
    }

    // ==================== Leaf conditions ====================

    private SelectNode personProperty(PersonPropertyCondition cond) {
        counter++;
        Expression latest = latestPropertyExpr(cond.property());
        return SelectBuilder.select(ResolvedPerson.expr().as("person_id"))
            .from("events")
            .where(projectCondition())
            .groupBy(col("person_id"))
            .having(PropertyFilters.operatorClause(latest, cond.operator(), cond.value(), cond.values()))
            .build();
    }

    private SelectNode event(EventCondition cond) {
        int n = counter++;
        Expression eventName = named("coh_" + n + "_event", "String", cond.eventName());
        Expression days = named("coh_" + n + "_days", "UInt32", cond.timeWindowDays());
        Expression upper = upperBound();
        Expression windowStart = sub(upper, interval(days, IntervalExpression.Unit.DAY));

        if (cond.isZeroCount()) {
            // Everyone active in the window who never performed the event
            Expression lower = dateFrom != null
                ? named("coh_date_from", "DateTime64(3)", TimeHelpers.toChTs(dateFrom))
                : windowStart;
            Expression performed = and(eq(col("event_name"), eventName),
                PropertyFilters.propertyFilters(cond.eventFilters()).orElse(null));
            return SelectBuilder.select(ResolvedPerson.expr().as("person_id"))
                .from("events")
                .where(projectCondition(),
                       gte(col("timestamp"), lower),
                       lte(col("timestamp"), upper))
                .groupBy(col("person_id"))
                .having(eq(countIf(performed), literal(0)))
                .build();
        }

        Expression threshold = named("coh_" + n + "_count", "UInt64", cond.count());
        Expression having = switch (cond.countOperator()) {
            case GTE -> gte(count(), threshold);
            case LTE -> lte(count(), threshold);
            case EQ -> eq(count(), threshold);
        };
        return SelectBuilder.select(ResolvedPerson.expr().as("person_id"))
            .from("events")
            .where(projectCondition(),
                   eq(col("event_name"), eventName),
                   gte(col("timestamp"), windowStart),
                   lte(col("timestamp"), upper))
            .where(PropertyFilters.propertyFilters(cond.eventFilters()))
            .groupBy(col("person_id"))
            .having(having)
            .build();
    }

    private SelectNode cohortRef(CohortRefCondition cond) {
        int n = counter++;
        SelectNode members = memberQuery(cond.cohortId(), "coh_" + n + "_ref", lookup.isStatic(cond.cohortId()));
        if (!cond.negated()) {
            return members;
        }
        return SelectBuilder.select(ResolvedPerson.expr().as("person_id"))
            .distinct()
            .from("events")
            .where(projectCondition(),
                   lte(col("timestamp"), upperBound()),
                   notInSubquery(ResolvedPerson.expr(), members))
            .build();
    }

    // ==================== Shared pieces ====================

    /**
     * {@code SELECT person_id FROM <members table> WHERE cohort_id = {param:UUID} AND project_id = {project_id:UUID}}
     */
    public SelectNode memberQuery(String cohortId, String paramName, boolean isStatic) {
        return SelectBuilder.select(col("person_id"))
            .from(isStatic ? STATIC_MEMBERS_TABLE : MATERIALIZED_MEMBERS_TABLE)
            .where(eq(col("cohort_id"), named(paramName, "UUID", cohortId)),
                   projectCondition())
            .build();
    }

    private Expression projectCondition() {
        return eq(col("project_id"), named("project_id", "UUID", projectId));
    }

    private Expression upperBound() {
        if (dateTo == null) {
            return raw("now64(3)");
        }
        return named("coh_date_to", "DateTime64(3)", TimeHelpers.toChTs(dateTo, true));
    }

    /**
     * Latest value of a person property across the person's events.
     */
    static Expression latestPropertyExpr(String property) {
        if (TOP_LEVEL_COLUMNS.contains(property)) {
            return argMax(col(property), col("timestamp"));
        }
        String column = "user_properties";
        String key = property;
        if (property.startsWith("properties.")) {
            column = "properties";
            key = property.substring("properties.".length());
        } else if (property.startsWith("user_properties.")) {
            key = property.substring("user_properties.".length());
        }
        if (!SQLQuoting.isSafePropertyKey(key)) {
            throw new BadRequestException("Invalid property key '" + property
                + "': only letters, digits, '_', '-' and '.' are allowed");
        }
        List<String> segments = Arrays.asList(key.split("\\.", -1));
        if (segments.contains("")) {
            throw new BadRequestException("Invalid property key '" + property + "': empty path segment");
        }
        return jsonExtractString(argMax(col(column), col("timestamp")), segments);
    }
}
