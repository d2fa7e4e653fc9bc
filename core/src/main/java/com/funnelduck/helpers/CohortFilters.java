package com.funnelduck.helpers;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.cohort.CohortFilterInput;
import com.funnelduck.cohort.CohortLookup;
import com.funnelduck.cohort.CohortQueryBuilder;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.RawWithParams;
import com.funnelduck.generator.CompiledQuery;
import com.funnelduck.generator.SQLCompiler;
import com.funnelduck.query.QueryNode;
import com.funnelduck.query.SelectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Restricts an events query to members of one or more cohorts.
 *
 * <p>Each cohort contributes {@code <resolved person> IN (<member query>)}.
 * Member queries that are set operations are compiled separately and spliced
 * in as {@link RawWithParams}; their positional parameters get a
 * per-cohort prefix so they cannot clash with the parent's.
 */
public final class CohortFilters {

    /** Offset added to the cohort index of breakdown groups so their parameters differ from filters'. */
    public static final int BREAKDOWN_INDEX_OFFSET = 900;

    private static final SQLCompiler COMPILER = new SQLCompiler();

    private CohortFilters() {
    }

    /**
     * ANDs one membership condition per cohort.
     *
     * @param cohorts cohorts to filter by
     * @param projectId project id, bound as {@code {project_id:UUID}}
     * @param lookup resolves cohorts referenced from inline definitions
     * @param dateTo upper bound for behavioral conditions, may be null
     * @param dateFrom lower bound for zero-count conditions, may be null
     * @return the combined condition, or empty when there are no cohorts
     */
    public static Optional<Expression> cohortFilter(List<CohortFilterInput> cohorts, String projectId,
                                                    CohortLookup lookup, String dateTo, String dateFrom) {
        if (cohorts == null || cohorts.isEmpty()) {
            return Optional.empty();
        }
        CohortQueryBuilder builder = new CohortQueryBuilder(projectId, lookup, dateTo, dateFrom);
        List<Expression> conditions = new ArrayList<>();
        for (int i = 0; i < cohorts.size(); i++) {
            CohortFilterInput cohort = cohorts.get(i);
            if (cohort.materialized()) {
                conditions.add(inSubquery(ResolvedPerson.expr(),
                    builder.memberQuery(cohort.cohortId(), "coh_mid_" + i, false)));
            } else if (cohort.isStatic()) {
                conditions.add(inSubquery(ResolvedPerson.expr(),
                    builder.memberQuery(cohort.cohortId(), "coh_sid_" + i, true)));
            } else {
                conditions.add(membership(builder.build(cohort.definition(), i), "coh" + i + "_p_"));
            }
        }
        return allOf(conditions);
    }

    /**
     * Membership condition for one cohort breakdown group. The member id is
     * bound under {@code cohort_bd_<id without dashes>}; inline definitions
     * are namespaced with {@link #BREAKDOWN_INDEX_OFFSET} plus the group index.
     */
    public static Expression breakdownFilter(CohortFilterInput cohort, int groupIndex, String projectId,
                                             CohortLookup lookup, String dateTo, String dateFrom) {
        CohortQueryBuilder builder = new CohortQueryBuilder(projectId, lookup, dateTo, dateFrom);
        String paramKey = breakdownParamKey(cohort.cohortId());
        if (cohort.isStatic() || cohort.materialized()) {
            return inSubquery(ResolvedPerson.expr(),
                builder.memberQuery(cohort.cohortId(), paramKey, cohort.isStatic()));
        }
        QueryNode members = builder.build(cohort.definition(), BREAKDOWN_INDEX_OFFSET + groupIndex);
        return membership(members, "cohbd" + groupIndex + "_p_");
    }

    public static String breakdownParamKey(String cohortId) {
        return "cohort_bd_" + cohortId.replace("-", "");
    }

    private static Expression membership(QueryNode members, String positionalPrefix) {
        if (members instanceof SelectNode) {
            return inSubquery(ResolvedPerson.expr(), members);
        }
        CompiledQuery person = COMPILER.compileExpression(ResolvedPerson.expr());
        CompiledQuery fragment = COMPILER.compile(members, positionalPrefix);
        return new RawWithParams(person.sql() + " IN (" + fragment.sql() + ")", fragment.params());
    }
}
