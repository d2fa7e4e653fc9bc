package com.funnelduck.helpers;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.expression.Expression;

/**
 * The person an event belongs to after identity merges.
 *
 * <p>Events keep the {@code person_id} they were ingested with. When two
 * persons are merged, the override dictionary maps
 * {@code (project_id, distinct_id)} to the surviving person; events without an
 * override keep their own id.
 */
public final class ResolvedPerson {

    public static final String OVERRIDES_DICT = "person_overrides_dict";

    private static final Expression EXPR = coalesce(
        dictGetOrNull(OVERRIDES_DICT, "person_id", tuple(col("project_id"), col("distinct_id"))),
        col("person_id"));

    private ResolvedPerson() {
    }

    /**
     * {@code coalesce(dictGetOrNull('person_overrides_dict', 'person_id', (project_id, distinct_id)), person_id)}
     */
    public static Expression expr() {
        return EXPR;
    }
}
