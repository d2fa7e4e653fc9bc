package com.funnelduck.expression;

import com.funnelduck.query.QueryNode;
import java.util.Objects;

/**
 * A nested query used as an expression, rendered in parentheses.
 */
public final class SubqueryExpression implements Expression {

    private final QueryNode query;

    public SubqueryExpression(QueryNode query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
    }

    public QueryNode query() {
        return query;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SubqueryExpression)) return false;
        return query.equals(((SubqueryExpression) obj).query);
    }

    @Override
    public int hashCode() {
        return query.hashCode();
    }

    @Override
    public String toString() {
        return "Subquery(" + query + ")";
    }
}
