package com.funnelduck.query;

import java.util.Objects;

/**
 * Named query in a {@code WITH} clause.
 */
public final class CommonTableExpression {

    private final String name;
    private final QueryNode query;

    public CommonTableExpression(String name, QueryNode query) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.query = Objects.requireNonNull(query, "query must not be null");
    }

    public String name() {
        return name;
    }

    public QueryNode query() {
        return query;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CommonTableExpression)) return false;
        CommonTableExpression that = (CommonTableExpression) obj;
        return name.equals(that.name) && query.equals(that.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, query);
    }

    @Override
    public String toString() {
        return name + " AS (" + query + ")";
    }
}
