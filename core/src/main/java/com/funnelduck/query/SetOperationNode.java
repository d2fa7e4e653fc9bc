package com.funnelduck.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Set operation combining two or more queries.
 *
 * <p>Cohort groups use {@link Type#INTERSECT} for AND and {@link Type#UNION_DISTINCT}
 * for OR.
 */
public final class SetOperationNode implements QueryNode {

    /**
     * Set operation kinds.
     */
    public enum Type {
        UNION_ALL("UNION ALL"),
        UNION_DISTINCT("UNION DISTINCT"),
        INTERSECT("INTERSECT"),
        EXCEPT("EXCEPT");

        private final String keyword;

        Type(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    private final Type type;
    private final List<QueryNode> queries;

    public SetOperationNode(Type type, List<QueryNode> queries) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(queries, "queries must not be null");
        if (queries.size() < 2) {
            throw new IllegalArgumentException(type.keyword() + " requires at least two queries");
        }
        this.queries = new ArrayList<>(queries);
    }

    // ==================== Factory Methods ====================

    public static SetOperationNode unionAll(List<QueryNode> queries) {
        return new SetOperationNode(Type.UNION_ALL, queries);
    }

    public static SetOperationNode unionDistinct(List<QueryNode> queries) {
        return new SetOperationNode(Type.UNION_DISTINCT, queries);
    }

    public static SetOperationNode intersect(List<QueryNode> queries) {
        return new SetOperationNode(Type.INTERSECT, queries);
    }

    public static SetOperationNode except(List<QueryNode> queries) {
        return new SetOperationNode(Type.EXCEPT, queries);
    }

    public Type type() {
        return type;
    }

    public List<QueryNode> queries() {
        return Collections.unmodifiableList(queries);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SetOperationNode)) return false;
        SetOperationNode that = (SetOperationNode) obj;
        return type == that.type && queries.equals(that.queries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, queries);
    }

    @Override
    public String toString() {
        return type.keyword() + queries;
    }
}
