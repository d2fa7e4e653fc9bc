package com.funnelduck.query;

import com.funnelduck.expression.Expression;
import java.util.Objects;

/**
 * A join attached to a SELECT.
 *
 * <p>{@link JoinType#CROSS} joins carry no condition.
 */
public final class JoinClause {

    /**
     * Supported join types.
     */
    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT("LEFT JOIN"),
        CROSS("CROSS JOIN");

        private final String keyword;

        JoinType(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    private final JoinType type;
    private final Expression source;
    private final String alias;
    private final Expression condition;

    public JoinClause(JoinType type, Expression source, String alias, Expression condition) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.alias = alias;
        if (type == JoinType.CROSS && condition != null) {
            throw new IllegalArgumentException("CROSS JOIN does not take a condition");
        }
        if (type != JoinType.CROSS && condition == null) {
            throw new IllegalArgumentException(type.keyword() + " requires a condition");
        }
        this.condition = condition;
    }

    public JoinType type() {
        return type;
    }

    public Expression source() {
        return source;
    }

    /**
     * Returns the alias, or null when the source is referenced unaliased.
     */
    public String alias() {
        return alias;
    }

    /**
     * Returns the ON condition, or null for cross joins.
     */
    public Expression condition() {
        return condition;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JoinClause)) return false;
        JoinClause that = (JoinClause) obj;
        return type == that.type && source.equals(that.source)
            && Objects.equals(alias, that.alias) && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, source, alias, condition);
    }
}
