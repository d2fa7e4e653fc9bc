package com.funnelduck.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Conditional expression, rendered with ClickHouse {@code multiIf}.
 *
 * <pre>
 *   multiIf(cond1, value1, cond2, value2, elseValue)
 * </pre>
 */
public final class CaseExpression implements Expression {

    /**
     * One {@code condition -> result} branch.
     */
    public static final class WhenClause {
        private final Expression condition;
        private final Expression result;

        public WhenClause(Expression condition, Expression result) {
            this.condition = Objects.requireNonNull(condition, "condition must not be null");
            this.result = Objects.requireNonNull(result, "result must not be null");
        }

        public Expression condition() {
            return condition;
        }

        public Expression result() {
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof WhenClause)) return false;
            WhenClause that = (WhenClause) obj;
            return condition.equals(that.condition) && result.equals(that.result);
        }

        @Override
        public int hashCode() {
            return Objects.hash(condition, result);
        }
    }

    private final List<WhenClause> whenClauses;
    private final Expression elseValue;

    public CaseExpression(List<WhenClause> whenClauses, Expression elseValue) {
        Objects.requireNonNull(whenClauses, "whenClauses must not be null");
        if (whenClauses.isEmpty()) {
            throw new IllegalArgumentException("CASE requires at least one branch");
        }
        this.whenClauses = new ArrayList<>(whenClauses);
        this.elseValue = Objects.requireNonNull(elseValue, "elseValue must not be null");
    }

    public List<WhenClause> whenClauses() {
        return Collections.unmodifiableList(whenClauses);
    }

    public Expression elseValue() {
        return elseValue;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseExpression)) return false;
        CaseExpression that = (CaseExpression) obj;
        return whenClauses.equals(that.whenClauses) && elseValue.equals(that.elseValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(whenClauses, elseValue);
    }

    @Override
    public String toString() {
        return "Case(" + whenClauses.size() + " branches)";
    }
}
