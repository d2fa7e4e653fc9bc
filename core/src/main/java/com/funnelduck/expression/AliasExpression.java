package com.funnelduck.expression;

import java.util.Objects;

/**
 * Expression that gives an alias (name) to another expression.
 *
 * <p>Examples:
 * <pre>
 *   count() AS entered
 *   groupArrayIf(toUnixTimestamp64Milli(timestamp), cond) AS t0_arr
 * </pre>
 */
public final class AliasExpression implements Expression {

    private final Expression expression;
    private final String alias;

    /**
     * Creates an alias expression.
     *
     * @param expression the expression to alias
     * @param alias the alias name
     */
    public AliasExpression(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasExpression)) return false;
        AliasExpression that = (AliasExpression) obj;
        return expression.equals(that.expression) && alias.equals(that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }

    @Override
    public String toString() {
        return expression + " AS " + alias;
    }
}
