package com.funnelduck.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a lambda passed to a ClickHouse higher-order function.
 *
 * <p>Examples:
 * <pre>
 *   t -> t > 0                 -- arrayExists(t -> t > 0, ts_arr)
 *   (x, y) -> x + y            -- arrayMap over two arrays
 * </pre>
 *
 * <p>Parameter names are validated as identifiers by the compiler.
 */
public final class LambdaExpression implements Expression {

    private final List<String> parameters;
    private final Expression body;

    /**
     * Creates a lambda expression.
     *
     * @param parameters the parameter names (at least one)
     * @param body the lambda body expression
     */
    public LambdaExpression(List<String> parameters, Expression body) {
        if (parameters == null || parameters.isEmpty()) {
            throw new IllegalArgumentException("Lambda must have at least one parameter");
        }
        this.parameters = new ArrayList<>(parameters);
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    public List<String> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    public Expression body() {
        return body;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LambdaExpression)) return false;
        LambdaExpression that = (LambdaExpression) obj;
        return parameters.equals(that.parameters) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, body);
    }

    @Override
    public String toString() {
        return "Lambda(" + parameters + " -> " + body + ")";
    }
}
