package com.funnelduck.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Call of a parametric aggregate with two argument lists.
 *
 * <p>Examples:
 * <pre>
 *   quantile(0.5)(duration)
 *   windowFunnel(86400000, 'strict_order')(ts, cond_0, cond_1)
 * </pre>
 */
public final class ParametricCall implements Expression {

    private final String functionName;
    private final List<Expression> parameters;
    private final List<Expression> arguments;

    public ParametricCall(String functionName, List<Expression> parameters, List<Expression> arguments) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        this.parameters = new ArrayList<>(Objects.requireNonNull(parameters, "parameters must not be null"));
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Returns the constructor arguments (the first parenthesized list).
     *
     * @return an unmodifiable list
     */
    public List<Expression> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    /**
     * Returns the call arguments (the second parenthesized list).
     *
     * @return an unmodifiable list
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ParametricCall)) return false;
        ParametricCall that = (ParametricCall) obj;
        return functionName.equals(that.functionName)
            && parameters.equals(that.parameters)
            && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, parameters, arguments);
    }

    @Override
    public String toString() {
        return "ParametricCall(" + functionName + ", " + parameters + ", " + arguments + ")";
    }
}
