package com.funnelduck.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a function call.
 *
 * <p>Examples:
 * <pre>
 *   count()
 *   uniqExact(person_id)
 *   JSONExtractString(properties, 'plan')
 *   count(DISTINCT person_id)
 * </pre>
 *
 * <p>The function name is emitted as given; ClickHouse function names are
 * case sensitive.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final boolean distinct;

    /**
     * Creates a function call expression.
     *
     * @param functionName the ClickHouse function name
     * @param arguments the function arguments
     * @param distinct whether DISTINCT is applied to arguments
     */
    public FunctionCall(String functionName, List<Expression> arguments, boolean distinct) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (this.functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.distinct = distinct;
    }

    public FunctionCall(String functionName, List<Expression> arguments) {
        this(functionName, arguments, false);
    }

    /**
     * Returns the function name.
     *
     * @return the function name
     */
    public String functionName() {
        return functionName;
    }

    /**
     * Returns the function arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public boolean distinct() {
        return distinct;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return distinct == that.distinct
            && functionName.equals(that.functionName)
            && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments, distinct);
    }

    @Override
    public String toString() {
        return "Call(" + functionName + (distinct ? ", DISTINCT" : "") + ", " + arguments + ")";
    }
}
