package com.funnelduck.expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pre-compiled SQL fragment together with the parameters it references.
 *
 * <p>The compiler splices the SQL verbatim and merges the parameter map into
 * the enclosing compilation, rejecting any name already bound to a different
 * value. This is how independently compiled fragments (cohort sub-queries,
 * for instance) are embedded into a parent query.
 */
public final class RawWithParams implements Expression {

    private final String sql;
    private final Map<String, Object> params;

    public RawWithParams(String sql, Map<String, ?> params) {
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        this.params = Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(params, "params must not be null")));
    }

    public String sql() {
        return sql;
    }

    public Map<String, Object> params() {
        return params;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RawWithParams)) return false;
        RawWithParams that = (RawWithParams) obj;
        return sql.equals(that.sql) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, params);
    }

    @Override
    public String toString() {
        return "RawWithParams(" + sql + ", " + params.keySet() + ")";
    }
}
