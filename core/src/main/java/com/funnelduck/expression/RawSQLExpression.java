package com.funnelduck.expression;

import java.util.Objects;

/**
 * Expression that represents a raw SQL fragment passed through verbatim.
 *
 * <p>Used for fixed fragments owned by the engine, such as table names with
 * modifiers or the resolved-person expression. The fragment must not contain
 * parameter placeholders; use {@link RawWithParams} for that.
 *
 * <p>Examples:
 * <pre>
 *   count()
 *   person_static_cohort FINAL
 * </pre>
 */
public final class RawSQLExpression implements Expression {

    private final String sql;

    public RawSQLExpression(String sql) {
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
    }

    /**
     * Returns the SQL fragment.
     *
     * @return the SQL string
     */
    public String sql() {
        return sql;
    }

    @Override
    public String toString() {
        return "RawSQL(" + sql + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RawSQLExpression)) return false;
        RawSQLExpression that = (RawSQLExpression) obj;
        return sql.equals(that.sql);
    }

    @Override
    public int hashCode() {
        return sql.hashCode();
    }
}
