package com.funnelduck.query;

import com.funnelduck.expression.Expression;
import java.util.List;
import java.util.Objects;

/**
 * Immutable SELECT statement.
 *
 * <p>Instances are created through {@link SelectBuilder}. Clause lists are
 * unmodifiable copies; optional clauses are {@code null} when absent.
 *
 * <p>The source, join targets and ARRAY JOIN are plain expressions: a
 * {@link com.funnelduck.expression.ColumnReference} names a table or CTE, a
 * {@link com.funnelduck.expression.SubqueryExpression} nests a query and a
 * {@link com.funnelduck.expression.FunctionCall} invokes a table function such
 * as {@code numbers(n)}.
 */
public final class SelectNode implements QueryNode {

    private final List<CommonTableExpression> ctes;
    private final boolean distinct;
    private final List<Expression> columns;
    private final Expression from;
    private final String fromAlias;
    private final Expression arrayJoin;
    private final List<JoinClause> joins;
    private final List<Expression> prewhere;
    private final List<Expression> where;
    private final List<Expression> groupBy;
    private final List<Expression> having;
    private final List<OrderItem> orderBy;
    private final Long limit;
    private final Long offset;

    SelectNode(SelectBuilder b) {
        this.ctes = List.copyOf(b.ctes);
        this.distinct = b.distinct;
        this.columns = List.copyOf(b.columns);
        this.from = b.from;
        this.fromAlias = b.fromAlias;
        this.arrayJoin = b.arrayJoin;
        this.joins = List.copyOf(b.joins);
        this.prewhere = List.copyOf(b.prewhere);
        this.where = List.copyOf(b.where);
        this.groupBy = List.copyOf(b.groupBy);
        this.having = List.copyOf(b.having);
        this.orderBy = List.copyOf(b.orderBy);
        this.limit = b.limit;
        this.offset = b.offset;
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("SELECT requires at least one column");
        }
    }

    public List<CommonTableExpression> ctes() {
        return ctes;
    }

    public boolean distinct() {
        return distinct;
    }

    public List<Expression> columns() {
        return columns;
    }

    /**
     * Returns the source expression, or null for a SELECT without FROM.
     */
    public Expression from() {
        return from;
    }

    public String fromAlias() {
        return fromAlias;
    }

    public Expression arrayJoin() {
        return arrayJoin;
    }

    public List<JoinClause> joins() {
        return joins;
    }

    /**
     * Returns the PREWHERE conjuncts; empty when there is no PREWHERE.
     */
    public List<Expression> prewhere() {
        return prewhere;
    }

    /**
     * Returns the WHERE conjuncts; empty when there is no WHERE.
     */
    public List<Expression> where() {
        return where;
    }

    public List<Expression> groupBy() {
        return groupBy;
    }

    public List<Expression> having() {
        return having;
    }

    public List<OrderItem> orderBy() {
        return orderBy;
    }

    public Long limit() {
        return limit;
    }

    public Long offset() {
        return offset;
    }

    /**
     * Returns a builder pre-populated with this statement's clauses.
     */
    public SelectBuilder toBuilder() {
        return SelectBuilder.copyOf(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SelectNode)) return false;
        SelectNode that = (SelectNode) obj;
        return distinct == that.distinct
            && ctes.equals(that.ctes)
            && columns.equals(that.columns)
            && Objects.equals(from, that.from)
            && Objects.equals(fromAlias, that.fromAlias)
            && Objects.equals(arrayJoin, that.arrayJoin)
            && joins.equals(that.joins)
            && prewhere.equals(that.prewhere)
            && where.equals(that.where)
            && groupBy.equals(that.groupBy)
            && having.equals(that.having)
            && orderBy.equals(that.orderBy)
            && Objects.equals(limit, that.limit)
            && Objects.equals(offset, that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ctes, distinct, columns, from, fromAlias, arrayJoin, joins,
            prewhere, where, groupBy, having, orderBy, limit, offset);
    }

    @Override
    public String toString() {
        return "Select(" + columns.size() + " columns"
            + (from != null ? ", from=" + from : "")
            + (ctes.isEmpty() ? "" : ", ctes=" + ctes.size())
            + ")";
    }
}
