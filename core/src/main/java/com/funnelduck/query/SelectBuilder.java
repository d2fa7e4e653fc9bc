package com.funnelduck.query;

import com.funnelduck.expression.Expression;
import com.funnelduck.expression.RawSQLExpression;
import com.funnelduck.expression.SubqueryExpression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fluent builder for {@link SelectNode}.
 *
 * <p>WHERE, PREWHERE and HAVING accept nullable conjuncts; {@code null}
 * entries are dropped rather than compiled. A builder whose WHERE list ends
 * up empty produces a statement without a WHERE clause.
 *
 * <p>Example:
 * <pre>
 *   SelectNode node = SelectBuilder.select(col("person_id"))
 *       .from("events")
 *       .where(projectFilter, cohortFilterOrNull)
 *       .groupBy(col("person_id"))
 *       .build();
 * </pre>
 */
public final class SelectBuilder {

    final List<CommonTableExpression> ctes = new ArrayList<>();
    boolean distinct;
    final List<Expression> columns = new ArrayList<>();
    Expression from;
    String fromAlias;
    Expression arrayJoin;
    final List<JoinClause> joins = new ArrayList<>();
    final List<Expression> prewhere = new ArrayList<>();
    final List<Expression> where = new ArrayList<>();
    final List<Expression> groupBy = new ArrayList<>();
    final List<Expression> having = new ArrayList<>();
    final List<OrderItem> orderBy = new ArrayList<>();
    Long limit;
    Long offset;

    private SelectBuilder() {
    }

    // ==================== Factory Methods ====================

    public static SelectBuilder select(Expression... columns) {
        return new SelectBuilder().addSelect(columns);
    }

    public static SelectBuilder select(List<? extends Expression> columns) {
        SelectBuilder builder = new SelectBuilder();
        columns.forEach(builder::addColumn);
        return builder;
    }

    static SelectBuilder copyOf(SelectNode node) {
        SelectBuilder b = new SelectBuilder();
        b.ctes.addAll(node.ctes());
        b.distinct = node.distinct();
        b.columns.addAll(node.columns());
        b.from = node.from();
        b.fromAlias = node.fromAlias();
        b.arrayJoin = node.arrayJoin();
        b.joins.addAll(node.joins());
        b.prewhere.addAll(node.prewhere());
        b.where.addAll(node.where());
        b.groupBy.addAll(node.groupBy());
        b.having.addAll(node.having());
        b.orderBy.addAll(node.orderBy());
        b.limit = node.limit();
        b.offset = node.offset();
        return b;
    }

    // ==================== Projection ====================

    public SelectBuilder addSelect(Expression... exprs) {
        Arrays.stream(exprs).forEach(this::addColumn);
        return this;
    }

    private void addColumn(Expression expr) {
        columns.add(Objects.requireNonNull(expr, "column must not be null"));
    }

    public SelectBuilder distinct() {
        this.distinct = true;
        return this;
    }

    // ==================== Sources ====================

    /**
     * Sets a table or CTE source. The name is emitted verbatim, so it must
     * come from engine code (e.g. {@code "events"} or {@code "cohort_members FINAL"}).
     */
    public SelectBuilder from(String table) {
        this.from = new RawSQLExpression(Objects.requireNonNull(table, "table must not be null"));
        this.fromAlias = null;
        return this;
    }

    public SelectBuilder from(Expression source) {
        this.from = Objects.requireNonNull(source, "source must not be null");
        this.fromAlias = null;
        return this;
    }

    public SelectBuilder from(QueryNode subquery, String alias) {
        this.from = new SubqueryExpression(Objects.requireNonNull(subquery, "subquery must not be null"));
        this.fromAlias = alias;
        return this;
    }

    public SelectBuilder arrayJoin(Expression expr) {
        this.arrayJoin = Objects.requireNonNull(expr, "expr must not be null");
        return this;
    }

    public SelectBuilder innerJoin(Expression source, String alias, Expression on) {
        joins.add(new JoinClause(JoinClause.JoinType.INNER, source, alias, on));
        return this;
    }

    public SelectBuilder leftJoin(Expression source, String alias, Expression on) {
        joins.add(new JoinClause(JoinClause.JoinType.LEFT, source, alias, on));
        return this;
    }

    public SelectBuilder crossJoin(QueryNode subquery, String alias) {
        joins.add(new JoinClause(JoinClause.JoinType.CROSS, new SubqueryExpression(subquery), alias, null));
        return this;
    }

    // ==================== Filters ====================

    public SelectBuilder prewhere(Expression... conditions) {
        addNonNull(prewhere, conditions);
        return this;
    }

    /**
     * Appends WHERE conjuncts; null entries are ignored.
     */
    public SelectBuilder where(Expression... conditions) {
        addNonNull(where, conditions);
        return this;
    }

    public SelectBuilder where(Optional<? extends Expression> condition) {
        condition.ifPresent(where::add);
        return this;
    }

    public SelectBuilder having(Expression... conditions) {
        addNonNull(having, conditions);
        return this;
    }

    private static void addNonNull(List<Expression> target, Expression[] conditions) {
        for (Expression c : conditions) {
            if (c != null) {
                target.add(c);
            }
        }
    }

    // ==================== Grouping and Ordering ====================

    public SelectBuilder groupBy(Expression... exprs) {
        groupBy.addAll(Arrays.asList(exprs));
        return this;
    }

    public SelectBuilder orderBy(Expression expr) {
        return orderBy(expr, OrderItem.Direction.ASC);
    }

    public SelectBuilder orderBy(Expression expr, OrderItem.Direction direction) {
        orderBy.add(new OrderItem(expr, direction));
        return this;
    }

    public SelectBuilder limit(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative: " + limit);
        }
        this.limit = limit;
        return this;
    }

    public SelectBuilder offset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative: " + offset);
        }
        this.offset = offset;
        return this;
    }

    // ==================== CTEs ====================

    public SelectBuilder with(String name, QueryNode query) {
        ctes.add(new CommonTableExpression(name, query));
        return this;
    }

    public SelectBuilder withAll(List<CommonTableExpression> list) {
        ctes.addAll(list);
        return this;
    }

    public SelectNode build() {
        return new SelectNode(this);
    }
}
