package com.funnelduck.generator;

import com.funnelduck.expression.ArrayLiteral;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.BinaryExpression.Operator;
import com.funnelduck.expression.CaseExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.InExpression;
import com.funnelduck.expression.IntervalExpression;
import com.funnelduck.expression.LambdaExpression;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.NamedParam;
import com.funnelduck.expression.NotExpression;
import com.funnelduck.expression.ParametricCall;
import com.funnelduck.expression.PositionalParam;
import com.funnelduck.expression.RawSQLExpression;
import com.funnelduck.expression.RawWithParams;
import com.funnelduck.expression.SubqueryExpression;
import com.funnelduck.expression.TupleExpression;
import com.funnelduck.query.QueryNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Static factory methods for building expression trees.
 *
 * <p>Intended for static import:
 * <pre>
 *   import static com.funnelduck.generator.Functions.*;
 *
 *   Expression cond = and(
 *       eq(col("event_name"), named("step_0_name", "String", "signup")),
 *       gt(col("timestamp"), param("DateTime64(3)", from)));
 * </pre>
 *
 * <p>{@link #allOf(Collection)} and {@link #anyOf(Collection)} drop {@code null}
 * entries and return {@link Optional#empty()} when nothing is left, so that
 * optional filter fragments never compile to {@code WHERE 1}.
 */
public final class Functions {

    private Functions() {
    }

    // ==================== Leaves ====================

    public static ColumnReference col(String name) {
        return new ColumnReference(name);
    }

    public static Literal literal(String value) {
        return Literal.of(value);
    }

    public static Literal literal(long value) {
        return Literal.of(value);
    }

    public static Literal literal(double value) {
        return Literal.of(value);
    }

    public static PositionalParam param(String chType, Object value) {
        return new PositionalParam(chType, value);
    }

    public static NamedParam named(String name, String chType, Object value) {
        return new NamedParam(name, chType, value);
    }

    public static RawSQLExpression raw(String sql) {
        return new RawSQLExpression(sql);
    }

    public static RawWithParams rawWithParams(CompiledQuery fragment) {
        return new RawWithParams(fragment.sql(), fragment.params());
    }

    // ==================== Calls ====================

    public static FunctionCall func(String name, Expression... args) {
        return new FunctionCall(name, Arrays.asList(args));
    }

    public static FunctionCall func(String name, List<? extends Expression> args) {
        return new FunctionCall(name, new ArrayList<>(args));
    }

    public static FunctionCall funcDistinct(String name, Expression... args) {
        return new FunctionCall(name, Arrays.asList(args), true);
    }

    public static ParametricCall parametric(String name, List<? extends Expression> parameters,
                                            List<? extends Expression> args) {
        return new ParametricCall(name, new ArrayList<>(parameters), new ArrayList<>(args));
    }

    public static LambdaExpression lambda(String parameter, Expression body) {
        return new LambdaExpression(List.of(parameter), body);
    }

    public static LambdaExpression lambda(List<String> parameters, Expression body) {
        return new LambdaExpression(parameters, body);
    }

    // ==================== Operators ====================

    public static BinaryExpression eq(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.EQUAL, r);
    }

    public static BinaryExpression neq(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.NOT_EQUAL, r);
    }

    public static BinaryExpression gt(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.GREATER_THAN, r);
    }

    public static BinaryExpression gte(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.GREATER_THAN_OR_EQUAL, r);
    }

    public static BinaryExpression lt(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.LESS_THAN, r);
    }

    public static BinaryExpression lte(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.LESS_THAN_OR_EQUAL, r);
    }

    public static BinaryExpression like(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.LIKE, r);
    }

    public static BinaryExpression notLike(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.NOT_LIKE, r);
    }

    public static BinaryExpression add(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.ADD, r);
    }

    public static BinaryExpression sub(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.SUBTRACT, r);
    }

    public static BinaryExpression mul(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.MULTIPLY, r);
    }

    public static BinaryExpression div(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.DIVIDE, r);
    }

    public static BinaryExpression mod(Expression l, Expression r) {
        return BinaryExpression.of(l, Operator.MODULO, r);
    }

    public static NotExpression not(Expression e) {
        return new NotExpression(e);
    }

    /**
     * ANDs the given expressions, skipping nulls. At least one must be non-null.
     */
    public static Expression and(Expression first, Expression... rest) {
        return combine(Operator.AND, concat(first, rest))
            .orElseThrow(() -> new IllegalArgumentException("and() requires at least one operand"));
    }

    /**
     * ORs the given expressions, skipping nulls. At least one must be non-null.
     */
    public static Expression or(Expression first, Expression... rest) {
        return combine(Operator.OR, concat(first, rest))
            .orElseThrow(() -> new IllegalArgumentException("or() requires at least one operand"));
    }

    /**
     * ANDs the non-null expressions; empty when none remain.
     */
    public static Optional<Expression> allOf(Collection<? extends Expression> exprs) {
        return combine(Operator.AND, exprs);
    }

    /**
     * ORs the non-null expressions; empty when none remain.
     */
    public static Optional<Expression> anyOf(Collection<? extends Expression> exprs) {
        return combine(Operator.OR, exprs);
    }

    private static List<Expression> concat(Expression first, Expression[] rest) {
        List<Expression> all = new ArrayList<>(rest.length + 1);
        all.add(first);
        all.addAll(Arrays.asList(rest));
        return all;
    }

    private static Optional<Expression> combine(Operator op, Collection<? extends Expression> exprs) {
        Expression result = null;
        for (Expression e : exprs) {
            if (e == null) {
                continue;
            }
            result = result == null ? e : new BinaryExpression(result, op, e);
        }
        return Optional.ofNullable(result);
    }

    public static InExpression in(Expression e, Expression target) {
        return new InExpression(e, target, false);
    }

    public static InExpression notIn(Expression e, Expression target) {
        return new InExpression(e, target, true);
    }

    public static InExpression inSubquery(Expression e, QueryNode query) {
        return new InExpression(e, new SubqueryExpression(query), false);
    }

    public static InExpression notInSubquery(Expression e, QueryNode query) {
        return new InExpression(e, new SubqueryExpression(query), true);
    }

    public static SubqueryExpression subquery(QueryNode query) {
        return new SubqueryExpression(query);
    }

    public static TupleExpression tuple(Expression... elements) {
        return new TupleExpression(Arrays.asList(elements));
    }

    public static ArrayLiteral array(List<? extends Expression> elements) {
        return new ArrayLiteral(new ArrayList<>(elements));
    }

    public static IntervalExpression interval(Expression amount, IntervalExpression.Unit unit) {
        return new IntervalExpression(amount, unit);
    }

    public static CaseExpression multiIf(List<CaseExpression.WhenClause> branches, Expression elseValue) {
        return new CaseExpression(branches, elseValue);
    }

    public static CaseExpression.WhenClause when(Expression condition, Expression result) {
        return new CaseExpression.WhenClause(condition, result);
    }

    // ==================== Aggregates ====================

    public static FunctionCall count() {
        return func("count");
    }

    public static FunctionCall countIf(Expression cond) {
        return func("countIf", cond);
    }

    public static FunctionCall uniqExact(Expression e) {
        return func("uniqExact", e);
    }

    public static FunctionCall sum(Expression e) {
        return func("sum", e);
    }

    public static FunctionCall min(Expression e) {
        return func("min", e);
    }

    public static FunctionCall max(Expression e) {
        return func("max", e);
    }

    public static FunctionCall minIf(Expression e, Expression cond) {
        return func("minIf", e, cond);
    }

    public static FunctionCall maxIf(Expression e, Expression cond) {
        return func("maxIf", e, cond);
    }

    public static FunctionCall avgIf(Expression e, Expression cond) {
        return func("avgIf", e, cond);
    }

    public static FunctionCall groupArray(Expression e) {
        return func("groupArray", e);
    }

    public static FunctionCall groupArrayIf(Expression e, Expression cond) {
        return func("groupArrayIf", e, cond);
    }

    public static FunctionCall argMax(Expression arg, Expression val) {
        return func("argMax", arg, val);
    }

    public static FunctionCall argMinIf(Expression arg, Expression val, Expression cond) {
        return func("argMinIf", arg, val, cond);
    }

    public static FunctionCall argMaxIf(Expression arg, Expression val, Expression cond) {
        return func("argMaxIf", arg, val, cond);
    }

    public static ParametricCall quantile(double level, Expression e) {
        return parametric("quantile", List.of(literal(level)), List.of(e));
    }

    // ==================== Arrays ====================

    public static FunctionCall arrayExists(LambdaExpression fn, Expression arr) {
        return func("arrayExists", fn, arr);
    }

    public static FunctionCall arrayFilter(LambdaExpression fn, Expression arr) {
        return func("arrayFilter", fn, arr);
    }

    public static FunctionCall arrayMax(Expression arr) {
        return func("arrayMax", arr);
    }

    public static FunctionCall arrayMax(LambdaExpression fn, Expression arr) {
        return func("arrayMax", fn, arr);
    }

    public static FunctionCall arrayMin(Expression arr) {
        return func("arrayMin", arr);
    }

    public static FunctionCall length(Expression e) {
        return func("length", e);
    }

    public static FunctionCall notEmpty(Expression e) {
        return func("notEmpty", e);
    }

    public static FunctionCall indexOf(Expression arr, Expression e) {
        return func("indexOf", arr, e);
    }

    public static FunctionCall arrayElement(Expression arr, Expression index) {
        return func("arrayElement", arr, index);
    }

    // ==================== Conversions and Scalars ====================

    public static FunctionCall toStringFn(Expression e) {
        return func("toString", e);
    }

    public static FunctionCall toInt64(Expression e) {
        return func("toInt64", e);
    }

    public static FunctionCall toUInt64(Expression e) {
        return func("toUInt64", e);
    }

    public static FunctionCall toFloat64OrZero(Expression e) {
        return func("toFloat64OrZero", e);
    }

    public static FunctionCall toUnixTimestamp64Milli(Expression e) {
        return func("toUnixTimestamp64Milli", e);
    }

    public static FunctionCall toDateTime(Expression e, Expression... tz) {
        return func("toDateTime", prepend(e, tz));
    }

    public static FunctionCall toDateTime64(Expression e, Expression precision, Expression... tz) {
        List<Expression> args = new ArrayList<>();
        args.add(e);
        args.add(precision);
        args.addAll(Arrays.asList(tz));
        return func("toDateTime64", args);
    }

    public static FunctionCall toUUID(Expression e) {
        return func("toUUID", e);
    }

    public static FunctionCall ifFn(Expression cond, Expression then, Expression otherwise) {
        return func("if", cond, then, otherwise);
    }

    public static FunctionCall coalesce(Expression... args) {
        return func("coalesce", args);
    }

    public static FunctionCall greatest(List<? extends Expression> args) {
        return func("greatest", args);
    }

    public static FunctionCall sipHash64(Expression e) {
        return func("sipHash64", e);
    }

    public static FunctionCall dictGetOrNull(String dict, String attr, Expression key) {
        return func("dictGetOrNull", literal(dict), literal(attr), key);
    }

    public static FunctionCall match(Expression e, Expression pattern) {
        return func("match", e, pattern);
    }

    public static FunctionCall multiSearchAny(Expression haystack, Expression needles) {
        return func("multiSearchAny", haystack, needles);
    }

    public static FunctionCall parseDateTimeBestEffort(Expression e) {
        return func("parseDateTimeBestEffort", e);
    }

    public static FunctionCall parseDateTimeBestEffortOrZero(Expression e) {
        return func("parseDateTimeBestEffortOrZero", e);
    }

    public static FunctionCall toDate(Expression e) {
        return func("toDate", e);
    }

    // ==================== JSON ====================

    public static FunctionCall jsonExtractString(Expression column, List<String> keys) {
        return func("JSONExtractString", prepend(column, keyLiterals(keys)));
    }

    public static FunctionCall jsonExtractRaw(Expression column, List<String> keys) {
        return func("JSONExtractRaw", prepend(column, keyLiterals(keys)));
    }

    public static FunctionCall jsonHas(Expression column, List<String> keys) {
        return func("JSONHas", prepend(column, keyLiterals(keys)));
    }

    private static Expression[] keyLiterals(List<String> keys) {
        return keys.stream().map(Literal::of).toArray(Expression[]::new);
    }

    private static List<Expression> prepend(Expression first, Expression[] rest) {
        List<Expression> args = new ArrayList<>(rest.length + 1);
        args.add(first);
        args.addAll(Arrays.asList(rest));
        return args;
    }

    // ==================== Time ====================

    public static FunctionCall toStartOfHour(Expression e, Expression... tz) {
        return func("toStartOfHour", prepend(e, tz));
    }

    public static FunctionCall toStartOfDay(Expression e, Expression... tz) {
        return func("toStartOfDay", prepend(e, tz));
    }

    public static FunctionCall toStartOfWeek(Expression e, Expression mode, Expression... tz) {
        List<Expression> args = new ArrayList<>();
        args.add(e);
        args.add(mode);
        args.addAll(Arrays.asList(tz));
        return func("toStartOfWeek", args);
    }

    public static FunctionCall toStartOfMonth(Expression e, Expression... tz) {
        return func("toStartOfMonth", prepend(e, tz));
    }
}
