package com.funnelduck.expression;

/**
 * Base interface for all nodes of the analytics expression AST.
 *
 * <p>Expressions are immutable values with structural equality. They carry no
 * rendering logic of their own; {@link com.funnelduck.generator.SQLCompiler}
 * walks the tree and lowers it into parameterized ClickHouse SQL.
 *
 * <p>The hierarchy is closed: every variant is listed in the {@code permits}
 * clause, so the compiler can treat the set of node kinds as exhaustive.
 *
 * <p>Runtime values must enter the tree as {@link PositionalParam} or
 * {@link NamedParam} nodes. {@link Literal} and {@link RawSQLExpression} are
 * reserved for constants and for text that already passed an allow-list check.
 */
public sealed interface Expression
        permits ColumnReference, Literal, PositionalParam, NamedParam, RawSQLExpression,
                RawWithParams, FunctionCall, ParametricCall, LambdaExpression,
                BinaryExpression, AliasExpression, NotExpression, InExpression,
                CaseExpression, SubqueryExpression, TupleExpression, IntervalExpression,
                ArrayLiteral {

    /**
     * Wraps this expression in an alias.
     *
     * @param alias the output name
     * @return the aliased expression
     */
    default AliasExpression as(String alias) {
        return new AliasExpression(this, alias);
    }
}
