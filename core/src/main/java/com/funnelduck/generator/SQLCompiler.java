package com.funnelduck.generator;

import com.funnelduck.exception.SQLGenerationException;
import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.ArrayLiteral;
import com.funnelduck.expression.BinaryExpression;
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
import com.funnelduck.query.CommonTableExpression;
import com.funnelduck.query.JoinClause;
import com.funnelduck.query.OrderItem;
import com.funnelduck.query.QueryNode;
import com.funnelduck.query.SelectNode;
import com.funnelduck.query.SetOperationNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles the query AST into parameterized ClickHouse SQL.
 *
 * <p>The compiler is stateless: every call builds its own parameter registry,
 * so one instance can be shared between threads. Compilation is deterministic;
 * positional parameters are numbered in the order they appear in the output
 * text, which is a pre-order walk of the tree.
 *
 * <p>Example usage:
 * <pre>
 *   SelectNode node = SelectBuilder.select(Functions.count().as("n"))
 *       .from("events")
 *       .where(Functions.eq(Functions.col("event_name"), Functions.param("String", "signup")))
 *       .build();
 *   CompiledQuery q = new SQLCompiler().compile(node);
 *   // q.sql():    SELECT\n  count() AS n\nFROM events\nWHERE event_name = {p_0:String}
 *   // q.params(): {p_0=signup}
 * </pre>
 *
 * @see CompiledQuery
 */
public class SQLCompiler {

    private static final Logger logger = LoggerFactory.getLogger(SQLCompiler.class);

    /** Prefix of compiler-assigned parameter names. */
    public static final String DEFAULT_POSITIONAL_PREFIX = "p_";

    /**
     * Compiles a query.
     *
     * @param node the query to compile
     * @return the SQL text and its parameters
     * @throws NullPointerException if node is null
     * @throws IllegalArgumentException if an identifier or type fails validation
     * @throws SQLGenerationException if an invariant is violated
     */
    public CompiledQuery compile(QueryNode node) {
        return compile(node, DEFAULT_POSITIONAL_PREFIX);
    }

    /**
     * Compiles a query whose output will be spliced into another compilation
     * through {@link RawWithParams}. A distinct positional prefix keeps the
     * fragment's positional names from clashing with the parent's.
     *
     * @param node the query to compile
     * @param positionalPrefix prefix for positional parameter names, e.g. {@code "coh0_p_"}
     * @return the SQL text and its parameters
     */
    public CompiledQuery compile(QueryNode node, String positionalPrefix) {
        Objects.requireNonNull(node, "node must not be null");
        Compilation c = new Compilation(new ParameterRegistry(positionalPrefix));
        String sql = run(() -> c.query(node), node);
        logger.debug("Compiled query with {} parameters", c.params.values().size());
        return new CompiledQuery(sql, c.params.values());
    }

    /**
     * Compiles a standalone expression.
     *
     * @param expr the expression to compile
     * @return the SQL text and its parameters
     */
    public CompiledQuery compileExpression(Expression expr) {
        return compileExpression(expr, DEFAULT_POSITIONAL_PREFIX);
    }

    public CompiledQuery compileExpression(Expression expr, String positionalPrefix) {
        Objects.requireNonNull(expr, "expr must not be null");
        Compilation c = new Compilation(new ParameterRegistry(positionalPrefix));
        String sql = run(() -> c.expr(expr), expr);
        return new CompiledQuery(sql, c.params.values());
    }

    private static String run(Supplier<String> body, Object node) {
        try {
            return body.get();
        } catch (IllegalArgumentException | SQLGenerationException e) {
            // Validation failures and invariant violations already carry context
            throw e;
        } catch (RuntimeException e) {
            throw new SQLGenerationException("Unexpected error during SQL compilation", e, node);
        }
    }

    /**
     * State of a single compile call.
     */
    private static final class Compilation {

        private final ParameterRegistry params;

        Compilation(ParameterRegistry params) {
            this.params = params;
        }

        // ==================== Queries ====================

        String query(QueryNode node) {
            if (node instanceof SelectNode) {
                return select((SelectNode) node);
            } else if (node instanceof SetOperationNode) {
                return setOperation((SetOperationNode) node);
            }
            throw new SQLGenerationException("Unknown query node", node);
        }

        private String setOperation(SetOperationNode node) {
            List<String> parts = new ArrayList<>();
            for (QueryNode q : node.queries()) {
                parts.add(query(q));
            }
            return String.join("\n" + node.type().keyword() + "\n", parts);
        }

        private String select(SelectNode node) {
            List<String> parts = new ArrayList<>();

            if (!node.ctes().isEmpty()) {
                Set<String> names = new HashSet<>();
                List<String> cteParts = new ArrayList<>();
                for (CommonTableExpression cte : node.ctes()) {
                    SQLQuoting.validateIdentifier(cte.name());
                    if (!names.add(cte.name())) {
                        throw new SQLGenerationException("Duplicate CTE name '" + cte.name() + "'", node);
                    }
                    cteParts.add(cte.name() + " AS (\n" + query(cte.query()) + "\n)");
                }
                parts.add("WITH\n  " + String.join(",\n  ", cteParts));
            }

            List<String> cols = new ArrayList<>();
            for (Expression column : node.columns()) {
                cols.add(expr(column));
            }
            parts.add((node.distinct() ? "SELECT DISTINCT" : "SELECT") + "\n  " + String.join(",\n  ", cols));

            if (node.from() != null) {
                parts.add("FROM " + source(node.from()) + alias(node.fromAlias()));
            }

            if (node.arrayJoin() != null) {
                parts.add("ARRAY JOIN " + expr(node.arrayJoin()));
            }

            for (JoinClause join : node.joins()) {
                String on = join.condition() != null ? " ON " + expr(join.condition()) : "";
                parts.add(join.type().keyword() + " " + source(join.source()) + alias(join.alias()) + on);
            }

            if (!node.prewhere().isEmpty()) {
                parts.add("PREWHERE " + conjunction(node.prewhere()));
            }
            if (!node.where().isEmpty()) {
                parts.add("WHERE " + conjunction(node.where()));
            }
            if (!node.groupBy().isEmpty()) {
                parts.add("GROUP BY " + list(node.groupBy()));
            }
            if (!node.having().isEmpty()) {
                parts.add("HAVING " + conjunction(node.having()));
            }
            if (!node.orderBy().isEmpty()) {
                List<String> items = new ArrayList<>();
                for (OrderItem item : node.orderBy()) {
                    items.add(expr(item.expression()) + " " + item.direction().name());
                }
                parts.add("ORDER BY " + String.join(", ", items));
            }
            if (node.limit() != null) {
                parts.add("LIMIT " + node.limit() + (node.offset() != null ? " OFFSET " + node.offset() : ""));
            } else if (node.offset() != null) {
                parts.add("OFFSET " + node.offset());
            }

            return String.join("\n", parts);
        }

        private String source(Expression source) {
            if (source instanceof SubqueryExpression) {
                return "(" + query(((SubqueryExpression) source).query()) + ")";
            }
            return expr(source);
        }

        private static String alias(String alias) {
            if (alias == null) {
                return "";
            }
            SQLQuoting.validateIdentifier(alias);
            return " AS " + alias;
        }

        private String conjunction(List<Expression> conjuncts) {
            if (conjuncts.size() == 1) {
                return expr(conjuncts.get(0));
            }
            List<String> parts = new ArrayList<>();
            for (Expression c : conjuncts) {
                parts.add(operand(c, BinaryExpression.Operator.AND, false));
            }
            return String.join(" AND ", parts);
        }

        private String list(List<Expression> exprs) {
            List<String> parts = new ArrayList<>();
            for (Expression e : exprs) {
                parts.add(expr(e));
            }
            return String.join(", ", parts);
        }

        // ==================== Expressions ====================

        String expr(Expression e) {
            if (e instanceof ColumnReference) {
                return ((ColumnReference) e).name();
            } else if (e instanceof Literal) {
                return literal((Literal) e);
            } else if (e instanceof PositionalParam) {
                PositionalParam p = (PositionalParam) e;
                return params.addPositional(p.chType(), p.value());
            } else if (e instanceof NamedParam) {
                NamedParam p = (NamedParam) e;
                return params.addNamed(p.name(), p.chType(), p.value(), p);
            } else if (e instanceof RawSQLExpression) {
                return ((RawSQLExpression) e).sql();
            } else if (e instanceof RawWithParams) {
                RawWithParams r = (RawWithParams) e;
                params.merge(r.params(), r);
                return r.sql();
            } else if (e instanceof FunctionCall) {
                FunctionCall f = (FunctionCall) e;
                return f.functionName() + "(" + (f.distinct() ? "DISTINCT " : "") + list(f.arguments()) + ")";
            } else if (e instanceof ParametricCall) {
                ParametricCall f = (ParametricCall) e;
                return f.functionName() + "(" + list(f.parameters()) + ")(" + list(f.arguments()) + ")";
            } else if (e instanceof LambdaExpression) {
                return lambda((LambdaExpression) e);
            } else if (e instanceof BinaryExpression) {
                return binary((BinaryExpression) e);
            } else if (e instanceof AliasExpression) {
                AliasExpression a = (AliasExpression) e;
                SQLQuoting.validateIdentifier(a.alias());
                return expr(a.expression()) + " AS " + a.alias();
            } else if (e instanceof NotExpression) {
                Expression operand = ((NotExpression) e).operand();
                String inner = expr(operand);
                return operand instanceof BinaryExpression ? "NOT (" + inner + ")" : "NOT " + inner;
            } else if (e instanceof InExpression) {
                InExpression in = (InExpression) e;
                return expr(in.operand()) + (in.negated() ? " NOT IN " : " IN ") + expr(in.target());
            } else if (e instanceof CaseExpression) {
                CaseExpression c = (CaseExpression) e;
                List<String> args = new ArrayList<>();
                for (CaseExpression.WhenClause w : c.whenClauses()) {
                    args.add(expr(w.condition()));
                    args.add(expr(w.result()));
                }
                args.add(expr(c.elseValue()));
                return "multiIf(" + String.join(", ", args) + ")";
            } else if (e instanceof SubqueryExpression) {
                return "(" + query(((SubqueryExpression) e).query()) + ")";
            } else if (e instanceof TupleExpression) {
                return "(" + list(((TupleExpression) e).elements()) + ")";
            } else if (e instanceof IntervalExpression) {
                IntervalExpression i = (IntervalExpression) e;
                return "INTERVAL " + expr(i.amount()) + " " + i.unit().name();
            } else if (e instanceof ArrayLiteral) {
                return "[" + list(((ArrayLiteral) e).elements()) + "]";
            }
            throw new SQLGenerationException("Unknown expression node", e);
        }

        private static String literal(Literal l) {
            Object v = l.value();
            if (v instanceof Boolean) {
                return ((Boolean) v) ? "1" : "0";
            }
            if (v instanceof Double || v instanceof Float) {
                double d = ((Number) v).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new IllegalArgumentException("Non-finite numeric literal: " + d);
                }
                return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
            }
            if (v instanceof Number) {
                return v.toString();
            }
            return SQLQuoting.quoteLiteral((String) v);
        }

        private String lambda(LambdaExpression l) {
            l.parameters().forEach(SQLQuoting::validateIdentifier);
            String body = expr(l.body());
            if (l.parameters().size() == 1) {
                return l.parameters().get(0) + " -> " + body;
            }
            return "(" + String.join(", ", l.parameters()) + ") -> " + body;
        }

        private String binary(BinaryExpression b) {
            BinaryExpression.Operator op = b.operator();
            if (op.isLogical()) {
                List<Expression> chain = new ArrayList<>();
                flatten(b, op, chain);
                return chain.stream()
                    .map(operand -> operand(operand, op, false))
                    .collect(Collectors.joining(" " + op.symbol() + " "));
            }
            return operand(b.left(), op, false) + " " + op.symbol() + " " + operand(b.right(), op, true);
        }

        private static void flatten(Expression e, BinaryExpression.Operator op, List<Expression> out) {
            if (e instanceof BinaryExpression && ((BinaryExpression) e).operator() == op) {
                BinaryExpression b = (BinaryExpression) e;
                flatten(b.left(), op, out);
                flatten(b.right(), op, out);
            } else {
                out.add(e);
            }
        }

        private String operand(Expression child, BinaryExpression.Operator parent, boolean rightSide) {
            String sql = expr(child);
            int parentPrecedence = parent.precedence();
            int childPrecedence;
            if (child instanceof BinaryExpression) {
                childPrecedence = ((BinaryExpression) child).operator().precedence();
            } else if (child instanceof NotExpression) {
                childPrecedence = BinaryExpression.Operator.NOT_PRECEDENCE;
            } else {
                return sql;
            }
            boolean wrap = childPrecedence < parentPrecedence
                || (rightSide && childPrecedence == parentPrecedence && !parent.associative());
            return wrap ? "(" + sql + ")" : sql;
        }
    }
}
