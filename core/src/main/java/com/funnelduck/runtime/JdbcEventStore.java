package com.funnelduck.runtime;

import com.funnelduck.exception.QueryExecutionException;
import com.funnelduck.generator.CompiledQuery;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * {@link EventStore} over plain JDBC.
 *
 * <p>Every {@code {name:Type}} placeholder outside a quoted literal becomes a
 * {@code ?}, bound in order of appearance; a name used twice is bound twice.
 * Values are bound by their ClickHouse type: {@code Array(T)} through
 * {@link Connection#createArrayOf}, integers as longs, floats as doubles and
 * everything else as strings.
 *
 * <p>Each query borrows one connection and closes it afterwards.
 *
 * <p>Example usage:
 * <pre>
 *   EventStore store = new JdbcEventStore(ConnectionSupplier.of(dataSource));
 *   List&lt;Map&lt;String, Object&gt;&gt; rows = store.query(compiler.compile(node));
 * </pre>
 */
public class JdbcEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    static final String MDC_QUERY_ID = "queryId";

    private final ConnectionSupplier connections;

    public JdbcEventStore(ConnectionSupplier connections) {
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
    }

    /**
     * SQL with {@code ?} markers plus the placeholders they replace.
     */
    static final class PreparedSql {
        final String sql;
        final List<String> names;
        final List<String> types;

        PreparedSql(String sql, List<String> names, List<String> types) {
            this.sql = sql;
            this.names = names;
            this.types = types;
        }
    }

    @Override
    public List<Map<String, Object>> query(CompiledQuery query) {
        Objects.requireNonNull(query, "query must not be null");

        String queryId = "q_" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_QUERY_ID, queryId);
        long queryStartTime = System.nanoTime();
        try {
            PreparedSql prepared = toJdbc(query.sql());
            logger.debug("Executing query {} with {} parameters:\n{}", queryId, prepared.names.size(), query.sql());

            Connection conn = null;
            try {
                conn = connections.getConnection();
                try (PreparedStatement stmt = conn.prepareStatement(prepared.sql)) {
                    for (int i = 0; i < prepared.names.size(); i++) {
                        String name = prepared.names.get(i);
                        if (!query.params().containsKey(name)) {
                            throw new QueryExecutionException("No value bound for parameter '" + name + "'",
                                query.sql());
                        }
                        bind(conn, stmt, i + 1, prepared.types.get(i), query.params().get(name));
                    }
                    try (ResultSet rs = stmt.executeQuery()) {
                        List<Map<String, Object>> rows = readRows(rs);
                        long totalTimeMs = (System.nanoTime() - queryStartTime) / 1_000_000;
                        logger.info("Query {} returned {} rows in {} ms", queryId, rows.size(), totalTimeMs);
                        return rows;
                    }
                }
            } catch (SQLException e) {
                logger.error("Query {} failed: {}", queryId, e.getMessage());
                throw new QueryExecutionException("Failed to execute query: " + e.getMessage(), e, query.sql());
            } finally {
                if (conn != null) {
                    try {
                        conn.close();
                    } catch (SQLException e) {
                        logger.warn("Error closing connection for query {}", queryId, e);
                    }
                }
            }
        } finally {
            MDC.remove(MDC_QUERY_ID);
        }
    }

    // ==================== Placeholder rewriting ====================

    /**
     * Replaces placeholders with {@code ?}, leaving single-quoted literals
     * (with backslash escapes) untouched.
     */
    static PreparedSql toJdbc(String sql) {
        StringBuilder out = new StringBuilder(sql.length());
        List<String> names = new ArrayList<>();
        List<String> types = new ArrayList<>();
        Matcher m = CompiledQuery.PLACEHOLDER.matcher(sql);
        int i = 0;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\'') {
                int end = endOfLiteral(sql, i);
                out.append(sql, i, end);
                i = end;
            } else if (c == '{' && m.region(i, sql.length()).lookingAt()) {
                names.add(m.group(1));
                types.add(m.group(2));
                out.append('?');
                i = m.end();
            } else {
                out.append(c);
                i++;
            }
        }
        return new PreparedSql(out.toString(), names, types);
    }

    private static int endOfLiteral(String sql, int start) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '\'') {
                return i + 1;
            } else {
                i++;
            }
        }
        return sql.length();
    }

    // ==================== Binding ====================

    static void bind(Connection conn, PreparedStatement stmt, int index, String chType, Object value)
            throws SQLException {
        if (value == null) {
            stmt.setObject(index, null);
            return;
        }
        if (chType.startsWith("Array(") && chType.endsWith(")")) {
            String elementType = chType.substring("Array(".length(), chType.length() - 1);
            stmt.setArray(index, conn.createArrayOf(sqlTypeName(elementType), toArray(value)));
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            stmt.setLong(index, ((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            stmt.setDouble(index, ((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            stmt.setBoolean(index, (Boolean) value);
        } else {
            stmt.setString(index, value.toString());
        }
    }

    static String sqlTypeName(String chType) {
        if (chType.startsWith("Int") || chType.startsWith("UInt")) {
            return "BIGINT";
        }
        if (chType.startsWith("Float")) {
            return "DOUBLE";
        }
        if (chType.equals("UUID")) {
            return "UUID";
        }
        return "VARCHAR";
    }

    private static Object[] toArray(Object value) {
        if (value instanceof Object[]) {
            return (Object[]) value;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).toArray();
        }
        throw new IllegalArgumentException("Array parameter must be a collection or array, got "
            + value.getClass().getName());
    }

    // ==================== Results ====================

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int col = 1; col <= columnCount; col++) {
                row.put(meta.getColumnLabel(col), readValue(rs.getObject(col)));
            }
            rows.add(row);
        }
        return rows;
    }

    private static Object readValue(Object value) throws SQLException {
        if (value instanceof Array) {
            Object contents = ((Array) value).getArray();
            if (contents instanceof Object[]) {
                List<Object> items = new ArrayList<>();
                for (Object item : (Object[]) contents) {
                    items.add(readValue(item));
                }
                return items;
            }
            return contents;
        }
        return value;
    }
}
