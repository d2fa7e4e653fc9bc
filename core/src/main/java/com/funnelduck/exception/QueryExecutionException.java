package com.funnelduck.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when the event store fails to execute a compiled query.
 *
 * <p>This exception wraps SQLException (or whatever the store client throws)
 * with query context. It is never retried by the engine; retry policy belongs
 * to the store client.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       List&lt;Map&lt;String, Object&gt;&gt; rows = store.query(compiled);
 *   } catch (QueryExecutionException e) {
 *       log.error(e.getUserMessage());
 *       log.debug("Failed SQL: " + e.getFailedSQL());
 *   }
 * </pre>
 *
 * @see com.funnelduck.runtime.EventStore
 */
public class QueryExecutionException extends RuntimeException {

    private static final Pattern UNKNOWN_IDENTIFIER =
        Pattern.compile("Unknown (?:expression or function )?identifier [`']?([^`'\\s]+)");

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Detects a few common ClickHouse error patterns; anything else gets a
     * generic message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();

        if (message == null) {
            return "Query execution failed.";
        }

        if (message.contains("TIMEOUT_EXCEEDED") || message.contains("Timeout exceeded")) {
            return "Query took too long to run. Try a shorter date range or enable sampling.";
        }

        if (message.contains("MEMORY_LIMIT_EXCEEDED") || message.contains("Memory limit")) {
            return "Query requires more memory than available. " +
                   "Try a shorter date range, fewer breakdown values, or enable sampling.";
        }

        Matcher matcher = UNKNOWN_IDENTIFIER.matcher(message);
        if (matcher.find()) {
            return "Query references an unknown column or function '" + matcher.group(1) + "'.";
        }

        return "Query execution failed: " + message;
    }
}
