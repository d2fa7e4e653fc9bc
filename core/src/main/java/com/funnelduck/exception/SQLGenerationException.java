package com.funnelduck.exception;

/**
 * Exception thrown when query compilation violates an internal invariant.
 *
 * <p>These are programming errors, not user input errors. Common causes:
 * <ul>
 *   <li>Two different values registered under one named parameter</li>
 *   <li>Duplicate CTE names within one statement</li>
 *   <li>An AST node the compiler cannot render</li>
 * </ul>
 *
 * <p>{@link #getUserMessage()} deliberately hides the technical message so that
 * internal state is not leaked to API clients; {@link #getTechnicalMessage()}
 * is for logs.
 *
 * @see com.funnelduck.generator.SQLCompiler
 */
public class SQLGenerationException extends RuntimeException {

    private final Object failedNode;

    /**
     * Creates a SQL generation exception.
     *
     * @param message the error message
     * @param node the AST node being compiled when the error occurred, may be null
     */
    public SQLGenerationException(String message, Object node) {
        super(message + " (node type: " + describe(node) + ")");
        this.failedNode = node;
    }

    /**
     * Creates a SQL generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param node the AST node being compiled when the error occurred, may be null
     */
    public SQLGenerationException(String message, Throwable cause, Object node) {
        super(message + " (node type: " + describe(node) + ")", cause);
        this.failedNode = node;
    }

    private static String describe(Object node) {
        return node != null ? node.getClass().getSimpleName() : "null";
    }

    /**
     * Returns the node that failed to compile.
     *
     * @return the failed node, or null if not available
     */
    public Object getFailedNode() {
        return failedNode;
    }

    /**
     * Returns a generic message suitable for API clients.
     *
     * @return user-facing error message
     */
    public String getUserMessage() {
        return "Failed to build the analytics query. This is an internal error; please contact support.";
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("SQL Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedNode != null) {
            sb.append("Failed Node Type: ").append(failedNode.getClass().getName()).append("\n");
            sb.append("Node String: ").append(failedNode).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
