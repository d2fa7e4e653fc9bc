package com.funnelduck.exception;

/**
 * Exception thrown when a request cannot be turned into a query.
 *
 * <p>Covers request-shape errors (invalid exclusion ranges, overlapping
 * unordered steps, malformed conversion windows) and injection-prevention
 * errors (property keys outside the allow-list). All of them are raised
 * before any SQL is produced and carry a human-readable reason.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the reason, which is safe to show to API clients as is.
     *
     * @return user-facing error message
     */
    public String getUserMessage() {
        return getMessage();
    }
}
