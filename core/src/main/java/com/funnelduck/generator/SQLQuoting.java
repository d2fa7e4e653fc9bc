package com.funnelduck.generator;

import java.util.regex.Pattern;

/**
 * Utilities for quoting ClickHouse literals and validating the few pieces of
 * text that are allowed into generated SQL unparameterized.
 *
 * <p>Every check here is an allow-list: input is either accepted unchanged or
 * rejected. Nothing is silently stripped or truncated.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteLiteral("O'Reilly");        // 'O\'Reilly'
 *   SQLQuoting.validateIdentifier("step_0");    // ok
 *   SQLQuoting.escapeLikePattern("50%_off");    // 50\%\_off
 * </pre>
 *
 * @see SQLCompiler
 */
public final class SQLQuoting {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private static final Pattern PARAM_TYPE =
        Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*(\\([a-zA-Z0-9_, ]*\\))?");

    private static final Pattern PROPERTY_KEY = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private static final Pattern LIKE_SPECIAL = Pattern.compile("([\\\\%_])");

    private SQLQuoting() {
    }

    /**
     * Quotes a string literal in ClickHouse syntax.
     *
     * <p>Backslashes and single quotes are backslash-escaped.
     *
     * @param value the string value to quote
     * @return quoted literal
     * @throws NullPointerException if value is null
     */
    public static String quoteLiteral(String value) {
        String escaped = value.replace("\\", "\\\\").replace("'", "\\'");
        return "'" + escaped + "'";
    }

    /**
     * Validates that a string is safe to use as an identifier (alias, CTE name,
     * lambda parameter or parameter name).
     *
     * @param identifier the identifier to validate
     * @throws IllegalArgumentException if identifier is null, empty, or
     *         contains invalid characters
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException(
                "Invalid identifier (must start with letter/underscore, " +
                "contain only alphanumeric/underscore): " + identifier);
        }
    }

    /**
     * Validates a ClickHouse type used in a {name:Type} placeholder, such as
     * {@code String}, {@code DateTime64(3)} or {@code Array(String)}.
     *
     * @param type the type to validate
     * @throws IllegalArgumentException if the type is malformed
     */
    public static void validateParamType(String type) {
        if (type == null || !PARAM_TYPE.matcher(type).matches()) {
            throw new IllegalArgumentException("Invalid parameter type: " + type);
        }
    }

    /**
     * Checks a property key (or one dotted segment of it) against the allow-list
     * {@code [A-Za-z0-9_.-]+}.
     *
     * @param key the key to check
     * @return true if the key may be embedded in generated SQL
     */
    public static boolean isSafePropertyKey(String key) {
        return key != null && PROPERTY_KEY.matcher(key).matches();
    }

    /**
     * Escapes LIKE wildcards ({@code %}, {@code _}) and the escape character itself.
     *
     * @param value raw user value
     * @return value matching itself literally inside a LIKE pattern
     */
    public static String escapeLikePattern(String value) {
        return LIKE_SPECIAL.matcher(value).replaceAll("\\\\$1");
    }
}
