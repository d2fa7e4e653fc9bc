package com.funnelduck.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Result of compiling an AST: ClickHouse SQL with {@code {name:Type}}
 * placeholders, plus the values to bind for each placeholder.
 *
 * <p>The parameter map preserves registration order. Values are passed to the
 * store with typed binding and are never substituted into {@link #sql()}.
 */
public final class CompiledQuery {

    /**
     * Matches a ClickHouse placeholder, capturing the name and the type.
     */
    public static final Pattern PLACEHOLDER =
        Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*):([a-zA-Z_][a-zA-Z0-9_]*(?:\\([a-zA-Z0-9_, ]*\\))?)\\}");

    private final String sql;
    private final Map<String, Object> params;

    public CompiledQuery(String sql, Map<String, Object> params) {
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        this.params = Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(params, "params must not be null")));
    }

    public String sql() {
        return sql;
    }

    /**
     * Returns the parameter values keyed by placeholder name.
     *
     * @return an unmodifiable map in registration order
     */
    public Map<String, Object> params() {
        return params;
    }

    /**
     * Returns the placeholder names in the order they occur in the SQL text.
     * A name used several times is listed several times.
     *
     * @return placeholder names
     */
    public List<String> placeholderNames() {
        List<String> names = new ArrayList<>();
        Matcher m = PLACEHOLDER.matcher(sql);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CompiledQuery)) return false;
        CompiledQuery that = (CompiledQuery) obj;
        return sql.equals(that.sql) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, params);
    }

    @Override
    public String toString() {
        return sql + "\n-- params: " + params;
    }
}
