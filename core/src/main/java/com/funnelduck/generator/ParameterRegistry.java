package com.funnelduck.generator;

import com.funnelduck.exception.SQLGenerationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Collects parameters during one compilation.
 *
 * <p>Not thread-safe; {@link SQLCompiler} creates a fresh registry per call.
 */
final class ParameterRegistry {

    private final String positionalPrefix;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, String> types = new LinkedHashMap<>();
    private int counter;

    ParameterRegistry(String positionalPrefix) {
        this.positionalPrefix = positionalPrefix;
    }

    /**
     * Registers a positional parameter and returns its placeholder.
     */
    String addPositional(String type, Object value) {
        SQLQuoting.validateParamType(type);
        String name = positionalPrefix + counter++;
        bind(name, type, value, null);
        return placeholder(name, type);
    }

    /**
     * Registers a named parameter and returns its placeholder.
     *
     * @throws SQLGenerationException if the name is bound to a different value
     */
    String addNamed(String name, String type, Object value, Object node) {
        SQLQuoting.validateIdentifier(name);
        SQLQuoting.validateParamType(type);
        bind(name, type, value, node);
        return placeholder(name, type);
    }

    /**
     * Merges the parameters of a pre-compiled fragment. Types are not known
     * for spliced values, so only the values are compared.
     */
    void merge(Map<String, Object> params, Object node) {
        for (Map.Entry<String, Object> e : params.entrySet()) {
            SQLQuoting.validateIdentifier(e.getKey());
            bind(e.getKey(), null, e.getValue(), node);
        }
    }

    private void bind(String name, String type, Object value, Object node) {
        if (values.containsKey(name)) {
            Object existing = values.get(name);
            if (!Objects.equals(existing, value)) {
                throw new SQLGenerationException(
                    "Parameter '" + name + "' bound to conflicting values", node);
            }
            String existingType = types.get(name);
            if (type != null && existingType != null && !existingType.equals(type)) {
                throw new SQLGenerationException(
                    "Parameter '" + name + "' used with conflicting types "
                        + existingType + " and " + type, node);
            }
            if (existingType == null && type != null) {
                types.put(name, type);
            }
            return;
        }
        values.put(name, value);
        if (type != null) {
            types.put(name, type);
        }
    }

    private static String placeholder(String name, String type) {
        return "{" + name + ":" + type + "}";
    }

    Map<String, Object> values() {
        return values;
    }
}
