package com.spectral.nsp.fn;

import com.spectral.nsp.api.NetworkValidationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Registry mapping function type names to factories. Starts with every
 * {@link FunctionType}; callers may register their own types.
 */
public final class FunctionRegistry {

    /** Creates a node function from the properties of a definition entry. */
    @FunctionalInterface
    public interface FunctionFactory {
        NodeFunction create(Map<String, Object> properties);
    }

    private final Map<String, FunctionFactory> factories = new HashMap<>();

    public FunctionRegistry() {
        for (FunctionType type : FunctionType.values()) {
            factories.put(type.key(), type.getFactory());
        }
    }

    public FunctionRegistry register(String type, FunctionFactory factory) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Function type name must not be blank");
        }
        factories.put(type.toLowerCase(Locale.ROOT), factory);
        return this;
    }

    public boolean isRegistered(String type) {
        return type != null && factories.containsKey(type.toLowerCase(Locale.ROOT));
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /**
     * @throws NetworkValidationException if the type is unknown.
     */
    public NodeFunction create(String type, Map<String, Object> properties) {
        FunctionFactory factory = type == null ? null : factories.get(type.toLowerCase(Locale.ROOT));
        if (factory == null) {
            throw new NetworkValidationException("Unknown function type: " + type);
        }
        return factory.create(properties != null ? properties : Collections.emptyMap());
    }

    static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null) {
            return def;
        }
        try {
            return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
        } catch (NumberFormatException e) {
            throw new NetworkValidationException("Property '" + key + "' is not a number: " + v, e);
        }
    }
}
