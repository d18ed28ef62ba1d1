package org.pragmatica.symbolic.tree;

import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Variable environment for evaluation. Always includes the built-in constants {@code Pi} and
 * {@code E}; a caller binding with the same name shadows the built-in one.
 */
public final class Bindings {
    private static final ImmutableMap<String, Double> CONSTANTS = ImmutableMap.of("Pi", Math.PI, "E", Math.E);

    private static final Bindings EMPTY = new Bindings(ImmutableMap.of());

    private final ImmutableMap<String, Double> values;

    private Bindings(ImmutableMap<String, Double> values) {
        this.values = values;
    }

    public static Bindings empty() {
        return EMPTY;
    }

    public static Bindings of(Map<String, Double> values) {
        return values.isEmpty()
               ? EMPTY
               : new Bindings(ImmutableMap.copyOf(values));
    }

    public static Bindings of(String name, double value) {
        return new Bindings(ImmutableMap.of(name, value));
    }

    /**
     * Copy of this environment with one more binding; an existing binding of the name is replaced.
     */
    public Bindings with(String name, double value) {
        checkNotNull(name, "name");
        var copy = new HashMap<>(values);
        copy.put(name, value);
        return new Bindings(ImmutableMap.copyOf(copy));
    }

    public Optional<Double> lookup(String name) {
        var value = values.get(name);
        if (value == null) {
            value = CONSTANTS.get(name);
        }
        return Optional.ofNullable(value);
    }

    /**
     * Merged view: built-in constants overridden by caller bindings.
     */
    public Map<String, Double> asMap() {
        var merged = new HashMap<>(CONSTANTS);
        merged.putAll(values);
        return ImmutableMap.copyOf(merged);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
