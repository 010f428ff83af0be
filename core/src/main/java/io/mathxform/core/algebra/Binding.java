package io.mathxform.core.algebra;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a successful pattern match: wildcard name to the subexpression bound at that position.
 * Immutable; {@link #with(String, Expr)} returns a new binding.
 */
public final class Binding {

    private static final Binding EMPTY = new Binding(Map.of());

    private final Map<String, Expr> values;

    private Binding(Map<String, Expr> values) {
        this.values = values;
    }

    public static Binding empty() {
        return EMPTY;
    }

    public static Binding of(Map<String, Expr> values) {
        return new Binding(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public Optional<Expr> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Binding with(String name, Expr value) {
        Map<String, Expr> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new Binding(Collections.unmodifiableMap(copy));
    }

    public Map<String, Expr> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Binding other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Binding" + values;
    }
}
