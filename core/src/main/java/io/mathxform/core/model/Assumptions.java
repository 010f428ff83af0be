package io.mathxform.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Per-request variable assumptions, e.g. {@code theta -> real}. Tags compare case-insensitively.
 * Only used to gate rules that are valid under an assumption.
 */
public final class Assumptions {

    private static final Assumptions NONE = new Assumptions(Map.of());

    private final Map<String, String> tags;

    private Assumptions(Map<String, String> tags) {
        this.tags = tags;
    }

    public static Assumptions none() {
        return NONE;
    }

    /** Copies the given map; {@code null} or empty means no assumptions. Null keys and values are dropped. */
    public static Assumptions of(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return NONE;
        }
        Map<String, String> copy = new LinkedHashMap<>();
        tags.forEach((name, tag) -> {
            if (name != null && tag != null) {
                copy.put(name, tag.trim().toLowerCase(Locale.ROOT));
            }
        });
        return new Assumptions(Collections.unmodifiableMap(copy));
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public Optional<String> tagOf(String variable) {
        return Optional.ofNullable(tags.get(variable));
    }

    /** Returns {@code true} if the variable carries the given tag (case-insensitive). */
    public boolean has(String variable, String tag) {
        return tagOf(variable).map(t -> t.equals(tag.toLowerCase(Locale.ROOT))).orElse(false);
    }

    public Map<String, String> asMap() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Assumptions other && tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return "Assumptions" + tags;
    }
}
