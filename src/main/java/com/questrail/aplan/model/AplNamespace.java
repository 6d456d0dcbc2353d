package com.questrail.aplan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered name/value mapping, written {@code (name: value ⋄ ...)}.
 *
 * <p>
 * Insertion order is preserved so that serialization is deterministic. Order
 * does not take part in structural equality.
 * </p>
 *
 * <p>
 * Every key must satisfy {@link AplNames#isValidName(String)}.
 * </p>
 */
public record AplNamespace(Map<String, AplValue> entries) implements AplValue
{
    private static final AplNamespace EMPTY = new AplNamespace(Map.of());

    public AplNamespace {
        Objects.requireNonNull(entries, "entries");
        LinkedHashMap<String, AplValue> copy = new LinkedHashMap<>();
        for (Map.Entry<String, AplValue> entry : entries.entrySet()) {
            String name = entry.getKey();
            if (!AplNames.isValidName(name)) {
                throw new IllegalArgumentException("Invalid namespace name: '" + name + "'");
            }
            copy.put(name, Objects.requireNonNull(entry.getValue(), name));
        }
        entries = Collections.unmodifiableMap(copy);
    }

    public static AplNamespace empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<AplValue> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public Kind kind() {
        return Kind.NAMESPACE;
    }

    /**
     * Accumulates entries in insertion order.
     *
     * <p>
     * Putting a name that is already present replaces its value and keeps its
     * original position (last write wins).
     * </p>
     */
    public static final class Builder {
        private final LinkedHashMap<String, AplValue> entries = new LinkedHashMap<>();

        public Builder put(String name, AplValue value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            entries.put(name, value);
            return this;
        }

        public boolean contains(String name) {
            return entries.containsKey(name);
        }

        public AplNamespace build() {
            return entries.isEmpty() ? EMPTY : new AplNamespace(entries);
        }
    }
}
