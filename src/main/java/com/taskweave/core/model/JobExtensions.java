package com.taskweave.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, typed extension fields attached to a {@link JobContext}.
 * <p>
 * Callers declare a {@link Key} per field once and read it back with its declared type,
 * so caller-specific data never has to be cast out of an untyped bag.
 */
public final class JobExtensions {

    private static final JobExtensions EMPTY = new JobExtensions(Map.of());

    private final Map<Key<?>, Object> values;

    private JobExtensions(Map<Key<?>, Object> values) {
        this.values = values;
    }

    public static JobExtensions empty() {
        return EMPTY;
    }

    public static <T> JobExtensions of(Key<T> key, T value) {
        return EMPTY.with(key, value);
    }

    /**
     * Returns a copy with {@code key} bound to {@code value}, replacing any previous binding.
     */
    public <T> JobExtensions with(Key<T> key, T value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        var copy = new LinkedHashMap<Key<?>, Object>(values);
        copy.put(key, key.type().cast(value));
        return new JobExtensions(Collections.unmodifiableMap(copy));
    }

    public <T> Optional<T> get(Key<T> key) {
        Object value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(key.type().cast(value));
    }

    public <T> T getOrDefault(Key<T> key, T defaultValue) {
        return get(key).orElse(defaultValue);
    }

    public boolean contains(Key<?> key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "JobExtensions" + values;
    }

    /**
     * Name and value type of one extension field. Two keys are equal when both match.
     *
     * @param name unique field name
     * @param type value type used to check and cast stored values
     */
    public record Key<T>(String name, Class<T> type) {

        public Key {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }

        public static <T> Key<T> of(String name, Class<T> type) {
            return new Key<>(name, type);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
