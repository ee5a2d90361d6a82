package com.thriftgen.generator.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Immutable template model: string keys mapped to typed {@link DictionaryValue}s.
 * Built fresh for every render call.
 */
@EqualsAndHashCode
@ToString
public final class Dictionary {

    private static final Dictionary EMPTY = new Dictionary(Map.of());

    private final Map<String, DictionaryValue> entries;

    private Dictionary(Map<String, DictionaryValue> entries) {
        this.entries = entries;
    }

    public static Dictionary empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<DictionaryValue> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    /**
     * Convenience for tests and callers that expect a scalar under {@code key}.
     */
    public Optional<String> scalar(String key) {
        return get(key)
                .filter(DictionaryValue.Scalar.class::isInstance)
                .map(v -> ((DictionaryValue.Scalar) v).text());
    }

    public Optional<List<Dictionary>> items(String key) {
        return get(key)
                .filter(DictionaryValue.Items.class::isInstance)
                .map(v -> ((DictionaryValue.Items) v).items());
    }

    public Optional<Boolean> flag(String key) {
        return get(key)
                .filter(DictionaryValue.Flag.class::isInstance)
                .map(v -> ((DictionaryValue.Flag) v).value());
    }

    public static final class Builder {

        private final Map<String, DictionaryValue> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, String text) {
            return put(key, new DictionaryValue.Scalar(text));
        }

        public Builder put(String key, boolean flag) {
            return put(key, new DictionaryValue.Flag(flag));
        }

        public Builder put(String key, Dictionary nested) {
            return put(key, new DictionaryValue.Nested(nested));
        }

        public Builder put(String key, List<Dictionary> items) {
            return put(key, new DictionaryValue.Items(items));
        }

        public Builder put(String key, CompiledFragment partial) {
            return put(key, new DictionaryValue.Partial(partial));
        }

        public Builder put(String key, DictionaryValue value) {
            if (key == null || key.isEmpty()) {
                throw new IllegalArgumentException("Dictionary key must not be empty");
            }
            if (value == null) {
                throw new IllegalArgumentException("Dictionary value for '" + key + "' must not be null");
            }
            entries.put(key, value);
            return this;
        }

        /**
         * Adds every entry of {@code other}, overwriting keys already present.
         */
        public Builder putAll(Dictionary other) {
            other.entries.forEach(this::put);
            return this;
        }

        public Dictionary build() {
            return new Dictionary(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
    }
}
