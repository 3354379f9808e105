package com.phodal.tracegen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.phodal.tracegen.exception.InvalidParameterException;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Ordered, immutable set of span, event, link or resource attributes.
 * <p>
 * Values are restricted to {@code String}, {@code Long}, {@code Double}, {@code Boolean} and
 * homogeneous lists of those. Other integral and floating point numbers are widened on insert.
 */
@EqualsAndHashCode
public final class AttributeSet {

    private static final AttributeSet EMPTY = new AttributeSet(Map.of());

    private final Map<String, Object> values;

    private AttributeSet(Map<String, Object> values) {
        this.values = values;
    }

    public static AttributeSet empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AttributeSet of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        return builder().putAll(raw).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().putAll(values);
    }

    /**
     * Additive merge, entries of {@code other} win on key collision.
     */
    public AttributeSet merge(AttributeSet other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return toBuilder().putAll(other.values).build();
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<String> getString(String key) {
        Object value = values.get(key);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /**
     * Long view of a numeric attribute; numeric strings are accepted as well.
     */
    public Optional<Long> getLong(String key) {
        Object value = values.get(key);
        if (value instanceof Long l) {
            return Optional.of(l);
        }
        if (value instanceof Double d) {
            return Optional.of(d.longValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public void forEach(BiConsumer<String, Object> action) {
        values.forEach(action);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /**
     * Brings a raw value into one of the supported attribute value types.
     */
    static Object normalize(String key, Object value) {
        if (value == null) {
            throw new InvalidParameterException("attribute '" + key + "' has a null value");
        }
        if (value instanceof String || value instanceof Boolean || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Character || value instanceof Enum<?>) {
            return value.toString();
        }
        if (value instanceof Object[] array) {
            return normalizeList(key, List.of(array));
        }
        if (value instanceof List<?> list) {
            return normalizeList(key, list);
        }
        throw new InvalidParameterException("attribute '" + key + "' has unsupported type "
                + value.getClass().getSimpleName());
    }

    private static List<Object> normalizeList(String key, List<?> raw) {
        List<Object> normalized = new ArrayList<>(raw.size());
        Class<?> elementType = null;
        for (Object element : raw) {
            Object value = normalize(key, element);
            if (value instanceof List<?>) {
                throw new InvalidParameterException("attribute '" + key + "' contains a nested array");
            }
            if (elementType == null) {
                elementType = value.getClass();
            } else if (elementType != value.getClass()) {
                throw new InvalidParameterException("attribute '" + key + "' mixes "
                        + elementType.getSimpleName() + " and " + value.getClass().getSimpleName() + " elements");
            }
            normalized.add(value);
        }
        return Collections.unmodifiableList(normalized);
    }

    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            if (key == null || key.isEmpty()) {
                throw new InvalidParameterException("attribute key must not be empty");
            }
            values.put(key, normalize(key, value));
            return this;
        }

        public Builder putIfAbsent(String key, Object value) {
            if (!values.containsKey(key)) {
                put(key, value);
            }
            return this;
        }

        public Builder putAll(Map<String, ?> raw) {
            if (raw != null) {
                raw.forEach(this::put);
            }
            return this;
        }

        public Builder putAll(AttributeSet attributes) {
            if (attributes != null) {
                values.putAll(attributes.values);
            }
            return this;
        }

        public Builder putAllIfAbsent(AttributeSet attributes) {
            if (attributes != null) {
                attributes.values.forEach(values::putIfAbsent);
            }
            return this;
        }

        public boolean containsKey(String key) {
            return values.containsKey(key);
        }

        public Object get(String key) {
            return values.get(key);
        }

        public Builder remove(String key) {
            values.remove(key);
            return this;
        }

        public AttributeSet build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new AttributeSet(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
