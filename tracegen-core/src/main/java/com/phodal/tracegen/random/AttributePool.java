package com.phodal.tracegen.random;

import com.phodal.tracegen.model.AttributeSet;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed keys with a bounded set of candidate values each. An empty candidate list means the key
 * receives a fresh random value on every sample.
 */
public final class AttributePool {

    private static final AttributePool EMPTY = new AttributePool(Map.of());

    private final Map<String, List<String>> values;

    AttributePool(Map<String, List<String>> values) {
        this.values = values;
    }

    public static AttributePool empty() {
        return EMPTY;
    }

    public AttributeSet sample(RandomSource random) {
        if (values.isEmpty()) {
            return AttributeSet.empty();
        }
        AttributeSet.Builder attributes = AttributeSet.builder();
        values.forEach((key, candidates) -> attributes.put(key, candidates.isEmpty()
                ? random.string(AttributeCardinalityEngine.RANDOM_VALUE_LENGTH)
                : random.select(candidates)));
        return attributes.build();
    }

    /**
     * Union of both pools; keys of {@code other} win.
     */
    public AttributePool merge(AttributePool other) {
        if (other == null || other.values.isEmpty()) {
            return this;
        }
        Map<String, List<String>> merged = new LinkedHashMap<>(values);
        merged.putAll(other.values);
        return new AttributePool(merged);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
