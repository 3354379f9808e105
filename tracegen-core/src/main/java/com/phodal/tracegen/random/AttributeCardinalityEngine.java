package com.phodal.tracegen.random;

import com.phodal.tracegen.exception.InvalidParameterException;
import com.phodal.tracegen.model.AttributeSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces attribute sets whose values are drawn from pools of bounded size, which lets load
 * tests control the number of distinct values a backend has to index per key.
 */
public class AttributeCardinalityEngine {

    public static final int RANDOM_KEY_LENGTH = 15;
    public static final int RANDOM_VALUE_LENGTH = 30;

    private final RandomSource random;

    public AttributeCardinalityEngine(RandomSource random) {
        this.random = random;
    }

    /**
     * Generates {@code count} attributes named {@code <keyPrefix><i>}. Each value is one of
     * {@code <key>-0 .. <key>-<cardinality-1>}; a {@code null} or non-positive cardinality yields
     * unbounded random values.
     *
     * @throws InvalidParameterException if {@code count} is negative
     */
    public AttributeSet generate(int count, Integer cardinality, String keyPrefix) {
        checkCount(count);
        if (count == 0) {
            return AttributeSet.empty();
        }
        String prefix = keyPrefix != null ? keyPrefix : "";
        AttributeSet.Builder attributes = AttributeSet.builder();
        for (int i = 0; i < count; i++) {
            String key = prefix + i;
            if (isBounded(cardinality)) {
                attributes.put(key, key + "-" + random.nextInt(cardinality));
            } else {
                attributes.put(key, random.string(RANDOM_VALUE_LENGTH));
            }
        }
        return attributes.build();
    }

    /**
     * Draws {@code count} random keys, each with its own pool of {@code cardinality} random values.
     * The pool keeps its keys and values for its whole lifetime.
     */
    public AttributePool pool(int count, Integer cardinality, String keyPrefix) {
        checkCount(count);
        String prefix = keyPrefix != null ? keyPrefix : "";
        Map<String, List<String>> values = new LinkedHashMap<>(count * 2);
        while (values.size() < count) {
            String key = prefix + random.string(RANDOM_KEY_LENGTH);
            List<String> pool = new ArrayList<>();
            if (isBounded(cardinality)) {
                for (int j = 0; j < cardinality; j++) {
                    pool.add(random.string(RANDOM_VALUE_LENGTH));
                }
            }
            values.putIfAbsent(key, List.copyOf(pool));
        }
        return new AttributePool(values);
    }

    private static boolean isBounded(Integer cardinality) {
        return cardinality != null && cardinality > 0;
    }

    private static void checkCount(int count) {
        if (count < 0) {
            throw new InvalidParameterException("attribute count must not be negative, got " + count);
        }
    }
}
