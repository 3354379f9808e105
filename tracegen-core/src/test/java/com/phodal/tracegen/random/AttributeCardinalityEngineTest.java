package com.phodal.tracegen.random;

import com.phodal.tracegen.exception.InvalidParameterException;
import com.phodal.tracegen.model.AttributeSet;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AttributeCardinalityEngineTest {

    private final AttributeCardinalityEngine engine = new AttributeCardinalityEngine(RandomSource.seeded(42));

    @Test
    void shouldBoundDistinctValuesPerKey() {
        Map<String, Set<Object>> seen = new HashMap<>();
        for (int i = 0; i < 1000; i++) {
            AttributeSet attributes = engine.generate(5, 3, "k");
            assertEquals(5, attributes.size(), "Every call should produce 5 keys");
            attributes.forEach((key, value) -> seen.computeIfAbsent(key, k -> new HashSet<>()).add(value));
        }

        assertEquals(Set.of("k0", "k1", "k2", "k3", "k4"), seen.keySet());
        seen.forEach((key, values) -> {
            assertTrue(values.size() <= 3, "Key " + key + " should have at most 3 values, got " + values);
            values.forEach(value -> assertTrue(((String) value).startsWith(key + "-")));
        });
    }

    @Test
    void shouldProduceRandomValuesWithoutCardinality() {
        AttributeSet first = engine.generate(2, null, "k");
        AttributeSet second = engine.generate(2, 0, "k");

        assertEquals(AttributeCardinalityEngine.RANDOM_VALUE_LENGTH, first.getString("k0").orElseThrow().length());
        assertNotEquals(first, second);
    }

    @Test
    void shouldReturnEmptySetForZeroCount() {
        assertTrue(engine.generate(0, 3, "k").isEmpty());
    }

    @Test
    void shouldRejectNegativeCount() {
        assertThrows(InvalidParameterException.class, () -> engine.generate(-1, 3, "k"));
        assertThrows(InvalidParameterException.class, () -> engine.pool(-1, 3, "k"));
    }

    @Test
    void shouldKeepPoolKeysStableAcrossSamples() {
        RandomSource random = RandomSource.seeded(1);
        AttributePool pool = new AttributeCardinalityEngine(random).pool(4, 2, RandomData.KEY_PREFIX);

        Map<String, Set<Object>> seen = new HashMap<>();
        for (int i = 0; i < 200; i++) {
            pool.sample(random).forEach((key, value) -> seen.computeIfAbsent(key, k -> new HashSet<>()).add(value));
        }

        assertEquals(4, pool.size());
        assertEquals(4, seen.size(), "Samples should reuse the same keys");
        seen.forEach((key, values) -> {
            assertTrue(key.startsWith(RandomData.KEY_PREFIX));
            assertTrue(values.size() <= 2);
        });
    }

    @Test
    void shouldMergePools() {
        RandomSource random = RandomSource.seeded(3);
        AttributeCardinalityEngine engine = new AttributeCardinalityEngine(random);
        AttributePool merged = engine.pool(2, 1, "a.").merge(engine.pool(3, 1, "b."));

        assertEquals(5, merged.size());
        assertSame(AttributePool.empty().merge(AttributePool.empty()), AttributePool.empty());
    }
}
