package com.phodal.tracegen.generator;

import com.phodal.tracegen.random.RandomSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmissionPolicyTest {

    @Test
    void shouldTreatRatesBelowOneAsProbability() {
        RandomSource random = RandomSource.seeded(123);
        for (EmissionPolicy policy : EmissionPolicy.values()) {
            int emitted = 0;
            for (int i = 0; i < 10_000; i++) {
                emitted += policy.sample(0.5, random);
            }
            assertTrue(emitted >= 4500 && emitted <= 5500, policy + " emitted " + emitted);
        }
    }

    @Test
    void shouldEmitWholeRatesExactly() {
        RandomSource random = RandomSource.seeded(1);
        for (EmissionPolicy policy : EmissionPolicy.values()) {
            assertEquals(3, policy.sample(3.0, random));
            assertEquals(0, policy.sample(0, random));
            assertEquals(0, policy.sample(-1, random));
        }
    }

    @Test
    void shouldUseFractionalRemainderAsExtraProbability() {
        RandomSource random = RandomSource.seeded(9);
        int total = 0;
        for (int i = 0; i < 10_000; i++) {
            int count = EmissionPolicy.FRACTIONAL_REMAINDER.sample(2.5, random);
            assertTrue(count == 2 || count == 3, "Unexpected count " + count);
            total += count;
        }
        double mean = total / 10_000.0;
        assertTrue(mean > 2.45 && mean < 2.55, "Mean should be close to 2.5, got " + mean);
    }

    @Test
    void shouldTruncateLargeRates() {
        RandomSource random = RandomSource.seeded(9);
        for (int i = 0; i < 100; i++) {
            assertEquals(2, EmissionPolicy.TRUNCATE.sample(2.5, random));
        }
    }
}
