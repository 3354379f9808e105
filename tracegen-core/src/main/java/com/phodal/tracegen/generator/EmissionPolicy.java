package com.phodal.tracegen.generator;

import com.phodal.tracegen.random.RandomSource;

/**
 * Turns a fractional event or link rate into a number of emissions for one span.
 */
public enum EmissionPolicy {

    /**
     * {@code ⌊r⌋} emissions plus one more with probability {@code r - ⌊r⌋}.
     */
    FRACTIONAL_REMAINDER {
        @Override
        public int sample(double rate, RandomSource random) {
            if (!(rate > 0)) {
                return 0;
            }
            int whole = (int) Math.floor(rate);
            double remainder = rate - whole;
            return remainder > 0 && random.nextFloat() < remainder ? whole + 1 : whole;
        }
    },

    /**
     * Rates below one are probabilities, larger rates are truncated.
     */
    TRUNCATE {
        @Override
        public int sample(double rate, RandomSource random) {
            if (!(rate > 0)) {
                return 0;
            }
            if (rate < 1) {
                return random.nextFloat() < rate ? 1 : 0;
            }
            return (int) Math.floor(rate);
        }
    };

    public abstract int sample(double rate, RandomSource random);
}
