package com.phodal.tracegen.random;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Random context shared by generators. Safe for concurrent use; seed it for reproducible runs.
 */
public final class RandomSource {

    private static final char[] LETTERS =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

    private final Random random;

    private RandomSource(Random random) {
        this.random = random;
    }

    public static RandomSource create() {
        return new RandomSource(new Random(new SecureRandom().nextLong()));
    }

    public static RandomSource seeded(long seed) {
        return new RandomSource(new Random(seed));
    }

    /**
     * Uniform int in {@code [0, bound)}.
     */
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    /**
     * Uniform int in {@code [min, max)}; {@code min} when the range is empty.
     */
    public int intBetween(int min, int max) {
        if (max <= min) {
            return min;
        }
        return min + random.nextInt(max - min);
    }

    public long longBetween(long min, long max) {
        if (max <= min) {
            return min;
        }
        return min + (long) (random.nextDouble() * (max - min));
    }

    public float nextFloat() {
        return random.nextFloat();
    }

    public boolean nextBoolean() {
        return random.nextBoolean();
    }

    /**
     * Uniform duration in {@code [min, max)} with nanosecond granularity.
     */
    public Duration duration(Duration min, Duration max) {
        return Duration.ofNanos(longBetween(min.toNanos(), max.toNanos()));
    }

    public <T> T select(List<T> elements) {
        return elements.get(random.nextInt(elements.size()));
    }

    public String string(int length) {
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = LETTERS[random.nextInt(LETTERS.length)];
        }
        return new String(chars);
    }

    public byte[] bytes(int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }

    public String ipAddress() {
        return "192.168." + random.nextInt(255) + "." + random.nextInt(255);
    }

    public int port() {
        return intBetween(8000, 9000);
    }
}
