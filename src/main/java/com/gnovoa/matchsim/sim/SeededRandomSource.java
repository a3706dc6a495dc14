package com.gnovoa.matchsim.sim;

import java.util.SplittableRandom;

/**
 * Reproducible random stream: the same seed always yields the same sequence, on any JVM.
 *
 * <p>Not thread-safe. Each match owns its own instance.
 */
public final class SeededRandomSource implements RandomSource {

    private final long seed;
    private final SplittableRandom random;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new SplittableRandom(seed);
    }

    public long seed() { return seed; }

    @Override public int nextIntInclusive(int fromInclusive, int toInclusive) {
        if (toInclusive < fromInclusive) throw new IllegalArgumentException("empty range");
        return random.nextInt(fromInclusive, toInclusive + 1);
    }

    @Override public double nextDouble() {
        return random.nextDouble();
    }
}
