package org.cataphract.runtime.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.cataphract.runtime.spi.IRollSource;

import java.nio.charset.StandardCharsets;

/**
 * Default {@link IRollSource} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Child sources are derived with a stable hash of (parent seed, scope, key), so
 * a draw identified by its campaign seed, tick and context always yields the
 * same dice regardless of what else was rolled before it.
 */
public final class SeededRollSource implements IRollSource {

    private final long seed;
    private final Well19937c rng;

    /**
     * Creates a new seeded roll source.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRollSource(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    @Override
    public long seed() {
        return seed;
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public IRollSource deriveFor(String scope, long key) {
        long h = mix64(seed);
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new SeededRollSource(h);
    }

    /**
     * Hashes a string using the FNV-1a 64-bit algorithm.
     */
    static long hashString(String s) {
        if (s == null) return 0L;
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        long h = 1469598103934665603L; // FNV-1a 64-bit offset basis
        for (byte value : b) {
            h ^= (value & 0xFF);
            h *= 1099511628211L; // FNV-1a prime
        }
        return h;
    }

    /**
     * SplitMix64 finalizer.
     */
    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
