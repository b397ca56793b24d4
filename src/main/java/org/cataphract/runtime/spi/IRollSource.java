package org.cataphract.runtime.spi;

/**
 * Deterministic source of random numbers for rule resolution. Implementations
 * must produce the same sequence for the same seed, and derived sources must
 * depend only on the parent seed and the derivation key.
 */
public interface IRollSource {

    /**
     * @return the seed this source was created from.
     */
    long seed();

    /**
     * Returns a pseudo-random integer in [0, bound).
     * @param bound The upper bound (exclusive).
     * @return A random integer.
     */
    int nextInt(int bound);

    /**
     * Creates an independent source for a named scope, e.g. one per tick or per draw.
     * @param scope A stable scope name.
     * @param key   A key within that scope.
     * @return a new source whose seed is derived from this one.
     */
    IRollSource deriveFor(String scope, long key);
}
