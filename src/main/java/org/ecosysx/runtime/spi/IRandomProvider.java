package org.ecosysx.runtime.spi;

import java.util.Random;

/**
 * Deterministic source of randomness for the simulation.
 * Implementations are pure with respect to their seed and support derivation of independent
 * child streams, one per agent or subsystem.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Returns a random double in the range [min, max).
     */
    default double nextDouble(double min, double max) {
        return min + nextDouble() * (max - min);
    }

    /**
     * Provides a {@link Random} view for APIs that require one (e.g. {@code Collections.shuffle}).
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a provider deterministically derived from this provider's seed and the given scope/key.
     *
     * @param scope a stable scope name (e.g. "agent", "environment")
     * @param key a stable numeric key (e.g. agent serial id)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
