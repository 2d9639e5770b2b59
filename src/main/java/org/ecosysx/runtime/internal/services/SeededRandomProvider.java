package org.ecosysx.runtime.internal.services;

import org.apache.commons.math3.random.RandomAdaptor;
import org.apache.commons.math3.random.Well19937c;
import org.ecosysx.runtime.spi.IRandomProvider;

import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Child streams are derived by mixing the parent seed with a hashed scope name and a key, so two
 * runs with the same master seed hand every agent the same stream regardless of creation order.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final long seed;
    private final Well19937c rng;
    private Random javaRandom;

    /**
     * Creates a new seeded random provider.
     * @param seed the initial seed.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public Random asJavaRandom() {
        if (javaRandom == null) {
            javaRandom = new RandomAdaptor(rng);
        }
        return javaRandom;
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = splitMix(seed);
        h = splitMix(h ^ splitMix(fnv1a(scope)));
        h = splitMix(h ^ splitMix(key));
        return new SeededRandomProvider(h);
    }

    private static long fnv1a(String s) {
        if (s == null) {
            return 0L;
        }
        long h = FNV_OFFSET_BASIS;
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xFF);
            h *= FNV_PRIME;
        }
        return h;
    }

    // SplitMix64 finalizer
    private static long splitMix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
