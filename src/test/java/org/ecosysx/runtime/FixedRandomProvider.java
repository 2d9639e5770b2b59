package org.ecosysx.runtime;

import java.util.Random;

import org.ecosysx.runtime.spi.IRandomProvider;

/**
 * Test random provider that always returns the same draw. Derived streams are the provider
 * itself, so agents created from it behave identically.
 */
public final class FixedRandomProvider implements IRandomProvider {

    private final double value;

    public FixedRandomProvider(double value) {
        this.value = value;
    }

    @Override
    public int nextInt(int bound) {
        return (int) (value * bound);
    }

    @Override
    public double nextDouble() {
        return value;
    }

    @Override
    public Random asJavaRandom() {
        return new Random(0L);
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        return this;
    }
}
