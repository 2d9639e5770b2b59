package org.ecosysx.runtime.social;

import org.ecosysx.runtime.spi.IRandomProvider;

public enum Personality {
    CAUTIOUS,
    AGGRESSIVE,
    SOCIAL,
    SOLITARY,
    CURIOUS,
    CONSERVATIVE;

    public static Personality random(IRandomProvider rng) {
        Personality[] all = values();
        return all[rng.nextInt(all.length)];
    }

    public String getKey() {
        return name().toLowerCase();
    }
}
