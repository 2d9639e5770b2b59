package org.ecosysx.runtime.model;

import org.ecosysx.runtime.spi.IRandomProvider;

/**
 * Heritable trait set of an agent.
 *
 * @param speed                 maximum movement speed, sampled in [0.5, 2.5).
 * @param size                  body radius, sampled in [0.2, 0.5).
 * @param socialRadius          infection/social neighbourhood radius, sampled in [2, 7).
 * @param infectionResistance   in [0, 1].
 * @param lifespan              maximum age in ticks, an integer in [100, 300) at creation.
 * @param reproductionThreshold energy level enabling reproduction, sampled in [50, 80).
 * @param aggressiveness        in [0, 1].
 * @param forageEfficiency      in [0, 1].
 */
public record Genotype(
        double speed,
        double size,
        double socialRadius,
        double infectionResistance,
        double lifespan,
        double reproductionThreshold,
        double aggressiveness,
        double forageEfficiency) {

    /** Per-trait probability of mutating during reproduction. */
    public static final double MUTATION_PROBABILITY = 0.15;
    public static final double MUTATION_MIN_FACTOR = 0.8;
    public static final double MUTATION_MAX_FACTOR = 1.2;

    public static Genotype random(IRandomProvider rng) {
        return new Genotype(
                rng.nextDouble() * 2 + 0.5,
                rng.nextDouble() * 0.3 + 0.2,
                rng.nextDouble() * 5 + 2,
                rng.nextDouble(),
                Math.floor(rng.nextDouble() * 200 + 100),
                rng.nextDouble() * 30 + 50,
                rng.nextDouble(),
                rng.nextDouble());
    }

    /**
     * Produces an offspring genotype. Each trait independently keeps the parent value or, with
     * probability {@link #MUTATION_PROBABILITY}, is multiplied by a factor drawn from
     * [{@link #MUTATION_MIN_FACTOR}, {@link #MUTATION_MAX_FACTOR}). Unit-interval traits are
     * clamped to [0, 1].
     */
    public Genotype mutate(IRandomProvider rng) {
        return new Genotype(
                mutateTrait(speed, rng),
                mutateTrait(size, rng),
                mutateTrait(socialRadius, rng),
                clampUnit(mutateTrait(infectionResistance, rng)),
                mutateTrait(lifespan, rng),
                mutateTrait(reproductionThreshold, rng),
                clampUnit(mutateTrait(aggressiveness, rng)),
                clampUnit(mutateTrait(forageEfficiency, rng)));
    }

    private static double mutateTrait(double value, IRandomProvider rng) {
        if (rng.nextDouble() < MUTATION_PROBABILITY) {
            double factor = MUTATION_MIN_FACTOR + rng.nextDouble() * (MUTATION_MAX_FACTOR - MUTATION_MIN_FACTOR);
            return value * factor;
        }
        return value;
    }

    private static double clampUnit(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
