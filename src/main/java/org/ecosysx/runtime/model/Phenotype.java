package org.ecosysx.runtime.model;

/**
 * Read-only behavioural projection of a {@link Genotype}.
 */
public record Phenotype(
        double maxSpeed,
        double radius,
        double socialDistance,
        double resistance,
        double aggression,
        double efficiency) {

    public static Phenotype express(Genotype g) {
        return new Phenotype(
                g.speed(),
                g.size(),
                g.socialRadius(),
                g.infectionResistance(),
                g.aggressiveness(),
                g.forageEfficiency());
    }
}
