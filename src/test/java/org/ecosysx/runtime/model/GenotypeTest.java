package org.ecosysx.runtime.model;

import org.ecosysx.runtime.FixedRandomProvider;
import org.ecosysx.runtime.internal.services.SeededRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class GenotypeTest {

    @Test
    void offspringTraitsStayWithinTheMutationFactor() {
        SeededRandomProvider rng = new SeededRandomProvider(2024L);
        int mutated = 0;

        for (int i = 0; i < 2_000; i++) {
            Genotype parent = Genotype.random(rng);
            Genotype child = parent.mutate(rng);

            mutated += checkTrait(parent.speed(), child.speed());
            mutated += checkTrait(parent.size(), child.size());
            mutated += checkTrait(parent.socialRadius(), child.socialRadius());
            mutated += checkTrait(parent.infectionResistance(), child.infectionResistance());
            mutated += checkTrait(parent.lifespan(), child.lifespan());
            mutated += checkTrait(parent.reproductionThreshold(), child.reproductionThreshold());
            mutated += checkTrait(parent.aggressiveness(), child.aggressiveness());
            mutated += checkTrait(parent.forageEfficiency(), child.forageEfficiency());

            assertThat(child.infectionResistance()).isBetween(0.0, 1.0);
            assertThat(child.aggressiveness()).isBetween(0.0, 1.0);
            assertThat(child.forageEfficiency()).isBetween(0.0, 1.0);
        }

        // 16000 trait draws at a 15% rate
        assertThat(mutated).isBetween(2_000, 2_800);
    }

    private static int checkTrait(double parent, double child) {
        if (child == parent) {
            return 0;
        }
        assertThat(child / parent).isBetween(Genotype.MUTATION_MIN_FACTOR, Genotype.MUTATION_MAX_FACTOR);
        return 1;
    }

    @Test
    void highDrawsKeepTheParentUnchanged() {
        Genotype parent = new Genotype(1.5, 0.3, 4.0, 0.6, 200, 60, 0.4, 0.7);

        assertThat(parent.mutate(new FixedRandomProvider(0.99))).isEqualTo(parent);
    }

    @Test
    void lowDrawsShrinkEveryTraitByTheMinimumFactor() {
        Genotype parent = new Genotype(1.5, 0.3, 4.0, 0.6, 200, 60, 0.4, 0.7);

        Genotype child = parent.mutate(new FixedRandomProvider(0.0));

        assertThat(child.speed()).isCloseTo(1.2, within(1e-12));
        assertThat(child.lifespan()).isCloseTo(160, within(1e-12));
        assertThat(child.infectionResistance()).isCloseTo(0.48, within(1e-12));
        assertThat(child.forageEfficiency()).isCloseTo(0.56, within(1e-12));
    }

    @Test
    void unitTraitsAreClampedAtOne() {
        Genotype parent = new Genotype(1.5, 0.3, 4.0, 1.25, 200, 60, 1.25, 1.25);

        // factor 0.84 still leaves 1.05 before clamping
        Genotype child = parent.mutate(new FixedRandomProvider(0.1));

        assertThat(child.speed()).isCloseTo(1.5 * 0.84, within(1e-12));
        assertThat(child.infectionResistance()).isEqualTo(1.0);
        assertThat(child.aggressiveness()).isEqualTo(1.0);
        assertThat(child.forageEfficiency()).isEqualTo(1.0);
    }
}
