package org.ecosysx.runtime.model;

/**
 * Local modifiers of the terrain cell under a position.
 */
public record TerrainEffects(
        double movementSpeedMultiplier,
        double energyBonus,
        double resourceMultiplier,
        double infectionRiskModifier,
        double weatherExposureMultiplier,
        boolean isInShelter,
        double weatherProtection) {

    public static final TerrainEffects NEUTRAL = new TerrainEffects(1.0, 0.0, 1.0, 0.0, 1.0, false, 0.0);
}
