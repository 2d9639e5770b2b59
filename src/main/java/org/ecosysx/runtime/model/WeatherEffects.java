package org.ecosysx.runtime.model;

/**
 * Multipliers the current weather applies to agent behaviour.
 */
public record WeatherEffects(
        double movementSpeedMultiplier,
        double energyConsumptionMultiplier,
        double infectionSpreadMultiplier,
        double resourceSpawnMultiplier,
        double visibilityRange,
        double shelterNeed) {

    public static final WeatherEffects NEUTRAL = new WeatherEffects(1.0, 1.0, 1.0, 1.0, 1.0, 0.0);
}
