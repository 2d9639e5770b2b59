package org.ecosysx.runtime.model;

/**
 * Stress levels in [0, 1] imposed by the current climate.
 */
public record EnvironmentalStress(
        double heatStress,
        double coldStress,
        double stormStress,
        double droughtStress,
        double overallStress) {

    public static final EnvironmentalStress NONE = new EnvironmentalStress(0, 0, 0, 0, 0);
}
