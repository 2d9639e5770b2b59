package org.ecosysx.runtime.model;

/**
 * Local view of the world an agent acts upon.
 *
 * @param energy                  current energy.
 * @param nearbyCount             other agents within the observation radius.
 * @param nearbyInfected          infected agents among them.
 * @param age                     age in ticks.
 * @param nearestResourceDistance ground distance to the closest resource, 100 when none exists.
 * @param status                  own health status.
 */
public record Observation(
        double energy,
        int nearbyCount,
        int nearbyInfected,
        long age,
        double nearestResourceDistance,
        HealthStatus status) {

    public static final double NO_RESOURCE_DISTANCE = 100.0;
}
