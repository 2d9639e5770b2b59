package org.ecosysx.runtime.model;

/**
 * Epidemic compartment of an agent. Transitions only move forward:
 * SUSCEPTIBLE to INFECTED to RECOVERED.
 */
public enum HealthStatus {
    SUSCEPTIBLE("Susceptible"),
    INFECTED("Infected"),
    RECOVERED("Recovered");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns true if a transition from this status to {@code next} is permitted.
     */
    public boolean canTransitionTo(HealthStatus next) {
        return next.ordinal() > this.ordinal();
    }
}
