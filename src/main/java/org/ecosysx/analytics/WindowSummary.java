package org.ecosysx.analytics;

import java.util.Map;

/**
 * Immutable aggregate of one finalized analytics window.
 *
 * @param t0          first step of the window.
 * @param dtSteps     number of steps covered.
 * @param population  population at finalization.
 * @param epidemic    infection figures.
 * @param comms       messages sent by type key.
 * @param energy      energy statistics by kind label, from the last step of the window.
 * @param resources   resource figures.
 * @param contacts    ordered contact tallies keyed {@code "<kind>_<kind>"}.
 * @param births      births by kind label.
 * @param deaths      deaths by cause key.
 * @param eventsCount events logged in the window.
 */
public record WindowSummary(
        long t0,
        long dtSteps,
        Population population,
        Epidemic epidemic,
        Map<String, Integer> comms,
        Map<String, EnergyStats> energy,
        Resources resources,
        Map<String, Integer> contacts,
        Map<String, Integer> births,
        Map<String, Integer> deaths,
        int eventsCount) {

    public record Population(int total, Map<String, Integer> byType, Map<String, Integer> byHealth) {
    }

    /**
     * @param totalInfected     number of infected agents at finalization.
     * @param infectiousByType  infected agents by kind label.
     * @param infectionsCaused  successful transmissions by source agent id.
     * @param infectiousHours   accumulated infectious hours by kind label.
     */
    public record Epidemic(
            int totalInfected,
            Map<String, Integer> infectiousByType,
            Map<String, Integer> infectionsCaused,
            Map<String, Double> infectiousHours) {
    }

    public record Resources(int totalAvailable, int consumed) {
    }
}
