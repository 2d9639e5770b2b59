package org.ecosysx.analytics;

import java.util.Map;

/**
 * Point-in-time population statistics, published after every step.
 *
 * @param tick          step the statistics describe.
 * @param population    number of living agents.
 * @param byType        agents by kind label.
 * @param susceptible   susceptible agents.
 * @param infected      infected agents.
 * @param recovered     recovered agents.
 * @param averageEnergy mean energy, 0 for an empty population.
 * @param resources     resources currently available.
 * @param windows       windows finalized so far.
 * @param checkpoints   checkpoints taken so far.
 */
public record Statistics(
        long tick,
        int population,
        Map<String, Integer> byType,
        int susceptible,
        int infected,
        int recovered,
        double averageEnergy,
        int resources,
        int windows,
        int checkpoints) {

    public static final Statistics EMPTY = new Statistics(0, 0, Map.of(), 0, 0, 0, 0.0, 0, 0, 0);

    public Statistics {
        byType = Map.copyOf(byType);
    }
}
