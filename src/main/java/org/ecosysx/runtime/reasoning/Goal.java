package org.ecosysx.runtime.reasoning;

import java.util.Comparator;

/**
 * A prioritized goal derived from an agent's situation.
 *
 * @param name             goal identifier, e.g. {@code find_food}.
 * @param priority         coarse priority class.
 * @param urgency          tie-breaker within a priority class, larger is more urgent.
 * @param sociallyInformed true if shared information contributed to the goal.
 */
public record Goal(String name, Priority priority, double urgency, boolean sociallyInformed) {

    public static final String FIND_FOOD = "find_food";
    public static final String AVOID_INFECTION = "avoid_infection";
    public static final String REPRODUCE = "reproduce";
    public static final String EXPLORE = "explore";

    public enum Priority {
        CRITICAL(4),
        HIGH(3),
        MEDIUM(2),
        LOW(1);

        private final int rank;

        Priority(int rank) {
            this.rank = rank;
        }

        public int getRank() {
            return rank;
        }
    }

    /** Orders goals by priority class, then by urgency, both descending. */
    public static final Comparator<Goal> BY_IMPORTANCE = Comparator
            .comparingInt((Goal g) -> g.priority().getRank()).reversed()
            .thenComparing(Comparator.comparingDouble(Goal::urgency).reversed());
}
