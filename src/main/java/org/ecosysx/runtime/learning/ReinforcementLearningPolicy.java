package org.ecosysx.runtime.learning;

import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import org.ecosysx.runtime.model.MovementAction;
import org.ecosysx.runtime.model.Observation;
import org.ecosysx.runtime.spi.IRandomProvider;

/**
 * Tabular Q-learning movement policy over a discretized observation space.
 * <p>
 * On every call the previous (state, action) pair, if any, is updated toward
 * {@code reward + gamma * max_a Q(next, a)} and a new action is chosen epsilon-greedily over
 * {@link #ACTIONS}. Exploratory actions are random tuples outside the table; their Q values are
 * never read, so no entry is stored for them.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. Each agent owns its own instance.
 */
public final class ReinforcementLearningPolicy {

    public static final double EPSILON = 0.15;
    public static final double ALPHA = 0.1;
    public static final double GAMMA = 0.9;

    /** The fixed discrete action set the table is defined over. */
    public static final List<MovementAction> ACTIONS = List.of(
            MovementAction.policy(0.3, 0, 0),
            MovementAction.policy(0.6, Math.PI / 2, 0),
            MovementAction.policy(0.9, Math.PI, 0),
            MovementAction.policy(0.6, 3 * Math.PI / 2, 0),
            MovementAction.policy(0.4, 0, 0.3));

    private static final int RANDOM_ACTION = -1;

    private final IRandomProvider random;
    private final Object2DoubleOpenHashMap<String> qTable = new Object2DoubleOpenHashMap<>();
    private String lastState;
    private int lastActionIndex = RANDOM_ACTION;
    private boolean hasLast;

    public ReinforcementLearningPolicy(IRandomProvider random) {
        this.random = random;
        this.qTable.defaultReturnValue(0.0);
    }

    /**
     * Learns from the transition into {@code observation} and selects the next action.
     */
    public MovementAction getAction(Observation observation) {
        String state = discretize(observation);

        if (hasLast && lastActionIndex != RANDOM_ACTION) {
            updateQValue(lastState, lastActionIndex, reward(observation), state);
        }

        MovementAction action;
        if (random.nextDouble() < EPSILON) {
            action = randomAction();
            lastActionIndex = RANDOM_ACTION;
        } else {
            lastActionIndex = bestActionIndex(state);
            action = ACTIONS.get(lastActionIndex);
        }
        lastState = state;
        hasLast = true;
        return action;
    }

    /**
     * Builds the state key {@code energyBucket_nearby_infected_resourceFlag_STATUS}.
     */
    public static String discretize(Observation obs) {
        int energyBucket = (int) Math.floor(obs.energy() / 25);
        int nearbyBucket = Math.min(3, obs.nearbyCount());
        int infectedBucket = Math.min(2, obs.nearbyInfected());
        int resourceBucket = obs.nearestResourceDistance() < 5 ? 0 : 1;
        return energyBucket + "_" + nearbyBucket + "_" + infectedBucket + "_" + resourceBucket + "_" + obs.status().name();
    }

    public static double reward(Observation obs) {
        double reward = obs.energy() * 0.01;
        reward -= obs.nearbyInfected() * 2;
        if (obs.energy() < 50 && obs.nearestResourceDistance() < 10) {
            reward += 5;
        }
        reward -= obs.age() * 0.001;
        return reward;
    }

    public double getQValue(String state, int actionIndex) {
        return qTable.getDouble(key(state, actionIndex));
    }

    public int tableSize() {
        return qTable.size();
    }

    private void updateQValue(String state, int actionIndex, double reward, String nextState) {
        String key = key(state, actionIndex);
        double current = qTable.getDouble(key);
        double updated = current + ALPHA * (reward + GAMMA * maxQValue(nextState) - current);
        qTable.put(key, updated);
    }

    private double maxQValue(String state) {
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < ACTIONS.size(); i++) {
            max = Math.max(max, getQValue(state, i));
        }
        return max;
    }

    // Ties resolve to the lowest index.
    private int bestActionIndex(String state) {
        int best = 0;
        double bestQ = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < ACTIONS.size(); i++) {
            double q = getQValue(state, i);
            if (q > bestQ) {
                bestQ = q;
                best = i;
            }
        }
        return best;
    }

    private MovementAction randomAction() {
        return MovementAction.policy(
                random.nextDouble() * 0.8 + 0.2,
                random.nextDouble() * Math.PI * 2,
                random.nextDouble() * 0.5);
    }

    private static String key(String state, int actionIndex) {
        return state + "#" + actionIndex;
    }
}
