package org.ecosysx.runtime.spi;

import java.util.Collection;
import java.util.List;

import org.ecosysx.analytics.Statistics;
import org.ecosysx.runtime.model.Agent;
import org.ecosysx.runtime.model.Resource;

/**
 * Receives engine lifecycle and step events. All methods default to no-ops so hosts only
 * override what they need. Callbacks run on the thread executing the step.
 */
public interface IEngineListener {

    default void agentAdded(Agent agent) {
    }

    default void agentRemoved(Agent agent) {
    }

    default void stateChanged(boolean running) {
    }

    default void stepCompleted(long tick) {
    }

    default void populationUpdated(List<Agent> agents) {
    }

    default void resourcesUpdated(Collection<Resource> resources) {
    }

    default void environmentUpdated(IEnvironment environment) {
    }

    default void statisticsUpdated(Statistics statistics) {
    }

    default void simulationReset() {
    }

    /**
     * Called when the simulation ends on its own, e.g. with reason {@code "extinction"}.
     */
    default void simulationEnded(String reason, long tick) {
    }
}
