package org.ecosysx.runtime;

/**
 * Snapshot of the engine's control state.
 */
public record EngineState(long tick, boolean running, int agentCount, double speed) {
}
