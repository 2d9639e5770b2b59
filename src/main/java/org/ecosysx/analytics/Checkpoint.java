package org.ecosysx.analytics;

import java.util.List;

/**
 * Periodic snapshot of the analytics state.
 *
 * @param checkpointStep  step the checkpoint was taken at.
 * @param populationTotal population size.
 * @param windowCount     retained windows.
 * @param panelSample     copy of the panel.
 * @param recentWindows   up to five most recent windows.
 * @param performance     throughput and memory figures.
 */
public record Checkpoint(
        long checkpointStep,
        int populationTotal,
        int windowCount,
        List<PanelEntry> panelSample,
        List<WindowSummary> recentWindows,
        Performance performance) {

    /**
     * @param stepsPerSecond steps recorded per wall-clock second since the previous checkpoint.
     * @param memoryMb       heap in use.
     */
    public record Performance(double stepsPerSecond, long memoryMb) {
    }
}
