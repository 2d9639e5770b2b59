package org.ecosysx.analytics;

import java.util.List;

/**
 * Self-contained snapshot of all retained analytics history.
 */
public record AnalyticsExport(
        Metadata metadata,
        Summary simulationSummary,
        List<WindowSummary> recentWindows,
        List<Checkpoint> checkpoints,
        List<PanelEntry> panelSample,
        List<ContactMatrixEntry> contactMatrix) {

    public record Metadata(long currentStep, int windowSize, int checkpointInterval, double stepHours, String exportTimestamp) {
    }

    public record Summary(long totalSteps, int totalWindows, int totalCheckpoints, int panelAgents, int contactMatrixEntries) {
    }
}
