package org.ecosysx.analytics;

/**
 * Receives analytics events. All methods default to no-ops.
 */
public interface IAnalyticsListener {

    default void windowCompleted(WindowSummary summary) {
    }

    default void checkpointCreated(Checkpoint checkpoint) {
    }

    default void eventRecorded(AnalyticsEvent event) {
    }
}
