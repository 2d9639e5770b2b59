package org.ecosysx.analytics;

/**
 * State of a sampled agent at the time it entered or was refreshed in the panel.
 */
public record PanelEntry(String id, String type, long age, long energy, String status, double trustAvg, double x, double z) {
}
