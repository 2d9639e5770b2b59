package org.ecosysx.runtime.model;

/**
 * Discriminator for agent variants. Update logic is dispatched on this tag.
 */
public enum AgentKind {
    BASIC("Basic", "basic"),
    RL("RL", "rl"),
    CAUSAL("Causal", "causal");

    private final String label;
    private final String idPrefix;

    AgentKind(String label, String idPrefix) {
        this.label = label;
        this.idPrefix = idPrefix;
    }

    /** Display label used in analytics tallies (e.g. {@code "Causal"}). */
    public String getLabel() {
        return label;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public boolean isSocial() {
        return this == CAUSAL;
    }
}
