package org.ecosysx.runtime.model;

/**
 * Result of one agent update, consumed by the engine after the full sweep.
 */
public enum UpdateOutcome {
    CONTINUE,
    DIE,
    REPRODUCE
}
