package org.ecosysx.runtime;

import java.time.Instant;

/**
 * A transient failure that was isolated and did not stop the simulation.
 *
 * @param timestamp when the error occurred.
 * @param code      category, e.g. {@code AGENT_UPDATE_FAILED}.
 * @param message   human-readable description.
 * @param details   additional context.
 */
public record OperationalError(Instant timestamp, String code, String message, String details) {
}
