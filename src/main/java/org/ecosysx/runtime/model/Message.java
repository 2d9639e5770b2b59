package org.ecosysx.runtime.model;

/**
 * Immutable message exchanged between social agents.
 *
 * @param id        unique id within the run.
 * @param sender    sending agent id.
 * @param recipient receiving agent id.
 * @param type      message kind.
 * @param content   payload.
 * @param priority  delivery priority.
 * @param timestamp tick at which the message was sent.
 * @param range     communication range.
 */
public record Message(
        String id,
        String sender,
        String recipient,
        MessageType type,
        Content content,
        Priority priority,
        long timestamp,
        double range) {

    public static final double DEFAULT_RANGE = 10.0;

    public enum Priority { NORMAL, HIGH }

    /**
     * Message payload. Fields not relevant to the message type are zero.
     *
     * @param location   the location the message talks about, may be {@code null}.
     * @param confidence sender's confidence in the information.
     * @param quality    resource quality for tips.
     * @param severity   number of infected agents for warnings.
     */
    public record Content(Vector3 location, double confidence, double quality, int severity) {
    }
}
