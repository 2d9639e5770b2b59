package org.ecosysx.runtime.social;

import org.ecosysx.runtime.model.Message;
import org.ecosysx.runtime.model.Vector3;

/**
 * A request for help delivered to a peer. Processed at most once by the recipient.
 */
public final class HelpRequest {

    public enum Type { CRITICAL_ENERGY, MEDICAL }

    private final String senderId;
    private final Type type;
    private final double urgency;
    private final Message.Priority priority;
    private final long timestamp;
    private final Vector3 location;
    private boolean processed;

    public HelpRequest(String senderId, Type type, double urgency, Message.Priority priority, long timestamp, Vector3 location) {
        this.senderId = senderId;
        this.type = type;
        this.urgency = urgency;
        this.priority = priority;
        this.timestamp = timestamp;
        this.location = location;
    }

    public String getSenderId() {
        return senderId;
    }

    public Type getType() {
        return type;
    }

    public double getUrgency() {
        return urgency;
    }

    public Message.Priority getPriority() {
        return priority;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Vector3 getLocation() {
        return location;
    }

    public boolean isProcessed() {
        return processed;
    }

    void markProcessed() {
        this.processed = true;
    }
}
