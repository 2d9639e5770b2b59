package org.ecosysx.analytics;

/**
 * Cumulative contact record of an unordered agent pair. Persists across windows.
 * <p>
 * Agent A is always the one with the smaller serial.
 */
public final class ContactMatrixEntry {

    private final String agentAId;
    private final String agentBId;
    private final String agentAType;
    private final String agentBType;
    private double totalHours;
    private long lastContact;
    private int infectionsTransmitted;

    ContactMatrixEntry(String agentAId, String agentBId, String agentAType, String agentBType, long firstContact) {
        this.agentAId = agentAId;
        this.agentBId = agentBId;
        this.agentAType = agentAType;
        this.agentBType = agentBType;
        this.lastContact = firstContact;
    }

    private ContactMatrixEntry(ContactMatrixEntry other) {
        this(other.agentAId, other.agentBId, other.agentAType, other.agentBType, other.lastContact);
        this.totalHours = other.totalHours;
        this.infectionsTransmitted = other.infectionsTransmitted;
    }

    void addContact(double hours, long tick) {
        totalHours += hours;
        lastContact = tick;
    }

    void addTransmission() {
        infectionsTransmitted++;
    }

    ContactMatrixEntry copy() {
        return new ContactMatrixEntry(this);
    }

    public String getAgentAId() {
        return agentAId;
    }

    public String getAgentBId() {
        return agentBId;
    }

    public String getAgentAType() {
        return agentAType;
    }

    public String getAgentBType() {
        return agentBType;
    }

    public double getTotalHours() {
        return totalHours;
    }

    public long getLastContact() {
        return lastContact;
    }

    public int getInfectionsTransmitted() {
        return infectionsTransmitted;
    }
}
