package org.ecosysx.runtime.contact;

import java.util.List;

import org.ecosysx.runtime.model.Agent;

/**
 * Everything the contact service found in one tick. Consumed by the engine, which applies the
 * transmissions, and by analytics, which only records them.
 *
 * @param tick          tick of the evaluation.
 * @param contactHours  simulated hours of exposure credited to each contact.
 * @param contacts      unordered contact pairs, smaller serial first.
 * @param transmissions successful transmission trials.
 */
public record ContactReport(long tick, double contactHours, List<Contact> contacts, List<Transmission> transmissions) {

    public static ContactReport empty(long tick, double contactHours) {
        return new ContactReport(tick, contactHours, List.of(), List.of());
    }

    public ContactReport {
        contacts = List.copyOf(contacts);
        transmissions = List.copyOf(transmissions);
    }

    /**
     * Two agents within contact distance.
     */
    public record Contact(Agent first, Agent second) {

        /** Unordered pair key built from both serials. */
        public long pairKey() {
            return ContactReport.pairKey(first.getSerial(), second.getSerial());
        }
    }

    /**
     * A successful transmission trial from an infected to a susceptible agent.
     */
    public record Transmission(Agent source, Agent target) {

        public long pairKey() {
            return ContactReport.pairKey(source.getSerial(), target.getSerial());
        }
    }

    public static long pairKey(int serialA, int serialB) {
        int lo = Math.min(serialA, serialB);
        int hi = Math.max(serialA, serialB);
        return ((long) lo << 32) | (hi & 0xffffffffL);
    }
}
