package org.ecosysx.runtime.contact;

import java.util.ArrayList;
import java.util.List;

import com.typesafe.config.Config;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.ecosysx.runtime.model.Agent;
import org.ecosysx.runtime.spi.IRandomProvider;
import org.ecosysx.runtime.time.TimeSystem;

/**
 * Finds agent pairs in contact and draws contact-driven transmission.
 * <p>
 * Each unordered pair within {@link #getContactDistance()} is evaluated once per tick. When exactly
 * one side is infected and the other susceptible, one trial with probability
 * {@code hazardProbability(ratePerDay, stepHours)} decides transmission. An agent is infected at
 * most once per tick, and agents infected in this tick do not transmit until the next one. The
 * service never mutates agents; callers apply the reported transmissions.
 */
public final class ContactTransmissionService {

    public static final double DEFAULT_CONTACT_DISTANCE = 8.0;
    public static final double DEFAULT_TRANSMISSION_RATE_PER_DAY = 0.1;

    private final TimeSystem time;
    private final double contactDistance;
    private final double transmissionRatePerDay;
    private final IRandomProvider rng;

    public ContactTransmissionService(TimeSystem time, double contactDistance, double transmissionRatePerDay, IRandomProvider rng) {
        if (!(contactDistance > 0)) {
            throw new IllegalArgumentException("Contact distance must be positive, got " + contactDistance);
        }
        if (!(transmissionRatePerDay >= 0)) {
            throw new IllegalArgumentException("Transmission rate must not be negative, got " + transmissionRatePerDay);
        }
        this.time = time;
        this.contactDistance = contactDistance;
        this.transmissionRatePerDay = transmissionRatePerDay;
        this.rng = rng;
    }

    /**
     * Creates the service from the {@code contact} section of the configuration.
     */
    public static ContactTransmissionService fromConfig(TimeSystem time, Config config, IRandomProvider rng) {
        double distance = config.hasPath("distance") ? config.getDouble("distance") : DEFAULT_CONTACT_DISTANCE;
        double rate = config.hasPath("transmissionRatePerDay") ? config.getDouble("transmissionRatePerDay") : DEFAULT_TRANSMISSION_RATE_PER_DAY;
        return new ContactTransmissionService(time, distance, rate, rng);
    }

    public ContactReport evaluate(List<Agent> agents, long tick) {
        double hours = time.getStepHours();
        if (agents.size() < 2) {
            return ContactReport.empty(tick, hours);
        }
        UniformGrid grid = new UniformGrid(contactDistance);
        for (Agent a : agents) {
            grid.insert(a);
        }
        double probability = transmissionProbability();
        List<ContactReport.Contact> contacts = new ArrayList<>();
        List<ContactReport.Transmission> transmissions = new ArrayList<>();
        IntOpenHashSet newlyInfected = new IntOpenHashSet();
        for (Agent[] pair : grid.pairsWithin(contactDistance)) {
            Agent a = pair[0];
            Agent b = pair[1];
            contacts.add(new ContactReport.Contact(a, b));
            Agent source = null;
            Agent target = null;
            if (a.isInfected() && b.isSusceptible()) {
                source = a;
                target = b;
            } else if (b.isInfected() && a.isSusceptible()) {
                source = b;
                target = a;
            }
            if (source == null || newlyInfected.contains(target.getSerial())) {
                continue;
            }
            if (rng.nextDouble() < probability) {
                transmissions.add(new ContactReport.Transmission(source, target));
                newlyInfected.add(target.getSerial());
            }
        }
        return new ContactReport(tick, hours, contacts, transmissions);
    }

    /**
     * Applies the transmissions of a report.
     *
     * @return the number of agents that became infected.
     */
    public static int apply(ContactReport report) {
        int infected = 0;
        for (ContactReport.Transmission t : report.transmissions()) {
            if (t.target().infect()) {
                infected++;
            }
        }
        return infected;
    }

    public double transmissionProbability() {
        return TimeSystem.hazardProbability(transmissionRatePerDay, time.getStepHours());
    }

    public double getContactDistance() {
        return contactDistance;
    }

    public double getTransmissionRatePerDay() {
        return transmissionRatePerDay;
    }
}
