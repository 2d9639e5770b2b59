package org.ecosysx.runtime.social;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.ecosysx.runtime.model.HealthStatus;
import org.ecosysx.runtime.model.Message;
import org.ecosysx.runtime.model.Vector3;

/**
 * Bounded per-agent knowledge about other agents: trust, interaction history and received messages.
 * <p>
 * Trust is kept in [0, 1] with 0.5 as the neutral value for unknown agents. The number of
 * remembered agents is capped; on overflow the entries with the oldest {@code lastSeen} tick are
 * evicted first, independent of insertion order.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. Owned and mutated by the tick thread only.
 */
public final class SocialMemory {

    public static final int DEFAULT_MAX_KNOWN_AGENTS = 200;
    public static final int DEFAULT_MAX_MESSAGES = 20;
    public static final double NEUTRAL_TRUST = 0.5;
    public static final double MIN_TRUST = 0.0;
    public static final double MAX_TRUST = 1.0;
    public static final double TRUST_DECAY_RATE = 0.001;
    /** Ticks an agent must go unseen before its trust drifts back toward neutral. */
    public static final long IDLE_TICKS_BEFORE_DECAY = 50;
    public static final double DEFAULT_TRUST_THRESHOLD = 0.4;

    static final int MAX_SHARED_INFO = 50;
    static final int MAX_RECENT_OBSERVATIONS = 10;

    /**
     * A logged interaction or trust adjustment.
     *
     * @param type     interaction kind (message type key or {@code "trust_change"}).
     * @param reason   why a trust change happened, {@code null} for plain interactions.
     * @param change   trust delta, 0 for plain interactions.
     * @param newTrust trust after the change.
     * @param tick     tick of the entry.
     */
    public record SharedInfo(String type, String reason, double change, double newTrust, long tick) {
    }

    /**
     * What an agent saw of a peer at a given tick.
     */
    public record PeerObservation(long tick, Vector3 location, HealthStatus status, double energy) {
    }

    /**
     * Mutable record of what is known about one peer.
     */
    public static final class AgentMemory {
        private final long firstMet;
        private long lastSeen;
        private double trust = NEUTRAL_TRUST;
        private int interactions;
        private int helpGiven;
        private int helpReceived;
        private final Deque<SharedInfo> sharedInfo = new ArrayDeque<>();
        private final Deque<PeerObservation> recentObservations = new ArrayDeque<>();

        AgentMemory(long tick) {
            this.firstMet = tick;
            this.lastSeen = tick;
        }

        public long getFirstMet() {
            return firstMet;
        }

        public long getLastSeen() {
            return lastSeen;
        }

        public double getTrust() {
            return trust;
        }

        public int getInteractions() {
            return interactions;
        }

        public int getHelpGiven() {
            return helpGiven;
        }

        public int getHelpReceived() {
            return helpReceived;
        }

        public List<SharedInfo> getSharedInfo() {
            return List.copyOf(sharedInfo);
        }

        public List<PeerObservation> getRecentObservations() {
            return List.copyOf(recentObservations);
        }

        private void log(SharedInfo info) {
            sharedInfo.addLast(info);
            while (sharedInfo.size() > MAX_SHARED_INFO) {
                sharedInfo.removeFirst();
            }
        }
    }

    private final int maxKnownAgents;
    private final int maxMessages;
    private final Map<String, AgentMemory> knownAgents = new HashMap<>();
    private final Deque<Message> receivedMessages = new ArrayDeque<>();
    private long prunedAgents;

    public SocialMemory() {
        this(DEFAULT_MAX_KNOWN_AGENTS, DEFAULT_MAX_MESSAGES);
    }

    public SocialMemory(int maxKnownAgents, int maxMessages) {
        if (maxKnownAgents <= 0 || maxMessages <= 0) {
            throw new IllegalArgumentException("Memory capacities must be positive");
        }
        this.maxKnownAgents = maxKnownAgents;
        this.maxMessages = maxMessages;
    }

    /**
     * Records an interaction with an agent, creating a neutral entry on first contact.
     *
     * @param agentId         the peer.
     * @param interactionType interaction kind to log, or {@code null} to only bump counters.
     * @param tick            current tick, becomes the entry's {@code lastSeen}.
     */
    public void rememberAgent(String agentId, String interactionType, long tick) {
        AgentMemory memory = getOrCreate(agentId, tick);
        memory.interactions++;
        memory.lastSeen = tick;
        if (interactionType != null) {
            memory.log(new SharedInfo(interactionType, null, 0.0, memory.trust, tick));
        }
        pruneIfNeeded();
    }

    /**
     * Records an observation of a nearby peer.
     */
    public void updateAgentMemory(String agentId, PeerObservation observation) {
        AgentMemory memory = getOrCreate(agentId, observation.tick());
        memory.lastSeen = observation.tick();
        memory.interactions++;
        memory.recentObservations.addLast(observation);
        while (memory.recentObservations.size() > MAX_RECENT_OBSERVATIONS) {
            memory.recentObservations.removeFirst();
        }
        pruneIfNeeded();
    }

    /**
     * Adjusts trust in a known agent, clamped to [0, 1]. Unknown agents are ignored.
     *
     * @return the new trust, or the neutral value when the agent is unknown.
     */
    public double updateTrust(String agentId, double change, String reason, long tick) {
        AgentMemory memory = knownAgents.get(agentId);
        if (memory == null) {
            return NEUTRAL_TRUST;
        }
        memory.trust = clampTrust(memory.trust + change);
        memory.log(new SharedInfo("trust_change", reason, change, memory.trust, tick));
        return memory.trust;
    }

    public double getTrust(String agentId) {
        AgentMemory memory = knownAgents.get(agentId);
        return memory != null ? memory.trust : NEUTRAL_TRUST;
    }

    public boolean isAgentTrusted(String agentId, double threshold) {
        return getTrust(agentId) >= threshold;
    }

    public boolean isAgentTrusted(String agentId) {
        return isAgentTrusted(agentId, DEFAULT_TRUST_THRESHOLD);
    }

    /**
     * Moves trust of every agent unseen for more than {@link #IDLE_TICKS_BEFORE_DECAY} ticks one
     * decay step toward neutral, without overshooting it.
     */
    public void decayTrust(long tick) {
        for (AgentMemory memory : knownAgents.values()) {
            if (tick - memory.lastSeen <= IDLE_TICKS_BEFORE_DECAY) {
                continue;
            }
            if (memory.trust > NEUTRAL_TRUST) {
                memory.trust = Math.max(NEUTRAL_TRUST, memory.trust - TRUST_DECAY_RATE);
            } else if (memory.trust < NEUTRAL_TRUST) {
                memory.trust = Math.min(NEUTRAL_TRUST, memory.trust + TRUST_DECAY_RATE);
            }
        }
    }

    /**
     * Stores a message in the bounded inbox and adjusts trust in a known sender: up when the
     * recipient already trusted the sender above neutral at send time, down otherwise.
     *
     * @param message     the received message.
     * @param senderTrust the recipient's trust in the sender when the message was sent.
     */
    public void receiveMessage(Message message, double senderTrust) {
        receivedMessages.addLast(message);
        while (receivedMessages.size() > maxMessages) {
            receivedMessages.removeFirst();
        }
        if (knownAgents.containsKey(message.sender())) {
            double adjustment = senderTrust > NEUTRAL_TRUST ? 0.02 : -0.01;
            updateTrust(message.sender(), adjustment, "message_received", message.timestamp());
        }
    }

    void recordHelp(String agentId, boolean given) {
        AgentMemory memory = knownAgents.get(agentId);
        if (memory == null) {
            return;
        }
        if (given) {
            memory.helpGiven++;
        } else {
            memory.helpReceived++;
        }
    }

    public double averageTrust() {
        if (knownAgents.isEmpty()) {
            return NEUTRAL_TRUST;
        }
        double total = 0;
        for (AgentMemory memory : knownAgents.values()) {
            total += memory.trust;
        }
        return total / knownAgents.size();
    }

    public Optional<AgentMemory> getMemory(String agentId) {
        return Optional.ofNullable(knownAgents.get(agentId));
    }

    public boolean knows(String agentId) {
        return knownAgents.containsKey(agentId);
    }

    public int size() {
        return knownAgents.size();
    }

    public int getMaxKnownAgents() {
        return maxKnownAgents;
    }

    public List<Message> getReceivedMessages() {
        return Collections.unmodifiableList(new ArrayList<>(receivedMessages));
    }

    /** Total number of entries evicted because of the capacity limit. */
    public long getPrunedAgents() {
        return prunedAgents;
    }

    private AgentMemory getOrCreate(String agentId, long tick) {
        return knownAgents.computeIfAbsent(agentId, id -> new AgentMemory(tick));
    }

    private void pruneIfNeeded() {
        while (knownAgents.size() > maxKnownAgents) {
            String oldestId = null;
            long oldestSeen = Long.MAX_VALUE;
            Iterator<Map.Entry<String, AgentMemory>> it = knownAgents.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, AgentMemory> e = it.next();
                if (e.getValue().lastSeen < oldestSeen) {
                    oldestSeen = e.getValue().lastSeen;
                    oldestId = e.getKey();
                }
            }
            knownAgents.remove(oldestId);
            prunedAgents++;
        }
    }

    private static double clampTrust(double value) {
        return Math.max(MIN_TRUST, Math.min(MAX_TRUST, value));
    }
}
