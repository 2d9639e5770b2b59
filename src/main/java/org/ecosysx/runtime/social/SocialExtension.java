package org.ecosysx.runtime.social;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.ecosysx.runtime.reasoning.ReasoningResult;
import org.ecosysx.runtime.spi.IRandomProvider;

/**
 * Social capability attached to agents of kind {@code CAUSAL}.
 * <p>
 * Holds the agent's personality, social memory, bounded shared-knowledge lists and the state of
 * alliances, territory, trading and help exchange. All list growth is capped and evicts the oldest
 * entry first. Behaviour operating on this state lives in {@link CausalBehavior}.
 * <p>
 * The reasoning fields are the only ones touched off the tick thread and are atomic.
 */
public final class SocialExtension {

    public static final int MAX_KNOWN_RESOURCES = 30;
    public static final int MAX_DANGER_ZONES = 40;
    public static final int MAX_HELP_REQUESTS = 50;
    public static final int MAX_ALLIANCES = 3;
    public static final long INFORMATION_DECAY = 300;

    private final Personality personality;
    private final SocialMemory socialMemory;
    private final double territorialInstinct;
    private final double territoryDefensiveness;

    private final Deque<KnownResource> knownResourceLocations = new ArrayDeque<>();
    private final Deque<DangerZone> dangerZones = new ArrayDeque<>();
    private final Deque<HelpRequest> helpRequests = new ArrayDeque<>();

    private final Map<String, Alliance> alliances = new LinkedHashMap<>();
    private final List<AllianceInvitation> allianceInvitations = new ArrayList<>();
    private final List<TradeOffer> tradeOffers = new ArrayList<>();

    int communicationCooldown;
    int helpRequestCooldown;
    int allianceCooldown;
    long lastInfoUpdate;
    Territory territory;
    double tradingReputation = 0.5;
    double helpingReputation = 0.5;
    int messagesSent;
    HelpRequest currentHelpRequest;

    private final AtomicBoolean reasoningInFlight = new AtomicBoolean(false);
    private final AtomicReference<ReasoningResult> queuedResult = new AtomicReference<>();
    private volatile ReasoningResult lastReasoning;
    private int decisionCount;

    public SocialExtension(IRandomProvider rng) {
        this(Personality.random(rng), rng.nextDouble() * 0.8 + 0.2, rng.nextDouble() * 0.9 + 0.1);
    }

    public SocialExtension(Personality personality, double territorialInstinct, double territoryDefensiveness) {
        this.personality = personality;
        this.socialMemory = new SocialMemory();
        this.territorialInstinct = territorialInstinct;
        this.territoryDefensiveness = territoryDefensiveness;
    }

    public Personality getPersonality() {
        return personality;
    }

    public SocialMemory getSocialMemory() {
        return socialMemory;
    }

    public double getTerritorialInstinct() {
        return territorialInstinct;
    }

    public double getTerritoryDefensiveness() {
        return territoryDefensiveness;
    }

    public List<KnownResource> getKnownResourceLocations() {
        return List.copyOf(knownResourceLocations);
    }

    public List<DangerZone> getDangerZones() {
        return List.copyOf(dangerZones);
    }

    public List<HelpRequest> getHelpRequests() {
        return List.copyOf(helpRequests);
    }

    public Collection<Alliance> getAlliances() {
        return Collections.unmodifiableCollection(alliances.values());
    }

    public boolean isAlliedWith(String agentId) {
        return alliances.containsKey(agentId);
    }

    public List<AllianceInvitation> getAllianceInvitations() {
        return List.copyOf(allianceInvitations);
    }

    public List<TradeOffer> getTradeOffers() {
        return List.copyOf(tradeOffers);
    }

    public Territory getTerritory() {
        return territory;
    }

    public double getTradingReputation() {
        return tradingReputation;
    }

    public double getHelpingReputation() {
        return helpingReputation;
    }

    public int getCommunicationCooldown() {
        return communicationCooldown;
    }

    public int getHelpRequestCooldown() {
        return helpRequestCooldown;
    }

    public int getAllianceCooldown() {
        return allianceCooldown;
    }

    public int getMessagesSent() {
        return messagesSent;
    }

    public HelpRequest getCurrentHelpRequest() {
        return currentHelpRequest;
    }

    public ReasoningResult getLastReasoning() {
        return lastReasoning;
    }

    public int getDecisionCount() {
        return decisionCount;
    }

    public boolean isReasoningInFlight() {
        return reasoningInFlight.get();
    }

    /**
     * Marks a reasoning request as outstanding.
     *
     * @return false if a request is already in flight for this agent.
     */
    public boolean tryBeginReasoning() {
        return reasoningInFlight.compareAndSet(false, true);
    }

    /**
     * Publishes a reasoning result and clears the in-flight flag. Safe to call from any thread.
     */
    public void completeReasoning(ReasoningResult result) {
        queuedResult.set(result);
        reasoningInFlight.set(false);
    }

    /**
     * Clears the in-flight flag after a failed or cancelled request. The previously queued action,
     * if any, stays in place.
     */
    public void abortReasoning() {
        reasoningInFlight.set(false);
    }

    /**
     * Takes the queued reasoning result if it was requested before {@code currentTick}.
     * Results are never applied in the tick that requested them.
     */
    public ReasoningResult pollQueuedResult(long currentTick) {
        ReasoningResult result = queuedResult.get();
        if (result == null || result.requestTick() >= currentTick) {
            return null;
        }
        if (queuedResult.compareAndSet(result, null)) {
            lastReasoning = result;
            decisionCount++;
            return result;
        }
        return null;
    }

    void addKnownResource(KnownResource resource) {
        knownResourceLocations.addLast(resource);
        while (knownResourceLocations.size() > MAX_KNOWN_RESOURCES) {
            knownResourceLocations.removeFirst();
        }
    }

    void addDangerZone(DangerZone zone) {
        dangerZones.addLast(zone);
        while (dangerZones.size() > MAX_DANGER_ZONES) {
            dangerZones.removeFirst();
        }
    }

    void addHelpRequest(HelpRequest request) {
        helpRequests.addLast(request);
        while (helpRequests.size() > MAX_HELP_REQUESTS) {
            helpRequests.removeFirst();
        }
    }

    Deque<KnownResource> knownResources() {
        return knownResourceLocations;
    }

    Deque<DangerZone> dangerZonesMutable() {
        return dangerZones;
    }

    Deque<HelpRequest> helpRequestsMutable() {
        return helpRequests;
    }

    Map<String, Alliance> alliancesMutable() {
        return alliances;
    }

    List<AllianceInvitation> invitationsMutable() {
        return allianceInvitations;
    }

    List<TradeOffer> tradeOffersMutable() {
        return tradeOffers;
    }
}
