package org.ecosysx.runtime.social;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.ecosysx.runtime.AgentStepper;
import org.ecosysx.runtime.TickContext;
import org.ecosysx.runtime.model.Agent;
import org.ecosysx.runtime.model.AgentKind;
import org.ecosysx.runtime.model.HealthStatus;
import org.ecosysx.runtime.model.Message;
import org.ecosysx.runtime.model.MessageType;
import org.ecosysx.runtime.model.Resource;
import org.ecosysx.runtime.model.Vector3;
import org.ecosysx.runtime.reasoning.ReasoningRequest;
import org.ecosysx.runtime.reasoning.ReasoningResult;
import org.ecosysx.runtime.reasoning.ReasoningScheduler;
import org.ecosysx.runtime.reasoning.SocialSummary;
import org.ecosysx.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Social layer of {@link AgentKind#CAUSAL} agents, run after the base step of every surviving
 * causal agent.
 * <p>
 * Per tick, in order: communication, memory of nearby peers, alliances, territory, trade, decay of
 * shared information, help exchange, trust decay and the reasoning trigger. Effects on peers are
 * applied immediately, so agents later in the sweep see them in the same tick.
 * <p>
 * Energy moved between agents is taken from the giver before it is credited, so the receiver never
 * gains more than the giver lost.
 */
public final class CausalBehavior {

    private static final Logger LOG = LoggerFactory.getLogger(CausalBehavior.class);

    static final double COMMUNICATION_PROBABILITY = 0.3;
    static final double COMMUNICATION_RADIUS = 8.0;
    static final int COMMUNICATION_COOLDOWN = 10;
    static final double TIP_RESOURCE_RADIUS = 15.0;
    static final double WARNING_RADIUS = 10.0;
    static final double ALLIANCE_REQUEST_PROBABILITY = 0.1;
    static final double MIN_TRUST_TO_PROCESS = 0.3;

    static final double MEMORY_RADIUS = 12.0;

    static final long INVITATION_EXPIRY = 300;
    static final double ALLIANCE_RADIUS = 15.0;
    static final int ALLIANCE_COOLDOWN = 100;
    static final double ALLIANCE_DECAY = 0.001;

    static final double TERRITORY_SCAN_RADIUS = 15.0;
    static final double TERRITORY_SEPARATION = 20.0;
    static final double PATROL_RADIUS = 10.0;
    static final double PATROL_ARRIVAL = 3.0;

    static final long TRADE_OFFER_EXPIRY = 600;
    static final double TRADE_PROBABILITY = 0.1;
    static final double TRADE_OFFER_ENERGY = 15.0;
    static final double TRADE_WANT_ENERGY = 10.0;
    static final double TRANSFER_EFFICIENCY = 0.8;

    static final long DANGER_ZONE_EXPIRY = 150;
    static final long HELP_REQUEST_EXPIRY = 450;

    static final double HELP_RADIUS = 12.0;
    static final int HELP_REQUEST_COOLDOWN = 50;
    static final int MEDICAL_HELP_TICKS = 10;
    static final int MEDICAL_TIMER_CAP = 35;

    static final double THREAT_RADIUS = 5.0;
    static final double PLAN_TRUST_RADIUS = 6.0;

    private final ReasoningScheduler scheduler;

    public CausalBehavior(ReasoningScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public ReasoningScheduler getScheduler() {
        return scheduler;
    }

    /**
     * Runs the social layer of one causal agent. Agents without a social extension are ignored.
     */
    public void update(Agent agent, TickContext ctx) {
        SocialExtension social = agent.getSocial();
        if (social == null) {
            return;
        }
        communicate(agent, social, ctx);
        rememberNearbyAgents(agent, social, ctx);
        updateAlliances(agent, social, ctx);
        updateTerritory(agent, social, ctx);
        updateTrading(agent, social, ctx);
        decayInformation(social, ctx.getTick());
        processHelpRequests(agent, social, ctx);
        requestHelpIfNeeded(agent, social, ctx);
        social.getSocialMemory().decayTrust(ctx.getTick());
        maybeRequestReasoning(agent, social, ctx);
    }

    /**
     * Called when a planned action replaces the policy action of {@code agent}. Confident plans
     * raise the trust of nearby causal peers in the planner.
     */
    public void onPlanApplied(Agent agent, ReasoningResult result, TickContext ctx) {
        if (result.confidence() <= 0.8) {
            return;
        }
        for (Agent peer : causalPeersWithin(agent, ctx, PLAN_TRUST_RADIUS)) {
            peer.getSocial().getSocialMemory().updateTrust(agent.getId(), 0.01, "good_decision", ctx.getTick());
        }
    }

    // ---------------------------------------------------------------- communication

    private void communicate(Agent agent, SocialExtension social, TickContext ctx) {
        if (social.communicationCooldown > 0) {
            social.communicationCooldown--;
        }
        IRandomProvider rng = agent.getRandom();
        if (social.communicationCooldown > 0 || rng.nextDouble() >= COMMUNICATION_PROBABILITY) {
            return;
        }
        List<Agent> peers = causalPeersWithin(agent, ctx, COMMUNICATION_RADIUS);
        if (peers.isEmpty()) {
            return;
        }
        Agent target = peers.get(rng.nextInt(peers.size()));
        Message message = composeMessage(agent, social, target, ctx);
        if (message == null) {
            return;
        }
        deliver(agent, target, message, ctx);
        social.messagesSent++;
        social.communicationCooldown = COMMUNICATION_COOLDOWN;
    }

    private Message composeMessage(Agent agent, SocialExtension social, Agent target, TickContext ctx) {
        long tick = ctx.getTick();
        if (agent.getEnergy() > 70) {
            Resource nearest = ctx.nearestResource(agent);
            if (nearest != null && agent.distanceTo(nearest.position()) < TIP_RESOURCE_RADIUS) {
                social.addKnownResource(new KnownResource(nearest.position(), 1.0, nearest.quality(), KnownResource.SELF_OBSERVED, tick));
                return newMessage(agent, social, target, MessageType.RESOURCE_TIP,
                        new Message.Content(nearest.position(), 0.8, nearest.quality(), 0), Message.Priority.NORMAL, tick);
            }
        }
        if (agent.getStatus() == HealthStatus.RECOVERED) {
            List<Agent> infected = new ArrayList<>();
            for (Agent other : ctx.getAgents()) {
                if (other != agent && other.isInfected() && agent.distanceTo(other) < WARNING_RADIUS) {
                    infected.add(other);
                }
            }
            if (!infected.isEmpty()) {
                Vector3 hotspot = centroid(infected);
                social.addDangerZone(new DangerZone(hotspot, infected.size(), agent.getId(), tick));
                return newMessage(agent, social, target, MessageType.INFECTION_WARNING,
                        new Message.Content(hotspot, 0.9, 0.0, infected.size()), Message.Priority.HIGH, tick);
            }
        }
        if (agent.getEnergy() > 50 && agent.getRandom().nextDouble() < ALLIANCE_REQUEST_PROBABILITY) {
            return newMessage(agent, social, target, MessageType.ALLIANCE_REQUEST,
                    new Message.Content(agent.getPosition(), 0.6, 0.0, 0), Message.Priority.NORMAL, tick);
        }
        return null;
    }

    private static Message newMessage(Agent sender, SocialExtension social, Agent target, MessageType type,
                                      Message.Content content, Message.Priority priority, long tick) {
        String id = sender.getId() + "-m" + social.messagesSent;
        return new Message(id, sender.getId(), target.getId(), type, content, priority, tick, Message.DEFAULT_RANGE);
    }

    private void deliver(Agent sender, Agent recipient, Message message, TickContext ctx) {
        long tick = ctx.getTick();
        SocialMemory senderMemory = sender.getSocial().getSocialMemory();
        SocialMemory recipientMemory = recipient.getSocial().getSocialMemory();
        senderMemory.rememberAgent(recipient.getId(), message.type().getKey(), tick);

        double trustAtSend = recipientMemory.getTrust(sender.getId());
        recipientMemory.rememberAgent(sender.getId(), message.type().getKey(), tick);
        recipientMemory.receiveMessage(message, trustAtSend);

        double trust = recipientMemory.getTrust(sender.getId());
        if (trust >= MIN_TRUST_TO_PROCESS) {
            processContent(sender, recipient, message, trust, tick);
        }
        double change = message.content().confidence() > 0.7 ? 0.05 : -0.02;
        recipientMemory.updateTrust(sender.getId(), change, "message_quality", tick);
        ctx.recordMessage(message.type());
    }

    private static void processContent(Agent sender, Agent recipient, Message message, double trust, long tick) {
        SocialExtension target = recipient.getSocial();
        Message.Content content = message.content();
        switch (message.type()) {
            case RESOURCE_TIP -> {
                if (trust > 0.4) {
                    target.addKnownResource(new KnownResource(content.location(), content.confidence() * trust,
                            content.quality(), sender.getId(), tick));
                }
            }
            case INFECTION_WARNING -> {
                if (trust > 0.5) {
                    target.addDangerZone(new DangerZone(content.location(), content.severity(), sender.getId(), tick));
                }
            }
            case ALLIANCE_REQUEST -> {
                if (trust > 0.6 && recipient.getEnergy() > 40) {
                    target.getSocialMemory().updateTrust(sender.getId(), 0.1, "alliance_interest", tick);
                    sender.getSocial().getSocialMemory().updateTrust(recipient.getId(), 0.1, "alliance_interest", tick);
                }
            }
            default -> {
                // help requests and trade offers are delivered through their own channels
            }
        }
    }

    // ---------------------------------------------------------------- memory

    private static void rememberNearbyAgents(Agent agent, SocialExtension social, TickContext ctx) {
        long tick = ctx.getTick();
        for (Agent other : ctx.getAgents()) {
            if (other != agent && agent.distanceTo(other) < MEMORY_RADIUS) {
                social.getSocialMemory().updateAgentMemory(other.getId(),
                        new SocialMemory.PeerObservation(tick, other.getPosition(), other.getStatus(), other.getEnergy()));
            }
        }
    }

    // ---------------------------------------------------------------- alliances

    private void updateAlliances(Agent agent, SocialExtension social, TickContext ctx) {
        long tick = ctx.getTick();
        if (social.allianceCooldown > 0) {
            social.allianceCooldown--;
        }
        acceptInvitations(agent, social, ctx);

        if (social.allianceCooldown == 0 && social.alliancesMutable().size() < SocialExtension.MAX_ALLIANCES) {
            Agent candidate = findAllianceCandidate(agent, social, ctx);
            if (candidate != null) {
                SocialExtension target = candidate.getSocial();
                boolean alreadyInvited = target.invitationsMutable().stream().anyMatch(i -> i.fromId().equals(agent.getId()));
                if (!alreadyInvited) {
                    target.invitationsMutable().add(new AllianceInvitation(agent.getId(), tick));
                    ctx.recordMessage(MessageType.ALLIANCE_REQUEST);
                }
                social.allianceCooldown = ALLIANCE_COOLDOWN;
            }
        }
        maintainAlliances(agent, social, ctx);
    }

    private static void acceptInvitations(Agent agent, SocialExtension social, TickContext ctx) {
        long tick = ctx.getTick();
        Iterator<AllianceInvitation> it = social.invitationsMutable().iterator();
        while (it.hasNext()) {
            AllianceInvitation invitation = it.next();
            if (tick - invitation.timestamp() > INVITATION_EXPIRY) {
                it.remove();
                continue;
            }
            Agent inviter = ctx.findAgent(invitation.fromId());
            if (inviter == null || inviter.getSocial() == null) {
                it.remove();
                continue;
            }
            SocialExtension other = inviter.getSocial();
            if (social.getSocialMemory().getTrust(inviter.getId()) > 0.6
                    && agent.distanceTo(inviter) < ALLIANCE_RADIUS
                    && agent.getEnergy() < 70
                    && social.alliancesMutable().size() < SocialExtension.MAX_ALLIANCES
                    && other.alliancesMutable().size() < SocialExtension.MAX_ALLIANCES
                    && !social.isAlliedWith(inviter.getId())) {
                social.alliancesMutable().put(inviter.getId(), new Alliance(inviter.getId(), tick));
                other.alliancesMutable().put(agent.getId(), new Alliance(agent.getId(), tick));
                social.getSocialMemory().updateTrust(inviter.getId(), 0.1, "alliance_formed", tick);
                other.getSocialMemory().updateTrust(agent.getId(), 0.1, "alliance_formed", tick);
                it.remove();
                LOG.debug("Alliance formed between {} and {} at tick {}", agent.getId(), inviter.getId(), tick);
            }
        }
    }

    private static Agent findAllianceCandidate(Agent agent, SocialExtension social, TickContext ctx) {
        for (Agent other : causalPeersWithin(agent, ctx, ALLIANCE_RADIUS)) {
            SocialExtension peer = other.getSocial();
            if (social.isAlliedWith(other.getId())
                    || !social.getSocialMemory().isAgentTrusted(other.getId(), 0.5)
                    || peer.alliancesMutable().size() >= SocialExtension.MAX_ALLIANCES
                    || peer.getSocialMemory().getTrust(agent.getId()) <= 0.4) {
                continue;
            }
            if (agent.getEnergy() < 50 || other.getEnergy() < 50) {
                return other;
            }
        }
        return null;
    }

    private static void maintainAlliances(Agent agent, SocialExtension social, TickContext ctx) {
        Iterator<Map.Entry<String, Alliance>> it = social.alliancesMutable().entrySet().iterator();
        while (it.hasNext()) {
            Alliance alliance = it.next().getValue();
            Agent partner = ctx.findAgent(alliance.getPartnerId());
            if (partner == null) {
                it.remove();
                LOG.debug("Alliance of {} with {} dissolved: partner gone", agent.getId(), alliance.getPartnerId());
                continue;
            }
            if (agent.getEnergy() > 70 && partner.getEnergy() < 30) {
                double amount = Math.min(10, (agent.getEnergy() - 70) * Alliance.SHARING_RATE);
                double paid = -agent.addEnergy(-amount);
                partner.addEnergy(paid);
                alliance.recordShared(paid);
                alliance.adjustStrength(0.02);
            }
            alliance.adjustStrength(-ALLIANCE_DECAY);
            if (alliance.isBroken()) {
                it.remove();
                if (partner.getSocial() != null) {
                    partner.getSocial().alliancesMutable().remove(agent.getId());
                }
                LOG.debug("Alliance of {} with {} dissolved: strength {}", agent.getId(), partner.getId(), alliance.getStrength());
            }
        }
    }

    // ---------------------------------------------------------------- territory

    private static void updateTerritory(Agent agent, SocialExtension social, TickContext ctx) {
        long tick = ctx.getTick();
        if (social.territory == null) {
            if (social.getTerritorialInstinct() > 0.5 && agent.getEnergy() > 60) {
                tryClaimTerritory(agent, social, ctx);
            }
            return;
        }
        Territory territory = social.territory;
        for (Agent other : ctx.getAgents()) {
            if (other == agent || social.isAlliedWith(other.getId())) {
                continue;
            }
            double distance = agent.distanceTo(other);
            if (distance >= territory.getRadius()) {
                continue;
            }
            double threat = (territory.getRadius() - distance) / territory.getRadius();
            if (threat > 0.5 && social.getTerritoryDefensiveness() > 0.6) {
                AgentStepper.steerToward(agent, other.getPosition(), social.getTerritoryDefensiveness() * threat * 0.8);
                social.getSocialMemory().updateTrust(other.getId(), -0.05, "territory_intrusion", tick);
            }
        }
        AgentStepper.steerToward(agent, territory.currentPatrolPoint(), 0.3);
        if (agent.distanceTo(territory.currentPatrolPoint()) < PATROL_ARRIVAL) {
            territory.advancePatrol();
        }
    }

    private static void tryClaimTerritory(Agent agent, SocialExtension social, TickContext ctx) {
        List<Resource> cluster = new ArrayList<>();
        for (Resource r : ctx.getEnvironment().getResources()) {
            if (agent.distanceTo(r.position()) < TERRITORY_SCAN_RADIUS) {
                cluster.add(r);
            }
        }
        if (cluster.size() < 2) {
            return;
        }
        double x = 0;
        double z = 0;
        for (Resource r : cluster) {
            x += r.position().x();
            z += r.position().z();
        }
        Vector3 center = new Vector3(x / cluster.size(), 1.0, z / cluster.size());
        for (Agent other : ctx.getAgents()) {
            SocialExtension peer = other.getSocial();
            if (other != agent && peer != null && peer.territory != null
                    && peer.territory.getCenter().distanceXZ(center) < TERRITORY_SEPARATION) {
                return;
            }
        }
        social.territory = new Territory(center, Territory.DEFAULT_RADIUS, ctx.getTick(), PATROL_RADIUS * 0.8);
        LOG.debug("{} claimed territory at ({}, {}) at tick {}", agent.getId(), center.x(), center.z(), ctx.getTick());
    }

    // ---------------------------------------------------------------- trading

    private static void updateTrading(Agent agent, SocialExtension social, TickContext ctx) {
        long tick = ctx.getTick();
        SocialMemory memory = social.getSocialMemory();
        social.tradeOffersMutable().removeIf(o -> tick - o.getTimestamp() > TRADE_OFFER_EXPIRY);

        for (TradeOffer offer : social.tradeOffersMutable()) {
            if (offer.isEvaluated()) {
                continue;
            }
            offer.markEvaluated();
            Agent trader = ctx.findAgent(offer.getTraderId());
            if (trader == null || trader.getSocial() == null) {
                continue;
            }
            double trust = memory.getTrust(trader.getId());
            double need = (80 - agent.getEnergy()) / 80;
            double value = offer.getOfferEnergy() / 20;
            if (trust > 0.4 && need > 0.6 && value > need * 0.8) {
                double paid = -trader.addEnergy(-offer.getOfferEnergy());
                agent.addEnergy(paid * TRANSFER_EFFICIENCY);
                social.tradingReputation += 0.05;
                trader.getSocial().tradingReputation += 0.05;
                memory.updateTrust(trader.getId(), 0.03, "trade_completed", tick);
                trader.getSocial().getSocialMemory().updateTrust(agent.getId(), 0.03, "trade_completed", tick);
            } else {
                memory.updateTrust(trader.getId(), -0.01, "trade_declined", tick);
            }
        }

        IRandomProvider rng = agent.getRandom();
        if (agent.getEnergy() > 70 && rng.nextDouble() < TRADE_PROBABILITY) {
            List<Agent> partners = new ArrayList<>();
            for (Agent other : causalPeersWithin(agent, ctx, COMMUNICATION_RADIUS)) {
                if (memory.getTrust(other.getId()) > 0.3 && other.getEnergy() < 50) {
                    partners.add(other);
                }
            }
            if (!partners.isEmpty()) {
                Agent partner = partners.get(rng.nextInt(partners.size()));
                partner.getSocial().tradeOffersMutable().add(new TradeOffer(agent.getId(), TRADE_OFFER_ENERGY, TRADE_WANT_ENERGY, tick));
                ctx.recordMessage(MessageType.TRADE_OFFER);
            }
        }
    }

    // ---------------------------------------------------------------- information decay

    static void decayInformation(SocialExtension social, long tick) {
        Iterator<KnownResource> resources = social.knownResources().iterator();
        List<KnownResource> kept = new ArrayList<>();
        while (resources.hasNext()) {
            KnownResource r = resources.next();
            long age = tick - r.timestamp();
            if (age <= SocialExtension.INFORMATION_DECAY) {
                kept.add(r.withConfidence(Math.max(0.1, r.confidence() * (1.0 - age / 600.0))));
            }
        }
        social.knownResources().clear();
        social.knownResources().addAll(kept);

        social.dangerZonesMutable().removeIf(z -> tick - z.timestamp() >= DANGER_ZONE_EXPIRY);
        social.helpRequestsMutable().removeIf(h -> tick - h.getTimestamp() >= HELP_REQUEST_EXPIRY);
        if (social.helpRequestCooldown > 0) {
            social.helpRequestCooldown--;
        }
    }

    // ---------------------------------------------------------------- help

    private static void processHelpRequests(Agent agent, SocialExtension social, TickContext ctx) {
        long tick = ctx.getTick();
        SocialMemory memory = social.getSocialMemory();
        for (HelpRequest request : social.helpRequestsMutable()) {
            if (request.isProcessed()) {
                continue;
            }
            Agent requester = ctx.findAgent(request.getSenderId());
            if (requester == null || agent.distanceTo(requester) >= HELP_RADIUS) {
                continue;
            }
            double trust = memory.getTrust(requester.getId());
            if (agent.getEnergy() <= 60 || trust <= 0.5 || agent.getRandom().nextDouble() >= trust) {
                continue;
            }
            if (request.getType() == HelpRequest.Type.MEDICAL && agent.getStatus() == HealthStatus.RECOVERED) {
                if (requester.isInfected()) {
                    requester.setInfectionTimer(Math.min(requester.getInfectionTimer() + MEDICAL_HELP_TICKS, MEDICAL_TIMER_CAP));
                }
                social.helpingReputation += 0.08;
            } else {
                double share = Math.min(20, agent.getEnergy() * 0.2);
                double paid = -agent.addEnergy(-share);
                requester.addEnergy(paid * TRANSFER_EFFICIENCY);
                social.helpingReputation += 0.1;
            }
            request.markProcessed();
            memory.recordHelp(requester.getId(), true);
            memory.updateTrust(requester.getId(), 0.1, "helped", tick);
            if (requester.getSocial() != null) {
                SocialMemory requesterMemory = requester.getSocial().getSocialMemory();
                requesterMemory.recordHelp(agent.getId(), false);
                requesterMemory.updateTrust(agent.getId(), 0.15, "received_help", tick);
            }
            LOG.debug("{} helped {} ({}) at tick {}", agent.getId(), requester.getId(), request.getType(), tick);
        }
    }

    private static void requestHelpIfNeeded(Agent agent, SocialExtension social, TickContext ctx) {
        boolean lowEnergy = agent.getEnergy() < 20;
        boolean sick = agent.isInfected() && agent.getInfectionTimer() > 20;
        if (social.helpRequestCooldown > 0 || !(lowEnergy || sick)) {
            return;
        }
        double urgency = 0;
        if (agent.getEnergy() < 10) {
            urgency += 0.8;
        } else if (agent.getEnergy() < 30) {
            urgency += 0.4;
        }
        if (agent.isInfected()) {
            urgency += 0.6;
        }
        urgency = Math.min(1.0, urgency);
        HelpRequest.Type type = lowEnergy ? HelpRequest.Type.CRITICAL_ENERGY : HelpRequest.Type.MEDICAL;
        Message.Priority priority = urgency > 0.7 ? Message.Priority.HIGH : Message.Priority.NORMAL;
        long tick = ctx.getTick();

        for (Agent peer : causalPeersWithin(agent, ctx, HELP_RADIUS)) {
            if (!social.getSocialMemory().isAgentTrusted(peer.getId(), SocialMemory.DEFAULT_TRUST_THRESHOLD)) {
                continue;
            }
            peer.getSocial().addHelpRequest(new HelpRequest(agent.getId(), type, urgency, priority, tick, agent.getPosition()));
            ctx.recordMessage(MessageType.HELP_REQUEST);
        }
        social.currentHelpRequest = new HelpRequest(agent.getId(), type, urgency, priority, tick, agent.getPosition());
        social.helpRequestCooldown = HELP_REQUEST_COOLDOWN;
    }

    // ---------------------------------------------------------------- reasoning

    private void maybeRequestReasoning(Agent agent, SocialExtension social, TickContext ctx) {
        if (!scheduler.isEnabled() || social.isReasoningInFlight()) {
            return;
        }
        IRandomProvider rng = agent.getRandom();
        if (rng.nextDouble() >= scheduler.getFrequency()) {
            return;
        }
        int threats = 0;
        for (Agent other : ctx.getAgents()) {
            if (other != agent && other.isInfected() && agent.distanceTo(other) < THREAT_RADIUS) {
                threats++;
            }
        }
        ReasoningRequest request = new ReasoningRequest(
                agent.getId(),
                ctx.getTick(),
                social.getPersonality(),
                ctx.observe(agent),
                threats,
                agent.getReproductionCooldown(),
                summarize(social, ctx.getTick()),
                rng.nextDouble());
        scheduler.submit(social, request);
    }

    static SocialSummary summarize(SocialExtension social, long tick) {
        int resources = 0;
        for (KnownResource r : social.knownResources()) {
            if (tick - r.timestamp() < SocialExtension.INFORMATION_DECAY && r.confidence() > 0.3) {
                resources++;
            }
        }
        int dangers = 0;
        for (DangerZone z : social.dangerZonesMutable()) {
            if (tick - z.timestamp() < DANGER_ZONE_EXPIRY) {
                dangers++;
            }
        }
        int urgent = 0;
        for (HelpRequest h : social.helpRequestsMutable()) {
            if (!h.isProcessed() && h.getPriority() == Message.Priority.HIGH) {
                urgent++;
            }
        }
        return new SocialSummary(resources, dangers, urgent);
    }

    // ---------------------------------------------------------------- helpers

    private static List<Agent> causalPeersWithin(Agent agent, TickContext ctx, double radius) {
        List<Agent> peers = new ArrayList<>();
        for (Agent other : ctx.getAgents()) {
            if (other != agent && other.getSocial() != null && agent.distanceTo(other) < radius) {
                peers.add(other);
            }
        }
        return peers;
    }

    private static Vector3 centroid(List<Agent> agents) {
        double x = 0;
        double z = 0;
        for (Agent a : agents) {
            x += a.getX();
            z += a.getZ();
        }
        return new Vector3(x / agents.size(), 1.0, z / agents.size());
    }
}
