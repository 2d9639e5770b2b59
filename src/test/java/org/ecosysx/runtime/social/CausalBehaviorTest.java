package org.ecosysx.runtime.social;

import java.util.List;

import org.ecosysx.runtime.FixedRandomProvider;
import org.ecosysx.runtime.StubEnvironment;
import org.ecosysx.runtime.TickContext;
import org.ecosysx.runtime.model.ActionType;
import org.ecosysx.runtime.model.Agent;
import org.ecosysx.runtime.model.AgentKind;
import org.ecosysx.runtime.model.Message;
import org.ecosysx.runtime.model.MessageType;
import org.ecosysx.runtime.model.MovementAction;
import org.ecosysx.runtime.model.Vector3;
import org.ecosysx.runtime.reasoning.ReasoningResult;
import org.ecosysx.runtime.reasoning.ReasoningScheduler;
import org.ecosysx.runtime.reasoning.RuleBasedPlanner;
import org.ecosysx.runtime.reasoning.SocialSummary;
import org.ecosysx.runtime.spi.IRandomProvider;
import org.ecosysx.runtime.time.TimeSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the social layer. Agents created from {@link #ACTIVE} pass every random roll,
 * agents created from {@link #PASSIVE} fail them, which keeps the behaviour under test isolated.
 */
@Tag("unit")
class CausalBehaviorTest {

    private static final IRandomProvider ACTIVE = new FixedRandomProvider(0.0);
    private static final IRandomProvider PASSIVE = new FixedRandomProvider(0.99);

    private StubEnvironment environment;
    private CausalBehavior behavior;

    @BeforeEach
    void setUp() {
        environment = new StubEnvironment();
        behavior = new CausalBehavior(ReasoningScheduler.disabled());
    }

    private static Agent causal(int serial, IRandomProvider rng, double x, double z) {
        return Agent.create(serial, AgentKind.CAUSAL, new Vector3(x, 1, z), null, 0, rng);
    }

    private TickContext context(long tick, Agent... agents) {
        return new TickContext(tick, environment, List.of(agents), TimeSystem.V1, PASSIVE, 20.0);
    }

    private static void setTrust(Agent holder, Agent about, double trust) {
        SocialMemory memory = holder.getSocial().getSocialMemory();
        memory.rememberAgent(about.getId(), null, 0);
        memory.updateTrust(about.getId(), trust - memory.getTrust(about.getId()), "test", 0);
    }

    @Test
    void energeticAgentSharesResourceTip() {
        Agent sender = causal(0, ACTIVE, 0, 0);
        Agent recipient = causal(1, PASSIVE, 3, 0);
        environment.addResource("r1", 2, 2, 20);
        TickContext ctx = context(1, sender, recipient);

        behavior.update(sender, ctx);

        assertThat(sender.getSocial().getMessagesSent()).isEqualTo(1);
        assertThat(sender.getSocial().getCommunicationCooldown()).isEqualTo(CausalBehavior.COMMUNICATION_COOLDOWN);
        assertThat(sender.getSocial().getKnownResourceLocations())
                .anySatisfy(r -> {
                    assertThat(r.source()).isEqualTo(KnownResource.SELF_OBSERVED);
                    assertThat(r.confidence()).isEqualTo(1.0);
                });

        SocialMemory inbox = recipient.getSocial().getSocialMemory();
        assertThat(inbox.getReceivedMessages()).singleElement().satisfies(m -> {
            assertThat(m.id()).isEqualTo("causal-0-m0");
            assertThat(m.type()).isEqualTo(MessageType.RESOURCE_TIP);
        });
        // neutral 0.5, -0.01 on receipt, +0.05 for a confident message
        assertThat(inbox.getTrust(sender.getId())).isCloseTo(0.54, within(1e-9));
        assertThat(recipient.getSocial().getKnownResourceLocations()).singleElement().satisfies(r -> {
            assertThat(r.source()).isEqualTo(sender.getId());
            assertThat(r.confidence()).isCloseTo(0.8 * 0.49, within(1e-9));
        });
        assertThat(sender.getSocial().getSocialMemory().knows(recipient.getId())).isTrue();
        assertThat(ctx.getMessagesSent()).containsEntry(MessageType.RESOURCE_TIP, 1);
    }

    @Test
    void distrustedSenderIsNotBelieved() {
        Agent sender = causal(0, ACTIVE, 0, 0);
        Agent recipient = causal(1, PASSIVE, 3, 0);
        setTrust(recipient, sender, 0.2);
        environment.addResource("r1", 2, 2, 20);

        behavior.update(sender, context(1, sender, recipient));

        assertThat(recipient.getSocial().getKnownResourceLocations()).isEmpty();
        assertThat(recipient.getSocial().getSocialMemory().getTrust(sender.getId())).isCloseTo(0.24, within(1e-9));
    }

    @Test
    void recoveredAgentWarnsAboutInfectionHotspot() {
        Agent sender = causal(0, ACTIVE, 0, 0);
        sender.infect();
        sender.recover();
        sender.setEnergy(60);
        Agent recipient = causal(1, PASSIVE, 1, 1);
        setTrust(recipient, sender, 0.8);
        Agent sickA = Agent.create(2, AgentKind.BASIC, new Vector3(4, 1, 0), null, 0, PASSIVE);
        Agent sickB = Agent.create(3, AgentKind.BASIC, new Vector3(0, 1, 4), null, 0, PASSIVE);
        sickA.infect();
        sickB.infect();

        behavior.update(sender, context(1, sender, recipient, sickA, sickB));

        Message warning = recipient.getSocial().getSocialMemory().getReceivedMessages().get(0);
        assertThat(warning.type()).isEqualTo(MessageType.INFECTION_WARNING);
        assertThat(warning.priority()).isEqualTo(Message.Priority.HIGH);
        assertThat(warning.content().severity()).isEqualTo(2);
        assertThat(recipient.getSocial().getDangerZones()).singleElement().satisfies(zone -> {
            assertThat(zone.location().x()).isCloseTo(2.0, within(1e-9));
            assertThat(zone.location().z()).isCloseTo(2.0, within(1e-9));
        });
        assertThat(sender.getSocial().getDangerZones()).hasSize(1);
    }

    @Test
    void mutualTrustAndNeedFormAlliance() {
        Agent inviter = causal(0, PASSIVE, 0, 0);
        Agent invitee = causal(1, PASSIVE, 3, 0);
        inviter.setEnergy(40);
        invitee.setEnergy(40);
        setTrust(inviter, invitee, 0.8);
        setTrust(invitee, inviter, 0.8);
        TickContext ctx = context(1, inviter, invitee);

        behavior.update(inviter, ctx);

        assertThat(invitee.getSocial().getAllianceInvitations()).hasSize(1);
        assertThat(inviter.getSocial().getAllianceCooldown()).isEqualTo(CausalBehavior.ALLIANCE_COOLDOWN);

        behavior.update(invitee, ctx);

        assertThat(inviter.getSocial().isAlliedWith(invitee.getId())).isTrue();
        assertThat(invitee.getSocial().isAlliedWith(inviter.getId())).isTrue();
        assertThat(invitee.getSocial().getAllianceInvitations()).isEmpty();
        assertThat(inviter.getSocial().getSocialMemory().getTrust(invitee.getId())).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void acceptedTradeMovesEnergyWithTransferLoss() {
        Agent trader = causal(0, PASSIVE, 0, 0);
        Agent needy = causal(1, PASSIVE, 3, 0);
        needy.setEnergy(10);
        setTrust(needy, trader, 0.6);
        TradeOffer offer = new TradeOffer(trader.getId(), CausalBehavior.TRADE_OFFER_ENERGY, CausalBehavior.TRADE_WANT_ENERGY, 0);
        needy.getSocial().tradeOffersMutable().add(offer);

        behavior.update(needy, context(1, trader, needy));

        assertThat(offer.isEvaluated()).isTrue();
        assertThat(trader.getEnergy()).isCloseTo(85, within(1e-9));
        assertThat(needy.getEnergy()).isCloseTo(10 + 15 * CausalBehavior.TRANSFER_EFFICIENCY, within(1e-9));
        assertThat(needy.getSocial().getTradingReputation()).isCloseTo(0.55, within(1e-9));
        assertThat(trader.getSocial().getTradingReputation()).isCloseTo(0.55, within(1e-9));
    }

    @Test
    void wellFedAgentDeclinesTrade() {
        Agent trader = causal(0, PASSIVE, 0, 0);
        Agent other = causal(1, PASSIVE, 3, 0);
        other.setEnergy(60);
        setTrust(other, trader, 0.6);
        other.getSocial().tradeOffersMutable().add(new TradeOffer(trader.getId(), 15, 10, 0));

        behavior.update(other, context(1, trader, other));

        assertThat(trader.getEnergy()).isEqualTo(Agent.MAX_ENERGY);
        assertThat(other.getSocial().getSocialMemory().getTrust(trader.getId())).isCloseTo(0.59, within(1e-9));
    }

    @Test
    void starvingAgentAsksTrustedPeersForHelp() {
        Agent needy = causal(0, PASSIVE, 0, 0);
        Agent friend = causal(1, PASSIVE, 5, 0);
        Agent stranger = causal(2, PASSIVE, 6, 0);
        needy.setEnergy(15);
        setTrust(needy, friend, 0.6);
        setTrust(needy, stranger, 0.3);
        TickContext ctx = context(1, needy, friend, stranger);

        behavior.update(needy, ctx);

        assertThat(friend.getSocial().getHelpRequests()).singleElement().satisfies(r -> {
            assertThat(r.getType()).isEqualTo(HelpRequest.Type.CRITICAL_ENERGY);
            assertThat(r.getUrgency()).isCloseTo(0.4, within(1e-9));
            assertThat(r.getPriority()).isEqualTo(Message.Priority.NORMAL);
        });
        assertThat(stranger.getSocial().getHelpRequests()).isEmpty();
        assertThat(needy.getSocial().getHelpRequestCooldown()).isEqualTo(CausalBehavior.HELP_REQUEST_COOLDOWN);
        assertThat(needy.getSocial().getCurrentHelpRequest()).isNotNull();
        assertThat(ctx.getMessagesSent()).containsEntry(MessageType.HELP_REQUEST, 1);
    }

    @Test
    void helperSharesEnergyWithRequester() {
        Agent helper = causal(0, PASSIVE, 0, 0);
        Agent requester = causal(1, PASSIVE, 3, 0);
        requester.setEnergy(10);
        setTrust(helper, requester, 1.0);
        setTrust(requester, helper, 0.5);
        HelpRequest request = new HelpRequest(requester.getId(), HelpRequest.Type.CRITICAL_ENERGY, 0.8,
                Message.Priority.HIGH, 0, requester.getPosition());
        helper.getSocial().addHelpRequest(request);

        behavior.update(helper, context(1, helper, requester));

        assertThat(request.isProcessed()).isTrue();
        assertThat(helper.getEnergy()).isCloseTo(80, within(1e-9));
        assertThat(requester.getEnergy()).isCloseTo(10 + 20 * CausalBehavior.TRANSFER_EFFICIENCY, within(1e-9));
        assertThat(helper.getSocial().getHelpingReputation()).isCloseTo(0.6, within(1e-9));
        assertThat(requester.getSocial().getSocialMemory().getTrust(helper.getId())).isCloseTo(0.65, within(1e-9));
        assertThat(helper.getSocial().getSocialMemory().getMemory(requester.getId()).orElseThrow().getHelpGiven()).isEqualTo(1);
        assertThat(requester.getSocial().getSocialMemory().getMemory(helper.getId()).orElseThrow().getHelpReceived()).isEqualTo(1);
    }

    @Test
    void recoveredHelperGivesMedicalHelp() {
        Agent helper = causal(0, PASSIVE, 0, 0);
        helper.infect();
        helper.recover();
        Agent patient = causal(1, PASSIVE, 3, 0);
        patient.infect();
        patient.setInfectionTimer(30);
        setTrust(helper, patient, 1.0);
        helper.getSocial().addHelpRequest(new HelpRequest(patient.getId(), HelpRequest.Type.MEDICAL, 0.6,
                Message.Priority.NORMAL, 0, patient.getPosition()));

        behavior.update(helper, context(1, helper, patient));

        assertThat(patient.getInfectionTimer()).isEqualTo(CausalBehavior.MEDICAL_TIMER_CAP);
        assertThat(helper.getEnergy()).isEqualTo(Agent.MAX_ENERGY);
        assertThat(helper.getSocial().getHelpingReputation()).isCloseTo(0.58, within(1e-9));
    }

    @Test
    void territorialAgentClaimsResourceCluster() {
        Agent agent = causal(0, PASSIVE, 0, 0);
        environment.addResource("a", 3, 3, 10);
        environment.addResource("b", 5, 5, 10);

        behavior.update(agent, context(1, agent));

        Territory territory = agent.getSocial().getTerritory();
        assertThat(territory).isNotNull();
        assertThat(territory.getCenter().x()).isCloseTo(4.0, within(1e-9));
        assertThat(territory.getCenter().z()).isCloseTo(4.0, within(1e-9));
        assertThat(territory.getPatrolPoints()).hasSize(Territory.PATROL_POINTS);
    }

    @Test
    void territoryIsNotClaimedNextToAnother() {
        Agent agent = causal(0, PASSIVE, 0, 0);
        Agent owner = causal(1, PASSIVE, 15, 15);
        owner.getSocial().territory = new Territory(new Vector3(10, 1, 10), Territory.DEFAULT_RADIUS, 0, 8);
        environment.addResource("a", 3, 3, 10);
        environment.addResource("b", 5, 5, 10);

        behavior.update(agent, context(1, agent, owner));

        assertThat(agent.getSocial().getTerritory()).isNull();
    }

    @Test
    void sharedInformationAgesOut() {
        SocialExtension social = new SocialExtension(Personality.SOCIAL, 0.5, 0.5);
        social.addKnownResource(new KnownResource(new Vector3(1, 1, 1), 1.0, 0.5, "peer", 0));
        social.addKnownResource(new KnownResource(new Vector3(2, 1, 2), 1.0, 0.5, "peer", -200));
        social.addDangerZone(new DangerZone(new Vector3(0, 1, 0), 1, "peer", 0));
        social.addDangerZone(new DangerZone(new Vector3(0, 1, 0), 1, "peer", 100));
        social.addHelpRequest(new HelpRequest("x", HelpRequest.Type.MEDICAL, 0.5, Message.Priority.HIGH, -300, Vector3.ZERO));

        CausalBehavior.decayInformation(social, 150);

        assertThat(social.getKnownResourceLocations()).singleElement()
                .satisfies(r -> assertThat(r.confidence()).isCloseTo(0.75, within(1e-9)));
        assertThat(social.getDangerZones()).singleElement().satisfies(z -> assertThat(z.timestamp()).isEqualTo(100));
        assertThat(social.getHelpRequests()).isEmpty();
    }

    @Test
    void summaryCountsUsableKnowledge() {
        SocialExtension social = new SocialExtension(Personality.SOCIAL, 0.5, 0.5);
        social.addKnownResource(new KnownResource(Vector3.ZERO, 0.9, 0.5, "peer", 10));
        social.addKnownResource(new KnownResource(Vector3.ZERO, 0.2, 0.5, "peer", 10));
        social.addDangerZone(new DangerZone(Vector3.ZERO, 1, "peer", 10));
        social.addHelpRequest(new HelpRequest("x", HelpRequest.Type.MEDICAL, 0.9, Message.Priority.HIGH, 10, Vector3.ZERO));
        social.addHelpRequest(new HelpRequest("y", HelpRequest.Type.MEDICAL, 0.2, Message.Priority.NORMAL, 10, Vector3.ZERO));

        assertThat(CausalBehavior.summarize(social, 20)).isEqualTo(new SocialSummary(1, 1, 1));
    }

    @Test
    void confidentPlanRaisesTrustOfNearbyPeers() {
        Agent planner = causal(0, PASSIVE, 0, 0);
        Agent near = causal(1, PASSIVE, 2, 0);
        Agent far = causal(2, PASSIVE, 10, 0);
        setTrust(near, planner, 0.5);
        setTrust(far, planner, 0.5);
        TickContext ctx = context(3, planner, near, far);

        behavior.onPlanApplied(planner, plan(planner, 0.9), ctx);
        behavior.onPlanApplied(planner, plan(planner, 0.8), ctx);

        assertThat(near.getSocial().getSocialMemory().getTrust(planner.getId())).isCloseTo(0.51, within(1e-9));
        assertThat(far.getSocial().getSocialMemory().getTrust(planner.getId())).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void submitsReasoningRequestWhenScheduled() {
        ReasoningScheduler scheduler = new ReasoningScheduler(new RuleBasedPlanner(), ReasoningScheduler.Mode.DEFERRED, true, 1.0, 1);
        CausalBehavior reasoningBehavior = new CausalBehavior(scheduler);
        Agent agent = causal(0, PASSIVE, 0, 0);

        reasoningBehavior.update(agent, context(4, agent));

        assertThat(agent.getSocial().isReasoningInFlight()).isTrue();
        assertThat(scheduler.drainDeferred()).isEqualTo(1);
        ReasoningResult result = agent.getSocial().pollQueuedResult(5);
        assertThat(result).isNotNull();
        assertThat(result.agentId()).isEqualTo(agent.getId());
        assertThat(result.requestTick()).isEqualTo(4);
    }

    private static ReasoningResult plan(Agent agent, double confidence) {
        return new ReasoningResult(agent.getId(), 2, MovementAction.typed(ActionType.EXPLORE, 0.5),
                List.of(), List.of(), confidence, "test");
    }
}
