package org.ecosysx.runtime;

import java.util.List;

import org.ecosysx.runtime.model.Agent;
import org.ecosysx.runtime.model.AgentKind;
import org.ecosysx.runtime.model.DeathCause;
import org.ecosysx.runtime.model.HealthStatus;
import org.ecosysx.runtime.model.UpdateOutcome;
import org.ecosysx.runtime.model.Vector3;
import org.ecosysx.runtime.social.CausalBehavior;
import org.ecosysx.runtime.spi.IRandomProvider;
import org.ecosysx.runtime.time.TimeSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the per-tick agent state machine. Agents draw from a {@link FixedRandomProvider},
 * so every roll either always succeeds (draw 0.0) or always fails (draw 0.99).
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class AgentStepperTest {

    private static final IRandomProvider ALWAYS = new FixedRandomProvider(0.0);
    private static final IRandomProvider NEVER = new FixedRandomProvider(0.99);

    @Mock
    private CausalBehavior causalBehavior;

    private StubEnvironment environment;
    private AgentStepper stepper;

    @BeforeEach
    void setUp() {
        environment = new StubEnvironment();
        stepper = new AgentStepper(TimeSystem.V1, causalBehavior);
    }

    private TickContext context(long tick, IRandomProvider root, Agent... agents) {
        return new TickContext(tick, environment, List.of(agents), TimeSystem.V1, root, 20.0);
    }

    private static Agent agent(AgentKind kind, IRandomProvider rng, double x, double z) {
        return Agent.create(0, kind, new Vector3(x, 1, z), null, 0, rng);
    }

    @Test
    void healthyAgentPaysBaseMetabolism() {
        Agent agent = agent(AgentKind.BASIC, NEVER, 0, 0);

        UpdateOutcome outcome = stepper.update(agent, context(0, NEVER, agent));

        assertThat(outcome).isEqualTo(UpdateOutcome.CONTINUE);
        assertThat(agent.getEnergy()).isCloseTo(Agent.MAX_ENERGY - AgentStepper.BASE_ENERGY_LOSS, within(1e-9));
    }

    @Test
    void starvingAgentDiesOfStarvation() {
        Agent agent = agent(AgentKind.BASIC, ALWAYS, 0, 0);
        agent.setEnergy(0);

        UpdateOutcome outcome = stepper.update(agent, context(5, ALWAYS, agent));

        assertThat(outcome).isEqualTo(UpdateOutcome.DIE);
        assertThat(agent.getDeathCause()).isEqualTo(DeathCause.STARVATION);
    }

    @Test
    void agentPastLifespanDiesOfOldAge() {
        Agent agent = agent(AgentKind.BASIC, ALWAYS, 0, 0);

        UpdateOutcome outcome = stepper.update(agent, context((long) agent.getLifespan() + 1, ALWAYS, agent));

        assertThat(outcome).isEqualTo(UpdateOutcome.DIE);
        assertThat(agent.getDeathCause()).isEqualTo(DeathCause.OLD_AGE);
    }

    @Test
    void infectedAgentRecoversAfterRecoveryPeriod() {
        Agent agent = agent(AgentKind.BASIC, NEVER, 0, 0);
        agent.infect();
        agent.setInfectionTimer((int) AgentStepper.BASE_RECOVERY_HOURS);
        agent.setEnergy(50);

        stepper.update(agent, context(1, NEVER, agent));

        assertThat(agent.getStatus()).isEqualTo(HealthStatus.RECOVERED);
        double loss = AgentStepper.BASE_ENERGY_LOSS + AgentStepper.INFECTION_ENERGY_PENALTY;
        assertThat(agent.getEnergy()).isCloseTo(50 - loss + AgentStepper.RECOVERY_ENERGY_BONUS, within(1e-9));
    }

    @Test
    void susceptibleAgentCatchesInfectionFromCloseNeighbour() {
        Agent susceptible = agent(AgentKind.BASIC, ALWAYS, 0, 0);
        Agent carrier = Agent.create(1, AgentKind.BASIC, new Vector3(0.5, 1, 0), null, 0, ALWAYS);
        carrier.infect();

        stepper.update(susceptible, context(1, ALWAYS, susceptible, carrier));

        assertThat(susceptible.isInfected()).isTrue();
    }

    @Test
    void distantInfectedAgentsDoNotTransmit() {
        Agent susceptible = agent(AgentKind.BASIC, ALWAYS, 0, 0);
        Agent carrier = Agent.create(1, AgentKind.BASIC, new Vector3(15, 1, 15), null, 0, ALWAYS);
        carrier.infect();

        stepper.update(susceptible, context(1, ALWAYS, susceptible, carrier));

        assertThat(susceptible.isSusceptible()).isTrue();
    }

    @Test
    void foragingConsumesResourcesWithinPickupRadius() {
        Agent agent = agent(AgentKind.BASIC, NEVER, 0, 0);
        agent.setEnergy(50);
        environment.addResource("near", 1, 1, 20);
        environment.addResource("far", 10, 10, 20);
        TickContext ctx = context(1, NEVER, agent);

        stepper.update(agent, ctx);

        double gain = 20 * agent.getPhenotype().efficiency();
        assertThat(agent.getEnergy()).isCloseTo(50 - AgentStepper.BASE_ENERGY_LOSS + gain, within(1e-9));
        assertThat(environment.getResources()).extracting(r -> r.id()).containsExactly("far");
        assertThat(ctx.getResourcesConsumed()).isEqualTo(1);
    }

    @Test
    void matureWellFedAgentReproduces() {
        Agent parent = agent(AgentKind.BASIC, ALWAYS, 0, 0);

        UpdateOutcome outcome = stepper.update(parent, context(AgentStepper.MIN_REPRODUCTION_AGE + 10, ALWAYS, parent));

        assertThat(outcome).isEqualTo(UpdateOutcome.REPRODUCE);
    }

    @Test
    void youngAgentDoesNotReproduce() {
        Agent parent = agent(AgentKind.BASIC, ALWAYS, 0, 0);

        assertThat(stepper.update(parent, context(AgentStepper.MIN_REPRODUCTION_AGE, ALWAYS, parent)))
                .isEqualTo(UpdateOutcome.CONTINUE);
    }

    @Test
    void reproductionChargesParentAndInheritsKind() {
        Agent parent = agent(AgentKind.RL, NEVER, 2, 2);

        Agent child = stepper.reproduce(parent, 40, 7, NEVER);

        assertThat(child.getKind()).isEqualTo(AgentKind.RL);
        assertThat(child.getSerial()).isEqualTo(7);
        assertThat(child.getBirthStep()).isEqualTo(40);
        assertThat(child.getEnergy()).isEqualTo(Agent.MAX_ENERGY);
        assertThat(child.distanceTo(parent)).isLessThan(AgentStepper.OFFSPRING_SPREAD);
        assertThat(parent.getEnergy()).isEqualTo(Agent.MAX_ENERGY - AgentStepper.REPRODUCTION_COST);
        assertThat(parent.getReproductionCooldown()).isEqualTo(AgentStepper.REPRODUCTION_COOLDOWN);
    }

    @Test
    void socialLayerRunsOnlyForSurvivingCausalAgents() {
        Agent survivor = agent(AgentKind.CAUSAL, NEVER, 0, 0);
        TickContext ctx = context(1, NEVER, survivor);

        stepper.update(survivor, ctx);

        verify(causalBehavior).update(same(survivor), same(ctx));
    }

    @Test
    void socialLayerIsSkippedForDyingAgents() {
        Agent dying = agent(AgentKind.CAUSAL, ALWAYS, 0, 0);
        dying.setEnergy(0);

        assertThat(stepper.update(dying, context(1, ALWAYS, dying))).isEqualTo(UpdateOutcome.DIE);

        verify(causalBehavior, never()).update(any(), any());
    }

    @Test
    void basicAgentsNeverRunTheSocialLayer() {
        Agent basic = agent(AgentKind.BASIC, NEVER, 0, 0);

        stepper.update(basic, context(1, NEVER, basic));

        verify(causalBehavior, never()).update(any(), any());
    }

    @Test
    void movementStaysInsideBounds() {
        Agent agent = agent(AgentKind.BASIC, NEVER, 19.9, -19.9);
        agent.addVelocity(50, -50);

        stepper.update(agent, context(1, NEVER, agent));

        assertThat(Math.abs(agent.getX())).isLessThanOrEqualTo(20.0);
        assertThat(Math.abs(agent.getZ())).isLessThanOrEqualTo(20.0);
    }
}
