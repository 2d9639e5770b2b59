package org.ecosysx.runtime;

import java.util.ArrayList;
import java.util.List;

import org.ecosysx.runtime.model.Agent;
import org.ecosysx.runtime.model.DeathCause;
import org.ecosysx.runtime.model.EnvironmentalStress;
import org.ecosysx.runtime.model.Genotype;
import org.ecosysx.runtime.model.HealthStatus;
import org.ecosysx.runtime.model.MovementAction;
import org.ecosysx.runtime.model.Observation;
import org.ecosysx.runtime.model.Resource;
import org.ecosysx.runtime.model.TerrainEffects;
import org.ecosysx.runtime.model.UpdateOutcome;
import org.ecosysx.runtime.model.Vector3;
import org.ecosysx.runtime.model.WeatherEffects;
import org.ecosysx.runtime.reasoning.ReasoningResult;
import org.ecosysx.runtime.social.CausalBehavior;
import org.ecosysx.runtime.social.SocialExtension;
import org.ecosysx.runtime.spi.IRandomProvider;
import org.ecosysx.runtime.time.TimeSystem;

/**
 * Executes the per-tick state machine of an agent and dispatches kind-specific behaviour.
 * <p>
 * Every agent runs the same base sequence: metabolism, death roll, recovery, infection from
 * neighbours, foraging, movement and the reproduction roll. Social agents then run their social
 * layer through {@link CausalBehavior}, unless they died this tick.
 * <p>
 * All per-step probabilities below are calibrated for a one-hour step and converted with
 * {@link TimeSystem#stepProbability(double)}.
 */
public final class AgentStepper {

    static final double BASE_ENERGY_LOSS = 0.5;
    static final double INFECTION_ENERGY_PENALTY = 0.6;
    static final double OLD_AGE_ENERGY_PENALTY = 0.3;
    static final double OLD_AGE_FRACTION = 0.8;
    static final double BASE_CRITICAL_ENERGY = 5.0;
    static final double OLD_AGE_DEATH_CHANCE = 0.1;
    static final double BASE_RECOVERY_HOURS = 40.0;
    static final double RECOVERY_ENERGY_BONUS = 10.0;
    static final double BASE_INFECTION_RATE = 0.15;
    static final double PICKUP_RADIUS = 3.0;
    static final double AVOIDANCE_RADIUS = 10.0;
    static final double BASE_REPRODUCTION_RATE = 0.015;
    static final int MIN_REPRODUCTION_AGE = 20;
    static final int REPRODUCTION_COOLDOWN = 60;
    static final double REPRODUCTION_COST = 15.0;
    static final double OFFSPRING_SPREAD = 3.0;

    private final TimeSystem time;
    private final CausalBehavior causalBehavior;

    public AgentStepper(TimeSystem time, CausalBehavior causalBehavior) {
        this.time = time;
        this.causalBehavior = causalBehavior;
    }

    /**
     * Advances one agent by one tick.
     *
     * @param agent the agent to update.
     * @param ctx   the shared tick context.
     * @return what the engine should do with the agent after the sweep.
     */
    public UpdateOutcome update(Agent agent, TickContext ctx) {
        UpdateOutcome outcome = updateBase(agent, ctx);
        if (agent.getKind().isSocial() && outcome != UpdateOutcome.DIE) {
            causalBehavior.update(agent, ctx);
        }
        return outcome;
    }

    private UpdateOutcome updateBase(Agent agent, TickContext ctx) {
        IRandomProvider rng = agent.getRandom();
        long tick = ctx.getTick();
        long age = agent.getAge(tick);
        WeatherEffects weather = ctx.getWeather();
        EnvironmentalStress stress = ctx.getStress();
        TerrainEffects terrain = ctx.getEnvironment().getTerrainEffects(agent.getPosition());

        applyMetabolism(agent, age, weather, terrain);

        // Death
        double criticalEnergy = Math.max(2, BASE_CRITICAL_ENERGY - weather.shelterNeed() * 3);
        boolean oldAge = age >= agent.getLifespan();
        if (oldAge || agent.getEnergy() <= criticalEnergy) {
            double deathChance = oldAge ? OLD_AGE_DEATH_CHANCE : (criticalEnergy - agent.getEnergy()) * 0.05;
            if (stress.heatStress() > 0.7) deathChance += 0.15;
            if (stress.coldStress() > 0.7) deathChance += 0.12;
            if (stress.stormStress() > 0.8) deathChance += 0.1;
            if (rng.nextDouble() < time.stepProbability(deathChance)) {
                agent.setDeathCause(oldAge ? DeathCause.OLD_AGE : DeathCause.STARVATION);
                return UpdateOutcome.DIE;
            }
        }

        // Recovery
        if (agent.isInfected()) {
            agent.incrementInfectionTimer();
            double recoveryHours = BASE_RECOVERY_HOURS;
            if (stress.coldStress() > 0.3) recoveryHours *= 0.8;
            if (stress.heatStress() > 0.5) recoveryHours *= 1.3;
            if (time.stepToHours(agent.getInfectionTimer()) > recoveryHours && agent.recover()) {
                agent.addEnergy(RECOVERY_ENERGY_BONUS);
            }
        }

        if (agent.isSusceptible()) {
            tryInfectFromNeighbours(agent, ctx, weather, terrain, rng);
        }

        forage(agent, ctx, weather);

        // Movement
        Observation observation = ctx.observe(agent);
        MovementAction action = agent.getLearningPolicy().getAction(observation);
        SocialExtension social = agent.getSocial();
        if (social != null) {
            ReasoningResult planned = social.pollQueuedResult(tick);
            if (planned != null) {
                action = planned.action();
                causalBehavior.onPlanApplied(agent, planned, ctx);
            }
        }
        applyAction(agent, action.scaled(weather.movementSpeedMultiplier()), ctx, rng);
        agent.integrate(ctx.getBounds());

        // Reproduction
        double threshold = Math.max(30, agent.getGenotype().reproductionThreshold() * 0.7);
        int population = ctx.getPopulationSize();
        double pressure = population < 15 ? 2.0 : population > 50 ? 0.5 : 1.0;
        if (weather.shelterNeed() > 0.6) pressure *= 0.5;
        if (stress.stormStress() > 0.5) pressure *= 0.3;

        if (agent.getEnergy() > threshold
                && agent.getReproductionCooldown() == 0
                && age > MIN_REPRODUCTION_AGE
                && rng.nextDouble() < time.stepProbability(BASE_REPRODUCTION_RATE * pressure)) {
            return UpdateOutcome.REPRODUCE;
        }
        return UpdateOutcome.CONTINUE;
    }

    private void applyMetabolism(Agent agent, long age, WeatherEffects weather, TerrainEffects terrain) {
        double loss = BASE_ENERGY_LOSS;
        if (agent.isInfected()) loss += INFECTION_ENERGY_PENALTY;
        if (age > agent.getLifespan() * OLD_AGE_FRACTION) loss += OLD_AGE_ENERGY_PENALTY;
        loss += (weather.energyConsumptionMultiplier() - 1.0) * 0.4;
        if (weather.shelterNeed() > 0.5 && !terrain.isInShelter()) loss += 0.3;
        if (terrain.weatherExposureMultiplier() > 1.0) {
            loss += (terrain.weatherExposureMultiplier() - 1.0) * weather.energyConsumptionMultiplier() * 0.2;
        }
        loss -= terrain.energyBonus();

        agent.addEnergy(-loss);
        agent.setReproductionCooldown(agent.getReproductionCooldown() - 1);
    }

    private void tryInfectFromNeighbours(Agent agent, TickContext ctx, WeatherEffects weather, TerrainEffects terrain, IRandomProvider rng) {
        double socialDistance = agent.getPhenotype().socialDistance();
        double multiplier = weather.infectionSpreadMultiplier()
                * (1.0 + terrain.infectionRiskModifier())
                * (1.0 - terrain.weatherProtection() * 0.6);
        double perContact = time.stepProbability(BASE_INFECTION_RATE * multiplier * (1.0 - agent.getPhenotype().resistance()));

        for (Agent other : ctx.getAgents()) {
            if (other == agent || !other.isInfected() || agent.distanceTo(other) >= socialDistance) {
                continue;
            }
            if (rng.nextDouble() < perContact) {
                agent.infect();
                return;
            }
        }
    }

    private void forage(Agent agent, TickContext ctx, WeatherEffects weather) {
        double weatherEfficiency = Math.max(0.3, 1.0 - weather.shelterNeed() * 0.4);
        List<Resource> resources = new ArrayList<>(ctx.getEnvironment().getResources());
        for (Resource resource : resources) {
            if (agent.distanceTo(resource.position()) >= PICKUP_RADIUS) {
                continue;
            }
            double gain = resource.value() * agent.getPhenotype().efficiency();
            if (resource.weatherResistant() && weather.shelterNeed() > 0.5) {
                gain *= 1.5;
            }
            if (agent.getStatus() == HealthStatus.RECOVERED) {
                gain *= 1.2;
            }
            agent.addEnergy(gain * weatherEfficiency);
            ctx.getEnvironment().consumeResource(resource.id());
            ctx.recordConsumption();

            if (weather.shelterNeed() > 0.5 && agent.getReproductionCooldown() > 0) {
                agent.setReproductionCooldown(agent.getReproductionCooldown() - 30);
            }
        }
    }

    private void applyAction(Agent agent, MovementAction action, TickContext ctx, IRandomProvider rng) {
        double moveIntensity = action.intensity() * agent.getPhenotype().maxSpeed();
        if (!action.isTyped()) {
            applyPolicyAction(agent, action, ctx, rng, moveIntensity);
            return;
        }
        switch (action.type()) {
            case FORAGE -> {
                Resource nearest = ctx.nearestResource(agent);
                if (nearest != null) {
                    steerToward(agent, nearest.position(), moveIntensity * 0.8);
                } else {
                    jitter(agent, rng, moveIntensity * 0.3);
                }
            }
            case AVOID -> avoidInfected(agent, ctx, rng, moveIntensity);
            case REPRODUCE -> jitter(agent, rng, moveIntensity * 0.4);
            case REST -> jitter(agent, rng, moveIntensity * 0.1);
            case EXPLORE -> jitter(agent, rng, moveIntensity * 0.5);
        }
    }

    private void applyPolicyAction(Agent agent, MovementAction action, TickContext ctx, IRandomProvider rng, double moveIntensity) {
        if (agent.getEnergy() < 40) {
            Resource nearest = ctx.nearestResource(agent);
            if (nearest != null) {
                steerToward(agent, nearest.position(), moveIntensity * 0.3);
            }
        }
        jitter(agent, rng, moveIntensity * 0.2);
        if (agent.isSusceptible()) {
            jitter(agent, rng, action.avoidance());
        }
    }

    private void avoidInfected(Agent agent, TickContext ctx, IRandomProvider rng, double moveIntensity) {
        List<Agent> infected = new ArrayList<>();
        for (Agent other : ctx.getAgents()) {
            if (other != agent && other.isInfected() && agent.distanceTo(other) < AVOIDANCE_RADIUS) {
                infected.add(other);
            }
        }
        if (infected.isEmpty()) {
            jitter(agent, rng, moveIntensity * 0.3);
            return;
        }
        double ax = 0;
        double az = 0;
        for (Agent other : infected) {
            double dx = agent.getX() - other.getX();
            double dz = agent.getZ() - other.getZ();
            double d = Math.sqrt(dx * dx + dz * dz);
            if (d > 0) {
                ax += (dx / d) / infected.size();
                az += (dz / d) / infected.size();
            }
        }
        agent.addVelocity(ax * moveIntensity, az * moveIntensity);
    }

    public static void steerToward(Agent agent, Vector3 target, double strength) {
        double dx = target.x() - agent.getX();
        double dz = target.z() - agent.getZ();
        double magnitude = Math.sqrt(dx * dx + dz * dz);
        if (magnitude > 0) {
            agent.addVelocity(dx / magnitude * strength, dz / magnitude * strength);
        }
    }

    private static void jitter(Agent agent, IRandomProvider rng, double strength) {
        agent.addVelocity((rng.nextDouble() - 0.5) * strength, (rng.nextDouble() - 0.5) * strength);
    }

    /**
     * Creates the offspring of an agent that returned {@link UpdateOutcome#REPRODUCE} and charges
     * the parent the reproduction cost.
     *
     * @param parent the reproducing agent.
     * @param tick   current tick, becomes the offspring's birth step.
     * @param serial serial number for the offspring.
     * @param root   the simulation's root random provider.
     * @return the offspring, not yet part of the population.
     */
    public Agent reproduce(Agent parent, long tick, int serial, IRandomProvider root) {
        IRandomProvider rng = parent.getRandom();
        Genotype childGenotype = parent.getGenotype().mutate(rng);
        Vector3 position = new Vector3(
                parent.getX() + (rng.nextDouble() - 0.5) * OFFSPRING_SPREAD,
                1.0,
                parent.getZ() + (rng.nextDouble() - 0.5) * OFFSPRING_SPREAD);
        Agent child = Agent.create(serial, parent.getKind(), position, childGenotype, tick, root);

        parent.setReproductionCooldown(REPRODUCTION_COOLDOWN);
        parent.addEnergy(-REPRODUCTION_COST);
        return child;
    }
}
