package org.ecosysx.runtime;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.ecosysx.runtime.model.Agent;
import org.ecosysx.runtime.model.EnvironmentalStress;
import org.ecosysx.runtime.model.MessageType;
import org.ecosysx.runtime.model.Observation;
import org.ecosysx.runtime.model.Resource;
import org.ecosysx.runtime.model.WeatherEffects;
import org.ecosysx.runtime.spi.IEnvironment;
import org.ecosysx.runtime.spi.IRandomProvider;
import org.ecosysx.runtime.time.TimeSystem;

/**
 * Per-tick view shared by all agent updates of one step: the tick, the environment, the population
 * snapshot and tallies of what happened during the sweep.
 * <p>
 * The population list is the snapshot taken before the sweep; births and deaths are applied by the
 * engine only after every agent has been updated.
 */
public final class TickContext {

    /** Radius within which other agents count as nearby in an observation. */
    public static final double OBSERVATION_RADIUS = 8.0;

    private final long tick;
    private final IEnvironment environment;
    private final List<Agent> agents;
    private final TimeSystem time;
    private final IRandomProvider root;
    private final double bounds;
    private final EnvironmentalStress stress;
    private final WeatherEffects weather;

    private Map<String, Agent> byId;
    private int resourcesConsumed;
    private final EnumMap<MessageType, Integer> messagesSent = new EnumMap<>(MessageType.class);

    public TickContext(long tick, IEnvironment environment, List<Agent> agents, TimeSystem time, IRandomProvider root, double bounds) {
        this.tick = tick;
        this.environment = environment;
        this.agents = agents;
        this.time = time;
        this.root = root;
        this.bounds = bounds;
        this.stress = environment.getEnvironmentalStress();
        this.weather = environment.getWeatherEffects();
    }

    public long getTick() {
        return tick;
    }

    public IEnvironment getEnvironment() {
        return environment;
    }

    public List<Agent> getAgents() {
        return agents;
    }

    public int getPopulationSize() {
        return agents.size();
    }

    public TimeSystem getTime() {
        return time;
    }

    public IRandomProvider getRoot() {
        return root;
    }

    public double getBounds() {
        return bounds;
    }

    public EnvironmentalStress getStress() {
        return stress;
    }

    public WeatherEffects getWeather() {
        return weather;
    }

    /**
     * Looks up an agent of the snapshot by id.
     *
     * @return the agent, or {@code null} if it is not part of this tick's population.
     */
    public Agent findAgent(String id) {
        if (byId == null) {
            byId = new HashMap<>(agents.size() * 2);
            for (Agent a : agents) {
                byId.put(a.getId(), a);
            }
        }
        return byId.get(id);
    }

    /**
     * Builds the local observation an agent acts on.
     */
    public Observation observe(Agent agent) {
        int nearby = 0;
        int nearbyInfected = 0;
        for (Agent other : agents) {
            if (other == agent || agent.distanceTo(other) >= OBSERVATION_RADIUS) {
                continue;
            }
            nearby++;
            if (other.isInfected()) {
                nearbyInfected++;
            }
        }
        Resource nearest = nearestResource(agent);
        double distance = nearest != null ? agent.distanceTo(nearest.position()) : Observation.NO_RESOURCE_DISTANCE;
        return new Observation(agent.getEnergy(), nearby, nearbyInfected, agent.getAge(tick), distance, agent.getStatus());
    }

    /**
     * Returns the resource closest to the agent on the ground plane, or {@code null} if none exist.
     */
    public Resource nearestResource(Agent agent) {
        Resource nearest = null;
        double min = Double.POSITIVE_INFINITY;
        for (Resource r : environment.getResources()) {
            double d = agent.distanceTo(r.position());
            if (d < min) {
                min = d;
                nearest = r;
            }
        }
        return nearest;
    }

    public void recordConsumption() {
        resourcesConsumed++;
    }

    public void recordMessage(MessageType type) {
        messagesSent.merge(type, 1, Integer::sum);
    }

    public int getResourcesConsumed() {
        return resourcesConsumed;
    }

    public Map<MessageType, Integer> getMessagesSent() {
        return Map.copyOf(messagesSent);
    }
}
