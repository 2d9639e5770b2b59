package org.ecosysx.runtime.worldgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.typesafe.config.Config;
import org.ecosysx.runtime.EcosystemEngine;
import org.ecosysx.runtime.model.Agent;
import org.ecosysx.runtime.model.AgentKind;
import org.ecosysx.runtime.model.Vector3;
import org.ecosysx.runtime.spi.IRandomProvider;

/**
 * Seeds the initial population of an engine.
 * <ul>
 *   <li><b>basic, rl, causal:</b> number of agents of each kind.</li>
 *   <li><b>spawnRange:</b> agents are placed uniformly within [-spawnRange, spawnRange] on both
 *   axes.</li>
 *   <li><b>infectedFraction:</b> share of the population that starts infected, rounded to the
 *   nearest agent. Each starts with a random infection timer below 20.</li>
 * </ul>
 */
public class InitialPopulationCreator {

    static final int MAX_INITIAL_INFECTION_TIMER = 20;

    private final Random random;
    private final int basic;
    private final int rl;
    private final int causal;
    private final double spawnRange;
    private final double infectedFraction;

    /**
     * Creates a creator from the {@code population} section of the configuration. Missing keys fall
     * back to 8 basic, 9 RL and 8 causal agents, range 15 and an infected fraction of 0.12.
     */
    public InitialPopulationCreator(IRandomProvider randomProvider, Config config) {
        this(randomProvider,
                config.hasPath("basic") ? config.getInt("basic") : 8,
                config.hasPath("rl") ? config.getInt("rl") : 9,
                config.hasPath("causal") ? config.getInt("causal") : 8,
                config.hasPath("spawnRange") ? config.getDouble("spawnRange") : 15.0,
                config.hasPath("infectedFraction") ? config.getDouble("infectedFraction") : 0.12);
    }

    public InitialPopulationCreator(IRandomProvider randomProvider, int basic, int rl, int causal,
                                    double spawnRange, double infectedFraction) {
        if (basic < 0 || rl < 0 || causal < 0) {
            throw new IllegalArgumentException("Population counts must not be negative");
        }
        if (infectedFraction < 0 || infectedFraction > 1) {
            throw new IllegalArgumentException("infectedFraction must be in [0, 1], got " + infectedFraction);
        }
        this.random = randomProvider.asJavaRandom();
        this.basic = basic;
        this.rl = rl;
        this.causal = causal;
        this.spawnRange = spawnRange;
        this.infectedFraction = infectedFraction;
    }

    /**
     * Adds the configured agents to the engine and infects a random subset.
     *
     * @return the created agents in creation order.
     */
    public List<Agent> populate(EcosystemEngine engine) {
        List<Agent> created = new ArrayList<>(basic + rl + causal);
        spawn(engine, AgentKind.BASIC, basic, created);
        spawn(engine, AgentKind.RL, rl, created);
        spawn(engine, AgentKind.CAUSAL, causal, created);

        List<Agent> shuffled = new ArrayList<>(created);
        Collections.shuffle(shuffled, random);
        int toInfect = (int) Math.round(created.size() * infectedFraction);
        for (int i = 0; i < toInfect; i++) {
            Agent agent = shuffled.get(i);
            agent.infect();
            agent.setInfectionTimer(random.nextInt(MAX_INITIAL_INFECTION_TIMER));
        }
        return created;
    }

    private void spawn(EcosystemEngine engine, AgentKind kind, int count, List<Agent> out) {
        for (int i = 0; i < count; i++) {
            double x = (random.nextDouble() * 2 - 1) * spawnRange;
            double z = (random.nextDouble() * 2 - 1) * spawnRange;
            out.add(engine.spawnAgent(kind, new Vector3(x, 1.0, z)));
        }
    }
}
