package org.ecosysx.runtime;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import com.typesafe.config.Config;
import org.ecosysx.analytics.EcosystemAnalytics;
import org.ecosysx.analytics.Statistics;
import org.ecosysx.analytics.StepTally;
import org.ecosysx.runtime.contact.ContactReport;
import org.ecosysx.runtime.contact.ContactTransmissionService;
import org.ecosysx.runtime.environment.DefaultEnvironment;
import org.ecosysx.runtime.internal.services.SeededRandomProvider;
import org.ecosysx.runtime.model.Agent;
import org.ecosysx.runtime.model.AgentKind;
import org.ecosysx.runtime.model.DeathCause;
import org.ecosysx.runtime.model.UpdateOutcome;
import org.ecosysx.runtime.model.Vector3;
import org.ecosysx.runtime.reasoning.ReasoningScheduler;
import org.ecosysx.runtime.reasoning.RuleBasedPlanner;
import org.ecosysx.runtime.social.CausalBehavior;
import org.ecosysx.runtime.spi.IEngineListener;
import org.ecosysx.runtime.spi.IEnvironment;
import org.ecosysx.runtime.spi.IRandomProvider;
import org.ecosysx.runtime.time.TimeSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the population and drives the simulation one tick at a time.
 * <p>
 * A tick advances the environment, updates every agent of a snapshot of the population, applies
 * deaths and births after the sweep, evaluates contact transmission, records analytics and runs
 * deferred reasoning. Each agent update is isolated: a failure is logged, recorded as an
 * {@link OperationalError} and the agent simply continues.
 * <p>
 * <b>Thread safety:</b> {@link #step()} and the lifecycle methods are serialized on the engine
 * monitor. Auto-run executes steps on a single daemon thread; listeners are called on whichever
 * thread executes the step.
 */
public final class EcosystemEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EcosystemEngine.class);

    private final TimeSystem time;
    private final IRandomProvider root;
    private final ContactTransmissionService contactService;
    private final EcosystemAnalytics analytics;
    private final ReasoningScheduler reasoning;
    private final AgentStepper stepper;
    private final EngineSettings settings;

    private IEnvironment environment;
    private final List<Agent> agents = new ArrayList<>();
    private long tick;
    private int nextSerial;
    private double speed;

    private final ScheduledExecutorService autoRunExecutor;
    private ScheduledFuture<?> autoRun;
    private volatile boolean running;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private final List<IEngineListener> listeners = new CopyOnWriteArrayList<>();

    public EcosystemEngine(TimeSystem time,
                           IRandomProvider root,
                           IEnvironment environment,
                           ContactTransmissionService contactService,
                           EcosystemAnalytics analytics,
                           ReasoningScheduler reasoning,
                           EngineSettings settings) {
        this.time = time;
        this.root = root;
        this.environment = environment;
        this.contactService = contactService;
        this.analytics = analytics;
        this.reasoning = reasoning;
        this.settings = settings;
        this.speed = settings.speed();
        this.stepper = new AgentStepper(time, new CausalBehavior(reasoning));
        this.autoRunExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "engine-autorun");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates an engine with default contact, analytics and deferred reasoning settings.
     */
    public EcosystemEngine(TimeSystem time, IRandomProvider root, IEnvironment environment) {
        this(time, root, environment,
                new ContactTransmissionService(time, ContactTransmissionService.DEFAULT_CONTACT_DISTANCE,
                        ContactTransmissionService.DEFAULT_TRANSMISSION_RATE_PER_DAY, root.deriveFor("contact", 0)),
                new EcosystemAnalytics(time, root.deriveFor("analytics", 0)),
                new ReasoningScheduler(new RuleBasedPlanner(), ReasoningScheduler.Mode.DEFERRED, true, 0.3, 1),
                EngineSettings.DEFAULTS);
    }

    /**
     * Builds a fully wired engine with a {@link DefaultEnvironment} from configuration.
     *
     * @param config configuration containing the {@code ecosysx} section.
     * @return an engine without agents.
     */
    public static EcosystemEngine fromConfig(Config config) {
        Config c = config.getConfig("ecosysx");
        TimeSystem time = new TimeSystem(c.getDouble("time.stepHours"));
        IRandomProvider root = new SeededRandomProvider(c.getLong("seed"));
        IEnvironment environment = DefaultEnvironment.fromConfig(root, time, c.getConfig("environment"));
        ContactTransmissionService contacts = ContactTransmissionService.fromConfig(time, c.getConfig("contact"), root.deriveFor("contact", 0));
        EcosystemAnalytics analytics = EcosystemAnalytics.fromConfig(c.getConfig("analytics"), time, root.deriveFor("analytics", 0));
        ReasoningScheduler reasoning = ReasoningScheduler.fromConfig(new RuleBasedPlanner(), c.getConfig("reasoning"));
        return new EcosystemEngine(time, root, environment, contacts, analytics, reasoning, EngineSettings.fromConfig(c));
    }

    // ---------------------------------------------------------------- population

    /**
     * Creates an agent with the next free serial at the current tick and adds it.
     */
    public synchronized Agent spawnAgent(AgentKind kind, Vector3 position) {
        Agent agent = Agent.create(nextSerial++, kind, position, null, tick, root);
        addAgent(agent);
        return agent;
    }

    public synchronized void addAgent(Agent agent) {
        agents.add(agent);
        nextSerial = Math.max(nextSerial, agent.getSerial() + 1);
        fire(l -> l.agentAdded(agent), "agentAdded");
    }

    // ---------------------------------------------------------------- stepping

    /**
     * Executes one tick.
     *
     * @return false if the tick was skipped because no environment is set.
     */
    public synchronized boolean step() {
        if (environment == null) {
            LOG.warn("No environment set, skipping tick {}", tick);
            return false;
        }
        environment.update(tick);

        List<Agent> snapshot = List.copyOf(agents);
        TickContext ctx = new TickContext(tick, environment, snapshot, time, root, settings.bounds());
        List<Agent> dead = new ArrayList<>();
        List<Agent> parents = new ArrayList<>();
        for (Agent agent : snapshot) {
            UpdateOutcome outcome;
            try {
                outcome = stepper.update(agent, ctx);
            } catch (RuntimeException e) {
                LOG.warn("Update of agent '{}' failed at tick {}: {}", agent.getId(), tick, e.getMessage());
                recordError("AGENT_UPDATE_FAILED", "Agent update failed", "Agent: " + agent.getId() + ", Tick: " + tick + ", Error: " + e);
                outcome = UpdateOutcome.CONTINUE;
            }
            if (outcome == UpdateOutcome.DIE) {
                dead.add(agent);
            } else if (outcome == UpdateOutcome.REPRODUCE) {
                parents.add(agent);
            }
        }

        Map<DeathCause, Integer> deaths = new EnumMap<>(DeathCause.class);
        Map<AgentKind, Integer> births = new EnumMap<>(AgentKind.class);
        removeDead(dead, deaths);
        addNewborns(parents, births);

        ContactReport report = contactService.evaluate(agents, tick);
        ContactTransmissionService.apply(report);

        StepTally tally = new StepTally(births, deaths, ctx.getMessagesSent(), ctx.getResourcesConsumed());
        analytics.recordStep(tick, agents, environment, report, tally);
        reasoning.drainDeferred();

        long completed = tick;
        tick++;

        List<Agent> population = Collections.unmodifiableList(new ArrayList<>(agents));
        Statistics statistics = analytics.getCurrentStatistics();
        fire(l -> l.stepCompleted(completed), "stepCompleted");
        fire(l -> l.populationUpdated(population), "populationUpdated");
        fire(l -> l.resourcesUpdated(environment.getResources()), "resourcesUpdated");
        fire(l -> l.environmentUpdated(environment), "environmentUpdated");
        fire(l -> l.statisticsUpdated(statistics), "statisticsUpdated");

        if (agents.isEmpty() && !snapshot.isEmpty()) {
            LOG.info("Population extinct at tick {}", tick);
            analytics.recordEvent(completed, "extinction", Map.of("tick", tick));
            long endTick = tick;
            fire(l -> l.simulationEnded("extinction", endTick), "simulationEnded");
            pause();
        }
        return true;
    }

    private void removeDead(List<Agent> dead, Map<DeathCause, Integer> deaths) {
        if (dead.isEmpty()) {
            return;
        }
        Set<Agent> doomed = Collections.newSetFromMap(new IdentityHashMap<>());
        doomed.addAll(dead);
        agents.removeIf(doomed::contains);
        for (Agent agent : dead) {
            DeathCause cause = agent.getDeathCause() != null ? agent.getDeathCause() : DeathCause.STARVATION;
            deaths.merge(cause, 1, Integer::sum);
            analytics.recordEvent(tick, "agent_died", Map.of(
                    "id", agent.getId(),
                    "type", agent.getKind().getLabel(),
                    "cause", cause.getKey(),
                    "age", agent.getAge(tick)));
            fire(l -> l.agentRemoved(agent), "agentRemoved");
        }
    }

    private void addNewborns(List<Agent> parents, Map<AgentKind, Integer> births) {
        for (Agent parent : parents) {
            Agent child = stepper.reproduce(parent, tick, nextSerial++, root);
            agents.add(child);
            births.merge(child.getKind(), 1, Integer::sum);
            analytics.recordEvent(tick, "agent_born", Map.of(
                    "id", child.getId(),
                    "parent", parent.getId(),
                    "type", child.getKind().getLabel()));
            fire(l -> l.agentAdded(child), "agentAdded");
        }
    }

    /**
     * Executes up to {@code count} ticks, stopping early on extinction or when a tick is skipped.
     *
     * @return the number of ticks executed.
     */
    public synchronized int step(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Step count must not be negative, got " + count);
        }
        int executed = 0;
        while (executed < count) {
            if (!step()) {
                break;
            }
            executed++;
            if (agents.isEmpty()) {
                break;
            }
        }
        return executed;
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Starts stepping automatically at the interval derived from the current speed.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        schedule();
        LOG.info("Simulation started at tick {} (interval {} ms)", tick, intervalMs());
        fire(l -> l.stateChanged(true), "stateChanged");
    }

    /**
     * Stops automatic stepping. A step already in progress completes.
     */
    public synchronized void pause() {
        if (!running) {
            return;
        }
        running = false;
        if (autoRun != null) {
            autoRun.cancel(false);
            autoRun = null;
        }
        LOG.info("Simulation paused at tick {}", tick);
        fire(l -> l.stateChanged(false), "stateChanged");
    }

    public synchronized void stop() {
        pause();
    }

    /**
     * Pauses and restores the initial empty state: no agents, tick 0, fresh analytics, no pending
     * reasoning and a reset environment.
     */
    public synchronized void reset() {
        pause();
        agents.clear();
        tick = 0;
        nextSerial = 0;
        analytics.reset();
        reasoning.cancelAll();
        if (environment != null) {
            environment.reset();
        }
        LOG.info("Simulation reset");
        fire(IEngineListener::simulationReset, "simulationReset");
    }

    /**
     * Sets the speed multiplier, rescheduling auto-run if active.
     *
     * @throws IllegalArgumentException if {@code speed} is not positive and finite.
     */
    public synchronized void setSpeed(double speed) {
        if (!(speed > 0) || Double.isInfinite(speed)) {
            throw new IllegalArgumentException("Speed must be positive and finite, got " + speed);
        }
        this.speed = speed;
        if (running) {
            if (autoRun != null) {
                autoRun.cancel(false);
            }
            schedule();
        }
    }

    long intervalMs() {
        return Math.max(settings.minIntervalMs(), Math.round(settings.baseIntervalMs() / speed));
    }

    private void schedule() {
        autoRun = autoRunExecutor.scheduleAtFixedRate(() -> {
            try {
                step();
            } catch (RuntimeException e) {
                LOG.warn("Auto-run step failed at tick {}: {}", tick, e.getMessage());
                recordError("STEP_FAILED", "Auto-run step failed", "Tick: " + tick + ", Error: " + e);
            }
        }, 0, intervalMs(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        pause();
        autoRunExecutor.shutdownNow();
        reasoning.close();
    }

    // ---------------------------------------------------------------- listeners & errors

    public void addListener(IEngineListener listener) {
        listeners.add(listener);
    }

    public void removeListener(IEngineListener listener) {
        listeners.remove(listener);
    }

    private void fire(Consumer<IEngineListener> event, String name) {
        for (IEngineListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOG.warn("Listener '{}' failed on {}: {}", listener.getClass().getSimpleName(), name, e.getMessage());
            }
        }
    }

    private void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > settings.maxErrors()) {
            errors.pollFirst();
        }
    }

    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    public void clearErrors() {
        errors.clear();
    }

    // ---------------------------------------------------------------- accessors

    public synchronized EngineState getState() {
        return new EngineState(tick, running, agents.size(), speed);
    }

    /**
     * Returns an unmodifiable view of the live population. Only read it from the thread executing
     * steps or while the engine is paused.
     */
    public List<Agent> getAgents() {
        return Collections.unmodifiableList(agents);
    }

    public Statistics getCurrentStatistics() {
        return analytics.getCurrentStatistics();
    }

    public EcosystemAnalytics getAnalytics() {
        return analytics;
    }

    public ReasoningScheduler getReasoning() {
        return reasoning;
    }

    public synchronized IEnvironment getEnvironment() {
        return environment;
    }

    public synchronized void setEnvironment(IEnvironment environment) {
        this.environment = environment;
    }

    public TimeSystem getTime() {
        return time;
    }

    public IRandomProvider getRandom() {
        return root;
    }

    public synchronized long getTick() {
        return tick;
    }

    public boolean isRunning() {
        return running;
    }

    public double getSpeed() {
        return speed;
    }
}
