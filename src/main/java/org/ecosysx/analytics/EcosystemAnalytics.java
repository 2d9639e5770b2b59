package org.ecosysx.analytics;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.typesafe.config.Config;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.ecosysx.runtime.contact.ContactReport;
import org.ecosysx.runtime.model.Agent;
import org.ecosysx.runtime.model.AgentKind;
import org.ecosysx.runtime.model.DeathCause;
import org.ecosysx.runtime.model.HealthStatus;
import org.ecosysx.runtime.model.MessageType;
import org.ecosysx.runtime.social.SocialExtension;
import org.ecosysx.runtime.spi.IEnvironment;
import org.ecosysx.runtime.spi.IRandomProvider;
import org.ecosysx.runtime.time.TimeSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns per-step population snapshots into windowed aggregates, a persistent contact matrix, a
 * sampled agent panel and periodic checkpoints.
 * <p>
 * Analytics only observes. Contacts and transmissions arrive as a {@link ContactReport} produced
 * by the contact service; agents are never modified here.
 * <p>
 * The panel keeps up to {@code panelSize} agents. Once full, an agent replaces a random member
 * with probability {@code panelSize / (step + 1)} times a fixed gate, which favours recent agents
 * over a uniform sample of history.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. Driven by the engine's tick thread.
 */
public final class EcosystemAnalytics {

    private static final Logger LOG = LoggerFactory.getLogger(EcosystemAnalytics.class);

    public static final int DEFAULT_WINDOW_SIZE = 100;
    public static final int DEFAULT_CHECKPOINT_INTERVAL = 1000;
    public static final int DEFAULT_PANEL_SIZE = 200;
    public static final int DEFAULT_WINDOW_HISTORY_LIMIT = 50;
    public static final int DEFAULT_CHECKPOINT_LIMIT = 10;
    public static final double DEFAULT_PANEL_REPLACEMENT_GATE = 0.05;
    public static final int DEFAULT_MAX_EVENTS_PER_WINDOW = 1000;

    static final int RECENT_WINDOWS_PER_CHECKPOINT = 5;

    private final int windowSize;
    private final int checkpointInterval;
    private final int panelSize;
    private final int windowHistoryLimit;
    private final int checkpointLimit;
    private final double panelReplacementGate;
    private final int maxEventsPerWindow;
    private final TimeSystem time;
    private final IRandomProvider rng;

    private final WindowAccumulator window = new WindowAccumulator();
    private final Deque<WindowSummary> windowHistory = new ArrayDeque<>();
    private final Deque<Checkpoint> checkpoints = new ArrayDeque<>();
    private final Map<String, PanelEntry> panel = new LinkedHashMap<>();
    private final ObjectArrayList<String> panelIds = new ObjectArrayList<>();
    private final Long2ObjectLinkedOpenHashMap<ContactMatrixEntry> contactMatrix = new Long2ObjectLinkedOpenHashMap<>();
    private final List<IAnalyticsListener> listeners = new CopyOnWriteArrayList<>();

    private long currentStep;
    private long windowStart;
    private long stepsRecorded;
    private long totalWindows;
    private long lastCheckpointNanos = System.nanoTime();
    private long stepsAtLastCheckpoint;
    private Statistics lastStatistics = Statistics.EMPTY;

    public EcosystemAnalytics(int windowSize, int checkpointInterval, int panelSize, int windowHistoryLimit,
                              int checkpointLimit, double panelReplacementGate, int maxEventsPerWindow,
                              TimeSystem time, IRandomProvider rng) {
        requirePositive("windowSize", windowSize);
        requirePositive("checkpointInterval", checkpointInterval);
        requirePositive("panelSize", panelSize);
        requirePositive("windowHistoryLimit", windowHistoryLimit);
        requirePositive("checkpointLimit", checkpointLimit);
        requirePositive("maxEventsPerWindow", maxEventsPerWindow);
        if (panelReplacementGate < 0 || panelReplacementGate > 1) {
            throw new IllegalArgumentException("panelReplacementGate must be in [0, 1], got " + panelReplacementGate);
        }
        this.windowSize = windowSize;
        this.checkpointInterval = checkpointInterval;
        this.panelSize = panelSize;
        this.windowHistoryLimit = windowHistoryLimit;
        this.checkpointLimit = checkpointLimit;
        this.panelReplacementGate = panelReplacementGate;
        this.maxEventsPerWindow = maxEventsPerWindow;
        this.time = time;
        this.rng = rng;
    }

    public EcosystemAnalytics(TimeSystem time, IRandomProvider rng) {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_CHECKPOINT_INTERVAL, DEFAULT_PANEL_SIZE, DEFAULT_WINDOW_HISTORY_LIMIT,
                DEFAULT_CHECKPOINT_LIMIT, DEFAULT_PANEL_REPLACEMENT_GATE, DEFAULT_MAX_EVENTS_PER_WINDOW, time, rng);
    }

    /**
     * Creates analytics from the {@code analytics} section of the configuration.
     */
    public static EcosystemAnalytics fromConfig(Config config, TimeSystem time, IRandomProvider rng) {
        return new EcosystemAnalytics(
                config.hasPath("windowSize") ? config.getInt("windowSize") : DEFAULT_WINDOW_SIZE,
                config.hasPath("checkpointInterval") ? config.getInt("checkpointInterval") : DEFAULT_CHECKPOINT_INTERVAL,
                config.hasPath("panelSize") ? config.getInt("panelSize") : DEFAULT_PANEL_SIZE,
                config.hasPath("windowHistoryLimit") ? config.getInt("windowHistoryLimit") : DEFAULT_WINDOW_HISTORY_LIMIT,
                config.hasPath("checkpointLimit") ? config.getInt("checkpointLimit") : DEFAULT_CHECKPOINT_LIMIT,
                config.hasPath("panelReplacementGate") ? config.getDouble("panelReplacementGate") : DEFAULT_PANEL_REPLACEMENT_GATE,
                config.hasPath("maxEventsPerWindow") ? config.getInt("maxEventsPerWindow") : DEFAULT_MAX_EVENTS_PER_WINDOW,
                time,
                rng);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    public void addListener(IAnalyticsListener listener) {
        listeners.add(listener);
    }

    public void removeListener(IAnalyticsListener listener) {
        listeners.remove(listener);
    }

    /**
     * Records one completed step.
     *
     * @param step        the step that just completed.
     * @param agents      the population after births and deaths were applied.
     * @param environment the environment, may be {@code null}.
     * @param contacts    contacts and transmissions evaluated this step.
     * @param tally       births, deaths, messages and consumption of this step.
     */
    public void recordStep(long step, List<Agent> agents, IEnvironment environment, ContactReport contacts, StepTally tally) {
        currentStep = step;
        stepsRecorded++;

        recordContacts(contacts);
        recordInfectiousTime(agents);
        recordEnergy(agents);
        window.resourcesAvailable = environment != null ? environment.getResources().size() : 0;
        recordTally(tally);
        updatePanel(agents);

        if (step - windowStart >= windowSize) {
            finalizeWindow(step, agents);
        }
        if (step > 0 && step % checkpointInterval == 0) {
            createCheckpoint(agents);
        }
        lastStatistics = computeStatistics(step, agents, window.resourcesAvailable);
    }

    private void recordContacts(ContactReport report) {
        if (report == null) {
            return;
        }
        for (ContactReport.Contact c : report.contacts()) {
            String a = c.first().getKind().getLabel();
            String b = c.second().getKind().getLabel();
            window.contactsByType.addTo(a + "_" + b, 1);
            window.contactsByType.addTo(b + "_" + a, 1);

            long key = c.pairKey();
            ContactMatrixEntry entry = contactMatrix.get(key);
            if (entry == null) {
                entry = new ContactMatrixEntry(c.first().getId(), c.second().getId(), a, b, report.tick());
                contactMatrix.put(key, entry);
            }
            entry.addContact(report.contactHours(), report.tick());
        }
        for (ContactReport.Transmission t : report.transmissions()) {
            window.infectionsCaused.addTo(t.source().getId(), 1);
            ContactMatrixEntry entry = contactMatrix.get(t.pairKey());
            if (entry != null) {
                entry.addTransmission();
            }
        }
    }

    private void recordInfectiousTime(List<Agent> agents) {
        for (Agent agent : agents) {
            if (agent.isInfected()) {
                window.infectiousHours.addTo(agent.getKind().getLabel(), time.getStepHours());
            }
        }
    }

    private void recordEnergy(List<Agent> agents) {
        Map<String, double[]> byType = new TreeMap<>();
        for (Agent agent : agents) {
            // sum, count, at cap
            double[] acc = byType.computeIfAbsent(agent.getKind().getLabel(), k -> new double[3]);
            acc[0] += agent.getEnergy();
            acc[1]++;
            if (agent.getEnergy() >= Agent.MAX_ENERGY) {
                acc[2]++;
            }
        }
        window.energy.clear();
        for (Map.Entry<String, double[]> e : byType.entrySet()) {
            double[] acc = e.getValue();
            double mean = Math.round(acc[0] / acc[1] * 10) / 10.0;
            double pct = Math.round(acc[2] / acc[1] * 1000) / 10.0;
            window.energy.put(e.getKey(), new EnergyStats(mean, (int) acc[1], pct));
        }
    }

    private void recordTally(StepTally tally) {
        if (tally == null) {
            return;
        }
        window.resourcesConsumed += tally.resourcesConsumed();
        for (Map.Entry<AgentKind, Integer> e : tally.births().entrySet()) {
            window.births.addTo(e.getKey().getLabel(), e.getValue());
        }
        for (Map.Entry<DeathCause, Integer> e : tally.deaths().entrySet()) {
            window.deaths.addTo(e.getKey().getKey(), e.getValue());
        }
        for (Map.Entry<MessageType, Integer> e : tally.messages().entrySet()) {
            window.comms.addTo(e.getKey().getKey(), e.getValue());
        }
    }

    private void updatePanel(List<Agent> agents) {
        for (Agent agent : agents) {
            if (panel.size() < panelSize) {
                if (panel.put(agent.getId(), capture(agent)) == null) {
                    panelIds.add(agent.getId());
                }
                continue;
            }
            if (rng.nextDouble() >= (double) panelSize / (currentStep + 1)) {
                continue;
            }
            if (rng.nextDouble() >= panelReplacementGate) {
                continue;
            }
            if (panel.containsKey(agent.getId())) {
                panel.put(agent.getId(), capture(agent));
                continue;
            }
            int victim = rng.nextInt(panelIds.size());
            String evicted = panelIds.get(victim);
            panelIds.set(victim, agent.getId());
            panel.remove(evicted);
            panel.put(agent.getId(), capture(agent));
        }
    }

    private PanelEntry capture(Agent agent) {
        SocialExtension social = agent.getSocial();
        double trust = social != null ? Math.round(social.getSocialMemory().averageTrust() * 100) / 100.0 : 0.5;
        return new PanelEntry(
                agent.getId(),
                agent.getKind().getLabel(),
                agent.getAge(currentStep),
                Math.round(agent.getEnergy()),
                agent.getStatus().getLabel(),
                trust,
                Math.round(agent.getX() * 10) / 10.0,
                Math.round(agent.getZ() * 10) / 10.0);
    }

    private void finalizeWindow(long step, List<Agent> agents) {
        Map<String, Integer> byType = new TreeMap<>();
        Map<String, Integer> byHealth = new TreeMap<>();
        Map<String, Integer> infectiousByType = new TreeMap<>();
        int infected = 0;
        for (Agent agent : agents) {
            byType.merge(agent.getKind().getLabel(), 1, Integer::sum);
            byHealth.merge(agent.getStatus().getLabel(), 1, Integer::sum);
            if (agent.getStatus() == HealthStatus.INFECTED) {
                infected++;
                infectiousByType.merge(agent.getKind().getLabel(), 1, Integer::sum);
            }
        }
        WindowSummary summary = new WindowSummary(
                windowStart,
                step - windowStart,
                new WindowSummary.Population(agents.size(), byType, byHealth),
                new WindowSummary.Epidemic(infected, infectiousByType,
                        WindowAccumulator.sorted(window.infectionsCaused),
                        WindowAccumulator.sorted(window.infectiousHours)),
                WindowAccumulator.sorted(window.comms),
                new TreeMap<>(window.energy),
                new WindowSummary.Resources(window.resourcesAvailable, window.resourcesConsumed),
                WindowAccumulator.sorted(window.contactsByType),
                WindowAccumulator.sorted(window.births),
                WindowAccumulator.sorted(window.deaths),
                window.events.size() + window.droppedEvents);

        windowHistory.addLast(summary);
        while (windowHistory.size() > windowHistoryLimit) {
            windowHistory.removeFirst();
        }
        totalWindows++;
        windowStart = step;
        window.clear();
        LOG.debug("Window [{}, {}] finalized: population {}, {} infected", summary.t0(), step, agents.size(), infected);

        for (IAnalyticsListener listener : listeners) {
            try {
                listener.windowCompleted(summary);
            } catch (RuntimeException e) {
                LOG.warn("Analytics listener failed on window completion: {}", e.getMessage());
            }
        }
    }

    private void createCheckpoint(List<Agent> agents) {
        long now = System.nanoTime();
        double seconds = (now - lastCheckpointNanos) / 1e9;
        double stepsPerSecond = seconds > 0 ? (stepsRecorded - stepsAtLastCheckpoint) / seconds : 0.0;
        lastCheckpointNanos = now;
        stepsAtLastCheckpoint = stepsRecorded;
        Runtime runtime = Runtime.getRuntime();
        long memoryMb = (runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024);

        Checkpoint checkpoint = new Checkpoint(
                currentStep,
                agents.size(),
                windowHistory.size(),
                List.copyOf(panel.values()),
                recentWindows(RECENT_WINDOWS_PER_CHECKPOINT),
                new Checkpoint.Performance(Math.round(stepsPerSecond * 10) / 10.0, memoryMb));
        checkpoints.addLast(checkpoint);
        while (checkpoints.size() > checkpointLimit) {
            checkpoints.removeFirst();
        }
        LOG.info("Checkpoint at step {}: {} agents, {} windows analyzed", currentStep, agents.size(), windowHistory.size());

        for (IAnalyticsListener listener : listeners) {
            try {
                listener.checkpointCreated(checkpoint);
            } catch (RuntimeException e) {
                LOG.warn("Analytics listener failed on checkpoint: {}", e.getMessage());
            }
        }
    }

    /**
     * Appends an event stamped with the last recorded step to the current window's log.
     *
     * @see #recordEvent(long, String, Map)
     */
    public void recordEvent(String type, Map<String, Object> data) {
        recordEvent(currentStep, type, data);
    }

    /**
     * Appends an event that happened at {@code step} to the current window's log. Once the log
     * holds {@code maxEventsPerWindow} entries further events are only counted.
     */
    public void recordEvent(long step, String type, Map<String, Object> data) {
        AnalyticsEvent event = new AnalyticsEvent(step, type, data, System.currentTimeMillis());
        if (window.events.size() < maxEventsPerWindow) {
            window.events.add(event);
        } else {
            window.droppedEvents++;
        }
        for (IAnalyticsListener listener : listeners) {
            try {
                listener.eventRecorded(event);
            } catch (RuntimeException e) {
                LOG.warn("Analytics listener failed on event '{}': {}", type, e.getMessage());
            }
        }
    }

    public AnalyticsExport exportAnalytics() {
        List<ContactMatrixEntry> matrix = new ArrayList<>(contactMatrix.size());
        for (ContactMatrixEntry entry : contactMatrix.values()) {
            matrix.add(entry.copy());
        }
        return new AnalyticsExport(
                new AnalyticsExport.Metadata(currentStep, windowSize, checkpointInterval, time.getStepHours(), Instant.now().toString()),
                new AnalyticsExport.Summary(currentStep, windowHistory.size(), checkpoints.size(), panel.size(), contactMatrix.size()),
                List.copyOf(windowHistory),
                List.copyOf(checkpoints),
                List.copyOf(panel.values()),
                matrix);
    }

    private static Statistics computeStatistics(long step, List<Agent> agents, int resources) {
        Map<String, Integer> byType = new TreeMap<>();
        int susceptible = 0;
        int infected = 0;
        int recovered = 0;
        double energy = 0;
        for (Agent agent : agents) {
            byType.merge(agent.getKind().getLabel(), 1, Integer::sum);
            switch (agent.getStatus()) {
                case SUSCEPTIBLE -> susceptible++;
                case INFECTED -> infected++;
                case RECOVERED -> recovered++;
            }
            energy += agent.getEnergy();
        }
        double average = agents.isEmpty() ? 0.0 : energy / agents.size();
        return new Statistics(step, agents.size(), byType, susceptible, infected, recovered, average, resources, 0, 0);
    }

    /**
     * Returns statistics of the last recorded step, with window and checkpoint counts filled in.
     */
    public Statistics getCurrentStatistics() {
        Statistics s = lastStatistics;
        return new Statistics(s.tick(), s.population(), s.byType(), s.susceptible(), s.infected(), s.recovered(),
                s.averageEnergy(), s.resources(), (int) totalWindows, checkpoints.size());
    }

    /**
     * Clears all windows, checkpoints, the panel and the contact matrix.
     */
    public void reset() {
        window.clear();
        windowHistory.clear();
        checkpoints.clear();
        panel.clear();
        panelIds.clear();
        contactMatrix.clear();
        currentStep = 0;
        windowStart = 0;
        stepsRecorded = 0;
        totalWindows = 0;
        stepsAtLastCheckpoint = 0;
        lastCheckpointNanos = System.nanoTime();
        lastStatistics = Statistics.EMPTY;
    }

    public List<WindowSummary> getWindowHistory() {
        return List.copyOf(windowHistory);
    }

    public List<WindowSummary> recentWindows(int count) {
        List<WindowSummary> all = new ArrayList<>(windowHistory);
        return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
    }

    public List<Checkpoint> getCheckpoints() {
        return List.copyOf(checkpoints);
    }

    public Map<String, PanelEntry> getPanel() {
        return Map.copyOf(panel);
    }

    public int getContactMatrixSize() {
        return contactMatrix.size();
    }

    /** Returns a copy of the matrix entry for two agent serials, or {@code null}. */
    public ContactMatrixEntry getContactEntry(int serialA, int serialB) {
        ContactMatrixEntry entry = contactMatrix.get(ContactReport.pairKey(serialA, serialB));
        return entry != null ? entry.copy() : null;
    }

    /** Events logged in the current, not yet finalized window. */
    public List<AnalyticsEvent> getCurrentWindowEvents() {
        return List.copyOf(window.events);
    }

    public long getCurrentStep() {
        return currentStep;
    }

    public long getWindowStart() {
        return windowStart;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getCheckpointInterval() {
        return checkpointInterval;
    }

    public int getPanelSize() {
        return panelSize;
    }
}
