package org.ecosysx.runtime.reasoning;

import java.util.ArrayDeque;
import java.util.Locale;
import java.util.Queue;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.typesafe.config.Config;
import org.ecosysx.runtime.social.SocialExtension;
import org.ecosysx.runtime.spi.IReasoningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs planning requests decoupled from the agent update that issued them.
 * <p>
 * In {@link Mode#DEFERRED} mode requests are queued and executed by {@link #drainDeferred()} after
 * the sweep of the issuing tick, which keeps runs reproducible. In {@link Mode#BACKGROUND} mode they
 * run on a small worker pool. In both modes the result becomes visible to the agent through
 * {@link SocialExtension#pollQueuedResult(long)} on a strictly later tick, and at most one request
 * per agent is outstanding.
 * <p>
 * Failures are logged and never reach the tick loop.
 */
public final class ReasoningScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ReasoningScheduler.class);

    public enum Mode {
        DEFERRED,
        BACKGROUND;

        public static Mode parse(String value) {
            try {
                return Mode.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown reasoning mode '" + value + "', expected 'deferred' or 'background'", e);
            }
        }
    }

    private record Task(SocialExtension target, ReasoningRequest request, long generation) {
    }

    private final IReasoningService service;
    private final Mode mode;
    private final boolean enabled;
    private final double frequency;
    private final ExecutorService executor;

    private final Queue<Task> deferred = new ArrayDeque<>();
    private final Map<CompletableFuture<Void>, Task> running = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public ReasoningScheduler(IReasoningService service, Mode mode, boolean enabled, double frequency, int threads) {
        if (frequency < 0 || frequency > 1) {
            throw new IllegalArgumentException("Reasoning frequency must be in [0, 1], got " + frequency);
        }
        this.service = service;
        this.mode = mode;
        this.enabled = enabled;
        this.frequency = frequency;
        if (enabled && mode == Mode.BACKGROUND) {
            if (threads <= 0) {
                throw new IllegalArgumentException("Reasoning threads must be positive, got " + threads);
            }
            AtomicInteger counter = new AtomicInteger();
            this.executor = Executors.newFixedThreadPool(threads, r -> {
                Thread t = new Thread(r, "reasoning-" + counter.getAndIncrement());
                t.setDaemon(true);
                return t;
            });
        } else {
            this.executor = null;
        }
    }

    /**
     * Creates a scheduler from the {@code reasoning} section of the engine configuration.
     */
    public static ReasoningScheduler fromConfig(IReasoningService service, Config config) {
        boolean enabled = !config.hasPath("enabled") || config.getBoolean("enabled");
        Mode mode = config.hasPath("mode") ? Mode.parse(config.getString("mode")) : Mode.DEFERRED;
        double frequency = config.hasPath("frequency") ? config.getDouble("frequency") : 0.3;
        int threads = config.hasPath("threads") ? config.getInt("threads") : 1;
        return new ReasoningScheduler(service, mode, enabled, frequency, threads);
    }

    public static ReasoningScheduler disabled() {
        return new ReasoningScheduler(new RuleBasedPlanner(), Mode.DEFERRED, false, 0.0, 1);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public double getFrequency() {
        return frequency;
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * Submits a request unless one is already outstanding for the target agent.
     *
     * @return true if the request was accepted.
     */
    public boolean submit(SocialExtension target, ReasoningRequest request) {
        if (!enabled || !target.tryBeginReasoning()) {
            return false;
        }
        Task task = new Task(target, request, generation.get());
        if (mode == Mode.DEFERRED) {
            deferred.add(task);
        } else {
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> execute(task), executor);
            running.put(future, task);
            future.whenComplete((v, t) -> running.remove(future));
        }
        return true;
    }

    /**
     * Executes all queued deferred requests on the calling thread.
     *
     * @return the number of requests executed.
     */
    public int drainDeferred() {
        int count = 0;
        Task task;
        while ((task = deferred.poll()) != null) {
            execute(task);
            count++;
        }
        return count;
    }

    /**
     * Drops every queued and running request. Results of requests that are already executing are
     * discarded when they complete.
     */
    public void cancelAll() {
        generation.incrementAndGet();
        Task task;
        while ((task = deferred.poll()) != null) {
            task.target().abortReasoning();
        }
        for (Map.Entry<CompletableFuture<Void>, Task> entry : running.entrySet()) {
            entry.getKey().cancel(false);
            entry.getValue().target().abortReasoning();
        }
        running.clear();
    }

    public int pendingCount() {
        return deferred.size() + running.size();
    }

    public long getCompletedCount() {
        return completed.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    private void execute(Task task) {
        try {
            ReasoningResult result = service.reason(task.request());
            // cancelAll() already released the agent
            if (task.generation() != generation.get()) {
                return;
            }
            task.target().completeReasoning(result);
            completed.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            if (task.generation() == generation.get()) {
                task.target().abortReasoning();
            }
            LOG.warn("Reasoning for agent '{}' failed at tick {}: {}", task.request().agentId(), task.request().tick(), e.getMessage());
        }
    }

    @Override
    public void close() {
        cancelAll();
        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    LOG.warn("Reasoning workers did not terminate within 1 second");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
