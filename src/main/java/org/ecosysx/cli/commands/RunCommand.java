package org.ecosysx.cli.commands;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.ecosysx.analytics.AnalyticsExporter;
import org.ecosysx.analytics.Statistics;
import org.ecosysx.cli.CommandLineInterface;
import org.ecosysx.runtime.EcosystemEngine;
import org.ecosysx.runtime.spi.IEngineListener;
import org.ecosysx.runtime.worldgen.InitialPopulationCreator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs a headless simulation for a fixed number of steps and prints a summary.
 * <p>
 * Without {@code --speed} steps execute back to back. With it the engine's auto-run paces them.
 */
@Command(
    name = "run",
    description = "Run a headless simulation"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    @Option(names = {"--steps"}, defaultValue = "1000", description = "Number of steps to run (default: ${DEFAULT-VALUE})")
    private int steps;

    @Option(names = {"--seed"}, description = "Master seed, overrides ecosysx.seed")
    private Long seed;

    @Option(names = {"--basic"}, description = "Initial number of basic agents")
    private Integer basic;

    @Option(names = {"--rl"}, description = "Initial number of learning agents")
    private Integer rl;

    @Option(names = {"--causal"}, description = "Initial number of causal agents")
    private Integer causal;

    @Option(names = {"--infected-fraction"}, description = "Share of the initial population that starts infected")
    private Double infectedFraction;

    @Option(names = {"--export"}, description = "Write the analytics export as JSON to this file")
    private Path exportFile;

    @Option(names = {"--speed"}, description = "Pace the run with auto-run at this speed multiplier")
    private Double speed;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        Config config;
        try {
            if (steps < 0) {
                throw new IllegalArgumentException("--steps must not be negative, got " + steps);
            }
            config = withOverrides(parent.getConfig());
        } catch (IllegalArgumentException | ConfigException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        Statistics statistics;
        try (EcosystemEngine engine = EcosystemEngine.fromConfig(config)) {
            new InitialPopulationCreator(engine.getRandom().deriveFor("population", 0),
                    config.getConfig("ecosysx.population")).populate(engine);
            if (speed != null) {
                runPaced(engine);
            } else {
                engine.step(steps);
            }
            statistics = engine.getCurrentStatistics();
            if (exportFile != null) {
                new AnalyticsExporter().write(engine.getAnalytics().exportAnalytics(), exportFile);
            }
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            LOG.error("Failed to write export to {}: {}", exportFile, e.getMessage());
            err.println("Error: could not write " + exportFile + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_IO_ERROR;
        }

        out.printf("Finished at step %d: population %d (S=%d I=%d R=%d), avg energy %.1f, resources %d, %d windows, %d checkpoints%n",
                statistics.tick(), statistics.population(), statistics.susceptible(), statistics.infected(),
                statistics.recovered(), statistics.averageEnergy(), statistics.resources(),
                statistics.windows(), statistics.checkpoints());
        if (exportFile != null) {
            out.println("Analytics written to " + exportFile.toAbsolutePath());
        }
        return EXIT_OK;
    }

    private Config withOverrides(Config config) {
        Map<String, Object> overrides = new HashMap<>();
        if (seed != null) {
            overrides.put("ecosysx.seed", seed);
        }
        if (basic != null) {
            overrides.put("ecosysx.population.basic", basic);
        }
        if (rl != null) {
            overrides.put("ecosysx.population.rl", rl);
        }
        if (causal != null) {
            overrides.put("ecosysx.population.causal", causal);
        }
        if (infectedFraction != null) {
            overrides.put("ecosysx.population.infectedFraction", infectedFraction);
        }
        if (speed != null) {
            overrides.put("ecosysx.engine.speed", speed);
        }
        return ConfigFactory.parseMap(overrides).withFallback(config);
    }

    private void runPaced(EcosystemEngine engine) throws InterruptedException {
        if (steps == 0) {
            return;
        }
        CountDownLatch done = new CountDownLatch(1);
        engine.addListener(new IEngineListener() {
            @Override
            public void stepCompleted(long tick) {
                if (tick + 1 >= steps) {
                    engine.pause();
                    done.countDown();
                }
            }

            @Override
            public void simulationEnded(String reason, long tick) {
                done.countDown();
            }
        });
        engine.start();
        done.await();
    }
}
