package org.ecosysx.runtime;

import com.typesafe.config.Config;

/**
 * Engine pacing and bookkeeping settings.
 *
 * @param baseIntervalMs auto-run interval at speed 1.
 * @param minIntervalMs  lower bound of the auto-run interval.
 * @param speed          initial speed multiplier.
 * @param maxErrors      capacity of the operational error log.
 * @param bounds         half-extent of the square world.
 */
public record EngineSettings(long baseIntervalMs, long minIntervalMs, double speed, int maxErrors, double bounds) {

    public static final EngineSettings DEFAULTS = new EngineSettings(100, 10, 1.0, 1000, 20.0);

    public EngineSettings {
        if (baseIntervalMs <= 0 || minIntervalMs <= 0) {
            throw new IllegalArgumentException("Intervals must be positive");
        }
        if (!(speed > 0) || Double.isInfinite(speed)) {
            throw new IllegalArgumentException("Speed must be positive and finite, got " + speed);
        }
        if (maxErrors <= 0) {
            throw new IllegalArgumentException("maxErrors must be positive, got " + maxErrors);
        }
        if (!(bounds > 0)) {
            throw new IllegalArgumentException("Bounds must be positive, got " + bounds);
        }
    }

    /**
     * Reads the {@code engine} section, with world bounds taken from {@code environment.bounds}.
     *
     * @param root the {@code ecosysx} configuration object.
     */
    public static EngineSettings fromConfig(Config root) {
        Config engine = root.hasPath("engine") ? root.getConfig("engine") : null;
        long base = engine != null && engine.hasPath("baseIntervalMs") ? engine.getLong("baseIntervalMs") : DEFAULTS.baseIntervalMs();
        long min = engine != null && engine.hasPath("minIntervalMs") ? engine.getLong("minIntervalMs") : DEFAULTS.minIntervalMs();
        double speed = engine != null && engine.hasPath("speed") ? engine.getDouble("speed") : DEFAULTS.speed();
        int maxErrors = engine != null && engine.hasPath("maxErrors") ? engine.getInt("maxErrors") : DEFAULTS.maxErrors();
        double bounds = root.hasPath("environment.bounds") ? root.getDouble("environment.bounds") : DEFAULTS.bounds();
        return new EngineSettings(base, min, speed, maxErrors, bounds);
    }
}
