package org.ecosysx.runtime.environment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.ecosysx.runtime.model.WeatherEffects;
import org.ecosysx.runtime.spi.IRandomProvider;
import org.ecosysx.runtime.time.TimeSystem;

/**
 * Seasonal and daily weather with occasional storms, heat waves and cold snaps.
 * <p>
 * Conditions are re-rolled every {@value #UPDATE_INTERVAL} ticks. At most one pattern of each kind
 * is active at a time.
 */
public final class WeatherSystem {

    static final int UPDATE_INTERVAL = 5;
    static final int HISTORY_LIMIT = 100;

    /**
     * An active weather pattern.
     *
     * @param startStep tick the pattern began.
     * @param intensity strength in [0.2, 1], only meaningful for storms.
     * @param duration  length in ticks.
     */
    public record Pattern(long startStep, double intensity, int duration) {
        boolean endedAt(long step) {
            return step - startStep > duration;
        }
    }

    private final IRandomProvider rng;
    private final TimeSystem time;

    private double temperature = 20;
    private double humidity = 0.5;
    private double windSpeed = 5;
    private double precipitation;
    private double cloudCover = 0.3;
    private final Deque<Double> precipitationHistory = new ArrayDeque<>();

    private Pattern storm;
    private Pattern heatWave;
    private Pattern coldSnap;

    private long lastUpdate;
    private WeatherEffects cachedEffects;

    public WeatherSystem(IRandomProvider rng, TimeSystem time) {
        this.rng = rng;
        this.time = time;
    }

    public void update(long step) {
        if (step - lastUpdate < UPDATE_INTERVAL) {
            return;
        }
        updateConditions(step);
        updatePatterns(step);
        lastUpdate = step;
        cachedEffects = null;
    }

    private void updateConditions(long step) {
        double days = time.stepToDays(step);
        double seasonal = 20 + 15 * Math.sin((days / 365.25) * 2 * Math.PI);
        double daily = 8 * Math.sin((days % 1) * 2 * Math.PI);
        temperature = seasonal + daily + (rng.nextDouble() - 0.5) * 6;

        double tempFactor = Math.max(0.2, 1 - (temperature - 10) / 40);
        humidity = Math.max(0.1, Math.min(0.95, 0.5 * tempFactor + (rng.nextDouble() - 0.5) * 0.3));
        windSpeed = Math.max(0, 5 + (rng.nextDouble() - 0.5) * 15);

        double rainChance = Math.max(0, humidity - 0.6) * 2;
        if (rng.nextDouble() < rainChance * 0.1) {
            precipitation = rng.nextDouble() * 20;
        } else {
            precipitation = Math.max(0, precipitation - 2);
        }
        double targetCloud = precipitation > 0 ? 0.7 + rng.nextDouble() * 0.3 : rng.nextDouble() * 0.6;
        cloudCover = cloudCover * 0.8 + targetCloud * 0.2;

        precipitationHistory.addLast(precipitation);
        while (precipitationHistory.size() > HISTORY_LIMIT) {
            precipitationHistory.removeFirst();
        }
    }

    private void updatePatterns(long step) {
        if (storm != null && storm.endedAt(step)) storm = null;
        if (heatWave != null && heatWave.endedAt(step)) heatWave = null;
        if (coldSnap != null && coldSnap.endedAt(step)) coldSnap = null;

        if (precipitation > 15 && windSpeed > 20 && storm == null && rng.nextDouble() < 0.3) {
            storm = new Pattern(step, rng.nextDouble() * 0.8 + 0.2, rng.nextInt(20) + 10);
        }
        if (temperature > 35 && heatWave == null && rng.nextDouble() < 0.2) {
            heatWave = new Pattern(step, 1.0, rng.nextInt(30) + 20);
        }
        if (temperature < -5 && coldSnap == null && rng.nextDouble() < 0.15) {
            coldSnap = new Pattern(step, 1.0, rng.nextInt(25) + 15);
        }
    }

    public WeatherEffects getEffects() {
        if (cachedEffects == null) {
            cachedEffects = computeEffects();
        }
        return cachedEffects;
    }

    private WeatherEffects computeEffects() {
        double energy = 1.0;
        double movement = 1.0;
        double infection = 1.0;
        double shelterNeed = 0.0;
        double visibilityLoss = 0.0;

        if (temperature < 0) {
            energy += 0.3;
            movement *= 0.8;
            shelterNeed = Math.max(shelterNeed, 0.6);
        } else if (temperature > 35) {
            energy += 0.2;
            movement *= 0.9;
            shelterNeed = Math.max(shelterNeed, 0.4);
        }
        if (precipitation > 5) {
            movement *= 0.85;
            visibilityLoss += 0.2;
            shelterNeed = Math.max(shelterNeed, 0.3);
        }
        if (precipitation > 15) {
            movement *= 0.7;
            visibilityLoss += 0.4;
            shelterNeed = Math.max(shelterNeed, 0.7);
        }
        if (windSpeed > 25) {
            energy += 0.15;
            movement *= 0.9;
            shelterNeed = Math.max(shelterNeed, 0.5);
        }
        if (humidity > 0.7) {
            infection *= 1.2;
        } else if (humidity < 0.3) {
            infection *= 0.8;
        }
        if (storm != null) {
            energy += 0.4 * storm.intensity();
            movement *= 1 - 0.3 * storm.intensity();
            shelterNeed = Math.max(shelterNeed, 0.8 * storm.intensity());
            visibilityLoss += 0.5 * storm.intensity();
        }
        if (heatWave != null) {
            energy += 0.3;
            shelterNeed = Math.max(shelterNeed, 0.6);
        }
        if (coldSnap != null) {
            energy += 0.5;
            movement *= 0.7;
            shelterNeed = Math.max(shelterNeed, 0.8);
        }
        double spawn = shelterNeed > 0.5 ? 0.6 : 1.0;
        return new WeatherEffects(movement, energy, infection, spawn, Math.max(0.1, 1.0 - visibilityLoss), shelterNeed);
    }

    /**
     * Mean precipitation over the last {@code count} weather updates, 5 when there is no history yet.
     */
    public double averagePrecipitation(int count) {
        if (precipitationHistory.isEmpty()) {
            return 5.0;
        }
        List<Double> all = new ArrayList<>(precipitationHistory);
        List<Double> recent = all.subList(Math.max(0, all.size() - count), all.size());
        double sum = 0;
        for (double p : recent) {
            sum += p;
        }
        return sum / recent.size();
    }

    public String getCondition() {
        if (precipitation > 15) return "heavy_rain";
        if (precipitation > 5) return "light_rain";
        if (cloudCover > 0.8) return "overcast";
        if (cloudCover > 0.5) return "partly_cloudy";
        if (temperature > 35) return "hot";
        if (temperature < 0) return "freezing";
        return "clear";
    }

    public List<String> getActivePatterns() {
        List<String> patterns = new ArrayList<>();
        if (storm != null) patterns.add("storm");
        if (heatWave != null) patterns.add("heat_wave");
        if (coldSnap != null) patterns.add("cold_snap");
        return patterns;
    }

    public double getTemperature() {
        return temperature;
    }

    public double getHumidity() {
        return humidity;
    }

    public double getWindSpeed() {
        return windSpeed;
    }

    public double getPrecipitation() {
        return precipitation;
    }

    public double getCloudCover() {
        return cloudCover;
    }

    /** Intensity of the active storm, 0 when there is none. */
    public double getStormIntensity() {
        return storm != null ? storm.intensity() : 0.0;
    }

    // Test hook for forcing conditions.
    void setConditions(double temperature, double humidity, double windSpeed, double precipitation) {
        this.temperature = temperature;
        this.humidity = humidity;
        this.windSpeed = windSpeed;
        this.precipitation = precipitation;
        this.cachedEffects = null;
    }
}
