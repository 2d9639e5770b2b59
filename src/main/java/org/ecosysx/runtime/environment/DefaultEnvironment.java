package org.ecosysx.runtime.environment;

import java.util.Collection;

import com.typesafe.config.Config;
import org.ecosysx.runtime.model.EnvironmentalStress;
import org.ecosysx.runtime.model.Resource;
import org.ecosysx.runtime.model.TerrainEffects;
import org.ecosysx.runtime.model.Vector3;
import org.ecosysx.runtime.model.WeatherEffects;
import org.ecosysx.runtime.spi.IEnvironment;
import org.ecosysx.runtime.spi.IRandomProvider;
import org.ecosysx.runtime.time.TimeSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link IEnvironment} combining weather, terrain and resources.
 * <p>
 * Each subsystem draws from its own stream derived from the root provider, so {@link #reset()}
 * reproduces the initial world exactly.
 */
public final class DefaultEnvironment implements IEnvironment {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultEnvironment.class);

    static final int STRESS_INTERVAL = 3;
    static final int DROUGHT_WINDOW = 20;

    private final IRandomProvider root;
    private final TimeSystem time;
    private final int maxResources;
    private final double bounds;

    private WeatherSystem weather;
    private TerrainSystem terrain;
    private ResourceSystem resources;
    private EnvironmentalStress stress;
    private long lastStressUpdate;

    public DefaultEnvironment(IRandomProvider root, TimeSystem time, int maxResources, double bounds) {
        this.root = root;
        this.time = time;
        this.maxResources = maxResources;
        this.bounds = bounds;
        init();
    }

    /**
     * Creates an environment from the {@code environment} section of the configuration.
     */
    public static DefaultEnvironment fromConfig(IRandomProvider root, TimeSystem time, Config config) {
        int maxResources = config.hasPath("maxResources") ? config.getInt("maxResources") : 25;
        double bounds = config.hasPath("bounds") ? config.getDouble("bounds") : 20.0;
        return new DefaultEnvironment(root, time, maxResources, bounds);
    }

    private void init() {
        weather = new WeatherSystem(root.deriveFor("weather", 0), time);
        terrain = new TerrainSystem(root.deriveFor("terrain", 0));
        resources = new ResourceSystem(root.deriveFor("resources", 0), maxResources, bounds);
        stress = EnvironmentalStress.NONE;
        lastStressUpdate = 0;
    }

    @Override
    public void update(long tick) {
        weather.update(tick);
        resources.update(weather.getEffects(), terrain);
        if (tick - lastStressUpdate >= STRESS_INTERVAL) {
            updateStress();
            lastStressUpdate = tick;
        }
    }

    private void updateStress() {
        double t = weather.getTemperature();
        double heat = Math.max(0, (t - 30) / 15);
        double cold = Math.max(0, (5 - t) / 15);
        double storm = weather.getStormIntensity();
        double drought = Math.max(0, (3 - weather.averagePrecipitation(DROUGHT_WINDOW)) / 3);
        stress = new EnvironmentalStress(heat, cold, storm, drought, (heat + cold + storm + drought) / 4);
    }

    @Override
    public Collection<Resource> getResources() {
        return resources.getResources();
    }

    @Override
    public double consumeResource(String resourceId) {
        return resources.consume(resourceId);
    }

    @Override
    public WeatherEffects getWeatherEffects() {
        return weather.getEffects();
    }

    @Override
    public TerrainEffects getTerrainEffects(Vector3 position) {
        return terrain.getEffects(position);
    }

    @Override
    public EnvironmentalStress getEnvironmentalStress() {
        return stress;
    }

    @Override
    public void reset() {
        init();
        LOG.debug("Environment reset");
    }

    public WeatherSystem getWeather() {
        return weather;
    }

    public TerrainSystem getTerrain() {
        return terrain;
    }

    ResourceSystem getResourceSystem() {
        return resources;
    }
}
