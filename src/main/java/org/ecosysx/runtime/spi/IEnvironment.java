package org.ecosysx.runtime.spi;

import java.util.Collection;

import org.ecosysx.runtime.model.EnvironmentalStress;
import org.ecosysx.runtime.model.Resource;
import org.ecosysx.runtime.model.TerrainEffects;
import org.ecosysx.runtime.model.Vector3;
import org.ecosysx.runtime.model.WeatherEffects;

/**
 * The world agents live in: resources, weather and terrain.
 * <p>
 * The resource set is mutated only through {@link #update(long)}, {@link #consumeResource(String)}
 * and {@link #reset()}; agents never modify it directly.
 */
public interface IEnvironment {

    /**
     * Advances weather, stress and resources to the given tick. Called once per tick before any
     * agent update.
     */
    void update(long tick);

    /**
     * Returns an unmodifiable view of the resources currently available.
     */
    Collection<Resource> getResources();

    /**
     * Consumes a resource.
     *
     * @param resourceId the id of the resource.
     * @return the value consumed, or 0 if no such resource exists.
     */
    double consumeResource(String resourceId);

    WeatherEffects getWeatherEffects();

    TerrainEffects getTerrainEffects(Vector3 position);

    EnvironmentalStress getEnvironmentalStress();

    /**
     * Restores the environment to its initial state. The default does nothing.
     */
    default void reset() {
    }
}
