package org.ecosysx.runtime.environment;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.ecosysx.runtime.model.Resource;
import org.ecosysx.runtime.model.ResourceType;
import org.ecosysx.runtime.model.TerrainEffects;
import org.ecosysx.runtime.model.Vector3;
import org.ecosysx.runtime.model.WeatherEffects;
import org.ecosysx.runtime.spi.IRandomProvider;

/**
 * Spawns, ages and removes consumable resources.
 * <p>
 * Resources are immutable records; ageing and depletion replace the stored record.
 */
public final class ResourceSystem {

    static final int REPLENISH_INTERVAL = 20;
    static final double REPLENISH_AMOUNT = 2.0;
    static final double DEPLETION_PER_CONSUME = 5.0;
    static final double ROT_CHANCE = 0.3;

    private final IRandomProvider rng;
    private final int maxResources;
    private final double bounds;
    private final Map<String, Resource> resources = new LinkedHashMap<>();
    private final Map<String, Double> maxValues = new HashMap<>();
    private int idCounter;
    private int spawnCooldown;

    public ResourceSystem(IRandomProvider rng, int maxResources, double bounds) {
        if (maxResources < 0) {
            throw new IllegalArgumentException("maxResources must not be negative, got " + maxResources);
        }
        this.rng = rng;
        this.maxResources = maxResources;
        this.bounds = bounds;
    }

    public void update(WeatherEffects weather, TerrainSystem terrain) {
        spawnCooldown = Math.max(0, spawnCooldown - 1);
        if (resources.size() < maxResources && spawnCooldown == 0) {
            spawn(weather, terrain);
            spawnCooldown = 15 + rng.nextInt(10);
        }

        Iterator<Map.Entry<String, Resource>> it = resources.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Resource> entry = it.next();
            Resource r = entry.getValue().withAge(entry.getValue().age() + 1);
            if (r.age() > r.maxAge() && rng.nextDouble() < ROT_CHANCE) {
                it.remove();
                maxValues.remove(entry.getKey());
                continue;
            }
            if (r.replenishable() && r.age() % REPLENISH_INTERVAL == 0) {
                r = r.withValue(Math.min(maxValues.getOrDefault(r.id(), r.value()), r.value() + REPLENISH_AMOUNT));
            }
            entry.setValue(r);
        }
    }

    private void spawn(WeatherEffects weather, TerrainSystem terrain) {
        Vector3 position = new Vector3((rng.nextDouble() - 0.5) * bounds * 2, 1, (rng.nextDouble() - 0.5) * bounds * 2);
        TerrainEffects effects = terrain.getEffects(position);

        ResourceType type = ResourceType.BERRY;
        double baseValue = 8 + rng.nextDouble() * 7;
        int maxAge = 80 + rng.nextInt(40);
        boolean weatherResistant = false;
        boolean replenishable = false;

        if (terrain.getElevation(position) > 0.7) {
            type = ResourceType.MINERAL;
            baseValue = 15 + rng.nextDouble() * 10;
            maxAge = 200 + rng.nextInt(100);
            weatherResistant = true;
        } else if (effects.isInShelter()) {
            type = ResourceType.MUSHROOM;
            baseValue = 12 + rng.nextDouble() * 8;
            maxAge = 60 + rng.nextInt(30);
            weatherResistant = true;
            replenishable = true;
        } else if (rng.nextDouble() < 0.3) {
            type = ResourceType.SEED;
            baseValue = 5 + rng.nextDouble() * 5;
            maxAge = 120 + rng.nextInt(80);
        }
        double value = baseValue * effects.resourceMultiplier();

        if (weather.shelterNeed() > 0.5 && !weatherResistant && rng.nextDouble() < 0.4) {
            return;
        }
        String id = "resource_" + idCounter++;
        double quality = rng.nextDouble() * 0.4 + 0.6;
        resources.put(id, new Resource(id, position, value, quality, type, weatherResistant, replenishable, 0, maxAge));
        maxValues.put(id, value);
    }

    /**
     * Consumes a resource. Replenishable resources lose value and age faster once depleted, all
     * others are removed.
     *
     * @return the value before consumption, 0 if the id is unknown.
     */
    public double consume(String id) {
        Resource r = resources.get(id);
        if (r == null) {
            return 0.0;
        }
        if (r.replenishable()) {
            double remaining = Math.max(0, r.value() - DEPLETION_PER_CONSUME);
            Resource depleted = r.withValue(remaining);
            if (remaining <= 0) {
                depleted = depleted.withAge(depleted.age() + 20);
            }
            resources.put(id, depleted);
        } else {
            resources.remove(id);
            maxValues.remove(id);
        }
        return r.value();
    }

    public Collection<Resource> getResources() {
        return Collections.unmodifiableCollection(resources.values());
    }

    public int getMaxResources() {
        return maxResources;
    }

    void put(Resource resource) {
        resources.put(resource.id(), resource);
        maxValues.put(resource.id(), resource.value());
    }
}
