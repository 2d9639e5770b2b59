package org.ecosysx.runtime.model;

/**
 * Immutable snapshot of a consumable resource placed in the environment.
 *
 * @param id               stable identifier used with {@code consumeResource}.
 * @param position         location (y is ignored for distances).
 * @param value            energy value before forage efficiency is applied.
 * @param quality          reported quality in [0, 1].
 * @param type             resource kind.
 * @param weatherResistant true if the resource yields a bonus under shelter-worthy weather.
 * @param replenishable    true if consumption depletes rather than removes it.
 * @param age              ticks since spawn.
 * @param maxAge           age after which the resource may rot away.
 */
public record Resource(
        String id,
        Vector3 position,
        double value,
        double quality,
        ResourceType type,
        boolean weatherResistant,
        boolean replenishable,
        int age,
        int maxAge) {

    public Resource withValue(double newValue) {
        return new Resource(id, position, newValue, quality, type, weatherResistant, replenishable, age, maxAge);
    }

    public Resource withAge(int newAge) {
        return new Resource(id, position, value, quality, type, weatherResistant, replenishable, newAge, maxAge);
    }
}
