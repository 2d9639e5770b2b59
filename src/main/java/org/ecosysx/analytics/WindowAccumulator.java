package org.ecosysx.analytics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Mutable per-window tallies. Reset when a window is finalized.
 */
final class WindowAccumulator {

    final Object2IntOpenHashMap<String> contactsByType = new Object2IntOpenHashMap<>();
    final Object2IntOpenHashMap<String> infectionsCaused = new Object2IntOpenHashMap<>();
    final Object2DoubleOpenHashMap<String> infectiousHours = new Object2DoubleOpenHashMap<>();
    final Object2IntOpenHashMap<String> births = new Object2IntOpenHashMap<>();
    final Object2IntOpenHashMap<String> deaths = new Object2IntOpenHashMap<>();
    final Object2IntOpenHashMap<String> comms = new Object2IntOpenHashMap<>();
    final Map<String, EnergyStats> energy = new TreeMap<>();
    final List<AnalyticsEvent> events = new ArrayList<>();
    int resourcesConsumed;
    int resourcesAvailable;
    int droppedEvents;

    void clear() {
        contactsByType.clear();
        infectionsCaused.clear();
        infectiousHours.clear();
        births.clear();
        deaths.clear();
        comms.clear();
        energy.clear();
        events.clear();
        resourcesConsumed = 0;
        resourcesAvailable = 0;
        droppedEvents = 0;
    }

    static Map<String, Integer> sorted(Object2IntOpenHashMap<String> counts) {
        Map<String, Integer> out = new TreeMap<>();
        for (Object2IntOpenHashMap.Entry<String> e : counts.object2IntEntrySet()) {
            out.put(e.getKey(), e.getIntValue());
        }
        return out;
    }

    static Map<String, Double> sorted(Object2DoubleOpenHashMap<String> values) {
        Map<String, Double> out = new TreeMap<>();
        for (Object2DoubleOpenHashMap.Entry<String> e : values.object2DoubleEntrySet()) {
            out.put(e.getKey(), e.getDoubleValue());
        }
        return out;
    }
}
