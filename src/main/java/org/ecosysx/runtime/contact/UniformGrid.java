package org.ecosysx.runtime.contact;

import java.util.ArrayList;
import java.util.List;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.ecosysx.runtime.model.Agent;

/**
 * Spatial hash over the ground plane with square cells. With a cell size equal to the query
 * distance every pair closer than that distance lies in the same or an adjacent cell.
 */
final class UniformGrid {

    private final double cellSize;
    private final Long2ObjectOpenHashMap<ObjectArrayList<Agent>> cells = new Long2ObjectOpenHashMap<>();

    UniformGrid(double cellSize) {
        this.cellSize = cellSize;
    }

    void insert(Agent agent) {
        long key = key(cellOf(agent.getX()), cellOf(agent.getZ()));
        ObjectArrayList<Agent> bucket = cells.get(key);
        if (bucket == null) {
            bucket = new ObjectArrayList<>();
            cells.put(key, bucket);
        }
        bucket.add(agent);
    }

    /**
     * Returns every unordered pair of inserted agents closer than {@code distance}, each exactly once.
     * Pairs are ordered so that the agent with the smaller serial comes first.
     */
    List<Agent[]> pairsWithin(double distance) {
        List<Agent[]> pairs = new ArrayList<>();
        for (Long2ObjectOpenHashMap.Entry<ObjectArrayList<Agent>> entry : cells.long2ObjectEntrySet()) {
            int cx = (int) (entry.getLongKey() >> 32);
            int cz = (int) entry.getLongKey();
            ObjectArrayList<Agent> home = entry.getValue();
            for (int dx = -1; dx <= 1; dx++) {
                for (int dz = -1; dz <= 1; dz++) {
                    ObjectArrayList<Agent> other = cells.get(key(cx + dx, cz + dz));
                    if (other == null) {
                        continue;
                    }
                    for (Agent a : home) {
                        for (Agent b : other) {
                            // the pair is emitted from the cell holding the smaller serial only
                            if (a.getSerial() < b.getSerial() && a.distanceTo(b) < distance) {
                                pairs.add(new Agent[]{a, b});
                            }
                        }
                    }
                }
            }
        }
        pairs.sort((p, q) -> p[0].getSerial() != q[0].getSerial()
                ? Integer.compare(p[0].getSerial(), q[0].getSerial())
                : Integer.compare(p[1].getSerial(), q[1].getSerial()));
        return pairs;
    }

    private int cellOf(double coordinate) {
        return (int) Math.floor(coordinate / cellSize);
    }

    private static long key(int cx, int cz) {
        return ((long) cx << 32) | (cz & 0xffffffffL);
    }
}
