package org.ecosysx.runtime.environment;

import org.ecosysx.runtime.model.TerrainEffects;
import org.ecosysx.runtime.model.Vector3;
import org.ecosysx.runtime.spi.IRandomProvider;

/**
 * Static terrain on a 2-unit grid covering [-25, 25] on both axes: elevation, vegetation, ponds and
 * shelters. Generated once at construction. Positions outside the grid get neutral grassland.
 */
public final class TerrainSystem {

    static final int EXTENT = 25;
    static final int CELL = 2;
    static final int SIZE = 2 * EXTENT / CELL + 1;

    public enum Vegetation { FOREST, SHRUBLAND, GRASS, SPARSE }

    public enum ShelterType {
        CAVE(0.9),
        DENSE_FOREST(0.6),
        ROCKS(0.4);

        private final double protection;

        ShelterType(double protection) {
            this.protection = protection;
        }

        public double getProtection() {
            return protection;
        }
    }

    private final double[][] elevation = new double[SIZE][SIZE];
    private final double[][] vegetationDensity = new double[SIZE][SIZE];
    private final Vegetation[][] vegetation = new Vegetation[SIZE][SIZE];
    private final boolean[][] water = new boolean[SIZE][SIZE];
    private final ShelterType[][] shelters = new ShelterType[SIZE][SIZE];

    public TerrainSystem(IRandomProvider rng) {
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                int x = -EXTENT + i * CELL;
                int z = -EXTENT + j * CELL;
                double e = elevationAt(x, z);
                elevation[i][j] = e;

                double moisture = 1 - e * 0.6;
                double latitude = 1 - Math.abs(x) / (double) EXTENT;
                double density = Math.max(0, Math.min(1, moisture * latitude + (rng.nextDouble() - 0.5) * 0.3));
                vegetationDensity[i][j] = density;
                vegetation[i][j] = density > 0.7 ? Vegetation.FOREST
                        : density > 0.4 ? Vegetation.SHRUBLAND
                        : density < 0.2 ? Vegetation.SPARSE
                        : Vegetation.GRASS;

                if (e < 0.2 && rng.nextDouble() < 0.3) {
                    water[i][j] = true;
                }
                if (rng.nextDouble() < 0.15) {
                    ShelterType type = ShelterType.ROCKS;
                    if (density > 0.7) type = ShelterType.DENSE_FOREST;
                    if (e > 0.8) type = ShelterType.CAVE;
                    shelters[i][j] = type;
                }
            }
        }
    }

    static double elevationAt(double x, double z) {
        double n1 = Math.sin(x * 0.1) * Math.cos(z * 0.1);
        double n2 = Math.sin(x * 0.05) * Math.cos(z * 0.05) * 0.5;
        double n3 = Math.sin(x * 0.02) * Math.cos(z * 0.02) * 0.3;
        return Math.max(0, Math.min(1, (n1 + n2 + n3) * 0.5 + 0.5));
    }

    // Cell i is centred on -EXTENT + i * CELL.
    private static int index(double coordinate) {
        return (int) Math.floor((coordinate + EXTENT + CELL / 2.0) / CELL);
    }

    private static boolean inGrid(int i, int j) {
        return i >= 0 && i < SIZE && j >= 0 && j < SIZE;
    }

    public double getElevation(Vector3 position) {
        int i = index(position.x());
        int j = index(position.z());
        return inGrid(i, j) ? elevation[i][j] : 0.5;
    }

    public ShelterType getShelter(Vector3 position) {
        int i = index(position.x());
        int j = index(position.z());
        return inGrid(i, j) ? shelters[i][j] : null;
    }

    public Vegetation getVegetation(Vector3 position) {
        int i = index(position.x());
        int j = index(position.z());
        return inGrid(i, j) ? vegetation[i][j] : Vegetation.GRASS;
    }

    public TerrainEffects getEffects(Vector3 position) {
        int i = index(position.x());
        int j = index(position.z());
        boolean inside = inGrid(i, j);
        double e = inside ? elevation[i][j] : 0.5;
        Vegetation veg = inside ? vegetation[i][j] : Vegetation.GRASS;
        boolean hasWater = inside && water[i][j];
        ShelterType shelter = inside ? shelters[i][j] : null;

        double movement = 1.0;
        double exposure = 1.0;
        double infectionRisk = 0.0;
        double resource = 1.0;
        double energyBonus = 0.0;

        if (e > 0.8) {
            movement *= 0.85;
            exposure *= 1.3;
        } else if (e < 0.3) {
            movement *= 1.1;
            infectionRisk += 0.1;
        }
        switch (veg) {
            case FOREST -> {
                exposure *= 0.7;
                movement *= 0.9;
                resource *= 1.3;
            }
            case SHRUBLAND -> {
                exposure *= 0.85;
                resource *= 1.1;
            }
            case SPARSE -> {
                exposure *= 1.2;
                movement *= 1.1;
                resource *= 0.7;
            }
            case GRASS -> {
            }
        }
        if (hasWater) {
            energyBonus += 0.5;
            infectionRisk += 0.2;
            resource *= 1.2;
        }
        double protection = 0.0;
        if (shelter != null) {
            protection = shelter.getProtection();
            exposure *= 1 - protection;
        }
        return new TerrainEffects(movement, energyBonus, resource, infectionRisk, exposure, shelter != null, protection);
    }
}
