package org.ecosysx.runtime.model;

/**
 * Immutable 3D point. Simulation distances are measured on the x/z ground plane.
 */
public record Vector3(double x, double y, double z) {

    public static final Vector3 ZERO = new Vector3(0, 0, 0);

    public double distanceXZ(Vector3 other) {
        return distanceXZ(other.x, other.z);
    }

    public double distanceXZ(double ox, double oz) {
        double dx = x - ox;
        double dz = z - oz;
        return Math.sqrt(dx * dx + dz * dz);
    }
}
