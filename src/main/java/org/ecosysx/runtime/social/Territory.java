package org.ecosysx.runtime.social;

import java.util.List;

import org.ecosysx.runtime.model.Vector3;

/**
 * A claimed area around a resource cluster with a circular patrol route.
 */
public final class Territory {

    public static final double DEFAULT_RADIUS = 8.0;
    public static final int PATROL_POINTS = 6;

    private final Vector3 center;
    private final double radius;
    private final long claimedAt;
    private final List<Vector3> patrolPoints;
    private int patrolIndex;

    public Territory(Vector3 center, double radius, long claimedAt, double patrolDistance) {
        this.center = center;
        this.radius = radius;
        this.claimedAt = claimedAt;
        Vector3[] points = new Vector3[PATROL_POINTS];
        for (int i = 0; i < PATROL_POINTS; i++) {
            double angle = (i / (double) PATROL_POINTS) * Math.PI * 2;
            points[i] = new Vector3(
                    center.x() + Math.cos(angle) * patrolDistance,
                    center.y(),
                    center.z() + Math.sin(angle) * patrolDistance);
        }
        this.patrolPoints = List.of(points);
    }

    public Vector3 getCenter() {
        return center;
    }

    public double getRadius() {
        return radius;
    }

    public long getClaimedAt() {
        return claimedAt;
    }

    public List<Vector3> getPatrolPoints() {
        return patrolPoints;
    }

    public Vector3 currentPatrolPoint() {
        return patrolPoints.get(patrolIndex);
    }

    void advancePatrol() {
        patrolIndex = (patrolIndex + 1) % patrolPoints.size();
    }

    public boolean contains(Vector3 position) {
        return center.distanceXZ(position) < radius;
    }
}
