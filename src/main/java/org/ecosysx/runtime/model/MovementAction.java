package org.ecosysx.runtime.model;

/**
 * A movement decision for one tick.
 * <p>
 * Actions produced by the learning policy are untyped ({@code type == null}) and steer through
 * intensity, direction and avoidance. Actions produced by the planner carry an {@link ActionType}.
 *
 * @param type      the action archetype, or {@code null} for a policy action.
 * @param intensity relative movement strength, scaled by the agent's max speed.
 * @param direction heading in radians.
 * @param avoidance random avoidance jitter applied while susceptible.
 */
public record MovementAction(ActionType type, double intensity, double direction, double avoidance) {

    public static MovementAction policy(double intensity, double direction, double avoidance) {
        return new MovementAction(null, intensity, direction, avoidance);
    }

    public static MovementAction typed(ActionType type, double intensity) {
        return new MovementAction(type, intensity, 0.0, 0.0);
    }

    public boolean isTyped() {
        return type != null;
    }

    public MovementAction scaled(double multiplier) {
        return new MovementAction(type, intensity * multiplier, direction, avoidance);
    }
}
