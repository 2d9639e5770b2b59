package org.ecosysx.runtime.reasoning;

import java.util.List;

import org.ecosysx.runtime.model.MovementAction;

/**
 * Outcome of one planning call.
 *
 * @param agentId        agent the plan is for.
 * @param requestTick    tick the request was made; the plan is applied on a later tick.
 * @param action         the chosen movement action.
 * @param goals          goals in order of importance.
 * @param chainOfThought trace of the planning steps.
 * @param confidence     planner confidence in [0.6, 1.0).
 * @param justification  one-line reason for the chosen action.
 */
public record ReasoningResult(
        String agentId,
        long requestTick,
        MovementAction action,
        List<Goal> goals,
        List<ThoughtStep> chainOfThought,
        double confidence,
        String justification) {

    public ReasoningResult {
        goals = List.copyOf(goals);
        chainOfThought = List.copyOf(chainOfThought);
    }
}
