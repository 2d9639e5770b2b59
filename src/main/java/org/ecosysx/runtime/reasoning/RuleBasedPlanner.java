package org.ecosysx.runtime.reasoning;

import java.util.ArrayList;
import java.util.List;

import org.ecosysx.runtime.model.ActionType;
import org.ecosysx.runtime.model.HealthStatus;
import org.ecosysx.runtime.model.MovementAction;
import org.ecosysx.runtime.model.Observation;
import org.ecosysx.runtime.spi.IReasoningService;

/**
 * Deterministic planner that mimics the decisions a language-model backed planner would make.
 * <p>
 * Derives prioritized goals from the situation, picks one action archetype and returns it with a
 * three-step chain of thought. The output depends only on the request, including the confidence,
 * which is derived from the draw taken on the tick thread.
 */
public final class RuleBasedPlanner implements IReasoningService {

    static final int MIN_REPRODUCTION_AGE = 30;

    @Override
    public ReasoningResult reason(ReasoningRequest request) {
        Observation obs = request.observation();
        List<Goal> goals = defineGoals(request);
        Goal primary = goals.get(0);
        Plan plan = planAction(request, primary);

        List<ThoughtStep> thoughts = List.of(
                new ThoughtStep(1, "situation_analysis", String.format(
                        "Current situation: energy %s (%.0f), %d infected nearby, %d threats close, nearest resource %d units away, %d shared tips.",
                        energyStatus(obs.energy()), obs.energy(), obs.nearbyInfected(), request.nearbyThreats(),
                        Math.round(obs.nearestResourceDistance()), request.socialSummary().knownResourceCount())),
                new ThoughtStep(2, "goal_prioritization", String.format(
                        "Primary goal: %s (urgency: %.1f).", primary.name(), primary.urgency())),
                new ThoughtStep(3, "action_planning", String.format(
                        "Action plan: %s. %s. Expected outcome: %s.", plan.action.getKey(), plan.description, plan.expectedOutcome)));

        double confidence = 0.6 + 0.4 * request.confidenceDraw();
        return new ReasoningResult(
                request.agentId(),
                request.tick(),
                MovementAction.typed(plan.action, intensityOf(plan.action)),
                goals,
                thoughts,
                confidence,
                plan.justification);
    }

    static String energyStatus(double energy) {
        if (energy < 30) {
            return "critical";
        }
        return energy > 70 ? "abundant" : "moderate";
    }

    static List<Goal> defineGoals(ReasoningRequest request) {
        Observation obs = request.observation();
        List<Goal> goals = new ArrayList<>();
        if (obs.energy() < 40) {
            goals.add(new Goal(Goal.FIND_FOOD, Goal.Priority.HIGH, 10 - obs.energy() / 10,
                    request.socialSummary().knownResourceCount() > 0));
        }
        if (obs.nearbyInfected() > 0) {
            goals.add(new Goal(Goal.AVOID_INFECTION, Goal.Priority.CRITICAL, obs.nearbyInfected() * 3, false));
        }
        if (obs.energy() > 60 && obs.age() > MIN_REPRODUCTION_AGE) {
            goals.add(new Goal(Goal.REPRODUCE, Goal.Priority.MEDIUM, 3, false));
        }
        goals.add(new Goal(Goal.EXPLORE, Goal.Priority.LOW, 1, false));
        goals.sort(Goal.BY_IMPORTANCE);
        return goals;
    }

    static Plan planAction(ReasoningRequest request, Goal primary) {
        Observation obs = request.observation();
        if (Goal.FIND_FOOD.equals(primary.name()) && obs.nearestResourceDistance() < 10) {
            return new Plan(ActionType.FORAGE, "Move toward nearest resource", "energy restoration",
                    String.format("Food is accessible (%d units)", Math.round(obs.nearestResourceDistance())));
        }
        if (obs.nearbyInfected() > 0 && obs.status() == HealthStatus.SUSCEPTIBLE) {
            return new Plan(ActionType.AVOID, "Maintain distance from infected agents", "reduced infection probability",
                    obs.nearbyInfected() + " infected agents nearby");
        }
        if (obs.energy() > 70 && request.reproductionCooldown() == 0 && obs.age() > MIN_REPRODUCTION_AGE) {
            return new Plan(ActionType.REPRODUCE, "Seek reproduction opportunity", "genetic propagation",
                    "High energy reserves enable reproduction");
        }
        return new Plan(ActionType.EXPLORE, "Continue exploration", "maintain status quo", "Default action");
    }

    static double intensityOf(ActionType type) {
        return switch (type) {
            case FORAGE -> 0.9;
            case AVOID -> 0.7;
            case REPRODUCE -> 0.3;
            case REST -> 0.1;
            case EXPLORE -> 0.5;
        };
    }

    record Plan(ActionType action, String description, String expectedOutcome, String justification) {
    }
}
