package org.ecosysx.runtime.reasoning;

import org.ecosysx.runtime.model.Observation;
import org.ecosysx.runtime.social.Personality;

/**
 * Immutable snapshot handed to an {@link IReasoningService}. Contains everything a planner may use,
 * so it can be evaluated off the tick thread without touching live agent state.
 *
 * @param agentId              requesting agent.
 * @param tick                 tick the request was made.
 * @param personality          the agent's personality.
 * @param observation          the agent's local observation.
 * @param nearbyThreats        infected agents within threat range.
 * @param reproductionCooldown remaining reproduction cooldown.
 * @param socialSummary        digest of shared knowledge.
 * @param confidenceDraw       uniform draw in [0, 1) taken on the tick thread.
 */
public record ReasoningRequest(
        String agentId,
        long tick,
        Personality personality,
        Observation observation,
        int nearbyThreats,
        int reproductionCooldown,
        SocialSummary socialSummary,
        double confidenceDraw) {
}
