package org.ecosysx.runtime.reasoning;

/**
 * Digest of an agent's shared knowledge used as planner input.
 *
 * @param knownResourceCount resource tips still valid and confident.
 * @param dangerZoneCount    danger zones still active.
 * @param urgentHelpRequests unprocessed high-priority help requests.
 */
public record SocialSummary(int knownResourceCount, int dangerZoneCount, int urgentHelpRequests) {

    public static final SocialSummary EMPTY = new SocialSummary(0, 0, 0);

    public double overallSocialInfluence() {
        return (knownResourceCount + dangerZoneCount) > 0 ? 0.6 : 0.1;
    }
}
