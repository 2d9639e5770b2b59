package org.ecosysx.runtime.social;

import org.ecosysx.runtime.model.Vector3;

/**
 * A remembered resource location.
 *
 * @param location   where the resource was seen.
 * @param confidence belief that the resource is still there, decays with age.
 * @param quality    reported quality.
 * @param source     {@link #SELF_OBSERVED} or the id of the agent that shared it.
 * @param timestamp  tick the information was recorded.
 */
public record KnownResource(Vector3 location, double confidence, double quality, String source, long timestamp) {

    public static final String SELF_OBSERVED = "self_observed";

    public KnownResource withConfidence(double newConfidence) {
        return new KnownResource(location, newConfidence, quality, source, timestamp);
    }
}
