package org.ecosysx.runtime.social;

import org.ecosysx.runtime.model.Vector3;

/**
 * A remembered infection hotspot.
 */
public record DangerZone(Vector3 location, int severity, String source, long timestamp) {
}
