package org.ecosysx.analytics;

import java.util.Map;

/**
 * An entry of a window's event log.
 *
 * @param step      tick the event was recorded at.
 * @param type      event type, e.g. {@code agent_born}.
 * @param data      event payload.
 * @param timestamp wall clock time in epoch milliseconds.
 */
public record AnalyticsEvent(long step, String type, Map<String, Object> data, long timestamp) {

    public AnalyticsEvent {
        data = Map.copyOf(data);
    }
}
