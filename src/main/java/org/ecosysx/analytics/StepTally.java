package org.ecosysx.analytics;

import java.util.Map;

import org.ecosysx.runtime.model.AgentKind;
import org.ecosysx.runtime.model.DeathCause;
import org.ecosysx.runtime.model.MessageType;

/**
 * What happened during one sweep besides the population snapshot itself.
 *
 * @param births            newborns by kind.
 * @param deaths            deaths by cause.
 * @param messages          messages sent by type.
 * @param resourcesConsumed resources consumed by foraging.
 */
public record StepTally(
        Map<AgentKind, Integer> births,
        Map<DeathCause, Integer> deaths,
        Map<MessageType, Integer> messages,
        int resourcesConsumed) {

    public static final StepTally EMPTY = new StepTally(Map.of(), Map.of(), Map.of(), 0);

    public StepTally {
        births = Map.copyOf(births);
        deaths = Map.copyOf(deaths);
        messages = Map.copyOf(messages);
    }
}
