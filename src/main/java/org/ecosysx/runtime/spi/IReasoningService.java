package org.ecosysx.runtime.spi;

import org.ecosysx.runtime.reasoning.ReasoningRequest;
import org.ecosysx.runtime.reasoning.ReasoningResult;

/**
 * Planner consulted by social agents. Implementations must be side-effect free with respect to
 * simulation state; they only see the immutable request.
 */
public interface IReasoningService {

    /**
     * Plans an action for the given situation.
     *
     * @param request the immutable situation snapshot.
     * @return the planned result, never {@code null}.
     */
    ReasoningResult reason(ReasoningRequest request);
}
