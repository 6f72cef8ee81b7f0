package com.ryuqq.finfind.core.capability;

import com.ryuqq.finfind.core.outcome.Result;

/**
 * {@link com.ryuqq.finfind.core.protocol.Capability#SEARCH} handler.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SearchCapability {

    /**
     * Finds products matching the request query and filters.
     *
     * @param request step input
     * @return output, or a failure carrying its error kind
     */
    Result<StepOutput> search(StepRequest request);
}
