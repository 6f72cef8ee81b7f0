package com.ryuqq.finfind.core.capability;

import com.ryuqq.finfind.core.outcome.Result;

/**
 * {@link com.ryuqq.finfind.core.protocol.Capability#ALTERNATIVE} handler.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlternativeCapability {

    /**
     * Finds cheaper or similar alternatives for the request products.
     *
     * @param request step input
     * @return output, or a failure carrying its error kind
     */
    Result<StepOutput> findAlternatives(StepRequest request);
}
