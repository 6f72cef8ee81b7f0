package com.ryuqq.finfind.core.capability;

import com.ryuqq.finfind.core.outcome.Result;

/**
 * {@link com.ryuqq.finfind.core.protocol.Capability#CLASSIFY} handler.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClassifyCapability {

    /**
     * Classifies a request into a workflow id.
     *
     * @param request step input
     * @return output, or a failure carrying its error kind
     */
    Result<Classification> classify(StepRequest request);
}
