package com.ryuqq.finfind.core.capability;

import com.ryuqq.finfind.core.outcome.Result;

/**
 * {@link com.ryuqq.finfind.core.protocol.Capability#EXPLAIN} handler.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExplainCapability {

    /**
     * Explains why the request products match the user.
     *
     * @param request step input
     * @return output, or a failure carrying its error kind
     */
    Result<StepOutput> explain(StepRequest request);
}
