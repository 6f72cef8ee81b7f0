package com.ryuqq.finfind.application.runtime;

import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.context.CompressedContext;
import com.ryuqq.finfind.core.model.CorrelationId;
import com.ryuqq.finfind.core.workflow.CancellationSignal;
import com.ryuqq.finfind.core.workflow.WorkflowDefinition;
import com.ryuqq.finfind.core.workflow.WorkflowResult;

/**
 * Workflow execution runtime.
 *
 * <p>Drives one {@link WorkflowDefinition} to a terminal state by dispatching each step as a
 * bus request to the agent that provides the step's capability.</p>
 *
 * <p><strong>Execution Flow:</strong></p>
 * <pre>
 * execute() starts
 *   ↓
 * while (PENDING steps remain):
 *   1. Skip steps whose required dependency FAILED or was SKIPPED
 *   2. Collect the layer: PENDING steps whose dependencies are all resolved
 *   3. For each step in the layer (concurrently):
 *      a. Evaluate the condition → false: SKIPPED
 *      b. Build the step input from the input mappings
 *      c. Request over the bus, retrying retryable failures with backoff
 *      d. Try the fallback capability once if every attempt failed
 *      e. COMPLETED or FAILED
 *   4. Wait for the whole layer
 * </pre>
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>Never throws for step failures; they are reported in the {@link WorkflowResult}</li>
 *   <li>At most one live execution per correlation id</li>
 *   <li>Cancellation fails in-flight steps with {@code CANCELLED} and skips pending ones</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkflowEngine {

    /**
     * Executes a workflow and blocks until it is terminal.
     *
     * @param definition workflow to run
     * @param input the original request as a step input (query, user, budget, filters)
     * @param context conversational context attached to every step request (nullable)
     * @param correlationId id of the originating request
     * @param cancellation cancellation signal
     * @return terminal result
     * @throws IllegalStateException if a live execution already exists for {@code correlationId}
     */
    WorkflowResult execute(
        WorkflowDefinition definition,
        StepRequest input,
        CompressedContext context,
        CorrelationId correlationId,
        CancellationSignal cancellation
    );
}
