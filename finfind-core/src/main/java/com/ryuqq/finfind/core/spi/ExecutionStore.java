package com.ryuqq.finfind.core.spi;

import com.ryuqq.finfind.core.model.CorrelationId;
import com.ryuqq.finfind.core.workflow.WorkflowExecution;

import java.util.List;
import java.util.Optional;

/**
 * Store of live and finished workflow executions.
 *
 * <p><strong>Invariant:</strong> at most one live execution per correlation id.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExecutionStore {

    /**
     * Registers a new live execution.
     *
     * @param execution execution to register
     * @throws IllegalStateException if a live execution with the same correlation id exists
     */
    void begin(WorkflowExecution execution);

    /**
     * Moves a live execution to the bounded history.
     *
     * @param execution finished execution
     */
    void end(WorkflowExecution execution);

    Optional<WorkflowExecution> findActive(CorrelationId correlationId);

    /**
     * Finds a live or archived execution by id.
     *
     * @param executionId execution id
     * @return execution, if still known
     */
    Optional<WorkflowExecution> findById(String executionId);

    List<WorkflowExecution> active();

    /**
     * Returns archived executions, newest first.
     *
     * @param limit maximum number of entries
     * @return archived executions
     */
    List<WorkflowExecution> history(int limit);
}
