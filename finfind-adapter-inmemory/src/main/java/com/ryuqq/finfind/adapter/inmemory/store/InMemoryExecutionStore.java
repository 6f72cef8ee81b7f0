package com.ryuqq.finfind.adapter.inmemory.store;

import com.ryuqq.finfind.core.model.CorrelationId;
import com.ryuqq.finfind.core.spi.ExecutionStore;
import com.ryuqq.finfind.core.workflow.WorkflowExecution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ExecutionStore} SPI.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>active:</strong> ConcurrentHashMap&lt;CorrelationId, WorkflowExecution&gt; - live executions</li>
 *   <li><strong>history:</strong> ArrayDeque&lt;WorkflowExecution&gt; - finished executions, newest first,
 *       bounded by {@code historyLimit} (default {@value #DEFAULT_HISTORY_LIMIT})</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryExecutionStore implements ExecutionStore {

    /** Default number of finished executions kept. */
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    private final ConcurrentHashMap<CorrelationId, WorkflowExecution> active = new ConcurrentHashMap<>();
    private final Deque<WorkflowExecution> history = new ArrayDeque<>();
    private final int historyLimit;

    public InMemoryExecutionStore() {
        this(DEFAULT_HISTORY_LIMIT);
    }

    /**
     * Creates a store with a custom history bound.
     *
     * @param historyLimit maximum number of finished executions kept
     * @throws IllegalArgumentException if historyLimit is not positive
     */
    public InMemoryExecutionStore(int historyLimit) {
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be positive (current: " + historyLimit + ")");
        }
        this.historyLimit = historyLimit;
    }

    @Override
    public void begin(WorkflowExecution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        WorkflowExecution existing = active.putIfAbsent(execution.getCorrelationId(), execution);
        if (existing != null) {
            throw new IllegalStateException(
                "Live execution already exists for " + execution.getCorrelationId() + ": " + existing.getExecutionId()
            );
        }
    }

    @Override
    public void end(WorkflowExecution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        if (!active.remove(execution.getCorrelationId(), execution)) {
            return;
        }
        synchronized (history) {
            history.addFirst(execution);
            while (history.size() > historyLimit) {
                history.removeLast();
            }
        }
    }

    @Override
    public Optional<WorkflowExecution> findActive(CorrelationId correlationId) {
        return Optional.ofNullable(active.get(correlationId));
    }

    @Override
    public Optional<WorkflowExecution> findById(String executionId) {
        for (WorkflowExecution execution : active.values()) {
            if (execution.getExecutionId().equals(executionId)) {
                return Optional.of(execution);
            }
        }
        synchronized (history) {
            Iterator<WorkflowExecution> iterator = history.iterator();
            while (iterator.hasNext()) {
                WorkflowExecution execution = iterator.next();
                if (execution.getExecutionId().equals(executionId)) {
                    return Optional.of(execution);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public List<WorkflowExecution> active() {
        return List.copyOf(active.values());
    }

    @Override
    public List<WorkflowExecution> history(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        List<WorkflowExecution> recent = new ArrayList<>();
        synchronized (history) {
            for (WorkflowExecution execution : history) {
                if (recent.size() == limit) {
                    break;
                }
                recent.add(execution);
            }
        }
        return recent;
    }
}
