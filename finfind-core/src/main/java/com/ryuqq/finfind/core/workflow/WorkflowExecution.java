package com.ryuqq.finfind.core.workflow;

import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.model.CorrelationId;
import com.ryuqq.finfind.core.outcome.ErrorDetail;
import com.ryuqq.finfind.core.statemachine.StepStatus;
import com.ryuqq.finfind.core.statemachine.StepTransition;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 워크플로 실행 한 건의 상태.
 *
 * <p>오케스트레이션 시작 시 생성되고 워크플로 엔진만 변경하며, 종료 후에는 이력으로 보관됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>단계 상태 전이는 {@link StepTransition} 규칙을 따름 (단조 증가)</li>
 *   <li>PENDING 또는 RUNNING 단계가 없으면 종료 상태</li>
 *   <li>종료 전에는 {@link #finish()} 불가</li>
 * </ul>
 *
 * <p>모든 변경 메서드는 동기화되어 있어 같은 레이어의 단계들이 동시에 호출해도 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowExecution {

    private final String executionId;
    private final String workflowId;
    private final CorrelationId correlationId;
    private final Instant startedAt;
    private final Map<String, StepStatus> statuses = new LinkedHashMap<>();
    private final Map<String, StepOutput> outputs = new LinkedHashMap<>();
    private final Map<String, ErrorDetail> errors = new LinkedHashMap<>();
    private final Map<String, String> agents = new LinkedHashMap<>();
    private StepOutput aggregatedOutput;
    private Instant finishedAt;

    private WorkflowExecution(WorkflowDefinition definition, CorrelationId correlationId) {
        this.executionId = UUID.randomUUID().toString();
        this.workflowId = definition.id();
        this.correlationId = correlationId;
        this.startedAt = Instant.now();
        for (WorkflowStep step : definition.steps()) {
            statuses.put(step.name(), StepStatus.PENDING);
        }
    }

    /**
     * 모든 단계가 PENDING인 새 실행 생성.
     *
     * @param definition 워크플로 정의
     * @param correlationId 요청 상관관계 ID
     * @return WorkflowExecution 인스턴스
     */
    public static WorkflowExecution start(WorkflowDefinition definition, CorrelationId correlationId) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        return new WorkflowExecution(definition, correlationId);
    }

    /**
     * 단계 상태 전이.
     *
     * @param step 단계 이름
     * @param next 다음 상태
     * @throws IllegalArgumentException 알 수 없는 단계인 경우
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public synchronized void transition(String step, StepStatus next) {
        StepStatus current = statuses.get(step);
        if (current == null) {
            throw new IllegalArgumentException("Unknown step: " + step);
        }
        statuses.put(step, StepTransition.transition(current, next));
    }

    /**
     * RUNNING → COMPLETED 전이와 함께 출력 기록.
     *
     * @param step 단계 이름
     * @param output 단계 출력
     * @param agent 응답한 에이전트 이름
     */
    public synchronized void complete(String step, StepOutput output, String agent) {
        transition(step, StepStatus.COMPLETED);
        outputs.put(step, output);
        if (agent != null) {
            agents.put(step, agent);
        }
    }

    /**
     * RUNNING → FAILED 전이와 함께 오류 기록.
     *
     * @param step 단계 이름
     * @param error 오류
     */
    public synchronized void fail(String step, ErrorDetail error) {
        transition(step, StepStatus.FAILED);
        errors.put(step, error);
    }

    /**
     * PENDING → SKIPPED 전이.
     *
     * @param step 단계 이름
     */
    public synchronized void skip(String step) {
        transition(step, StepStatus.SKIPPED);
    }

    public synchronized StepStatus statusOf(String step) {
        StepStatus status = statuses.get(step);
        if (status == null) {
            throw new IllegalArgumentException("Unknown step: " + step);
        }
        return status;
    }

    public synchronized Map<String, StepStatus> statuses() {
        return Map.copyOf(statuses);
    }

    /**
     * 완료된 단계의 출력 (단계 완료 순서).
     *
     * @return 단계 이름 → 출력 스냅샷
     */
    public synchronized Map<String, StepOutput> outputs() {
        return new LinkedHashMap<>(outputs);
    }

    public synchronized Map<String, ErrorDetail> errors() {
        return new LinkedHashMap<>(errors);
    }

    public synchronized Map<String, String> agents() {
        return new LinkedHashMap<>(agents);
    }

    /**
     * 종료 여부.
     *
     * @return PENDING, RUNNING 단계가 없으면 true
     */
    public synchronized boolean isTerminal() {
        return statuses.values().stream().noneMatch(StepStatus::isLive);
    }

    /**
     * 병합 출력 없이 종료 시각 기록.
     *
     * @throws IllegalStateException 아직 진행 중인 단계가 있는 경우
     */
    public synchronized void finish() {
        finish(StepOutput.empty());
    }

    /**
     * 종료 시각과 병합 출력 기록.
     *
     * <p>처음 호출한 값만 기록됩니다.</p>
     *
     * @param aggregatedOutput 완료된 단계 출력을 병합한 결과
     * @throws IllegalArgumentException aggregatedOutput이 null인 경우
     * @throws IllegalStateException 아직 진행 중인 단계가 있는 경우
     */
    public synchronized void finish(StepOutput aggregatedOutput) {
        if (aggregatedOutput == null) {
            throw new IllegalArgumentException("aggregatedOutput cannot be null");
        }
        if (!isTerminal()) {
            throw new IllegalStateException("Execution " + executionId + " still has live steps: " + statuses);
        }
        if (finishedAt == null) {
            finishedAt = Instant.now();
            this.aggregatedOutput = aggregatedOutput;
        }
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public CorrelationId getCorrelationId() {
        return correlationId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    /**
     * 병합 출력.
     *
     * @return 종료 시 기록된 병합 출력 (종료 전이면 null)
     */
    public synchronized StepOutput getAggregatedOutput() {
        return aggregatedOutput;
    }

    @Override
    public synchronized String toString() {
        return "WorkflowExecution{" + executionId + ", workflow=" + workflowId + ", steps=" + statuses + '}';
    }
}
