package com.ryuqq.finfind.core.workflow;

import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.outcome.ErrorDetail;
import com.ryuqq.finfind.core.statemachine.StepStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 종료된 워크플로 실행의 결과.
 *
 * <p>상태 결정 규칙:</p>
 * <ul>
 *   <li>COMPLETED: 모든 필수 단계가 COMPLETED</li>
 *   <li>PARTIAL: 필수 단계 중 하나 이상 COMPLETED</li>
 *   <li>FAILED: 그 외</li>
 * </ul>
 *
 * @param executionId 실행 ID
 * @param workflowId 워크플로 ID
 * @param status 최종 상태
 * @param stepOutputs 완료된 단계 출력 (정의 순서)
 * @param failedSteps 실패한 단계 (정의 순서)
 * @param skippedSteps 건너뛴 단계 (정의 순서)
 * @param stepErrors 실패한 단계의 오류
 * @param stepAgents 완료된 단계에 응답한 에이전트
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowResult(
    String executionId,
    String workflowId,
    WorkflowStatus status,
    Map<String, StepOutput> stepOutputs,
    List<String> failedSteps,
    List<String> skippedSteps,
    Map<String, ErrorDetail> stepErrors,
    Map<String, String> stepAgents
) {

    public WorkflowResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        stepOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(stepOutputs));
        failedSteps = List.copyOf(failedSteps);
        skippedSteps = List.copyOf(skippedSteps);
        stepErrors = Collections.unmodifiableMap(new LinkedHashMap<>(stepErrors));
        stepAgents = Collections.unmodifiableMap(new LinkedHashMap<>(stepAgents));
    }

    /**
     * 종료된 실행으로부터 결과 생성.
     *
     * @param definition 워크플로 정의
     * @param execution 종료된 실행
     * @return WorkflowResult 인스턴스
     * @throws IllegalStateException 실행이 종료되지 않은 경우
     */
    public static WorkflowResult of(WorkflowDefinition definition, WorkflowExecution execution) {
        if (!execution.isTerminal()) {
            throw new IllegalStateException("Execution is not terminal: " + execution);
        }

        Map<String, StepStatus> statuses = execution.statuses();
        Map<String, StepOutput> produced = execution.outputs();
        Map<String, StepOutput> outputs = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        boolean allRequiredCompleted = true;
        boolean anyRequiredCompleted = false;

        for (WorkflowStep step : definition.steps()) {
            StepStatus status = statuses.get(step.name());
            if (status == StepStatus.COMPLETED) {
                outputs.put(step.name(), produced.get(step.name()));
            } else if (status == StepStatus.FAILED) {
                failed.add(step.name());
            } else if (status == StepStatus.SKIPPED) {
                skipped.add(step.name());
            }
            if (step.required()) {
                if (status == StepStatus.COMPLETED) {
                    anyRequiredCompleted = true;
                } else {
                    allRequiredCompleted = false;
                }
            }
        }

        WorkflowStatus status;
        if (allRequiredCompleted) {
            status = WorkflowStatus.COMPLETED;
        } else if (anyRequiredCompleted) {
            status = WorkflowStatus.PARTIAL;
        } else {
            status = WorkflowStatus.FAILED;
        }

        return new WorkflowResult(execution.getExecutionId(), definition.id(), status, outputs, failed, skipped,
            execution.errors(), execution.agents());
    }
}
