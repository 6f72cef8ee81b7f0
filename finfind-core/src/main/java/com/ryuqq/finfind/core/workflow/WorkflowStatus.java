package com.ryuqq.finfind.core.workflow;

/**
 * 워크플로 실행의 최종 상태.
 *
 * <ul>
 *   <li>COMPLETED: 모든 필수 단계가 완료됨</li>
 *   <li>PARTIAL: 필수 단계 중 일부만 완료됨</li>
 *   <li>FAILED: 완료된 필수 단계가 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkflowStatus {
    COMPLETED,
    PARTIAL,
    FAILED
}
