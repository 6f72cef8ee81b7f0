package com.ryuqq.finfind.core.statemachine;

/**
 * 워크플로 단계의 상태.
 *
 * <p>상태 전이 규칙:</p>
 * <ul>
 *   <li>PENDING → RUNNING (의존 단계가 모두 해결됨)</li>
 *   <li>PENDING → SKIPPED (필수 의존 단계 실패/건너뜀, 조건 불충족, 취소)</li>
 *   <li>RUNNING → COMPLETED (버스 응답 성공)</li>
 *   <li>RUNNING → FAILED (재시도와 대체 capability 소진, 취소)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, FAILED, SKIPPED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StepStatus {

    /**
     * 실행 대기 상태.
     */
    PENDING,

    /**
     * 버스를 통해 에이전트 호출 중.
     */
    RUNNING,

    /**
     * 성공적으로 완료됨 (종료 상태).
     */
    COMPLETED,

    /**
     * 실패로 종료됨 (종료 상태).
     */
    FAILED,

    /**
     * 실행되지 않고 건너뜀 (종료 상태).
     */
    SKIPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, SKIPPED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /**
     * 아직 진행 중인지 확인.
     *
     * @return PENDING 또는 RUNNING이면 true
     */
    public boolean isLive() {
        return !isTerminal();
    }
}
