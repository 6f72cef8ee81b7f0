package com.ryuqq.finfind.core.outcome;

/**
 * 오류 분류.
 *
 * <p>모든 실패 결과와 응답의 errors 항목은 이 분류 중 하나를 가집니다.</p>
 *
 * <ul>
 *   <li>VALIDATION: 잘못된 입력 (재시도 불가)</li>
 *   <li>UPSTREAM_TIMEOUT: 응답 기한 초과</li>
 *   <li>UPSTREAM_FAILURE: 에이전트/외부 서비스 오류</li>
 *   <li>STEP_FAILURE: 단계 처리 중 오류</li>
 *   <li>AGGREGATION_CONFLICT: 결과 병합 중 충돌 (경고 용도)</li>
 *   <li>CANCELLED: 호출자가 취소함</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorKind {

    VALIDATION(false),
    UPSTREAM_TIMEOUT(true),
    UPSTREAM_FAILURE(true),
    STEP_FAILURE(true),
    AGGREGATION_CONFLICT(false),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * 재시도 가능한 분류인지 확인.
     *
     * @return 재시도 가능 여부
     */
    public boolean isRetryable() {
        return retryable;
    }
}
