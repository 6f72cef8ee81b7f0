package com.ryuqq.finfind.core.workflow;

/**
 * 단계 재시도 정책 (불변 record).
 *
 * <p>각 시도는 버스 요청 한 번이며, 시도 사이에는 backoffMs를 기준으로
 * 지수 백오프가 적용됩니다. 재시도 불가 오류(VALIDATION 등)는 남은 시도와 무관하게 즉시 멈춥니다.</p>
 *
 * @param maxAttempts 최대 시도 횟수 (첫 시도 포함, 1 이상)
 * @param backoffMs 첫 재시도 전 대기 시간 (밀리초, 양수)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetryPolicy(int maxAttempts, long backoffMs) {

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (backoffMs <= 0) {
            throw new IllegalArgumentException(
                "backoffMs must be positive (current: " + backoffMs + ")"
            );
        }
    }

    /**
     * 기본 정책: 3회 시도 (재시도 2회), 200ms부터 백오프.
     *
     * @return 기본 RetryPolicy
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 200);
    }

    /**
     * 재시도 없음.
     *
     * @return 1회만 시도하는 RetryPolicy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 200);
    }
}
