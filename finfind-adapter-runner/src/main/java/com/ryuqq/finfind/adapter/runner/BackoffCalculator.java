package com.ryuqq.finfind.adapter.runner;

import com.ryuqq.finfind.core.workflow.RetryPolicy;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Step 재시도용 Exponential Backoff with Jitter 계산기.
 *
 * <p>같은 Agent에 동시에 재시도가 몰리지 않도록 지수 증가 간격에 Jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(failedAttempts-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (RetryPolicy.defaults(): backoff=200ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>1회 실패 후: 200ms + jitter(0-20ms)</li>
 *   <li>2회 실패 후: 400ms + jitter(0-40ms)</li>
 *   <li>6회 실패 후: 6400ms → maxDelay(5000ms)로 제한</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Step의 RetryPolicy로부터 계산기 생성.
     *
     * <p>정책의 backoff가 maxDelayMs보다 크면 정책 값이 상한이 됩니다.</p>
     *
     * @param policy Step 재시도 정책
     * @param maxDelayMs Runner 전역 최대 지연 시간 (밀리초)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @return 계산기
     */
    public static BackoffCalculator forPolicy(RetryPolicy policy, long maxDelayMs, double jitterFactor) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        return new BackoffCalculator(policy.backoffMs(), Math.max(policy.backoffMs(), maxDelayMs), jitterFactor);
    }

    /**
     * 다음 시도 전 대기 시간 계산.
     *
     * @param failedAttempts 지금까지 실패한 시도 횟수 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException failedAttempts가 양수가 아닌 경우
     */
    public long calculate(int failedAttempts) {
        if (failedAttempts <= 0) {
            throw new IllegalArgumentException(
                "failedAttempts must be positive (current: " + failedAttempts + ")"
            );
        }

        // shift 상한으로 overflow 방지
        long exponential = Math.min(
            baseDelayMs * (1L << Math.min(failedAttempts - 1, MAX_SHIFT)),
            maxDelayMs
        );
        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
