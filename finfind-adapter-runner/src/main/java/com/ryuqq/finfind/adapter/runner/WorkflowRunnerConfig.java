package com.ryuqq.finfind.adapter.runner;

import com.ryuqq.finfind.core.protocol.Priority;

import java.time.Duration;

/**
 * LayeredWorkflowRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 실행되는 Step 수 (기본 8)</li>
 *   <li>maxBackoffMs: 재시도 대기 상한 (기본 5000ms)</li>
 *   <li>jitterFactor: Backoff Jitter 비율 (기본 0.1)</li>
 *   <li>defaultStepTimeout: Step에 timeout이 없을 때의 시도당 제한 (기본 30초)</li>
 *   <li>sender: Bus 요청/이벤트의 발신자 이름 (기본 "workflow-runner")</li>
 *   <li>priority: Step 요청 우선순위 (기본 NORMAL)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param concurrency 동시 Step 실행 스레드 수 (1 이상이어야 함)
 * @param maxBackoffMs 최대 재시도 대기 (밀리초, 양수여야 함)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param defaultStepTimeout 시도당 기본 제한 시간 (양수여야 함)
 * @param sender 발신자 이름
 * @param priority Step 요청 우선순위
 */
public record WorkflowRunnerConfig(
    int concurrency,
    long maxBackoffMs,
    double jitterFactor,
    Duration defaultStepTimeout,
    String sender,
    Priority priority
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=8, maxBackoffMs=5000, jitterFactor=0.1,
     * defaultStepTimeout=30s, sender="workflow-runner", priority=NORMAL</p>
     */
    public WorkflowRunnerConfig() {
        this(8, 5000, 0.1, Duration.ofSeconds(30), "workflow-runner", Priority.NORMAL);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkflowRunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (maxBackoffMs <= 0) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be positive (current: " + maxBackoffMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (defaultStepTimeout == null || defaultStepTimeout.isNegative() || defaultStepTimeout.isZero()) {
            throw new IllegalArgumentException(
                "defaultStepTimeout must be positive (current: " + defaultStepTimeout + ")"
            );
        }
        if (sender == null || sender.isBlank()) {
            throw new IllegalArgumentException("sender cannot be null or blank");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public WorkflowRunnerConfig withConcurrency(int concurrency) {
        return new WorkflowRunnerConfig(concurrency, maxBackoffMs, jitterFactor, defaultStepTimeout, sender, priority);
    }

    /**
     * maxBackoffMs만 변경한 새 인스턴스 생성.
     */
    public WorkflowRunnerConfig withMaxBackoffMs(long maxBackoffMs) {
        return new WorkflowRunnerConfig(concurrency, maxBackoffMs, jitterFactor, defaultStepTimeout, sender, priority);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public WorkflowRunnerConfig withJitterFactor(double jitterFactor) {
        return new WorkflowRunnerConfig(concurrency, maxBackoffMs, jitterFactor, defaultStepTimeout, sender, priority);
    }

    /**
     * defaultStepTimeout만 변경한 새 인스턴스 생성.
     */
    public WorkflowRunnerConfig withDefaultStepTimeout(Duration defaultStepTimeout) {
        return new WorkflowRunnerConfig(concurrency, maxBackoffMs, jitterFactor, defaultStepTimeout, sender, priority);
    }

    /**
     * sender만 변경한 새 인스턴스 생성.
     */
    public WorkflowRunnerConfig withSender(String sender) {
        return new WorkflowRunnerConfig(concurrency, maxBackoffMs, jitterFactor, defaultStepTimeout, sender, priority);
    }

    /**
     * priority만 변경한 새 인스턴스 생성.
     */
    public WorkflowRunnerConfig withPriority(Priority priority) {
        return new WorkflowRunnerConfig(concurrency, maxBackoffMs, jitterFactor, defaultStepTimeout, sender, priority);
    }
}
