package com.ryuqq.finfind.adapter.runner;

import java.time.Duration;

/**
 * DiscoveryOrchestrator 설정.
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultWorkflowId: 분류 실패 시 사용할 워크플로 (기본값: search_only)</li>
 *   <li>classifyTimeout: 분류 요청 대기 시간 (기본값: 5초)</li>
 *   <li>requestTimeout: 요청 전체 처리 시간 상한, 초과 시 실행 취소 (기본값: 60초)</li>
 *   <li>maxQueryLength: 허용하는 질의 최대 길이 (기본값: 1000)</li>
 *   <li>sender: 분류 요청의 발신자 이름 (기본값: orchestrator)</li>
 * </ul>
 *
 * @param defaultWorkflowId 기본 워크플로 ID
 * @param classifyTimeout 분류 요청 대기 시간
 * @param requestTimeout 요청 처리 시간 상한
 * @param maxQueryLength 질의 최대 길이
 * @param sender 발신자 이름
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorConfig(
    String defaultWorkflowId,
    Duration classifyTimeout,
    Duration requestTimeout,
    int maxQueryLength,
    String sender
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 설정 값이 유효하지 않은 경우
     */
    public OrchestratorConfig {
        if (defaultWorkflowId == null || defaultWorkflowId.isBlank()) {
            throw new IllegalArgumentException("defaultWorkflowId cannot be null or blank");
        }
        if (classifyTimeout == null || classifyTimeout.isNegative() || classifyTimeout.isZero()) {
            throw new IllegalArgumentException("classifyTimeout must be positive (current: " + classifyTimeout + ")");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
        if (maxQueryLength <= 0) {
            throw new IllegalArgumentException("maxQueryLength must be positive (current: " + maxQueryLength + ")");
        }
        if (sender == null || sender.isBlank()) {
            throw new IllegalArgumentException("sender cannot be null or blank");
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public OrchestratorConfig() {
        this("search_only", Duration.ofSeconds(5), Duration.ofSeconds(60), 1000, "orchestrator");
    }

    /**
     * defaultWorkflowId만 변경한 새 인스턴스 생성.
     *
     * @param defaultWorkflowId 기본 워크플로 ID
     * @return 새 OrchestratorConfig 인스턴스
     */
    public OrchestratorConfig withDefaultWorkflowId(String defaultWorkflowId) {
        return new OrchestratorConfig(defaultWorkflowId, classifyTimeout, requestTimeout, maxQueryLength, sender);
    }

    /**
     * classifyTimeout만 변경한 새 인스턴스 생성.
     *
     * @param classifyTimeout 분류 요청 대기 시간
     * @return 새 OrchestratorConfig 인스턴스
     */
    public OrchestratorConfig withClassifyTimeout(Duration classifyTimeout) {
        return new OrchestratorConfig(defaultWorkflowId, classifyTimeout, requestTimeout, maxQueryLength, sender);
    }

    /**
     * requestTimeout만 변경한 새 인스턴스 생성.
     *
     * @param requestTimeout 요청 처리 시간 상한
     * @return 새 OrchestratorConfig 인스턴스
     */
    public OrchestratorConfig withRequestTimeout(Duration requestTimeout) {
        return new OrchestratorConfig(defaultWorkflowId, classifyTimeout, requestTimeout, maxQueryLength, sender);
    }

    /**
     * maxQueryLength만 변경한 새 인스턴스 생성.
     *
     * @param maxQueryLength 질의 최대 길이
     * @return 새 OrchestratorConfig 인스턴스
     */
    public OrchestratorConfig withMaxQueryLength(int maxQueryLength) {
        return new OrchestratorConfig(defaultWorkflowId, classifyTimeout, requestTimeout, maxQueryLength, sender);
    }

    /**
     * sender만 변경한 새 인스턴스 생성.
     *
     * @param sender 발신자 이름
     * @return 새 OrchestratorConfig 인스턴스
     */
    public OrchestratorConfig withSender(String sender) {
        return new OrchestratorConfig(defaultWorkflowId, classifyTimeout, requestTimeout, maxQueryLength, sender);
    }
}
