package com.ryuqq.finfind.adapter.inmemory.bus;

import java.time.Duration;

/**
 * InMemoryMessageBus 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrentRequestsPerTopic: 토픽당 동시에 응답을 기다리는 요청 수 (기본 4).
 *       기한이 지난 요청은 핸들러가 아직 실행 중이어도 세지 않음</li>
 *   <li>contextByteBudget: REQUEST에 첨부되는 컨텍스트 최대 크기 (기본 4096 bytes)</li>
 *   <li>defaultTimeout: 호출자가 timeout을 주지 않았을 때의 응답 대기 시간 (기본 30초)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxConcurrentRequestsPerTopic 토픽당 동시에 응답을 기다리는 요청 수 (1 이상)
 * @param contextByteBudget 컨텍스트 바이트 예산 (512 이상)
 * @param defaultTimeout 기본 응답 대기 시간 (양수)
 */
public record BusConfig(
    int maxConcurrentRequestsPerTopic,
    int contextByteBudget,
    Duration defaultTimeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrentRequestsPerTopic=4, contextByteBudget=4096, defaultTimeout=30s</p>
     */
    public BusConfig() {
        this(4, 4096, Duration.ofSeconds(30));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BusConfig {
        if (maxConcurrentRequestsPerTopic <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentRequestsPerTopic must be positive (current: " + maxConcurrentRequestsPerTopic + ")"
            );
        }
        if (contextByteBudget < 512) {
            throw new IllegalArgumentException(
                "contextByteBudget must be >= 512 (current: " + contextByteBudget + ")"
            );
        }
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException(
                "defaultTimeout must be positive (current: " + defaultTimeout + ")"
            );
        }
    }

    /**
     * maxConcurrentRequestsPerTopic만 변경한 새 인스턴스 생성.
     */
    public BusConfig withMaxConcurrentRequestsPerTopic(int maxConcurrentRequestsPerTopic) {
        return new BusConfig(maxConcurrentRequestsPerTopic, contextByteBudget, defaultTimeout);
    }

    /**
     * contextByteBudget만 변경한 새 인스턴스 생성.
     */
    public BusConfig withContextByteBudget(int contextByteBudget) {
        return new BusConfig(maxConcurrentRequestsPerTopic, contextByteBudget, defaultTimeout);
    }

    /**
     * defaultTimeout만 변경한 새 인스턴스 생성.
     */
    public BusConfig withDefaultTimeout(Duration defaultTimeout) {
        return new BusConfig(maxConcurrentRequestsPerTopic, contextByteBudget, defaultTimeout);
    }
}
