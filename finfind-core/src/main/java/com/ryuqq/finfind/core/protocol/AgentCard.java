package com.ryuqq.finfind.core.protocol;

import java.util.List;

/**
 * 에이전트가 시작 시 공개하는 정적 명세.
 *
 * @param name 에이전트 이름 (고유)
 * @param topic 요청을 받는 버스 토픽
 * @param capabilities 제공 기능 목록 (1개 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AgentCard(
    String name,
    String topic,
    List<CapabilityDescriptor> capabilities
) {

    public AgentCard {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("capabilities cannot be null or empty");
        }
        capabilities = List.copyOf(capabilities);
    }

    /**
     * 기능 지원 여부.
     *
     * @param capability 확인할 기능
     * @return 지원하면 true
     */
    public boolean supports(Capability capability) {
        return capabilities.stream().anyMatch(descriptor -> descriptor.capability() == capability);
    }
}
