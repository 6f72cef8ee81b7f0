package com.ryuqq.finfind.core.protocol;

/**
 * 에이전트가 공개하는 기능 한 개의 명세.
 *
 * @param capability 기능
 * @param inputType 입력 페이로드 타입
 * @param outputType 출력 페이로드 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CapabilityDescriptor(
    Capability capability,
    Class<?> inputType,
    Class<?> outputType
) {

    public CapabilityDescriptor {
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        if (inputType == null) {
            throw new IllegalArgumentException("inputType cannot be null");
        }
        if (outputType == null) {
            throw new IllegalArgumentException("outputType cannot be null");
        }
    }
}
