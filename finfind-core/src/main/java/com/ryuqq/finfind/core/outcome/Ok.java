package com.ryuqq.finfind.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 성공 값 (null 불가)
 * @param <T> 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Ok {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }
}
