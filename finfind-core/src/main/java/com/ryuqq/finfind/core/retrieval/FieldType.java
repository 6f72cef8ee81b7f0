package com.ryuqq.finfind.core.retrieval;

/**
 * 필터 가능한 페이로드 필드의 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FieldType {

    /** 문자열 (정확히 일치). */
    KEYWORD,

    /** 숫자 (범위 조건 가능). */
    NUMERIC,

    /** 참/거짓. */
    BOOLEAN;

    /**
     * 값이 이 타입에 맞는지 확인.
     *
     * @param value 검사할 값
     * @return 맞으면 true
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case KEYWORD -> value instanceof String;
            case NUMERIC -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
        };
    }
}
