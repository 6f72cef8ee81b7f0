package com.ryuqq.finfind.core.model;

import java.util.UUID;

/**
 * 요청-응답을 짝짓는 상관관계 식별자.
 *
 * <p>CorrelationId는 REQUEST 메시지 하나와 그에 대한 RESPONSE 메시지를 연결하며,
 * 오케스트레이터 수준에서는 하나의 사용자 요청(= 하나의 WorkflowExecution)을 식별합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CorrelationId {

    private final String value;

    private CorrelationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CorrelationId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("CorrelationId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("CorrelationId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * CorrelationId 생성.
     *
     * @param value 식별자 값
     * @return CorrelationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CorrelationId of(String value) {
        return new CorrelationId(value);
    }

    /**
     * 무작위 UUID 기반 CorrelationId 생성.
     *
     * @return 새 CorrelationId
     */
    public static CorrelationId generate() {
        return new CorrelationId(UUID.randomUUID().toString());
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrelationId that = (CorrelationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CorrelationId{" + value + '}';
    }
}
