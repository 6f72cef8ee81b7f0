package com.ryuqq.finfind.core.outcome;

/**
 * 응답에 포함되는 오류 항목.
 *
 * @param source 오류 발생 위치 (단계 이름, "classify", "orchestrator" 등)
 * @param kind 오류 분류
 * @param message 오류 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ErrorDetail(String source, ErrorKind kind, String message) {

    public ErrorDetail {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }

    /**
     * Fail로부터 오류 항목 생성.
     *
     * @param source 오류 발생 위치
     * @param fail 실패 결과
     * @return ErrorDetail 인스턴스
     */
    public static ErrorDetail of(String source, Fail<?> fail) {
        return new ErrorDetail(source, fail.kind(), fail.message());
    }
}
