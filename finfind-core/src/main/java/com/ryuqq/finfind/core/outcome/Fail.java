package com.ryuqq.finfind.core.outcome;

/**
 * 실패 결과.
 *
 * <p>오류 분류({@link ErrorKind})에 따라 재시도 여부가 결정됩니다.
 * 재시도 판단은 호출자(워크플로 러너)의 책임입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>응답 기한 초과 → {@link ErrorKind#UPSTREAM_TIMEOUT}</li>
 *   <li>토픽에 핸들러 없음 → {@link ErrorKind#UPSTREAM_FAILURE}</li>
 *   <li>알 수 없는 필터 필드 → {@link ErrorKind#VALIDATION}</li>
 * </ul>
 *
 * @param kind 오류 분류
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 * @param <T> 성공 시 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail<T>(
    ErrorKind kind,
    String message,
    String cause
) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 null/빈 문자열인 경우
     */
    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * Fail 생성 (cause 포함).
     *
     * @param kind 오류 분류
     * @param message 오류 메시지
     * @param cause 원인
     * @param <T> 값 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> of(ErrorKind kind, String message, String cause) {
        return new Fail<>(kind, message, cause);
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param kind 오류 분류
     * @param message 오류 메시지
     * @param <T> 값 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> of(ErrorKind kind, String message) {
        return new Fail<>(kind, message, null);
    }

    /**
     * 동일한 오류 정보를 다른 값 타입으로 재생성.
     *
     * @param <U> 대상 값 타입
     * @return 새 Fail 인스턴스
     */
    public <U> Fail<U> retype() {
        return new Fail<>(kind, message, cause);
    }

    /**
     * 재시도 가능 여부.
     *
     * @return kind가 재시도 가능한 분류이면 true
     */
    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
