package com.ryuqq.finfind.core.outcome;

import java.util.function.Function;

/**
 * 에이전트 호출, 버스 요청, 워크플로 단계의 실행 결과.
 *
 * <p>Result는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨 (값 포함)</li>
 *   <li>{@link Fail}: 실패 ({@link ErrorKind}로 분류)</li>
 * </ul>
 *
 * <p>타임아웃, 업스트림 오류, 검증 실패는 모두 예외가 아닌 Fail 값으로 전달됩니다.
 * 엔진과 오케스트레이터는 Result 값만 다루며, 예외는 어댑터 경계에서 변환됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;StepOutput&gt; result = agent.search(request);
 * if (result instanceof Ok&lt;StepOutput&gt; ok) {
 *     merge(ok.value());
 * } else if (result instanceof Fail&lt;StepOutput&gt; fail) {
 *     record(fail.kind(), fail.message());
 * }
 * </pre>
 *
 * @param <T> 성공 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Ok, Fail {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값
     * @param <T> 값 타입
     * @return Ok 인스턴스
     */
    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param kind 오류 분류
     * @param message 오류 메시지
     * @param <T> 값 타입
     * @return Fail 인스턴스
     */
    static <T> Result<T> fail(ErrorKind kind, String message) {
        return new Fail<>(kind, message, null);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 성공 값을 변환.
     *
     * <p>실패인 경우 동일한 오류 정보를 가진 Fail을 그대로 반환합니다.</p>
     *
     * @param mapper 변환 함수
     * @param <U> 변환 후 타입
     * @return 변환된 Result
     */
    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return ((Fail<T>) this).retype();
    }
}
