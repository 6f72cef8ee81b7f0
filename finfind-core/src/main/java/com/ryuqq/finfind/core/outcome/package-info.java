/**
 * 실행 결과 타입.
 *
 * <p>{@link com.ryuqq.finfind.core.outcome.Result}는 Ok/Fail 두 가지 케이스를 가지는
 * sealed interface이며, 실패는 {@link com.ryuqq.finfind.core.outcome.ErrorKind}로 분류됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.core.outcome;
