/**
 * Agent-to-Agent 프로토콜.
 *
 * <p>메시지 봉투({@link com.ryuqq.finfind.core.protocol.Message}), 우선순위, 에이전트 카드,
 * 그리고 correlationId 기반 요청-응답 매칭({@link com.ryuqq.finfind.core.protocol.A2AProtocol})을 정의합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.core.protocol;
