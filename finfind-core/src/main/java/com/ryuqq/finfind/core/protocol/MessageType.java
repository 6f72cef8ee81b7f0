package com.ryuqq.finfind.core.protocol;

/**
 * A2A 메시지 유형.
 *
 * <ul>
 *   <li>REQUEST: 응답을 기대하는 요청 (correlationId 필수)</li>
 *   <li>RESPONSE: 이전 REQUEST 하나에 대한 응답 (같은 correlationId)</li>
 *   <li>EVENT: 수명주기 알림 (응답 없음)</li>
 *   <li>BROADCAST: 모든 구독자에게 전달 (응답 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MessageType {

    REQUEST,
    RESPONSE,
    EVENT,
    BROADCAST;

    /**
     * 상관관계 ID가 필요한 유형인지 확인.
     *
     * @return REQUEST 또는 RESPONSE이면 true
     */
    public boolean isCorrelated() {
        return this == REQUEST || this == RESPONSE;
    }
}
