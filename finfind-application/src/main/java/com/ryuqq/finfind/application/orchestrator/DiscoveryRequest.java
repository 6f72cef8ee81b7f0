package com.ryuqq.finfind.application.orchestrator;

/**
 * 자연어 상품 탐색 요청.
 *
 * <p>text, userId 검증은 {@link Orchestrator#processRequest}가 수행하며
 * 실패 시 예외 대신 VALIDATION 오류가 담긴 응답을 반환합니다.</p>
 *
 * @param text 사용자 질의
 * @param userId 사용자 ID
 * @param context 대화 상태 (null이면 빈 컨텍스트)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DiscoveryRequest(String text, String userId, RequestContext context) {

    public DiscoveryRequest {
        context = context == null ? RequestContext.empty() : context;
    }

    /**
     * 컨텍스트 없는 요청 생성.
     *
     * @param text 사용자 질의
     * @param userId 사용자 ID
     * @return DiscoveryRequest 인스턴스
     */
    public static DiscoveryRequest of(String text, String userId) {
        return new DiscoveryRequest(text, userId, RequestContext.empty());
    }
}
