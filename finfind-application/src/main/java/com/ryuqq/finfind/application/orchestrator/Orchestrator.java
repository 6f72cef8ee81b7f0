package com.ryuqq.finfind.application.orchestrator;

/**
 * 상품 탐색 요청 조정자.
 *
 * <p>자연어 요청 하나를 워크플로로 분류하고 실행하여 하나의 구조화된 응답으로 병합합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DiscoveryRequest request = new DiscoveryRequest(
 *     "noise cancelling headphones under 200",
 *     "user-42",
 *     RequestContext.empty().withBudgetMax(200.0)
 * );
 * DiscoveryResponse response = orchestrator.processRequest(request);
 *
 * if (response.success()) {
 *     render(response.products(), response.explanations());
 * } else {
 *     report(response.errors());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * 요청 처리.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>CLASSIFY 기능으로 워크플로 선택 (실패 시 기본 워크플로 + 경고)</li>
     *   <li>이전 턴과 상품 ID로 압축 컨텍스트 구성</li>
     *   <li>워크플로 엔진으로 실행</li>
     *   <li>단계 출력 병합 (상품 ID 중복 제거, 설명 충돌은 마지막 단계 우선)</li>
     * </ol>
     *
     * <p>이 메서드는 예외를 던지지 않습니다. 모든 실패는 응답의 errors에 기록됩니다.</p>
     *
     * @param request 탐색 요청
     * @return 구조화된 응답 (null 아님)
     */
    DiscoveryResponse processRequest(DiscoveryRequest request);
}
