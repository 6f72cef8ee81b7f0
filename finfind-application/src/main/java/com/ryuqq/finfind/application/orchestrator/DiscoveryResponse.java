package com.ryuqq.finfind.application.orchestrator;

import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.outcome.ErrorDetail;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 오케스트레이터의 구조화된 응답.
 *
 * <p>오케스트레이터는 예외를 던지지 않으며, 모든 실패는 {@link #errors()}에 담깁니다.</p>
 *
 * <ul>
 *   <li>success = true, partial = false: 모든 필수 단계 완료</li>
 *   <li>success = true, partial = true: 일부 필수 단계만 완료</li>
 *   <li>success = false: 완료된 필수 단계 없음 또는 요청 검증 실패</li>
 * </ul>
 *
 * @param success 성공 여부
 * @param output 사람이 읽을 요약
 * @param products 병합된 상품 (ID 기준 중복 제거, 점수 내림차순)
 * @param agentsUsed 응답한 에이전트 (호출 순서)
 * @param executionTimeMs 처리 시간 (밀리초)
 * @param errors 오류 목록
 * @param partial 부분 성공 여부
 * @param workflowId 실행한 워크플로 ID (선택 전 실패 시 null)
 * @param executionId 실행 ID (실행 전 실패 시 null)
 * @param explanations 상품 ID → 설명
 * @param alternatives 대안 상품
 * @param warnings 경고 (분류 대체, 설명 충돌 등)
 * @param conversationId 이 요청이 기록된 대화 ID (다음 요청의 RequestContext에 전달, 검증 실패 시 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DiscoveryResponse(
    boolean success,
    String output,
    List<ProductHit> products,
    List<String> agentsUsed,
    long executionTimeMs,
    List<ErrorDetail> errors,
    boolean partial,
    String workflowId,
    String executionId,
    Map<String, String> explanations,
    List<ProductHit> alternatives,
    List<String> warnings,
    String conversationId
) {

    public DiscoveryResponse {
        if (executionTimeMs < 0) {
            throw new IllegalArgumentException("executionTimeMs cannot be negative (current: " + executionTimeMs + ")");
        }
        if (partial && !success) {
            throw new IllegalArgumentException("partial response must be successful");
        }
        output = output == null ? "" : output;
        products = products == null ? List.of() : List.copyOf(products);
        agentsUsed = agentsUsed == null ? List.of() : List.copyOf(agentsUsed);
        errors = errors == null ? List.of() : List.copyOf(errors);
        explanations = explanations == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(explanations));
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * 워크플로 실행 전에 실패한 응답.
     *
     * @param errors 오류 목록
     * @param warnings 경고
     * @param executionTimeMs 처리 시간
     * @return 실패 응답
     */
    public static DiscoveryResponse failure(List<ErrorDetail> errors, List<String> warnings, long executionTimeMs) {
        return new DiscoveryResponse(false, "Request could not be processed", List.of(), List.of(), executionTimeMs,
            errors, false, null, null, Map.of(), List.of(), warnings, null);
    }
}
