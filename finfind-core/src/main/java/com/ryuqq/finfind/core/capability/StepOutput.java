package com.ryuqq.finfind.core.capability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 에이전트가 반환하는 단계 출력.
 *
 * @param products 찾거나 재정렬한 상품
 * @param explanations 상품 ID → 설명
 * @param alternatives 대안 상품
 * @param summary 사람이 읽을 요약 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepOutput(
    List<ProductHit> products,
    Map<String, String> explanations,
    List<ProductHit> alternatives,
    String summary
) {

    public StepOutput {
        products = products == null ? List.of() : List.copyOf(products);
        explanations = explanations == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(explanations));
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    /**
     * 상품만 담은 출력.
     *
     * @param products 상품
     * @param summary 요약
     * @return StepOutput 인스턴스
     */
    public static StepOutput ofProducts(List<ProductHit> products, String summary) {
        return new StepOutput(products, Map.of(), List.of(), summary);
    }

    /**
     * 빈 출력.
     *
     * @return 상품, 설명, 대안이 모두 없는 출력
     */
    public static StepOutput empty() {
        return new StepOutput(List.of(), Map.of(), List.of(), null);
    }
}
