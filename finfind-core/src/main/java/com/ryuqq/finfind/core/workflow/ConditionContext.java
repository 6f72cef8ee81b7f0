package com.ryuqq.finfind.core.workflow;

import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.StepOutput;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 단계 조건이 평가하는 시점의 누적 상태.
 *
 * @param query 사용자 질의
 * @param budgetMax 예산 상한 (null 가능)
 * @param products 완료된 단계들의 상품 (ID 기준 중복 제거, 단계 순서)
 * @param outputs 완료된 단계 이름 → 출력
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ConditionContext(
    String query,
    Double budgetMax,
    List<ProductHit> products,
    Map<String, StepOutput> outputs
) {

    public ConditionContext {
        products = products == null ? List.of() : List.copyOf(products);
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }
}
