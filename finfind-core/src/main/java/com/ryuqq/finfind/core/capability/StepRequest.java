package com.ryuqq.finfind.core.capability;

import com.ryuqq.finfind.core.context.CompressedContext;
import com.ryuqq.finfind.core.protocol.Capability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 에이전트가 받는 단계 입력.
 *
 * <p>워크플로 러너가 단계의 입력 매핑에 따라 원본 요청과 이전 단계 출력으로부터 구성합니다.
 * 버스에는 payload 맵으로 직렬화되어 전달되며, 압축 컨텍스트는 메시지 봉투에 별도로 실립니다.</p>
 *
 * @param capability 호출할 기능
 * @param query 사용자 질의 (입력 매핑에 QUERY가 없으면 null)
 * @param userId 사용자 ID (입력 매핑에 USER가 없으면 null)
 * @param budgetMax 예산 상한 (null 가능)
 * @param filters 검색 필터 (필드 → 조건)
 * @param products 이전 단계에서 넘어온 상품
 * @param context 압축 컨텍스트 (수신 측에서만 채워짐, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepRequest(
    Capability capability,
    String query,
    String userId,
    Double budgetMax,
    Map<String, Object> filters,
    List<ProductHit> products,
    CompressedContext context
) {

    public StepRequest {
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        products = products == null ? List.of() : List.copyOf(products);
    }

    public StepRequest withCapability(Capability capability) {
        return new StepRequest(capability, query, userId, budgetMax, filters, products, context);
    }

    public StepRequest withProducts(List<ProductHit> products) {
        return new StepRequest(capability, query, userId, budgetMax, filters, products, context);
    }

    public StepRequest withContext(CompressedContext context) {
        return new StepRequest(capability, query, userId, budgetMax, filters, products, context);
    }
}
