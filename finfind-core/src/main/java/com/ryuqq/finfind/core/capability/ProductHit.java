package com.ryuqq.finfind.core.capability;

import com.ryuqq.finfind.core.retrieval.RetrievalResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 단계 출력에 포함되는 상품 한 건.
 *
 * @param id 상품 ID
 * @param score 관련도 점수 (0~1)
 * @param attributes 상품 속성 (name, price, category 등)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProductHit(String id, double score, Map<String, Object> attributes) {

    public ProductHit {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0 (current: " + score + ")");
        }
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * 검색 결과로부터 생성.
     *
     * @param result 검색 결과
     * @return ProductHit 인스턴스
     */
    public static ProductHit from(RetrievalResult result) {
        return new ProductHit(result.id(), result.score(), result.payload());
    }

    /**
     * 가격 속성 조회.
     *
     * @return 가격 (없거나 숫자가 아니면 null)
     */
    public Double priceOrNull() {
        Object price = attributes.get("price");
        return price instanceof Number number ? number.doubleValue() : null;
    }

    /**
     * 점수만 바꾼 새 인스턴스.
     *
     * @param score 새 점수
     * @return ProductHit 인스턴스
     */
    public ProductHit withScore(double score) {
        return new ProductHit(id, score, attributes);
    }
}
