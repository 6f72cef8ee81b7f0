package com.ryuqq.finfind.core.retrieval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 검색 결과 한 건.
 *
 * @param id 점 ID
 * @param score 관련도 점수 (0 ~ 1, 코사인 유사도를 0 아래에서 자름)
 * @param payload 페이로드
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetrievalResult(String id, double score, Map<String, Object> payload) {

    public RetrievalResult {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0 (current: " + score + ")");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
