package com.ryuqq.finfind.core.retrieval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 벡터 저장소의 점 한 개.
 *
 * @param id 점 ID
 * @param vector 임베딩
 * @param payload 페이로드 (필터 대상 속성)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Point(String id, Embedding vector, Map<String, Object> payload) {

    public Point {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (vector == null) {
            throw new IllegalArgumentException("vector cannot be null");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
