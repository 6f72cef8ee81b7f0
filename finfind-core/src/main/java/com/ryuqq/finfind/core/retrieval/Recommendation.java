package com.ryuqq.finfind.core.retrieval;

import java.util.List;

/**
 * 예시 기반 추천 결과.
 *
 * <p>컬렉션에 없는 예시 ID는 호출 전체를 실패시키지 않고 {@code rejectedIds}로 보고됩니다.</p>
 *
 * @param results 추천 결과 (점수 내림차순)
 * @param rejectedIds 컬렉션에 없어 무시된 예시 ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Recommendation(List<RetrievalResult> results, List<String> rejectedIds) {

    public Recommendation {
        results = results == null ? List.of() : List.copyOf(results);
        rejectedIds = rejectedIds == null ? List.of() : List.copyOf(rejectedIds);
    }

    public boolean hasRejections() {
        return !rejectedIds.isEmpty();
    }
}
