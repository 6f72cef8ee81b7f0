package com.ryuqq.finfind.core.retrieval;

import java.util.List;

/**
 * 검색 질의.
 *
 * <p>semantic/MMR 검색은 vector가 필요하고, 추천은 positiveIds가 필요합니다.</p>
 *
 * @param collection 컬렉션 이름
 * @param vector 질의 벡터 (추천 질의에서는 null)
 * @param limit 최대 결과 수 (1 이상)
 * @param scoreThreshold 점수 하한 (null이면 제한 없음)
 * @param filter 페이로드 필터 (null이면 빈 필터)
 * @param diversity MMR 다양성 0~1 (null이면 설정 기본값)
 * @param positiveIds 추천 긍정 예시
 * @param negativeIds 추천 부정 예시
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetrievalQuery(
    String collection,
    Embedding vector,
    int limit,
    Double scoreThreshold,
    PayloadFilter filter,
    Double diversity,
    List<String> positiveIds,
    List<String> negativeIds
) {

    public RetrievalQuery {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection cannot be null or blank");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        if (scoreThreshold != null && (scoreThreshold < 0.0 || scoreThreshold > 1.0)) {
            throw new IllegalArgumentException("scoreThreshold must be between 0.0 and 1.0 (current: " + scoreThreshold + ")");
        }
        if (diversity != null && (diversity < 0.0 || diversity > 1.0)) {
            throw new IllegalArgumentException("diversity must be between 0.0 and 1.0 (current: " + diversity + ")");
        }
        filter = filter == null ? PayloadFilter.empty() : filter;
        positiveIds = positiveIds == null ? List.of() : List.copyOf(positiveIds);
        negativeIds = negativeIds == null ? List.of() : List.copyOf(negativeIds);
    }

    /**
     * 벡터 검색 질의 생성.
     *
     * @param collection 컬렉션
     * @param vector 질의 벡터
     * @param limit 최대 결과 수
     * @return RetrievalQuery 인스턴스
     */
    public static RetrievalQuery of(String collection, Embedding vector, int limit) {
        if (vector == null) {
            throw new IllegalArgumentException("vector cannot be null");
        }
        return new RetrievalQuery(collection, vector, limit, null, null, null, null, null);
    }

    /**
     * 예시 기반 추천 질의 생성.
     *
     * @param collection 컬렉션
     * @param positiveIds 긍정 예시
     * @param negativeIds 부정 예시 (null 가능)
     * @param limit 최대 결과 수
     * @return RetrievalQuery 인스턴스
     */
    public static RetrievalQuery recommend(String collection, List<String> positiveIds, List<String> negativeIds, int limit) {
        return new RetrievalQuery(collection, null, limit, null, null, null, positiveIds, negativeIds);
    }

    public RetrievalQuery withScoreThreshold(Double scoreThreshold) {
        return new RetrievalQuery(collection, vector, limit, scoreThreshold, filter, diversity, positiveIds, negativeIds);
    }

    public RetrievalQuery withFilter(PayloadFilter filter) {
        return new RetrievalQuery(collection, vector, limit, scoreThreshold, filter, diversity, positiveIds, negativeIds);
    }

    public RetrievalQuery withDiversity(Double diversity) {
        return new RetrievalQuery(collection, vector, limit, scoreThreshold, filter, diversity, positiveIds, negativeIds);
    }

    public RetrievalQuery withLimit(int limit) {
        return new RetrievalQuery(collection, vector, limit, scoreThreshold, filter, diversity, positiveIds, negativeIds);
    }
}
