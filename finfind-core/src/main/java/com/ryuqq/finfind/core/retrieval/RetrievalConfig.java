package com.ryuqq.finfind.core.retrieval;

/**
 * RetrievalEngine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>prefetchLimit: MMR 후보 풀 최소 크기 (기본 50)</li>
 *   <li>oversampleFactor: MMR 후보 풀 = max(limit × oversampleFactor, prefetchLimit) (기본 3)</li>
 *   <li>defaultScoreThreshold: 에이전트가 쓰는 기본 점수 하한 (기본 0.5)</li>
 *   <li>defaultDiversity: 질의에 diversity가 없을 때 MMR 다양성 (기본 0.3)</li>
 *   <li>negativeWeight: 추천 시 부정 예시 centroid 가중치 (기본 0.3)</li>
 *   <li>maxNegativeExamples: 추천 시 사용할 부정 예시 최대 개수 (기본 5)</li>
 * </ul>
 *
 * @param prefetchLimit MMR 후보 풀 최소 크기 (1 이상)
 * @param oversampleFactor 후보 풀 배수 (1 이상)
 * @param defaultScoreThreshold 기본 점수 하한 (0.0 ~ 1.0)
 * @param defaultDiversity 기본 다양성 (0.0 ~ 1.0)
 * @param negativeWeight 부정 예시 가중치 (0.0 ~ 1.0)
 * @param maxNegativeExamples 부정 예시 최대 개수 (0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetrievalConfig(
    int prefetchLimit,
    int oversampleFactor,
    double defaultScoreThreshold,
    double defaultDiversity,
    double negativeWeight,
    int maxNegativeExamples
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: prefetchLimit=50, oversampleFactor=3, defaultScoreThreshold=0.5,
     * defaultDiversity=0.3, negativeWeight=0.3, maxNegativeExamples=5</p>
     */
    public RetrievalConfig() {
        this(50, 3, 0.5, 0.3, 0.3, 5);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetrievalConfig {
        if (prefetchLimit <= 0) {
            throw new IllegalArgumentException(
                "prefetchLimit must be positive (current: " + prefetchLimit + ")"
            );
        }
        if (oversampleFactor <= 0) {
            throw new IllegalArgumentException(
                "oversampleFactor must be positive (current: " + oversampleFactor + ")"
            );
        }
        requireUnit("defaultScoreThreshold", defaultScoreThreshold);
        requireUnit("defaultDiversity", defaultDiversity);
        requireUnit("negativeWeight", negativeWeight);
        if (maxNegativeExamples < 0) {
            throw new IllegalArgumentException(
                "maxNegativeExamples cannot be negative (current: " + maxNegativeExamples + ")"
            );
        }
    }

    public RetrievalConfig withPrefetchLimit(int prefetchLimit) {
        return new RetrievalConfig(prefetchLimit, oversampleFactor, defaultScoreThreshold, defaultDiversity, negativeWeight, maxNegativeExamples);
    }

    public RetrievalConfig withOversampleFactor(int oversampleFactor) {
        return new RetrievalConfig(prefetchLimit, oversampleFactor, defaultScoreThreshold, defaultDiversity, negativeWeight, maxNegativeExamples);
    }

    public RetrievalConfig withDefaultScoreThreshold(double defaultScoreThreshold) {
        return new RetrievalConfig(prefetchLimit, oversampleFactor, defaultScoreThreshold, defaultDiversity, negativeWeight, maxNegativeExamples);
    }

    public RetrievalConfig withDefaultDiversity(double defaultDiversity) {
        return new RetrievalConfig(prefetchLimit, oversampleFactor, defaultScoreThreshold, defaultDiversity, negativeWeight, maxNegativeExamples);
    }

    public RetrievalConfig withNegativeWeight(double negativeWeight) {
        return new RetrievalConfig(prefetchLimit, oversampleFactor, defaultScoreThreshold, defaultDiversity, negativeWeight, maxNegativeExamples);
    }

    public RetrievalConfig withMaxNegativeExamples(int maxNegativeExamples) {
        return new RetrievalConfig(prefetchLimit, oversampleFactor, defaultScoreThreshold, defaultDiversity, negativeWeight, maxNegativeExamples);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(
                name + " must be between 0.0 and 1.0 (current: " + value + ")"
            );
        }
    }
}
