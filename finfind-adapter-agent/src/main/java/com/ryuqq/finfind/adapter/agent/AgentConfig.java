package com.ryuqq.finfind.adapter.agent;

/**
 * Reference Agent 설정.
 *
 * <p>검색/추천/대안/설명 Agent가 공유하는 retrieval 파라미터를 정의합니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>productsCollection: "products"</li>
 *   <li>userProfilesCollection: "user_profiles"</li>
 *   <li>searchLimit: 10</li>
 *   <li>recommendationLimit: 5</li>
 *   <li>alternativesPerProduct: 3</li>
 *   <li>scoreThreshold: 0.5</li>
 *   <li>searchDiversity: 0.3</li>
 *   <li>minAlternativeSimilarity: 0.6</li>
 *   <li>budgetTolerance: 0.2 (예산의 20% 초과까지 검색 허용)</li>
 *   <li>maxExplanations: 5</li>
 * </ul>
 *
 * @param productsCollection 상품 벡터 컬렉션
 * @param userProfilesCollection 사용자 프로필 컬렉션 (payload의 budget_max 사용)
 * @param searchLimit 검색 결과 최대 개수
 * @param recommendationLimit 추천 결과 최대 개수
 * @param alternativesPerProduct 상품당 대안 최대 개수
 * @param scoreThreshold 검색 최소 유사도 (0.0 ~ 1.0)
 * @param searchDiversity MMR 다양성 (0.0 ~ 1.0)
 * @param minAlternativeSimilarity 대안 최소 유사도 (0.0 ~ 1.0)
 * @param budgetTolerance 검색 시 예산 초과 허용 비율 (0 이상)
 * @param maxExplanations 설명을 생성할 최대 상품 수
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AgentConfig(
    String productsCollection,
    String userProfilesCollection,
    int searchLimit,
    int recommendationLimit,
    int alternativesPerProduct,
    double scoreThreshold,
    double searchDiversity,
    double minAlternativeSimilarity,
    double budgetTolerance,
    int maxExplanations
) {

    /**
     * 기본 설정으로 생성.
     */
    public AgentConfig() {
        this("products", "user_profiles", 10, 5, 3, 0.5, 0.3, 0.6, 0.2, 5);
    }

    /**
     * Compact Constructor (검증 로직).
     */
    public AgentConfig {
        if (productsCollection == null || productsCollection.isBlank()) {
            throw new IllegalArgumentException("productsCollection cannot be null or blank");
        }
        if (userProfilesCollection == null || userProfilesCollection.isBlank()) {
            throw new IllegalArgumentException("userProfilesCollection cannot be null or blank");
        }
        requirePositive("searchLimit", searchLimit);
        requirePositive("recommendationLimit", recommendationLimit);
        requirePositive("alternativesPerProduct", alternativesPerProduct);
        requirePositive("maxExplanations", maxExplanations);
        requireUnit("scoreThreshold", scoreThreshold);
        requireUnit("searchDiversity", searchDiversity);
        requireUnit("minAlternativeSimilarity", minAlternativeSimilarity);
        if (Double.isNaN(budgetTolerance) || budgetTolerance < 0.0) {
            throw new IllegalArgumentException(
                "budgetTolerance cannot be negative (current: " + budgetTolerance + ")"
            );
        }
    }

    /**
     * productsCollection만 변경한 새 인스턴스 생성.
     */
    public AgentConfig withProductsCollection(String productsCollection) {
        return new AgentConfig(productsCollection, userProfilesCollection, searchLimit, recommendationLimit,
            alternativesPerProduct, scoreThreshold, searchDiversity, minAlternativeSimilarity, budgetTolerance, maxExplanations);
    }

    /**
     * userProfilesCollection만 변경한 새 인스턴스 생성.
     */
    public AgentConfig withUserProfilesCollection(String userProfilesCollection) {
        return new AgentConfig(productsCollection, userProfilesCollection, searchLimit, recommendationLimit,
            alternativesPerProduct, scoreThreshold, searchDiversity, minAlternativeSimilarity, budgetTolerance, maxExplanations);
    }

    /**
     * searchLimit만 변경한 새 인스턴스 생성.
     */
    public AgentConfig withSearchLimit(int searchLimit) {
        return new AgentConfig(productsCollection, userProfilesCollection, searchLimit, recommendationLimit,
            alternativesPerProduct, scoreThreshold, searchDiversity, minAlternativeSimilarity, budgetTolerance, maxExplanations);
    }

    /**
     * recommendationLimit만 변경한 새 인스턴스 생성.
     */
    public AgentConfig withRecommendationLimit(int recommendationLimit) {
        return new AgentConfig(productsCollection, userProfilesCollection, searchLimit, recommendationLimit,
            alternativesPerProduct, scoreThreshold, searchDiversity, minAlternativeSimilarity, budgetTolerance, maxExplanations);
    }

    /**
     * alternativesPerProduct만 변경한 새 인스턴스 생성.
     */
    public AgentConfig withAlternativesPerProduct(int alternativesPerProduct) {
        return new AgentConfig(productsCollection, userProfilesCollection, searchLimit, recommendationLimit,
            alternativesPerProduct, scoreThreshold, searchDiversity, minAlternativeSimilarity, budgetTolerance, maxExplanations);
    }

    /**
     * scoreThreshold만 변경한 새 인스턴스 생성.
     */
    public AgentConfig withScoreThreshold(double scoreThreshold) {
        return new AgentConfig(productsCollection, userProfilesCollection, searchLimit, recommendationLimit,
            alternativesPerProduct, scoreThreshold, searchDiversity, minAlternativeSimilarity, budgetTolerance, maxExplanations);
    }

    /**
     * searchDiversity만 변경한 새 인스턴스 생성.
     */
    public AgentConfig withSearchDiversity(double searchDiversity) {
        return new AgentConfig(productsCollection, userProfilesCollection, searchLimit, recommendationLimit,
            alternativesPerProduct, scoreThreshold, searchDiversity, minAlternativeSimilarity, budgetTolerance, maxExplanations);
    }

    /**
     * minAlternativeSimilarity만 변경한 새 인스턴스 생성.
     */
    public AgentConfig withMinAlternativeSimilarity(double minAlternativeSimilarity) {
        return new AgentConfig(productsCollection, userProfilesCollection, searchLimit, recommendationLimit,
            alternativesPerProduct, scoreThreshold, searchDiversity, minAlternativeSimilarity, budgetTolerance, maxExplanations);
    }

    /**
     * budgetTolerance만 변경한 새 인스턴스 생성.
     */
    public AgentConfig withBudgetTolerance(double budgetTolerance) {
        return new AgentConfig(productsCollection, userProfilesCollection, searchLimit, recommendationLimit,
            alternativesPerProduct, scoreThreshold, searchDiversity, minAlternativeSimilarity, budgetTolerance, maxExplanations);
    }

    /**
     * maxExplanations만 변경한 새 인스턴스 생성.
     */
    public AgentConfig withMaxExplanations(int maxExplanations) {
        return new AgentConfig(productsCollection, userProfilesCollection, searchLimit, recommendationLimit,
            alternativesPerProduct, scoreThreshold, searchDiversity, minAlternativeSimilarity, budgetTolerance, maxExplanations);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(
                name + " must be between 0.0 and 1.0 (current: " + value + ")"
            );
        }
    }
}
