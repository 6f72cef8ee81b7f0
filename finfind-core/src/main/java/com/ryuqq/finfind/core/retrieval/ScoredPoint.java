package com.ryuqq.finfind.core.retrieval;

/**
 * 질의 벡터와의 유사도가 매겨진 점.
 *
 * @param point 점
 * @param similarity 원시 코사인 유사도 (-1 ~ 1)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ScoredPoint(Point point, double similarity) {

    public ScoredPoint {
        if (point == null) {
            throw new IllegalArgumentException("point cannot be null");
        }
    }

    public String id() {
        return point.id();
    }
}
