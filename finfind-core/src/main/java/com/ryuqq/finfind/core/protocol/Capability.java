package com.ryuqq.finfind.core.protocol;

/**
 * 에이전트가 제공할 수 있는 기능.
 *
 * <p>워크플로 단계는 에이전트 이름이 아닌 Capability로 대상을 지정하며,
 * 실제 에이전트는 {@link A2AProtocol#discover(Capability)}로 결정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Capability {

    /** 요청 의도 분류 → 워크플로 선택. */
    CLASSIFY,

    /** 자연어 상품 검색. */
    SEARCH,

    /** 사용자 맞춤 추천. */
    RECOMMEND,

    /** 예산 내 대안 상품 탐색. */
    ALTERNATIVE,

    /** 추천 이유 설명. */
    EXPLAIN
}
