package com.ryuqq.finfind.core.workflow;

import java.util.Optional;

/**
 * 워크플로 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkflowType {

    /** 검색만 수행. */
    SEARCH_ONLY("search_only"),

    /** 검색 → 개인화. */
    SEARCH_RECOMMEND("search_recommend"),

    /** 추천 → 설명. */
    RECOMMEND_EXPLAIN("recommend_explain"),

    /** 검색 → 예산 초과 시 대안. */
    SEARCH_ALTERNATIVE("search_alternative"),

    /** 검색 → 개인화 → (설명, 대안) 병렬. */
    FULL_PIPELINE("full_pipeline"),

    /** 런타임에 등록된 사용자 정의 워크플로. */
    CUSTOM("custom");

    private final String id;

    WorkflowType(String id) {
        this.id = id;
    }

    /**
     * 미리 정의된 워크플로의 ID.
     *
     * @return 워크플로 ID
     */
    public String id() {
        return id;
    }

    /**
     * ID로 유형 조회.
     *
     * @param id 워크플로 ID
     * @return 일치하는 유형 (없으면 empty)
     */
    public static Optional<WorkflowType> fromId(String id) {
        for (WorkflowType type : values()) {
            if (type.id.equals(id)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
