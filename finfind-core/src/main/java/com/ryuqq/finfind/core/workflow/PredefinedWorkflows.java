package com.ryuqq.finfind.core.workflow;

import com.ryuqq.finfind.core.protocol.Capability;

import java.util.List;

/**
 * 미리 정의된 워크플로.
 *
 * <ul>
 *   <li>search_only: search</li>
 *   <li>search_recommend: search → recommend(상품이 있을 때)</li>
 *   <li>recommend_explain: recommend → explain(상품이 있을 때)</li>
 *   <li>search_alternative: search → alternatives(모든 상품이 예산 초과일 때)</li>
 *   <li>full_pipeline: search → recommend → (explain ∥ alternatives)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PredefinedWorkflows {

    public static final WorkflowDefinition SEARCH_ONLY = new WorkflowDefinition(
        WorkflowType.SEARCH_ONLY.id(),
        WorkflowType.SEARCH_ONLY,
        "Product Search",
        "Search for products matching the request",
        List.of(search())
    );

    public static final WorkflowDefinition SEARCH_RECOMMEND = new WorkflowDefinition(
        WorkflowType.SEARCH_RECOMMEND.id(),
        WorkflowType.SEARCH_RECOMMEND,
        "Search and Personalize",
        "Search for products then personalize results based on user profile",
        List.of(search(), personalize())
    );

    public static final WorkflowDefinition RECOMMEND_EXPLAIN = new WorkflowDefinition(
        WorkflowType.RECOMMEND_EXPLAIN.id(),
        WorkflowType.RECOMMEND_EXPLAIN,
        "Recommend with Explanation",
        "Get recommendations and explain why they were chosen",
        List.of(
            WorkflowStep.builder("recommend", Capability.RECOMMEND)
                .inputs(InputMapping.query(), InputMapping.user())
                .fallback(Capability.SEARCH)
                .build(),
            WorkflowStep.builder("explain", Capability.EXPLAIN)
                .inputs(InputMapping.query(), InputMapping.user(), InputMapping.productsFrom("recommend"))
                .dependsOn("recommend")
                .when(StepCondition.hasProducts())
                .optional()
                .build()
        )
    );

    public static final WorkflowDefinition SEARCH_ALTERNATIVE = new WorkflowDefinition(
        WorkflowType.SEARCH_ALTERNATIVE.id(),
        WorkflowType.SEARCH_ALTERNATIVE,
        "Search with Budget Fallback",
        "Search for products, find alternatives if over budget",
        List.of(
            search(),
            WorkflowStep.builder("alternatives", Capability.ALTERNATIVE)
                .inputs(InputMapping.query(), InputMapping.productsFrom("search"))
                .dependsOn("search")
                .when(StepCondition.allProductsOverBudget())
                .optional()
                .build()
        )
    );

    public static final WorkflowDefinition FULL_PIPELINE = new WorkflowDefinition(
        WorkflowType.FULL_PIPELINE.id(),
        WorkflowType.FULL_PIPELINE,
        "Full Product Discovery Pipeline",
        "Search, personalize, then explain and find alternatives in parallel",
        List.of(
            search(),
            personalize(),
            WorkflowStep.builder("explain", Capability.EXPLAIN)
                .inputs(InputMapping.query(), InputMapping.user(), InputMapping.allProducts())
                .dependsOn("recommend")
                .when(StepCondition.hasProducts())
                .optional()
                .build(),
            WorkflowStep.builder("alternatives", Capability.ALTERNATIVE)
                .inputs(InputMapping.query(), InputMapping.allProducts())
                .dependsOn("recommend")
                .when(StepCondition.anyProductOverBudget())
                .optional()
                .build()
        )
    );

    private PredefinedWorkflows() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 모든 미리 정의된 워크플로.
     *
     * @return 워크플로 목록
     */
    public static List<WorkflowDefinition> all() {
        return List.of(SEARCH_ONLY, SEARCH_RECOMMEND, RECOMMEND_EXPLAIN, SEARCH_ALTERNATIVE, FULL_PIPELINE);
    }

    private static WorkflowStep search() {
        return WorkflowStep.builder("search", Capability.SEARCH)
            .inputs(InputMapping.query())
            .build();
    }

    private static WorkflowStep personalize() {
        return WorkflowStep.builder("recommend", Capability.RECOMMEND)
            .inputs(InputMapping.query(), InputMapping.user(), InputMapping.productsFrom("search"))
            .dependsOn("search")
            .when(StepCondition.hasProducts())
            .optional()
            .build();
    }
}
