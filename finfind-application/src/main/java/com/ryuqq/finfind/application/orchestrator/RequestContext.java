package com.ryuqq.finfind.application.orchestrator;

import com.ryuqq.finfind.core.context.Turn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 요청과 함께 전달되는 대화 상태와 검색 조건.
 *
 * @param conversationId 대화 ID (null 가능)
 * @param history 이전 턴 (오래된 것부터)
 * @param priorProductIds 이전 턴에서 본 상품 ID
 * @param budgetMax 예산 상한 (null 가능)
 * @param categories 관심 카테고리
 * @param filters 검색 필터 (필드 → 조건)
 * @param workflowId 분류 없이 사용할 워크플로 ID (null이면 분류)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RequestContext(
    String conversationId,
    List<Turn> history,
    List<String> priorProductIds,
    Double budgetMax,
    List<String> categories,
    Map<String, Object> filters,
    String workflowId
) {

    public RequestContext {
        history = history == null ? List.of() : List.copyOf(history);
        priorProductIds = priorProductIds == null ? List.of() : List.copyOf(priorProductIds);
        categories = categories == null ? List.of() : List.copyOf(categories);
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        if (budgetMax != null && budgetMax <= 0) {
            throw new IllegalArgumentException("budgetMax must be positive (current: " + budgetMax + ")");
        }
    }

    /**
     * 빈 컨텍스트.
     *
     * @return 이전 대화와 조건이 없는 컨텍스트
     */
    public static RequestContext empty() {
        return new RequestContext(null, List.of(), List.of(), null, List.of(), Map.of(), null);
    }

    public RequestContext withConversationId(String conversationId) {
        return new RequestContext(conversationId, history, priorProductIds, budgetMax, categories, filters, workflowId);
    }

    public RequestContext withHistory(List<Turn> history) {
        return new RequestContext(conversationId, history, priorProductIds, budgetMax, categories, filters, workflowId);
    }

    public RequestContext withPriorProductIds(List<String> priorProductIds) {
        return new RequestContext(conversationId, history, priorProductIds, budgetMax, categories, filters, workflowId);
    }

    public RequestContext withBudgetMax(Double budgetMax) {
        return new RequestContext(conversationId, history, priorProductIds, budgetMax, categories, filters, workflowId);
    }

    public RequestContext withCategories(List<String> categories) {
        return new RequestContext(conversationId, history, priorProductIds, budgetMax, categories, filters, workflowId);
    }

    public RequestContext withFilters(Map<String, Object> filters) {
        return new RequestContext(conversationId, history, priorProductIds, budgetMax, categories, filters, workflowId);
    }

    public RequestContext withWorkflowId(String workflowId) {
        return new RequestContext(conversationId, history, priorProductIds, budgetMax, categories, filters, workflowId);
    }
}
