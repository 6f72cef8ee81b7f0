package com.ryuqq.finfind.core.retrieval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 컴파일된 페이로드 필터.
 *
 * <p>모든 조건을 AND로 결합하며, 제외 ID 목록에 있는 점은 항상 걸러냅니다.
 * 조건이 없으면 모든 점을 통과시킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PayloadFilter {

    private static final PayloadFilter EMPTY = new PayloadFilter(List.of(), Set.of());

    private final List<FieldCondition> conditions;
    private final Set<String> excludedIds;

    private PayloadFilter(List<FieldCondition> conditions, Set<String> excludedIds) {
        this.conditions = List.copyOf(conditions);
        this.excludedIds = Set.copyOf(excludedIds);
    }

    /**
     * 조건 없는 필터.
     *
     * @return 모든 점을 통과시키는 필터
     */
    public static PayloadFilter empty() {
        return EMPTY;
    }

    /**
     * 조건 목록으로 필터 생성.
     *
     * @param conditions AND로 결합할 조건
     * @return PayloadFilter 인스턴스
     */
    public static PayloadFilter of(List<FieldCondition> conditions) {
        if (conditions == null) {
            throw new IllegalArgumentException("conditions cannot be null");
        }
        return new PayloadFilter(conditions, Set.of());
    }

    /**
     * 제외 ID를 추가한 새 필터.
     *
     * @param ids 결과에서 제외할 점 ID
     * @return 새 PayloadFilter
     */
    public PayloadFilter excludingIds(Collection<String> ids) {
        Set<String> merged = new LinkedHashSet<>(excludedIds);
        merged.addAll(ids);
        return new PayloadFilter(conditions, merged);
    }

    /**
     * 조건을 추가한 새 필터.
     *
     * @param condition 추가할 조건
     * @return 새 PayloadFilter
     */
    public PayloadFilter and(FieldCondition condition) {
        List<FieldCondition> merged = new ArrayList<>(conditions);
        merged.add(condition);
        return new PayloadFilter(merged, excludedIds);
    }

    /**
     * 점이 필터를 통과하는지 확인.
     *
     * @param id 점 ID
     * @param payload 점 페이로드
     * @return 모든 조건을 만족하고 제외 대상이 아니면 true
     */
    public boolean test(String id, Map<String, Object> payload) {
        if (excludedIds.contains(id)) {
            return false;
        }
        for (FieldCondition condition : conditions) {
            if (!condition.test(payload)) {
                return false;
            }
        }
        return true;
    }

    public List<FieldCondition> conditions() {
        return conditions;
    }

    public Set<String> excludedIds() {
        return excludedIds;
    }

    public boolean isEmpty() {
        return conditions.isEmpty() && excludedIds.isEmpty();
    }

    @Override
    public String toString() {
        return "PayloadFilter{conditions=" + conditions + ", excludedIds=" + excludedIds + '}';
    }
}
