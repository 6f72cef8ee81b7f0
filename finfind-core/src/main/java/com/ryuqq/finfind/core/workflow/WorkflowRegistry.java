package com.ryuqq.finfind.core.workflow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 등록된 워크플로 정의 저장소.
 *
 * <p>정의는 불변이며 등록 후 교체할 수 없습니다. 같은 ID로 다시 등록하면 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowRegistry {

    private final Map<String, WorkflowDefinition> definitions = new LinkedHashMap<>();

    /**
     * 미리 정의된 워크플로가 등록된 레지스트리 생성.
     *
     * @return WorkflowRegistry 인스턴스
     */
    public static WorkflowRegistry withPredefined() {
        WorkflowRegistry registry = new WorkflowRegistry();
        PredefinedWorkflows.all().forEach(registry::register);
        return registry;
    }

    /**
     * 워크플로 등록.
     *
     * @param definition 워크플로 정의
     * @throws IllegalArgumentException definition이 null이거나 같은 ID가 이미 등록된 경우
     */
    public synchronized void register(WorkflowDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (definitions.containsKey(definition.id())) {
            throw new IllegalArgumentException("Workflow already registered: " + definition.id());
        }
        definitions.put(definition.id(), definition);
    }

    /**
     * ID로 조회.
     *
     * @param id 워크플로 ID
     * @return 정의 (없으면 empty)
     */
    public synchronized Optional<WorkflowDefinition> find(String id) {
        return Optional.ofNullable(definitions.get(id));
    }

    /**
     * 등록된 모든 정의 (등록 순서).
     *
     * @return 정의 목록 스냅샷
     */
    public synchronized List<WorkflowDefinition> all() {
        return List.copyOf(definitions.values());
    }
}
