package com.ryuqq.finfind.core.workflow;

import com.ryuqq.finfind.core.protocol.Capability;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 워크플로 정의 (불변 record).
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>단계는 1개 이상, 이름은 고유</li>
 *   <li>dependsOn은 목록에서 앞에 정의된 단계만 참조 (순환 불가)</li>
 *   <li>PRODUCTS_FROM(step) 입력은 dependsOn에 포함된 단계만 참조</li>
 * </ul>
 *
 * @param id 워크플로 ID
 * @param type 워크플로 유형
 * @param name 표시 이름
 * @param description 설명 (null 가능)
 * @param steps 단계 (의존 순서)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowDefinition(
    String id,
    WorkflowType type,
    String name,
    String description,
    List<WorkflowStep> steps
) {

    public WorkflowDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("steps cannot be null or empty");
        }
        steps = List.copyOf(steps);

        Set<String> defined = new HashSet<>();
        for (WorkflowStep step : steps) {
            for (String dependency : step.dependsOn()) {
                if (!defined.contains(dependency)) {
                    throw new IllegalArgumentException(
                        "Step '" + step.name() + "' depends on '" + dependency + "' which is not defined before it"
                    );
                }
            }
            for (InputMapping input : step.inputs()) {
                if (input.source() == InputMapping.Source.PRODUCTS_FROM && !step.dependsOn().contains(input.step())) {
                    throw new IllegalArgumentException(
                        "Step '" + step.name() + "' reads products from '" + input.step() + "' without depending on it"
                    );
                }
            }
            if (!defined.add(step.name())) {
                throw new IllegalArgumentException("Duplicate step name: " + step.name());
            }
        }
    }

    /**
     * 이름으로 단계 조회.
     *
     * @param stepName 단계 이름
     * @return 단계 (없으면 empty)
     */
    public Optional<WorkflowStep> step(String stepName) {
        return steps.stream().filter(step -> step.name().equals(stepName)).findFirst();
    }

    /**
     * 이 워크플로가 참조하는 모든 기능 (대체 기능 포함).
     *
     * @return 기능 집합
     */
    public Set<Capability> capabilities() {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (WorkflowStep step : steps) {
            capabilities.add(step.capability());
            if (step.fallbackCapability() != null) {
                capabilities.add(step.fallbackCapability());
            }
        }
        return capabilities;
    }
}
