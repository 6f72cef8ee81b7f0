package com.ryuqq.finfind.core.workflow;

import com.ryuqq.finfind.core.protocol.Capability;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 워크플로 단계 정의 (불변 record).
 *
 * <p>단계는 에이전트 이름이 아닌 {@link Capability}로 대상을 지정합니다.</p>
 *
 * @param name 단계 이름 (워크플로 내 고유)
 * @param capability 호출할 기능
 * @param inputs 입력 매핑 (1개 이상)
 * @param retryPolicy 재시도 정책
 * @param dependsOn 먼저 해결되어야 하는 단계 이름
 * @param required 필수 단계 여부 (실패 시 의존 단계를 건너뛰고 결과 상태에 반영)
 * @param condition 실행 조건
 * @param fallbackCapability 주 기능이 모두 실패했을 때 한 번 시도할 기능 (null 가능)
 * @param timeout 시도당 응답 대기 시간 (null이면 러너 기본값)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowStep(
    String name,
    Capability capability,
    List<InputMapping> inputs,
    RetryPolicy retryPolicy,
    Set<String> dependsOn,
    boolean required,
    StepCondition condition,
    Capability fallbackCapability,
    Duration timeout
) {

    public WorkflowStep {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("inputs cannot be null or empty");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (fallbackCapability == capability) {
            throw new IllegalArgumentException("fallbackCapability must differ from capability: " + capability);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        inputs = List.copyOf(inputs);
        dependsOn = dependsOn == null ? Set.of() : Set.copyOf(dependsOn);
        if (dependsOn.contains(name)) {
            throw new IllegalArgumentException("step cannot depend on itself: " + name);
        }
        condition = condition == null ? StepCondition.always() : condition;
    }

    /**
     * 빌더 생성.
     *
     * @param name 단계 이름
     * @param capability 호출할 기능
     * @return Builder
     */
    public static Builder builder(String name, Capability capability) {
        return new Builder(name, capability);
    }

    /**
     * WorkflowStep 빌더.
     *
     * <p>기본값: inputs=[QUERY], retryPolicy=defaults(), required=true, 조건 없음, 대체 기능 없음.</p>
     */
    public static final class Builder {

        private final String name;
        private final Capability capability;
        private List<InputMapping> inputs = List.of(InputMapping.query());
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private final Set<String> dependsOn = new LinkedHashSet<>();
        private boolean required = true;
        private StepCondition condition;
        private Capability fallbackCapability;
        private Duration timeout;

        private Builder(String name, Capability capability) {
            this.name = name;
            this.capability = capability;
        }

        public Builder inputs(InputMapping... inputs) {
            this.inputs = List.of(inputs);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder dependsOn(String... steps) {
            this.dependsOn.addAll(List.of(steps));
            return this;
        }

        public Builder optional() {
            this.required = false;
            return this;
        }

        public Builder when(StepCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder fallback(Capability fallbackCapability) {
            this.fallbackCapability = fallbackCapability;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(name, capability, inputs, retryPolicy, dependsOn, required,
                condition, fallbackCapability, timeout);
        }
    }
}
