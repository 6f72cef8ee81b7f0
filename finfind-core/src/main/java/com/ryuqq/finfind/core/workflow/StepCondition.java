package com.ryuqq.finfind.core.workflow;

import com.ryuqq.finfind.core.capability.ProductHit;

/**
 * 단계 실행 여부를 결정하는 조건.
 *
 * <p>의존 단계가 모두 해결된 뒤 평가되며, false이면 단계는 호출 없이 SKIPPED가 됩니다.
 * 조건 평가 중 예외가 발생하면 러너는 경고를 남기고 단계를 실행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepCondition {

    /**
     * 조건 평가.
     *
     * @param context 누적 상태
     * @return 단계를 실행하면 true
     */
    boolean test(ConditionContext context);

    /**
     * 항상 실행.
     *
     * @return 항상 true인 조건
     */
    static StepCondition always() {
        return context -> true;
    }

    /**
     * 앞선 단계에서 상품을 하나 이상 찾은 경우.
     *
     * @return 조건
     */
    static StepCondition hasProducts() {
        return context -> !context.products().isEmpty();
    }

    /**
     * 예산이 있고 예산을 넘는 상품이 하나라도 있는 경우.
     *
     * <p>가격이 없는 상품은 예산 이내로 간주합니다.</p>
     *
     * @return 조건
     */
    static StepCondition anyProductOverBudget() {
        return context -> {
            Double budget = context.budgetMax();
            if (budget == null) {
                return false;
            }
            return context.products().stream().anyMatch(product -> overBudget(product, budget));
        };
    }

    /**
     * 예산이 있고 상품이 있으며 모든 상품이 예산을 넘는 경우.
     *
     * @return 조건
     */
    static StepCondition allProductsOverBudget() {
        return context -> {
            Double budget = context.budgetMax();
            if (budget == null || context.products().isEmpty()) {
                return false;
            }
            return context.products().stream().allMatch(product -> overBudget(product, budget));
        };
    }

    private static boolean overBudget(ProductHit product, double budget) {
        Double price = product.priceOrNull();
        return price != null && price > budget;
    }
}
