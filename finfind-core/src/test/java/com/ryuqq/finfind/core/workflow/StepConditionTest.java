package com.ryuqq.finfind.core.workflow;

import com.ryuqq.finfind.core.capability.ProductHit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StepConditionTest {

    private static ProductHit product(String id, Double price) {
        return new ProductHit(id, 0.9, price == null ? Map.of() : Map.of("price", price));
    }

    private static ConditionContext context(Double budget, ProductHit... products) {
        return new ConditionContext("q", budget, List.of(products), Map.of());
    }

    @Test
    void hasProducts() {
        assertThat(StepCondition.hasProducts().test(context(null))).isFalse();
        assertThat(StepCondition.hasProducts().test(context(null, product("p1", 10.0)))).isTrue();
    }

    @Test
    void anyProductOverBudget_RequiresBudget() {
        ConditionContext noBudget = context(null, product("p1", 500.0));
        ConditionContext mixed = context(100.0, product("p1", 50.0), product("p2", 500.0));

        assertThat(StepCondition.anyProductOverBudget().test(noBudget)).isFalse();
        assertThat(StepCondition.anyProductOverBudget().test(mixed)).isTrue();
        assertThat(StepCondition.allProductsOverBudget().test(mixed)).isFalse();
    }

    @Test
    void allProductsOverBudget_MissingPriceCountsAsWithinBudget() {
        ConditionContext allOver = context(100.0, product("p1", 150.0), product("p2", 500.0));
        ConditionContext unknownPrice = context(100.0, product("p1", 150.0), product("p2", null));

        assertThat(StepCondition.allProductsOverBudget().test(allOver)).isTrue();
        assertThat(StepCondition.allProductsOverBudget().test(unknownPrice)).isFalse();
        assertThat(StepCondition.allProductsOverBudget().test(context(100.0))).isFalse();
    }
}
