package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.outcome.Ok;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.retrieval.RetrievalEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.ryuqq.finfind.adapter.agent.CatalogFixture.catalog;
import static com.ryuqq.finfind.adapter.agent.CatalogFixture.embeddings;
import static com.ryuqq.finfind.adapter.agent.CatalogFixture.hit;
import static com.ryuqq.finfind.adapter.agent.CatalogFixture.request;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * AlternativeAgent 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AlternativeAgentTest {

    private final AlternativeAgent agent = new AlternativeAgent(new RetrievalEngine(catalog()), embeddings(),
        new AgentConfig());

    @Test
    void findAlternatives_OverBudgetProduct_ReturnsSimilarProductsWithinBudget() {
        // given
        StepRequest request = withProducts(100.0, hit("shoe-1", 0.9, 120, 4.5));

        // when
        StepOutput output = valueOf(agent.findAlternatives(request));

        // then
        assertThat(output.alternatives()).extracting(ProductHit::id).containsExactly("shoe-2", "shoe-3");
        assertThat(output.explanations()).containsEntry("shoe-2", "Lower-priced alternative to SHOE-1");
        assertThat(output.products()).isEmpty();
    }

    @Test
    void findAlternatives_ProductWithinBudget_NoAlternatives() {
        // given
        StepRequest request = withProducts(100.0, hit("shoe-2", 0.9, 90, 4.0));

        // when
        StepOutput output = valueOf(agent.findAlternatives(request));

        // then
        assertThat(output.alternatives()).isEmpty();
    }

    @Test
    void findAlternatives_NoBudget_ReturnsCheaperThanProduct() {
        // given
        StepRequest request = withProducts(null, hit("shoe-2", 0.9, 90, 4.0));

        // when
        StepOutput output = valueOf(agent.findAlternatives(request));

        // then
        assertThat(output.alternatives()).extracting(ProductHit::id).containsExactly("shoe-3");
    }

    @Test
    void findAlternatives_NoProductsWithBudget_SearchesQueryUnderBudget() {
        // when
        StepOutput output = valueOf(agent.findAlternatives(request(Capability.ALTERNATIVE, "running shoes", 70.0)));

        // then
        assertThat(output.alternatives()).extracting(ProductHit::id).containsExactly("shoe-3");
    }

    @Test
    void findAlternatives_NoProductsNoBudget_ReturnsEmptyOutput() {
        // when
        StepOutput output = valueOf(agent.findAlternatives(request(Capability.ALTERNATIVE, "running shoes", null)));

        // then
        assertThat(output.alternatives()).isEmpty();
        assertThat(output.summary()).isNotBlank();
    }

    private static StepRequest withProducts(Double budget, ProductHit... products) {
        return new StepRequest(Capability.ALTERNATIVE, "running shoes", "user-1", budget, Map.of(),
            List.of(products), null);
    }

    private static StepOutput valueOf(Result<StepOutput> result) {
        assertThat(result).isInstanceOf(Ok.class);
        return ((Ok<StepOutput>) result).value();
    }
}
