package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.exception.LlmException;
import com.ryuqq.finfind.core.outcome.Ok;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.spi.LlmClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.ryuqq.finfind.adapter.agent.CatalogFixture.hit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

/**
 * ExplainabilityAgent 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ExplainabilityAgentTest {

    @Mock
    private LlmClient llm;

    @Test
    void explain_WithoutLlm_JoinsFactors() {
        // given
        ExplainabilityAgent agent = new ExplainabilityAgent(new AgentConfig());

        // when
        StepOutput output = valueOf(agent.explain(request(100.0, hit("shoe-2", 0.9, 90, 4.0))));

        // then
        assertThat(output.explanations()).containsEntry("shoe-2",
            "Matches your request with 90% relevance; Fits your budget ($90.00 of $100.00); Rated 4.0/5");
        assertThat(output.products()).isEmpty();
    }

    @Test
    void explain_OverBudget_MentionsExcess() {
        // when
        List<String> factors = ExplainabilityAgent.factorsOf(hit("shoe-1", 0.5, 120, 4.5), 100.0);

        // then
        assertThat(factors).contains("Exceeds your budget by $20.00");
    }

    @Test
    void explain_LlmAnswersText_UsesModelSentence() {
        // given
        when(llm.complete(contains("SHOE-2"), anyList()))
            .thenReturn(new LlmClient.Completion.Text("  Light, cheap and well rated.  "));
        ExplainabilityAgent agent = new ExplainabilityAgent(llm, new AgentConfig());

        // when
        StepOutput output = valueOf(agent.explain(request(100.0, hit("shoe-2", 0.9, 90, 4.0))));

        // then
        assertThat(output.explanations()).containsEntry("shoe-2", "Light, cheap and well rated.");
    }

    @Test
    void explain_LlmFails_FallsBackToFactors() {
        // given
        when(llm.complete(anyString(), anyList()))
            .thenThrow(new LlmException(LlmException.Reason.RATE_LIMITED, "429"));
        ExplainabilityAgent agent = new ExplainabilityAgent(llm, new AgentConfig());

        // when
        StepOutput output = valueOf(agent.explain(request(null, hit("shoe-2", 0.9, 90, 4.0))));

        // then
        assertThat(output.explanations().get("shoe-2")).startsWith("Matches your request with 90% relevance");
        assertThat(output.explanations().get("shoe-2")).contains("Priced at $90.00");
    }

    @Test
    void explain_MoreProductsThanLimit_ExplainsFirstOnly() {
        // given
        ExplainabilityAgent agent = new ExplainabilityAgent(new AgentConfig().withMaxExplanations(1));

        // when
        StepOutput output = valueOf(agent.explain(request(null,
            hit("shoe-1", 0.9, 120, 4.5), hit("shoe-2", 0.8, 90, 4.0))));

        // then
        assertThat(output.explanations()).containsOnlyKeys("shoe-1");
        assertThat(output.summary()).isEqualTo("Explained 1 of 2 products");
    }

    private static StepRequest request(Double budget, ProductHit... products) {
        return new StepRequest(Capability.EXPLAIN, "running shoes", "user-1", budget, Map.of(),
            List.of(products), null);
    }

    private static StepOutput valueOf(Result<StepOutput> result) {
        assertThat(result).isInstanceOf(Ok.class);
        return ((Ok<StepOutput>) result).value();
    }
}
