package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.core.capability.Classification;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.context.CompressedContext;
import com.ryuqq.finfind.core.exception.LlmException;
import com.ryuqq.finfind.core.outcome.Ok;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.spi.LlmClient;
import com.ryuqq.finfind.core.workflow.WorkflowRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * IntentAgent 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class IntentAgentTest {

    @Mock
    private LlmClient llm;

    @Test
    void classify_LlmSelectsRegisteredWorkflow_ReturnsIt() {
        // given
        when(llm.complete(anyString(), anyList())).thenReturn(new LlmClient.Completion.ToolCall(
            IntentAgent.TOOL_NAME, Map.of("workflow_id", "full_pipeline", "confidence", 0.9, "reason", "broad request")));

        // when
        Classification classification = valueOf(agent().classify(request("show me everything about tents", null)));

        // then
        assertThat(classification.workflowId()).isEqualTo("full_pipeline");
        assertThat(classification.confidence()).isEqualTo(0.9);
        assertThat(classification.reason()).isEqualTo("broad request");
    }

    @Test
    void classify_LlmSelectsUnknownWorkflow_FallsBackToKeywords() {
        // given
        when(llm.complete(anyString(), anyList())).thenReturn(new LlmClient.Completion.ToolCall(
            IntentAgent.TOOL_NAME, Map.of("workflow_id", "teleport")));

        // when
        Classification classification = valueOf(agent().classify(request("something cheaper please", null)));

        // then
        assertThat(classification.workflowId()).isEqualTo("search_alternative");
    }

    @Test
    void classify_LlmFails_FallsBackToKeywords() {
        // given
        when(llm.complete(anyString(), anyList()))
            .thenThrow(new LlmException(LlmException.Reason.TIMEOUT, "slow"));

        // when
        Classification classification = valueOf(agent().classify(request("can you recommend a tent", null)));

        // then
        assertThat(classification.workflowId()).isEqualTo("search_recommend");
        assertThat(classification.confidence()).isEqualTo(IntentAgent.KEYWORD_CONFIDENCE);
    }

    @Test
    void classify_LlmAnswersText_NoKeywordButPriorProducts_PicksSearchRecommend() {
        // given
        when(llm.complete(anyString(), anyList())).thenReturn(new LlmClient.Completion.Text("hmm"));
        CompressedContext context = CompressedContext.of("user-1", "conv-1", "tents")
            .withProductIds(List.of("tent-1"));

        // when
        Classification classification = valueOf(agent().classify(request("tents", context)));

        // then
        assertThat(classification.workflowId()).isEqualTo("search_recommend");
        assertThat(classification.confidence()).isEqualTo(IntentAgent.DEFAULT_CONFIDENCE);
    }

    @ParameterizedTest
    @CsvSource({
        "can you recommend a laptop, search_recommend",
        "why is this one better, recommend_explain",
        "something cheaper please, search_alternative",
        "show me tents, search_only",
        "tents, search_only"
    })
    void classifyByKeywords_FirstMatchingGroupWins(String text, String expected) {
        // when
        Classification classification = IntentAgent.classifyByKeywords(text, false);

        // then
        assertThat(classification.workflowId()).isEqualTo(expected);
    }

    private IntentAgent agent() {
        return new IntentAgent(llm, WorkflowRegistry.withPredefined());
    }

    private static StepRequest request(String text, CompressedContext context) {
        return new StepRequest(Capability.CLASSIFY, text, "user-1", null, Map.of(), List.of(), context);
    }

    private static Classification valueOf(Result<Classification> result) {
        assertThat(result).isInstanceOf(Ok.class);
        return ((Ok<Classification>) result).value();
    }
}
