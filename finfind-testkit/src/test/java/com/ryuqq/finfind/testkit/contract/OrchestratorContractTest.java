package com.ryuqq.finfind.testkit.contract;

import com.ryuqq.finfind.adapter.runner.DiscoveryOrchestrator;
import com.ryuqq.finfind.application.orchestrator.DiscoveryRequest;
import com.ryuqq.finfind.application.orchestrator.DiscoveryResponse;
import com.ryuqq.finfind.application.orchestrator.RequestContext;
import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.context.Conversation;
import com.ryuqq.finfind.core.context.Turn;
import com.ryuqq.finfind.core.exception.LlmException;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test for end-to-end discovery with the reference agents.
 *
 * <p>The fake LLM is left without a script unless a test says otherwise, so intent
 * classification runs on keyword rules and explanations fall back to factor lists.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Plain search → search_only, products ranked by relevance</li>
 *   <li>Over-budget product → search_alternative, cheaper alternatives</li>
 *   <li>Personal request → search_recommend</li>
 *   <li>"Why" question → recommend_explain with explanations</li>
 *   <li>LLM picks the workflow → full_pipeline</li>
 *   <li>Follow-up in the same conversation → earlier products carried, search_recommend</li>
 *   <li>Invalid request → structured VALIDATION failure, never an exception</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OrchestratorContractTest extends AbstractContractTest {

    @Test
    void testPlainSearch_SearchOnlyRankedByRelevance() {
        // Given
        exposeReferenceAgents();
        DiscoveryOrchestrator orchestrator = newOrchestrator();

        // When
        DiscoveryResponse response = orchestrator.processRequest(DiscoveryRequest.of("show me running shoes", USER_ID));

        // Then
        assertTrue(response.success(), () -> "Unexpected errors: " + response.errors());
        assertFalse(response.partial());
        assertEquals("search_only", response.workflowId());
        assertEquals(List.of("shoe-1", "shoe-2", "shoe-3"), ids(response.products()));
        assertEquals(List.of("intent-agent", "search-agent"), response.agentsUsed());
        assertNotNull(response.executionId());
        assertNoLiveExecutions();
    }

    @Test
    void testOverBudgetProduct_CheaperAlternativesFound() {
        // Given
        exposeReferenceAgents();
        DiscoveryOrchestrator orchestrator = newOrchestrator();
        RequestContext context = RequestContext.empty()
            .withBudgetMax(100.0)
            .withFilters(Map.of("price", Map.of("gte", 200)));

        // When
        DiscoveryResponse response = orchestrator.processRequest(
            new DiscoveryRequest("cheaper alternative to the dome tent", USER_ID, context));

        // Then
        assertTrue(response.success(), () -> "Unexpected errors: " + response.errors());
        assertEquals("search_alternative", response.workflowId());
        assertEquals(List.of("tent-1"), ids(response.products()));
        assertEquals(List.of("tent-2", "stove-1"), ids(response.alternatives()));
        assertEquals("Lower-priced alternative to Dome Tent", response.explanations().get("tent-2"));
        assertTrue(response.agentsUsed().contains("alternative-agent"));
    }

    @Test
    void testFollowUpRequest_SameConversationCarriesEarlierTurn() {
        // Given
        exposeReferenceAgents();
        DiscoveryOrchestrator orchestrator = newOrchestrator();
        DiscoveryResponse first = orchestrator.processRequest(DiscoveryRequest.of("show me running shoes", USER_ID));
        RequestContext followUp = RequestContext.empty().withConversationId(first.conversationId());

        // When
        DiscoveryResponse second = orchestrator.processRequest(
            new DiscoveryRequest("and a tent", USER_ID, followUp));

        // Then
        assertNotNull(first.conversationId());
        assertEquals(first.conversationId(), second.conversationId());
        assertTrue(second.success(), () -> "Unexpected errors: " + second.errors());
        assertEquals("search_recommend", second.workflowId(), "Earlier products make an unmarked query a follow-up");

        Conversation conversation = conversationStore.find(first.conversationId()).orElseThrow();
        assertEquals(List.of("show me running shoes", "and a tent"),
            conversation.turns().stream().map(Turn::query).toList());
        Turn earlier = conversation.turns().get(0);
        assertEquals("search_only", earlier.intent());
        assertEquals(List.of("shoe-1", "shoe-2", "shoe-3"), earlier.productIds());
    }

    @Test
    void testPersonalRequest_SearchThenRecommend() {
        // Given
        exposeReferenceAgents();
        DiscoveryOrchestrator orchestrator = newOrchestrator();

        // When
        DiscoveryResponse response = orchestrator.processRequest(
            DiscoveryRequest.of("recommend running shoes for me", USER_ID));

        // Then
        assertTrue(response.success(), () -> "Unexpected errors: " + response.errors());
        assertEquals("search_recommend", response.workflowId());
        assertEquals(List.of("intent-agent", "search-agent", "recommendation-agent"), response.agentsUsed());
        assertTrue(ids(response.products()).containsAll(List.of("shoe-1", "shoe-2", "shoe-3")));
        assertEquals(ids(response.products()).size(), Set.copyOf(ids(response.products())).size(),
            "Products must be deduplicated by id");
    }

    @Test
    void testWhyQuestion_RecommendationsExplained() {
        // Given
        exposeReferenceAgents();
        DiscoveryOrchestrator orchestrator = newOrchestrator();

        // When
        DiscoveryResponse response = orchestrator.processRequest(DiscoveryRequest.of("why is this tent good", USER_ID));

        // Then
        assertTrue(response.success(), () -> "Unexpected errors: " + response.errors());
        assertEquals("recommend_explain", response.workflowId());
        assertTrue(response.agentsUsed().contains("explainability-agent"));
        assertFalse(response.products().isEmpty());
        for (ProductHit product : response.products()) {
            String explanation = response.explanations().get(product.id());
            assertNotNull(explanation, "Missing explanation for " + product.id());
            assertTrue(explanation.startsWith("Matches your request"), explanation);
        }
    }

    @Test
    void testLlmSelectsWorkflow_FullPipelineRuns() {
        // Given
        llm.thenCallTool("select_workflow", Map.of("workflow_id", "full_pipeline", "confidence", 0.9))
            .thenReply("Roomy and weatherproof.");
        exposeReferenceAgents();
        DiscoveryOrchestrator orchestrator = newOrchestrator();

        // When
        DiscoveryResponse response = orchestrator.processRequest(DiscoveryRequest.of("a tent for camping", USER_ID));

        // Then
        assertTrue(response.success(), () -> "Unexpected errors: " + response.errors());
        assertEquals("full_pipeline", response.workflowId());
        assertTrue(response.agentsUsed().containsAll(
            List.of("intent-agent", "search-agent", "recommendation-agent", "explainability-agent")));
        assertTrue(response.explanations().containsValue("Roomy and weatherproof."));
        assertTrue(llm.prompts().get(0).contains("full_pipeline"), "Classifier prompt lists the workflows");
    }

    @Test
    void testLlmRateLimited_KeywordClassificationUsed() {
        // Given
        llm.thenFail(LlmException.Reason.RATE_LIMITED);
        exposeReferenceAgents();
        DiscoveryOrchestrator orchestrator = newOrchestrator();

        // When
        DiscoveryResponse response = orchestrator.processRequest(DiscoveryRequest.of("find a sun hat", USER_ID));

        // Then
        assertTrue(response.success());
        assertEquals("search_only", response.workflowId());
        assertEquals("hat-1", response.products().get(0).id());
    }

    @Test
    void testInvalidRequest_StructuredValidationFailure() {
        // Given
        exposeReferenceAgents();
        DiscoveryOrchestrator orchestrator = newOrchestrator();

        // When
        DiscoveryResponse blank = orchestrator.processRequest(DiscoveryRequest.of("   ", USER_ID));
        DiscoveryResponse missing = orchestrator.processRequest(null);

        // Then
        for (DiscoveryResponse response : List.of(blank, missing)) {
            assertFalse(response.success());
            assertFalse(response.partial());
            assertNull(response.workflowId());
            assertEquals(ErrorKind.VALIDATION, response.errors().get(0).kind());
            assertTrue(response.products().isEmpty());
        }
        assertNoLiveExecutions();
    }

    private static List<String> ids(List<ProductHit> products) {
        return products.stream().map(ProductHit::id).toList();
    }
}
