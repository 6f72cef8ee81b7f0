package com.ryuqq.finfind.testkit.contract;

import com.ryuqq.finfind.adapter.inmemory.bus.BusConfig;
import com.ryuqq.finfind.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.finfind.application.runtime.CapabilityEndpoints;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.context.CompressedContext;
import com.ryuqq.finfind.core.context.Turn;
import com.ryuqq.finfind.core.model.CorrelationId;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Fail;
import com.ryuqq.finfind.core.outcome.Ok;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.protocol.Message;
import com.ryuqq.finfind.core.protocol.MessageType;
import com.ryuqq.finfind.core.protocol.Priority;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test for agent messaging.
 *
 * <p>This test validates the guarantees the workflow layer relies on when it talks to agents
 * through the protocol and the bus.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Many concurrent requests → every caller receives the response to its own request</li>
 *   <li>Deadline passes → typed UPSTREAM_TIMEOUT, late response dropped</li>
 *   <li>Oversized conversation → agent receives a context within the byte budget</li>
 *   <li>Workflow lifecycle events → delivered to every subscriber</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MessagingContractTest extends AbstractContractTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    void testConcurrentRequests_EachCallerReceivesOwnResponse() {
        // Given
        ScriptedAgent echo = new ScriptedAgent("echo", Capability.SEARCH)
            .answer(Capability.SEARCH, request -> Result.ok(StepOutput.ofProducts(List.of(), request.query())));
        expose(echo);

        // When
        List<CompletableFuture<Result<Map<String, Object>>>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            StepRequest request = stepRequest(Capability.SEARCH, "query-" + i, null);
            futures.add(bus.request("agent.echo", "contract", CapabilityEndpoints.encode(request),
                Priority.NORMAL, TIMEOUT, null));
        }

        // Then
        for (int i = 0; i < futures.size(); i++) {
            Result<Map<String, Object>> result = futures.get(i).join();
            assertTrue(result.isOk(), "Request " + i + " should succeed");
            Map<String, Object> payload = ((Ok<Map<String, Object>>) result).value();
            assertEquals("query-" + i, payload.get("summary"), "Response must belong to request " + i);
        }
        assertEquals(50, echo.calls(Capability.SEARCH));
        assertEquals(0, protocol.pendingCount(), "No slot may be left pending");
    }

    @Test
    void testDeadlinePassed_TimeoutIsTypedAndLateResponseDropped() {
        // Given
        Message request = Message.request("agent.silent", "contract", Map.of(), Priority.NORMAL,
            Duration.ofMillis(50), null);

        // When
        Result<Map<String, Object>> result = protocol.sendRequest(request).orTimeout(5, TimeUnit.SECONDS).join();
        boolean accepted = protocol.respond(Message.response(request, "agent.silent", Result.ok(Map.of())));

        // Then
        assertTrue(result.isFail(), "Expired request must complete with a failure");
        assertEquals(ErrorKind.UPSTREAM_TIMEOUT, ((Fail<Map<String, Object>>) result).kind());
        assertFalse(accepted, "Late response must be dropped");
        assertFalse(protocol.isPending(request.correlationId()));
    }

    @Test
    void testOversizedConversation_AgentReceivesBudgetedContext() {
        // Given
        InMemoryMessageBus tight = new InMemoryMessageBus(protocol, new BusConfig().withContextByteBudget(512));
        ScriptedAgent reader = new ScriptedAgent("reader", Capability.SEARCH)
            .returning(Capability.SEARCH, StepOutput.empty());
        List<Turn> turns = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            turns.add(Turn.of("earlier question " + i + " about lightweight camping tents", "search_only",
                List.of("tent-" + i, "stove-" + i)));
        }
        CompressedContext context = CompressedContext.of(USER_ID, "conv-1", "dome tent under 100")
            .withBudgetMax(100.0)
            .withTurns(turns);

        try {
            CapabilityEndpoints.expose(reader, tight, protocol);

            // When
            Result<Map<String, Object>> result = tight.request("agent.reader", "contract",
                CapabilityEndpoints.encode(stepRequest(Capability.SEARCH, "dome tent under 100", null)),
                Priority.NORMAL, TIMEOUT, context).join();

            // Then
            assertTrue(result.isOk());
            CompressedContext received = reader.received().get(0).context();
            assertNotNull(received, "Agent must receive the attached context");
            assertTrue(received.sizeInBytes() <= 512,
                "Context must fit the budget but was " + received.sizeInBytes() + " bytes");
            assertEquals(USER_ID, received.userId());
            assertEquals(Double.valueOf(100.0), received.budgetMax());
            assertTrue(received.droppedTurns() > 0, "Oldest turns must be dropped first");
        } finally {
            tight.close();
        }
    }

    @Test
    void testWorkflowEvents_DeliveredToEverySubscriber() {
        // Given
        List<Message> first = new ArrayList<>();
        List<Message> second = new ArrayList<>();
        bus.subscribe("workflow.events", first::add);
        bus.subscribe("workflow.events", second::add);
        expose(new ScriptedAgent("searcher", Capability.SEARCH)
            .returning(Capability.SEARCH, StepOutput.empty()));

        // When
        runner.execute(registry.find("search_only").orElseThrow(), stepRequest(Capability.SEARCH, "tent", null),
            null, CorrelationId.generate(), null);

        // Then
        assertEquals(2, first.size(), "Started and completed events expected");
        assertEquals(first.size(), second.size());
        assertTrue(first.stream().allMatch(message -> message.type() == MessageType.EVENT));
        assertEquals("workflow_started", first.get(0).payload().get("event"));
        assertEquals("workflow_completed", first.get(1).payload().get("event"));
    }
}
