package com.ryuqq.finfind.testkit.contract;

import com.ryuqq.finfind.core.capability.Classification;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Fail;
import com.ryuqq.finfind.core.outcome.Ok;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.Capability;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for the {@link ScriptedAgent} test double itself.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ScriptedAgentTest {

    private final ScriptedAgent agent = new ScriptedAgent("scripted", Capability.CLASSIFY, Capability.SEARCH);

    @Test
    void testClassifying_ReturnsScriptedClassification() {
        // Given
        agent.classifying(request -> Result.ok(new Classification("search_only", 0.8, "scripted")));

        // When
        Result<Classification> result = agent.classify(request(Capability.CLASSIFY));

        // Then
        assertInstanceOf(Ok.class, result);
        Classification classification = ((Ok<Classification>) result).value();
        assertEquals("search_only", classification.workflowId());
        assertEquals(1, agent.calls(Capability.CLASSIFY));
    }

    @Test
    void testAnswerForClassify_Rejected() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> agent.answer(Capability.CLASSIFY, request -> Result.ok(StepOutput.empty())));
    }

    @Test
    void testUnscriptedCapability_UpstreamFailure() {
        // When
        Result<StepOutput> search = agent.search(request(Capability.SEARCH));
        Result<Classification> classify = agent.classify(request(Capability.CLASSIFY));

        // Then
        assertInstanceOf(Fail.class, search);
        assertInstanceOf(Fail.class, classify);
        assertEquals(ErrorKind.UPSTREAM_FAILURE, ((Fail<StepOutput>) search).kind());
        assertEquals(ErrorKind.UPSTREAM_FAILURE, ((Fail<Classification>) classify).kind());
        assertEquals(2, agent.received().size());
    }

    private static StepRequest request(Capability capability) {
        return new StepRequest(capability, "tents", "user-1", null, Map.of(), List.of(), null);
    }
}
