package com.ryuqq.finfind.core.protocol;

import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Fail;
import com.ryuqq.finfind.core.outcome.Result;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * A2AProtocol 레지스트리와 상관관계 테이블 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class A2AProtocolTest {

    private A2AProtocol protocol;

    @BeforeEach
    void setUp() {
        protocol = new A2AProtocol(5);
    }

    @AfterEach
    void tearDown() {
        protocol.close();
    }

    private static AgentCard card(String name, Capability... capabilities) {
        List<CapabilityDescriptor> descriptors = java.util.Arrays.stream(capabilities)
            .map(capability -> new CapabilityDescriptor(capability, StepRequest.class, StepOutput.class))
            .toList();
        return new AgentCard(name, "agent." + name, descriptors);
    }

    private static Message request(Duration timeout) {
        return Message.request("agent.search", "orchestrator", Map.of(), Priority.NORMAL, timeout, null);
    }

    // ========== Registry ==========

    @Test
    void discover_ReturnsAgentsInRegistrationOrder() {
        // given
        protocol.register(card("beta", Capability.SEARCH));
        protocol.register(card("alpha", Capability.SEARCH, Capability.ALTERNATIVE));
        protocol.register(card("gamma", Capability.EXPLAIN));

        // when
        List<String> searchers = protocol.discover(Capability.SEARCH);

        // then
        assertThat(searchers).containsExactly("beta", "alpha");
        assertThat(protocol.discover(Capability.RECOMMEND)).isEmpty();
        assertThat(protocol.topicOf("alpha")).contains("agent.alpha");
    }

    @Test
    void register_DuplicateName_Rejected() {
        protocol.register(card("search", Capability.SEARCH));

        assertThatThrownBy(() -> protocol.register(card("search", Capability.EXPLAIN)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already registered");
    }

    @Test
    void unregister_RemovesFromDiscovery() {
        protocol.register(card("search", Capability.SEARCH));

        assertThat(protocol.unregister("search")).isTrue();
        assertThat(protocol.unregister("search")).isFalse();
        assertThat(protocol.discover(Capability.SEARCH)).isEmpty();
        assertThat(protocol.topicOf("search")).isEmpty();
    }

    // ========== Request / Response ==========

    @Test
    void respond_CompletesOnlyMatchingSlot() throws Exception {
        // given
        Message first = request(Duration.ofSeconds(5));
        Message second = request(Duration.ofSeconds(5));
        CompletableFuture<Result<Map<String, Object>>> firstFuture = protocol.sendRequest(first);
        CompletableFuture<Result<Map<String, Object>>> secondFuture = protocol.sendRequest(second);

        // when
        boolean delivered = protocol.respond(Message.response(second, "search-agent", Result.ok(Map.of("n", 2))));

        // then
        assertThat(delivered).isTrue();
        assertThat(secondFuture.get(1, TimeUnit.SECONDS).isOk()).isTrue();
        assertThat(firstFuture).isNotDone();
        assertThat(protocol.pendingCount()).isEqualTo(1);
    }

    @Test
    void sendRequest_NoResponse_ResolvesWithTimeoutResult() throws Exception {
        // given
        CompletableFuture<Result<Map<String, Object>>> future = protocol.sendRequest(request(Duration.ofMillis(50)));

        // when
        Result<Map<String, Object>> result = future.get(2, TimeUnit.SECONDS);

        // then
        assertThat(result).isInstanceOf(Fail.class);
        assertThat(((Fail<Map<String, Object>>) result).kind()).isEqualTo(ErrorKind.UPSTREAM_TIMEOUT);
        assertThat(protocol.pendingCount()).isZero();
    }

    @Test
    void respond_AfterTimeout_IsDropped() throws Exception {
        // given
        Message request = request(Duration.ofMillis(30));
        protocol.sendRequest(request).get(2, TimeUnit.SECONDS);

        // when
        boolean delivered = protocol.respond(Message.response(request, "search-agent", Result.ok(Map.of())));

        // then
        assertThat(delivered).isFalse();
    }

    @Test
    void callerCompletion_ReleasesSlot() {
        CompletableFuture<Result<Map<String, Object>>> future = protocol.sendRequest(request(Duration.ofSeconds(5)));

        future.complete(Fail.of(ErrorKind.CANCELLED, "cancelled"));

        assertThat(protocol.pendingCount()).isZero();
    }

    @Test
    void close_FailsPendingSlots() throws Exception {
        CompletableFuture<Result<Map<String, Object>>> future = protocol.sendRequest(request(Duration.ofSeconds(5)));

        protocol.close();

        Result<Map<String, Object>> result = future.get(1, TimeUnit.SECONDS);
        assertThat(((Fail<Map<String, Object>>) result).kind()).isEqualTo(ErrorKind.UPSTREAM_FAILURE);
    }

    // ========== History ==========

    @Test
    void history_IsBoundedAndFilteredByAgent() {
        // given: limit 5
        for (int i = 0; i < 4; i++) {
            protocol.record(Message.event("workflow.events", "orchestrator", Map.of("i", i)));
        }
        for (int i = 0; i < 3; i++) {
            protocol.record(Message.event("workflow.events", "search-agent", Map.of("i", i)));
        }

        // then
        assertThat(protocol.historySize()).isEqualTo(5);
        assertThat(protocol.history("orchestrator", 10)).hasSize(2);
        assertThat(protocol.history("search-agent", 2))
            .extracting(message -> message.payload().get("i"))
            .containsExactly(1, 2);
    }
}
