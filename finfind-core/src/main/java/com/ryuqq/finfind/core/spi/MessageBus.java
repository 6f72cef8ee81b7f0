package com.ryuqq.finfind.core.spi;

import com.ryuqq.finfind.core.context.CompressedContext;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.Message;
import com.ryuqq.finfind.core.protocol.Priority;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Topic-based message bus SPI.
 *
 * <p>This interface provides publish/subscribe for EVENT and BROADCAST messages and
 * request/response for REQUEST messages, built on the
 * {@link com.ryuqq.finfind.core.protocol.A2AProtocol} correlation table.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Fan-out of published messages to current subscribers (best effort)</li>
 *   <li>Routing REQUESTs to the topic's designated handler</li>
 *   <li>Servicing queued requests CRITICAL → HIGH → NORMAL → LOW, FIFO within a priority</li>
 *   <li>Compressing the attached {@link CompressedContext} to the configured byte budget</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from multiple threads</li>
 *   <li>{@code request} never blocks the caller or other bus activity</li>
 *   <li>Failures are returned as {@link com.ryuqq.finfind.core.outcome.Fail} values, never thrown</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * bus.registerHandler("agent.search", request -&gt; Result.ok(search(request.payload())));
 *
 * CompletableFuture&lt;Result&lt;Map&lt;String, Object&gt;&gt;&gt; response =
 *     bus.request("agent.search", "orchestrator", payload, Priority.HIGH, Duration.ofSeconds(5), context);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MessageBus {

    /** Topic carrying workflow lifecycle events. */
    String WORKFLOW_EVENTS_TOPIC = "workflow.events";

    /**
     * Delivers an EVENT or BROADCAST message to every current subscriber of {@code topic}.
     *
     * <p>A failing subscriber is logged and does not affect the others.</p>
     *
     * @param topic topic name
     * @param message EVENT or BROADCAST message
     * @throws IllegalArgumentException if message is null or is a REQUEST/RESPONSE
     */
    void publish(String topic, Message message);

    /**
     * Registers a subscriber for future publishes on {@code topic}.
     *
     * @param topic topic name
     * @param subscriber subscriber
     * @return subscription that can be cancelled
     */
    Subscription subscribe(String topic, Subscriber subscriber);

    /**
     * Designates the request handler of {@code topic}.
     *
     * @param topic topic name
     * @param handler request handler
     * @throws IllegalStateException if the topic already has a handler
     */
    void registerHandler(String topic, RequestHandler handler);

    /**
     * Removes the request handler of {@code topic}.
     *
     * @param topic topic name
     * @return true if a handler was removed
     */
    boolean unregisterHandler(String topic);

    /**
     * Sends a REQUEST to the topic's handler and returns the matching response.
     *
     * <p>The future completes with the handler's result, with {@code UPSTREAM_TIMEOUT} when
     * {@code timeout} elapses first, or immediately with {@code UPSTREAM_FAILURE} when the topic
     * has no handler.</p>
     *
     * @param topic topic name
     * @param sender sender name
     * @param payload request payload
     * @param priority dispatch priority
     * @param timeout time to wait for the response
     * @param context conversational context to attach (nullable)
     * @return future of the response result
     */
    CompletableFuture<Result<Map<String, Object>>> request(
        String topic,
        String sender,
        Map<String, Object> payload,
        Priority priority,
        Duration timeout,
        CompressedContext context
    );
}
