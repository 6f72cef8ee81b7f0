package com.ryuqq.finfind.adapter.inmemory.bus;

import com.ryuqq.finfind.core.context.CompressedContext;
import com.ryuqq.finfind.core.context.ContextCompressor;
import com.ryuqq.finfind.core.exception.DiscoveryException;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Fail;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.A2AProtocol;
import com.ryuqq.finfind.core.protocol.Message;
import com.ryuqq.finfind.core.protocol.MessageType;
import com.ryuqq.finfind.core.protocol.Priority;
import com.ryuqq.finfind.core.spi.MessageBus;
import com.ryuqq.finfind.core.spi.RequestHandler;
import com.ryuqq.finfind.core.spi.Subscriber;
import com.ryuqq.finfind.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process implementation of {@link MessageBus}.
 *
 * <p>Request/response matching is delegated to the shared {@link A2AProtocol}; this class
 * owns topic routing, priority dispatch and subscriber fan-out.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Per-topic queue:</strong> PriorityBlockingQueue ordered by priority rank (desc),
 *       then by enqueue sequence (asc), so FIFO within a priority</li>
 *   <li><strong>Per-topic permits:</strong> Semaphore bounding concurrently awaited requests. A permit is
 *       returned when the caller's wait ends (response or deadline), even if the handler is still running</li>
 *   <li><strong>Dispatcher:</strong> ExecutorService running handler invocations</li>
 *   <li><strong>Subscribers:</strong> CopyOnWriteArrayList per topic, snapshot iteration on publish</li>
 * </ul>
 *
 * <p><strong>Request Lifecycle:</strong></p>
 * <pre>
 * request()
 *   ↓ no handler → Fail(UPSTREAM_FAILURE) immediately
 *   ↓ compress context to the byte budget
 *   ↓ A2AProtocol.sendRequest (pending slot + deadline timer)
 *   ↓ enqueue on the topic queue
 * drain() (permit available)
 *   ↓ skip if the slot is no longer pending (timed out, cancelled)
 *   ↓ handler.handle(request) → Result (exceptions converted)
 *   ↓ A2AProtocol.respond(RESPONSE)
 * </pre>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * A2AProtocol protocol = new A2AProtocol();
 * InMemoryMessageBus bus = new InMemoryMessageBus(protocol, new BusConfig().withMaxConcurrentRequestsPerTopic(2));
 *
 * bus.registerHandler("agent.search", request -&gt; Result.ok(Map.of("products", List.of())));
 * Result&lt;Map&lt;String, Object&gt;&gt; result = bus.request("agent.search", "orchestrator", Map.of(),
 *     Priority.HIGH, Duration.ofSeconds(5), null).join();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMessageBus implements MessageBus, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private static final Comparator<QueuedRequest> DISPATCH_ORDER = Comparator
        .comparingInt((QueuedRequest queued) -> queued.message.priority().rank()).reversed()
        .thenComparingLong(queued -> queued.sequence);

    private final A2AProtocol protocol;
    private final BusConfig config;
    private final ContextCompressor compressor;
    private final ExecutorService dispatcher;
    private final boolean ownsDispatcher;
    private final ConcurrentHashMap<String, RequestHandler> handlers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TopicQueue> queues = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Registration>> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Creates a bus with default configuration.
     *
     * @param protocol shared protocol (registry and correlation table)
     */
    public InMemoryMessageBus(A2AProtocol protocol) {
        this(protocol, new BusConfig());
    }

    /**
     * Creates a bus with its own dispatcher threads.
     *
     * @param protocol shared protocol
     * @param config bus configuration
     */
    public InMemoryMessageBus(A2AProtocol protocol, BusConfig config) {
        this(protocol, config, Executors.newCachedThreadPool(new DispatcherThreadFactory()), true);
    }

    /**
     * Creates a bus dispatching on a caller-owned executor.
     *
     * @param protocol shared protocol
     * @param config bus configuration
     * @param dispatcher executor running handler invocations
     */
    public InMemoryMessageBus(A2AProtocol protocol, BusConfig config, ExecutorService dispatcher) {
        this(protocol, config, dispatcher, false);
    }

    private InMemoryMessageBus(A2AProtocol protocol, BusConfig config, ExecutorService dispatcher, boolean ownsDispatcher) {
        if (protocol == null) {
            throw new IllegalArgumentException("protocol cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        this.protocol = protocol;
        this.config = config;
        this.compressor = new ContextCompressor(config.contextByteBudget());
        this.dispatcher = dispatcher;
        this.ownsDispatcher = ownsDispatcher;
    }

    // ========== Publish / Subscribe ==========

    @Override
    public void publish(String topic, Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (message.type() != MessageType.EVENT && message.type() != MessageType.BROADCAST) {
            throw new IllegalArgumentException("publish accepts EVENT or BROADCAST only (current: " + message.type() + ")");
        }

        protocol.record(message);
        List<Registration> registrations = subscribers.get(topic);
        if (registrations == null) {
            return;
        }
        for (Registration registration : registrations) {
            try {
                registration.subscriber.onMessage(message);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on topic {} for message {}", topic, message.id(), e);
            }
        }
    }

    @Override
    public Subscription subscribe(String topic, Subscriber subscriber) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }
        Registration registration = new Registration(topic, subscriber);
        subscribers.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>()).add(registration);
        return registration;
    }

    // ========== Request / Response ==========

    @Override
    public void registerHandler(String topic, RequestHandler handler) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (handlers.putIfAbsent(topic, handler) != null) {
            throw new IllegalStateException("Topic already has a handler: " + topic);
        }
        log.debug("Handler registered on topic {}", topic);
    }

    @Override
    public boolean unregisterHandler(String topic) {
        return handlers.remove(topic) != null;
    }

    @Override
    public CompletableFuture<Result<Map<String, Object>>> request(
        String topic,
        String sender,
        Map<String, Object> payload,
        Priority priority,
        Duration timeout,
        CompressedContext context
    ) {
        if (!handlers.containsKey(topic)) {
            log.warn("No handler registered for topic {} (sender: {})", topic, sender);
            return CompletableFuture.completedFuture(
                Fail.of(ErrorKind.UPSTREAM_FAILURE, "No handler registered for topic " + topic)
            );
        }

        CompressedContext attached;
        try {
            attached = context == null ? null : compressor.compress(context);
        } catch (IllegalStateException e) {
            return CompletableFuture.completedFuture(Fail.of(ErrorKind.VALIDATION, e.getMessage()));
        }

        Message message = Message.request(topic, sender, payload, priority == null ? Priority.NORMAL : priority,
            timeout == null ? config.defaultTimeout() : timeout, attached);
        CompletableFuture<Result<Map<String, Object>>> response = protocol.sendRequest(message);
        queueOf(topic).offer(new QueuedRequest(message, response, sequence.incrementAndGet()));
        return response;
    }

    /**
     * Number of requests waiting for a permit on {@code topic}.
     *
     * @param topic topic name
     * @return queued request count
     */
    public int queuedCount(String topic) {
        TopicQueue queue = queues.get(topic);
        return queue == null ? 0 : queue.pending.size();
    }

    public BusConfig getConfig() {
        return config;
    }

    /**
     * Stops the dispatcher if this bus created it. Pending requests are left to the protocol.
     */
    @Override
    public void close() {
        if (ownsDispatcher) {
            dispatcher.shutdownNow();
        }
    }

    private TopicQueue queueOf(String topic) {
        return queues.computeIfAbsent(topic, key -> new TopicQueue(key, config.maxConcurrentRequestsPerTopic()));
    }

    private void serve(Message request) {
        if (!protocol.isPending(request.correlationId())) {
            log.debug("Skipping request {} on {}: no longer awaited", request.correlationId(), request.topic());
            return;
        }
        if (request.isExpired(Instant.now())) {
            log.debug("Skipping expired request {} on {}", request.correlationId(), request.topic());
            return;
        }

        RequestHandler handler = handlers.get(request.topic());
        Result<Map<String, Object>> result;
        if (handler == null) {
            result = Fail.of(ErrorKind.UPSTREAM_FAILURE, "Handler removed from topic " + request.topic());
        } else {
            result = invoke(handler, request);
        }
        protocol.respond(Message.response(request, request.topic(), result));
    }

    private static Result<Map<String, Object>> invoke(RequestHandler handler, Message request) {
        try {
            Result<Map<String, Object>> result = handler.handle(request);
            if (result == null) {
                return Fail.of(ErrorKind.STEP_FAILURE, "Handler on " + request.topic() + " returned no result");
            }
            return result;
        } catch (DiscoveryException e) {
            return e.toFail();
        } catch (RuntimeException e) {
            log.error("Handler on topic {} failed for {}", request.topic(), request.correlationId(), e);
            return Fail.of(ErrorKind.UPSTREAM_FAILURE, "Handler failed: " + e.getMessage(), e.getClass().getName());
        }
    }

    private final class TopicQueue {

        private final String topic;
        private final PriorityBlockingQueue<QueuedRequest> pending = new PriorityBlockingQueue<>(16, DISPATCH_ORDER);
        private final Semaphore permits;

        TopicQueue(String topic, int maxConcurrent) {
            this.topic = topic;
            this.permits = new Semaphore(maxConcurrent);
        }

        void offer(QueuedRequest request) {
            pending.offer(request);
            drain();
        }

        void drain() {
            while (!pending.isEmpty() && permits.tryAcquire()) {
                QueuedRequest next = pending.poll();
                if (next == null) {
                    permits.release();
                    continue;
                }
                if (next.response.isDone()) {
                    permits.release();
                    log.debug("Dropping request {} on {}: answered or expired while queued",
                        next.message.correlationId(), topic);
                    continue;
                }
                AtomicBoolean held = new AtomicBoolean(true);
                Runnable releasePermit = () -> {
                    if (held.compareAndSet(true, false)) {
                        permits.release();
                        drain();
                    }
                };
                try {
                    dispatcher.execute(() -> {
                        try {
                            serve(next.message);
                        } finally {
                            releasePermit.run();
                        }
                    });
                } catch (RejectedExecutionException e) {
                    held.set(false);
                    permits.release();
                    log.warn("Dispatcher rejected request {} on {}", next.message.correlationId(), topic);
                    protocol.respond(Message.response(next.message, topic,
                        Fail.of(ErrorKind.UPSTREAM_FAILURE, "bus is shut down")));
                    return;
                }
                // a handler still running past its deadline no longer holds the permit
                next.response.whenComplete((result, error) -> releasePermit.run());
            }
        }
    }

    private static final class QueuedRequest {
        private final Message message;
        private final CompletableFuture<Result<Map<String, Object>>> response;
        private final long sequence;

        QueuedRequest(Message message, CompletableFuture<Result<Map<String, Object>>> response, long sequence) {
            this.message = message;
            this.response = response;
            this.sequence = sequence;
        }
    }

    private final class Registration implements Subscription {
        private final String topic;
        private final Subscriber subscriber;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Registration(String topic, Subscriber subscriber) {
            this.topic = topic;
            this.subscriber = subscriber;
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                List<Registration> registrations = subscribers.get(topic);
                if (registrations != null) {
                    registrations.remove(this);
                }
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }

    private static final class DispatcherThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "finfind-bus-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
