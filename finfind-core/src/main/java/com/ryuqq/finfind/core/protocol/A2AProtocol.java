package com.ryuqq.finfind.core.protocol;

import com.ryuqq.finfind.core.model.CorrelationId;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Fail;
import com.ryuqq.finfind.core.outcome.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Agent-to-Agent 프로토콜: 에이전트 레지스트리와 요청-응답 상관관계 테이블.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>에이전트 카드 등록/해제 및 capability 기반 탐색</li>
 *   <li>REQUEST마다 correlationId 기준의 응답 대기 슬롯 관리</li>
 *   <li>응답 기한 초과 시 슬롯을 {@link ErrorKind#UPSTREAM_TIMEOUT} 결과로 완료</li>
 *   <li>최근 메시지 이력 보관 (기본 {@value #DEFAULT_HISTORY_LIMIT}개)</li>
 * </ul>
 *
 * <p><strong>매칭 규칙:</strong></p>
 * <ul>
 *   <li>RESPONSE는 같은 correlationId의 대기 슬롯 하나만 완료</li>
 *   <li>슬롯이 없는 응답(지연 도착, 알 수 없는 ID)은 버리고 로그만 남김</li>
 *   <li>슬롯의 Future가 어떤 이유로든 완료되면 슬롯과 타이머를 정리</li>
 * </ul>
 *
 * <p>타임아웃은 예외가 아닌 {@link Fail} 값으로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class A2AProtocol implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(A2AProtocol.class);

    /** 기본 메시지 이력 보관 개수. */
    public static final int DEFAULT_HISTORY_LIMIT = 1000;

    private final Map<String, AgentCard> agents = new LinkedHashMap<>();
    private final ConcurrentHashMap<CorrelationId, PendingSlot> pending = new ConcurrentHashMap<>();
    private final Deque<Message> history = new ArrayDeque<>();
    private final int historyLimit;
    private final ScheduledExecutorService timer;

    /**
     * 기본 이력 한도로 생성.
     */
    public A2AProtocol() {
        this(DEFAULT_HISTORY_LIMIT);
    }

    /**
     * 커스텀 이력 한도로 생성.
     *
     * @param historyLimit 보관할 최대 메시지 수
     * @throws IllegalArgumentException historyLimit이 양수가 아닌 경우
     */
    public A2AProtocol(int historyLimit) {
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be positive (current: " + historyLimit + ")");
        }
        this.historyLimit = historyLimit;
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "a2a-timeout");
            thread.setDaemon(true);
            return thread;
        });
    }

    // ========== Registry ==========

    /**
     * 에이전트 카드 등록.
     *
     * @param card 에이전트 카드
     * @throws IllegalArgumentException card가 null이거나 같은 이름이 이미 등록된 경우
     */
    public void register(AgentCard card) {
        if (card == null) {
            throw new IllegalArgumentException("card cannot be null");
        }
        synchronized (agents) {
            if (agents.containsKey(card.name())) {
                throw new IllegalArgumentException("Agent already registered: " + card.name());
            }
            agents.put(card.name(), card);
        }
        log.info("Agent registered: {} (topic: {}, capabilities: {})",
            card.name(), card.topic(), card.capabilities().size());
    }

    /**
     * 에이전트 등록 해제.
     *
     * @param name 에이전트 이름
     * @return 해제되었으면 true, 등록되지 않은 이름이면 false
     */
    public boolean unregister(String name) {
        boolean removed;
        synchronized (agents) {
            removed = agents.remove(name) != null;
        }
        if (removed) {
            log.info("Agent unregistered: {}", name);
        }
        return removed;
    }

    /**
     * capability를 제공하는 에이전트 이름 조회 (등록 순서).
     *
     * @param capability 찾을 기능
     * @return 후보 에이전트 이름 (없으면 빈 목록)
     */
    public List<String> discover(Capability capability) {
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        synchronized (agents) {
            List<String> candidates = new ArrayList<>();
            for (AgentCard card : agents.values()) {
                if (card.supports(capability)) {
                    candidates.add(card.name());
                }
            }
            return candidates;
        }
    }

    /**
     * 에이전트의 요청 토픽 조회.
     *
     * @param agentName 에이전트 이름
     * @return 토픽 (등록되지 않은 경우 empty)
     */
    public Optional<String> topicOf(String agentName) {
        synchronized (agents) {
            AgentCard card = agents.get(agentName);
            return card == null ? Optional.empty() : Optional.of(card.topic());
        }
    }

    /**
     * 등록된 모든 에이전트 카드 (등록 순서).
     *
     * @return 카드 목록 스냅샷
     */
    public List<AgentCard> agents() {
        synchronized (agents) {
            return List.copyOf(agents.values());
        }
    }

    // ========== Request / Response ==========

    /**
     * REQUEST에 대한 응답 대기 슬롯 등록.
     *
     * <p>반환된 Future는 다음 중 먼저 일어나는 일로 완료됩니다:</p>
     * <ul>
     *   <li>{@link #respond(Message)}로 같은 correlationId의 RESPONSE 도착</li>
     *   <li>deadline 경과 → {@code Fail(UPSTREAM_TIMEOUT)}</li>
     *   <li>호출자가 Future를 직접 완료 (예: 취소)</li>
     * </ul>
     *
     * @param request REQUEST 메시지
     * @return 응답 결과 Future
     * @throws IllegalArgumentException REQUEST가 아니거나 같은 correlationId 슬롯이 이미 있는 경우
     */
    public CompletableFuture<Result<Map<String, Object>>> sendRequest(Message request) {
        if (request == null || request.type() != MessageType.REQUEST) {
            throw new IllegalArgumentException("sendRequest requires a REQUEST message");
        }

        CorrelationId correlationId = request.correlationId();
        CompletableFuture<Result<Map<String, Object>>> future = new CompletableFuture<>();
        PendingSlot slot = new PendingSlot(request, future);
        if (pending.putIfAbsent(correlationId, slot) != null) {
            throw new IllegalArgumentException("Request already pending: " + correlationId);
        }

        long delayMs = Math.max(0, Duration.between(Instant.now(), request.deadline()).toMillis());
        slot.timeout = timer.schedule(() -> expire(correlationId), delayMs, TimeUnit.MILLISECONDS);
        future.whenComplete((result, error) -> {
            pending.remove(correlationId, slot);
            ScheduledFuture<?> timeout = slot.timeout;
            if (timeout != null) {
                timeout.cancel(false);
            }
        });

        record(request);
        return future;
    }

    /**
     * RESPONSE로 대기 슬롯 완료.
     *
     * @param response RESPONSE 메시지
     * @return 슬롯을 완료했으면 true, 지연/알 수 없는 응답이라 버렸으면 false
     * @throws IllegalArgumentException RESPONSE가 아닌 경우
     */
    public boolean respond(Message response) {
        if (response == null || response.type() != MessageType.RESPONSE) {
            throw new IllegalArgumentException("respond requires a RESPONSE message");
        }

        record(response);
        PendingSlot slot = pending.remove(response.correlationId());
        if (slot == null) {
            log.warn("Dropping late or unknown response: {} from {}", response.correlationId(), response.sender());
            return false;
        }
        return slot.future.complete(response.toResult());
    }

    /**
     * 응답을 기다리는 슬롯이 있는지 확인.
     *
     * <p>타임아웃, 취소, 응답으로 이미 완료된 요청은 false입니다.</p>
     *
     * @param correlationId 상관관계 ID
     * @return 대기 중이면 true
     */
    public boolean isPending(CorrelationId correlationId) {
        return pending.containsKey(correlationId);
    }

    /**
     * 대기 중인 슬롯 수 (진단용).
     *
     * @return 슬롯 수
     */
    public int pendingCount() {
        return pending.size();
    }

    // ========== History ==========

    /**
     * 메시지 이력에 기록.
     *
     * <p>한도를 넘으면 가장 오래된 메시지부터 제거됩니다.</p>
     *
     * @param message 기록할 메시지
     */
    public void record(Message message) {
        synchronized (history) {
            history.addLast(message);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
    }

    /**
     * 에이전트가 보내거나 받은 최근 메시지 조회.
     *
     * @param agentName 에이전트 이름
     * @param limit 최대 개수
     * @return 오래된 것부터 정렬된 메시지
     */
    public List<Message> history(String agentName, int limit) {
        List<Message> matched = new ArrayList<>();
        synchronized (history) {
            for (Message message : history) {
                if (agentName.equals(message.sender()) || agentName.equals(message.recipient())) {
                    matched.add(message);
                }
            }
        }
        int from = Math.max(0, matched.size() - limit);
        return List.copyOf(matched.subList(from, matched.size()));
    }

    /**
     * 보관 중인 메시지 수.
     *
     * @return 이력 크기
     */
    public int historySize() {
        synchronized (history) {
            return history.size();
        }
    }

    /**
     * 타이머 종료 및 남은 슬롯을 실패로 완료.
     */
    @Override
    public void close() {
        timer.shutdownNow();
        for (PendingSlot slot : List.copyOf(pending.values())) {
            slot.future.complete(Fail.of(ErrorKind.UPSTREAM_FAILURE, "protocol closed"));
        }
        pending.clear();
    }

    private void expire(CorrelationId correlationId) {
        PendingSlot slot = pending.remove(correlationId);
        if (slot == null) {
            return;
        }
        log.warn("Request timed out: {} on topic {}", correlationId, slot.request.topic());
        slot.future.complete(Fail.of(
            ErrorKind.UPSTREAM_TIMEOUT,
            "No response on topic " + slot.request.topic() + " before " + slot.request.deadline()
        ));
    }

    private static final class PendingSlot {
        private final Message request;
        private final CompletableFuture<Result<Map<String, Object>>> future;
        private volatile ScheduledFuture<?> timeout;

        PendingSlot(Message request, CompletableFuture<Result<Map<String, Object>>> future) {
            this.request = request;
            this.future = future;
        }
    }
}
