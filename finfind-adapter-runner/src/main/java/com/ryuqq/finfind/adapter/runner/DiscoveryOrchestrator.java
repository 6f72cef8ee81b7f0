package com.ryuqq.finfind.adapter.runner;

import com.ryuqq.finfind.adapter.runner.ResultAggregator.Aggregation;
import com.ryuqq.finfind.application.orchestrator.DiscoveryRequest;
import com.ryuqq.finfind.application.orchestrator.DiscoveryResponse;
import com.ryuqq.finfind.application.orchestrator.Orchestrator;
import com.ryuqq.finfind.application.orchestrator.RequestContext;
import com.ryuqq.finfind.application.runtime.CapabilityEndpoints;
import com.ryuqq.finfind.application.runtime.WorkflowEngine;
import com.ryuqq.finfind.core.capability.Classification;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.context.CompressedContext;
import com.ryuqq.finfind.core.context.Conversation;
import com.ryuqq.finfind.core.context.Turn;
import com.ryuqq.finfind.core.exception.DiscoveryException;
import com.ryuqq.finfind.core.model.CorrelationId;
import com.ryuqq.finfind.core.outcome.ErrorDetail;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Fail;
import com.ryuqq.finfind.core.outcome.Ok;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.A2AProtocol;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.protocol.Priority;
import com.ryuqq.finfind.core.spi.ConversationStore;
import com.ryuqq.finfind.core.spi.MessageBus;
import com.ryuqq.finfind.core.support.Payloads;
import com.ryuqq.finfind.core.workflow.CancellationSignal;
import com.ryuqq.finfind.core.workflow.WorkflowDefinition;
import com.ryuqq.finfind.core.workflow.WorkflowRegistry;
import com.ryuqq.finfind.core.workflow.WorkflowResult;
import com.ryuqq.finfind.core.workflow.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 상품 탐색 Orchestrator 구현체.
 *
 * <p>요청 하나를 검증하고, CLASSIFY Agent로 워크플로를 선택한 뒤 {@link WorkflowEngine}으로 실행하고
 * {@link ResultAggregator}로 Step 출력을 병합합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * processRequest(request)
 *   ↓ 검증 (text, userId, 질의 길이) → 실패 시 VALIDATION 응답
 *   ↓ 대화 열기 (conversationId 없으면 새로 생성, 다른 사용자의 대화면 VALIDATION 응답)
 *   ↓ CompressedContext 구성 (요청의 이전 턴 + 저장된 턴, 이전 상품 ID, 예산, 카테고리)
 *   ↓ 워크플로 선택
 *   │   context.workflowId 지정 → 해당 워크플로
 *   │   아니면 CLASSIFY 요청 (HIGH 우선순위) → 실패 시 기본 워크플로 + 경고
 *   ↓ engine.execute (requestTimeout 초과 시 취소)
 *   ↓ 병합 → 대화에 턴 기록 (질의, 워크플로 ID, 반환된 상품 ID)
 *   ↓ DiscoveryResponse (conversationId 포함)
 * </pre>
 *
 * <p>processRequest는 예외를 던지지 않습니다. 생성 시점의 설정 오류만 예외로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DiscoveryOrchestrator implements Orchestrator, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryOrchestrator.class);

    private final WorkflowEngine engine;
    private final MessageBus bus;
    private final A2AProtocol protocol;
    private final WorkflowRegistry registry;
    private final ConversationStore conversations;
    private final ResultAggregator aggregator;
    private final OrchestratorConfig config;
    private final ScheduledExecutorService watchdog;

    /**
     * 생성자 (기본 설정).
     *
     * @param engine 워크플로 엔진
     * @param bus 메시지 버스
     * @param protocol Agent 레지스트리
     * @param registry 워크플로 레지스트리
     * @param conversations 대화 저장소
     */
    public DiscoveryOrchestrator(
        WorkflowEngine engine,
        MessageBus bus,
        A2AProtocol protocol,
        WorkflowRegistry registry,
        ConversationStore conversations
    ) {
        this(engine, bus, protocol, registry, conversations, new ResultAggregator(), new OrchestratorConfig());
    }

    /**
     * 생성자.
     *
     * <p>기본 워크플로가 등록되어 있고, 등록된 모든 워크플로의 Capability를 제공하는 Agent가
     * 있어야 합니다.</p>
     *
     * @param engine 워크플로 엔진
     * @param bus 메시지 버스
     * @param protocol Agent 레지스트리
     * @param registry 워크플로 레지스트리
     * @param conversations 대화 저장소
     * @param aggregator 결과 병합기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     * @throws IllegalStateException 기본 워크플로가 없거나 제공되지 않는 Capability가 있는 경우
     */
    public DiscoveryOrchestrator(
        WorkflowEngine engine,
        MessageBus bus,
        A2AProtocol protocol,
        WorkflowRegistry registry,
        ConversationStore conversations,
        ResultAggregator aggregator,
        OrchestratorConfig config
    ) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (protocol == null) {
            throw new IllegalArgumentException("protocol cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (conversations == null) {
            throw new IllegalArgumentException("conversations cannot be null");
        }
        if (aggregator == null) {
            throw new IllegalArgumentException("aggregator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.engine = engine;
        this.bus = bus;
        this.protocol = protocol;
        this.registry = registry;
        this.conversations = conversations;
        this.aggregator = aggregator;
        this.config = config;
        validateWorkflows();
        this.watchdog = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "finfind-request-watchdog");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public DiscoveryResponse processRequest(DiscoveryRequest request) {
        return processRequest(request, CancellationSignal.create());
    }

    /**
     * 취소 신호와 함께 요청 처리.
     *
     * @param request 탐색 요청
     * @param cancellation 취소 신호 (null이면 새로 생성)
     * @return 구조화된 응답 (null 아님)
     */
    public DiscoveryResponse processRequest(DiscoveryRequest request, CancellationSignal cancellation) {
        long startNanos = System.nanoTime();
        try {
            return handle(request, cancellation == null ? CancellationSignal.create() : cancellation, startNanos);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while processing request", e);
            return DiscoveryResponse.failure(
                List.of(new ErrorDetail("orchestrator", ErrorKind.STEP_FAILURE, "Unexpected failure: " + e.getMessage())),
                List.of(),
                elapsedMs(startNanos)
            );
        }
    }

    /**
     * 요청 타임아웃 감시 스레드 종료.
     */
    @Override
    public void close() {
        watchdog.shutdownNow();
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    // ========== Request ==========

    private DiscoveryResponse handle(DiscoveryRequest request, CancellationSignal signal, long startNanos) {
        Optional<String> invalid = validate(request);
        if (invalid.isPresent()) {
            log.warn("Rejected request: {}", invalid.get());
            return validationFailure(invalid.get(), startNanos);
        }

        RequestContext requestContext = request.context();
        Conversation conversation;
        CompressedContext context;
        try {
            conversation = conversations.open(requestContext.conversationId(), request.userId());
            if (!conversation.belongsTo(request.userId())) {
                log.warn("Rejected request: conversation {} belongs to another user", conversation.conversationId());
                return validationFailure("conversation " + conversation.conversationId() + " belongs to another user",
                    startNanos);
            }
            context = CompressedContext.of(request.userId(), conversation.conversationId(), request.text())
                .withBudgetMax(requestContext.budgetMax())
                .withCategories(requestContext.categories())
                .withProductIds(priorProductIds(requestContext, conversation))
                .withTurns(history(requestContext, conversation));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected request context: {}", e.getMessage());
            return validationFailure(e.getMessage(), startNanos);
        }

        List<String> warnings = new ArrayList<>();
        Set<String> agentsUsed = new LinkedHashSet<>();
        WorkflowDefinition definition = selectWorkflow(request, context, warnings, agentsUsed);
        context = context.withIntent(definition.id());

        StepRequest input = new StepRequest(definition.steps().get(0).capability(), request.text(), request.userId(),
            requestContext.budgetMax(), requestContext.filters(), List.of(), null);
        CorrelationId correlationId = CorrelationId.generate();

        WorkflowResult result;
        ScheduledFuture<?> deadline = watchdog.schedule(
            () -> signal.cancel("Request timed out after " + config.requestTimeout().toMillis() + "ms"),
            config.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        try {
            result = engine.execute(definition, input, context, correlationId, signal);
        } finally {
            deadline.cancel(false);
        }

        Aggregation aggregation = aggregator.aggregate(result);
        aggregation.warnings().forEach(warning -> log.warn("Request {}: {}", correlationId.getValue(), warning));
        warnings.addAll(aggregation.warnings());
        agentsUsed.addAll(result.stepAgents().values());

        List<ErrorDetail> errors = new ArrayList<>(result.stepErrors().values());
        if (result.status() == WorkflowStatus.FAILED && errors.isEmpty()) {
            errors.add(new ErrorDetail(definition.id(), ErrorKind.STEP_FAILURE, "No required step completed"));
        }

        List<String> productIds = aggregation.products().stream().map(ProductHit::id).toList();
        conversations.append(conversation.conversationId(), request.userId(),
            Turn.of(request.text(), definition.id(), productIds));

        boolean success = result.status() != WorkflowStatus.FAILED;
        long elapsed = elapsedMs(startNanos);
        log.info("Request {} finished via {} with {} in {}ms ({} products)",
            correlationId.getValue(), definition.id(), result.status(), elapsed, aggregation.products().size());

        return new DiscoveryResponse(
            success,
            aggregation.output(),
            aggregation.products(),
            new ArrayList<>(agentsUsed),
            elapsed,
            errors,
            result.status() == WorkflowStatus.PARTIAL,
            definition.id(),
            result.executionId(),
            aggregation.explanations(),
            aggregation.alternatives(),
            warnings,
            conversation.conversationId()
        );
    }

    private Optional<String> validate(DiscoveryRequest request) {
        if (request == null) {
            return Optional.of("request cannot be null");
        }
        if (request.text() == null || request.text().isBlank()) {
            return Optional.of("text cannot be null or blank");
        }
        if (request.text().length() > config.maxQueryLength()) {
            return Optional.of("text must be at most " + config.maxQueryLength()
                + " characters (current: " + request.text().length() + ")");
        }
        if (request.userId() == null || request.userId().isBlank()) {
            return Optional.of("userId cannot be null or blank");
        }
        return Optional.empty();
    }

    private static List<Turn> history(RequestContext requestContext, Conversation conversation) {
        List<Turn> turns = new ArrayList<>(requestContext.history());
        turns.addAll(conversation.turns());
        return turns;
    }

    private static List<String> priorProductIds(RequestContext requestContext, Conversation conversation) {
        Set<String> productIds = new LinkedHashSet<>(requestContext.priorProductIds());
        productIds.addAll(conversation.lastProductIds());
        return new ArrayList<>(productIds);
    }

    // ========== Workflow selection ==========

    private WorkflowDefinition selectWorkflow(
        DiscoveryRequest request,
        CompressedContext context,
        List<String> warnings,
        Set<String> agentsUsed
    ) {
        String requested = request.context().workflowId();
        if (requested != null) {
            Optional<WorkflowDefinition> explicit = registry.find(requested);
            if (explicit.isPresent()) {
                return explicit.get();
            }
            warnings.add("Unknown workflow " + requested + ", using " + config.defaultWorkflowId());
            return defaultWorkflow();
        }

        List<String> classifiers = protocol.discover(Capability.CLASSIFY);
        if (classifiers.isEmpty()) {
            warnings.add("No classifier registered, using " + config.defaultWorkflowId());
            return defaultWorkflow();
        }
        String classifier = classifiers.get(0);
        Optional<String> topic = protocol.topicOf(classifier);
        if (topic.isEmpty()) {
            warnings.add("Classifier " + classifier + " is not reachable, using " + config.defaultWorkflowId());
            return defaultWorkflow();
        }

        StepRequest classify = new StepRequest(Capability.CLASSIFY, request.text(), request.userId(),
            request.context().budgetMax(), request.context().filters(), List.of(), null);
        Result<Classification> classification = classify(topic.get(), classify, context);

        if (classification instanceof Fail<Classification> fail) {
            log.warn("Classification failed ({}: {}), using {}", fail.kind(), fail.message(), config.defaultWorkflowId());
            warnings.add("Classification failed (" + fail.kind() + ": " + fail.message() + "), using "
                + config.defaultWorkflowId());
            return defaultWorkflow();
        }

        Classification selected = ((Ok<Classification>) classification).value();
        agentsUsed.add(classifier);
        Optional<WorkflowDefinition> definition = registry.find(selected.workflowId());
        if (definition.isEmpty()) {
            log.warn("Classifier selected unknown workflow {}, using {}", selected.workflowId(), config.defaultWorkflowId());
            warnings.add("Classifier selected unknown workflow " + selected.workflowId() + ", using "
                + config.defaultWorkflowId());
            return defaultWorkflow();
        }
        log.debug("Classified as {} (confidence: {}, reason: {})",
            selected.workflowId(), selected.confidence(), selected.reason());
        return definition.get();
    }

    private Result<Classification> classify(String topic, StepRequest request, CompressedContext context) {
        Result<Map<String, Object>> raw;
        try {
            raw = bus.request(topic, config.sender(), CapabilityEndpoints.encode(request), Priority.HIGH,
                config.classifyTimeout(), context).join();
        } catch (CompletionException e) {
            return Fail.of(ErrorKind.UPSTREAM_FAILURE, "Classification request failed: " + e.getCause());
        }
        if (raw instanceof Ok<Map<String, Object>> ok) {
            try {
                return Result.ok(Payloads.fromMap(ok.value(), Classification.class));
            } catch (DiscoveryException e) {
                return e.toFail();
            }
        }
        return ((Fail<Map<String, Object>>) raw).retype();
    }

    private WorkflowDefinition defaultWorkflow() {
        return registry.find(config.defaultWorkflowId())
            .orElseThrow(() -> new IllegalStateException("Default workflow is not registered: " + config.defaultWorkflowId()));
    }

    // ========== Startup ==========

    private void validateWorkflows() {
        if (registry.find(config.defaultWorkflowId()).isEmpty()) {
            throw new IllegalStateException("Default workflow is not registered: " + config.defaultWorkflowId());
        }
        for (WorkflowDefinition definition : registry.all()) {
            for (Capability capability : definition.capabilities()) {
                if (protocol.discover(capability).isEmpty()) {
                    throw new IllegalStateException(
                        "No agent provides " + capability + " required by workflow " + definition.id());
                }
            }
        }
    }

    // ========== Helpers ==========

    private static DiscoveryResponse validationFailure(String message, long startNanos) {
        return DiscoveryResponse.failure(
            List.of(new ErrorDetail("request", ErrorKind.VALIDATION, message)),
            List.of(),
            elapsedMs(startNanos)
        );
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
