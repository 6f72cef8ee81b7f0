package com.ryuqq.finfind.adapter.runner;

import com.ryuqq.finfind.application.runtime.CapabilityEndpoints;
import com.ryuqq.finfind.application.runtime.WorkflowEngine;
import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.context.CompressedContext;
import com.ryuqq.finfind.core.exception.DiscoveryException;
import com.ryuqq.finfind.core.model.CorrelationId;
import com.ryuqq.finfind.core.outcome.ErrorDetail;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Fail;
import com.ryuqq.finfind.core.outcome.Ok;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.A2AProtocol;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.protocol.Message;
import com.ryuqq.finfind.core.spi.ExecutionStore;
import com.ryuqq.finfind.core.spi.MessageBus;
import com.ryuqq.finfind.core.statemachine.StepStatus;
import com.ryuqq.finfind.core.support.Payloads;
import com.ryuqq.finfind.core.workflow.CancellationSignal;
import com.ryuqq.finfind.core.workflow.ConditionContext;
import com.ryuqq.finfind.core.workflow.InputMapping;
import com.ryuqq.finfind.core.workflow.WorkflowDefinition;
import com.ryuqq.finfind.core.workflow.WorkflowExecution;
import com.ryuqq.finfind.core.workflow.WorkflowResult;
import com.ryuqq.finfind.core.workflow.WorkflowStatus;
import com.ryuqq.finfind.core.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Layer 단위 Workflow 실행 Runner.
 *
 * <p>WorkflowDefinition의 Step을 의존성 Layer로 나누어 실행합니다. 같은 Layer의 Step은
 * 동시에 실행되고, Layer 전체가 끝난 뒤 다음 Layer로 넘어갑니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>의존성 해석 및 연쇄 SKIP (필수 의존 Step이 FAILED/SKIPPED인 경우)</li>
 *   <li>Step 조건 평가 (false → 디스패치 없이 SKIPPED)</li>
 *   <li>입력 매핑 (QUERY, USER, PRODUCTS_FROM, ALL_PRODUCTS)</li>
 *   <li>Capability → Agent → Topic 해석 후 Bus 요청</li>
 *   <li>재시도 가능한 실패에 대한 Exponential Backoff 재시도, 이후 fallback Capability 1회 시도</li>
 *   <li>CancellationSignal 처리 (진행 중 요청 CANCELLED, 대기 Step SKIPPED)</li>
 *   <li>ExecutionStore 등록/해제 및 workflow.events 발행</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute()
 *   ↓ store.begin(execution)          (같은 CorrelationId의 live 실행이 있으면 IllegalStateException)
 *   ↓ publish workflow_started
 *   ↓ loop:
 *   │   PENDING Step 분류 → SKIP(의존 실패) / READY / WAITING
 *   │   READY Step 조건 평가 → SKIP / RUNNING
 *   │   RUNNING Step 동시 실행, Layer 완료 대기
 *   │     attempt → Fail(retryable) → backoff → attempt ... → fallback attempt
 *   ↓ 모든 Step terminal
 *   ↓ execution.finish(병합 출력)      ({@link ResultAggregator})
 *   ↓ store.end(execution)
 *   ↓ publish workflow_completed | workflow_failed
 * </pre>
 *
 * <p>Step 실패는 예외가 아니라 {@link Result} 값으로 전달됩니다. 이 클래스가 던지는 예외는
 * 인자 검증과 중복 live 실행뿐입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LayeredWorkflowRunner implements WorkflowEngine, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LayeredWorkflowRunner.class);

    public static final String EVENT_STARTED = "workflow_started";
    public static final String EVENT_COMPLETED = "workflow_completed";
    public static final String EVENT_FAILED = "workflow_failed";

    private final MessageBus bus;
    private final A2AProtocol protocol;
    private final ExecutionStore store;
    private final WorkflowRunnerConfig config;
    private final ExecutorService stepExecutor;
    private final ResultAggregator aggregator = new ResultAggregator();

    /**
     * 생성자 (기본 설정).
     *
     * @param bus 메시지 버스
     * @param protocol Agent 레지스트리
     * @param store 실행 저장소
     */
    public LayeredWorkflowRunner(MessageBus bus, A2AProtocol protocol, ExecutionStore store) {
        this(bus, protocol, store, new WorkflowRunnerConfig());
    }

    /**
     * 생성자.
     *
     * @param bus 메시지 버스
     * @param protocol Agent 레지스트리
     * @param store 실행 저장소
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LayeredWorkflowRunner(MessageBus bus, A2AProtocol protocol, ExecutionStore store, WorkflowRunnerConfig config) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (protocol == null) {
            throw new IllegalArgumentException("protocol cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.bus = bus;
        this.protocol = protocol;
        this.store = store;
        this.config = config;
        this.stepExecutor = Executors.newFixedThreadPool(config.concurrency(), new StepThreadFactory());
    }

    @Override
    public WorkflowResult execute(
        WorkflowDefinition definition,
        StepRequest input,
        CompressedContext context,
        CorrelationId correlationId,
        CancellationSignal cancellation
    ) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        CancellationSignal signal = cancellation == null ? CancellationSignal.create() : cancellation;

        WorkflowExecution execution = WorkflowExecution.start(definition, correlationId);
        store.begin(execution);
        log.info("Workflow {} started (execution: {}, correlation: {})",
            definition.id(), execution.getExecutionId(), correlationId.getValue());
        publish(EVENT_STARTED, execution, null);

        try {
            runLayers(definition, input, context, execution, signal);
        } catch (RuntimeException e) {
            log.error("Workflow {} aborted unexpectedly (execution: {})", definition.id(), execution.getExecutionId(), e);
            abandon(definition, execution, ErrorKind.STEP_FAILURE, "Workflow aborted: " + e.getMessage());
        } finally {
            if (!execution.isTerminal()) {
                abandon(definition, execution, ErrorKind.STEP_FAILURE, "Workflow aborted");
            }
            execution.finish(aggregator.aggregate(WorkflowResult.of(definition, execution)).toStepOutput());
            store.end(execution);
        }
        WorkflowResult result = WorkflowResult.of(definition, execution);

        log.info("Workflow {} finished with {} (execution: {}, failed: {}, skipped: {})",
            definition.id(), result.status(), result.executionId(), result.failedSteps(), result.skippedSteps());
        publish(result.status() == WorkflowStatus.FAILED ? EVENT_FAILED : EVENT_COMPLETED, execution, result.status());
        return result;
    }

    /**
     * Step 실행 스레드 종료.
     */
    @Override
    public void close() {
        stepExecutor.shutdown();
        try {
            if (!stepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                stepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            stepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public WorkflowRunnerConfig getConfig() {
        return config;
    }

    // ========== Layers ==========

    private void runLayers(
        WorkflowDefinition definition,
        StepRequest input,
        CompressedContext context,
        WorkflowExecution execution,
        CancellationSignal signal
    ) {
        while (!execution.isTerminal()) {
            if (signal.isCancelled()) {
                log.warn("Workflow {} cancelled: {}", definition.id(), signal.reason());
                skipPending(definition, execution);
                return;
            }

            List<WorkflowStep> ready = new ArrayList<>();
            boolean skipped = false;
            for (WorkflowStep step : definition.steps()) {
                if (execution.statusOf(step.name()) != StepStatus.PENDING) {
                    continue;
                }
                switch (dependencyState(definition, execution, step)) {
                    case BLOCKED -> {
                        log.debug("Skipping {}: a required dependency did not complete", step.name());
                        execution.skip(step.name());
                        skipped = true;
                    }
                    case READY -> ready.add(step);
                    case WAITING -> { }
                }
            }
            if (ready.isEmpty()) {
                if (!skipped) {
                    // 의존성이 정의 순서로 검증되므로 도달하지 않는 경로
                    skipPending(definition, execution);
                }
                continue;
            }

            List<CompletableFuture<Void>> layer = new ArrayList<>();
            for (WorkflowStep step : ready) {
                StepRequest request = requestFor(step, input, execution);
                if (!conditionHolds(step, input, context, execution)) {
                    log.debug("Skipping {}: condition not met", step.name());
                    execution.skip(step.name());
                    continue;
                }
                execution.transition(step.name(), StepStatus.RUNNING);
                layer.add(CompletableFuture.runAsync(
                    () -> runStep(step, request, context, execution, signal), stepExecutor));
            }
            CompletableFuture.allOf(layer.toArray(new CompletableFuture[0])).join();
        }
    }

    private DependencyState dependencyState(WorkflowDefinition definition, WorkflowExecution execution, WorkflowStep step) {
        boolean waiting = false;
        for (String dependency : step.dependsOn()) {
            StepStatus status = execution.statusOf(dependency);
            if (status == StepStatus.COMPLETED) {
                continue;
            }
            if (status.isLive()) {
                waiting = true;
                continue;
            }
            boolean required = definition.step(dependency).map(WorkflowStep::required).orElse(true);
            if (required) {
                return DependencyState.BLOCKED;
            }
        }
        return waiting ? DependencyState.WAITING : DependencyState.READY;
    }

    private boolean conditionHolds(WorkflowStep step, StepRequest input, CompressedContext context, WorkflowExecution execution) {
        Double budget = input.budgetMax() != null
            ? input.budgetMax()
            : context == null ? null : context.budgetMax();
        Map<String, StepOutput> outputs = execution.outputs();
        Map<String, ProductHit> products = new LinkedHashMap<>();
        outputs.values().forEach(output -> output.products().forEach(product -> mergeHighest(products, product)));
        ConditionContext conditionContext = new ConditionContext(input.query(), budget,
            new ArrayList<>(products.values()), outputs);
        try {
            return step.condition().test(conditionContext);
        } catch (RuntimeException e) {
            log.warn("Condition of step {} failed, running the step anyway", step.name(), e);
            return true;
        }
    }

    // ========== Step ==========

    private void runStep(
        WorkflowStep step,
        StepRequest request,
        CompressedContext context,
        WorkflowExecution execution,
        CancellationSignal signal
    ) {
        try {
            Attempt attempt = attemptWithRetry(step, step.capability(), request, context, signal);
            if (attempt.failed() && step.fallbackCapability() != null && !signal.isCancelled()) {
                log.warn("Step {} failed on {} ({}), trying fallback {}",
                    step.name(), step.capability(), attempt.fail().kind(), step.fallbackCapability());
                attempt = attemptOnce(step, request.withCapability(step.fallbackCapability()), context, signal);
            }

            if (attempt.failed()) {
                Fail<StepOutput> fail = attempt.fail();
                log.warn("Step {} failed: {} - {}", step.name(), fail.kind(), fail.message());
                execution.fail(step.name(), new ErrorDetail(step.name(), fail.kind(), fail.message()));
            } else {
                execution.complete(step.name(), attempt.output(), attempt.agent());
            }
        } catch (RuntimeException e) {
            log.error("Step {} raised an unexpected error", step.name(), e);
            execution.fail(step.name(), new ErrorDetail(step.name(), ErrorKind.STEP_FAILURE,
                "Step failed: " + e.getMessage()));
        }
    }

    private Attempt attemptWithRetry(
        WorkflowStep step,
        Capability capability,
        StepRequest request,
        CompressedContext context,
        CancellationSignal signal
    ) {
        BackoffCalculator backoff = BackoffCalculator.forPolicy(step.retryPolicy(), config.maxBackoffMs(), config.jitterFactor());
        int maxAttempts = step.retryPolicy().maxAttempts();
        StepRequest primary = request.withCapability(capability);

        Attempt attempt = attemptOnce(step, primary, context, signal);
        for (int failures = 1; failures < maxAttempts && attempt.failed(); failures++) {
            Fail<StepOutput> fail = attempt.fail();
            if (!fail.isRetryable()) {
                return attempt;
            }
            long delay = backoff.calculate(failures);
            log.warn("Step {} attempt {}/{} failed ({}: {}), retrying in {}ms",
                step.name(), failures, maxAttempts, fail.kind(), fail.message(), delay);
            if (!pause(delay, signal)) {
                return Attempt.failure(cancelled(signal));
            }
            attempt = attemptOnce(step, primary, context, signal);
        }
        return attempt;
    }

    private Attempt attemptOnce(WorkflowStep step, StepRequest request, CompressedContext context, CancellationSignal signal) {
        if (signal.isCancelled()) {
            return Attempt.failure(cancelled(signal));
        }
        List<String> candidates = protocol.discover(request.capability());
        if (candidates.isEmpty()) {
            return Attempt.failure(Fail.of(ErrorKind.UPSTREAM_FAILURE, "No agent provides " + request.capability()));
        }
        String agent = candidates.get(0);
        Optional<String> topic = protocol.topicOf(agent);
        if (topic.isEmpty()) {
            return Attempt.failure(Fail.of(ErrorKind.UPSTREAM_FAILURE, "Agent " + agent + " is no longer registered"));
        }

        Duration timeout = step.timeout() != null ? step.timeout() : config.defaultStepTimeout();
        CompletableFuture<Result<Map<String, Object>>> response = bus.request(topic.get(), config.sender(),
            CapabilityEndpoints.encode(request), config.priority(), timeout, context);
        CancellationSignal.Registration registration = signal.onCancel(() -> response.complete(cancelled(signal).retype()));

        Result<Map<String, Object>> raw;
        try {
            raw = response.join();
        } catch (CompletionException e) {
            raw = Fail.of(ErrorKind.UPSTREAM_FAILURE, "Request to " + agent + " failed: " + e.getCause(), null);
        } finally {
            registration.remove();
        }

        if (raw instanceof Ok<Map<String, Object>> ok) {
            try {
                return Attempt.success(Payloads.fromMap(ok.value(), StepOutput.class), agent);
            } catch (DiscoveryException e) {
                return Attempt.failure(e.toFail());
            }
        }
        return Attempt.failure(((Fail<Map<String, Object>>) raw).retype());
    }

    private boolean pause(long delayMs, CancellationSignal signal) {
        CountDownLatch wake = new CountDownLatch(1);
        CancellationSignal.Registration registration = signal.onCancel(wake::countDown);
        try {
            return !wake.await(delayMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            registration.remove();
        }
    }

    // ========== Input mapping ==========

    private static StepRequest requestFor(WorkflowStep step, StepRequest input, WorkflowExecution execution) {
        String query = null;
        String userId = null;
        Map<String, ProductHit> products = new LinkedHashMap<>();
        Map<String, StepOutput> outputs = execution.outputs();

        for (InputMapping mapping : step.inputs()) {
            switch (mapping.source()) {
                case QUERY -> query = input.query();
                case USER -> userId = input.userId();
                case PRODUCTS_FROM -> {
                    StepOutput output = outputs.get(mapping.step());
                    if (output != null) {
                        output.products().forEach(product -> mergeHighest(products, product));
                    }
                }
                case ALL_PRODUCTS -> outputs.values()
                    .forEach(output -> output.products().forEach(product -> mergeHighest(products, product)));
            }
        }
        return new StepRequest(step.capability(), query, userId, input.budgetMax(), input.filters(),
            new ArrayList<>(products.values()), null);
    }

    private static void mergeHighest(Map<String, ProductHit> products, ProductHit product) {
        ProductHit existing = products.get(product.id());
        if (existing == null || product.score() > existing.score()) {
            products.put(product.id(), product);
        }
    }

    // ========== Termination ==========

    private static void skipPending(WorkflowDefinition definition, WorkflowExecution execution) {
        for (WorkflowStep step : definition.steps()) {
            if (execution.statusOf(step.name()) == StepStatus.PENDING) {
                execution.skip(step.name());
            }
        }
    }

    private static void abandon(WorkflowDefinition definition, WorkflowExecution execution, ErrorKind kind, String message) {
        for (WorkflowStep step : definition.steps()) {
            StepStatus status = execution.statusOf(step.name());
            if (status == StepStatus.PENDING) {
                execution.skip(step.name());
            } else if (status == StepStatus.RUNNING) {
                execution.fail(step.name(), new ErrorDetail(step.name(), kind, message));
            }
        }
    }

    private void publish(String event, WorkflowExecution execution, WorkflowStatus status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", event);
        payload.put("workflowId", execution.getWorkflowId());
        payload.put("executionId", execution.getExecutionId());
        payload.put("correlationId", execution.getCorrelationId().getValue());
        if (status != null) {
            payload.put("status", status.name());
        }
        bus.publish(MessageBus.WORKFLOW_EVENTS_TOPIC,
            Message.event(MessageBus.WORKFLOW_EVENTS_TOPIC, config.sender(), payload));
    }

    private static Fail<StepOutput> cancelled(CancellationSignal signal) {
        return Fail.of(ErrorKind.CANCELLED, "Workflow cancelled: " + signal.reason());
    }

    private enum DependencyState {
        READY,
        WAITING,
        BLOCKED
    }

    private record Attempt(StepOutput output, String agent, Fail<StepOutput> fail) {

        static Attempt success(StepOutput output, String agent) {
            return new Attempt(output, agent, null);
        }

        static Attempt failure(Fail<StepOutput> fail) {
            return new Attempt(null, null, fail);
        }

        boolean failed() {
            return fail != null;
        }
    }

    private static final class StepThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "finfind-step-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
