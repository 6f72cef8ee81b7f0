package com.ryuqq.finfind.core.workflow;

import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.model.CorrelationId;
import com.ryuqq.finfind.core.outcome.ErrorDetail;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.statemachine.StepStatus;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkflowExecution 상태 관리와 WorkflowResult 상태 결정 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkflowExecutionTest {

    private static final ErrorDetail TIMEOUT = new ErrorDetail("search", ErrorKind.UPSTREAM_TIMEOUT, "slow");

    @Test
    void start_AllStepsPending() {
        WorkflowExecution execution = WorkflowExecution.start(PredefinedWorkflows.FULL_PIPELINE, CorrelationId.generate());

        assertThat(execution.statuses()).hasSize(4).containsValue(StepStatus.PENDING);
        assertThat(execution.isTerminal()).isFalse();
    }

    @Test
    void finish_WithLiveSteps_Rejected() {
        WorkflowExecution execution = WorkflowExecution.start(PredefinedWorkflows.SEARCH_ONLY, CorrelationId.generate());
        execution.transition("search", StepStatus.RUNNING);

        assertThatThrownBy(execution::finish).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finish_RecordsAggregatedOutputOnce() {
        // given
        WorkflowExecution execution = WorkflowExecution.start(PredefinedWorkflows.SEARCH_ONLY, CorrelationId.generate());
        execution.transition("search", StepStatus.RUNNING);
        execution.complete("search", StepOutput.empty(), "search-agent");
        StepOutput merged = StepOutput.ofProducts(java.util.List.of(), "merged");

        // when
        execution.finish(merged);
        execution.finish(StepOutput.ofProducts(java.util.List.of(), "later"));

        // then
        assertThat(execution.getAggregatedOutput()).isEqualTo(merged);
        assertThat(execution.getFinishedAt()).isNotNull();
    }

    @Test
    void complete_FromPending_RejectedByStateMachine() {
        WorkflowExecution execution = WorkflowExecution.start(PredefinedWorkflows.SEARCH_ONLY, CorrelationId.generate());

        assertThatThrownBy(() -> execution.complete("search", StepOutput.empty(), "agent"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void result_AllRequiredCompleted_IsCompleted() {
        // given
        WorkflowExecution execution = WorkflowExecution.start(PredefinedWorkflows.SEARCH_RECOMMEND, CorrelationId.generate());
        execution.transition("search", StepStatus.RUNNING);
        execution.complete("search", StepOutput.empty(), "search-agent");
        execution.skip("recommend");
        execution.finish();

        // when
        WorkflowResult result = WorkflowResult.of(PredefinedWorkflows.SEARCH_RECOMMEND, execution);

        // then
        assertThat(result.status()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(result.skippedSteps()).containsExactly("recommend");
        assertThat(result.stepAgents()).containsEntry("search", "search-agent");
        assertThat(execution.getFinishedAt()).isNotNull();
    }

    @Test
    void result_SomeRequiredCompleted_IsPartial() {
        // given: custom workflow with two required steps
        WorkflowDefinition definition = new WorkflowDefinition("two", WorkflowType.CUSTOM, "Two", null,
            java.util.List.of(
                WorkflowStep.builder("search", com.ryuqq.finfind.core.protocol.Capability.SEARCH).build(),
                WorkflowStep.builder("explain", com.ryuqq.finfind.core.protocol.Capability.EXPLAIN).build()
            ));
        WorkflowExecution execution = WorkflowExecution.start(definition, CorrelationId.generate());
        execution.transition("search", StepStatus.RUNNING);
        execution.complete("search", StepOutput.empty(), "a");
        execution.transition("explain", StepStatus.RUNNING);
        execution.fail("explain", TIMEOUT);

        // when
        WorkflowResult result = WorkflowResult.of(definition, execution);

        // then
        assertThat(result.status()).isEqualTo(WorkflowStatus.PARTIAL);
        assertThat(result.failedSteps()).containsExactly("explain");
        assertThat(result.stepErrors()).containsKey("explain");
    }

    @Test
    void result_NoRequiredCompleted_IsFailed() {
        WorkflowExecution execution = WorkflowExecution.start(PredefinedWorkflows.SEARCH_ONLY, CorrelationId.generate());
        execution.transition("search", StepStatus.RUNNING);
        execution.fail("search", TIMEOUT);

        WorkflowResult result = WorkflowResult.of(PredefinedWorkflows.SEARCH_ONLY, execution);

        assertThat(result.status()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(result.stepOutputs()).isEmpty();
    }

    @Test
    void cancellationSignal_NotifiesListenersOnce() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        assertThat(signal.cancel("user abort")).isTrue();
        assertThat(signal.cancel("again")).isFalse();
        assertThat(calls).hasValue(1);
        assertThat(signal.reason()).isEqualTo("user abort");

        signal.onCancel(calls::incrementAndGet);
        assertThat(calls).hasValue(2);
    }
}
