package com.ryuqq.finfind.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StepTransition 상태 전이 규칙 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StepTransitionTest {

    @Test
    void transition_PendingToRunning_Allowed() {
        assertThat(StepTransition.transition(StepStatus.PENDING, StepStatus.RUNNING)).isEqualTo(StepStatus.RUNNING);
    }

    @Test
    void transition_PendingToSkipped_Allowed() {
        assertThat(StepTransition.transition(StepStatus.PENDING, StepStatus.SKIPPED)).isEqualTo(StepStatus.SKIPPED);
    }

    @Test
    void transition_RunningToCompletedOrFailed_Allowed() {
        assertThat(StepTransition.transition(StepStatus.RUNNING, StepStatus.COMPLETED)).isEqualTo(StepStatus.COMPLETED);
        assertThat(StepTransition.transition(StepStatus.RUNNING, StepStatus.FAILED)).isEqualTo(StepStatus.FAILED);
    }

    @Test
    void transition_PendingToCompleted_Rejected() {
        assertThatThrownBy(() -> StepTransition.transition(StepStatus.PENDING, StepStatus.COMPLETED))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Invalid state transition");
    }

    @Test
    void transition_RunningToSkipped_Rejected() {
        assertThatThrownBy(() -> StepTransition.transition(StepStatus.RUNNING, StepStatus.SKIPPED))
            .isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest
    @EnumSource(value = StepStatus.class, names = {"COMPLETED", "FAILED", "SKIPPED"})
    void transition_FromTerminal_Rejected(StepStatus terminal) {
        assertThatThrownBy(() -> StepTransition.transition(terminal, StepStatus.RUNNING))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("terminal state");
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> StepTransition.validate(null, StepStatus.RUNNING))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
