package com.ryuqq.finfind.core.statemachine;

/**
 * 단계 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 단계의 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 단조 증가 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING</li>
 *   <li>PENDING → SKIPPED</li>
 *   <li>RUNNING → COMPLETED</li>
 *   <li>RUNNING → FAILED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepTransition {

    // Utility class - prevent instantiation
    private StepTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(StepStatus from, StepStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == StepStatus.RUNNING || to == StepStatus.SKIPPED;
            case RUNNING -> to == StepStatus.COMPLETED || to == StepStatus.FAILED;
            case COMPLETED, FAILED, SKIPPED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static StepStatus transition(StepStatus current, StepStatus next) {
        validate(current, next);
        return next;
    }
}
