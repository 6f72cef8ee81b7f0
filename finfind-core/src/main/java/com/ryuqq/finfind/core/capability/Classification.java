package com.ryuqq.finfind.core.capability;

/**
 * CLASSIFY 기능의 출력: 요청에 맞는 워크플로.
 *
 * @param workflowId 선택된 워크플로 ID
 * @param confidence 신뢰도 (0~1)
 * @param reason 선택 근거 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Classification(String workflowId, double confidence, String reason) {

    public Classification {
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workflowId cannot be null or blank");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0 (current: " + confidence + ")");
        }
    }
}
