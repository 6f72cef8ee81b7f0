package com.ryuqq.finfind.core.protocol;

/**
 * 메시지 우선순위.
 *
 * <p>같은 토픽에 대기 중인 요청은 CRITICAL → HIGH → NORMAL → LOW 순으로 처리되며,
 * 같은 우선순위끼리는 도착 순서(FIFO)를 따릅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Priority {

    LOW(0),
    NORMAL(1),
    HIGH(2),
    CRITICAL(3);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    /**
     * 정렬용 순위 (클수록 먼저 처리).
     *
     * @return 순위
     */
    public int rank() {
        return rank;
    }
}
