package com.ryuqq.finfind.core.context;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 대화 한 건의 누적 턴.
 *
 * <p>요청이 끝날 때마다 {@link #append(Turn, int, Instant)}로 턴이 추가되고, 다음 요청의
 * {@link CompressedContext}는 이 턴들로 다시 구성됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>conversationId, userId: 공백 불가, 최대 {@value CompressedContext#MAX_IDENTITY_LENGTH}자</li>
 *   <li>updatedAt: null 불가</li>
 * </ul>
 *
 * @param conversationId 대화 ID
 * @param userId 대화를 시작한 사용자
 * @param turns 기록된 턴 (오래된 것부터)
 * @param updatedAt 마지막 접근 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Conversation(
    String conversationId,
    String userId,
    List<Turn> turns,
    Instant updatedAt
) {

    public Conversation {
        requireIdentity("conversationId", conversationId);
        requireIdentity("userId", userId);
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    /**
     * 턴이 없는 새 대화.
     *
     * @param conversationId 대화 ID
     * @param userId 사용자 ID
     * @param now 생성 시각
     * @return Conversation 인스턴스
     */
    public static Conversation start(String conversationId, String userId, Instant now) {
        return new Conversation(conversationId, userId, List.of(), now);
    }

    /**
     * 턴을 추가한 새 인스턴스 생성.
     *
     * @param turn 추가할 턴
     * @param maxTurns 유지할 최대 턴 수 (초과분은 오래된 것부터 제거)
     * @param now 접근 시각
     * @return 턴이 추가된 대화
     * @throws IllegalArgumentException turn이 null이거나 maxTurns가 양수가 아닌 경우
     */
    public Conversation append(Turn turn, int maxTurns, Instant now) {
        if (turn == null) {
            throw new IllegalArgumentException("turn cannot be null");
        }
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be positive (current: " + maxTurns + ")");
        }
        List<Turn> updated = new ArrayList<>(turns);
        updated.add(turn);
        if (updated.size() > maxTurns) {
            updated = updated.subList(updated.size() - maxTurns, updated.size());
        }
        return new Conversation(conversationId, userId, updated, now);
    }

    public Conversation touch(Instant now) {
        return new Conversation(conversationId, userId, turns, now);
    }

    public boolean belongsTo(String userId) {
        return this.userId.equals(userId);
    }

    /**
     * 직전 턴에서 반환된 상품 ID.
     *
     * @return 마지막 턴의 상품 ID (턴이 없으면 빈 목록)
     */
    public List<String> lastProductIds() {
        return turns.isEmpty() ? List.of() : turns.get(turns.size() - 1).productIds();
    }

    private static void requireIdentity(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be null or blank");
        }
        if (value.length() > CompressedContext.MAX_IDENTITY_LENGTH) {
            throw new IllegalArgumentException(field + " length cannot exceed " + CompressedContext.MAX_IDENTITY_LENGTH
                + " characters (current: " + value.length() + ")");
        }
    }
}
