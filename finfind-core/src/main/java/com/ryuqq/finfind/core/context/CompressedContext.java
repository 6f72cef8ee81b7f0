package com.ryuqq.finfind.core.context;

import com.ryuqq.finfind.core.support.Payloads;

import java.util.List;

/**
 * REQUEST 메시지에 첨부되는 크기 제한 대화 컨텍스트.
 *
 * <p>에이전트가 이전 대화 내용을 참고할 수 있도록 직전 턴과 상품 ID를 담습니다.
 * 직렬화(JSON, UTF-8) 크기는 {@link ContextCompressor}가 설정된 바이트 예산 이하로 유지합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>userId, conversationId, intent: 최대 64자</li>
 *   <li>droppedTurns: 0 이상</li>
 *   <li>목록 필드는 null이면 빈 목록으로 대체</li>
 * </ul>
 *
 * @param userId 사용자 ID
 * @param conversationId 대화 ID (null 가능)
 * @param query 현재 질의
 * @param intent 선택된 워크플로 (null 가능)
 * @param budgetMax 사용자 예산 상한 (null 가능)
 * @param categories 관심 카테고리
 * @param productIds 이전 턴에서 본 상품 ID (오래된 것부터)
 * @param turns 이전 턴 (오래된 것부터)
 * @param droppedTurns 예산 초과로 제거된 턴 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CompressedContext(
    String userId,
    String conversationId,
    String query,
    String intent,
    Double budgetMax,
    List<String> categories,
    List<String> productIds,
    List<Turn> turns,
    int droppedTurns
) {

    /** 식별 필드 최대 길이. */
    public static final int MAX_IDENTITY_LENGTH = 64;

    public CompressedContext {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        checkLength("userId", userId);
        checkLength("conversationId", conversationId);
        checkLength("intent", intent);
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (droppedTurns < 0) {
            throw new IllegalArgumentException("droppedTurns cannot be negative (current: " + droppedTurns + ")");
        }
        categories = categories == null ? List.of() : List.copyOf(categories);
        productIds = productIds == null ? List.of() : List.copyOf(productIds);
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    /**
     * 최소 정보로 컨텍스트 생성.
     *
     * @param userId 사용자 ID
     * @param conversationId 대화 ID
     * @param query 현재 질의
     * @return CompressedContext 인스턴스
     */
    public static CompressedContext of(String userId, String conversationId, String query) {
        return new CompressedContext(userId, conversationId, query, null, null, List.of(), List.of(), List.of(), 0);
    }

    /**
     * 직렬화 크기 (JSON, UTF-8 바이트).
     *
     * @return 바이트 수
     */
    public int sizeInBytes() {
        return Payloads.sizeOf(this);
    }

    public CompressedContext withQuery(String query) {
        return new CompressedContext(userId, conversationId, query, intent, budgetMax, categories, productIds, turns, droppedTurns);
    }

    public CompressedContext withIntent(String intent) {
        return new CompressedContext(userId, conversationId, query, intent, budgetMax, categories, productIds, turns, droppedTurns);
    }

    public CompressedContext withBudgetMax(Double budgetMax) {
        return new CompressedContext(userId, conversationId, query, intent, budgetMax, categories, productIds, turns, droppedTurns);
    }

    public CompressedContext withCategories(List<String> categories) {
        return new CompressedContext(userId, conversationId, query, intent, budgetMax, categories, productIds, turns, droppedTurns);
    }

    public CompressedContext withProductIds(List<String> productIds) {
        return new CompressedContext(userId, conversationId, query, intent, budgetMax, categories, productIds, turns, droppedTurns);
    }

    public CompressedContext withTurns(List<Turn> turns) {
        return new CompressedContext(userId, conversationId, query, intent, budgetMax, categories, productIds, turns, droppedTurns);
    }

    /**
     * 가장 오래된 턴을 제거한 새 인스턴스 생성.
     *
     * @return droppedTurns가 1 증가한 컨텍스트
     * @throws IllegalStateException 제거할 턴이 없는 경우
     */
    public CompressedContext dropOldestTurn() {
        if (turns.isEmpty()) {
            throw new IllegalStateException("No turn to drop");
        }
        return new CompressedContext(userId, conversationId, query, intent, budgetMax, categories, productIds,
            turns.subList(1, turns.size()), droppedTurns + 1);
    }

    private static void checkLength(String field, String value) {
        if (value != null && value.length() > MAX_IDENTITY_LENGTH) {
            throw new IllegalArgumentException(
                field + " length cannot exceed " + MAX_IDENTITY_LENGTH + " characters (current: " + value.length() + ")"
            );
        }
    }
}
