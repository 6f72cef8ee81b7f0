package com.ryuqq.finfind.core.context;

import java.util.ArrayList;
import java.util.List;

/**
 * CompressedContext를 바이트 예산 이하로 줄이는 압축기.
 *
 * <p>직렬화 크기가 예산을 넘는 동안 아래 순서로 한 단계씩 줄입니다:</p>
 * <ol>
 *   <li>요약되지 않은 가장 오래된 턴을 요약</li>
 *   <li>모든 턴이 요약된 경우 가장 오래된 턴 제거 (droppedTurns 증가)</li>
 *   <li>가장 오래된 상품 ID 제거</li>
 *   <li>마지막 카테고리 제거</li>
 *   <li>현재 질의를 절반으로 자름 (surrogate pair는 나누지 않음)</li>
 * </ol>
 *
 * <p>예산 안에 들어오면 즉시 멈추므로 최근 정보가 가장 오래 유지됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ContextCompressor {

    /** 허용되는 최소 바이트 예산. */
    public static final int MIN_BYTE_BUDGET = 512;

    /** 기본 바이트 예산. */
    public static final int DEFAULT_BYTE_BUDGET = 4096;

    private final int byteBudget;

    /**
     * 기본 예산({@value #DEFAULT_BYTE_BUDGET} bytes)으로 생성.
     */
    public ContextCompressor() {
        this(DEFAULT_BYTE_BUDGET);
    }

    /**
     * 커스텀 예산으로 생성.
     *
     * @param byteBudget 최대 직렬화 크기 (bytes)
     * @throws IllegalArgumentException byteBudget이 {@value #MIN_BYTE_BUDGET}보다 작은 경우
     */
    public ContextCompressor(int byteBudget) {
        if (byteBudget < MIN_BYTE_BUDGET) {
            throw new IllegalArgumentException(
                "byteBudget must be >= " + MIN_BYTE_BUDGET + " (current: " + byteBudget + ")"
            );
        }
        this.byteBudget = byteBudget;
    }

    /**
     * 컨텍스트를 예산 이하로 압축.
     *
     * @param context 원본 컨텍스트
     * @return 예산 이하의 컨텍스트 (이미 예산 이하면 원본 그대로)
     * @throws IllegalArgumentException context가 null인 경우
     * @throws IllegalStateException 식별 필드만으로 예산을 초과하는 경우
     */
    public CompressedContext compress(CompressedContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        CompressedContext current = context;
        while (current.sizeInBytes() > byteBudget) {
            CompressedContext next = shrinkOnce(current);
            if (next == null) {
                throw new IllegalStateException(
                    "Context cannot fit in " + byteBudget + " bytes (current: " + current.sizeInBytes() + ")"
                );
            }
            current = next;
        }
        return current;
    }

    public int getByteBudget() {
        return byteBudget;
    }

    private CompressedContext shrinkOnce(CompressedContext context) {
        List<Turn> turns = context.turns();
        for (int i = 0; i < turns.size(); i++) {
            if (!turns.get(i).summarized()) {
                List<Turn> updated = new ArrayList<>(turns);
                updated.set(i, turns.get(i).summarize());
                return context.withTurns(updated);
            }
        }
        if (!turns.isEmpty()) {
            return context.dropOldestTurn();
        }

        List<String> productIds = context.productIds();
        if (!productIds.isEmpty()) {
            return context.withProductIds(productIds.subList(1, productIds.size()));
        }

        List<String> categories = context.categories();
        if (!categories.isEmpty()) {
            return context.withCategories(categories.subList(0, categories.size() - 1));
        }

        String query = context.query();
        if (!query.isEmpty()) {
            return context.withQuery(Turn.truncate(query, query.length() / 2));
        }
        return null;
    }
}
