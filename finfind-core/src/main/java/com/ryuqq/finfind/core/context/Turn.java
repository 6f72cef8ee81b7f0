package com.ryuqq.finfind.core.context;

import java.util.List;

/**
 * 이전 대화 턴 한 개.
 *
 * <p>요약된 턴은 질의가 짧게 잘리고 상품 ID 목록이 제거된 형태입니다.</p>
 *
 * @param query 사용자 질의
 * @param intent 해당 턴에서 선택된 워크플로 (null 가능)
 * @param productIds 해당 턴에서 반환된 상품 ID
 * @param summarized 요약 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Turn(
    String query,
    String intent,
    List<String> productIds,
    boolean summarized
) {

    /** 요약 시 유지하는 질의 최대 길이. */
    public static final int SUMMARY_QUERY_LENGTH = 40;

    public Turn {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        productIds = productIds == null ? List.of() : List.copyOf(productIds);
    }

    /**
     * 요약되지 않은 턴 생성.
     *
     * @param query 사용자 질의
     * @param intent 선택된 워크플로
     * @param productIds 반환된 상품 ID
     * @return Turn 인스턴스
     */
    public static Turn of(String query, String intent, List<String> productIds) {
        return new Turn(query, intent, productIds, false);
    }

    /**
     * 요약된 턴 생성.
     *
     * <p>질의를 {@value #SUMMARY_QUERY_LENGTH}자로 자르고 상품 ID를 제거합니다.</p>
     *
     * @return 요약된 Turn
     */
    public Turn summarize() {
        return new Turn(truncate(query, SUMMARY_QUERY_LENGTH), intent, List.of(), true);
    }

    /**
     * 문자열을 최대 maxLength자로 자름.
     *
     * <p>잘리는 위치가 surrogate pair 사이면 한 글자 앞에서 자릅니다.</p>
     *
     * @param text 원본 문자열
     * @param maxLength 최대 길이 (UTF-16 char 단위)
     * @return 잘린 문자열
     */
    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
