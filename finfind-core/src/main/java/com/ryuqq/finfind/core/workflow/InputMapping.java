package com.ryuqq.finfind.core.workflow;

/**
 * 단계가 원본 요청과 이전 단계 출력에서 무엇을 받을지 지정.
 *
 * <ul>
 *   <li>QUERY: 질의, 예산, 필터</li>
 *   <li>USER: 사용자 ID</li>
 *   <li>PRODUCTS_FROM(step): 해당 단계가 반환한 상품</li>
 *   <li>ALL_PRODUCTS: 지금까지 완료된 모든 단계의 상품 (ID 기준 중복 제거)</li>
 * </ul>
 *
 * @param source 입력 출처
 * @param step PRODUCTS_FROM인 경우 대상 단계 이름, 그 외에는 null
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InputMapping(Source source, String step) {

    /**
     * 입력 출처.
     */
    public enum Source {
        QUERY,
        USER,
        PRODUCTS_FROM,
        ALL_PRODUCTS
    }

    public InputMapping {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (source == Source.PRODUCTS_FROM && (step == null || step.isBlank())) {
            throw new IllegalArgumentException("PRODUCTS_FROM requires a step name");
        }
        if (source != Source.PRODUCTS_FROM && step != null) {
            throw new IllegalArgumentException(source + " cannot name a step");
        }
    }

    public static InputMapping query() {
        return new InputMapping(Source.QUERY, null);
    }

    public static InputMapping user() {
        return new InputMapping(Source.USER, null);
    }

    public static InputMapping productsFrom(String step) {
        return new InputMapping(Source.PRODUCTS_FROM, step);
    }

    public static InputMapping allProducts() {
        return new InputMapping(Source.ALL_PRODUCTS, null);
    }
}
