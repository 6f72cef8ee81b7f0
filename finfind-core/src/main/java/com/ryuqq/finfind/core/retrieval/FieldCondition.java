package com.ryuqq.finfind.core.retrieval;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 페이로드 필드 하나에 대한 조건.
 *
 * <p>필드 값이 목록이면 원소 중 하나라도 조건을 만족할 때 참입니다
 * ({@link NoneOf}는 어떤 원소도 집합에 속하지 않을 때 참).</p>
 *
 * <ul>
 *   <li>{@link Match}: 값이 같음</li>
 *   <li>{@link Range}: gte/gt/lte/lt 숫자 범위</li>
 *   <li>{@link AnyOf}: 값이 집합에 속함</li>
 *   <li>{@link NoneOf}: 값이 집합에 속하지 않음 (필드가 없어도 참)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface FieldCondition permits FieldCondition.Match, FieldCondition.Range,
    FieldCondition.AnyOf, FieldCondition.NoneOf {

    /**
     * 조건 대상 필드.
     *
     * @return 필드 이름
     */
    String field();

    /**
     * 페이로드가 조건을 만족하는지 확인.
     *
     * @param payload 점 페이로드
     * @return 만족하면 true
     */
    boolean test(Map<String, Object> payload);

    /**
     * 값 일치 조건.
     *
     * @param field 필드
     * @param value 기대 값
     */
    record Match(String field, Object value) implements FieldCondition {

        public Match {
            requireField(field);
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public boolean test(Map<String, Object> payload) {
            return anyElement(payload.get(field), actual -> sameValue(value, actual));
        }
    }

    /**
     * 숫자 범위 조건. 지정하지 않은 경계는 null.
     *
     * @param field 필드
     * @param gte 이상
     * @param gt 초과
     * @param lte 이하
     * @param lt 미만
     */
    record Range(String field, Double gte, Double gt, Double lte, Double lt) implements FieldCondition {

        public Range {
            requireField(field);
            if (gte == null && gt == null && lte == null && lt == null) {
                throw new IllegalArgumentException("range requires at least one bound");
            }
        }

        @Override
        public boolean test(Map<String, Object> payload) {
            return anyElement(payload.get(field), actual -> {
                if (!(actual instanceof Number number)) {
                    return false;
                }
                double v = number.doubleValue();
                return (gte == null || v >= gte)
                    && (gt == null || v > gt)
                    && (lte == null || v <= lte)
                    && (lt == null || v < lt);
            });
        }
    }

    /**
     * 집합 포함 조건.
     *
     * @param field 필드
     * @param values 허용 값
     */
    record AnyOf(String field, List<Object> values) implements FieldCondition {

        public AnyOf {
            requireField(field);
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("values cannot be null or empty");
            }
            values = List.copyOf(values);
        }

        @Override
        public boolean test(Map<String, Object> payload) {
            return anyElement(payload.get(field), actual -> containsValue(values, actual));
        }
    }

    /**
     * 집합 제외 조건.
     *
     * @param field 필드
     * @param values 금지 값
     */
    record NoneOf(String field, List<Object> values) implements FieldCondition {

        public NoneOf {
            requireField(field);
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("values cannot be null or empty");
            }
            values = List.copyOf(values);
        }

        @Override
        public boolean test(Map<String, Object> payload) {
            Object actual = payload.get(field);
            if (actual == null) {
                return true;
            }
            return !anyElement(actual, element -> containsValue(values, element));
        }
    }

    private static void requireField(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
    }

    private static boolean anyElement(Object actual, java.util.function.Predicate<Object> predicate) {
        if (actual == null) {
            return false;
        }
        if (actual instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null && predicate.test(element)) {
                    return true;
                }
            }
            return false;
        }
        return predicate.test(actual);
    }

    private static boolean containsValue(List<Object> values, Object actual) {
        for (Object value : values) {
            if (sameValue(value, actual)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameValue(Object expected, Object actual) {
        if (expected instanceof Number e && actual instanceof Number a) {
            return Double.compare(e.doubleValue(), a.doubleValue()) == 0;
        }
        return Objects.equals(expected, actual);
    }
}
