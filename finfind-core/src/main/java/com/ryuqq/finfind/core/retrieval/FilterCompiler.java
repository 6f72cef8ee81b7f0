package com.ryuqq.finfind.core.retrieval;

import com.ryuqq.finfind.core.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 필드 → 조건 맵을 {@link PayloadFilter}로 컴파일.
 *
 * <p>모든 조건은 AND로 결합됩니다. 지원하는 조건 형태:</p>
 * <pre>
 * {"category": "laptops"}                          // 단순 값 = match
 * {"category": {"match": "laptops"}}
 * {"price": {"range": {"gte": 100, "lt": 500}}}
 * {"price": {"lte": 500}}                          // range 축약형
 * {"brand": {"any": ["acme", "globex"]}}
 * {"brand": {"none": ["initech"]}}
 * </pre>
 *
 * <p>스키마에 없는 필드, 알 수 없는 연산자, 타입이 맞지 않는 값은 무시하지 않고
 * {@link ValidationException}을 발생시킵니다. 결과가 0건인 필터는 유효합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FilterCompiler {

    private static final Set<String> RANGE_BOUNDS = Set.of("gte", "gt", "lte", "lt");

    private final Map<String, FieldType> schema;

    /**
     * 필드 스키마로 생성.
     *
     * @param schema 필드 이름 → 타입
     * @throws IllegalArgumentException schema가 null이거나 비어 있는 경우
     */
    public FilterCompiler(Map<String, FieldType> schema) {
        if (schema == null || schema.isEmpty()) {
            throw new IllegalArgumentException("schema cannot be null or empty");
        }
        this.schema = Collections.unmodifiableMap(new LinkedHashMap<>(schema));
    }

    /**
     * 상품 컬렉션 기본 스키마.
     *
     * @return 상품 필드 스키마로 구성된 FilterCompiler
     */
    public static FilterCompiler forProducts() {
        Map<String, FieldType> schema = new LinkedHashMap<>();
        schema.put("name", FieldType.KEYWORD);
        schema.put("category", FieldType.KEYWORD);
        schema.put("subcategory", FieldType.KEYWORD);
        schema.put("brand", FieldType.KEYWORD);
        schema.put("tags", FieldType.KEYWORD);
        schema.put("price", FieldType.NUMERIC);
        schema.put("rating", FieldType.NUMERIC);
        schema.put("rating_avg", FieldType.NUMERIC);
        schema.put("in_stock", FieldType.BOOLEAN);
        return new FilterCompiler(schema);
    }

    /**
     * 필터 맵 컴파일.
     *
     * @param filters 필드 → 조건 (null 또는 빈 맵이면 빈 필터)
     * @return 컴파일된 필터
     * @throws ValidationException 알 수 없는 필드/연산자 또는 잘못된 값
     */
    public PayloadFilter compile(Map<String, ?> filters) {
        if (filters == null || filters.isEmpty()) {
            return PayloadFilter.empty();
        }

        List<FieldCondition> conditions = new ArrayList<>();
        for (Map.Entry<String, ?> entry : filters.entrySet()) {
            String field = entry.getKey();
            FieldType type = schema.get(field);
            if (type == null) {
                throw new ValidationException("Unknown filter field: " + field);
            }
            compileField(field, type, entry.getValue(), conditions);
        }
        return PayloadFilter.of(conditions);
    }

    public Map<String, FieldType> getSchema() {
        return schema;
    }

    private void compileField(String field, FieldType type, Object constraint, List<FieldCondition> out) {
        if (constraint == null) {
            throw new ValidationException("Filter value for '" + field + "' cannot be null");
        }
        if (constraint instanceof Collection<?>) {
            throw new ValidationException("Filter '" + field + "' has a bare list; use 'any' or 'none'");
        }
        if (!(constraint instanceof Map<?, ?> operators)) {
            out.add(new FieldCondition.Match(field, requireType(field, type, constraint)));
            return;
        }
        if (operators.isEmpty()) {
            throw new ValidationException("Filter '" + field + "' has no operator");
        }

        Map<String, Object> shorthand = new LinkedHashMap<>();
        for (Map.Entry<?, ?> op : operators.entrySet()) {
            String name = String.valueOf(op.getKey());
            Object operand = op.getValue();
            switch (name) {
                case "match" -> out.add(new FieldCondition.Match(field, requireType(field, type, operand)));
                case "range" -> out.add(range(field, type, asMap(field, "range", operand)));
                case "any" -> out.add(new FieldCondition.AnyOf(field, asValues(field, type, "any", operand)));
                case "none" -> out.add(new FieldCondition.NoneOf(field, asValues(field, type, "none", operand)));
                case "gte", "gt", "lte", "lt" -> shorthand.put(name, operand);
                default -> throw new ValidationException("Unknown filter operator '" + name + "' on field " + field);
            }
        }
        if (!shorthand.isEmpty()) {
            out.add(range(field, type, shorthand));
        }
    }

    private FieldCondition.Range range(String field, FieldType type, Map<String, Object> bounds) {
        if (type != FieldType.NUMERIC) {
            throw new ValidationException("Range filter requires a numeric field: " + field);
        }
        if (bounds.isEmpty()) {
            throw new ValidationException("Range filter on '" + field + "' has no bound");
        }
        for (String bound : bounds.keySet()) {
            if (!RANGE_BOUNDS.contains(bound)) {
                throw new ValidationException("Unknown range bound '" + bound + "' on field " + field);
            }
        }
        return new FieldCondition.Range(
            field,
            number(field, bounds.get("gte")),
            number(field, bounds.get("gt")),
            number(field, bounds.get("lte")),
            number(field, bounds.get("lt"))
        );
    }

    private static Double number(String field, Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new ValidationException("Range bound on '" + field + "' must be numeric (current: " + value + ")");
        }
        return number.doubleValue();
    }

    private static Object requireType(String field, FieldType type, Object value) {
        if (value == null || !type.accepts(value)) {
            throw new ValidationException(
                "Filter value for '" + field + "' must be " + type + " (current: " + value + ")"
            );
        }
        return value;
    }

    private static Map<String, Object> asMap(String field, String operator, Object operand) {
        if (!(operand instanceof Map<?, ?> map)) {
            throw new ValidationException("'" + operator + "' on field " + field + " requires an object");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    private static List<Object> asValues(String field, FieldType type, String operator, Object operand) {
        if (!(operand instanceof Collection<?> values) || values.isEmpty()) {
            throw new ValidationException("'" + operator + "' on field " + field + " requires a non-empty list");
        }
        List<Object> checked = new ArrayList<>();
        for (Object value : values) {
            checked.add(requireType(field, type, value));
        }
        return checked;
    }
}
