package com.ryuqq.finfind.adapter.runner;

import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.workflow.WorkflowResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 완료된 Step 출력 병합기.
 *
 * <p><strong>병합 규칙:</strong></p>
 * <ul>
 *   <li>상품: ID 기준 중복 제거 (가장 높은 점수 유지), 점수 내림차순, 동점은 처음 등장한 순서</li>
 *   <li>설명: Step 정의 순서로 덮어쓰기 (나중 Step 우선), 다른 내용으로 덮어쓰면 경고 추가</li>
 *   <li>대안 상품: ID 기준 중복 제거 (가장 높은 점수 유지)</li>
 *   <li>요약: null이 아닌 Step 요약을 공백으로 연결</li>
 * </ul>
 *
 * <p>충돌 경고는 로그로 남기지 않고 {@link Aggregation#warnings()}로만 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResultAggregator {

    /**
     * 워크플로 결과 병합.
     *
     * @param result 종료된 워크플로 결과
     * @return 병합 결과
     * @throws IllegalArgumentException result가 null인 경우
     */
    public Aggregation aggregate(WorkflowResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }

        Map<String, ProductHit> products = new LinkedHashMap<>();
        Map<String, ProductHit> alternatives = new LinkedHashMap<>();
        Map<String, String> explanations = new LinkedHashMap<>();
        Map<String, String> explainedBy = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        List<String> summaries = new ArrayList<>();

        for (Map.Entry<String, StepOutput> entry : result.stepOutputs().entrySet()) {
            String step = entry.getKey();
            StepOutput output = entry.getValue();
            output.products().forEach(product -> keepHighest(products, product));
            output.alternatives().forEach(product -> keepHighest(alternatives, product));

            for (Map.Entry<String, String> explanation : output.explanations().entrySet()) {
                String productId = explanation.getKey();
                String previous = explanations.put(productId, explanation.getValue());
                if (previous != null && !Objects.equals(previous, explanation.getValue())) {
                    String warning = ErrorKind.AGGREGATION_CONFLICT + ": explanation for " + productId
                        + " from step " + explainedBy.get(productId) + " replaced by step " + step;
                    warnings.add(warning);
                }
                explainedBy.put(productId, step);
            }

            if (output.summary() != null && !output.summary().isBlank()) {
                summaries.add(output.summary());
            }
        }

        return new Aggregation(
            ranked(products),
            explanations,
            ranked(alternatives),
            warnings,
            String.join(" ", summaries)
        );
    }

    private static void keepHighest(Map<String, ProductHit> merged, ProductHit product) {
        ProductHit existing = merged.get(product.id());
        if (existing == null || product.score() > existing.score()) {
            merged.put(product.id(), product);
        }
    }

    private static List<ProductHit> ranked(Map<String, ProductHit> merged) {
        // 안정 정렬이므로 동점은 처음 등장한 순서 유지
        List<ProductHit> ranked = new ArrayList<>(merged.values());
        ranked.sort(Comparator.comparingDouble(ProductHit::score).reversed());
        return ranked;
    }

    /**
     * 병합 결과.
     *
     * @param products 병합된 상품
     * @param explanations 상품 ID → 설명
     * @param alternatives 병합된 대안 상품
     * @param warnings 병합 중 발생한 경고
     * @param output 요약 문장
     */
    public record Aggregation(
        List<ProductHit> products,
        Map<String, String> explanations,
        List<ProductHit> alternatives,
        List<String> warnings,
        String output
    ) {

        public Aggregation {
            products = List.copyOf(products);
            explanations = Collections.unmodifiableMap(new LinkedHashMap<>(explanations));
            alternatives = List.copyOf(alternatives);
            warnings = List.copyOf(warnings);
        }

        /**
         * 실행 기록용 단계 출력 형태로 변환.
         *
         * @return 상품, 설명, 대안, 요약을 담은 StepOutput
         */
        public StepOutput toStepOutput() {
            return new StepOutput(products, explanations, alternatives, output);
        }
    }
}
