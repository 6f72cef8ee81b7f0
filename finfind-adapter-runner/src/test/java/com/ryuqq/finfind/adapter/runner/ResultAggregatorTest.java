package com.ryuqq.finfind.adapter.runner;

import com.ryuqq.finfind.adapter.runner.ResultAggregator.Aggregation;
import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.workflow.WorkflowResult;
import com.ryuqq.finfind.core.workflow.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ryuqq.finfind.adapter.runner.StubAgent.product;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ResultAggregator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    @Test
    void aggregate_같은_상품은_가장_높은_점수로_한_번만_포함됨() {
        // given
        Map<String, StepOutput> outputs = new LinkedHashMap<>();
        outputs.put("search", StepOutput.ofProducts(List.of(product("a", 0.5, 10.0), product("b", 0.9, 20.0)), null));
        outputs.put("recommend", StepOutput.ofProducts(List.of(product("a", 0.8, 10.0), product("c", 0.1, 5.0)), null));

        // when
        Aggregation aggregation = aggregator.aggregate(result(outputs));

        // then
        assertThat(aggregation.products()).extracting(ProductHit::id).containsExactly("b", "a", "c");
        assertThat(aggregation.products()).extracting(ProductHit::score).containsExactly(0.9, 0.8, 0.1);
    }

    @Test
    void aggregate_동점이면_처음_등장한_순서를_유지함() {
        // given
        Map<String, StepOutput> outputs = new LinkedHashMap<>();
        outputs.put("search", StepOutput.ofProducts(List.of(product("z", 0.5, 10.0), product("y", 0.5, 10.0)), null));
        outputs.put("recommend", StepOutput.ofProducts(List.of(product("x", 0.5, 10.0)), null));

        // when
        Aggregation aggregation = aggregator.aggregate(result(outputs));

        // then
        assertThat(aggregation.products()).extracting(ProductHit::id).containsExactly("z", "y", "x");
    }

    @Test
    void aggregate_설명_충돌은_나중_Step이_우선하고_경고가_남음() {
        // given
        Map<String, StepOutput> outputs = new LinkedHashMap<>();
        outputs.put("recommend", new StepOutput(List.of(), Map.of("a", "cheap", "b", "popular"), List.of(), null));
        outputs.put("explain", new StepOutput(List.of(), Map.of("a", "matches your request", "b", "popular"), List.of(), null));

        // when
        Aggregation aggregation = aggregator.aggregate(result(outputs));

        // then
        assertThat(aggregation.explanations())
            .containsEntry("a", "matches your request")
            .containsEntry("b", "popular");
        assertThat(aggregation.warnings()).hasSize(1);
        assertThat(aggregation.warnings().get(0))
            .startsWith("AGGREGATION_CONFLICT")
            .contains("a")
            .contains("recommend")
            .contains("explain");
    }

    @Test
    void aggregate_대안_상품도_중복_제거됨() {
        // given
        Map<String, StepOutput> outputs = new LinkedHashMap<>();
        outputs.put("alternatives", new StepOutput(List.of(), Map.of(),
            List.of(product("alt-1", 0.6, 10.0), product("alt-1", 0.7, 10.0), product("alt-2", 0.65, 8.0)), null));

        // when
        Aggregation aggregation = aggregator.aggregate(result(outputs));

        // then
        assertThat(aggregation.alternatives()).extracting(ProductHit::id).containsExactly("alt-1", "alt-2");
        assertThat(aggregation.alternatives().get(0).score()).isEqualTo(0.7);
    }

    @Test
    void aggregate_요약은_Step_순서대로_연결됨() {
        // given
        Map<String, StepOutput> outputs = new LinkedHashMap<>();
        outputs.put("search", StepOutput.ofProducts(List.of(), "Found 3 products."));
        outputs.put("recommend", StepOutput.ofProducts(List.of(), null));
        outputs.put("explain", StepOutput.ofProducts(List.of(), "Explained 2 of 3 products."));

        // when
        Aggregation aggregation = aggregator.aggregate(result(outputs));

        // then
        assertThat(aggregation.output()).isEqualTo("Found 3 products. Explained 2 of 3 products.");
    }

    @Test
    void aggregate_출력이_없으면_빈_결과() {
        // when
        Aggregation aggregation = aggregator.aggregate(result(Map.of()));

        // then
        assertThat(aggregation.products()).isEmpty();
        assertThat(aggregation.explanations()).isEmpty();
        assertThat(aggregation.warnings()).isEmpty();
        assertThat(aggregation.output()).isEmpty();
    }

    @Test
    void aggregate_null이면_예외() {
        assertThatThrownBy(() -> aggregator.aggregate(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("result cannot be null");
    }

    private static WorkflowResult result(Map<String, StepOutput> outputs) {
        return new WorkflowResult("exec-1", "test_flow", WorkflowStatus.COMPLETED, outputs, List.of(), List.of(),
            Map.of(), Map.of());
    }
}
