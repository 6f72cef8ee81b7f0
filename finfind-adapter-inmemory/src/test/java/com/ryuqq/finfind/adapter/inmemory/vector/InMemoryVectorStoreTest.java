package com.ryuqq.finfind.adapter.inmemory.vector;

import com.ryuqq.finfind.core.exception.UpstreamFailureException;
import com.ryuqq.finfind.core.exception.ValidationException;
import com.ryuqq.finfind.core.retrieval.Embedding;
import com.ryuqq.finfind.core.retrieval.FilterCompiler;
import com.ryuqq.finfind.core.retrieval.PayloadFilter;
import com.ryuqq.finfind.core.retrieval.Point;
import com.ryuqq.finfind.core.retrieval.ScoredPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryVectorStore 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryVectorStoreTest {

    private static final String PRODUCTS = "products";

    private InMemoryVectorStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        store.createCollection(PRODUCTS, 3);
        store.upsert(PRODUCTS, List.of(
            point("p-1", 1.0f, 0.0f, 0.0f, "running", 120),
            point("p-2", 0.9f, 0.1f, 0.0f, "running", 80),
            point("p-3", 0.0f, 1.0f, 0.0f, "hiking", 60),
            point("p-4", 1.0f, 0.0f, 0.0f, "hiking", 200)
        ));
    }

    @Test
    void query_OrdersBySimilarityThenId() {
        // when
        List<ScoredPoint> hits = store.query(PRODUCTS, Embedding.of(1.0f, 0.0f, 0.0f), 3, null);

        // then
        assertThat(hits).extracting(ScoredPoint::id).containsExactly("p-1", "p-4", "p-2");
        assertThat(hits.get(0).similarity()).isEqualTo(hits.get(1).similarity());
    }

    @Test
    void query_WithFilter_ReturnsOnlyMatchingPoints() {
        // given
        PayloadFilter filter = FilterCompiler.forProducts().compile(Map.of(
            "category", "running",
            "price", Map.of("lte", 100)
        ));

        // when
        List<ScoredPoint> hits = store.query(PRODUCTS, Embedding.of(1.0f, 0.0f, 0.0f), 10, filter);

        // then
        assertThat(hits).extracting(ScoredPoint::id).containsExactly("p-2");
    }

    @Test
    void query_DimensionMismatch_ThrowsValidationException() {
        // when & then
        assertThatThrownBy(() -> store.query(PRODUCTS, Embedding.of(1.0f, 0.0f), 3, null))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void query_UnknownCollection_ThrowsUpstreamFailure() {
        // when & then
        assertThatThrownBy(() -> store.query("missing", Embedding.of(1.0f, 0.0f, 0.0f), 3, null))
            .isInstanceOf(UpstreamFailureException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void retrieve_KeepsRequestedOrderAndSkipsUnknownIds() {
        // when
        List<Point> points = store.retrieve(PRODUCTS, List.of("p-3", "zzz", "p-1"));

        // then
        assertThat(points).extracting(Point::id).containsExactly("p-3", "p-1");
    }

    @Test
    void scroll_ReturnsIdOrderedMatchesUpToLimit() {
        // given
        PayloadFilter hiking = FilterCompiler.forProducts().compile(Map.of("category", "hiking"));

        // when
        List<Point> all = store.scroll(PRODUCTS, null, 3);
        List<Point> filtered = store.scroll(PRODUCTS, hiking, 10);

        // then
        assertThat(all).extracting(Point::id).containsExactly("p-1", "p-2", "p-3");
        assertThat(filtered).extracting(Point::id).containsExactly("p-3", "p-4");
    }

    @Test
    void upsert_ExistingId_ReplacesPoint() {
        // when
        store.upsert(PRODUCTS, List.of(point("p-1", 0.0f, 0.0f, 1.0f, "swimming", 30)));

        // then
        assertThat(store.size(PRODUCTS)).isEqualTo(4);
        assertThat(store.retrieve(PRODUCTS, List.of("p-1")).get(0).payload()).containsEntry("category", "swimming");
    }

    @Test
    void createCollection_Duplicate_ThrowsException() {
        // when & then
        assertThatThrownBy(() -> store.createCollection(PRODUCTS, 3))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(PRODUCTS);
    }

    private static Point point(String id, float x, float y, float z, String category, int price) {
        return new Point(id, Embedding.of(x, y, z), Map.of("category", category, "price", price));
    }
}
