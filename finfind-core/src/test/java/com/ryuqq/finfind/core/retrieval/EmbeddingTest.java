package com.ryuqq.finfind.core.retrieval;

import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingTest {

    @Test
    void cosine_OrthogonalAndParallel() {
        Embedding x = Embedding.of(1f, 0f);

        assertThat(x.cosine(Embedding.of(0f, 2f))).isCloseTo(0.0, Offset.offset(1e-9));
        assertThat(x.cosine(Embedding.of(3f, 0f))).isCloseTo(1.0, Offset.offset(1e-9));
        assertThat(x.cosine(Embedding.of(0f, 0f))).isZero();
    }

    @Test
    void cosine_DimensionMismatch_Rejected() {
        assertThatThrownBy(() -> Embedding.of(1f, 0f).cosine(Embedding.of(1f, 0f, 0f)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dimension mismatch");
    }

    @Test
    void centroidMinusWeightedNegative() {
        Embedding centroid = Embedding.centroid(List.of(Embedding.of(1f, 0f), Embedding.of(0f, 1f)));
        Embedding target = centroid.minus(Embedding.of(1f, 1f), 0.3);

        assertThat(centroid.toArray()).containsExactly(0.5f, 0.5f);
        assertThat(target.get(0)).isCloseTo(0.2f, Offset.offset(1e-6f));
    }

    @Test
    void of_NonFinite_Rejected() {
        assertThatThrownBy(() -> Embedding.of(Float.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
