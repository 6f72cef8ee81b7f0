package com.ryuqq.finfind.testkit.contract;

import com.ryuqq.finfind.core.retrieval.Embedding;
import com.ryuqq.finfind.core.spi.EmbeddingClient;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic keyword embedding for contract tests.
 *
 * <p>Each registered keyword owns one axis. A text is embedded as the sum of the axes of every
 * keyword it contains; text matching no keyword maps to the uniform vector, which is equally
 * (and weakly) similar to every axis.</p>
 *
 * <pre>
 * FakeEmbeddingClient embeddings = new FakeEmbeddingClient(3, Map.of("shoe", 0, "hat", 1, "tent", 2));
 * embeddings.embed("trail shoe");   // (1, 0, 0)
 * embeddings.embed("hat and tent"); // (0, 1, 1)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FakeEmbeddingClient implements EmbeddingClient {

    private final int dimension;
    private final Map<String, Integer> keywordAxes;
    private final AtomicInteger calls = new AtomicInteger();

    /**
     * Creates the client.
     *
     * @param dimension vector dimension
     * @param keywordAxes lower-case keyword to axis index
     * @throws IllegalArgumentException if an axis is outside the dimension
     */
    public FakeEmbeddingClient(int dimension, Map<String, Integer> keywordAxes) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive (current: " + dimension + ")");
        }
        if (keywordAxes == null) {
            throw new IllegalArgumentException("keywordAxes cannot be null");
        }
        for (Map.Entry<String, Integer> entry : keywordAxes.entrySet()) {
            if (entry.getValue() < 0 || entry.getValue() >= dimension) {
                throw new IllegalArgumentException(
                    "axis of '" + entry.getKey() + "' must be below " + dimension + " (current: " + entry.getValue() + ")"
                );
            }
        }
        this.dimension = dimension;
        this.keywordAxes = new LinkedHashMap<>(keywordAxes);
    }

    @Override
    public Embedding embed(String text) {
        calls.incrementAndGet();
        float[] values = new float[dimension];
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        boolean matched = false;
        for (Map.Entry<String, Integer> entry : keywordAxes.entrySet()) {
            if (lower.contains(entry.getKey())) {
                values[entry.getValue()] = 1.0f;
                matched = true;
            }
        }
        if (!matched) {
            Arrays.fill(values, 1.0f);
        }
        return Embedding.of(values);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    /**
     * Number of {@link #embed(String)} calls so far.
     *
     * @return call count
     */
    public int calls() {
        return calls.get();
    }
}
