package com.ryuqq.finfind.core.spi;

import com.ryuqq.finfind.core.retrieval.Embedding;

/**
 * Text embedding SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EmbeddingClient {

    /**
     * Embeds text into a vector of {@link #dimension()} components.
     *
     * @param text text to embed
     * @return embedding
     */
    Embedding embed(String text);

    /**
     * Fixed vector length produced by this client.
     *
     * @return dimension
     */
    int dimension();
}
