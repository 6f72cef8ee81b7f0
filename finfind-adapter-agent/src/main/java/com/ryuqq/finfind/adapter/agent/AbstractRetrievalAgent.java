package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.core.capability.Agent;
import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.exception.ValidationException;
import com.ryuqq.finfind.core.retrieval.Embedding;
import com.ryuqq.finfind.core.retrieval.RetrievalEngine;
import com.ryuqq.finfind.core.retrieval.RetrievalResult;
import com.ryuqq.finfind.core.spi.EmbeddingClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for agents backed by the retrieval engine.
 *
 * <p>Holds the shared collaborators and the request helpers every retrieval agent needs:
 * query embedding, budget resolution and result conversion. Subclasses implement one or
 * more capability interfaces and publish their {@link com.ryuqq.finfind.core.protocol.AgentCard}.</p>
 *
 * <p>Capability methods may throw {@link com.ryuqq.finfind.core.exception.DiscoveryException}
 * subtypes; the bus endpoint converts them into {@code Fail} results.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractRetrievalAgent implements Agent {

    protected final RetrievalEngine engine;
    protected final EmbeddingClient embeddings;
    protected final AgentConfig config;

    protected AbstractRetrievalAgent(RetrievalEngine engine, EmbeddingClient embeddings, AgentConfig config) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (embeddings == null) {
            throw new IllegalArgumentException("embeddings cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.engine = engine;
        this.embeddings = embeddings;
        this.config = config;
    }

    /**
     * Embeds the request query.
     *
     * @throws ValidationException if the query is blank
     */
    protected Embedding embedQuery(StepRequest request) {
        String query = request.query();
        if (query == null || query.isBlank()) {
            throw new ValidationException(card().name() + " requires a non-blank query");
        }
        return embeddings.embed(query);
    }

    /**
     * Budget from the request, falling back to the one carried by the compressed context.
     */
    protected static Double budgetOf(StepRequest request) {
        if (request.budgetMax() != null) {
            return request.budgetMax();
        }
        return request.context() == null ? null : request.context().budgetMax();
    }

    protected static List<ProductHit> toHits(List<RetrievalResult> results) {
        List<ProductHit> hits = new ArrayList<>(results.size());
        for (RetrievalResult result : results) {
            hits.add(ProductHit.from(result));
        }
        return hits;
    }

    protected static String labelOf(ProductHit product) {
        Object name = product.attributes().get("name");
        return name == null ? product.id() : name.toString();
    }
}
