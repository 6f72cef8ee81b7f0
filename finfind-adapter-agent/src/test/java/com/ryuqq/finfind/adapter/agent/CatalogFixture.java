package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.adapter.inmemory.vector.InMemoryVectorStore;
import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.retrieval.Embedding;
import com.ryuqq.finfind.core.retrieval.Point;
import com.ryuqq.finfind.core.spi.EmbeddingClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small three-dimensional product catalog shared by the agent tests.
 *
 * <p>Axis x = shoes, y = hats, z = camping. The embedding stub maps query text onto the same axes.</p>
 */
final class CatalogFixture {

    static final String PRODUCTS = "products";

    private CatalogFixture() {
    }

    static InMemoryVectorStore catalog() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.createCollection(PRODUCTS, 3);
        store.upsert(PRODUCTS, List.of(
            product("shoe-1", "Trail Runner", "running", 120, 4.5, 1.0f, 0.0f, 0.0f),
            product("shoe-2", "Road Runner", "running", 90, 4.0, 0.95f, 0.05f, 0.0f),
            product("shoe-3", "Budget Jogger", "running", 60, 3.5, 0.9f, 0.1f, 0.0f),
            product("hat-1", "Sun Hat", "hats", 20, 4.8, 0.0f, 1.0f, 0.0f),
            product("tent-1", "Dome Tent", "camping", 300, 4.2, 0.0f, 0.0f, 1.0f)
        ));
        return store;
    }

    static EmbeddingClient embeddings() {
        return new EmbeddingClient() {
            @Override
            public Embedding embed(String text) {
                String lower = text.toLowerCase();
                if (lower.contains("shoe") || lower.contains("run")) {
                    return Embedding.of(1.0f, 0.0f, 0.0f);
                }
                if (lower.contains("hat")) {
                    return Embedding.of(0.0f, 1.0f, 0.0f);
                }
                return Embedding.of(0.0f, 0.0f, 1.0f);
            }

            @Override
            public int dimension() {
                return 3;
            }
        };
    }

    static ProductHit hit(String id, double score, double price, double rating) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", id.toUpperCase());
        attributes.put("price", price);
        attributes.put("rating_avg", rating);
        return new ProductHit(id, score, attributes);
    }

    static StepRequest request(Capability capability, String query, Double budgetMax) {
        return new StepRequest(capability, query, "user-1", budgetMax, Map.of(), List.of(), null);
    }

    private static Point product(String id, String name, String category, double price, double rating,
                                 float x, float y, float z) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        payload.put("category", category);
        payload.put("price", price);
        payload.put("rating_avg", rating);
        return new Point(id, Embedding.of(x, y, z), payload);
    }
}
