package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.RecommendCapability;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.exception.UpstreamFailureException;
import com.ryuqq.finfind.core.exception.ValidationException;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.AgentCard;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.protocol.CapabilityDescriptor;
import com.ryuqq.finfind.core.retrieval.Point;
import com.ryuqq.finfind.core.retrieval.Recommendation;
import com.ryuqq.finfind.core.retrieval.RetrievalEngine;
import com.ryuqq.finfind.core.retrieval.RetrievalQuery;
import com.ryuqq.finfind.core.spi.EmbeddingClient;
import com.ryuqq.finfind.core.spi.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Personalized ranking agent.
 *
 * <p><strong>Candidates:</strong></p>
 * <ol>
 *   <li>products handed over by a previous step (personalizing search results)</li>
 *   <li>otherwise the products the user looked at in earlier turns, expanded with
 *       example-based recommendation</li>
 *   <li>otherwise a semantic search on the query</li>
 * </ol>
 *
 * <p><strong>Score:</strong> weighted mean of relevance (0.4), affordability (0.3) and rating (0.2),
 * taken over the components that are known for the product. The budget comes from the request,
 * then the compressed context, then the user's profile point ({@code budget_max}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecommendationAgent extends AbstractRetrievalAgent implements RecommendCapability {

    public static final String NAME = "recommendation-agent";
    public static final String TOPIC = "agent.recommendation";

    static final double RELEVANCE_WEIGHT = 0.4;
    static final double AFFORDABILITY_WEIGHT = 0.3;
    static final double RATING_WEIGHT = 0.2;

    private static final Logger log = LoggerFactory.getLogger(RecommendationAgent.class);

    private static final AgentCard CARD = new AgentCard(NAME, TOPIC, List.of(
        new CapabilityDescriptor(Capability.RECOMMEND, StepRequest.class, StepOutput.class)
    ));

    private final VectorStore store;

    public RecommendationAgent(RetrievalEngine engine, EmbeddingClient embeddings, VectorStore store, AgentConfig config) {
        super(engine, embeddings, config);
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public AgentCard card() {
        return CARD;
    }

    @Override
    public Result<StepOutput> recommend(StepRequest request) {
        List<ProductHit> candidates = candidatesFor(request);
        Double budget = budgetOf(request);
        if (budget == null) {
            budget = profileBudget(request.userId());
        }

        List<ProductHit> ranked = new ArrayList<>(candidates.size());
        for (ProductHit candidate : candidates) {
            ranked.add(candidate.withScore(score(candidate, budget)));
        }
        ranked.sort(Comparator.comparingDouble(ProductHit::score).reversed().thenComparing(ProductHit::id));
        List<ProductHit> top = List.copyOf(ranked.subList(0, Math.min(config.recommendationLimit(), ranked.size())));

        log.debug("Ranked {} of {} candidates for user {} (budget: {})", top.size(), candidates.size(), request.userId(), budget);
        return Result.ok(StepOutput.ofProducts(top, "Recommended " + top.size() + " products"));
    }

    private List<ProductHit> candidatesFor(StepRequest request) {
        if (!request.products().isEmpty()) {
            return request.products();
        }
        int poolSize = config.recommendationLimit() * 3;
        List<String> seen = request.context() == null ? List.of() : request.context().productIds();
        if (!seen.isEmpty()) {
            Recommendation recommendation = engine.recommend(
                RetrievalQuery.recommend(config.productsCollection(), seen, null, poolSize));
            if (recommendation.hasRejections()) {
                log.warn("Prior products no longer in {}: {}", config.productsCollection(), recommendation.rejectedIds());
            }
            if (!recommendation.results().isEmpty()) {
                return toHits(recommendation.results());
            }
        }
        if (request.query() == null || request.query().isBlank()) {
            throw new ValidationException("recommend requires products, prior product ids or a query");
        }
        RetrievalQuery query = RetrievalQuery.of(config.productsCollection(), embedQuery(request), poolSize)
            .withScoreThreshold(config.scoreThreshold());
        return toHits(engine.semanticSearch(query));
    }

    private Double profileBudget(String userId) {
        if (userId == null) {
            return null;
        }
        List<Point> profile;
        try {
            profile = store.retrieve(config.userProfilesCollection(), List.of(userId));
        } catch (UpstreamFailureException e) {
            log.warn("User profiles unavailable, ranking without profile: {}", e.getMessage());
            return null;
        }
        if (profile.isEmpty()) {
            return null;
        }
        Object budget = profile.get(0).payload().get("budget_max");
        return budget instanceof Number number ? number.doubleValue() : null;
    }

    static double score(ProductHit product, Double budget) {
        double total = RELEVANCE_WEIGHT * product.score();
        double weight = RELEVANCE_WEIGHT;

        Double price = product.priceOrNull();
        if (budget != null && price != null) {
            total += AFFORDABILITY_WEIGHT * affordability(price, budget);
            weight += AFFORDABILITY_WEIGHT;
        }
        Double rating = ratingOf(product);
        if (rating != null) {
            total += RATING_WEIGHT * Math.min(1.0, Math.max(0.0, rating / 5.0));
            weight += RATING_WEIGHT;
        }
        return Math.min(1.0, total / weight);
    }

    private static double affordability(double price, double budget) {
        if (price <= budget) {
            return 1.0;
        }
        if (budget <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - (price - budget) / budget);
    }

    private static Double ratingOf(ProductHit product) {
        Object rating = product.attributes().get("rating_avg");
        if (rating == null) {
            rating = product.attributes().get("rating");
        }
        return rating instanceof Number number ? number.doubleValue() : null;
    }
}
