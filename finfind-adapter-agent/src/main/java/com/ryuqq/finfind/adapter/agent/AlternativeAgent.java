package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.core.capability.AlternativeCapability;
import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.AgentCard;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.protocol.CapabilityDescriptor;
import com.ryuqq.finfind.core.retrieval.FieldCondition;
import com.ryuqq.finfind.core.retrieval.PayloadFilter;
import com.ryuqq.finfind.core.retrieval.Recommendation;
import com.ryuqq.finfind.core.retrieval.RetrievalEngine;
import com.ryuqq.finfind.core.retrieval.RetrievalQuery;
import com.ryuqq.finfind.core.retrieval.RetrievalResult;
import com.ryuqq.finfind.core.spi.EmbeddingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Budget alternatives agent.
 *
 * <p>For every input product that is over budget (every input product when there is no budget),
 * looks for similar products that cost less: example-based recommendation seeded with the product,
 * restricted to {@code price <= budget} (or {@code price < product price} without a budget) and to a
 * minimum similarity. Input products are never proposed as their own alternatives.</p>
 *
 * <p>Without input products the query itself is searched under the budget.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AlternativeAgent extends AbstractRetrievalAgent implements AlternativeCapability {

    public static final String NAME = "alternative-agent";
    public static final String TOPIC = "agent.alternative";

    private static final Logger log = LoggerFactory.getLogger(AlternativeAgent.class);

    private static final AgentCard CARD = new AgentCard(NAME, TOPIC, List.of(
        new CapabilityDescriptor(Capability.ALTERNATIVE, StepRequest.class, StepOutput.class)
    ));

    public AlternativeAgent(RetrievalEngine engine, EmbeddingClient embeddings, AgentConfig config) {
        super(engine, embeddings, config);
    }

    @Override
    public AgentCard card() {
        return CARD;
    }

    @Override
    public Result<StepOutput> findAlternatives(StepRequest request) {
        Double budget = budgetOf(request);
        if (request.products().isEmpty()) {
            return Result.ok(alternativesForQuery(request, budget));
        }

        Set<String> inputIds = request.products().stream().map(ProductHit::id).collect(Collectors.toSet());
        Map<String, ProductHit> alternatives = new LinkedHashMap<>();
        Map<String, String> explanations = new LinkedHashMap<>();
        for (ProductHit product : request.products()) {
            Double price = product.priceOrNull();
            if (budget != null && (price == null || price <= budget)) {
                continue;
            }
            FieldCondition.Range cheaper = budget != null
                ? new FieldCondition.Range("price", null, null, budget, null)
                : price == null ? null : new FieldCondition.Range("price", null, null, null, price);
            if (cheaper == null) {
                continue;
            }

            RetrievalQuery query = RetrievalQuery.recommend(config.productsCollection(), List.of(product.id()), null,
                    config.alternativesPerProduct())
                .withFilter(PayloadFilter.empty().and(cheaper).excludingIds(inputIds))
                .withScoreThreshold(config.minAlternativeSimilarity());
            Recommendation recommendation = engine.recommend(query);
            if (recommendation.hasRejections()) {
                log.debug("Product {} has no vector in {}, skipping", product.id(), config.productsCollection());
            }
            for (RetrievalResult result : recommendation.results()) {
                if (alternatives.putIfAbsent(result.id(), ProductHit.from(result)) == null) {
                    explanations.put(result.id(), "Lower-priced alternative to " + labelOf(product));
                }
            }
        }

        log.debug("Found {} alternatives for {} products (budget: {})", alternatives.size(), inputIds.size(), budget);
        return Result.ok(new StepOutput(List.of(), explanations, new ArrayList<>(alternatives.values()),
            "Found " + alternatives.size() + " alternatives"));
    }

    private StepOutput alternativesForQuery(StepRequest request, Double budget) {
        if (budget == null) {
            return new StepOutput(List.of(), Map.of(), List.of(), "No products or budget to find alternatives for");
        }
        RetrievalQuery query = RetrievalQuery.of(config.productsCollection(), embedQuery(request), config.alternativesPerProduct())
            .withFilter(PayloadFilter.empty().and(new FieldCondition.Range("price", null, null, budget, null)))
            .withScoreThreshold(config.minAlternativeSimilarity());
        List<ProductHit> hits = toHits(engine.semanticSearch(query));
        return new StepOutput(List.of(), Map.of(), hits, "Found " + hits.size() + " products within budget");
    }
}
