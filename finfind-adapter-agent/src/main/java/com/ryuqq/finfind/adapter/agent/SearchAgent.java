package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.SearchCapability;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.AgentCard;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.protocol.CapabilityDescriptor;
import com.ryuqq.finfind.core.retrieval.FieldCondition;
import com.ryuqq.finfind.core.retrieval.FilterCompiler;
import com.ryuqq.finfind.core.retrieval.PayloadFilter;
import com.ryuqq.finfind.core.retrieval.RetrievalEngine;
import com.ryuqq.finfind.core.retrieval.RetrievalQuery;
import com.ryuqq.finfind.core.spi.EmbeddingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Product search agent.
 *
 * <p>Embeds the query, compiles the request filters and runs an MMR search so the result
 * list is relevant but not a row of near-duplicates. When the request has a budget and no
 * explicit {@code price} filter, results are capped at {@code budget × (1 + budgetTolerance)}
 * so that slightly-over-budget items stay visible to the alternatives step.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SearchAgent extends AbstractRetrievalAgent implements SearchCapability {

    public static final String NAME = "search-agent";
    public static final String TOPIC = "agent.search";

    private static final Logger log = LoggerFactory.getLogger(SearchAgent.class);

    private static final AgentCard CARD = new AgentCard(NAME, TOPIC, List.of(
        new CapabilityDescriptor(Capability.SEARCH, StepRequest.class, StepOutput.class)
    ));

    private final FilterCompiler filters;

    public SearchAgent(RetrievalEngine engine, EmbeddingClient embeddings, FilterCompiler filters, AgentConfig config) {
        super(engine, embeddings, config);
        if (filters == null) {
            throw new IllegalArgumentException("filters cannot be null");
        }
        this.filters = filters;
    }

    @Override
    public AgentCard card() {
        return CARD;
    }

    @Override
    public Result<StepOutput> search(StepRequest request) {
        PayloadFilter filter = filters.compile(request.filters());
        Double budget = budgetOf(request);
        if (budget != null && !request.filters().containsKey("price")) {
            double ceiling = budget * (1.0 + config.budgetTolerance());
            filter = filter.and(new FieldCondition.Range("price", null, null, ceiling, null));
        }

        RetrievalQuery query = new RetrievalQuery(config.productsCollection(), embedQuery(request),
            config.searchLimit(), config.scoreThreshold(), filter, config.searchDiversity(), null, null);
        List<ProductHit> hits = toHits(engine.mmrSearch(query));

        log.debug("Search '{}' returned {} products (filter: {})", request.query(), hits.size(), filter);
        return Result.ok(StepOutput.ofProducts(hits, "Found " + hits.size() + " products for '" + request.query() + "'"));
    }
}
