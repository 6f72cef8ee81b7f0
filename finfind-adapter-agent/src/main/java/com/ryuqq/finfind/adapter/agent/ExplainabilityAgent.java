package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.core.capability.Agent;
import com.ryuqq.finfind.core.capability.ExplainCapability;
import com.ryuqq.finfind.core.capability.ProductHit;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.exception.LlmException;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.AgentCard;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.protocol.CapabilityDescriptor;
import com.ryuqq.finfind.core.spi.LlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Explanation agent.
 *
 * <p>Builds a list of factual factors per product (relevance, price against budget, rating).
 * With an {@link LlmClient} the factors are turned into one sentence by the model; without one,
 * or when the model fails or answers with a tool call, the factors are joined as the explanation.
 * A failing model therefore degrades the wording, never the step.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ExplainabilityAgent implements Agent, ExplainCapability {

    public static final String NAME = "explainability-agent";
    public static final String TOPIC = "agent.explainability";

    private static final Logger log = LoggerFactory.getLogger(ExplainabilityAgent.class);

    private static final AgentCard CARD = new AgentCard(NAME, TOPIC, List.of(
        new CapabilityDescriptor(Capability.EXPLAIN, StepRequest.class, StepOutput.class)
    ));

    private final LlmClient llm;
    private final AgentConfig config;

    /**
     * Creates an agent producing factor-list explanations only.
     *
     * @param config agent configuration
     */
    public ExplainabilityAgent(AgentConfig config) {
        this(null, config);
    }

    /**
     * Creates an agent phrasing explanations through the LLM.
     *
     * @param llm LLM client, {@code null} for factor lists only
     * @param config agent configuration
     */
    public ExplainabilityAgent(LlmClient llm, AgentConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.llm = llm;
        this.config = config;
    }

    @Override
    public AgentCard card() {
        return CARD;
    }

    @Override
    public Result<StepOutput> explain(StepRequest request) {
        Double budget = AbstractRetrievalAgent.budgetOf(request);
        List<ProductHit> products = request.products();
        int count = Math.min(config.maxExplanations(), products.size());

        Map<String, String> explanations = new LinkedHashMap<>();
        for (ProductHit product : products.subList(0, count)) {
            List<String> factors = factorsOf(product, budget);
            explanations.put(product.id(), phrase(request.query(), product, factors));
        }
        return Result.ok(new StepOutput(List.of(), explanations, List.of(),
            "Explained " + explanations.size() + " of " + products.size() + " products"));
    }

    static List<String> factorsOf(ProductHit product, Double budget) {
        List<String> factors = new ArrayList<>();
        factors.add(String.format(Locale.ROOT, "Matches your request with %d%% relevance", Math.round(product.score() * 100)));

        Double price = product.priceOrNull();
        if (price != null && budget != null) {
            if (price <= budget) {
                factors.add(String.format(Locale.ROOT, "Fits your budget ($%.2f of $%.2f)", price, budget));
            } else {
                factors.add(String.format(Locale.ROOT, "Exceeds your budget by $%.2f", price - budget));
            }
        } else if (price != null) {
            factors.add(String.format(Locale.ROOT, "Priced at $%.2f", price));
        }

        Object rating = product.attributes().get("rating_avg");
        if (rating instanceof Number number) {
            factors.add(String.format(Locale.ROOT, "Rated %.1f/5", number.doubleValue()));
        }
        return factors;
    }

    private String phrase(String query, ProductHit product, List<String> factors) {
        String fallback = String.join("; ", factors);
        if (llm == null) {
            return fallback;
        }
        String prompt = "Explain in one sentence why this product fits the request.\n"
            + "Request: " + (query == null ? "" : query) + "\n"
            + "Product: " + AbstractRetrievalAgent.labelOf(product) + "\n"
            + "Facts: " + fallback;
        try {
            LlmClient.Completion completion = llm.complete(prompt, List.of());
            if (completion instanceof LlmClient.Completion.Text text && !text.text().isBlank()) {
                return text.text().strip();
            }
            log.debug("LLM gave no text for {}, using factor list", product.id());
        } catch (LlmException e) {
            log.warn("LLM explanation failed for {} ({}), using factor list", product.id(), e.reason());
        }
        return fallback;
    }
}
