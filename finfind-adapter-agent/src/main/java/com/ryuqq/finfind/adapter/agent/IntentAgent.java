package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.core.capability.Agent;
import com.ryuqq.finfind.core.capability.Classification;
import com.ryuqq.finfind.core.capability.ClassifyCapability;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.exception.LlmException;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.AgentCard;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.protocol.CapabilityDescriptor;
import com.ryuqq.finfind.core.spi.LlmClient;
import com.ryuqq.finfind.core.workflow.WorkflowDefinition;
import com.ryuqq.finfind.core.workflow.WorkflowRegistry;
import com.ryuqq.finfind.core.workflow.WorkflowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Intent classification agent.
 *
 * <p>Asks the LLM to call the {@value #TOOL_NAME} tool with one of the registered workflow ids.
 * A text answer, an unknown workflow id or an {@link LlmException} falls back to keyword rules:</p>
 *
 * <pre>
 * recommend, suggestion, for me, personalized       → search_recommend
 * why, explain, reason, how come                     → recommend_explain
 * alternative, instead, cheaper, similar to, like    → search_alternative
 * search, find, looking for, show me, where          → search_only
 * (no keyword, products seen in earlier turns)       → search_recommend
 * (otherwise)                                        → search_only
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class IntentAgent implements Agent, ClassifyCapability {

    public static final String NAME = "intent-agent";
    public static final String TOPIC = "agent.intent";
    public static final String TOOL_NAME = "select_workflow";

    static final double KEYWORD_CONFIDENCE = 0.6;
    static final double DEFAULT_CONFIDENCE = 0.3;
    static final double LLM_CONFIDENCE = 0.8;

    private static final Logger log = LoggerFactory.getLogger(IntentAgent.class);

    private static final AgentCard CARD = new AgentCard(NAME, TOPIC, List.of(
        new CapabilityDescriptor(Capability.CLASSIFY, StepRequest.class, Classification.class)
    ));

    private static final List<Map.Entry<WorkflowType, List<String>>> KEYWORDS = List.of(
        Map.entry(WorkflowType.SEARCH_RECOMMEND, List.of("recommend", "suggestion", "for me", "personalized")),
        Map.entry(WorkflowType.RECOMMEND_EXPLAIN, List.of("why", "explain", "reason", "how come")),
        Map.entry(WorkflowType.SEARCH_ALTERNATIVE, List.of("alternative", "instead", "cheaper", "similar to", "like")),
        Map.entry(WorkflowType.SEARCH_ONLY, List.of("search", "find", "looking for", "show me", "where"))
    );

    private final LlmClient llm;
    private final WorkflowRegistry registry;

    public IntentAgent(LlmClient llm, WorkflowRegistry registry) {
        if (llm == null) {
            throw new IllegalArgumentException("llm cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.llm = llm;
        this.registry = registry;
    }

    @Override
    public AgentCard card() {
        return CARD;
    }

    @Override
    public Result<Classification> classify(StepRequest request) {
        String text = request.query() == null ? "" : request.query();
        boolean seenProducts = request.context() != null && !request.context().productIds().isEmpty();
        try {
            LlmClient.Completion completion = llm.complete(prompt(text), List.of(tool()));
            if (completion instanceof LlmClient.Completion.ToolCall call && TOOL_NAME.equals(call.toolName())) {
                Classification chosen = fromToolCall(call);
                if (chosen != null) {
                    return Result.ok(chosen);
                }
                log.warn("LLM selected an unknown workflow: {}", call.arguments());
            } else {
                log.debug("LLM did not call {}, using keyword rules", TOOL_NAME);
            }
        } catch (LlmException e) {
            log.warn("Intent classification via LLM failed ({}), using keyword rules", e.reason());
        }
        return Result.ok(classifyByKeywords(text, seenProducts));
    }

    /**
     * Keyword rules, first matching group wins.
     *
     * @param text user text
     * @param seenProducts whether earlier turns showed products
     * @return classification
     */
    public static Classification classifyByKeywords(String text, boolean seenProducts) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (Map.Entry<WorkflowType, List<String>> group : KEYWORDS) {
            for (String keyword : group.getValue()) {
                if (lower.contains(keyword)) {
                    return new Classification(group.getKey().id(), KEYWORD_CONFIDENCE, "keyword: " + keyword);
                }
            }
        }
        if (seenProducts) {
            return new Classification(WorkflowType.SEARCH_RECOMMEND.id(), DEFAULT_CONFIDENCE, "follow-up on earlier products");
        }
        return new Classification(WorkflowType.SEARCH_ONLY.id(), DEFAULT_CONFIDENCE, "default");
    }

    private Classification fromToolCall(LlmClient.Completion.ToolCall call) {
        Object workflowId = call.arguments().get("workflow_id");
        if (workflowId == null || registry.find(workflowId.toString()).isEmpty()) {
            return null;
        }
        double confidence = LLM_CONFIDENCE;
        Object reported = call.arguments().get("confidence");
        if (reported instanceof Number number && number.doubleValue() >= 0.0 && number.doubleValue() <= 1.0) {
            confidence = number.doubleValue();
        }
        Object reason = call.arguments().get("reason");
        return new Classification(workflowId.toString(), confidence, reason == null ? "llm" : reason.toString());
    }

    private LlmClient.ToolSpec tool() {
        String ids = registry.all().stream().map(WorkflowDefinition::id).collect(Collectors.joining(", "));
        return new LlmClient.ToolSpec(TOOL_NAME, "Select the workflow that best serves the shopping request", Map.of(
            "workflow_id", "one of: " + ids,
            "confidence", "number between 0 and 1",
            "reason", "short justification"
        ));
    }

    private String prompt(String text) {
        StringBuilder prompt = new StringBuilder("Classify the shopping request and call ")
            .append(TOOL_NAME).append(".\nWorkflows:\n");
        for (WorkflowDefinition definition : registry.all()) {
            prompt.append("- ").append(definition.id()).append(": ").append(definition.description()).append('\n');
        }
        return prompt.append("Request: ").append(text).toString();
    }
}
