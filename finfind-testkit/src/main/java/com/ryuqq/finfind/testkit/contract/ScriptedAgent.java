package com.ryuqq.finfind.testkit.contract;

import com.ryuqq.finfind.core.capability.Agent;
import com.ryuqq.finfind.core.capability.AlternativeCapability;
import com.ryuqq.finfind.core.capability.Classification;
import com.ryuqq.finfind.core.capability.ClassifyCapability;
import com.ryuqq.finfind.core.capability.ExplainCapability;
import com.ryuqq.finfind.core.capability.RecommendCapability;
import com.ryuqq.finfind.core.capability.SearchCapability;
import com.ryuqq.finfind.core.capability.StepOutput;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.AgentCard;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.protocol.CapabilityDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Agent whose answers are scripted per capability.
 *
 * <p>Implements every capability interface; the card advertises only the capabilities passed to
 * the constructor. A capability without a scripted answer fails with {@code UPSTREAM_FAILURE}.
 * Every request is recorded, including its attached context.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedAgent implements Agent, ClassifyCapability, SearchCapability, RecommendCapability,
    AlternativeCapability, ExplainCapability {

    private final AgentCard card;
    private final Map<Capability, Function<StepRequest, Result<StepOutput>>> answers = new ConcurrentHashMap<>();
    private volatile Function<StepRequest, Result<Classification>> classification;
    private final List<StepRequest> received = new CopyOnWriteArrayList<>();

    /**
     * Creates an agent listening on {@code agent.<name>}.
     *
     * @param name agent name
     * @param capabilities advertised capabilities (at least one)
     */
    public ScriptedAgent(String name, Capability... capabilities) {
        List<CapabilityDescriptor> descriptors = new ArrayList<>();
        for (Capability capability : capabilities) {
            descriptors.add(new CapabilityDescriptor(capability, StepRequest.class,
                capability == Capability.CLASSIFY ? Classification.class : StepOutput.class));
        }
        this.card = new AgentCard(name, "agent." + name, descriptors);
    }

    /**
     * Scripts the answer of one step capability.
     *
     * @param capability step capability (not CLASSIFY)
     * @param answer request to result
     * @return this agent
     * @throws IllegalArgumentException if capability is CLASSIFY; use {@link #classifying(Function)}
     */
    public ScriptedAgent answer(Capability capability, Function<StepRequest, Result<StepOutput>> answer) {
        if (capability == Capability.CLASSIFY) {
            throw new IllegalArgumentException("CLASSIFY answers are scripted with classifying()");
        }
        answers.put(capability, answer);
        return this;
    }

    /**
     * Scripts the CLASSIFY answer.
     *
     * @param answer request to classification result
     * @return this agent
     */
    public ScriptedAgent classifying(Function<StepRequest, Result<Classification>> answer) {
        this.classification = answer;
        return this;
    }

    /**
     * Scripts a fixed successful output.
     *
     * @param capability capability
     * @param output output
     * @return this agent
     */
    public ScriptedAgent returning(Capability capability, StepOutput output) {
        return answer(capability, request -> Result.ok(output));
    }

    /**
     * Scripts a fixed failure.
     *
     * @param capability capability
     * @param kind error kind
     * @param message error message
     * @return this agent
     */
    public ScriptedAgent failing(Capability capability, ErrorKind kind, String message) {
        return answer(capability, request -> Result.fail(kind, message));
    }

    public List<StepRequest> received() {
        return List.copyOf(received);
    }

    public long calls(Capability capability) {
        return received.stream().filter(request -> request.capability() == capability).count();
    }

    @Override
    public AgentCard card() {
        return card;
    }

    @Override
    public Result<Classification> classify(StepRequest request) {
        received.add(request);
        Function<StepRequest, Result<Classification>> answer = classification;
        if (answer == null) {
            return unanswered(request);
        }
        return answer.apply(request);
    }

    @Override
    public Result<StepOutput> search(StepRequest request) {
        return invoke(request);
    }

    @Override
    public Result<StepOutput> recommend(StepRequest request) {
        return invoke(request);
    }

    @Override
    public Result<StepOutput> findAlternatives(StepRequest request) {
        return invoke(request);
    }

    @Override
    public Result<StepOutput> explain(StepRequest request) {
        return invoke(request);
    }

    private Result<StepOutput> invoke(StepRequest request) {
        received.add(request);
        Function<StepRequest, Result<StepOutput>> answer = answers.get(request.capability());
        if (answer == null) {
            return unanswered(request);
        }
        return answer.apply(request);
    }

    private <T> Result<T> unanswered(StepRequest request) {
        return Result.fail(ErrorKind.UPSTREAM_FAILURE, card.name() + " has no answer for " + request.capability());
    }
}
