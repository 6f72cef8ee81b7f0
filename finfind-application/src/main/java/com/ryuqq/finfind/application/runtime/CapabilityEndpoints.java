package com.ryuqq.finfind.application.runtime;

import com.ryuqq.finfind.core.capability.Agent;
import com.ryuqq.finfind.core.capability.AlternativeCapability;
import com.ryuqq.finfind.core.capability.ClassifyCapability;
import com.ryuqq.finfind.core.capability.ExplainCapability;
import com.ryuqq.finfind.core.capability.RecommendCapability;
import com.ryuqq.finfind.core.capability.SearchCapability;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.exception.DiscoveryException;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Fail;
import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.A2AProtocol;
import com.ryuqq.finfind.core.protocol.AgentCard;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.protocol.CapabilityDescriptor;
import com.ryuqq.finfind.core.spi.MessageBus;
import com.ryuqq.finfind.core.spi.RequestHandler;
import com.ryuqq.finfind.core.support.Payloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Binds agents to the message bus.
 *
 * <p>The handler produced for an agent decodes the REQUEST payload into a {@link StepRequest},
 * attaches the message's compressed context, dispatches on the requested capability and
 * encodes the typed result back into a payload map. Exceptions raised by the agent are
 * converted into {@link Fail} values here so that they never cross the bus.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CapabilityEndpoints {

    private static final Logger log = LoggerFactory.getLogger(CapabilityEndpoints.class);

    private CapabilityEndpoints() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Registers the agent's card and installs its request handler on the card's topic.
     *
     * @param agent agent to expose
     * @param bus message bus
     * @param protocol protocol registry
     * @throws IllegalArgumentException if the card lists a capability the agent does not implement
     * @throws IllegalStateException if the topic already has a handler
     */
    public static void expose(Agent agent, MessageBus bus, A2AProtocol protocol) {
        if (agent == null) {
            throw new IllegalArgumentException("agent cannot be null");
        }
        AgentCard card = agent.card();
        for (CapabilityDescriptor descriptor : card.capabilities()) {
            if (!implementsCapability(agent, descriptor.capability())) {
                throw new IllegalArgumentException(
                    "Agent " + card.name() + " does not implement " + descriptor.capability()
                );
            }
        }
        bus.registerHandler(card.topic(), handlerFor(agent));
        protocol.register(card);
    }

    /**
     * Removes the agent from the protocol registry and the bus.
     *
     * @param agent agent to withdraw
     * @param bus message bus
     * @param protocol protocol registry
     */
    public static void withdraw(Agent agent, MessageBus bus, A2AProtocol protocol) {
        AgentCard card = agent.card();
        protocol.unregister(card.name());
        bus.unregisterHandler(card.topic());
    }

    /**
     * Creates the bus handler for an agent.
     *
     * @param agent agent
     * @return request handler
     */
    public static RequestHandler handlerFor(Agent agent) {
        String name = agent.card().name();
        return message -> {
            StepRequest request;
            try {
                request = Payloads.fromMap(message.payload(), StepRequest.class).withContext(message.context());
            } catch (DiscoveryException e) {
                return e.toFail();
            }
            if (!agent.card().supports(request.capability())) {
                return Fail.of(ErrorKind.VALIDATION, name + " does not provide " + request.capability());
            }
            try {
                return dispatch(agent, request).map(Payloads::toMap);
            } catch (DiscoveryException e) {
                log.warn("Agent {} failed {} with {}: {}", name, request.capability(), e.kind(), e.getMessage());
                return e.toFail();
            } catch (RuntimeException e) {
                log.error("Agent {} raised an unexpected error on {}", name, request.capability(), e);
                return Fail.of(ErrorKind.STEP_FAILURE, name + " failed: " + e.getMessage(), e.getClass().getName());
            }
        };
    }

    /**
     * Encodes a step request for the bus. The context travels on the message envelope.
     *
     * @param request step request
     * @return payload map
     */
    public static Map<String, Object> encode(StepRequest request) {
        return Payloads.toMap(request.withContext(null));
    }

    private static Result<?> dispatch(Agent agent, StepRequest request) {
        return switch (request.capability()) {
            case CLASSIFY -> ((ClassifyCapability) agent).classify(request);
            case SEARCH -> ((SearchCapability) agent).search(request);
            case RECOMMEND -> ((RecommendCapability) agent).recommend(request);
            case ALTERNATIVE -> ((AlternativeCapability) agent).findAlternatives(request);
            case EXPLAIN -> ((ExplainCapability) agent).explain(request);
        };
    }

    private static boolean implementsCapability(Agent agent, Capability capability) {
        return switch (capability) {
            case CLASSIFY -> agent instanceof ClassifyCapability;
            case SEARCH -> agent instanceof SearchCapability;
            case RECOMMEND -> agent instanceof RecommendCapability;
            case ALTERNATIVE -> agent instanceof AlternativeCapability;
            case EXPLAIN -> agent instanceof ExplainCapability;
        };
    }
}
