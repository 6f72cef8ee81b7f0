package com.ryuqq.finfind.core.capability;

import com.ryuqq.finfind.core.protocol.AgentCard;

/**
 * Bus-addressable worker.
 *
 * <p>An agent publishes its {@link AgentCard} and implements one or more of the capability
 * interfaces in this package; the card must list exactly the capabilities it implements.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Agent {

    /**
     * Returns the static description published at startup.
     *
     * @return agent card
     */
    AgentCard card();
}
