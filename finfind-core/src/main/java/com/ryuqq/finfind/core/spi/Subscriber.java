package com.ryuqq.finfind.core.spi;

import com.ryuqq.finfind.core.protocol.Message;

/**
 * Receiver of EVENT and BROADCAST messages.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Subscriber {

    void onMessage(Message message);
}
