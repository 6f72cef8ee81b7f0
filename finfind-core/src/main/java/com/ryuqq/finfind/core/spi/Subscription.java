package com.ryuqq.finfind.core.spi;

/**
 * Handle returned by {@link MessageBus#subscribe}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Subscription {

    /**
     * Stops delivery to the subscriber. Idempotent.
     */
    void cancel();

    boolean isActive();
}
