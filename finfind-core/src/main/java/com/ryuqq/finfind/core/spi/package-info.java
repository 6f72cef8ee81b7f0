/**
 * Service Provider Interfaces.
 *
 * <p>Transports and external services the core consumes only through these interfaces:
 * {@link com.ryuqq.finfind.core.spi.MessageBus}, {@link com.ryuqq.finfind.core.spi.VectorStore},
 * {@link com.ryuqq.finfind.core.spi.ExecutionStore},
 * {@link com.ryuqq.finfind.core.spi.ConversationStore}, {@link com.ryuqq.finfind.core.spi.LlmClient}
 * and {@link com.ryuqq.finfind.core.spi.EmbeddingClient}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.core.spi;
