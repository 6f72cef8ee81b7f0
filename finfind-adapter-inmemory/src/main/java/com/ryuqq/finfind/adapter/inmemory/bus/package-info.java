/**
 * In-process message bus adapter.
 *
 * <p>{@link com.ryuqq.finfind.adapter.inmemory.bus.InMemoryMessageBus} implements the
 * {@link com.ryuqq.finfind.core.spi.MessageBus} SPI on top of the shared
 * {@link com.ryuqq.finfind.core.protocol.A2AProtocol} correlation table.</p>
 *
 * <h2>Dispatch Order</h2>
 *
 * <pre>
 * ┌─────────────┐
 * │   request   │ → pending slot + deadline timer (A2AProtocol)
 * └──────┬──────┘
 *        ▼
 * ┌─────────────┐
 * │ topic queue │ CRITICAL &gt; HIGH &gt; NORMAL &gt; LOW, FIFO within a priority
 * └──────┬──────┘
 *        ▼  (permit: maxConcurrentRequestsPerTopic)
 * ┌─────────────┐
 * │   handler   │ → RESPONSE → A2AProtocol.respond
 * └─────────────┘
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>Single JVM:</strong> no cross-process delivery</li>
 *   <li><strong>No Persistence:</strong> queued requests are lost on shutdown</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.adapter.inmemory.bus;
