/**
 * In-memory {@link com.ryuqq.finfind.core.spi.ExecutionStore} adapter keeping live executions and a bounded history.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.adapter.inmemory.store;
