/**
 * Exact-scan {@link com.ryuqq.finfind.core.spi.VectorStore} adapter for tests and local runs.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.adapter.inmemory.vector;
