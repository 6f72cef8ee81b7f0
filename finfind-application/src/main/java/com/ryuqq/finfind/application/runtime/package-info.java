/**
 * Workflow runtime contracts and bus endpoint binding.
 *
 * <ul>
 *   <li>{@link com.ryuqq.finfind.application.runtime.WorkflowEngine} - drives a workflow to a terminal state</li>
 *   <li>{@link com.ryuqq.finfind.application.runtime.CapabilityEndpoints} - exposes agents on the bus</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.application.runtime;
