/**
 * Reference agents, one per capability.
 *
 * <p>Each agent implements {@link com.ryuqq.finfind.core.capability.Agent} plus the capability
 * interfaces listed on its card, and is bound to the bus by
 * {@code com.ryuqq.finfind.application.runtime.CapabilityEndpoints}.</p>
 *
 * <table>
 *   <caption>Agents</caption>
 *   <tr><th>Agent</th><th>Topic</th><th>Capability</th></tr>
 *   <tr><td>IntentAgent</td><td>agent.intent</td><td>CLASSIFY</td></tr>
 *   <tr><td>SearchAgent</td><td>agent.search</td><td>SEARCH</td></tr>
 *   <tr><td>RecommendationAgent</td><td>agent.recommendation</td><td>RECOMMEND</td></tr>
 *   <tr><td>AlternativeAgent</td><td>agent.alternative</td><td>ALTERNATIVE</td></tr>
 *   <tr><td>ExplainabilityAgent</td><td>agent.explainability</td><td>EXPLAIN</td></tr>
 * </table>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.adapter.agent;
