/**
 * Runner Adapter Layer - WorkflowEngine, Orchestrator 구현체.
 *
 * <p>이 패키지는 application 계층 인터페이스의 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.finfind.adapter.runner.LayeredWorkflowRunner} - Layer 단위 동시 실행 워크플로 러너</li>
 *   <li>{@link com.ryuqq.finfind.adapter.runner.DiscoveryOrchestrator} - 분류, 실행, 병합을 묶는 요청 조정자</li>
 *   <li>{@link com.ryuqq.finfind.adapter.runner.ResultAggregator} - Step 출력 병합</li>
 *   <li>{@link com.ryuqq.finfind.adapter.runner.BackoffCalculator} - 재시도 지연 계산</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DiscoveryOrchestrator, LayeredWorkflowRunner)
 *   ↓ implements
 * application (Orchestrator, WorkflowEngine, CapabilityEndpoints)
 *   ↓ depends on
 * core (Message, A2AProtocol, WorkflowDefinition, WorkflowExecution, Result)
 *   ↓ depends on
 * core/spi (MessageBus, ExecutionStore)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.adapter.runner;
