/**
 * 워크플로 단계 상태 머신.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.core.statemachine;
