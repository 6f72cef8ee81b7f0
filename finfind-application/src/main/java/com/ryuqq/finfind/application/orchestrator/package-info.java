/**
 * FinFind Application Layer - 상품 탐색 요청 조정 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.finfind.application.orchestrator.Orchestrator} - 요청 조정자</li>
 *   <li>{@link com.ryuqq.finfind.application.orchestrator.DiscoveryRequest} - 요청</li>
 *   <li>{@link com.ryuqq.finfind.application.orchestrator.DiscoveryResponse} - 구조화된 응답</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>불변성:</strong> 요청/응답은 불변 record</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.application.orchestrator;
