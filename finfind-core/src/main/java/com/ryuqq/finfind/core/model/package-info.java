/**
 * 도메인 식별자 값 객체.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.finfind.core.model;
