/**
 * Application Layer - 발송 오케스트레이터 계약.
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (FallbackOrchestrator)
 *   ↓ implements
 * application (DeliveryOrchestrator interface)
 *   ↓ depends on
 * core (DeliveryRequest, DeliveryOutcome, protection SPI, IdempotencyGuard)
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.application.orchestrator;
