/**
 * 발송 Orchestrator 실행 어댑터.
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.relay.adapter.runner.FallbackOrchestrator}: Fallback Chain 엔진 (동기 실행)</li>
 *   <li>{@link com.ryuqq.relay.adapter.runner.AsyncDeliveryRunner}: Worker Pool 기반 비동기 실행</li>
 *   <li>{@link com.ryuqq.relay.adapter.runner.Slf4jDeliveryEventListener}: 이벤트 로그 기록</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner;
