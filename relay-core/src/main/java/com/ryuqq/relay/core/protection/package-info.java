/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>Provider 장애를 격리하고 처리량을 제어하기 위한 보호 메커니즘 확장점을 정의합니다.</p>
 *
 * <h2>Protection 체인 순서</h2>
 *
 * <p>오케스트레이터는 요청마다 다음 순서로 보호 장치를 적용합니다:</p>
 * <pre>
 * 1. IdempotencyGuard → 이미 완료된 requestId 거부
 * 2. RateLimiter      → 윈도우당 허용 처리량 초과 시 거부
 * 3. CircuitBreaker   → Provider별 통과 판정 (우선순위 순서)
 * 4. RetryPolicy      → Provider별 시도 루프와 지수 백오프
 * </pre>
 *
 * <h3>체인 순서 선정 이유</h3>
 * <ul>
 *   <li><strong>Idempotency First:</strong> 중복 요청은 처리량 예산도 소모하지 않음</li>
 *   <li><strong>Rate Limiter:</strong> Provider 호출 전 요청 단위 입장 제어</li>
 *   <li><strong>Circuit Breaker:</strong> 장애 Provider는 재시도 예산 소모 없이 건너뜀</li>
 * </ul>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지는 보호 없이 항상 허용하는 기본 구현을 제공합니다.
 * 실제 상태를 추적하는 구현은 {@code relay-adapter-inmemory} 모듈에 있습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @see com.ryuqq.relay.core.protection.CircuitBreaker
 * @see com.ryuqq.relay.core.protection.RateLimiter
 * @see com.ryuqq.relay.core.protection.noop
 */
package com.ryuqq.relay.core.protection;
