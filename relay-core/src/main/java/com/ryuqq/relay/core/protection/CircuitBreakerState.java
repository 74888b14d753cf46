package com.ryuqq.relay.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 Provider별 실패 횟수를 추적하고,
 * 임계값 도달 시 해당 Provider 호출을 일정 시간 차단합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (모니터링 윈도우 내 실패 횟수 ≥ failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과 후 첫 호출)
 * HALF_OPEN (반개방, 프로브 1건)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 통과하며, 모니터링 윈도우 안의 실패 횟수를 추적합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>nextAttemptTime 전까지 모든 요청을 거부합니다.
     * 이후 첫 호출이 HALF_OPEN 전이를 일으킵니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (프로브 1건만 통과).
     *
     * <p>프로브가 성공하면 CLOSED, 실패하면 임계값과 무관하게 다시 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN
}
