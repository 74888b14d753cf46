package com.ryuqq.relay.core.protection;

import java.time.Instant;
import java.util.Optional;

/**
 * Circuit Breaker 상태 스냅샷 (읽기 전용).
 *
 * @param providerName Provider 이름
 * @param state 현재 상태
 * @param failureCount 현재 실패 카운트
 * @param nextAttemptTime 다음 시도 허용 시각 (OPEN일 때만 존재, 그 외 null)
 * @param config 설정
 * @author Relay Team
 * @since 1.0.0
 */
public record CircuitBreakerStatus(
    String providerName,
    CircuitBreakerState state,
    int failureCount,
    Instant nextAttemptTime,
    CircuitBreakerConfig config
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나, OPEN이 아닌데 nextAttemptTime이 있는 경우
     */
    public CircuitBreakerStatus {
        if (providerName == null || state == null || config == null) {
            throw new IllegalArgumentException("providerName, state and config are required");
        }
        if (state != CircuitBreakerState.OPEN && nextAttemptTime != null) {
            throw new IllegalArgumentException("nextAttemptTime is only present while OPEN (state: " + state + ")");
        }
    }

    /**
     * 다음 시도 허용 시각 조회.
     *
     * @return OPEN이면 nextAttemptTime, 아니면 empty
     */
    public Optional<Instant> nextAttemptTimeIfOpen() {
        return Optional.ofNullable(nextAttemptTime);
    }
}
