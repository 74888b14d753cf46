package com.ryuqq.relay.core.event;

import com.ryuqq.relay.core.protection.CircuitBreakerState;

import java.time.Instant;

/**
 * Circuit Breaker 상태 전이 이벤트.
 *
 * @param providerName Provider 이름
 * @param from 이전 상태
 * @param to 새 상태
 * @param failureCount 전이 시점의 실패 카운트
 * @param occurredAt 전이 시각
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record CircuitStateChanged(
    String providerName,
    CircuitBreakerState from,
    CircuitBreakerState to,
    int failureCount,
    Instant occurredAt
) implements DeliveryEvent {
}
