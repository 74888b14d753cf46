package com.ryuqq.relay.core.event;

/**
 * Circuit Breaker 거부로 Provider를 건너뛴 이벤트.
 *
 * @param requestId 요청 ID
 * @param providerName Provider 이름
 * @param reason 거부 사유
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record ProviderSkipped(
    String requestId,
    String providerName,
    String reason
) implements DeliveryEvent {
}
