package com.ryuqq.relay.core.event;

/**
 * 발송 시도 성공 이벤트.
 *
 * @param requestId 요청 ID
 * @param providerName Provider 이름
 * @param attempt 성공한 시도 번호 (1부터 시작)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record AttemptSucceeded(
    String requestId,
    String providerName,
    int attempt
) implements DeliveryEvent {
}
