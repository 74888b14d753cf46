package com.ryuqq.relay.core.event;

/**
 * 입력 단계 거부 이벤트.
 *
 * @param requestId 요청 ID
 * @param reason 거부 유형
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record RequestRejected(
    String requestId,
    Reason reason
) implements DeliveryEvent {

    /**
     * 입력 거부 유형.
     */
    public enum Reason {
        /** 이미 완료된 requestId */
        DUPLICATE,
        /** Rate Limit 초과 */
        RATE_LIMITED
    }
}
