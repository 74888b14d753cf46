package com.ryuqq.relay.core.event;

import java.time.Duration;

/**
 * 발송 시도 실패 이벤트.
 *
 * @param requestId 요청 ID
 * @param providerName Provider 이름
 * @param attempt 시도 번호 (1부터 시작)
 * @param maxAttempts 최대 시도 횟수
 * @param reason 실패 사유
 * @param nextDelay 다음 시도까지 대기 시간 (마지막 시도면 {@link Duration#ZERO})
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record AttemptFailed(
    String requestId,
    String providerName,
    int attempt,
    int maxAttempts,
    String reason,
    Duration nextDelay
) implements DeliveryEvent {

    /**
     * 재시도가 남아 있는지 확인.
     *
     * @return 마지막 시도가 아니면 true
     */
    public boolean willRetry() {
        return attempt < maxAttempts;
    }
}
