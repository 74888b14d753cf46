package com.ryuqq.relay.core.protection;

import java.time.Duration;

/**
 * Rate Limiter 상태 스냅샷.
 *
 * @param currentRequests 현재 윈도우 안에 기록된 요청 수
 * @param maxRequests 윈도우당 허용 요청 수
 * @param windowSize 윈도우 크기
 * @author Relay Team
 * @since 1.0.0
 */
public record RateLimitStatus(int currentRequests, int maxRequests, Duration windowSize) {

    /**
     * 남은 허용량.
     *
     * @return maxRequests - currentRequests (최소 0)
     */
    public int remaining() {
        return Math.max(0, maxRequests - currentRequests);
    }
}
