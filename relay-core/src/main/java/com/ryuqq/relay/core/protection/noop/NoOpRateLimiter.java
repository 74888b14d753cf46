package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.protection.RateLimitStatus;
import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.protection.RateLimiterConfig;

import java.time.Duration;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 항상 허용합니다.
 * 개발 및 테스트 환경에서 사용하거나, Rate Limiting 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>isLimited(): 항상 false 반환</li>
 *   <li>getStatus(): 항상 currentRequests=0</li>
 *   <li>getConfig(): 무제한 설정 반환</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED_CONFIG =
        new RateLimiterConfig(Integer.MAX_VALUE, Duration.ofSeconds(1));

    @Override
    public boolean isLimited() {
        return false;
    }

    @Override
    public RateLimitStatus getStatus() {
        return new RateLimitStatus(0, UNLIMITED_CONFIG.maxRequests(), UNLIMITED_CONFIG.windowSize());
    }

    @Override
    public RateLimiterConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
