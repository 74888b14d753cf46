package com.ryuqq.relay.core.protection;

import java.time.Duration;

/**
 * Rate Limiter 설정.
 *
 * @param maxRequests 윈도우당 허용 요청 수 (기본 10)
 * @param windowSize 이동 윈도우 크기 (기본 60초)
 * @author Relay Team
 * @since 1.0.0
 */
public record RateLimiterConfig(int maxRequests, Duration windowSize) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRequests=10, windowSize=60s</p>
     */
    public RateLimiterConfig() {
        this(10, Duration.ofSeconds(60));
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxRequests is not positive
     * @throws IllegalArgumentException if windowSize is null or not positive
     */
    public RateLimiterConfig {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive (current: " + maxRequests + ")");
        }
        if (windowSize == null) {
            throw new IllegalArgumentException("windowSize cannot be null");
        }
        if (windowSize.isNegative() || windowSize.isZero()) {
            throw new IllegalArgumentException("windowSize must be positive (current: " + windowSize + ")");
        }
    }

    /**
     * maxRequests만 변경한 새 인스턴스 생성.
     */
    public RateLimiterConfig withMaxRequests(int maxRequests) {
        return new RateLimiterConfig(maxRequests, windowSize);
    }

    /**
     * windowSize만 변경한 새 인스턴스 생성.
     */
    public RateLimiterConfig withWindowSize(Duration windowSize) {
        return new RateLimiterConfig(maxRequests, windowSize);
    }
}
