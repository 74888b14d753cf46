package com.ryuqq.relay.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * <p>Circuit Breaker 인스턴스 생성 이후 변경되지 않습니다.</p>
 *
 * @param failureThreshold OPEN 전이 실패 횟수 (기본 3)
 * @param recoveryTimeout OPEN 유지 시간 (기본 30초)
 * @param monitoringWindow 실패 카운트 유지 구간 (기본 60초)
 * @author Relay Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration recoveryTimeout,
    Duration monitoringWindow
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=3, recoveryTimeout=30s, monitoringWindow=60s</p>
     */
    public CircuitBreakerConfig() {
        this(3, Duration.ofSeconds(30), Duration.ofSeconds(60));
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if failureThreshold is not positive
     * @throws IllegalArgumentException if recoveryTimeout or monitoringWindow is null or not positive
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        requirePositive(recoveryTimeout, "recoveryTimeout");
        requirePositive(monitoringWindow, "monitoringWindow");
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, monitoringWindow);
    }

    /**
     * recoveryTimeout만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withRecoveryTimeout(Duration recoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, monitoringWindow);
    }

    /**
     * monitoringWindow만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withMonitoringWindow(Duration monitoringWindow) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, monitoringWindow);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }
}
