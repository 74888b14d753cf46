package com.ryuqq.relay.adapter.runner;

/**
 * AsyncDeliveryRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 처리 스레드 수 (기본 5)</li>
 *   <li>shutdownTimeoutMs: graceful shutdown 대기 시간 (기본 60000ms = 60초)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param concurrency 동시 처리 스레드 수 (1 이상이어야 함)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record AsyncRunnerConfig(
    int concurrency,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자 (concurrency=5, shutdownTimeoutMs=60000).
     */
    public AsyncRunnerConfig() {
        this(5, 60_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public AsyncRunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public AsyncRunnerConfig withConcurrency(int concurrency) {
        return new AsyncRunnerConfig(concurrency, shutdownTimeoutMs);
    }

    public AsyncRunnerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new AsyncRunnerConfig(concurrency, shutdownTimeoutMs);
    }
}
