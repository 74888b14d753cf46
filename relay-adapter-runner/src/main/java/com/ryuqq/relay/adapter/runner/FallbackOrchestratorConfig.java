package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.core.retry.RetryPolicy;

/**
 * FallbackOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>retryPolicy: Provider별 재시도 정책 (기본 3회, 1000ms 기준 exponential backoff)</li>
 * </ul>
 *
 * <p>각 Provider는 독립된 재시도 한도를 가지므로,
 * 최악의 경우 총 시도 횟수는 {@code providers × maxAttempts}입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param retryPolicy Provider별 재시도 정책 (null 불가)
 */
public record FallbackOrchestratorConfig(RetryPolicy retryPolicy) {

    /**
     * 기본 설정 생성자 (maxAttempts=3, baseDelay=1000ms, maxDelay=5분).
     */
    public FallbackOrchestratorConfig() {
        this(new RetryPolicy());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException retryPolicy가 null인 경우
     */
    public FallbackOrchestratorConfig {
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
    }

    /**
     * retryPolicy만 변경한 새 설정 반환.
     *
     * @param retryPolicy 새 재시도 정책
     * @return 새 설정
     */
    public FallbackOrchestratorConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new FallbackOrchestratorConfig(retryPolicy);
    }
}
