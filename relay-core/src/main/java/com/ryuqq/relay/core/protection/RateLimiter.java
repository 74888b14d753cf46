package com.ryuqq.relay.core.protection;

/**
 * Rate Limiter SPI.
 *
 * <p>이동 시간 윈도우 안에서 허용된 요청 수를 제한하는 프로세스 단위 입장 게이트입니다.</p>
 *
 * <p><strong>카운트 규칙:</strong></p>
 * <ul>
 *   <li>허용된 요청만 윈도우에 기록됩니다.</li>
 *   <li>거부된 요청은 기록되지 않으므로, 제한 대상은 전체 유입량이 아니라
 *       windowSize당 허용된 처리량입니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (rateLimiter.isLimited()) {
 *     return DeliveryOutcome.rejected(requestId, "rate limit exceeded", startedAt);
 * }
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 요청 제한 여부 판정 (허용 시 카운트됨).
     *
     * <p>윈도우 밖의 기록을 정리한 뒤, 남은 개수가 maxRequests 이상이면 true를 반환하고
     * 아무 것도 기록하지 않습니다. 그렇지 않으면 현재 시각을 기록하고 false를 반환합니다.
     * 정리와 기록은 하나의 원자적 단위로 수행되어야 합니다.</p>
     *
     * @return true: 요청 거부, false: 요청 허용
     */
    boolean isLimited();

    /**
     * 현재 윈도우 상태 조회 (부작용 없음).
     *
     * @return 윈도우 내 요청 수, 최대 요청 수, 윈도우 크기
     */
    RateLimitStatus getStatus();

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return Rate Limiter 설정
     */
    RateLimiterConfig getConfig();
}
