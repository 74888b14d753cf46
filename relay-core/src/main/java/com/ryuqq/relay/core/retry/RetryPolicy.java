package com.ryuqq.relay.core.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Provider 단위 재시도 정책 (Exponential Backoff).
 *
 * <p>Provider 하나에 대한 최대 시도 횟수와 시도 사이의 대기 시간을 결정합니다.
 * 각 Provider는 자신만의 전체 시도 예산을 가지므로,
 * 최악의 경우 총 시도 횟수는 {@code providers × maxAttempts}입니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay(n) = min(baseDelay * 2^(n-1), maxDelay)   // n번째 시도 실패 후, n &lt; maxAttempts
 * delay(maxAttempts) = 0                          // 마지막 시도 후에는 대기 없음
 * </pre>
 *
 * <p><strong>예시 (maxAttempts=3, baseDelay=1000ms):</strong></p>
 * <ul>
 *   <li>1번째 시도 실패: 1000ms 대기</li>
 *   <li>2번째 시도 실패: 2000ms 대기</li>
 *   <li>3번째 시도 실패: 대기 없음 (재시도 소진)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: maxAttempts=3, baseDelay=1000ms, maxDelay=300000ms</p>
     */
    public RetryPolicy() {
        this(3, Duration.ofSeconds(1), Duration.ofMinutes(5));
    }

    /**
     * 커스텀 설정으로 생성 (maxDelay 기본값 5분).
     *
     * @param maxAttempts 최대 시도 횟수 (1 이상)
     * @param baseDelay 기본 지연 시간 (1ms 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy(int maxAttempts, Duration baseDelay) {
        this(maxAttempts, baseDelay, max(baseDelay, Duration.ofMinutes(5)));
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param maxAttempts 최대 시도 횟수 (1 이상)
     * @param baseDelay 기본 지연 시간 (1ms 이상)
     * @param maxDelay 최대 지연 시간 (baseDelay 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelay == null || maxDelay == null) {
            throw new IllegalArgumentException("baseDelay and maxDelay cannot be null");
        }
        long base = toMillis(baseDelay);
        long cap = toMillis(maxDelay);
        if (base <= 0) {
            throw new IllegalArgumentException(
                "baseDelay must be at least 1ms (current: " + baseDelay + ")"
            );
        }
        if (cap < base) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }

        this.maxAttempts = maxAttempts;
        this.baseDelayMs = base;
        this.maxDelayMs = cap;
    }

    /**
     * n번째 시도가 실패한 뒤 다음 시도까지의 대기 시간 계산.
     *
     * @param failedAttempt 실패한 시도 번호 (1부터 시작)
     * @return 대기 시간, 마지막 시도였다면 {@link Duration#ZERO}
     * @throws IllegalArgumentException failedAttempt가 양수가 아닌 경우
     */
    public Duration delayAfter(int failedAttempt) {
        if (failedAttempt <= 0) {
            throw new IllegalArgumentException(
                "failedAttempt must be positive (current: " + failedAttempt + ")"
            );
        }
        if (failedAttempt >= maxAttempts) {
            return Duration.ZERO;
        }

        // overflow 방지: 곱셈 전에 상한과 비교
        int shift = failedAttempt - 1;
        if (shift >= Long.SIZE - 2) {
            return Duration.ofMillis(maxDelayMs);
        }
        long factor = 1L << shift;
        if (baseDelayMs > maxDelayMs / factor) {
            return Duration.ofMillis(maxDelayMs);
        }
        return Duration.ofMillis(baseDelayMs * factor);
    }

    /**
     * 시도 사이 대기 시간 목록.
     *
     * @return 길이 maxAttempts-1의 대기 시간 목록 (예: [1s, 2s])
     */
    public List<Duration> delaySchedule() {
        List<Duration> schedule = new ArrayList<>(maxAttempts - 1);
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            schedule.add(delayAfter(attempt));
        }
        return List.copyOf(schedule);
    }

    /**
     * 최대 시도 횟수 조회.
     *
     * @return 최대 시도 횟수
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 기본 지연 시간 조회.
     *
     * @return 기본 지연 시간
     */
    public Duration getBaseDelay() {
        return Duration.ofMillis(baseDelayMs);
    }

    /**
     * 최대 지연 시간 조회.
     *
     * @return 최대 지연 시간
     */
    public Duration getMaxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, getBaseDelay(), getMaxDelay());
    }

    private static long toMillis(Duration duration) {
        try {
            return duration.toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static Duration max(Duration a, Duration b) {
        if (a == null) {
            return b;
        }
        return a.compareTo(b) > 0 ? a : b;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts
            + ", baseDelayMs=" + baseDelayMs
            + ", maxDelayMs=" + maxDelayMs + '}';
    }
}
