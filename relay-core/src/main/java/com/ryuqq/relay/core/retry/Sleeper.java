package com.ryuqq.relay.core.retry;

import java.time.Duration;

/**
 * 재시도 대기 추상화.
 *
 * <p>재시도 루프는 대기 지점에서만 멈춥니다. 테스트는 실제로 잠들지 않는 구현을 주입하여
 * 요청된 대기 시간만 기록할 수 있습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정한 시간만큼 현재 스레드를 대기.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 기본 구현.
     *
     * @return 스레드를 블로킹하는 Sleeper
     */
    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
