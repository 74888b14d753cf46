package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.event.DeliveryEventListener;

/**
 * Provider별 Circuit Breaker 생성기.
 *
 * <p>오케스트레이터는 생성 시점에 설정된 Provider마다 이 팩토리를 한 번씩 호출하여
 * 전용 Circuit Breaker를 만듭니다. 팩토리는 호출마다 새 인스턴스를 반환해야 합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CircuitBreakerFactory {

    /**
     * Circuit Breaker 생성.
     *
     * @param providerName Provider 이름
     * @param listener 상태 전이 이벤트 수신자
     * @return 새 Circuit Breaker
     */
    CircuitBreaker create(String providerName, DeliveryEventListener listener);
}
