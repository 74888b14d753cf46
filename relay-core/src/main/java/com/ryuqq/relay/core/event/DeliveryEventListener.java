package com.ryuqq.relay.core.event;

/**
 * {@link DeliveryEvent} 수신자.
 *
 * <p>이벤트는 발행한 스레드에서 동기적으로 전달되며, Circuit Breaker의 잠금 밖에서 호출됩니다.
 * 구현체는 thread-safe해야 하고, 예외를 던지지 않아야 합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeliveryEventListener {

    /**
     * 아무 것도 하지 않는 Listener.
     */
    DeliveryEventListener NOOP = event -> { };

    /**
     * 이벤트 수신.
     *
     * @param event 발행된 이벤트
     */
    void onEvent(DeliveryEvent event);
}
