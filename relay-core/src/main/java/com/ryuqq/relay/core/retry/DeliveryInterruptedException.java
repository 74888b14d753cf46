package com.ryuqq.relay.core.retry;

/**
 * 재시도 대기 중 인터럽트.
 *
 * <p>발생 시점에 현재 스레드의 인터럽트 플래그는 이미 복원되어 있습니다.
 * 해당 요청에 대해서는 Circuit Breaker 결과, 멱등성 기록이 남지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class DeliveryInterruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 메시지
     * @param cause 원인 ({@link InterruptedException})
     */
    public DeliveryInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
