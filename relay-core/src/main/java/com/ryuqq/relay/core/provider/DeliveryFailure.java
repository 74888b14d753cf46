package com.ryuqq.relay.core.provider;

/**
 * Provider 발송 실패.
 *
 * <p>메시지는 사람이 읽을 수 있는 실패 사유이며,
 * 그대로 {@link com.ryuqq.relay.core.outcome.Exhausted#lastError()}와 최종 오류 메시지에 전달됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class DeliveryFailure extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * 실패 사유로 생성.
     *
     * @param message 실패 사유
     */
    public DeliveryFailure(String message) {
        super(message);
    }

    /**
     * 실패 사유와 원인으로 생성.
     *
     * @param message 실패 사유
     * @param cause 원인
     */
    public DeliveryFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
