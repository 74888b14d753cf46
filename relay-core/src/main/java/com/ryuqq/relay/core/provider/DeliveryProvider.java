package com.ryuqq.relay.core.provider;

import com.ryuqq.relay.core.model.DeliveryRequest;

/**
 * 발송 Provider SPI.
 *
 * <p>엔진은 Provider를 "발송을 시도한다: 성공하거나 실패한다"는 불투명한 능력으로만 다룹니다.
 * SendGrid, Mailgun 같은 구체 Provider는 이 인터페이스를 구현하고,
 * 오케스트레이터에는 우선순위 순서의 목록으로 전달됩니다.
 * 새 Provider를 추가할 때는 목록에 덧붙이기만 하면 됩니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>한 번의 호출 = 한 번의 동기 발송 시도 (재시도는 엔진이 담당)</li>
 *   <li>실패 시 사람이 읽을 수 있는 사유와 함께 {@link DeliveryFailure}를 던짐</li>
 *   <li>thread-safe (여러 요청이 동시에 호출)</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>{@code
 * public class SendGridProvider implements DeliveryProvider {
 *     public String getName() {
 *         return "SendGrid";
 *     }
 *
 *     public void attemptDelivery(DeliveryRequest request) throws DeliveryFailure {
 *         Response response = client.send(request);
 *         if (!response.isSuccessful()) {
 *             throw new DeliveryFailure("SendGrid responded " + response.status());
 *         }
 *     }
 * }
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface DeliveryProvider {

    /**
     * Provider 이름.
     *
     * <p>결과의 providerUsed, Circuit Breaker 이름, 오류 메시지 라벨로 사용되며
     * 체인 안에서 고유해야 합니다.</p>
     *
     * @return Provider 이름
     */
    String getName();

    /**
     * 발송 1회 시도.
     *
     * @param request 발송 요청
     * @throws DeliveryFailure Provider가 발송을 완료하지 못한 경우
     */
    void attemptDelivery(DeliveryRequest request) throws DeliveryFailure;
}
