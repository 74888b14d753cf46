package com.ryuqq.relay.core.model;

/**
 * 발송 요청.
 *
 * <p>수신자, 제목, 본문, 요청 ID 네 필드 모두 필수입니다.
 * {@code requestId}는 호출자가 부여하는 멱등성 키이며, 논리적 발송 단위마다 고유해야 합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * DeliveryRequest request = new DeliveryRequest(
 *     "user@example.com",
 *     "Welcome",
 *     "Hello!",
 *     "550e8400-e29b-41d4-a716-446655440000"
 * );
 * </pre>
 *
 * @param to 수신자 주소
 * @param subject 제목
 * @param body 본문
 * @param requestId 멱등성 키 (중복 발송 방지)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record DeliveryRequest(
    String to,
    String subject,
    String body,
    String requestId
) {

    /**
     * Compact Constructor.
     *
     * <p>유효하지 않은 요청은 생성 단계에서 거부되므로,
     * 엔진에 도달하는 요청은 항상 네 필드가 모두 채워져 있습니다.</p>
     *
     * @throws IllegalArgumentException 필드 중 하나라도 null이거나 빈 문자열인 경우
     */
    public DeliveryRequest {
        requireText(to, "to");
        requireText(subject, "subject");
        requireText(body, "body");
        requireText(requestId, "requestId");
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be null or blank");
        }
    }
}
