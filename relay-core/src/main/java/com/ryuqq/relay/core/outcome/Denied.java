package com.ryuqq.relay.core.outcome;

/**
 * Circuit Breaker에 의한 호출 거부.
 *
 * <p>재시도 예산을 소모하지 않으며, 오케스트레이터는 다음 Provider로 넘어갑니다.</p>
 *
 * @param providerName Provider 이름
 * @param reason 거부 사유
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Denied(
    String providerName,
    String reason
) implements ProviderResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException providerName 또는 reason이 비어 있는 경우
     */
    public Denied {
        if (providerName == null || providerName.isBlank()) {
            throw new IllegalArgumentException("providerName cannot be null or blank");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    @Override
    public int attempts() {
        return 0;
    }
}
