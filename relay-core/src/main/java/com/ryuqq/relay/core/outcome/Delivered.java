package com.ryuqq.relay.core.outcome;

/**
 * 발송 성공.
 *
 * @param providerName Provider 이름
 * @param attempts 성공까지 걸린 시도 횟수 (1 이상)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Delivered(
    String providerName,
    int attempts
) implements ProviderResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException providerName이 비어 있거나 attempts가 양수가 아닌 경우
     */
    public Delivered {
        if (providerName == null || providerName.isBlank()) {
            throw new IllegalArgumentException("providerName cannot be null or blank");
        }
        if (attempts <= 0) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }
}
