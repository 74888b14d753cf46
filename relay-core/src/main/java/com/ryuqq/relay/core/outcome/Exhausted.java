package com.ryuqq.relay.core.outcome;

/**
 * 재시도 한도 소진.
 *
 * <p>Provider가 설정된 최대 시도 횟수만큼 모두 실패한 경우입니다.
 * 이 결과가 나오면 해당 Provider의 Circuit Breaker에 실패가 기록됩니다.</p>
 *
 * @param providerName Provider 이름
 * @param attempts 수행한 시도 횟수
 * @param lastError 마지막 시도의 실패 사유
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Exhausted(
    String providerName,
    int attempts,
    String lastError
) implements ProviderResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException providerName 또는 lastError가 비어 있거나 attempts가 양수가 아닌 경우
     */
    public Exhausted {
        if (providerName == null || providerName.isBlank()) {
            throw new IllegalArgumentException("providerName cannot be null or blank");
        }
        if (attempts <= 0) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
        if (lastError == null || lastError.isBlank()) {
            throw new IllegalArgumentException("lastError cannot be null or blank");
        }
    }
}
