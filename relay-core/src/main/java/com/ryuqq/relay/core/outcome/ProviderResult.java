package com.ryuqq.relay.core.outcome;

/**
 * 단일 Provider에 대한 처리 결과.
 *
 * <p>ProviderResult는 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Delivered}: 재시도 루프 안에서 발송 성공</li>
 *   <li>{@link Exhausted}: 재시도 한도까지 모두 실패</li>
 *   <li>{@link Denied}: Circuit Breaker가 호출을 거부 (시도 0회)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public sealed interface ProviderResult permits Delivered, Exhausted, Denied {

    /**
     * Provider 이름.
     *
     * @return Provider 이름
     */
    String providerName();

    /**
     * 이 Provider에 대해 수행한 시도 횟수.
     *
     * @return 시도 횟수 (Denied는 항상 0)
     */
    int attempts();

    /**
     * 발송 성공 여부 확인.
     *
     * @return 성공 여부
     */
    default boolean isDelivered() {
        return this instanceof Delivered;
    }
}
