package com.ryuqq.relay.core.event;

/**
 * 엔진이 발행하는 구조화 이벤트.
 *
 * <p>상태 머신과 재시도 루프는 콘솔에 직접 기록하지 않고 이벤트를 발행하며,
 * 출력 방식은 주입된 {@link DeliveryEventListener}가 결정합니다.</p>
 *
 * <ul>
 *   <li>{@link CircuitStateChanged}: Circuit Breaker 상태 전이</li>
 *   <li>{@link AttemptFailed}: 발송 시도 실패 (다음 대기 시간 포함)</li>
 *   <li>{@link AttemptSucceeded}: 발송 시도 성공</li>
 *   <li>{@link ProviderSkipped}: Circuit Breaker 거부로 Provider 건너뜀</li>
 *   <li>{@link RequestRejected}: 중복 또는 Rate Limit으로 요청 거부</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public sealed interface DeliveryEvent
    permits CircuitStateChanged, AttemptFailed, AttemptSucceeded, ProviderSkipped, RequestRejected {
}
