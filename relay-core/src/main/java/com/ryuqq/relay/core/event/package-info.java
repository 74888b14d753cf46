/**
 * 구조화 이벤트 패키지.
 *
 * <p>Circuit Breaker 상태 전이와 시도 단위 이벤트를 {@link com.ryuqq.relay.core.event.DeliveryEventListener}로
 * 전달하여, 상태 머신을 특정 출력 수단(콘솔, 로그, 메트릭)과 분리합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.event;
