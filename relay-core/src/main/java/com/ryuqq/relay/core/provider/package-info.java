/**
 * 발송 Provider 추상화.
 *
 * <p>Provider는 {@link com.ryuqq.relay.core.provider.DeliveryProvider} 하나의 capability로 표현되며,
 * Fallback Chain에 추가하려면 목록에 인스턴스를 하나 더 넣으면 됩니다.
 * 실패는 {@link com.ryuqq.relay.core.provider.DeliveryFailure}로 전달합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.provider;
