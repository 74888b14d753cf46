/**
 * 발송 도메인 모델.
 *
 * <p>{@link com.ryuqq.relay.core.model.DeliveryRequest}는 엔진의 입력,
 * {@link com.ryuqq.relay.core.model.DeliveryOutcome}은 출력입니다.
 * 두 타입 모두 불변 record입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.model;
