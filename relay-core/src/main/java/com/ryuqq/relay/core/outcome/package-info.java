/**
 * Provider별 처리 결과 ({@link com.ryuqq.relay.core.outcome.ProviderResult}).
 *
 * <p>폴백 체인은 Provider마다 정확히 하나의 결과를 남기며,
 * 최종 {@link com.ryuqq.relay.core.model.DeliveryOutcome}은 이 결과들을 집계합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.outcome;
