/**
 * 재시도 정책과 대기 추상화.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.retry;
