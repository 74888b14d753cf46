/**
 * In-memory protection implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.adapter.inmemory.protection.InMemoryCircuitBreaker} - lock-guarded breaker state machine</li>
 *   <li>{@link com.ryuqq.relay.adapter.inmemory.protection.SlidingWindowRateLimiter} - sliding time window limiter</li>
 * </ul>
 *
 * <p>State is process-local and volatile; nothing survives a restart.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory.protection;
