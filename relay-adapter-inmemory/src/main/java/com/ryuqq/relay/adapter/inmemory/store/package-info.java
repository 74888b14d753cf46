/**
 * In-memory implementation of the idempotency SPI.
 *
 * <p>This package contains {@link com.ryuqq.relay.adapter.inmemory.store.InMemoryIdempotencyGuard},
 * a thread-safe, append-only set of completed requestIds.</p>
 *
 * <p><strong>Use Cases:</strong></p>
 * <ul>
 *   <li>Short-lived processes or bounded requestId universes</li>
 *   <li>Unit and integration testing</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory.store;
