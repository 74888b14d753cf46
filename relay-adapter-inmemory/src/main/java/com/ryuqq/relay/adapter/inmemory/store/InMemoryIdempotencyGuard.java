package com.ryuqq.relay.adapter.inmemory.store;

import com.ryuqq.relay.core.spi.IdempotencyGuard;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link IdempotencyGuard}.
 *
 * <p>Completed requestIds are kept in a concurrent set for the lifetime of the instance.
 * There is no eviction and no removal.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link ConcurrentHashMap#newKeySet()} makes each membership test and insert atomic</li>
 *   <li>No manual locking required</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * IdempotencyGuard guard = new InMemoryIdempotencyGuard();
 *
 * guard.isDuplicate("req-1");   // false
 * guard.markComplete("req-1");
 * guard.isDuplicate("req-1");   // true
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InMemoryIdempotencyGuard implements IdempotencyGuard {

    /**
     * Completed requestIds.
     */
    private final Set<String> completed;

    /**
     * Creates a new InMemoryIdempotencyGuard with empty storage.
     */
    public InMemoryIdempotencyGuard() {
        this.completed = ConcurrentHashMap.newKeySet();
    }

    @Override
    public boolean isDuplicate(String requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return completed.contains(requestId);
    }

    @Override
    public void markComplete(String requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        completed.add(requestId);
    }

    /**
     * Returns the number of completed requestIds.
     *
     * <p>This method is useful for testing and monitoring.</p>
     *
     * @return the number of completed requestIds
     */
    public int size() {
        return completed.size();
    }
}
