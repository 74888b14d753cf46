package com.ryuqq.relay.adapter.inmemory.protection;

import com.ryuqq.relay.core.event.CircuitStateChanged;
import com.ryuqq.relay.core.event.DeliveryEventListener;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerFactory;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.protection.CircuitBreakerStatus;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link CircuitBreaker}.
 *
 * <p>Failure counting decays by time rather than by count: a failure recorded more than
 * {@code monitoringWindow} after the previous one starts a fresh count. HALF_OPEN admits a single
 * in-flight probe.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Every read-modify-write sequence runs under a single {@link ReentrantLock}</li>
 *   <li>{@link CircuitStateChanged} events are published after the lock is released</li>
 *   <li>A listener exception propagates to the caller after the state change is committed;
 *       a probe admitted by {@link #tryAcquire()} is released first</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CircuitBreaker cb = new InMemoryCircuitBreaker(
 *     "SendGrid", new CircuitBreakerConfig(), Clock.systemUTC(), listener);
 *
 * if (cb.tryAcquire()) {
 *     // call provider, then recordSuccess() / recordFailure()
 * }
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreaker implements CircuitBreaker {

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final DeliveryEventListener listener;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private Instant nextAttemptTime;
    private boolean probeInFlight;

    /**
     * Creates a breaker in the CLOSED state.
     *
     * @param name provider name
     * @param config breaker configuration
     * @param clock time source
     * @param listener receiver of state transition events
     * @throws IllegalArgumentException if any argument is null or name is blank
     */
    public InMemoryCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock,
                                  DeliveryEventListener listener) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Returns a factory producing a fresh breaker per provider with a shared configuration.
     *
     * @param config configuration applied to every breaker
     * @param clock time source
     * @return circuit breaker factory
     */
    public static CircuitBreakerFactory factory(CircuitBreakerConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return (providerName, listener) -> new InMemoryCircuitBreaker(providerName, config, clock, listener);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean tryAcquire() {
        CircuitStateChanged event = null;
        boolean permitted;

        lock.lock();
        try {
            switch (state) {
                case CLOSED -> permitted = true;
                case OPEN -> {
                    Instant now = clock.instant();
                    if (!now.isBefore(nextAttemptTime)) {
                        event = transitionTo(CircuitBreakerState.HALF_OPEN, now);
                        probeInFlight = true;
                        permitted = true;
                    } else {
                        permitted = false;
                    }
                }
                case HALF_OPEN -> {
                    permitted = !probeInFlight;
                    probeInFlight = true;
                }
                default -> throw new IllegalStateException("Unknown state: " + state);
            }
        } finally {
            lock.unlock();
        }

        try {
            publish(event);
        } catch (RuntimeException e) {
            // the caller never sees the permit, so the probe slot must not stay claimed
            releasePermission();
            throw e;
        }
        return permitted;
    }

    @Override
    public boolean isCallPermitted() {
        lock.lock();
        try {
            return switch (state) {
                case CLOSED -> true;
                case OPEN -> !clock.instant().isBefore(nextAttemptTime);
                case HALF_OPEN -> !probeInFlight;
            };
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess() {
        CircuitStateChanged event = null;

        lock.lock();
        try {
            failureCount = 0;
            if (state == CircuitBreakerState.HALF_OPEN) {
                event = transitionTo(CircuitBreakerState.CLOSED, clock.instant());
                nextAttemptTime = null;
                probeInFlight = false;
            }
        } finally {
            lock.unlock();
        }

        publish(event);
    }

    @Override
    public void recordFailure() {
        CircuitStateChanged event = null;

        lock.lock();
        try {
            Instant now = clock.instant();

            // stale failures do not count toward the threshold
            if (lastFailureTime == null
                || Duration.between(lastFailureTime, now).compareTo(config.monitoringWindow()) > 0) {
                failureCount = 0;
            }
            if (failureCount < Integer.MAX_VALUE) {
                failureCount++;
            }
            lastFailureTime = now;

            // a failed probe always reopens
            if (failureCount >= config.failureThreshold() || state == CircuitBreakerState.HALF_OPEN) {
                nextAttemptTime = plusSaturating(now, config.recoveryTimeout());
                probeInFlight = false;
                if (state != CircuitBreakerState.OPEN) {
                    event = transitionTo(CircuitBreakerState.OPEN, now);
                }
            }
        } finally {
            lock.unlock();
        }

        publish(event);
    }

    @Override
    public void releasePermission() {
        lock.lock();
        try {
            if (state == CircuitBreakerState.HALF_OPEN) {
                probeInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerStatus getStatus() {
        lock.lock();
        try {
            Instant next = state == CircuitBreakerState.OPEN ? nextAttemptTime : null;
            return new CircuitBreakerStatus(name, state, failureCount, next, config);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        CircuitStateChanged event = null;

        lock.lock();
        try {
            if (state != CircuitBreakerState.CLOSED) {
                event = transitionTo(CircuitBreakerState.CLOSED, clock.instant());
            }
            failureCount = 0;
            lastFailureTime = null;
            nextAttemptTime = null;
            probeInFlight = false;
        } finally {
            lock.unlock();
        }

        publish(event);
    }

    /**
     * Must be called while holding the lock.
     */
    private CircuitStateChanged transitionTo(CircuitBreakerState next, Instant now) {
        CircuitBreakerState previous = state;
        state = next;
        return new CircuitStateChanged(name, previous, next, failureCount, now);
    }

    private void publish(CircuitStateChanged event) {
        if (event != null) {
            listener.onEvent(event);
        }
    }

    private static Instant plusSaturating(Instant instant, Duration amount) {
        try {
            return instant.plus(amount);
        } catch (DateTimeException | ArithmeticException e) {
            return Instant.MAX;
        }
    }

    @Override
    public String toString() {
        return "InMemoryCircuitBreaker{" + name + ", " + getState() + '}';
    }
}
