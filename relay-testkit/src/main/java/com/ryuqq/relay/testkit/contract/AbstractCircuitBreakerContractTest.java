package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.event.CircuitStateChanged;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.protection.CircuitBreakerStatus;
import com.ryuqq.relay.testkit.fixture.MutableClock;
import com.ryuqq.relay.testkit.fixture.RecordingEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link CircuitBreaker} implementations.
 *
 * <p>Every implementation must pass these scenarios with
 * threshold 3, recovery timeout 30s and monitoring window 60s.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A fresh breaker is CLOSED and permits calls</li>
 *   <li>Threshold failures trip the breaker to OPEN</li>
 *   <li>OPEN denies calls until the recovery timeout elapses</li>
 *   <li>After the timeout one probe is admitted in HALF_OPEN</li>
 *   <li>Probe success closes the breaker, probe failure reopens it</li>
 *   <li>Failures further apart than the monitoring window do not accumulate</li>
 *   <li>Reset restores the initial state</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyCircuitBreakerTest extends AbstractCircuitBreakerContractTest {
 *     {@literal @}Override
 *     protected CircuitBreaker createBreaker(String name, CircuitBreakerConfig config,
 *                                            MutableClock clock, RecordingEventListener listener) {
 *         return new MyCircuitBreaker(name, config, clock, listener);
 *     }
 * }
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public abstract class AbstractCircuitBreakerContractTest {

    protected static final String PROVIDER = "SendGrid";

    protected MutableClock clock;
    protected RecordingEventListener listener;
    protected CircuitBreakerConfig config;
    protected CircuitBreaker breaker;

    /**
     * Creates the implementation under test.
     */
    protected abstract CircuitBreaker createBreaker(String name, CircuitBreakerConfig config,
                                                    MutableClock clock, RecordingEventListener listener);

    @BeforeEach
    void setUpBreaker() {
        clock = MutableClock.create();
        listener = new RecordingEventListener();
        config = new CircuitBreakerConfig(3, Duration.ofSeconds(30), Duration.ofSeconds(60));
        breaker = createBreaker(PROVIDER, config, clock, listener);
    }

    protected void trip() {
        for (int i = 0; i < config.failureThreshold(); i++) {
            breaker.recordFailure();
        }
    }

    @Test
    void testNewBreaker_IsClosedAndPermitsCalls() {
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertTrue(breaker.isCallPermitted());
        assertTrue(breaker.tryAcquire());
        assertEquals(PROVIDER, breaker.getName());

        CircuitBreakerStatus status = breaker.getStatus();
        assertEquals(0, status.failureCount());
        assertNull(status.nextAttemptTime(), "nextAttemptTime is absent while CLOSED");
    }

    @Test
    void testFailuresBelowThreshold_StayClosed() {
        // When
        breaker.recordFailure();
        breaker.recordFailure();

        // Then
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(2, breaker.getStatus().failureCount());
        assertTrue(breaker.tryAcquire());
    }

    @Test
    void testThresholdFailures_TripToOpen() {
        // When
        trip();

        // Then
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertFalse(breaker.isCallPermitted());
        assertFalse(breaker.tryAcquire());
        assertEquals(clock.instant().plus(config.recoveryTimeout()), breaker.getStatus().nextAttemptTime());

        List<CircuitStateChanged> transitions = listener.eventsOfType(CircuitStateChanged.class);
        assertEquals(1, transitions.size());
        assertEquals(CircuitBreakerState.CLOSED, transitions.get(0).from());
        assertEquals(CircuitBreakerState.OPEN, transitions.get(0).to());
        assertEquals(3, transitions.get(0).failureCount());
    }

    @Test
    void testOpen_DeniesUntilRecoveryTimeoutElapses() {
        // Given
        trip();

        // When: just before the recovery timeout
        clock.advance(config.recoveryTimeout().minusMillis(1));

        // Then
        assertFalse(breaker.tryAcquire());
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
    }

    @Test
    void testOpen_AfterRecoveryTimeout_AdmitsSingleProbe() {
        // Given
        trip();
        clock.advance(config.recoveryTimeout());

        // When
        boolean first = breaker.tryAcquire();
        boolean second = breaker.tryAcquire();

        // Then
        assertTrue(first, "first call after timeout is the probe");
        assertFalse(second, "only one probe may be in flight");
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
        assertFalse(breaker.isCallPermitted());
    }

    @Test
    void testIsCallPermitted_DoesNotTransition() {
        // Given
        trip();
        clock.advance(config.recoveryTimeout());

        // When
        boolean permitted = breaker.isCallPermitted();

        // Then
        assertTrue(permitted);
        assertEquals(CircuitBreakerState.OPEN, breaker.getState(), "reads must not mutate state");
    }

    @Test
    void testHalfOpenProbeSuccess_Closes() {
        // Given
        trip();
        clock.advance(config.recoveryTimeout());
        assertTrue(breaker.tryAcquire());

        // When
        breaker.recordSuccess();

        // Then
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getStatus().failureCount());
        assertTrue(breaker.tryAcquire());

        List<CircuitStateChanged> transitions = listener.eventsOfType(CircuitStateChanged.class);
        assertEquals(List.of(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED),
            transitions.stream().map(CircuitStateChanged::to).toList());
    }

    @Test
    void testHalfOpenProbeFailure_Reopens() {
        // Given
        trip();
        clock.advance(config.recoveryTimeout());
        assertTrue(breaker.tryAcquire());

        // When
        breaker.recordFailure();

        // Then
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(clock.instant().plus(config.recoveryTimeout()), breaker.getStatus().nextAttemptTime());
        assertFalse(breaker.tryAcquire());
    }

    @Test
    void testReleasePermission_FreesProbeSlot() {
        // Given
        trip();
        clock.advance(config.recoveryTimeout());
        assertTrue(breaker.tryAcquire());

        // When
        breaker.releasePermission();

        // Then
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
        assertTrue(breaker.tryAcquire());
    }

    @Test
    void testFailuresOutsideMonitoringWindow_DoNotAccumulate() {
        // Given
        breaker.recordFailure();
        breaker.recordFailure();

        // When: next failure arrives after the window
        clock.advance(config.monitoringWindow().plusSeconds(1));
        breaker.recordFailure();

        // Then
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(1, breaker.getStatus().failureCount());
    }

    @Test
    void testFailuresInsideMonitoringWindow_Accumulate() {
        breaker.recordFailure();
        clock.advance(config.monitoringWindow());
        breaker.recordFailure();
        clock.advance(config.monitoringWindow());
        breaker.recordFailure();

        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
    }

    @Test
    void testSuccessWhileClosed_ResetsFailureCount() {
        breaker.recordFailure();
        breaker.recordFailure();

        breaker.recordSuccess();
        breaker.recordFailure();

        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(1, breaker.getStatus().failureCount());
    }

    @Test
    void testReset_RestoresInitialState() {
        // Given
        trip();

        // When
        breaker.reset();

        // Then
        CircuitBreakerStatus status = breaker.getStatus();
        assertEquals(CircuitBreakerState.CLOSED, status.state());
        assertEquals(0, status.failureCount());
        assertNull(status.nextAttemptTime());
        assertTrue(breaker.tryAcquire());
    }

    @Test
    void testStatus_ReportsConfig() {
        assertEquals(config, breaker.getStatus().config());
        assertEquals(PROVIDER, breaker.getStatus().providerName());
    }
}
