package com.ryuqq.relay.testkit.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Manually advanced {@link Clock} for deterministic time-dependent tests.
 *
 * <p>Time only moves when {@link #advance(Duration)} or {@link #setInstant(Instant)} is called.
 * Reads and writes are synchronized so the clock can be shared across threads.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * MutableClock clock = MutableClock.startingAt(Instant.parse("2024-01-01T00:00:00Z"));
 * CircuitBreaker breaker = new InMemoryCircuitBreaker("SendGrid", config, clock, listener);
 *
 * clock.advance(Duration.ofSeconds(30));
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    /**
     * Default starting instant.
     */
    public static final Instant DEFAULT_START = Instant.parse("2024-01-01T00:00:00Z");

    private final ZoneId zone;
    private Instant instant;

    private MutableClock(Instant instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    /**
     * Creates a clock at {@link #DEFAULT_START} in UTC.
     */
    public static MutableClock create() {
        return startingAt(DEFAULT_START);
    }

    /**
     * Creates a clock at the given instant in UTC.
     *
     * @param start starting instant
     * @return new clock
     */
    public static MutableClock startingAt(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        return new MutableClock(start, ZoneOffset.UTC);
    }

    /**
     * Moves the clock forward.
     *
     * @param amount non-negative amount
     */
    public synchronized void advance(Duration amount) {
        if (amount == null || amount.isNegative()) {
            throw new IllegalArgumentException("amount must be non-negative");
        }
        instant = instant.plus(amount);
    }

    /**
     * Moves the clock forward by milliseconds.
     *
     * @param millis non-negative amount in milliseconds
     */
    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /**
     * Sets the current instant. Moving backwards is allowed.
     *
     * @param instant new current instant
     */
    public synchronized void setInstant(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        this.instant = instant;
    }

    @Override
    public synchronized Instant instant() {
        return instant;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        synchronized (this) {
            return new MutableClock(instant, zone);
        }
    }
}
