package com.ryuqq.relay.testkit.fixture;

import com.ryuqq.relay.core.retry.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link Sleeper} that records requested delays instead of blocking.
 *
 * <p>When built with {@link #advancing(MutableClock)}, each sleep also advances the clock,
 * so time-based protections observe the backoff as if it had really elapsed.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final MutableClock clock;
    private final List<Duration> delays = new ArrayList<>();

    private RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    /**
     * Sleeper that only records.
     */
    public static RecordingSleeper recording() {
        return new RecordingSleeper(null);
    }

    /**
     * Sleeper that records and advances the given clock.
     *
     * @param clock clock to advance
     */
    public static RecordingSleeper advancing(MutableClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new RecordingSleeper(clock);
    }

    @Override
    public void sleep(Duration duration) {
        synchronized (delays) {
            delays.add(duration);
        }
        if (clock != null) {
            clock.advance(duration);
        }
    }

    /**
     * Returns a snapshot of the recorded delays in call order.
     */
    public List<Duration> delays() {
        synchronized (delays) {
            return List.copyOf(delays);
        }
    }

    /**
     * Sum of all recorded delays.
     */
    public Duration totalSlept() {
        return delays().stream().reduce(Duration.ZERO, Duration::plus);
    }
}
