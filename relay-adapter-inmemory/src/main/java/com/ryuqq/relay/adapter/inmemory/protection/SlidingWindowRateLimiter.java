package com.ryuqq.relay.adapter.inmemory.protection;

import com.ryuqq.relay.core.protection.RateLimitStatus;
import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.protection.RateLimiterConfig;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Sliding-window implementation of {@link RateLimiter}.
 *
 * <p>Keeps the admission timestamps (epoch millis) of admitted requests in arrival order.
 * A timestamp {@code t} is inside the window while {@code now - t < windowSize}.</p>
 *
 * <p><strong>Consistency between status and enforcement:</strong></p>
 * <ul>
 *   <li>{@link #isLimited()} prunes expired timestamps, then appends when admitted</li>
 *   <li>{@link #getStatus()} counts with the same predicate without pruning</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> both operations synchronize on the timestamp deque and read
 * the clock while holding it, so the deque stays ordered oldest first.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private final RateLimiterConfig config;
    private final Clock clock;
    private final long windowMs;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    /**
     * Creates a limiter with the default configuration (10 requests per 60 seconds).
     *
     * @param clock time source
     */
    public SlidingWindowRateLimiter(Clock clock) {
        this(new RateLimiterConfig(), clock);
    }

    /**
     * Creates a limiter.
     *
     * @param config limiter configuration
     * @param clock time source
     * @throws IllegalArgumentException if config or clock is null
     */
    public SlidingWindowRateLimiter(RateLimiterConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.windowMs = toMillisSaturating(config);
    }

    @Override
    public boolean isLimited() {
        synchronized (timestamps) {
            // read under the lock so timestamps are appended in clock order
            long now = clock.millis();
            while (!timestamps.isEmpty() && !inWindow(timestamps.peekFirst(), now)) {
                timestamps.pollFirst();
            }
            if (timestamps.size() >= config.maxRequests()) {
                return true;
            }
            timestamps.addLast(now);
            return false;
        }
    }

    @Override
    public RateLimitStatus getStatus() {
        int active = 0;
        synchronized (timestamps) {
            long now = clock.millis();
            Iterator<Long> it = timestamps.descendingIterator();
            while (it.hasNext() && inWindow(it.next(), now)) {
                active++;
            }
        }
        return new RateLimitStatus(active, config.maxRequests(), config.windowSize());
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    private boolean inWindow(long timestamp, long now) {
        return now - timestamp < windowMs;
    }

    private static long toMillisSaturating(RateLimiterConfig config) {
        try {
            return config.windowSize().toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
