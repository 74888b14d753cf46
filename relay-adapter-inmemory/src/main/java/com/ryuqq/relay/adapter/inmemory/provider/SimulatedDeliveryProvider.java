package com.ryuqq.relay.adapter.inmemory.provider;

import com.ryuqq.relay.core.model.DeliveryRequest;
import com.ryuqq.relay.core.provider.DeliveryFailure;
import com.ryuqq.relay.core.provider.DeliveryProvider;

import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated {@link DeliveryProvider} that succeeds with a fixed probability.
 *
 * <p>Used for demos and load experiments where no real mail provider is wired.
 * {@link #sendGrid()} and {@link #mailgun()} reproduce the two stock providers
 * (20% and 30% success respectively).</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class SimulatedDeliveryProvider implements DeliveryProvider {

    private final String name;
    private final double successProbability;
    private final Random random;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    /**
     * Creates a simulated provider.
     *
     * @param name provider name
     * @param successProbability probability of success per attempt (0.0 ~ 1.0)
     * @param random randomness source
     * @throws IllegalArgumentException if name is blank, random is null or probability is out of range
     */
    public SimulatedDeliveryProvider(String name, double successProbability, Random random) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (successProbability < 0.0 || successProbability > 1.0) {
            throw new IllegalArgumentException(
                "successProbability must be between 0.0 and 1.0 (current: " + successProbability + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.name = name;
        this.successProbability = successProbability;
        this.random = random;
    }

    /**
     * Primary stock provider: "SendGrid", 20% success.
     */
    public static SimulatedDeliveryProvider sendGrid() {
        return new SimulatedDeliveryProvider("SendGrid", 0.2, new Random());
    }

    /**
     * Fallback stock provider: "Mailgun", 30% success.
     */
    public static SimulatedDeliveryProvider mailgun() {
        return new SimulatedDeliveryProvider("Mailgun", 0.3, new Random());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void attemptDelivery(DeliveryRequest request) throws DeliveryFailure {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (random.nextDouble() >= successProbability) {
            failed.incrementAndGet();
            throw new DeliveryFailure(name + " failed to send email");
        }
        delivered.incrementAndGet();
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    public long getFailedCount() {
        return failed.get();
    }
}
