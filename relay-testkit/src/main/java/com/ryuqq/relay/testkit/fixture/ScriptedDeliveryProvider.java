package com.ryuqq.relay.testkit.fixture;

import com.ryuqq.relay.core.model.DeliveryRequest;
import com.ryuqq.relay.core.provider.DeliveryFailure;
import com.ryuqq.relay.core.provider.DeliveryProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link DeliveryProvider} whose outcome per call is fixed in advance.
 *
 * <p><strong>Scripts:</strong></p>
 * <ul>
 *   <li>{@link #alwaysFailing(String)}: every call throws {@link DeliveryFailure}</li>
 *   <li>{@link #alwaysSucceeding(String)}: every call succeeds</li>
 *   <li>{@link #failingTimes(String, int)}: the first n calls fail, later calls succeed</li>
 *   <li>{@link #throwingUnchecked(String, RuntimeException)}: every call throws the given exception</li>
 * </ul>
 *
 * <p>Failure messages follow the form {@code "<name> failed to send email"}.
 * Invocations are counted and the received requests are kept for assertions.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ScriptedDeliveryProvider implements DeliveryProvider {

    private final String name;
    private final int failuresBeforeSuccess;
    private final RuntimeException unchecked;
    private final AtomicInteger invocations = new AtomicInteger();
    private final List<DeliveryRequest> received = new ArrayList<>();

    private ScriptedDeliveryProvider(String name, int failuresBeforeSuccess, RuntimeException unchecked) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.failuresBeforeSuccess = failuresBeforeSuccess;
        this.unchecked = unchecked;
    }

    public static ScriptedDeliveryProvider alwaysFailing(String name) {
        return new ScriptedDeliveryProvider(name, Integer.MAX_VALUE, null);
    }

    public static ScriptedDeliveryProvider alwaysSucceeding(String name) {
        return new ScriptedDeliveryProvider(name, 0, null);
    }

    public static ScriptedDeliveryProvider failingTimes(String name, int failures) {
        if (failures < 0) {
            throw new IllegalArgumentException("failures cannot be negative");
        }
        return new ScriptedDeliveryProvider(name, failures, null);
    }

    public static ScriptedDeliveryProvider throwingUnchecked(String name, RuntimeException exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        return new ScriptedDeliveryProvider(name, 0, exception);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void attemptDelivery(DeliveryRequest request) throws DeliveryFailure {
        int call = invocations.incrementAndGet();
        synchronized (received) {
            received.add(request);
        }
        if (unchecked != null) {
            throw unchecked;
        }
        if (call <= failuresBeforeSuccess) {
            throw new DeliveryFailure(name + " failed to send email");
        }
    }

    /**
     * Number of {@link #attemptDelivery(DeliveryRequest)} calls so far.
     */
    public int invocations() {
        return invocations.get();
    }

    /**
     * Snapshot of received requests in call order.
     */
    public List<DeliveryRequest> received() {
        synchronized (received) {
            return List.copyOf(received);
        }
    }
}
