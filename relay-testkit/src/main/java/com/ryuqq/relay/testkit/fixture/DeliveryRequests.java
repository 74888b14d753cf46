package com.ryuqq.relay.testkit.fixture;

import com.ryuqq.relay.core.model.DeliveryRequest;

import java.util.UUID;

/**
 * Test factory for {@link DeliveryRequest}.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class DeliveryRequests {

    private DeliveryRequests() {
    }

    /**
     * Request with the given requestId and fixed address, subject and body.
     */
    public static DeliveryRequest withId(String requestId) {
        return new DeliveryRequest("user@example.com", "Welcome", "Hello from Relay", requestId);
    }

    /**
     * Request with a random UUID requestId.
     */
    public static DeliveryRequest random() {
        return withId(UUID.randomUUID().toString());
    }
}
