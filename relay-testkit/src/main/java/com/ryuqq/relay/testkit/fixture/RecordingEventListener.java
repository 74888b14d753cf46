package com.ryuqq.relay.testkit.fixture;

import com.ryuqq.relay.core.event.DeliveryEvent;
import com.ryuqq.relay.core.event.DeliveryEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * {@link DeliveryEventListener} that keeps every received event.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RecordingEventListener implements DeliveryEventListener {

    private final List<DeliveryEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(DeliveryEvent event) {
        events.add(event);
    }

    public List<DeliveryEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Events of the given type in arrival order.
     *
     * @param type event type
     * @param <E> event type
     * @return matching events
     */
    public <E extends DeliveryEvent> List<E> eventsOfType(Class<E> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
