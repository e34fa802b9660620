package io.twsbridge.application.event;

import io.twsbridge.domain.event.ErrorEvent;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.event.NextValidIdEvent;
import io.twsbridge.domain.event.OrderStatusEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EventListenerRegistry.
 */
class EventListenerRegistryTest {

    private final EventListenerRegistry registry = new EventListenerRegistry();

    @Test
    void testListenersReceiveOnlyTheirType() {
        List<OrderStatusEvent> statuses = new ArrayList<>();
        List<InboundEvent> everything = new ArrayList<>();
        registry.addListener(OrderStatusEvent.class, statuses::add);
        registry.addListener(InboundEvent.class, everything::add);

        registry.publish(new NextValidIdEvent(5));
        registry.publish(OrderStatusEvent.rejected(5, "margin"));

        assertEquals(1, statuses.size());
        assertEquals(2, everything.size(), "InboundEvent listeners see every event");
    }

    @Test
    void testThrowingListenerDoesNotBlockOthers() {
        List<ErrorEvent> received = new ArrayList<>();
        registry.addListener(ErrorEvent.class, e -> {
            throw new IllegalStateException("listener bug");
        });
        registry.addListener(ErrorEvent.class, received::add);

        assertDoesNotThrow(() -> registry.publish(new ErrorEvent(-1, 1100, "Connectivity lost")));
        assertEquals(1, received.size());
    }

    @Test
    void testHandleRemovesListener() {
        List<InboundEvent> received = new ArrayList<>();
        ListenerHandle handle = registry.addListener(InboundEvent.class, received::add);

        registry.publish(new NextValidIdEvent(1));
        assertTrue(handle.remove());
        registry.publish(new NextValidIdEvent(2));

        assertEquals(1, received.size());
        assertFalse(handle.remove(), "Already removed");
        assertEquals(0, registry.listenerCount());
    }

    @Test
    void testCloseableHandle() {
        List<InboundEvent> received = new ArrayList<>();
        try (ListenerHandle ignored = registry.addListener(InboundEvent.class, received::add)) {
            registry.publish(new NextValidIdEvent(1));
        }
        registry.publish(new NextValidIdEvent(2));

        assertEquals(1, received.size());
    }

    @Test
    void testClear() {
        registry.addListener(InboundEvent.class, e -> { });
        registry.addListener(ErrorEvent.class, e -> { });

        registry.clear();

        assertEquals(0, registry.listenerCount());
    }

    @Test
    void testNullArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.addListener(null, e -> { }));
        assertThrows(IllegalArgumentException.class, () -> registry.addListener(ErrorEvent.class, null));
    }
}
