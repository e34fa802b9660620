package io.twsbridge.application.event;

import io.twsbridge.domain.event.InboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Typed callbacks per event kind.
 *
 * Listeners run on the reader thread in registration order; they must be quick.
 * A listener registered for {@code InboundEvent.class} sees every event.
 * A throwing listener is logged and does not affect the others.
 *
 * <pre>
 * ListenerHandle handle = registry.addListener(OrderStatusEvent.class,
 *     status -> log.info("{} is {}", status.orderId(), status.status()));
 * ...
 * handle.remove();
 * </pre>
 */
public class EventListenerRegistry {
    private static final Logger log = LoggerFactory.getLogger(EventListenerRegistry.class);

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public <E extends InboundEvent> ListenerHandle addListener(Class<E> type, Consumer<? super E> listener) {
        if (type == null || listener == null) {
            throw new IllegalArgumentException("Event type and listener are required");
        }
        ListenerHandle handle = new ListenerHandle(this, sequence.incrementAndGet());
        registrations.add(new Registration<>(handle.id(), type, listener));
        log.debug("[Events] Added listener {} for {}", handle.id(), type.getSimpleName());
        return handle;
    }

    /**
     * @return true if the listener was registered
     */
    public boolean removeListener(ListenerHandle handle) {
        if (handle == null) {
            return false;
        }
        return registrations.removeIf(registration -> registration.id == handle.id());
    }

    public void publish(InboundEvent event) {
        for (Registration<?> registration : registrations) {
            registration.deliver(event);
        }
    }

    public int listenerCount() {
        return registrations.size();
    }

    public void clear() {
        registrations.clear();
    }

    private static final class Registration<E extends InboundEvent> {
        final long id;
        final Class<E> type;
        final Consumer<? super E> listener;

        Registration(long id, Class<E> type, Consumer<? super E> listener) {
            this.id = id;
            this.type = type;
            this.listener = listener;
        }

        void deliver(InboundEvent event) {
            if (!type.isInstance(event)) {
                return;
            }
            try {
                listener.accept(type.cast(event));
            } catch (Exception e) {
                log.error("[Events] Listener for {} threw exception on {}", type.getSimpleName(), event, e);
            }
        }
    }
}
