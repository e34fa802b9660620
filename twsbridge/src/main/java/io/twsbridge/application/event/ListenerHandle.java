package io.twsbridge.application.event;

/**
 * Returned by {@link EventListenerRegistry#addListener}; closing it removes the listener.
 */
public final class ListenerHandle implements AutoCloseable {

    private final EventListenerRegistry registry;
    private final long id;

    ListenerHandle(EventListenerRegistry registry, long id) {
        this.registry = registry;
        this.id = id;
    }

    long id() {
        return id;
    }

    public boolean remove() {
        return registry.removeListener(this);
    }

    @Override
    public void close() {
        remove();
    }
}
