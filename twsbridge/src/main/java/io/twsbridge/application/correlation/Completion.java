package io.twsbridge.application.correlation;

import io.twsbridge.domain.event.InboundEvent;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of a oneshot request: the terminal event plus everything that arrived
 * for the request before it, in decode order.
 */
public record Completion(InboundEvent terminal, List<InboundEvent> intermediates) {

    public Completion {
        if (terminal == null) {
            throw new IllegalArgumentException("Terminal event cannot be null");
        }
        intermediates = intermediates == null ? List.of() : List.copyOf(intermediates);
    }

    public <E extends InboundEvent> List<E> intermediatesOf(Class<E> type) {
        return intermediates.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
