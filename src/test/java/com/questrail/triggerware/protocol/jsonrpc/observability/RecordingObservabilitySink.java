package com.questrail.triggerware.protocol.jsonrpc.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements JsonRpcObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTransportEvent(JsonRpcTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onProtocolEvent(JsonRpcProtocolEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(JsonRpcErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<JsonRpcProtocolEvent> getProtocolEvents(JsonRpcProtocolEvent.Kind kind) {
        return events.stream()
            .filter(e -> e instanceof JsonRpcProtocolEvent)
            .map(e -> (JsonRpcProtocolEvent) e)
            .filter(e -> e.kind() == kind)
            .collect(Collectors.toList());
    }

    public synchronized List<JsonRpcErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof JsonRpcErrorEvent)
            .map(e -> (JsonRpcErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
