package com.oracle.lats.search;

import com.oracle.lats.core.SearchEventListener;
import com.oracle.lats.search.model.LatsEvent;
import com.oracle.lats.search.model.LatsEventType;
import com.oracle.lats.search.model.SearchMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Synchronous fan-out of search events. A failing listener is logged and skipped.
 */
@Slf4j
public class EventEmitter {

    private final List<SearchEventListener> listeners;
    private final SearchMetrics metrics;

    public EventEmitter(List<SearchEventListener> listeners, SearchMetrics metrics) {
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.metrics = metrics;
    }

    public void emit(LatsEventType type, int iteration, String nodeId, String message) {
        emit(type, iteration, nodeId, message, Map.of());
    }

    public void emit(LatsEventType type, int iteration, String nodeId, String message,
                     Map<String, Object> metadata) {
        if (listeners.isEmpty()) {
            return;
        }
        LatsEvent event = LatsEvent.builder()
                .type(type)
                .iteration(iteration)
                .nodeId(nodeId)
                .message(message)
                .metadata(metadata)
                .build();
        for (SearchEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                metrics.recordEventCallbackFailure();
                log.error("Event callback failed for {}: {}", type, e.getMessage());
            }
        }
    }
}
