package com.insurance.claims.application.service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.insurance.claims.application.port.out.SubmissionEventListener;
import com.insurance.claims.domain.entity.SubmissionEvent;

/**
 * In-process fan-out of submission events to registered listeners.
 * <p>
 * Delivery is synchronous on the publishing thread, in registration order, so
 * listeners see the events of one attempt in the order they were raised.
 * A failing listener is logged and skipped; the others still receive the event.
 * </p>
 */
public class SubmissionEventBus {

    private static final Logger log = LoggerFactory.getLogger(SubmissionEventBus.class);

    private final CopyOnWriteArrayList<SubmissionEventListener> listeners = new CopyOnWriteArrayList<>();

    public SubmissionEventBus() {
    }

    public SubmissionEventBus(List<? extends SubmissionEventListener> initialListeners) {
        if (initialListeners != null) {
            initialListeners.forEach(this::subscribe);
        }
    }

    public void subscribe(SubmissionEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.addIfAbsent(listener);
    }

    public void unsubscribe(SubmissionEventListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Delivers an event to every listener.
     * Listener errors are logged but NOT rethrown.
     */
    public void publish(SubmissionEvent event) {
        for (SubmissionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("action=listener_error listener={} eventId={} type={} attemptId={} error={}",
                        listener.getClass().getSimpleName(), event.getEventId(), event.getType(),
                        event.getAttemptId(), e.getMessage(), e);
            }
        }
    }
}
