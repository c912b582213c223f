package com.gravitychain.event;

import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers events synchronously, in subscription order, on the calling thread.
 */
@Log
@Component
public class ChainEventPublisher {

    private final List<ChainEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(ChainEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(ChainEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(ChainEvent event) {
        log.fine(String.format("Publishing %s", event));
        for (ChainEventListener listener : listeners) {
            listener.onChainEvent(event);
        }
    }
}
