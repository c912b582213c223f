package com.gravitychain.event;

@FunctionalInterface
public interface ChainEventListener {

    void onChainEvent(ChainEvent event);
}
