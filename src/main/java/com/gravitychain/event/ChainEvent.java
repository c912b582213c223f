package com.gravitychain.event;

import java.util.EventObject;

/**
 * Base of all notifications emitted by the epoch core.
 */
public abstract class ChainEvent extends EventObject {

    /**
     * @param source the component that emitted the event
     * @throws IllegalArgumentException if source is null
     */
    protected ChainEvent(Object source) {
        super(source);
    }
}
