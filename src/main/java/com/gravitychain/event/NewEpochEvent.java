package com.gravitychain.event;

import lombok.Getter;
import lombok.ToString;

/**
 * Emitted once a reconfiguration has been fully applied.
 */
@Getter
@ToString(callSuper = false)
public class NewEpochEvent extends ChainEvent {

    private final long epoch;
    private final long lastReconfigurationTimeMicros;

    public NewEpochEvent(Object source, long epoch, long lastReconfigurationTimeMicros) {
        super(source);
        this.epoch = epoch;
        this.lastReconfigurationTimeMicros = lastReconfigurationTimeMicros;
    }
}
