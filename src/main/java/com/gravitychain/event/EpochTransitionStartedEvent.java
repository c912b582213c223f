package com.gravitychain.event;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = false)
public class EpochTransitionStartedEvent extends ChainEvent {

    private final long epoch;
    private final boolean awaitingDkg;

    public EpochTransitionStartedEvent(Object source, long epoch, boolean awaitingDkg) {
        super(source);
        this.epoch = epoch;
        this.awaitingDkg = awaitingDkg;
    }
}
