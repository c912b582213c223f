package com.gravitychain.event;

import com.gravitychain.account.Address;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = false)
public class NewBlockEvent extends ChainEvent {

    private final long height;
    private final long epoch;
    private final Address proposer;
    private final long timestampMicros;

    public NewBlockEvent(Object source, long height, long epoch, Address proposer, long timestampMicros) {
        super(source);
        this.height = height;
        this.epoch = epoch;
        this.proposer = proposer;
        this.timestampMicros = timestampMicros;
    }
}
