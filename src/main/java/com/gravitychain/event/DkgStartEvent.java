package com.gravitychain.event;

import com.gravitychain.dkg.DkgSessionMetadata;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = false)
public class DkgStartEvent extends ChainEvent {

    private final DkgSessionMetadata metadata;
    private final long startTimeMicros;

    public DkgStartEvent(Object source, DkgSessionMetadata metadata, long startTimeMicros) {
        super(source);
        this.metadata = metadata;
        this.startTimeMicros = startTimeMicros;
    }
}
