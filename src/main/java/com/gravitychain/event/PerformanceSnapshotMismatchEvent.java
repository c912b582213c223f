package com.gravitychain.event;

import lombok.Getter;
import lombok.ToString;

/**
 * Diagnostic emitted when an eviction pass receives a snapshot that does not line up with the active set.
 */
@Getter
@ToString(callSuper = false)
public class PerformanceSnapshotMismatchEvent extends ChainEvent {

    private final int snapshotLength;
    private final int activeCount;

    public PerformanceSnapshotMismatchEvent(Object source, int snapshotLength, int activeCount) {
        super(source);
        this.snapshotLength = snapshotLength;
        this.activeCount = activeCount;
    }
}
