package com.gravitychain.timestamp;

import com.gravitychain.access.AccessControl;
import com.gravitychain.access.SystemRole;
import com.gravitychain.account.Address;
import com.gravitychain.exception.timestamp.InvalidTimestampException;
import com.gravitychain.state.AbstractState;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

/**
 * Blocks proposed by the system caller are NIL blocks: they must carry the current time unchanged.
 * Every other block may only keep or move the time forward.
 */
@Log
@Component
@RequiredArgsConstructor
public class TimestampState extends AbstractState implements Clock {

    private final AccessControl accessControl;

    private long microseconds;

    public void initialize(Address caller, long genesisMicros) {
        accessControl.requireCaller(caller, SystemRole.GENESIS);
        if (genesisMicros < 0) {
            throw new InvalidTimestampException("Genesis timestamp must not be negative");
        }
        markInitialized();
        this.microseconds = genesisMicros;
    }

    @Override
    public long nowMicros() {
        return microseconds;
    }

    @Override
    public void requireValidAdvance(Address proposer, long timestampMicros) {
        requireInitialized();
        if (accessControl.hasRole(proposer, SystemRole.SYSTEM_CALLER)) {
            if (timestampMicros != microseconds) {
                throw new InvalidTimestampException(String.format(
                        "NIL block must keep the current time %d, got %d", microseconds, timestampMicros));
            }
        } else if (timestampMicros < microseconds) {
            throw new InvalidTimestampException(String.format(
                    "Block time %d is before the current time %d", timestampMicros, microseconds));
        }
    }

    @Override
    public void advance(Address caller, Address proposer, long timestampMicros) {
        accessControl.requireCaller(caller, SystemRole.BLOCK);
        requireValidAdvance(proposer, timestampMicros);
        microseconds = timestampMicros;
        log.finest(String.format("Clock at %d", microseconds));
    }
}
