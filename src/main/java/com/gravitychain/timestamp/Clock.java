package com.gravitychain.timestamp;

import com.gravitychain.account.Address;

/**
 * Authoritative on-chain time in microseconds. Advanced once per block.
 */
public interface Clock {

    long MICROS_PER_SECOND = 1_000_000L;

    long nowMicros();

    default long nowSeconds() {
        return nowMicros() / MICROS_PER_SECOND;
    }

    /**
     * Checks, without side effects, that {@link #advance} would accept the given block time.
     *
     * @throws com.gravitychain.exception.timestamp.InvalidTimestampException if it would not
     */
    void requireValidAdvance(Address proposer, long timestampMicros);

    void advance(Address caller, Address proposer, long timestampMicros);
}
