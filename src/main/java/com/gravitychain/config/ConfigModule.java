package com.gravitychain.config;

import com.gravitychain.account.Address;

/**
 * A per-epoch tunable whose staged changes are committed only by the reconfiguration apply step.
 */
public interface ConfigModule {

    String getName();

    /**
     * Promotes the staged value, if any, to the current one.
     *
     * @param caller must be the reconfiguration role
     * @return true if a staged value was committed
     */
    boolean applyPendingConfig(Address caller);

    boolean hasPendingConfig();
}
