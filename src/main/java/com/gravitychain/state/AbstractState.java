package com.gravitychain.state;

import com.gravitychain.exception.state.AlreadyInitializedException;
import com.gravitychain.exception.state.NotInitializedException;
import lombok.Getter;

/**
 * Base for components that are bootstrapped exactly once at genesis.
 */
public abstract class AbstractState {

    @Getter
    protected boolean initialized;

    protected void markInitialized() {
        if (initialized) {
            throw new AlreadyInitializedException(getClass().getSimpleName());
        }
        initialized = true;
    }

    protected void requireInitialized() {
        if (!initialized) {
            throw new NotInitializedException(getClass().getSimpleName());
        }
    }
}
