package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import com.gravitychain.access.SystemRole;
import com.gravitychain.account.Address;
import com.gravitychain.state.AbstractState;
import lombok.extern.java.Log;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.logging.Level;

@Log
public abstract class AbstractConfigModule<T> extends AbstractState implements ConfigModule {

    protected final AccessControl accessControl;
    private final PendingConfig<T> config = new PendingConfig<>();

    protected AbstractConfigModule(AccessControl accessControl) {
        this.accessControl = accessControl;
    }

    public void initialize(Address caller, T value) {
        accessControl.requireCaller(caller, SystemRole.GENESIS);
        validate(value);
        markInitialized();
        config.initialize(value);
    }

    /**
     * Stages a value that becomes current at the next epoch boundary.
     */
    public void setForNextEpoch(Address caller, T value) {
        accessControl.requireCaller(caller, SystemRole.GOVERNANCE);
        requireInitialized();
        validate(value);
        config.stage(value);
        log.log(Level.INFO, String.format("Staged %s for next epoch: %s", getName(), value));
    }

    @Override
    public boolean applyPendingConfig(Address caller) {
        accessControl.requireCaller(caller, SystemRole.RECONFIGURATION);
        if (!config.commit()) {
            return false;
        }
        log.log(Level.INFO, String.format("Applied pending %s: %s", getName(), config.getCurrent()));
        return true;
    }

    @Override
    public boolean hasPendingConfig() {
        return config.hasPending();
    }

    public T getCurrent() {
        requireInitialized();
        return config.getCurrent();
    }

    public Optional<T> getPending() {
        return config.getPending();
    }

    @Nullable
    protected T currentOrNull() {
        return config.getCurrent();
    }

    protected abstract void validate(T value);
}
