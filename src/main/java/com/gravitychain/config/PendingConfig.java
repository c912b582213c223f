package com.gravitychain.config;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Two-phase configuration cell. A staged value stays invisible to readers until
 * {@link #commit()} is called at an epoch boundary. Staging again before the commit
 * replaces the previously staged value.
 */
public class PendingConfig<T> {

    @Nullable
    private T current;
    @Nullable
    private T pending;

    public void initialize(T value) {
        this.current = Objects.requireNonNull(value, "value");
        this.pending = null;
    }

    public void stage(T value) {
        this.pending = Objects.requireNonNull(value, "value");
    }

    /**
     * @return true if a staged value was promoted to current
     */
    public boolean commit() {
        if (pending == null) {
            return false;
        }
        current = pending;
        pending = null;
        return true;
    }

    @Nullable
    public T getCurrent() {
        return current;
    }

    public Optional<T> getPending() {
        return Optional.ofNullable(pending);
    }

    public boolean hasPending() {
        return pending != null;
    }
}
