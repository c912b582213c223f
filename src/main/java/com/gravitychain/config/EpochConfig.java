package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import com.gravitychain.exception.config.InvalidConfigException;
import org.springframework.stereotype.Component;

@Component
public class EpochConfig extends AbstractConfigModule<Long> {

    public EpochConfig(AccessControl accessControl) {
        super(accessControl);
    }

    @Override
    public String getName() {
        return "epoch interval";
    }

    public long getIntervalMicros() {
        return getCurrent();
    }

    @Override
    protected void validate(Long intervalMicros) {
        if (intervalMicros == null || intervalMicros <= 0) {
            throw new InvalidConfigException("Epoch interval must be positive, got " + intervalMicros);
        }
    }
}
