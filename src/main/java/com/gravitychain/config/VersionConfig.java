package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import com.gravitychain.exception.config.InvalidConfigException;
import org.springframework.stereotype.Component;

/**
 * Protocol major version. Upgrades take effect at the next epoch and never go backwards.
 */
@Component
public class VersionConfig extends AbstractConfigModule<Long> {

    public VersionConfig(AccessControl accessControl) {
        super(accessControl);
    }

    @Override
    public String getName() {
        return "protocol version";
    }

    public long getMajorVersion() {
        return getCurrent();
    }

    @Override
    protected void validate(Long majorVersion) {
        if (majorVersion == null || majorVersion < 0) {
            throw new InvalidConfigException("Major version must not be negative");
        }
        Long current = currentOrNull();
        if (current != null && majorVersion <= current) {
            throw new InvalidConfigException(
                    String.format("Major version must increase, current %d, got %d", current, majorVersion));
        }
    }
}
