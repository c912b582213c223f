package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import com.gravitychain.exception.config.InvalidConfigException;
import org.apache.commons.lang3.ArrayUtils;

import java.util.Arrays;

/**
 * Serialized parameters owned by the consensus or execution engine. Only their presence is checked here.
 */
public abstract class OpaqueConfig extends AbstractConfigModule<byte[]> {

    protected OpaqueConfig(AccessControl accessControl) {
        super(accessControl);
    }

    public byte[] getConfigBytes() {
        byte[] current = getCurrent();
        return Arrays.copyOf(current, current.length);
    }

    @Override
    protected void validate(byte[] value) {
        if (ArrayUtils.isEmpty(value)) {
            throw new InvalidConfigException(getName() + " must not be empty");
        }
    }
}
