package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import org.springframework.stereotype.Component;

@Component
public class ExecutionConfig extends OpaqueConfig {

    public ExecutionConfig(AccessControl accessControl) {
        super(accessControl);
    }

    @Override
    public String getName() {
        return "execution config";
    }
}
