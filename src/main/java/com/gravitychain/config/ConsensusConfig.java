package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import org.springframework.stereotype.Component;

@Component
public class ConsensusConfig extends OpaqueConfig {

    public ConsensusConfig(AccessControl accessControl) {
        super(accessControl);
    }

    @Override
    public String getName() {
        return "consensus config";
    }
}
