package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import com.gravitychain.exception.config.InvalidConfigException;
import org.springframework.stereotype.Component;

/**
 * Whether the current epoch hands off to a DKG session before reconfiguring.
 */
@Component
public class RandomnessConfig extends AbstractConfigModule<RandomnessConfigData> {

    public RandomnessConfig(AccessControl accessControl) {
        super(accessControl);
    }

    @Override
    public String getName() {
        return "randomness config";
    }

    public RandomnessVariant getCurrentVariant() {
        return getCurrent().getVariant();
    }

    public boolean isEnabled() {
        return getCurrent().isEnabled();
    }

    @Override
    protected void validate(RandomnessConfigData data) {
        if (data == null || data.getVariant() == null) {
            throw new InvalidConfigException("Randomness variant is required");
        }
        if (!data.isEnabled()) {
            return;
        }
        if (data.getSecrecyThreshold() == null || data.getReconstructionThreshold() == null) {
            throw new InvalidConfigException("V2 randomness requires secrecy and reconstruction thresholds");
        }
        if (data.getReconstructionThreshold().compareTo(data.getSecrecyThreshold()) < 0) {
            throw new InvalidConfigException("Reconstruction threshold must not be below the secrecy threshold");
        }
    }
}
