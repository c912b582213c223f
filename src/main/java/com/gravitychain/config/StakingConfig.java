package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import com.gravitychain.exception.config.InvalidConfigException;
import org.springframework.stereotype.Component;

@Component
public class StakingConfig extends AbstractConfigModule<StakingConfigParams> {

    public StakingConfig(AccessControl accessControl) {
        super(accessControl);
    }

    @Override
    public String getName() {
        return "staking config";
    }

    @Override
    protected void validate(StakingConfigParams params) {
        if (params == null || params.getMinimumStake() == null || params.getMinimumProposalStake() == null) {
            throw new InvalidConfigException("Staking config requires minimum stake and minimum proposal stake");
        }
        if (params.getLockupDurationMicros() < 0 || params.getUnbondingDelayMicros() < 0) {
            throw new InvalidConfigException("Staking durations must not be negative");
        }
    }
}
