package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import com.gravitychain.exception.config.InvalidConfigException;
import org.springframework.stereotype.Component;

@Component
public class GovernanceConfig extends AbstractConfigModule<GovernanceConfigParams> {

    public GovernanceConfig(AccessControl accessControl) {
        super(accessControl);
    }

    @Override
    public String getName() {
        return "governance config";
    }

    @Override
    protected void validate(GovernanceConfigParams params) {
        if (params == null || params.getMinVotingThreshold() == null || params.getRequiredProposerStake() == null) {
            throw new InvalidConfigException("Governance config requires voting threshold and proposer stake");
        }
        if (params.getVotingDurationMicros() <= 0) {
            throw new InvalidConfigException("Voting duration must be positive");
        }
        if (params.getExecutionDelayMicros() < 0 || params.getExecutionWindowMicros() < 0) {
            throw new InvalidConfigException("Execution delay and window must not be negative");
        }
    }
}
