package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import com.gravitychain.exception.config.InvalidConfigException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Component
public class ValidatorConfig extends AbstractConfigModule<ValidatorConfigParams> {

    static final long MAX_VOTING_POWER_INCREASE_LIMIT_PCT = 50;

    public ValidatorConfig(AccessControl accessControl) {
        super(accessControl);
    }

    @Override
    public String getName() {
        return "validator config";
    }

    @Override
    protected void validate(ValidatorConfigParams params) {
        if (params == null || params.getMinimumBond() == null || params.getMaximumBond() == null) {
            throw new InvalidConfigException("Validator config requires minimum and maximum bond");
        }
        if (params.getMinimumBond().signum() < 0) {
            throw new InvalidConfigException("Minimum bond must not be negative");
        }
        if (params.getMinimumBond().compareTo(params.getMaximumBond()) > 0) {
            throw new InvalidConfigException(String.format("Minimum bond %s exceeds maximum bond %s",
                    params.getMinimumBond(), params.getMaximumBond()));
        }
        if (params.getMaximumBond().equals(BigInteger.ZERO)) {
            throw new InvalidConfigException("Maximum bond must be positive");
        }
        long pct = params.getVotingPowerIncreaseLimitPct();
        if (pct < 1 || pct > MAX_VOTING_POWER_INCREASE_LIMIT_PCT) {
            throw new InvalidConfigException("Voting power increase limit must be within [1, 50], got " + pct);
        }
        if (params.getMaxValidatorSetSize() < 1) {
            throw new InvalidConfigException("Max validator set size must be at least 1");
        }
        if (params.getAutoEvictThreshold() < 0) {
            throw new InvalidConfigException("Auto evict threshold must not be negative");
        }
    }
}
