package com.gravitychain.config;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder(toBuilder = true)
public class ValidatorConfigParams {

    BigInteger minimumBond;
    BigInteger maximumBond;
    long unbondingDelayMicros;
    boolean allowValidatorSetChange;
    // Share of the prior epoch's total voting power that may join in a single epoch
    long votingPowerIncreaseLimitPct;
    long maxValidatorSetSize;
    boolean autoEvictEnabled;
    // Minimum successful proposals per epoch for a validator that had proposal opportunities
    long autoEvictThreshold;
}
