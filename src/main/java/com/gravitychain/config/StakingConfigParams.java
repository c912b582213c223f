package com.gravitychain.config;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder(toBuilder = true)
public class StakingConfigParams {

    BigInteger minimumStake;
    long lockupDurationMicros;
    long unbondingDelayMicros;
    BigInteger minimumProposalStake;
}
