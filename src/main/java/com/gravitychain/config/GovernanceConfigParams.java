package com.gravitychain.config;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder(toBuilder = true)
public class GovernanceConfigParams {

    BigInteger minVotingThreshold;
    BigInteger requiredProposerStake;
    long votingDurationMicros;
    long executionDelayMicros;
    long executionWindowMicros;
}
