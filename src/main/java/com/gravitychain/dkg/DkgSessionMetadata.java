package com.gravitychain.dkg;

import com.gravitychain.config.RandomnessConfigData;
import com.gravitychain.validator.dto.ValidatorConsensusInfo;
import lombok.Value;

import java.util.List;

/**
 * What a DKG session is run for: the epoch whose validators deal, and the set that will receive the key.
 */
@Value
public class DkgSessionMetadata {

    long dealerEpoch;
    RandomnessConfigData randomnessConfig;
    List<ValidatorConsensusInfo> dealerValidatorSet;
    List<ValidatorConsensusInfo> targetValidatorSet;

    public DkgSessionMetadata(long dealerEpoch,
                              RandomnessConfigData randomnessConfig,
                              List<ValidatorConsensusInfo> dealerValidatorSet,
                              List<ValidatorConsensusInfo> targetValidatorSet) {
        this.dealerEpoch = dealerEpoch;
        this.randomnessConfig = randomnessConfig;
        this.dealerValidatorSet = List.copyOf(dealerValidatorSet);
        this.targetValidatorSet = List.copyOf(targetValidatorSet);
    }
}
