package com.gravitychain.config;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Thresholds are fixed-point fractions as produced by the genesis tooling.
 */
@Value
@Builder
public class RandomnessConfigData {

    RandomnessVariant variant;
    BigInteger secrecyThreshold;
    BigInteger reconstructionThreshold;
    BigInteger fastPathSecrecyThreshold;

    public static RandomnessConfigData off() {
        return RandomnessConfigData.builder()
                .variant(RandomnessVariant.OFF)
                .build();
    }

    public static RandomnessConfigData v2(BigInteger secrecyThreshold,
                                          BigInteger reconstructionThreshold,
                                          BigInteger fastPathSecrecyThreshold) {
        return new RandomnessConfigData(RandomnessVariant.V2,
                secrecyThreshold, reconstructionThreshold, fastPathSecrecyThreshold);
    }

    public boolean isEnabled() {
        return variant != RandomnessVariant.OFF;
    }
}
