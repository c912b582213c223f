package com.gravitychain.genesis;

import com.gravitychain.config.GovernanceConfigParams;
import com.gravitychain.config.RandomnessConfigData;
import com.gravitychain.config.RandomnessVariant;
import com.gravitychain.config.StakingConfigParams;
import com.gravitychain.config.ValidatorConfigParams;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Chain bootstrap parameters, bound from {@code gravity.genesis.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "gravity.genesis")
public class GenesisProperties {

    private boolean runOnStartup = true;
    private long initialTimestampMicros;
    // Two hours
    private long epochIntervalMicros = 7_200_000_000L;
    private long majorVersion = 1;
    private String consensusConfig = "0x00";
    private String executionConfig = "0x00";
    private ValidatorConfigProperties validatorConfig = new ValidatorConfigProperties();
    private StakingConfigProperties stakingConfig = new StakingConfigProperties();
    private GovernanceConfigProperties governanceConfig = new GovernanceConfigProperties();
    private RandomnessConfigProperties randomnessConfig = new RandomnessConfigProperties();
    private List<InitialValidator> validators = new ArrayList<>();

    @Getter
    @Setter
    public static class ValidatorConfigProperties {
        private BigInteger minimumBond = BigInteger.ONE;
        private BigInteger maximumBond = BigInteger.TEN.pow(24);
        private long unbondingDelayMicros = 604_800_000_000L;
        private boolean allowValidatorSetChange = true;
        private long votingPowerIncreaseLimitPct = 20;
        private long maxValidatorSetSize = 100;
        private boolean autoEvictEnabled;
        private long autoEvictThreshold;

        public ValidatorConfigParams toParams() {
            return ValidatorConfigParams.builder()
                    .minimumBond(minimumBond)
                    .maximumBond(maximumBond)
                    .unbondingDelayMicros(unbondingDelayMicros)
                    .allowValidatorSetChange(allowValidatorSetChange)
                    .votingPowerIncreaseLimitPct(votingPowerIncreaseLimitPct)
                    .maxValidatorSetSize(maxValidatorSetSize)
                    .autoEvictEnabled(autoEvictEnabled)
                    .autoEvictThreshold(autoEvictThreshold)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class StakingConfigProperties {
        private BigInteger minimumStake = BigInteger.ONE;
        private long lockupDurationMicros = 1_209_600_000_000L;
        private long unbondingDelayMicros = 604_800_000_000L;
        private BigInteger minimumProposalStake = BigInteger.ONE;

        public StakingConfigParams toParams() {
            return StakingConfigParams.builder()
                    .minimumStake(minimumStake)
                    .lockupDurationMicros(lockupDurationMicros)
                    .unbondingDelayMicros(unbondingDelayMicros)
                    .minimumProposalStake(minimumProposalStake)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class GovernanceConfigProperties {
        private BigInteger minVotingThreshold = BigInteger.ONE;
        private BigInteger requiredProposerStake = BigInteger.ONE;
        private long votingDurationMicros = 604_800_000_000L;
        private long executionDelayMicros = 86_400_000_000L;
        private long executionWindowMicros = 604_800_000_000L;

        public GovernanceConfigParams toParams() {
            return GovernanceConfigParams.builder()
                    .minVotingThreshold(minVotingThreshold)
                    .requiredProposerStake(requiredProposerStake)
                    .votingDurationMicros(votingDurationMicros)
                    .executionDelayMicros(executionDelayMicros)
                    .executionWindowMicros(executionWindowMicros)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class RandomnessConfigProperties {
        private RandomnessVariant variant = RandomnessVariant.OFF;
        private BigInteger secrecyThreshold;
        private BigInteger reconstructionThreshold;
        private BigInteger fastPathSecrecyThreshold;

        public RandomnessConfigData toData() {
            if (variant == RandomnessVariant.OFF) {
                return RandomnessConfigData.off();
            }
            return RandomnessConfigData.v2(secrecyThreshold, reconstructionThreshold, fastPathSecrecyThreshold);
        }
    }

    @Getter
    @Setter
    public static class InitialValidator {
        private String pool;
        private String owner;
        private String operator;
        private BigInteger stakeAmount;
        private String moniker;
        private String consensusPubkey;
        private String consensusPop;
        // Multiaddr strings, e.g. /ip4/127.0.0.1/tcp/2024/noise-ik/<key>/handshake/0
        private String networkAddresses = "";
        private String fullnodeAddresses = "";
        private String feeRecipient;
    }
}
