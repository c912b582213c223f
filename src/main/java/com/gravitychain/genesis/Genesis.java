package com.gravitychain.genesis;

import com.gravitychain.access.AccessControl;
import com.gravitychain.access.SystemRole;
import com.gravitychain.account.Address;
import com.gravitychain.config.ConsensusConfig;
import com.gravitychain.config.EpochConfig;
import com.gravitychain.config.ExecutionConfig;
import com.gravitychain.config.GovernanceConfig;
import com.gravitychain.config.RandomnessConfig;
import com.gravitychain.config.StakingConfig;
import com.gravitychain.config.ValidatorConfig;
import com.gravitychain.config.VersionConfig;
import com.gravitychain.performance.PerformanceTracker;
import com.gravitychain.reconfiguration.Reconfiguration;
import com.gravitychain.stake.InMemoryStakePoolRegistry;
import com.gravitychain.timestamp.TimestampState;
import com.gravitychain.utils.HexUtils;
import com.gravitychain.validator.ValidatorManagement;
import com.gravitychain.validator.dto.ValidatorRegistration;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Level;

/**
 * Bootstraps every component from {@link GenesisProperties}. Components refuse a second initialization,
 * so running genesis twice fails.
 */
@Log
@Component
@RequiredArgsConstructor
public class Genesis {

    private final AccessControl accessControl;
    private final GenesisProperties properties;
    private final TimestampState timestampState;
    private final EpochConfig epochConfig;
    private final RandomnessConfig randomnessConfig;
    private final ValidatorConfig validatorConfig;
    private final StakingConfig stakingConfig;
    private final GovernanceConfig governanceConfig;
    private final VersionConfig versionConfig;
    private final ConsensusConfig consensusConfig;
    private final ExecutionConfig executionConfig;
    private final InMemoryStakePoolRegistry stakePools;
    private final ValidatorManagement validatorManagement;
    private final PerformanceTracker performanceTracker;
    private final Reconfiguration reconfiguration;

    public void execute() {
        Address genesis = accessControl.addressOf(SystemRole.GENESIS);
        log.log(Level.INFO, String.format("Executing genesis with %d validators", properties.getValidators().size()));

        timestampState.initialize(genesis, properties.getInitialTimestampMicros());

        epochConfig.initialize(genesis, properties.getEpochIntervalMicros());
        randomnessConfig.initialize(genesis, properties.getRandomnessConfig().toData());
        validatorConfig.initialize(genesis, properties.getValidatorConfig().toParams());
        stakingConfig.initialize(genesis, properties.getStakingConfig().toParams());
        governanceConfig.initialize(genesis, properties.getGovernanceConfig().toParams());
        versionConfig.initialize(genesis, properties.getMajorVersion());
        consensusConfig.initialize(genesis, HexUtils.fromHex(properties.getConsensusConfig()));
        executionConfig.initialize(genesis, HexUtils.fromHex(properties.getExecutionConfig()));

        List<ValidatorRegistration> registrations = properties.getValidators().stream()
                .map(this::createPoolAndRegistration)
                .toList();
        validatorManagement.initializeGenesisValidators(genesis, registrations);

        performanceTracker.initialize(genesis, validatorManagement.getActiveCount());
        reconfiguration.initialize(genesis);

        log.log(Level.INFO, String.format("Genesis complete: %d active validators, total voting power %s",
                validatorManagement.getActiveCount(), validatorManagement.getTotalVotingPower()));
    }

    private ValidatorRegistration createPoolAndRegistration(GenesisProperties.InitialValidator validator) {
        Address pool = Address.fromHex(validator.getPool());
        Address operator = Address.fromHex(validator.getOperator());
        Address owner = StringUtils.isBlank(validator.getOwner()) ? operator : Address.fromHex(validator.getOwner());
        stakePools.createPool(pool, owner, operator, validator.getStakeAmount());

        return ValidatorRegistration.builder()
                .pool(pool)
                .moniker(validator.getMoniker())
                .consensusPublicKey(HexUtils.fromHex(validator.getConsensusPubkey()))
                .proofOfPossession(HexUtils.fromHex(validator.getConsensusPop()))
                .networkAddresses(validator.getNetworkAddresses().getBytes(StandardCharsets.UTF_8))
                .fullnodeAddresses(validator.getFullnodeAddresses().getBytes(StandardCharsets.UTF_8))
                .feeRecipient(StringUtils.isBlank(validator.getFeeRecipient())
                        ? null
                        : Address.fromHex(validator.getFeeRecipient()))
                .build();
    }
}
