package com.gravitychain.config;

import com.gravitychain.access.AccessControl;
import com.gravitychain.access.RoleProperties;
import com.gravitychain.access.SystemRole;
import com.gravitychain.account.Address;
import com.gravitychain.exception.access.UnauthorizedCallerException;
import com.gravitychain.exception.config.InvalidConfigException;
import com.gravitychain.exception.state.AlreadyInitializedException;
import com.gravitychain.exception.state.NotInitializedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigModuleTest {

    private AccessControl accessControl;
    private Address genesis;
    private Address governance;
    private Address reconfiguration;

    @BeforeEach
    void setUp() {
        accessControl = new AccessControl(new RoleProperties());
        genesis = accessControl.addressOf(SystemRole.GENESIS);
        governance = accessControl.addressOf(SystemRole.GOVERNANCE);
        reconfiguration = accessControl.addressOf(SystemRole.RECONFIGURATION);
    }

    @Test
    void testEpochIntervalChangeAppliesOnlyAtBoundary() {
        EpochConfig epochConfig = new EpochConfig(accessControl);
        epochConfig.initialize(genesis, 100L);

        epochConfig.setForNextEpoch(governance, 200L);
        assertEquals(100L, epochConfig.getIntervalMicros());
        assertTrue(epochConfig.hasPendingConfig());

        assertTrue(epochConfig.applyPendingConfig(reconfiguration));
        assertEquals(200L, epochConfig.getIntervalMicros());
        assertFalse(epochConfig.applyPendingConfig(reconfiguration));
    }

    @Test
    void testEpochIntervalMustBePositive() {
        EpochConfig epochConfig = new EpochConfig(accessControl);

        assertThrows(InvalidConfigException.class, () -> epochConfig.initialize(genesis, 0L));
        assertFalse(epochConfig.isInitialized());
    }

    @Test
    void testOnlyGovernanceStagesAndOnlyReconfigurationApplies() {
        EpochConfig epochConfig = new EpochConfig(accessControl);
        epochConfig.initialize(genesis, 100L);

        assertThrows(UnauthorizedCallerException.class, () -> epochConfig.setForNextEpoch(genesis, 200L));
        epochConfig.setForNextEpoch(governance, 200L);
        assertThrows(UnauthorizedCallerException.class, () -> epochConfig.applyPendingConfig(governance));
    }

    @Test
    void testInitializeTwiceFails() {
        EpochConfig epochConfig = new EpochConfig(accessControl);
        epochConfig.initialize(genesis, 100L);

        assertThrows(AlreadyInitializedException.class, () -> epochConfig.initialize(genesis, 100L));
    }

    @Test
    void testStagingBeforeInitializationFails() {
        EpochConfig epochConfig = new EpochConfig(accessControl);

        assertThrows(NotInitializedException.class, () -> epochConfig.setForNextEpoch(governance, 200L));
    }

    @Test
    void testValidatorConfigValidation() {
        ValidatorConfig validatorConfig = new ValidatorConfig(accessControl);
        ValidatorConfigParams valid = ValidatorConfigParams.builder()
                .minimumBond(BigInteger.TEN)
                .maximumBond(BigInteger.valueOf(1_000))
                .allowValidatorSetChange(true)
                .votingPowerIncreaseLimitPct(20)
                .maxValidatorSetSize(100)
                .build();
        validatorConfig.initialize(genesis, valid);

        assertThrows(InvalidConfigException.class, () -> validatorConfig.setForNextEpoch(governance,
                valid.toBuilder().minimumBond(BigInteger.valueOf(2_000)).build()));
        assertThrows(InvalidConfigException.class, () -> validatorConfig.setForNextEpoch(governance,
                valid.toBuilder().votingPowerIncreaseLimitPct(51).build()));
        assertThrows(InvalidConfigException.class, () -> validatorConfig.setForNextEpoch(governance,
                valid.toBuilder().votingPowerIncreaseLimitPct(0).build()));
        assertThrows(InvalidConfigException.class, () -> validatorConfig.setForNextEpoch(governance,
                valid.toBuilder().maxValidatorSetSize(0).build()));
        assertFalse(validatorConfig.hasPendingConfig());
    }

    @Test
    void testRandomnessV2RequiresOrderedThresholds() {
        RandomnessConfig randomnessConfig = new RandomnessConfig(accessControl);
        randomnessConfig.initialize(genesis, RandomnessConfigData.off());
        assertFalse(randomnessConfig.isEnabled());

        assertThrows(InvalidConfigException.class, () -> randomnessConfig.setForNextEpoch(governance,
                RandomnessConfigData.v2(BigInteger.valueOf(66), BigInteger.valueOf(50), null)));

        randomnessConfig.setForNextEpoch(governance,
                RandomnessConfigData.v2(BigInteger.valueOf(50), BigInteger.valueOf(66), null));
        randomnessConfig.applyPendingConfig(reconfiguration);
        assertEquals(RandomnessVariant.V2, randomnessConfig.getCurrentVariant());
    }

    @Test
    void testVersionMustIncrease() {
        VersionConfig versionConfig = new VersionConfig(accessControl);
        versionConfig.initialize(genesis, 3L);

        assertThrows(InvalidConfigException.class, () -> versionConfig.setForNextEpoch(governance, 3L));
        assertThrows(InvalidConfigException.class, () -> versionConfig.setForNextEpoch(governance, 2L));

        versionConfig.setForNextEpoch(governance, 4L);
        versionConfig.applyPendingConfig(reconfiguration);
        assertEquals(4L, versionConfig.getMajorVersion());
    }

    @Test
    void testOpaqueConfigRejectsEmptyBytesAndReturnsCopies() {
        ConsensusConfig consensusConfig = new ConsensusConfig(accessControl);

        assertThrows(InvalidConfigException.class, () -> consensusConfig.initialize(genesis, new byte[0]));

        consensusConfig.initialize(genesis, new byte[]{1, 2, 3});
        consensusConfig.getConfigBytes()[0] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, consensusConfig.getConfigBytes());
    }
}
