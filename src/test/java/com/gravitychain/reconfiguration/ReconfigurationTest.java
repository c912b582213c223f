package com.gravitychain.reconfiguration;

import com.gravitychain.access.AccessControl;
import com.gravitychain.access.RoleProperties;
import com.gravitychain.access.SystemRole;
import com.gravitychain.account.Address;
import com.gravitychain.config.ConfigModule;
import com.gravitychain.config.EpochConfig;
import com.gravitychain.config.RandomnessConfig;
import com.gravitychain.config.RandomnessConfigData;
import com.gravitychain.config.ValidatorConfig;
import com.gravitychain.config.ValidatorConfigParams;
import com.gravitychain.dkg.DkgCoordinator;
import com.gravitychain.event.ChainEventPublisher;
import com.gravitychain.event.EpochTransitionStartedEvent;
import com.gravitychain.event.NewEpochEvent;
import com.gravitychain.exception.access.UnauthorizedCallerException;
import com.gravitychain.exception.reconfiguration.ReconfigurationInProgressException;
import com.gravitychain.exception.reconfiguration.ReconfigurationNotInProgressException;
import com.gravitychain.performance.PerformanceTracker;
import com.gravitychain.performance.ProposerPerformance;
import com.gravitychain.reconfiguration.state.ReconfigurationState;
import com.gravitychain.timestamp.Clock;
import com.gravitychain.validator.ValidatorRegistry;
import com.gravitychain.validator.dto.ValidatorConsensusInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconfigurationTest {

    private static final long GENESIS_TIME = 1_000_000L;
    private static final long INTERVAL = 60_000_000L;
    private static final ValidatorConfigParams PARAMS = ValidatorConfigParams.builder()
            .minimumBond(BigInteger.ONE)
            .maximumBond(BigInteger.TEN)
            .votingPowerIncreaseLimitPct(20)
            .maxValidatorSetSize(10)
            .build();

    @Mock
    private Clock clock;
    @Mock
    private EpochConfig epochConfig;
    @Mock
    private RandomnessConfig randomnessConfig;
    @Mock
    private ValidatorConfig validatorConfig;
    @Mock
    private ConfigModule firstModule;
    @Mock
    private ConfigModule secondModule;
    @Mock
    private DkgCoordinator dkgCoordinator;
    @Mock
    private ValidatorRegistry validatorRegistry;
    @Mock
    private PerformanceTracker performanceTracker;
    @Mock
    private ChainEventPublisher eventPublisher;

    private ReconfigurationState state;
    private Reconfiguration reconfiguration;
    private Address block;
    private Address self;
    private Address governance;
    private Address systemCaller;

    @BeforeEach
    void setUp() {
        AccessControl accessControl = new AccessControl(new RoleProperties());
        block = accessControl.addressOf(SystemRole.BLOCK);
        self = accessControl.addressOf(SystemRole.RECONFIGURATION);
        governance = accessControl.addressOf(SystemRole.GOVERNANCE);
        systemCaller = accessControl.addressOf(SystemRole.SYSTEM_CALLER);

        state = new ReconfigurationState();
        reconfiguration = new Reconfiguration(accessControl, clock, epochConfig, randomnessConfig, validatorConfig,
                List.of(firstModule, secondModule), dkgCoordinator, validatorRegistry, performanceTracker, state,
                eventPublisher);

        when(clock.nowMicros()).thenReturn(GENESIS_TIME);
        reconfiguration.initialize(accessControl.addressOf(SystemRole.GENESIS));
    }

    @Test
    void testNoTransitionBeforeIntervalElapses() {
        when(clock.nowMicros()).thenReturn(GENESIS_TIME + INTERVAL - 1);
        when(epochConfig.getIntervalMicros()).thenReturn(INTERVAL);

        assertFalse(reconfiguration.checkAndStartTransition(block));
        assertEquals(0, reconfiguration.getCurrentEpoch());
        assertEquals(0, reconfiguration.getRemainingTimeSeconds());
        verify(validatorRegistry, never()).onNewEpoch(any());
    }

    @Test
    void testRemainingTime() {
        when(clock.nowMicros()).thenReturn(GENESIS_TIME + 20 * Clock.MICROS_PER_SECOND);
        when(epochConfig.getIntervalMicros()).thenReturn(INTERVAL);

        assertEquals(40, reconfiguration.getRemainingTimeSeconds());
        assertFalse(reconfiguration.canTransition());
    }

    @Test
    void testHugeIntervalDoesNotOverflow() {
        when(clock.nowMicros()).thenReturn(GENESIS_TIME + Clock.MICROS_PER_SECOND);
        when(epochConfig.getIntervalMicros()).thenReturn(Long.MAX_VALUE);

        assertFalse(reconfiguration.canTransition());
        assertFalse(reconfiguration.checkAndStartTransition(block));
        assertEquals((Long.MAX_VALUE - Clock.MICROS_PER_SECOND) / Clock.MICROS_PER_SECOND,
                reconfiguration.getRemainingTimeSeconds());
        assertEquals(0, reconfiguration.getCurrentEpoch());
    }

    @Test
    void testImmediateReconfigurationAppliesStepsInOrder() {
        long now = GENESIS_TIME + INTERVAL;
        when(clock.nowMicros()).thenReturn(now);
        when(epochConfig.getIntervalMicros()).thenReturn(INTERVAL);
        when(randomnessConfig.isEnabled()).thenReturn(false);
        when(validatorConfig.getCurrent()).thenReturn(PARAMS);
        when(validatorRegistry.getActiveCount()).thenReturn(2);

        assertTrue(reconfiguration.checkAndStartTransition(block));

        InOrder inOrder = inOrder(firstModule, secondModule, validatorRegistry, performanceTracker, eventPublisher);
        inOrder.verify(eventPublisher).publish(any(EpochTransitionStartedEvent.class));
        inOrder.verify(firstModule).applyPendingConfig(self);
        inOrder.verify(secondModule).applyPendingConfig(self);
        inOrder.verify(validatorRegistry).onNewEpoch(self);
        inOrder.verify(performanceTracker).onNewEpoch(self, 2);
        inOrder.verify(eventPublisher).publish(any(NewEpochEvent.class));
        verify(validatorRegistry, never()).evictUnderperformingValidators(any(), any());

        assertEquals(1, reconfiguration.getCurrentEpoch());
        assertEquals(now, reconfiguration.getLastReconfigurationTime());
        assertEquals(TransitionState.IDLE, reconfiguration.getTransitionState());
    }

    @Test
    void testAutoEvictionRunsBeforeConfigCommitAndRecomputation() {
        List<ProposerPerformance> snapshot = List.of(new ProposerPerformance(0, 4));
        when(clock.nowMicros()).thenReturn(GENESIS_TIME + INTERVAL);
        when(epochConfig.getIntervalMicros()).thenReturn(INTERVAL);
        when(randomnessConfig.isEnabled()).thenReturn(false);
        when(validatorConfig.getCurrent()).thenReturn(PARAMS.toBuilder().autoEvictEnabled(true).build());
        when(performanceTracker.getAllPerformances()).thenReturn(snapshot);

        reconfiguration.checkAndStartTransition(block);

        InOrder inOrder = inOrder(firstModule, validatorRegistry, performanceTracker);
        inOrder.verify(validatorRegistry).evictUnderperformingValidators(self, snapshot);
        inOrder.verify(firstModule).applyPendingConfig(self);
        inOrder.verify(validatorRegistry).onNewEpoch(self);
        inOrder.verify(performanceTracker).onNewEpoch(eq(self), anyInt());
    }

    @Test
    void testDkgTransitionWaitsForTranscript() {
        List<ValidatorConsensusInfo> current = List.of();
        List<ValidatorConsensusInfo> next = List.of();
        RandomnessConfigData randomness =
                RandomnessConfigData.v2(BigInteger.ONE, BigInteger.TWO, BigInteger.TWO);
        when(clock.nowMicros()).thenReturn(GENESIS_TIME + INTERVAL);
        when(epochConfig.getIntervalMicros()).thenReturn(INTERVAL);
        when(randomnessConfig.isEnabled()).thenReturn(true);
        when(randomnessConfig.getCurrent()).thenReturn(randomness);
        when(validatorConfig.getCurrent()).thenReturn(PARAMS);
        when(validatorRegistry.getCurrentConsensusInfos()).thenReturn(current);
        when(validatorRegistry.getNextConsensusInfos()).thenReturn(next);

        assertTrue(reconfiguration.checkAndStartTransition(block));

        verify(dkgCoordinator).start(self, 0, randomness, current, next);
        assertEquals(TransitionState.DKG_IN_PROGRESS, reconfiguration.getTransitionState());
        assertEquals(0, reconfiguration.getCurrentEpoch());
        assertFalse(reconfiguration.checkAndStartTransition(block));

        byte[] transcript = {1, 2, 3};
        reconfiguration.finishTransition(systemCaller, transcript);

        InOrder inOrder = inOrder(dkgCoordinator, validatorRegistry);
        inOrder.verify(dkgCoordinator).finish(self, transcript);
        inOrder.verify(validatorRegistry).onNewEpoch(self);
        assertEquals(1, reconfiguration.getCurrentEpoch());
        assertEquals(TransitionState.IDLE, reconfiguration.getTransitionState());
    }

    @Test
    void testEmptyTranscriptSkipsDkgFinish() {
        state.startDkg();

        reconfiguration.finishTransition(governance, new byte[0]);

        verify(dkgCoordinator, never()).finish(any(), any());
        verify(dkgCoordinator).discardStale(self);
        assertEquals(1, reconfiguration.getCurrentEpoch());
    }

    @Test
    void testFinishWithoutTransitionFails() {
        assertThrows(ReconfigurationNotInProgressException.class,
                () -> reconfiguration.finishTransition(systemCaller, new byte[]{1}));
    }

    @Test
    void testGovernanceReconfigureIgnoresInterval() {
        when(randomnessConfig.isEnabled()).thenReturn(false);
        when(validatorConfig.getCurrent()).thenReturn(PARAMS);

        reconfiguration.governanceReconfigure(governance);

        assertEquals(1, reconfiguration.getCurrentEpoch());
    }

    @Test
    void testGovernanceReconfigureRefusedDuringTransition() {
        state.startDkg();

        assertThrows(ReconfigurationInProgressException.class,
                () -> reconfiguration.governanceReconfigure(governance));
    }

    @Test
    void testOnlyBlockRoleChecksForTransition() {
        assertThrows(UnauthorizedCallerException.class, () -> reconfiguration.checkAndStartTransition(governance));
        verify(dkgCoordinator, never()).start(any(), anyLong(), any(), any(), any());
    }
}
