package com.gravitychain.reconfiguration;

import com.gravitychain.access.AccessControl;
import com.gravitychain.access.SystemRole;
import com.gravitychain.account.Address;
import com.gravitychain.config.ConfigModule;
import com.gravitychain.config.EpochConfig;
import com.gravitychain.config.RandomnessConfig;
import com.gravitychain.config.RandomnessConfigData;
import com.gravitychain.config.ValidatorConfig;
import com.gravitychain.dkg.DkgCoordinator;
import com.gravitychain.event.ChainEventPublisher;
import com.gravitychain.event.EpochTransitionStartedEvent;
import com.gravitychain.event.NewEpochEvent;
import com.gravitychain.exception.reconfiguration.ReconfigurationInProgressException;
import com.gravitychain.exception.reconfiguration.ReconfigurationNotInProgressException;
import com.gravitychain.performance.PerformanceTracker;
import com.gravitychain.reconfiguration.state.ReconfigurationState;
import com.gravitychain.timestamp.Clock;
import com.gravitychain.validator.ValidatorRegistry;
import com.gravitychain.validator.dto.ValidatorConsensusInfo;
import lombok.extern.java.Log;
import org.apache.commons.lang3.ArrayUtils;
import org.javatuples.Pair;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.logging.Level;

/**
 * The epoch state machine.
 * <p>
 * Each block the prologue asks {@link #checkAndStartTransition(Address)} whether the epoch interval has
 * elapsed. With randomness off the new epoch is applied on the spot. With randomness on, a DKG session is
 * started and the machine waits in {@link TransitionState#DKG_IN_PROGRESS} until the consensus engine (or
 * governance) calls {@link #finishTransition(Address, byte[])}.
 * <p>
 * Auto-eviction runs when the transition starts, with the counters and validator config of the ending epoch,
 * so the DKG targets and the set applied later agree.
 * <p>
 * Applying an epoch always commits staged configs first, then recomputes the validator set, and only then
 * bumps the epoch counter, so nothing can observe a new epoch number with an old set or old parameters.
 */
@Log
@Component
public class Reconfiguration {

    private final AccessControl accessControl;
    private final Clock clock;
    private final EpochConfig epochConfig;
    private final RandomnessConfig randomnessConfig;
    private final ValidatorConfig validatorConfig;
    private final List<ConfigModule> configModules;
    private final DkgCoordinator dkgCoordinator;
    private final ValidatorRegistry validatorRegistry;
    private final PerformanceTracker performanceTracker;
    private final ReconfigurationState state;
    private final ChainEventPublisher eventPublisher;

    public Reconfiguration(AccessControl accessControl,
                           Clock clock,
                           EpochConfig epochConfig,
                           RandomnessConfig randomnessConfig,
                           ValidatorConfig validatorConfig,
                           List<ConfigModule> configModules,
                           DkgCoordinator dkgCoordinator,
                           ValidatorRegistry validatorRegistry,
                           PerformanceTracker performanceTracker,
                           ReconfigurationState state,
                           ChainEventPublisher eventPublisher) {
        this.accessControl = accessControl;
        this.clock = clock;
        this.epochConfig = epochConfig;
        this.randomnessConfig = randomnessConfig;
        this.validatorConfig = validatorConfig;
        this.configModules = List.copyOf(configModules);
        this.dkgCoordinator = dkgCoordinator;
        this.validatorRegistry = validatorRegistry;
        this.performanceTracker = performanceTracker;
        this.state = state;
        this.eventPublisher = eventPublisher;
    }

    public void initialize(Address caller) {
        accessControl.requireCaller(caller, SystemRole.GENESIS);
        state.initialize(clock.nowMicros());
        log.log(Level.INFO, String.format("Reconfiguration initialized at epoch 0, time %d", clock.nowMicros()));
    }

    /**
     * @return true if a transition was started (and, with randomness off, already applied)
     */
    public boolean checkAndStartTransition(Address caller) {
        accessControl.requireCaller(caller, SystemRole.BLOCK);
        state.ensureInitialized();

        if (state.isTransitionInProgress() || !isIntervalElapsed()) {
            return false;
        }

        startTransition();
        return true;
    }

    /**
     * Completes a transition that is waiting for DKG. An empty transcript ends the transition without a
     * DKG result, which is how governance forces a stuck session through.
     */
    public void finishTransition(Address caller, byte[] transcript) {
        accessControl.requireCaller(caller, SystemRole.SYSTEM_CALLER, SystemRole.GOVERNANCE);
        state.ensureInitialized();
        if (!state.isTransitionInProgress()) {
            throw new ReconfigurationNotInProgressException("No epoch transition is in progress");
        }

        Address self = accessControl.addressOf(SystemRole.RECONFIGURATION);
        if (ArrayUtils.isNotEmpty(transcript)) {
            dkgCoordinator.finish(self, transcript);
        }
        dkgCoordinator.discardStale(self);

        applyReconfiguration();
    }

    /**
     * Emergency reconfiguration that ignores the epoch interval, e.g. to drop a malicious validator.
     */
    public void governanceReconfigure(Address caller) {
        accessControl.requireCaller(caller, SystemRole.GOVERNANCE);
        state.ensureInitialized();
        if (state.isTransitionInProgress()) {
            throw new ReconfigurationInProgressException(
                    "An epoch transition is already in progress, use finishTransition instead");
        }

        log.log(Level.WARNING, String.format("Governance triggered reconfiguration at epoch %d",
                state.getCurrentEpoch()));
        startTransition();
    }

    public long getCurrentEpoch() {
        return state.getCurrentEpoch();
    }

    public long getLastReconfigurationTime() {
        return state.getLastReconfigurationTime();
    }

    public boolean isTransitionInProgress() {
        return state.isTransitionInProgress();
    }

    public TransitionState getTransitionState() {
        return state.getTransitionState();
    }

    public boolean canTransition() {
        return state.isInitialized() && !state.isTransitionInProgress() && isIntervalElapsed();
    }

    public long getRemainingTimeSeconds() {
        long remaining = epochConfig.getIntervalMicros() - elapsedMicros();
        return remaining <= 0 ? 0 : remaining / Clock.MICROS_PER_SECOND;
    }

    private boolean isIntervalElapsed() {
        return elapsedMicros() >= epochConfig.getIntervalMicros();
    }

    // Never negative: the clock does not go back past the last reconfiguration
    private long elapsedMicros() {
        return clock.nowMicros() - state.getLastReconfigurationTime();
    }

    private void startTransition() {
        long epoch = state.getCurrentEpoch();
        Address self = accessControl.addressOf(SystemRole.RECONFIGURATION);

        // Evicted validators must already be PENDING_INACTIVE when the DKG targets are taken
        if (validatorConfig.getCurrent().isAutoEvictEnabled()) {
            validatorRegistry.evictUnderperformingValidators(self, performanceTracker.getAllPerformances());
        }

        if (!randomnessConfig.isEnabled()) {
            eventPublisher.publish(new EpochTransitionStartedEvent(this, epoch, false));
            applyReconfiguration();
            return;
        }

        Pair<List<ValidatorConsensusInfo>, List<ValidatorConsensusInfo>> dealersAndTargets = new Pair<>(
                validatorRegistry.getCurrentConsensusInfos(),
                validatorRegistry.getNextConsensusInfos());
        RandomnessConfigData randomness = randomnessConfig.getCurrent();

        dkgCoordinator.discardStale(self);
        dkgCoordinator.start(self, epoch, randomness, dealersAndTargets.getValue0(), dealersAndTargets.getValue1());
        state.startDkg();

        log.log(Level.INFO, String.format("Epoch %d transition waiting for DKG", epoch));
        eventPublisher.publish(new EpochTransitionStartedEvent(this, epoch, true));
    }

    private void applyReconfiguration() {
        Address self = accessControl.addressOf(SystemRole.RECONFIGURATION);

        for (ConfigModule module : configModules) {
            module.applyPendingConfig(self);
        }

        // Evaluated in the context of the epoch that is ending
        validatorRegistry.onNewEpoch(self);
        performanceTracker.onNewEpoch(self, validatorRegistry.getActiveCount());

        state.completeEpoch(clock.nowMicros());

        log.log(Level.INFO, String.format("New epoch %d at %d with %d validators",
                state.getCurrentEpoch(), state.getLastReconfigurationTime(), validatorRegistry.getActiveCount()));
        eventPublisher.publish(new NewEpochEvent(this, state.getCurrentEpoch(), state.getLastReconfigurationTime()));
    }
}
