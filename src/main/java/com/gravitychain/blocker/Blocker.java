package com.gravitychain.blocker;

import com.gravitychain.access.AccessControl;
import com.gravitychain.access.SystemRole;
import com.gravitychain.account.Address;
import com.gravitychain.event.ChainEventPublisher;
import com.gravitychain.event.NewBlockEvent;
import com.gravitychain.exception.blocker.InvalidProposerException;
import com.gravitychain.performance.PerformanceTracker;
import com.gravitychain.reconfiguration.Reconfiguration;
import com.gravitychain.timestamp.Clock;
import com.gravitychain.validator.ValidatorRegistry;
import com.gravitychain.validator.dto.ValidatorConsensusInfo;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Block prologue. Called once per block by the runtime before any transaction is executed.
 */
@Log
@Component
@RequiredArgsConstructor
public class Blocker {

    private final AccessControl accessControl;
    private final PerformanceTracker performanceTracker;
    private final Clock clock;
    private final ValidatorRegistry validatorRegistry;
    private final Reconfiguration reconfiguration;
    private final ChainEventPublisher eventPublisher;

    @Getter
    private long blockHeight;

    /**
     * @param proposerIndex         active set index of the proposer, or
     *                              {@link PerformanceTracker#NIL_PROPOSER_INDEX} for a NIL block
     * @param failedProposerIndices indices of proposers that failed to produce a block since the last one
     * @param timestampMicros       block time; must equal the current time for NIL blocks
     */
    public void onBlockStart(Address caller,
                             long proposerIndex,
                             List<Long> failedProposerIndices,
                             long timestampMicros) {
        accessControl.requireCaller(caller, SystemRole.SYSTEM_CALLER);

        Address proposer = resolveProposer(proposerIndex);
        clock.requireValidAdvance(proposer, timestampMicros);

        Address self = accessControl.addressOf(SystemRole.BLOCK);

        // The block that triggers a transition still belongs to the ending epoch
        performanceTracker.updateStatistics(self, proposerIndex, failedProposerIndices);
        clock.advance(self, proposer, timestampMicros);
        reconfiguration.checkAndStartTransition(self);

        blockHeight++;
        log.fine(String.format("Block %d in epoch %d proposed by %s at %d",
                blockHeight, reconfiguration.getCurrentEpoch(), proposer, timestampMicros));
        eventPublisher.publish(new NewBlockEvent(
                this, blockHeight, reconfiguration.getCurrentEpoch(), proposer, timestampMicros));
    }

    private Address resolveProposer(long proposerIndex) {
        if (proposerIndex == PerformanceTracker.NIL_PROPOSER_INDEX) {
            return accessControl.addressOf(SystemRole.SYSTEM_CALLER);
        }
        if (proposerIndex < 0 || proposerIndex > Integer.MAX_VALUE) {
            throw new InvalidProposerException("Proposer index out of range: " + proposerIndex);
        }

        return validatorRegistry.getActiveValidatorAt((int) proposerIndex)
                .map(ValidatorConsensusInfo::getValidator)
                .orElseThrow(() -> new InvalidProposerException(String.format(
                        "No active validator at index %d, active set size %d",
                        proposerIndex, validatorRegistry.getActiveCount())));
    }
}
