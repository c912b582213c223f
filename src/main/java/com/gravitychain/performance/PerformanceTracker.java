package com.gravitychain.performance;

import com.gravitychain.access.AccessControl;
import com.gravitychain.access.SystemRole;
import com.gravitychain.account.Address;
import com.gravitychain.state.AbstractState;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;
import org.apache.commons.collections4.CollectionUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-epoch proposal counters, indexed by active validator index.
 */
@Log
@Component
@RequiredArgsConstructor
public class PerformanceTracker extends AbstractState {

    /**
     * Proposer index of a NIL block. Same bit pattern as an unsigned 64-bit max.
     */
    public static final long NIL_PROPOSER_INDEX = -1L;

    private final AccessControl accessControl;

    private List<ProposerPerformance> performances = new ArrayList<>();

    public void initialize(Address caller, int activeValidatorCount) {
        accessControl.requireCaller(caller, SystemRole.GENESIS);
        markInitialized();
        performances = zeroed(activeValidatorCount);
    }

    /**
     * Never fails on indices: the sentinel and anything outside the active set are skipped, and a missing
     * failure list counts as empty.
     */
    public void updateStatistics(Address caller, long proposerIndex, List<Long> failedProposerIndices) {
        accessControl.requireCaller(caller, SystemRole.BLOCK);

        if (proposerIndex != NIL_PROPOSER_INDEX) {
            validIndex(proposerIndex).ifPresent(i -> performances.get(i).recordSuccess());
        }

        for (Long failedIndex : CollectionUtils.emptyIfNull(failedProposerIndices)) {
            if (failedIndex == null) {
                continue;
            }
            validIndex(failedIndex).ifPresent(i -> performances.get(i).recordFailure());
        }
    }

    public void onNewEpoch(Address caller, int activeValidatorCount) {
        accessControl.requireCaller(caller, SystemRole.RECONFIGURATION);
        performances = zeroed(activeValidatorCount);
        log.fine(String.format("Reset performance counters for %d validators", activeValidatorCount));
    }

    public Optional<ProposerPerformance> getPerformanceOf(int index) {
        if (index < 0 || index >= performances.size()) {
            return Optional.empty();
        }
        return Optional.of(performances.get(index).copy());
    }

    public List<ProposerPerformance> getAllPerformances() {
        return performances.stream()
                .map(ProposerPerformance::copy)
                .toList();
    }

    public int size() {
        return performances.size();
    }

    private Optional<Integer> validIndex(long index) {
        if (index < 0 || index >= performances.size()) {
            log.fine(String.format("Ignoring performance update for index %d, active set size %d",
                    index, performances.size()));
            return Optional.empty();
        }
        return Optional.of((int) index);
    }

    private static List<ProposerPerformance> zeroed(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Validator count must not be negative");
        }
        List<ProposerPerformance> counters = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            counters.add(new ProposerPerformance());
        }
        return counters;
    }
}
