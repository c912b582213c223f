package com.gravitychain.dkg;

import com.gravitychain.account.Address;
import com.gravitychain.config.RandomnessConfigData;
import com.gravitychain.validator.dto.ValidatorConsensusInfo;

import java.util.List;
import java.util.Optional;

/**
 * Owns the lifecycle of the multi-block DKG protocol. At most one session is incomplete at any time.
 */
public interface DkgCoordinator {

    void start(Address caller,
               long dealerEpoch,
               RandomnessConfigData randomnessConfig,
               List<ValidatorConsensusInfo> dealers,
               List<ValidatorConsensusInfo> targets);

    void finish(Address caller, byte[] transcript);

    /**
     * Drops the incomplete session if there is one. Safe to call at any time.
     *
     * @return true if a session was discarded
     */
    boolean discardStale(Address caller);

    Optional<DkgSession> getIncompleteSession();

    Optional<DkgSession> getLastCompletedSession();

    default boolean isInProgress() {
        return getIncompleteSession().isPresent();
    }
}
