package com.gravitychain.validator;

import com.gravitychain.account.Address;
import com.gravitychain.performance.ProposerPerformance;
import com.gravitychain.validator.dto.ValidatorConsensusInfo;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * The view of validator set membership used by the epoch state machine and the block prologue.
 */
public interface ValidatorRegistry {

    /**
     * @return the active set as fixed at the last epoch boundary, ordered by index
     */
    List<ValidatorConsensusInfo> getCurrentConsensusInfos();

    /**
     * @return the set the next epoch boundary would produce if it happened now
     */
    List<ValidatorConsensusInfo> getNextConsensusInfos();

    void onNewEpoch(Address caller);

    /**
     * Moves underperforming active validators to PENDING_INACTIVE. A snapshot whose length differs from
     * the active set is ignored.
     *
     * @return the validators that were marked for removal
     */
    List<Address> evictUnderperformingValidators(Address caller, List<ProposerPerformance> snapshot);

    Optional<ValidatorConsensusInfo> getActiveValidatorAt(int index);

    int getActiveCount();

    BigInteger getTotalVotingPower();

    Optional<ValidatorStatus> getStatusOf(Address validator);
}
