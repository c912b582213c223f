package com.gravitychain.validator;

import com.gravitychain.account.Address;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The outcome of an epoch boundary recomputation. The position in {@code activeValidators} is the index.
 */
@Value
public class NextValidatorSet {

    List<Address> activeValidators;
    Map<Address, BigInteger> votingPowers;
    BigInteger totalVotingPower;
    Set<Address> activated;
    Set<Address> deactivated;
    Set<Address> deferred;

    public int size() {
        return activeValidators.size();
    }
}
