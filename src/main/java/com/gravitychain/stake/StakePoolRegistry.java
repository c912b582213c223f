package com.gravitychain.stake;

import com.gravitychain.account.Address;

import java.math.BigInteger;

/**
 * Read view over stake pools. Deposits, withdrawals and lockups are handled by the staking module.
 */
public interface StakePoolRegistry {

    boolean exists(Address pool);

    /**
     * @throws com.gravitychain.exception.validator.StakePoolNotFoundException if the pool does not exist
     */
    BigInteger getBondedAmount(Address pool);

    /**
     * @throws com.gravitychain.exception.validator.StakePoolNotFoundException if the pool does not exist
     */
    Address getOperator(Address pool);

    Address getOwner(Address pool);
}
