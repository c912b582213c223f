package com.gravitychain.stake;

import com.gravitychain.account.Address;
import com.gravitychain.exception.validator.StakePoolNotFoundException;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

@Log
@Component
public class InMemoryStakePoolRegistry implements StakePoolRegistry {

    private final Map<Address, StakePool> pools = new HashMap<>();

    public StakePool createPool(Address pool, Address owner, Address operator, BigInteger bondedAmount) {
        if (pools.containsKey(pool)) {
            throw new IllegalArgumentException("Stake pool already exists: " + pool);
        }
        if (bondedAmount.signum() < 0) {
            throw new IllegalArgumentException("Bonded amount must not be negative");
        }

        StakePool stakePool = new StakePool(pool, owner, operator, bondedAmount);
        pools.put(pool, stakePool);
        log.fine(String.format("Created stake pool %s with %s bonded", pool, bondedAmount));
        return stakePool;
    }

    public void setBondedAmount(Address pool, BigInteger bondedAmount) {
        getPool(pool).setBondedAmount(bondedAmount);
    }

    @Override
    public boolean exists(Address pool) {
        return pools.containsKey(pool);
    }

    @Override
    public BigInteger getBondedAmount(Address pool) {
        return getPool(pool).getBondedAmount();
    }

    @Override
    public Address getOperator(Address pool) {
        return getPool(pool).getOperator();
    }

    @Override
    public Address getOwner(Address pool) {
        return getPool(pool).getOwner();
    }

    private StakePool getPool(Address pool) {
        StakePool stakePool = pools.get(pool);
        if (stakePool == null) {
            throw new StakePoolNotFoundException(pool);
        }
        return stakePool;
    }
}
