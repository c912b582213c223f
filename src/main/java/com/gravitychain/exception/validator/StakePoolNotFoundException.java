package com.gravitychain.exception.validator;

import com.gravitychain.account.Address;

public class StakePoolNotFoundException extends ValidatorException {

    public StakePoolNotFoundException(Address pool) {
        super("Stake pool not found: " + pool);
    }
}
