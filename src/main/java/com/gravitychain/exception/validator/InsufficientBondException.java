package com.gravitychain.exception.validator;

import java.math.BigInteger;

public class InsufficientBondException extends ValidatorException {

    public InsufficientBondException(BigInteger bond, BigInteger minimumBond) {
        super(String.format("Bond %s is below the minimum bond %s", bond, minimumBond));
    }
}
