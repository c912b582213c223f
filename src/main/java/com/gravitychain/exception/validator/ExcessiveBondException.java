package com.gravitychain.exception.validator;

import java.math.BigInteger;

public class ExcessiveBondException extends ValidatorException {

    public ExcessiveBondException(BigInteger bond, BigInteger maximumBond) {
        super(String.format("Bond %s exceeds the maximum bond %s", bond, maximumBond));
    }
}
