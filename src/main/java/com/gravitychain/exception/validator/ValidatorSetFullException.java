package com.gravitychain.exception.validator;

public class ValidatorSetFullException extends ValidatorException {

    public ValidatorSetFullException(long maxValidatorSetSize) {
        super("Validator set is full, maximum size is " + maxValidatorSetSize);
    }
}
