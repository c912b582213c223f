package com.gravitychain.exception.validator;

public class ValidatorSetChangeDisabledException extends ValidatorException {

    public ValidatorSetChangeDisabledException() {
        super("Validator set changes are disabled");
    }
}
