package com.gravitychain.exception.validator;

import com.gravitychain.account.Address;
import com.gravitychain.validator.ValidatorStatus;

import java.util.Set;

public class InvalidValidatorStatusException extends ValidatorException {

    public InvalidValidatorStatusException(Address validator, ValidatorStatus actual, Set<ValidatorStatus> expected) {
        super(String.format("Validator %s has status %s, expected one of %s", validator, actual, expected));
    }
}
