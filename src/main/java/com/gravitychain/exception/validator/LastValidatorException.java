package com.gravitychain.exception.validator;

import com.gravitychain.account.Address;

public class LastValidatorException extends ValidatorException {

    public LastValidatorException(Address validator) {
        super("Cannot remove the last active validator " + validator);
    }
}
