package com.gravitychain.exception.validator;

import com.gravitychain.account.Address;

public class ValidatorNotFoundException extends ValidatorException {

    public ValidatorNotFoundException(Address validator) {
        super("Validator not found: " + validator);
    }
}
