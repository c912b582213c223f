package com.gravitychain.exception.validator;

import com.gravitychain.account.Address;

public class ValidatorAlreadyRegisteredException extends ValidatorException {

    public ValidatorAlreadyRegisteredException(Address validator) {
        super("Validator already registered: " + validator);
    }
}
