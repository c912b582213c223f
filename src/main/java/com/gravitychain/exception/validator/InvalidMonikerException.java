package com.gravitychain.exception.validator;

public class InvalidMonikerException extends ValidatorException {

    public InvalidMonikerException(String message) {
        super(message);
    }
}
