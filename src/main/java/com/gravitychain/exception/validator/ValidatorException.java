package com.gravitychain.exception.validator;

/**
 * Base of the validator lifecycle failures. Every subtype aborts the call before any state changes.
 */
public class ValidatorException extends RuntimeException {

    public ValidatorException(String message) {
        super(message);
    }
}
