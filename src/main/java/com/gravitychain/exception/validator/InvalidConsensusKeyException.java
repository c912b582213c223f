package com.gravitychain.exception.validator;

public class InvalidConsensusKeyException extends ValidatorException {

    public InvalidConsensusKeyException(String message) {
        super(message);
    }
}
