package com.gravitychain.exception.blocker;

public class InvalidProposerException extends RuntimeException {

    public InvalidProposerException(String message) {
        super(message);
    }
}
