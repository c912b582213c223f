package com.gravitychain.exception.reconfiguration;

public class ReconfigurationInProgressException extends RuntimeException {

    public ReconfigurationInProgressException(String message) {
        super(message);
    }
}
