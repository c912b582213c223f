package com.gravitychain.exception.reconfiguration;

public class ReconfigurationNotInProgressException extends RuntimeException {

    public ReconfigurationNotInProgressException(String message) {
        super(message);
    }
}
