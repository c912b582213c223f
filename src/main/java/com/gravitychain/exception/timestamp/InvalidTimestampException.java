package com.gravitychain.exception.timestamp;

public class InvalidTimestampException extends RuntimeException {

    public InvalidTimestampException(String message) {
        super(message);
    }
}
