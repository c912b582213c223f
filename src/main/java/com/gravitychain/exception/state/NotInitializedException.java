package com.gravitychain.exception.state;

public class NotInitializedException extends RuntimeException {

    public NotInitializedException(String component) {
        super(component + " is not initialized");
    }
}
