package com.gravitychain.exception.state;

public class AlreadyInitializedException extends RuntimeException {

    public AlreadyInitializedException(String component) {
        super(component + " is already initialized");
    }
}
