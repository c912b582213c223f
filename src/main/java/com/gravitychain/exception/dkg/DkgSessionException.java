package com.gravitychain.exception.dkg;

public class DkgSessionException extends RuntimeException {

    public DkgSessionException(String message) {
        super(message);
    }
}
