package com.gravitychain.validator;

public enum ValidatorStatus {
    INACTIVE,
    PENDING_ACTIVE,
    ACTIVE,
    PENDING_INACTIVE
}
