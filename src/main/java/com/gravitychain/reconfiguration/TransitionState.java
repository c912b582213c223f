package com.gravitychain.reconfiguration;

public enum TransitionState {
    IDLE,
    DKG_IN_PROGRESS
}
