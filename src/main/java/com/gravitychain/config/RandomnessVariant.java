package com.gravitychain.config;

public enum RandomnessVariant {
    OFF,
    V2
}
