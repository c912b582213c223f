package com.gravitychain.access;

import lombok.Getter;

/**
 * The closed set of system caller roles, each with its well-known default address.
 * Validator operators are not listed here; they are checked against their stake pool.
 */
@Getter
public enum SystemRole {

    SYSTEM_CALLER("0x1625F0000"),
    GENESIS("0x1625F0001"),
    RECONFIGURATION("0x1625F2003"),
    BLOCK("0x1625F2004"),
    GOVERNANCE("0x1625F3000");

    private final String defaultAddress;

    SystemRole(String defaultAddress) {
        this.defaultAddress = defaultAddress;
    }
}
