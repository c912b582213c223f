package com.gravitychain.account;

import com.gravitychain.utils.HexUtils;
import lombok.EqualsAndHashCode;

import java.util.Arrays;

/**
 * A 20-byte account identity. Validators are identified by their stake pool address,
 * system components by the well-known addresses of their roles.
 */
@EqualsAndHashCode
public final class Address {

    public static final int LENGTH = 20;

    private final byte[] bytes;

    private Address(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                    String.format("Address must be %d bytes, got %d", LENGTH, bytes.length));
        }
        this.bytes = bytes;
    }

    public static Address wrap(byte[] bytes) {
        return new Address(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * Parses a hex address. Shorter inputs are left padded with zeros, so
     * {@code 0x1625F0000} resolves to the same address as its 40 character form.
     */
    public static Address fromHex(String hex) {
        String stripped = HexUtils.stripPrefix(hex);
        if (stripped.length() > LENGTH * 2) {
            throw new IllegalArgumentException("Address hex too long: " + hex);
        }
        return new Address(HexUtils.fromHex("0".repeat(LENGTH * 2 - stripped.length()) + stripped));
    }

    public byte[] getBytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public String toString() {
        return HexUtils.toHex(bytes);
    }
}
