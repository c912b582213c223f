package com.gravitychain.utils;

import lombok.experimental.UtilityClass;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.lang3.StringUtils;

@UtilityClass
public class HexUtils {

    private static final String PREFIX = "0x";

    public String toHex(byte[] bytes) {
        return PREFIX + Hex.encodeHexString(bytes);
    }

    /**
     * Accepts an optional {@code 0x} prefix and an odd number of digits.
     *
     * @throws IllegalArgumentException if the input holds a non-hex character
     */
    public byte[] fromHex(String hex) {
        String stripped = stripPrefix(hex);
        if (stripped.length() % 2 != 0) {
            stripped = "0" + stripped;
        }
        try {
            return Hex.decodeHex(stripped);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    public String stripPrefix(String hex) {
        if (StringUtils.isBlank(hex)) {
            return "";
        }
        return StringUtils.removeStartIgnoreCase(hex.trim(), PREFIX);
    }
}
