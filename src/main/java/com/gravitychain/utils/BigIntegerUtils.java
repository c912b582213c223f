package com.gravitychain.utils;

import java.math.BigInteger;

public class BigIntegerUtils {

    private static final BigInteger ONE_HUNDRED = BigInteger.valueOf(100);

    private BigIntegerUtils() {
    }

    // Rounds down, so a limit never admits more than the configured share
    public static BigInteger percentOf(BigInteger amount, long percent) {
        return amount.multiply(BigInteger.valueOf(percent)).divide(ONE_HUNDRED);
    }
}
