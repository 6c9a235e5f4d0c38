package com.bank.payout.support;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion between decimal amounts and the integer units kept by the limit ledger.
 */
public final class MinorUnits {

    public static final int SCALE = 8;

    // Largest single amount or limit accepted. Keeps window sums far below Long.MAX_VALUE minor units.
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("1000000000");

    private MinorUnits() {}

    /**
     * @throws ArithmeticException if the amount has more than {@link #SCALE} decimals
     */
    public static long toMinor(BigDecimal amount) {
        return amount.movePointRight(SCALE).setScale(0, RoundingMode.UNNECESSARY).longValueExact();
    }

    public static boolean fits(BigDecimal amount) {
        return amount.compareTo(MAX_AMOUNT) <= 0 && amount.stripTrailingZeros().scale() <= SCALE;
    }

    public static BigDecimal fromMinor(long minor) {
        return BigDecimal.valueOf(minor, SCALE);
    }
}
